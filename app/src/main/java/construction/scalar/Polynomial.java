package construction.scalar;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Working form of a scalar: rational coefficients keyed by monomials. Every arithmetic operation on
 * {@link Scalar} goes through this form and back, which keeps the expression trees normalized.
 */
final class Polynomial {
  private final TreeMap<Monomial, Fraction> terms = new TreeMap<>();

  private Polynomial() {}

  static Polynomial of(Scalar scalar) {
    Polynomial result = new Polynomial();
    switch (scalar.kind()) {
      case FRACTION -> result.addTerm(Monomial.CONSTANT, (Fraction) scalar);
      case VARIABLE -> result.addTerm(Monomial.of((Variable) scalar), Fraction.ONE);
      case ADDED -> {
        for (Scalar term : ((AddedScalar) scalar).terms()) {
          result.addAll(of(term));
        }
      }
      case MULTIPLIED -> {
        MultipliedScalar product = (MultipliedScalar) scalar;
        return of(product.first()).times(of(product.second()));
      }
      default -> throw new IllegalStateException("Unknown scalar kind " + scalar.kind());
    }
    return result;
  }

  private void addTerm(Monomial monomial, Fraction coefficient) {
    Fraction sum = terms.getOrDefault(monomial, Fraction.ZERO).plus(coefficient);
    if (sum.isZero()) {
      terms.remove(monomial);
    } else {
      terms.put(monomial, sum);
    }
  }

  private void addAll(Polynomial other) {
    for (Map.Entry<Monomial, Fraction> entry : other.terms.entrySet()) {
      addTerm(entry.getKey(), entry.getValue());
    }
  }

  Polynomial plus(Polynomial other) {
    Polynomial result = new Polynomial();
    result.addAll(this);
    result.addAll(other);
    return result;
  }

  Polynomial times(Polynomial other) {
    Polynomial result = new Polynomial();
    for (Map.Entry<Monomial, Fraction> left : terms.entrySet()) {
      for (Map.Entry<Monomial, Fraction> right : other.terms.entrySet()) {
        result.addTerm(
            left.getKey().times(right.getKey()), left.getValue().times(right.getValue()));
      }
    }
    return result;
  }

  Polynomial scaled(Fraction factor) {
    Polynomial result = new Polynomial();
    if (factor.isZero()) {
      return result;
    }
    for (Map.Entry<Monomial, Fraction> entry : terms.entrySet()) {
      result.terms.put(entry.getKey(), entry.getValue().times(factor));
    }
    return result;
  }

  /** Replaces every occurrence of {@code variable} by {@code replacement}. */
  Polynomial substitute(Variable variable, Polynomial replacement) {
    Polynomial result = new Polynomial();
    for (Map.Entry<Monomial, Fraction> entry : terms.entrySet()) {
      Polynomial term = new Polynomial();
      term.addTerm(Monomial.CONSTANT, entry.getValue());
      for (Variable factor : entry.getKey().factors()) {
        if (factor.equals(variable)) {
          term = term.times(replacement);
        } else {
          Polynomial single = new Polynomial();
          single.addTerm(Monomial.of(factor), Fraction.ONE);
          term = term.times(single);
        }
      }
      result.addAll(term);
    }
    return result;
  }

  Map<Monomial, Fraction> terms() {
    return terms;
  }

  Fraction constant() {
    return terms.getOrDefault(Monomial.CONSTANT, Fraction.ZERO);
  }

  /** Normalized tree: variable terms by ascending monomial, the constant last. */
  Scalar toScalar() {
    if (terms.isEmpty()) {
      return Fraction.ZERO;
    }
    List<Scalar> summands = new ArrayList<>(terms.size());
    for (Map.Entry<Monomial, Fraction> entry : terms.entrySet()) {
      if (!entry.getKey().isConstant()) {
        summands.add(term(entry.getKey(), entry.getValue()));
      }
    }
    Fraction constant = constant();
    if (!constant.isZero()) {
      summands.add(constant.reduced());
    }
    return summands.size() == 1 ? summands.get(0) : new AddedScalar(summands);
  }

  static Scalar term(Monomial monomial, Fraction coefficient) {
    if (monomial.isConstant()) {
      return coefficient.reduced();
    }
    Scalar product = monomial.toScalar();
    return coefficient.isOne() ? product : new MultipliedScalar(coefficient.reduced(), product);
  }

  /** Sorted product of variables; the empty product is the constant monomial. */
  record Monomial(List<Variable> factors) implements Comparable<Monomial> {
    static final Monomial CONSTANT = new Monomial(List.of());

    Monomial {
      factors = List.copyOf(factors);
    }

    static Monomial of(Variable variable) {
      return new Monomial(List.of(variable));
    }

    boolean isConstant() {
      return factors.isEmpty();
    }

    int degree() {
      return factors.size();
    }

    Monomial times(Monomial other) {
      List<Variable> merged = new ArrayList<>(factors);
      merged.addAll(other.factors);
      merged.sort(Variable::compareVariable);
      return new Monomial(merged);
    }

    Scalar toScalar() {
      Scalar result = factors.get(0);
      for (int i = 1; i < factors.size(); i++) {
        result = new MultipliedScalar(result, factors.get(i));
      }
      return result;
    }

    @Override
    public int compareTo(Monomial other) {
      int cmp = Integer.compare(degree(), other.degree());
      if (cmp != 0) {
        return cmp;
      }
      for (int i = 0; i < factors.size(); i++) {
        cmp = factors.get(i).compareVariable(other.factors.get(i));
        if (cmp != 0) {
          return cmp;
        }
      }
      return 0;
    }
  }
}
