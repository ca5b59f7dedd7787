package construction.scalar;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Coefficient of a tensor term: an exact rational, a named variable, or a normalized sum/product
 * of those.
 *
 * <p>Arithmetic always yields a normalized tree (like terms merged, numeric factors folded into a
 * single leading coefficient, numeric constant of a sum placed last), so two scalars compare equal
 * iff their trees are structurally equal.
 */
public abstract class Scalar implements Comparable<Scalar> {

  /** Node kinds, with the tag written by the binary codec. */
  public enum Kind {
    FRACTION(1),
    VARIABLE(2),
    ADDED(3),
    MULTIPLIED(4);

    private final int tag;

    Kind(int tag) {
      this.tag = tag;
    }

    public int tag() {
      return tag;
    }

    public static Kind fromTag(int tag) {
      for (Kind kind : values()) {
        if (kind.tag == tag) {
          return kind;
        }
      }
      return null;
    }
  }

  Scalar() {}

  public static Fraction zero() {
    return Fraction.ZERO;
  }

  public static Fraction one() {
    return Fraction.ONE;
  }

  public static Fraction of(long value) {
    return Fraction.of(value);
  }

  public static Fraction of(long numerator, long denominator) {
    return Fraction.of(numerator, denominator);
  }

  public static Variable variable(String name) {
    return new Variable(name, 0);
  }

  public static Variable variable(String name, int id) {
    return new Variable(name, id);
  }

  public abstract Kind kind();

  /** True if the scalar still contains unresolved variables. */
  public abstract boolean hasVariables();

  /**
   * Numeric value of a fully numeric scalar.
   *
   * @throws IllegalStateException if the scalar has variables
   */
  public abstract double toDouble();

  public boolean isNumeric() {
    return kind() == Kind.FRACTION;
  }

  public boolean isVariable() {
    return kind() == Kind.VARIABLE;
  }

  public boolean isAdded() {
    return kind() == Kind.ADDED;
  }

  public boolean isMultiplied() {
    return kind() == Kind.MULTIPLIED;
  }

  /** True for the numeric zero only; a symbolic scalar is never considered zero. */
  public boolean isZero() {
    return this instanceof Fraction f && f.isZero();
  }

  public boolean isOne() {
    return this instanceof Fraction f && f.isOne();
  }

  /** The rational value of a numeric scalar. */
  public Fraction asFraction() {
    if (this instanceof Fraction f) {
      return f;
    }
    throw new IllegalStateException("Scalar " + this + " is not numeric");
  }

  public Scalar add(Scalar other) {
    if (this instanceof Fraction a && other instanceof Fraction b) {
      return a.plus(b);
    }
    return Polynomial.of(this).plus(Polynomial.of(other)).toScalar();
  }

  public Scalar subtract(Scalar other) {
    return add(other.negate());
  }

  public Scalar multiply(Scalar other) {
    if (this instanceof Fraction a && other instanceof Fraction b) {
      return a.times(b);
    }
    return Polynomial.of(this).times(Polynomial.of(other)).toScalar();
  }

  /**
   * Division by a numeric scalar.
   *
   * @throws IllegalArgumentException if {@code other} has variables
   */
  public Scalar divide(Scalar other) {
    if (!(other instanceof Fraction divisor)) {
      throw new IllegalArgumentException("Cannot divide by the symbolic scalar " + other);
    }
    if (this instanceof Fraction a) {
      return a.dividedBy(divisor);
    }
    return Polynomial.of(this).scaled(Fraction.ONE.dividedBy(divisor)).toScalar();
  }

  public Scalar negate() {
    if (this instanceof Fraction a) {
      return a.negated();
    }
    return Polynomial.of(this).scaled(Fraction.MINUS_ONE).toScalar();
  }

  /** The additive terms of the scalar; a non-sum is its own single term. */
  public List<Scalar> summands() {
    return List.of(this);
  }

  /** Replaces {@code variable} by {@code expression} everywhere. */
  public Scalar substitute(Variable variable, Scalar expression) {
    if (!hasVariables()) {
      return this;
    }
    return Polynomial.of(this).substitute(variable, Polynomial.of(expression)).toScalar();
  }

  /**
   * Splits the scalar into {@code (monomial, coefficient)} pairs for every non-constant term plus
   * the numeric remainder. The monomial of a linear term is a single {@link Variable}.
   */
  public VariableSplit separateVariablesFromRest() {
    Polynomial polynomial = Polynomial.of(this);
    List<VariableTerm> variables = new ArrayList<>();
    for (Map.Entry<Polynomial.Monomial, Fraction> entry : polynomial.terms().entrySet()) {
      if (!entry.getKey().isConstant()) {
        variables.add(
            new VariableTerm(
                entry.getKey().toScalar(), entry.getValue().reduced(), entry.getKey().degree()));
      }
    }
    return new VariableSplit(List.copyOf(variables), polynomial.constant().reduced());
  }

  /**
   * Numeric scalars order by value and precede symbolic ones; symbolic scalars order by their
   * printed form.
   */
  @Override
  public int compareTo(Scalar other) {
    if (this instanceof Fraction a && other instanceof Fraction b) {
      return a.compareTo(b);
    }
    if (isNumeric() != other.isNumeric()) {
      return isNumeric() ? -1 : 1;
    }
    return toString().compareTo(other.toString());
  }

  /** One non-constant term of a split scalar. */
  public record VariableTerm(Scalar variable, Fraction coefficient, int degree) {
    public boolean isLinear() {
      return degree == 1;
    }
  }

  /** Result of {@link #separateVariablesFromRest()}. */
  public record VariableSplit(List<VariableTerm> variables, Fraction rest) {}
}
