package construction.scalar;

import com.google.common.math.LongMath;
import java.util.Objects;

/**
 * Exact rational number. The stored numerator/denominator are kept as given (with a positive
 * denominator); arithmetic results are reduced and equality compares by cross-multiplication.
 * Overflow of the 64-bit representation raises {@link ArithmeticException}.
 */
public final class Fraction extends Scalar {
  public static final Fraction ZERO = new Fraction(0, 1);
  public static final Fraction ONE = new Fraction(1, 1);
  public static final Fraction MINUS_ONE = new Fraction(-1, 1);

  private final long numerator;
  private final long denominator;

  private Fraction(long numerator, long denominator) {
    this.numerator = numerator;
    this.denominator = denominator;
  }

  public static Fraction of(long value) {
    return new Fraction(value, 1);
  }

  public static Fraction of(long numerator, long denominator) {
    if (denominator == 0) {
      throw new ArithmeticException("Zero denominator");
    }
    if (denominator < 0) {
      return new Fraction(
          LongMath.checkedMultiply(numerator, -1), LongMath.checkedMultiply(denominator, -1));
    }
    return new Fraction(numerator, denominator);
  }

  static Fraction reducedOf(long numerator, long denominator) {
    return of(numerator, denominator).reduced();
  }

  public long numerator() {
    return numerator;
  }

  public long denominator() {
    return denominator;
  }

  public Fraction reduced() {
    long g = LongMath.gcd(Math.abs(numerator), denominator);
    if (g <= 1) {
      return this;
    }
    return new Fraction(numerator / g, denominator / g);
  }

  public boolean isZero() {
    return numerator == 0;
  }

  public boolean isOne() {
    return numerator == denominator;
  }

  public boolean isInteger() {
    return numerator % denominator == 0;
  }

  public int signum() {
    return Long.signum(numerator);
  }

  public Fraction plus(Fraction other) {
    long n =
        LongMath.checkedAdd(
            LongMath.checkedMultiply(numerator, other.denominator),
            LongMath.checkedMultiply(other.numerator, denominator));
    return reducedOf(n, LongMath.checkedMultiply(denominator, other.denominator));
  }

  public Fraction minus(Fraction other) {
    return plus(other.negated());
  }

  public Fraction times(Fraction other) {
    Fraction a = reduced();
    Fraction b = other.reduced();
    return reducedOf(
        LongMath.checkedMultiply(a.numerator, b.numerator),
        LongMath.checkedMultiply(a.denominator, b.denominator));
  }

  public Fraction dividedBy(Fraction other) {
    if (other.isZero()) {
      throw new ArithmeticException("Division by zero");
    }
    return times(of(other.denominator, other.numerator));
  }

  public Fraction negated() {
    return new Fraction(LongMath.checkedMultiply(numerator, -1), denominator);
  }

  public Fraction abs() {
    return numerator < 0 ? negated() : this;
  }

  public int compareTo(Fraction other) {
    return Long.compare(
        LongMath.checkedMultiply(numerator, other.denominator),
        LongMath.checkedMultiply(other.numerator, denominator));
  }

  @Override
  public Kind kind() {
    return Kind.FRACTION;
  }

  @Override
  public boolean hasVariables() {
    return false;
  }

  @Override
  public double toDouble() {
    return (double) numerator / denominator;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Fraction other)) {
      return false;
    }
    return compareTo(other) == 0;
  }

  @Override
  public int hashCode() {
    Fraction r = reduced();
    return Objects.hash(r.numerator, r.denominator);
  }

  @Override
  public String toString() {
    if (numerator == 0) {
      return "0";
    }
    Fraction r = reduced();
    return r.denominator == 1 ? Long.toString(r.numerator) : r.numerator + "/" + r.denominator;
  }
}
