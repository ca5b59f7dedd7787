package construction.scalar;

import java.util.Objects;

/**
 * Normalized binary product. Either a numeric coefficient times a monomial, or a monomial times a
 * further variable factor.
 */
public final class MultipliedScalar extends Scalar {
  private final Scalar first;
  private final Scalar second;

  MultipliedScalar(Scalar first, Scalar second) {
    this.first = Objects.requireNonNull(first, "first");
    this.second = Objects.requireNonNull(second, "second");
  }

  public Scalar first() {
    return first;
  }

  public Scalar second() {
    return second;
  }

  @Override
  public Kind kind() {
    return Kind.MULTIPLIED;
  }

  @Override
  public boolean hasVariables() {
    return true;
  }

  @Override
  public double toDouble() {
    throw new IllegalStateException("Scalar " + this + " has unresolved variables");
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof MultipliedScalar other
        && first.equals(other.first)
        && second.equals(other.second);
  }

  @Override
  public int hashCode() {
    return Objects.hash(first, second);
  }

  @Override
  public String toString() {
    if (first instanceof Fraction c && c.equals(Fraction.MINUS_ONE)) {
      return "-" + second;
    }
    return first + " * " + second;
  }
}
