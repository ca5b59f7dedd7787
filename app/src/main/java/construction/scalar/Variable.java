package construction.scalar;

import java.util.Objects;

/** A named symbolic unknown, optionally numbered ({@code e_3}). */
public final class Variable extends Scalar {
  private final String name;
  private final int id;

  Variable(String name, int id) {
    this.name = Objects.requireNonNull(name, "name");
    this.id = id;
  }

  public String name() {
    return name;
  }

  /** Sequence number, {@code 0} when the variable is not numbered. */
  public int id() {
    return id;
  }

  int compareVariable(Variable other) {
    int cmp = name.compareTo(other.name);
    return cmp != 0 ? cmp : Integer.compare(id, other.id);
  }

  @Override
  public Kind kind() {
    return Kind.VARIABLE;
  }

  @Override
  public boolean hasVariables() {
    return true;
  }

  @Override
  public double toDouble() {
    throw new IllegalStateException("Variable " + this + " has no numeric value");
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Variable other && name.equals(other.name) && id == other.id;
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, id);
  }

  @Override
  public String toString() {
    return id > 0 ? name + "_" + id : name;
  }
}
