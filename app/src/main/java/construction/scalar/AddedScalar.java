package construction.scalar;

import java.util.List;

/** Normalized sum of at least two terms; a numeric constant, if any, comes last. */
public final class AddedScalar extends Scalar {
  private final List<Scalar> terms;

  AddedScalar(List<Scalar> terms) {
    this.terms = List.copyOf(terms);
  }

  public List<Scalar> terms() {
    return terms;
  }

  @Override
  public Kind kind() {
    return Kind.ADDED;
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
  public List<Scalar> summands() {
    return terms;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof AddedScalar other && terms.equals(other.terms);
  }

  @Override
  public int hashCode() {
    return terms.hashCode();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(terms.get(0).toString());
    for (int i = 1; i < terms.size(); i++) {
      String term = terms.get(i).toString();
      if (term.startsWith("-")) {
        sb.append(" - ").append(term.substring(1));
      } else {
        sb.append(" + ").append(term);
      }
    }
    return sb.toString();
  }
}
