package construction.index;

import com.google.common.base.Preconditions;

/** Inclusive range {@code [from, to]} of concrete values an index may take. */
public record Range(int from, int to) {

  public Range {
    Preconditions.checkArgument(from <= to, "Empty range [%s, %s]", from, to);
  }

  public static Range of(int from, int to) {
    return new Range(from, to);
  }

  public int size() {
    return to - from + 1;
  }

  public boolean contains(int value) {
    return value >= from && value <= to;
  }

  @Override
  public String toString() {
    return "[" + from + "," + to + "]";
  }
}
