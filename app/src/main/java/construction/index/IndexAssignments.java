package construction.index;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Concrete values assigned to indices by name. Sums and products route their arguments through an
 * assignment so that children with differently ordered index lists receive the right values.
 */
public final class IndexAssignments {
  private final Map<String, Integer> values = new LinkedHashMap<>();

  public IndexAssignments() {}

  /** Assignment binding the slots of {@code indices} to {@code args}, position by position. */
  public static IndexAssignments of(IndexList indices, int[] args) {
    if (args.length != indices.size()) {
      throw new IncompleteIndexAssignmentException(
          "Expected " + indices.size() + " index values, got " + args.length);
    }
    IndexAssignments assignment = new IndexAssignments();
    for (int i = 0; i < args.length; i++) {
      assignment.put(indices.get(i), args[i]);
    }
    return assignment;
  }

  public IndexAssignments put(Index index, int value) {
    values.put(index.name(), value);
    return this;
  }

  public IndexAssignments copy() {
    IndexAssignments copy = new IndexAssignments();
    copy.values.putAll(values);
    return copy;
  }

  public boolean contains(Index index) {
    return values.containsKey(index.name());
  }

  public int valueOf(Index index) {
    Integer value = values.get(index.name());
    if (value == null) {
      throw new IncompleteIndexAssignmentException("No value assigned to index " + index.name());
    }
    return value;
  }

  /** The values of {@code indices} in slot order. */
  public int[] apply(IndexList indices) {
    int[] result = new int[indices.size()];
    for (int i = 0; i < result.length; i++) {
      result[i] = valueOf(indices.get(i));
    }
    return result;
  }

  @Override
  public String toString() {
    return values.toString();
  }
}
