package construction.index;

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Bijection over slot positions. Applying the permutation to a list places the element at
 * position {@code image[i]} of the source into slot {@code i} of the result.
 */
public final class Permutation {
  private final int[] image;

  private Permutation(int[] image) {
    this.image = image;
  }

  public static Permutation identity(int size) {
    int[] image = new int[size];
    for (int i = 0; i < size; i++) {
      image[i] = i;
    }
    return new Permutation(image);
  }

  public static Permutation of(int... image) {
    boolean[] seen = new boolean[image.length];
    for (int target : image) {
      Preconditions.checkArgument(
          target >= 0 && target < image.length && !seen[target],
          "Not a permutation: %s",
          Arrays.toString(image));
      seen[target] = true;
    }
    return new Permutation(image.clone());
  }

  /**
   * The permutation mapping {@code from} onto {@code to}. Repeated indices (contraction pairs) are
   * matched in order of appearance.
   */
  public static Permutation from(IndexList from, IndexList to) {
    Preconditions.checkArgument(
        from.isPermutationOf(to), "%s is not a permutation of %s", to, from);
    boolean[] used = new boolean[from.size()];
    int[] image = new int[to.size()];
    for (int i = 0; i < to.size(); i++) {
      Index wanted = to.get(i);
      for (int j = 0; j < from.size(); j++) {
        if (!used[j] && from.get(j).equals(wanted)) {
          used[j] = true;
          image[i] = j;
          break;
        }
      }
    }
    return new Permutation(image);
  }

  public int size() {
    return image.length;
  }

  public int get(int slot) {
    return image[slot];
  }

  public IndexList apply(IndexList indices) {
    Preconditions.checkArgument(
        indices.size() == image.length,
        "Permutation of size %s applied to %s indices",
        image.length,
        indices.size());
    List<Index> result = new ArrayList<>(image.length);
    for (int target : image) {
      result.add(indices.get(target));
    }
    return IndexList.of(result);
  }

  /** +1 for even permutations, -1 for odd ones, from the cycle decomposition. */
  public int sign() {
    boolean[] visited = new boolean[image.length];
    int transpositions = 0;
    for (int start = 0; start < image.length; start++) {
      if (visited[start]) {
        continue;
      }
      int length = 0;
      int current = start;
      while (!visited[current]) {
        visited[current] = true;
        current = image[current];
        length++;
      }
      transpositions += length - 1;
    }
    return transpositions % 2 == 0 ? 1 : -1;
  }

  public Permutation inverse() {
    int[] inverse = new int[image.length];
    for (int i = 0; i < image.length; i++) {
      inverse[image[i]] = i;
    }
    return new Permutation(inverse);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Permutation other && Arrays.equals(image, other.image);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(image);
  }

  @Override
  public String toString() {
    return "Permutation" + Arrays.toString(image);
  }
}
