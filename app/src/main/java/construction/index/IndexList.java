package construction.index;

import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Ordered, immutable sequence of indices. The order defines the slot order of the tensor carrying
 * the list.
 */
public final class IndexList implements Iterable<Index> {
  private static final IndexList EMPTY = new IndexList(List.of());
  private static final Splitter NAME_SPLITTER =
      Splitter.on(CharMatcher.whitespace().or(CharMatcher.is(',')))
          .omitEmptyStrings()
          .trimResults();

  private final List<Index> indices;

  private IndexList(List<Index> indices) {
    this.indices = indices;
  }

  public static IndexList empty() {
    return EMPTY;
  }

  public static IndexList of(Index... indices) {
    return of(Arrays.asList(indices));
  }

  public static IndexList of(List<Index> indices) {
    if (indices.isEmpty()) {
      return EMPTY;
    }
    return new IndexList(List.copyOf(indices));
  }

  /** Parses whitespace or comma separated index names, e.g. {@code "a b c"}, over one range. */
  public static IndexList parse(String names, Range range) {
    List<Index> result = new ArrayList<>();
    for (String name : NAME_SPLITTER.split(names)) {
      result.add(Index.of(name, range));
    }
    return of(result);
  }

  /** {@code n} Roman indices a, b, c, ... starting {@code offset} letters into the alphabet. */
  public static IndexList romanSeries(int n, Range range, int offset) {
    Preconditions.checkArgument(n + offset <= 26, "Not enough Roman letters for %s indices", n);
    List<Index> result = new ArrayList<>(n);
    for (int i = 0; i < n; i++) {
      result.add(Index.of(String.valueOf((char) ('a' + offset + i)), range));
    }
    return of(result);
  }

  public static IndexList romanSeries(int n, Range range) {
    return romanSeries(n, range, 0);
  }

  /** {@code n} Greek indices \mu, \nu, \rho, ... starting {@code offset} letters in. */
  public static IndexList greekSeries(int n, Range range, int offset) {
    Preconditions.checkArgument(
        n + offset <= Index.GREEK.size(), "Not enough Greek letters for %s indices", n);
    List<Index> result = new ArrayList<>(n);
    for (int i = 0; i < n; i++) {
      result.add(Index.of(Index.GREEK.get(offset + i), range));
    }
    return of(result);
  }

  public static IndexList greekSeries(int n, Range range) {
    return greekSeries(n, range, 0);
  }

  public int size() {
    return indices.size();
  }

  public boolean isEmpty() {
    return indices.isEmpty();
  }

  public Index get(int position) {
    return indices.get(position);
  }

  public int indexOf(Index index) {
    return indices.indexOf(index);
  }

  public boolean contains(Index index) {
    return indices.contains(index);
  }

  public List<Index> asList() {
    return indices;
  }

  public Stream<Index> stream() {
    return indices.stream();
  }

  @Override
  public Iterator<Index> iterator() {
    return indices.iterator();
  }

  /** True if both lists hold the same indices, possibly in a different order. */
  public boolean isPermutationOf(IndexList other) {
    if (other.size() != size()) {
      return false;
    }
    List<Index> left = new ArrayList<>(indices);
    List<Index> right = new ArrayList<>(other.indices);
    Collections.sort(left);
    Collections.sort(right);
    return left.equals(right);
  }

  /** The list sorted by the indices' ordering key. */
  public IndexList ordered() {
    List<Index> sorted = new ArrayList<>(indices);
    Collections.sort(sorted);
    return new IndexList(List.copyOf(sorted));
  }

  /** Sublist of the inclusive slot range {@code [from, to]}. */
  public IndexList partial(int from, int to) {
    return of(indices.subList(from, to + 1));
  }

  public IndexList append(IndexList other) {
    List<Index> result = new ArrayList<>(indices.size() + other.size());
    result.addAll(indices);
    result.addAll(other.indices);
    return of(result);
  }

  public IndexList with(Index index) {
    List<Index> result = new ArrayList<>(indices);
    result.add(index);
    return of(result);
  }

  public IndexList without(int position) {
    List<Index> result = new ArrayList<>(indices);
    result.remove(position);
    return of(result);
  }

  public IndexList replace(int position, Index index) {
    List<Index> result = new ArrayList<>(indices);
    result.set(position, index);
    return of(result);
  }

  /** Replaces every index that is a key of {@code mapping} by its image. */
  public IndexList shuffle(Map<Index, Index> mapping) {
    List<Index> result = new ArrayList<>(indices.size());
    for (Index index : indices) {
      result.add(mapping.getOrDefault(index, index));
    }
    return of(result);
  }

  /**
   * Renames every index that is a key of {@code mapping} to its image, keeping the covariance of
   * the slot.
   */
  public IndexList rename(Map<Index, Index> mapping) {
    List<Index> result = new ArrayList<>(indices.size());
    for (Index index : indices) {
      Index target = mapping.get(index);
      result.add(target == null ? index : target.withContravariant(index.isContravariant()));
    }
    return of(result);
  }

  /** Slot-wise mapping from this list onto {@code target}. */
  public Map<Index, Index> mappingTo(IndexList target) {
    Preconditions.checkArgument(
        target.size() == size(), "Cannot map %s indices onto %s", size(), target.size());
    Map<Index, Index> mapping = new LinkedHashMap<>();
    for (int i = 0; i < indices.size(); i++) {
      mapping.put(indices.get(i), target.get(i));
    }
    return mapping;
  }

  /**
   * The free indices of the product of a tensor carrying this list with one carrying {@code
   * other}: indices forming a contraction pair (same index, opposite covariance) are dropped, all
   * others survive left to right.
   */
  public IndexList contract(IndexList other) {
    return append(other).withoutContractions();
  }

  /** This list with every contraction pair removed. */
  public IndexList withoutContractions() {
    boolean[] paired = pairedSlots();
    List<Index> result = new ArrayList<>();
    for (int i = 0; i < indices.size(); i++) {
      if (!paired[i]) {
        result.add(indices.get(i));
      }
    }
    return of(result);
  }

  /** One entry per contraction pair, in order of the pair's first slot. */
  public IndexList contractions() {
    boolean[] paired = pairedSlots();
    List<Index> result = new ArrayList<>();
    boolean[] reported = new boolean[indices.size()];
    for (int i = 0; i < indices.size(); i++) {
      if (paired[i] && !reported[i]) {
        result.add(indices.get(i));
        for (int j = i + 1; j < indices.size(); j++) {
          if (paired[j] && !reported[j] && indices.get(j).contractsWith(indices.get(i))) {
            reported[j] = true;
            break;
          }
        }
        reported[i] = true;
      }
    }
    return of(result);
  }

  private boolean[] pairedSlots() {
    boolean[] paired = new boolean[indices.size()];
    for (int i = 0; i < indices.size(); i++) {
      if (paired[i]) {
        continue;
      }
      for (int j = i + 1; j < indices.size(); j++) {
        if (!paired[j] && indices.get(i).contractsWith(indices.get(j))) {
          paired[i] = true;
          paired[j] = true;
          break;
        }
      }
    }
    return paired;
  }

  /** True if some index occurs twice, i.e. the list describes a trace. */
  public boolean containsContractions() {
    for (int i = 0; i < indices.size(); i++) {
      for (int j = i + 1; j < indices.size(); j++) {
        if (indices.get(i).equals(indices.get(j))) {
          return true;
        }
      }
    }
    return false;
  }

  /** True if two slots share a name but differ in range. */
  public boolean hasRangeConflicts() {
    for (int i = 0; i < indices.size(); i++) {
      for (int j = i + 1; j < indices.size(); j++) {
        Index a = indices.get(i);
        Index b = indices.get(j);
        if (a.name().equals(b.name()) && !a.range().equals(b.range())) {
          return true;
        }
      }
    }
    return false;
  }

  public boolean allRangesEqual() {
    for (Index index : indices) {
      if (!index.range().equals(indices.get(0).range())) {
        return false;
      }
    }
    return true;
  }

  /** Number of concrete value assignments, i.e. the product of all ranges. */
  public long combinationCount() {
    long count = 1;
    for (Index index : indices) {
      count *= index.range().size();
    }
    return count;
  }

  /**
   * Every concrete value assignment respecting each index's range. The first slot varies slowest.
   * An empty list yields a single empty assignment.
   */
  public List<int[]> allIndexCombinations() {
    List<int[]> result = new ArrayList<>((int) Math.min(combinationCount(), Integer.MAX_VALUE));
    int[] current = new int[indices.size()];
    fill(0, current, result);
    return result;
  }

  private void fill(int slot, int[] current, List<int[]> result) {
    if (slot == indices.size()) {
      result.add(current.clone());
      return;
    }
    Range range = indices.get(slot).range();
    for (int value = range.from(); value <= range.to(); value++) {
      current[slot] = value;
      fill(slot + 1, current, result);
    }
  }

  public IndexList permuted(Permutation permutation) {
    return permutation.apply(this);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof IndexList other && indices.equals(other.indices);
  }

  @Override
  public int hashCode() {
    return indices.hashCode();
  }

  /** Prints {@code _{ab}^{c}}, grouping neighbouring slots of equal covariance. */
  @Override
  public String toString() {
    if (indices.isEmpty()) {
      return "";
    }
    StringBuilder sb = new StringBuilder();
    Boolean up = null;
    for (Index index : indices) {
      if (up == null || up != index.isContravariant()) {
        if (up != null) {
          sb.append('}');
        }
        up = index.isContravariant();
        sb.append(up ? "^{" : "_{");
      } else if (index.printable().startsWith("\\")) {
        sb.append(' ');
      }
      sb.append(index.printable());
    }
    return sb.append('}').toString();
  }
}
