package construction.symmetry;

import com.google.common.base.Preconditions;
import construction.index.Index;
import construction.index.IndexList;
import java.util.ArrayList;
import java.util.List;

/** Index lists reachable by permuting a chosen subset of a tensor's indices among their slots. */
final class IndexOrbit {

  private IndexOrbit() {}

  /**
   * Every arrangement of {@code permuted} over the slots they occupy in {@code indices}; all
   * other slots keep their index. The orbit has {@code permuted.size()!} members.
   */
  static List<IndexList> of(IndexList indices, IndexList permuted) {
    List<Integer> positions = new ArrayList<>(permuted.size());
    for (Index index : permuted) {
      int position = indices.indexOf(index);
      Preconditions.checkArgument(position >= 0, "Index %s does not occur in %s", index, indices);
      positions.add(position);
    }
    List<IndexList> orbit = new ArrayList<>();
    fill(indices, positions, 0, new ArrayList<>(), new boolean[indices.size()], orbit);
    return orbit;
  }

  private static void fill(
      IndexList indices,
      List<Integer> positions,
      int slot,
      List<Index> used,
      boolean[] taken,
      List<IndexList> orbit) {
    if (slot == indices.size()) {
      orbit.add(IndexList.of(used));
      return;
    }
    if (!positions.contains(slot)) {
      used.add(indices.get(slot));
      fill(indices, positions, slot + 1, used, taken, orbit);
      used.remove(used.size() - 1);
      return;
    }
    for (int position : positions) {
      if (taken[position]) {
        continue;
      }
      taken[position] = true;
      used.add(indices.get(position));
      fill(indices, positions, slot + 1, used, taken, orbit);
      used.remove(used.size() - 1);
      taken[position] = false;
    }
  }
}
