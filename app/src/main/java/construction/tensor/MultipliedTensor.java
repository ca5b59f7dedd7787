package construction.tensor;

import construction.index.Index;
import construction.index.IndexAssignments;
import construction.index.IndexList;
import construction.scalar.Scalar;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Product of two tensors. Indices forming a contraction pair (same index, opposite covariance)
 * are summed over; every other index stays free.
 */
public final class MultipliedTensor extends TensorNode {
  private final TensorNode first;
  private final TensorNode second;

  public MultipliedTensor(TensorNode first, TensorNode second) {
    super(first.indices().contract(second.indices()));
    this.first = first;
    this.second = second;
  }

  public TensorNode first() {
    return first;
  }

  public TensorNode second() {
    return second;
  }

  /** Indices summed over, one entry per contraction pair. */
  public IndexList contracted() {
    return first.indices().append(second.indices()).contractions();
  }

  @Override
  public Kind kind() {
    return Kind.MULTIPLICATION;
  }

  /**
   * Holds the free indices at {@code args} and sums the product of both factors over every value
   * of the contracted indices.
   *
   * @throws CannotContractTensorsException if one index name is used with two different ranges
   * @throws CannotMultiplyTensorsException if an index repeats without forming a contraction pair
   */
  @Override
  protected Scalar evaluateAt(int[] args) {
    IndexList all = first.indices().append(second.indices());
    if (all.hasRangeConflicts()) {
      throw new CannotContractTensorsException(
          "Index ranges of " + first.indices() + " and " + second.indices() + " do not match");
    }
    IndexList contracted = all.contractions();
    checkSlots(contracted);

    IndexAssignments free = IndexAssignments.of(indices(), args);
    Scalar result = Scalar.zero();
    for (int[] values : contracted.allIndexCombinations()) {
      IndexAssignments assignment = free.copy();
      for (int i = 0; i < values.length; i++) {
        assignment.put(contracted.get(i), values[i]);
      }
      Scalar left = first.evaluate(assignment);
      if (left.isZero()) {
        continue;
      }
      result = result.add(left.multiply(second.evaluate(assignment)));
    }
    return result;
  }

  private void checkSlots(IndexList contracted) {
    Set<String> seen = new HashSet<>();
    for (Index index : indices()) {
      if (!seen.add(index.name())) {
        throw new CannotMultiplyTensorsException(
            "Index " + index.name() + " repeats in " + first + " times " + second);
      }
    }
    for (Index index : contracted) {
      if (!seen.add(index.name())) {
        throw new CannotMultiplyTensorsException(
            "Index " + index.name() + " is contracted more than once in " + this);
      }
    }
  }

  @Override
  public TensorNode withIndices(IndexList newIndices) {
    checkArity(newIndices);
    Map<Index, Index> mapping = indices().mappingTo(newIndices);
    Map<Index, Index> internal = internalRenames(newIndices);
    TensorNode left = relabel(first, mapping, internal);
    TensorNode right = relabel(second, mapping, internal);
    return inherit(new MultipliedTensor(left, right));
  }

  private static TensorNode relabel(
      TensorNode factor, Map<Index, Index> mapping, Map<Index, Index> internal) {
    IndexList relabeled = factor.indices().rename(internal).shuffle(mapping);
    return factor.withIndices(relabeled);
  }

  /** Fresh names for contracted indices that would collide with the new free indices. */
  private Map<Index, Index> internalRenames(IndexList newIndices) {
    Map<Index, Index> renames = new HashMap<>();
    IndexList contracted = contracted();
    if (contracted.isEmpty()) {
      return renames;
    }
    Set<String> newNames = names(newIndices);
    Set<String> freeNames = names(indices());
    Set<String> taken = new HashSet<>(newNames);
    taken.addAll(freeNames);
    taken.addAll(names(contracted));
    for (Index index : contracted) {
      if (newNames.contains(index.name()) && !freeNames.contains(index.name())) {
        Index fresh = Index.freshLike(index, taken);
        taken.add(fresh.name());
        renames.put(index, fresh);
      }
    }
    return renames;
  }

  private static Set<String> names(IndexList indices) {
    Set<String> names = new HashSet<>();
    for (Index index : indices) {
      names.add(index.name());
    }
    return names;
  }

  @Override
  protected boolean sameContent(TensorNode other) {
    MultipliedTensor product = (MultipliedTensor) other;
    return first.equals(product.first) && second.equals(product.second);
  }

  @Override
  public int hashCode() {
    return Objects.hash(first, second);
  }

  @Override
  public String toString() {
    return factorString(first) + factorString(second);
  }

  private static String factorString(TensorNode factor) {
    return factor.isAdded() ? "(" + factor + ")" : factor.toString();
  }
}
