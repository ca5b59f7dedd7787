package construction.tensor;

import construction.index.Index;
import construction.index.IndexAssignments;
import construction.index.IndexList;
import construction.scalar.Fraction;
import construction.scalar.Scalar;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Sum of tensors whose index lists are permutations of each other. The sum's own index list
 * fixes the argument order; summands receive their values by index name.
 */
public final class AddedTensor extends TensorNode {
  private final List<TensorNode> summands;

  public AddedTensor(List<TensorNode> summands, IndexList indices) {
    super(indices);
    this.summands = List.copyOf(summands);
  }

  public List<TensorNode> summands() {
    return summands;
  }

  public int size() {
    return summands.size();
  }

  @Override
  public Kind kind() {
    return Kind.ADDITION;
  }

  /**
   * @throws CannotAddTensorsException if a summand does not carry a permutation of the sum's
   *     indices
   */
  @Override
  protected Scalar evaluateAt(int[] args) {
    IndexAssignments assignment = IndexAssignments.of(indices(), args);
    Scalar result = Scalar.zero();
    for (TensorNode summand : summands) {
      if (!summand.indices().isPermutationOf(indices())) {
        throw new CannotAddTensorsException(
            "Cannot add " + summand.indices() + " to a sum over " + indices());
      }
      result = result.add(summand.evaluate(assignment));
    }
    return result;
  }

  @Override
  public TensorNode withIndices(IndexList newIndices) {
    checkArity(newIndices);
    Map<Index, Index> mapping = indices().mappingTo(newIndices);
    List<TensorNode> relabeled = new ArrayList<>(summands.size());
    for (TensorNode summand : summands) {
      relabeled.add(summand.withIndices(summand.indices().shuffle(mapping)));
    }
    return inherit(new AddedTensor(relabeled, newIndices));
  }

  /** Canonicalizes every summand on its own; like terms are not merged. */
  @Override
  public TensorNode canonicalize() {
    List<TensorNode> canonical = new ArrayList<>(summands.size());
    for (TensorNode summand : summands) {
      canonical.add(summand.canonicalize());
    }
    return inherit(new AddedTensor(canonical, indices()));
  }

  @Override
  protected boolean sameContent(TensorNode other) {
    return summands.equals(((AddedTensor) other).summands);
  }

  @Override
  public int hashCode() {
    return Objects.hash(indices(), summands);
  }

  @Override
  public String toString() {
    if (summands.isEmpty()) {
      return "";
    }
    StringBuilder sb = new StringBuilder(summands.get(0).toString());
    for (int i = 1; i < summands.size(); i++) {
      TensorNode summand = summands.get(i);
      if (summand instanceof ScaledTensor scaled
          && scaled.scale().isNumeric()
          && scaled.scale().asFraction().equals(Fraction.MINUS_ONE)) {
        sb.append(" - ").append(scaled.tensor());
      } else {
        sb.append(" + ").append(summand);
      }
    }
    return sb.toString();
  }
}
