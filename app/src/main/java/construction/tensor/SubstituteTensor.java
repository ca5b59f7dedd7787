package construction.tensor;

import com.google.common.base.Preconditions;
import construction.index.IndexAssignments;
import construction.index.IndexList;
import construction.index.Permutation;
import construction.scalar.Scalar;
import java.util.Objects;

/** Presents a tensor under a reordering of its own indices. */
public final class SubstituteTensor extends TensorNode {
  private final TensorNode tensor;

  public SubstituteTensor(TensorNode tensor, IndexList indices) {
    super(indices);
    Preconditions.checkArgument(
        indices.isPermutationOf(tensor.indices()),
        "%s is not a permutation of %s",
        indices,
        tensor.indices());
    this.tensor = tensor;
  }

  public TensorNode tensor() {
    return tensor;
  }

  @Override
  public Kind kind() {
    return Kind.SUBSTITUTE;
  }

  @Override
  protected Scalar evaluateAt(int[] args) {
    return tensor.evaluate(IndexAssignments.of(indices(), args));
  }

  @Override
  public TensorNode withIndices(IndexList newIndices) {
    checkArity(newIndices);
    Permutation permutation = Permutation.from(indices(), tensor.indices());
    TensorNode relabeled = tensor.withIndices(permutation.apply(newIndices));
    return inherit(new SubstituteTensor(relabeled, newIndices));
  }

  @Override
  protected boolean sameContent(TensorNode other) {
    return tensor.equals(((SubstituteTensor) other).tensor);
  }

  @Override
  public int hashCode() {
    return Objects.hash(indices(), tensor);
  }

  @Override
  public String toString() {
    return tensor.toString();
  }
}
