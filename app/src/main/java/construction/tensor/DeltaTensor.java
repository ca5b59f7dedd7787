package construction.tensor;

import com.google.common.base.Preconditions;
import construction.index.IndexList;
import construction.scalar.Scalar;

/** Kronecker delta. The first index is raised, the second lowered. */
public final class DeltaTensor extends TensorNode {

  public DeltaTensor(IndexList indices) {
    super(orient(indices));
  }

  private static IndexList orient(IndexList indices) {
    Preconditions.checkArgument(
        indices.size() == 2, "A delta needs two indices, got %s", indices.size());
    return IndexList.of(
        indices.get(0).withContravariant(true), indices.get(1).withContravariant(false));
  }

  @Override
  public Kind kind() {
    return Kind.DELTA;
  }

  @Override
  protected Scalar evaluateAt(int[] args) {
    return args[0] == args[1] ? Scalar.one() : Scalar.zero();
  }

  @Override
  public TensorNode withIndices(IndexList newIndices) {
    checkArity(newIndices);
    return inherit(new DeltaTensor(newIndices));
  }

  @Override
  public TensorNode canonicalize() {
    return inherit(new DeltaTensor(indices().ordered()));
  }

  @Override
  protected boolean sameContent(TensorNode other) {
    return true;
  }

  @Override
  public String toString() {
    return "\\delta" + indices();
  }
}
