package construction.tensor;

import construction.index.IndexList;
import construction.scalar.Scalar;

/** The tensor whose components all vanish. */
public final class ZeroTensor extends TensorNode {

  public ZeroTensor() {
    this(IndexList.empty());
  }

  public ZeroTensor(IndexList indices) {
    super(indices);
  }

  @Override
  public Kind kind() {
    return Kind.ZERO;
  }

  @Override
  protected Scalar evaluateAt(int[] args) {
    return Scalar.zero();
  }

  @Override
  public TensorNode withIndices(IndexList newIndices) {
    checkArity(newIndices);
    return inherit(new ZeroTensor(newIndices));
  }

  @Override
  protected boolean sameContent(TensorNode other) {
    return true;
  }

  @Override
  public String toString() {
    return "0";
  }
}
