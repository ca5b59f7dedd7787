package construction.tensor;

import construction.index.IndexList;
import construction.scalar.Scalar;

/**
 * A named tensor without known components. It only takes part in the index bookkeeping and
 * evaluates to zero.
 */
public final class CustomTensor extends TensorNode {

  public CustomTensor(String name, String printedText, IndexList indices) {
    super(indices, name, printedText);
  }

  @Override
  public Kind kind() {
    return Kind.CUSTOM;
  }

  @Override
  protected Scalar evaluateAt(int[] args) {
    return Scalar.zero();
  }

  @Override
  public TensorNode withIndices(IndexList newIndices) {
    checkArity(newIndices);
    return new CustomTensor(name(), printedText(), newIndices);
  }

  @Override
  public TensorNode canonicalize() {
    return new CustomTensor(name(), printedText(), indices().ordered());
  }

  @Override
  protected boolean sameContent(TensorNode other) {
    return name().equals(other.name());
  }

  @Override
  public String toString() {
    return printedText() + indices();
  }
}
