package construction.tensor;

import construction.index.IndexList;
import construction.scalar.Scalar;
import java.util.Objects;

/** A tensor without indices holding a single coefficient. */
public final class ScalarTensor extends TensorNode {
  private final Scalar value;

  public ScalarTensor(Scalar value) {
    super(IndexList.empty());
    this.value = Objects.requireNonNull(value, "value");
  }

  public Scalar value() {
    return value;
  }

  @Override
  public Kind kind() {
    return Kind.SCALAR;
  }

  @Override
  protected Scalar evaluateAt(int[] args) {
    return value;
  }

  @Override
  public TensorNode withIndices(IndexList newIndices) {
    checkArity(newIndices);
    return inherit(new ScalarTensor(value));
  }

  @Override
  protected boolean sameContent(TensorNode other) {
    return value.equals(((ScalarTensor) other).value);
  }

  @Override
  public int hashCode() {
    return value.hashCode();
  }

  @Override
  public String toString() {
    return printedText().isEmpty() ? value.toString() : printedText();
  }
}
