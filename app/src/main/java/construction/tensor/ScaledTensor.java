package construction.tensor;

import construction.index.IndexList;
import construction.scalar.Fraction;
import construction.scalar.Scalar;
import java.util.Objects;

/** A tensor multiplied by a coefficient. Never wraps another scaled tensor. */
public final class ScaledTensor extends TensorNode {
  private final TensorNode tensor;
  private final Scalar scale;

  public ScaledTensor(TensorNode tensor, Scalar scale) {
    super(tensor.indices());
    this.tensor = tensor;
    this.scale = Objects.requireNonNull(scale, "scale");
  }

  public TensorNode tensor() {
    return tensor;
  }

  public Scalar scale() {
    return scale;
  }

  @Override
  public Kind kind() {
    return Kind.SCALED;
  }

  @Override
  protected Scalar evaluateAt(int[] args) {
    return tensor.evaluate(args).multiply(scale);
  }

  @Override
  public TensorNode withIndices(IndexList newIndices) {
    checkArity(newIndices);
    return inherit(new ScaledTensor(tensor.withIndices(newIndices), scale));
  }

  @Override
  public TensorNode canonicalize() {
    return Arithmetic.scale(tensor.canonicalize(), scale);
  }

  @Override
  protected boolean sameContent(TensorNode other) {
    ScaledTensor scaled = (ScaledTensor) other;
    return scale.equals(scaled.scale) && tensor.equals(scaled.tensor);
  }

  @Override
  public int hashCode() {
    return Objects.hash(scale, tensor);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    if (scale.isNumeric() && scale.asFraction().equals(Fraction.MINUS_ONE)) {
      sb.append('-');
    } else if (scale.isAdded()) {
      sb.append('(').append(scale).append(") * ");
    } else if (!scale.isOne()) {
      sb.append(scale).append(" * ");
    }
    if (tensor.isAdded()) {
      sb.append('(').append(tensor).append(')');
    } else {
      sb.append(tensor);
    }
    return sb.toString();
  }
}
