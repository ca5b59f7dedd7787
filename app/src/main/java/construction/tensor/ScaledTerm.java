package construction.tensor;

import construction.scalar.Scalar;

/** A coefficient and the unit-scale tensor it multiplies. */
public record ScaledTerm(Scalar scale, TensorNode tensor) {

  public TensorNode toNode() {
    return Arithmetic.scale(tensor, scale);
  }
}
