package construction.tensor;

import com.google.common.base.Preconditions;
import construction.index.IndexList;
import construction.index.Permutation;
import construction.scalar.Scalar;

/**
 * Levi-Civita symbol: +1 on even permutations of the index range, -1 on odd ones and 0
 * whenever two values coincide.
 */
public final class EpsilonTensor extends TensorNode {

  public EpsilonTensor(IndexList indices) {
    super(indices, "epsilon", "\\epsilon");
    Preconditions.checkArgument(
        !indices.isEmpty() && indices.get(0).range().size() == indices.size(),
        "An epsilon over %s needs as many indices as values, got %s",
        indices.isEmpty() ? "nothing" : indices.get(0).range(),
        indices.size());
  }

  /**
   * Closed form {@code prod_{p<q} (a_q - a_p) / (q - p)}. With exactly as many arguments as range
   * values the product reduces to the product of the signs of the differences.
   */
  static int components(int[] args) {
    int sign = 1;
    for (int p = 0; p < args.length; p++) {
      for (int q = p + 1; q < args.length; q++) {
        sign *= Integer.signum(args[q] - args[p]);
        if (sign == 0) {
          return 0;
        }
      }
    }
    return sign;
  }

  @Override
  public Kind kind() {
    return Kind.EPSILON;
  }

  @Override
  protected Scalar evaluateAt(int[] args) {
    return Scalar.of(components(args));
  }

  @Override
  public TensorNode withIndices(IndexList newIndices) {
    checkArity(newIndices);
    return inherit(new EpsilonTensor(newIndices));
  }

  @Override
  public TensorNode canonicalize() {
    IndexList sorted = indices().ordered();
    TensorNode result = inherit(new EpsilonTensor(sorted));
    if (Permutation.from(indices(), sorted).sign() < 0) {
      return new ScaledTensor(result, Scalar.of(-1));
    }
    return result;
  }

  @Override
  protected boolean sameContent(TensorNode other) {
    return true;
  }

  @Override
  public String toString() {
    return "\\epsilon" + indices();
  }
}
