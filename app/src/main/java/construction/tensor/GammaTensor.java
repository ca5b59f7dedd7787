package construction.tensor;

import com.google.common.base.Preconditions;
import construction.index.IndexList;
import construction.scalar.Scalar;
import java.util.Objects;

/**
 * Flat metric of signature {@code (p, q)}: diagonal, -1 on the first {@code p} values of the range
 * and +1 on the remaining ones.
 */
public final class GammaTensor extends TensorNode {
  private final int p;
  private final int q;

  public GammaTensor(IndexList indices) {
    this(indices, 0, 3);
  }

  public GammaTensor(IndexList indices, int p, int q) {
    super(indices, "gamma", "\\gamma");
    Preconditions.checkArgument(
        indices.size() == 2, "A metric needs two indices, got %s", indices.size());
    this.p = p;
    this.q = q;
  }

  public int p() {
    return p;
  }

  public int q() {
    return q;
  }

  static int components(int[] args, int from, int p) {
    if (args[0] != args[1]) {
      return 0;
    }
    return args[0] - from < p ? -1 : 1;
  }

  @Override
  public Kind kind() {
    return Kind.GAMMA;
  }

  @Override
  protected Scalar evaluateAt(int[] args) {
    return Scalar.of(components(args, indices().get(0).range().from(), p));
  }

  @Override
  public TensorNode withIndices(IndexList newIndices) {
    checkArity(newIndices);
    return inherit(new GammaTensor(newIndices, p, q));
  }

  @Override
  public TensorNode canonicalize() {
    return inherit(new GammaTensor(indices().ordered(), p, q));
  }

  @Override
  protected boolean sameContent(TensorNode other) {
    GammaTensor gamma = (GammaTensor) other;
    return p == gamma.p && q == gamma.q;
  }

  @Override
  public int hashCode() {
    return Objects.hash(super.hashCode(), p, q);
  }

  @Override
  public String toString() {
    return "\\gamma" + indices();
  }
}
