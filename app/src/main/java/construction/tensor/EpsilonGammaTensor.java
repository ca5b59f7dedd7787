package construction.tensor;

import com.google.common.base.Preconditions;
import construction.index.IndexList;
import construction.index.Permutation;
import construction.scalar.Scalar;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Product of an optional three-index epsilon and {@code numGamma} metrics, laid out as one block of
 * three indices followed by blocks of two. Evaluation stops at the first vanishing factor. The
 * metric blocks use the Euclidean signature.
 */
public final class EpsilonGammaTensor extends TensorNode {
  private static final int EPSILON_ARITY = 3;
  private static final int GAMMA_ARITY = 2;

  private final int numEpsilon;
  private final int numGamma;

  public EpsilonGammaTensor(int numEpsilon, int numGamma, IndexList indices) {
    super(indices);
    Preconditions.checkArgument(
        numEpsilon == 0 || numEpsilon == 1, "At most one epsilon block, got %s", numEpsilon);
    Preconditions.checkArgument(numGamma >= 0, "Negative number of metrics: %s", numGamma);
    Preconditions.checkArgument(
        numEpsilon * EPSILON_ARITY + numGamma * GAMMA_ARITY == indices.size(),
        "%s epsilons and %s metrics do not fit %s indices",
        numEpsilon,
        numGamma,
        indices.size());
    this.numEpsilon = numEpsilon;
    this.numGamma = numGamma;
  }

  public int numEpsilon() {
    return numEpsilon;
  }

  public int numGamma() {
    return numGamma;
  }

  @Override
  public Kind kind() {
    return Kind.EPSILON_GAMMA;
  }

  @Override
  protected Scalar evaluateAt(int[] args) {
    int result = 1;
    int pos = 0;
    for (int i = 0; i < numEpsilon; i++) {
      result *= EpsilonTensor.components(Arrays.copyOfRange(args, pos, pos + EPSILON_ARITY));
      if (result == 0) {
        return Scalar.zero();
      }
      pos += EPSILON_ARITY;
    }
    for (int i = 0; i < numGamma; i++) {
      int from = indices().get(pos).range().from();
      result *= GammaTensor.components(Arrays.copyOfRange(args, pos, pos + GAMMA_ARITY), from, 0);
      if (result == 0) {
        return Scalar.zero();
      }
      pos += GAMMA_ARITY;
    }
    return Scalar.of(result);
  }

  @Override
  public TensorNode withIndices(IndexList newIndices) {
    checkArity(newIndices);
    return inherit(new EpsilonGammaTensor(numEpsilon, numGamma, newIndices));
  }

  /**
   * Sorts the epsilon block (collecting its sign), sorts every metric block, then orders the
   * metric blocks by their first index.
   */
  @Override
  public TensorNode canonicalize() {
    int pos = 0;
    int sign = 1;
    IndexList result = IndexList.empty();
    if (numEpsilon == 1) {
      IndexList epsilon = indices().partial(0, EPSILON_ARITY - 1);
      IndexList sorted = epsilon.ordered();
      sign = Permutation.from(epsilon, sorted).sign();
      result = result.append(sorted);
      pos += EPSILON_ARITY;
    }
    List<IndexList> gammas = new ArrayList<>(numGamma);
    for (int i = 0; i < numGamma; i++) {
      gammas.add(indices().partial(pos, pos + GAMMA_ARITY - 1).ordered());
      pos += GAMMA_ARITY;
    }
    gammas.sort(Comparator.comparing(block -> block.get(0)));
    for (IndexList gamma : gammas) {
      result = result.append(gamma);
    }
    TensorNode canonical = inherit(new EpsilonGammaTensor(numEpsilon, numGamma, result));
    return sign < 0 ? new ScaledTensor(canonical, Scalar.of(-1)) : canonical;
  }

  @Override
  protected boolean sameContent(TensorNode other) {
    EpsilonGammaTensor tensor = (EpsilonGammaTensor) other;
    return numEpsilon == tensor.numEpsilon && numGamma == tensor.numGamma;
  }

  @Override
  public int hashCode() {
    return Objects.hash(super.hashCode(), numEpsilon, numGamma);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    int pos = 0;
    for (int i = 0; i < numEpsilon; i++) {
      sb.append("\\epsilon").append(indices().partial(pos, pos + EPSILON_ARITY - 1));
      pos += EPSILON_ARITY;
    }
    for (int i = 0; i < numGamma; i++) {
      sb.append("\\gamma").append(indices().partial(pos, pos + GAMMA_ARITY - 1));
      pos += GAMMA_ARITY;
    }
    return sb.toString();
  }
}
