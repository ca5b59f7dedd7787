package construction.tensor;

import construction.core.EngineOptions;
import construction.index.IndexAssignments;
import construction.index.IndexList;
import construction.index.Permutation;
import construction.index.Range;
import construction.scalar.Scalar;
import construction.scalar.Variable;
import construction.simplify.ExtractedVariables;
import construction.simplify.LinearSystem;
import construction.simplify.Simplifier;
import construction.simplify.VariableCollector;
import construction.symmetry.Symmetrizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Immutable handle on an expression tree.
 *
 * <p>Arithmetic normalizes as it builds: adding zero is the identity, sums are flattened, scales
 * are folded and known contractions are rewritten. Index mismatches are not checked when a tree
 * is built; evaluating a malformed sum or product throws.
 */
public final class Tensor {
  private static final Range SPACE_TIME = Range.of(0, 3);
  private static final Range SPACE = Range.of(1, 3);

  private final TensorNode node;

  public Tensor(TensorNode node) {
    this.node = Objects.requireNonNull(node, "node");
  }

  public static Tensor zero() {
    return new Tensor(new ZeroTensor());
  }

  public static Tensor one() {
    return scalar(Scalar.one());
  }

  public static Tensor scalar(Scalar value) {
    return new Tensor(new ScalarTensor(value));
  }

  /** A named tensor without known components; it evaluates to zero everywhere. */
  public static Tensor of(String name, String printedText, IndexList indices) {
    return new Tensor(new CustomTensor(name, printedText, indices));
  }

  public static Tensor delta(IndexList indices) {
    return new Tensor(new DeltaTensor(indices));
  }

  public static Tensor epsilon(IndexList indices) {
    return new Tensor(new EpsilonTensor(indices));
  }

  public static Tensor gamma(IndexList indices) {
    return new Tensor(new GammaTensor(indices));
  }

  public static Tensor gamma(IndexList indices, int p, int q) {
    return new Tensor(new GammaTensor(indices, p, q));
  }

  public static Tensor epsilonGamma(int numEpsilon, int numGamma, IndexList indices) {
    return new Tensor(new EpsilonGammaTensor(numEpsilon, numGamma, indices));
  }

  public static Tensor euclideanMetric(int offset) {
    return gamma(IndexList.greekSeries(2, SPACE_TIME, offset), 0, 4);
  }

  public static Tensor minkowskianMetric(int offset) {
    return gamma(IndexList.greekSeries(2, SPACE_TIME, offset), 1, 3);
  }

  public static Tensor spatialMetric(int offset) {
    return gamma(IndexList.romanSeries(2, SPACE, offset), 0, 3);
  }

  /** Levi-Civita symbol in 3+1 dimensions, the first value of the range being time. */
  public static Tensor spaceTimeEpsilon(int offset) {
    return epsilon(IndexList.greekSeries(4, SPACE_TIME, offset));
  }

  public static Tensor spaceEpsilon(int offset) {
    return epsilon(IndexList.romanSeries(3, SPACE, offset));
  }

  /**
   * Relabels {@code tensor} to {@code indices}. If the new labels contract among themselves the
   * result is multiplied by one, so that evaluation sums over the contracted pairs.
   */
  public static Tensor contraction(Tensor tensor, IndexList indices) {
    Tensor relabeled = tensor.withIndices(indices);
    if (!indices.containsContractions()) {
      return relabeled;
    }
    return new Tensor(new MultipliedTensor(new ScalarTensor(Scalar.one()), relabeled.node));
  }

  /**
   * Presents {@code tensor} with its indices in the order of {@code indices}. Sums are distributed
   * and scales pulled out of the wrapper.
   */
  public static Tensor substitute(Tensor tensor, IndexList indices) {
    return new Tensor(Arithmetic.substitute(tensor.node, indices));
  }

  public TensorNode node() {
    return node;
  }

  public Kind kind() {
    return node.kind();
  }

  public IndexList indices() {
    return node.indices();
  }

  public String name() {
    return node.name();
  }

  public Tensor withName(String name, String printedText) {
    return new Tensor(node.withName(name, printedText));
  }

  public Tensor withIndices(IndexList indices) {
    return new Tensor(node.withIndices(indices));
  }

  public Tensor permuteIndices(Permutation permutation) {
    return withIndices(indices().permuted(permutation));
  }

  public Scalar evaluate(int... args) {
    return node.evaluate(args);
  }

  public Scalar evaluate(IndexAssignments assignment) {
    return node.evaluate(assignment);
  }

  public Tensor add(Tensor other) {
    return new Tensor(Arithmetic.add(node, other.node));
  }

  public Tensor subtract(Tensor other) {
    return add(other.negate());
  }

  public Tensor negate() {
    return multiply(Scalar.of(-1));
  }

  public Tensor multiply(Tensor other) {
    return new Tensor(Arithmetic.multiply(node, other.node));
  }

  public Tensor multiply(Scalar scale) {
    return new Tensor(Arithmetic.scale(node, scale));
  }

  public Tensor canonicalize() {
    return new Tensor(node.canonicalize());
  }

  /** True if every component is the number zero. */
  public boolean isZero() {
    for (int[] combination : indices().allIndexCombinations()) {
      if (!node.evaluate(combination).isZero()) {
        return false;
      }
    }
    return true;
  }

  /** Component-wise equality; tensors over different index lists are never equal. */
  public boolean isEqual(Tensor other) {
    if (!indices().equals(other.indices())) {
      return false;
    }
    for (int[] combination : indices().allIndexCombinations()) {
      if (!node.evaluate(combination).equals(other.node.evaluate(combination))) {
        return false;
      }
    }
    return true;
  }

  public boolean allRangesEqual() {
    return indices().allRangesEqual();
  }

  public List<int[]> allIndexCombinations() {
    return indices().allIndexCombinations();
  }

  public List<Tensor> summands() {
    List<Tensor> result = new ArrayList<>();
    for (TensorNode summand : Arithmetic.summands(node)) {
      result.add(new Tensor(summand));
    }
    return result;
  }

  public boolean hasVariables() {
    for (TensorNode summand : Arithmetic.summands(node)) {
      if (Arithmetic.separateScaleFactor(summand).scale().hasVariables()) {
        return true;
      }
    }
    return false;
  }

  public ScaledTerm separateScaleFactor() {
    return Arithmetic.separateScaleFactor(node);
  }

  public Tensor expand() {
    return new Tensor(Simplifier.expand(node));
  }

  public Tensor simplify() {
    return simplify(EngineOptions.defaults());
  }

  public Tensor simplify(EngineOptions options) {
    return new Tensor(new Simplifier(options).simplify(node));
  }

  public Tensor symmetrize(IndexList indices) {
    return symmetrize(indices, EngineOptions.defaults());
  }

  public Tensor symmetrize(IndexList indices, EngineOptions options) {
    return new Tensor(new Symmetrizer(options).symmetrize(node, indices));
  }

  public Tensor antiSymmetrize(IndexList indices) {
    return antiSymmetrize(indices, EngineOptions.defaults());
  }

  public Tensor antiSymmetrize(IndexList indices, EngineOptions options) {
    return new Tensor(new Symmetrizer(options).antiSymmetrize(node, indices));
  }

  public Tensor exchangeSymmetrize(IndexList from, IndexList to) {
    return exchangeSymmetrize(from, to, EngineOptions.defaults());
  }

  public Tensor exchangeSymmetrize(IndexList from, IndexList to, EngineOptions options) {
    return new Tensor(new Symmetrizer(options).exchangeSymmetrize(node, from, to));
  }

  public Tensor collectByVariables() {
    return new Tensor(VariableCollector.collectByVariables(node));
  }

  public Tensor substituteVariable(Variable variable, Scalar expression) {
    return new Tensor(VariableCollector.substituteVariable(node, variable, expression));
  }

  public Tensor substituteVariables(Map<Variable, ? extends Scalar> substitutions) {
    return new Tensor(VariableCollector.substituteVariables(node, substitutions));
  }

  public Tensor redefineVariables(String name, int offset) {
    return new Tensor(VariableCollector.redefineVariables(node, name, offset));
  }

  public ExtractedVariables extractVariables() {
    return VariableCollector.extractVariables(node);
  }

  public LinearSystem toHomogeneousLinearSystem() {
    return VariableCollector.toHomogeneousLinearSystem(node);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Tensor other && node.equals(other.node);
  }

  @Override
  public int hashCode() {
    return node.hashCode();
  }

  /** One summand per line when coefficients carry variables. */
  @Override
  public String toString() {
    List<TensorNode> summands = Arithmetic.summands(node);
    if (summands.size() == 1 || !hasVariables()) {
      return node.toString();
    }
    StringJoiner joiner = new StringJoiner(" +\n");
    for (TensorNode summand : summands) {
      joiner.add(summand.toString());
    }
    return joiner.toString();
  }
}
