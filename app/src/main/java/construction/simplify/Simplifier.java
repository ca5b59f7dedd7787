package construction.simplify;

import com.google.common.base.Stopwatch;
import construction.core.EngineOptions;
import construction.index.IndexAssignments;
import construction.index.IndexList;
import construction.linalg.Matrix;
import construction.scalar.Scalar;
import construction.tensor.AddedTensor;
import construction.tensor.Arithmetic;
import construction.tensor.CannotAddTensorsException;
import construction.tensor.MultipliedTensor;
import construction.tensor.ScaledTensor;
import construction.tensor.ScaledTerm;
import construction.tensor.TensorNode;
import construction.tensor.ZeroTensor;
import construction.util.TaskPool;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.stream.IntStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reduces a sum of tensors to a linearly independent set of structures.
 *
 * <p>Every summand is evaluated at every index combination of the sum. The columns of the
 * resulting matrix are brought to reduced row echelon form; each pivot column picks a basis
 * structure and the remaining columns of its row fold their coefficients into it.
 */
public final class Simplifier {
  private static final Logger LOG = LoggerFactory.getLogger(Simplifier.class);

  private final EngineOptions options;

  public Simplifier(EngineOptions options) {
    this.options = EngineOptions.normalize(options);
  }

  /**
   * Distributes scales and products over sums, leaving a flat sum of non-added terms. Scalar
   * coefficients are kept as they are.
   */
  public static TensorNode expand(TensorNode tensor) {
    if (tensor instanceof AddedTensor sum) {
      TensorNode result = new ZeroTensor();
      for (TensorNode summand : sum.summands()) {
        result = Arithmetic.add(result, expand(summand));
      }
      return result;
    }
    if (tensor instanceof ScaledTensor scaled) {
      TensorNode result = new ZeroTensor();
      for (TensorNode summand : Arithmetic.summands(expand(scaled.tensor()))) {
        result = Arithmetic.add(result, Arithmetic.scale(summand, scaled.scale()));
      }
      return result;
    }
    if (tensor instanceof MultipliedTensor product) {
      List<TensorNode> left = Arithmetic.summands(expand(product.first()));
      List<TensorNode> right = Arithmetic.summands(expand(product.second()));
      TensorNode result = new ZeroTensor();
      for (TensorNode first : left) {
        ScaledTerm a = Arithmetic.separateScaleFactor(first);
        for (TensorNode second : right) {
          ScaledTerm b = Arithmetic.separateScaleFactor(second);
          TensorNode term = Arithmetic.multiply(a.tensor(), b.tensor());
          result = Arithmetic.add(result, Arithmetic.scale(term, a.scale().multiply(b.scale())));
        }
      }
      return result;
    }
    return tensor;
  }

  public TensorNode simplify(TensorNode tensor) {
    if (tensor instanceof ScaledTensor scaled) {
      return Arithmetic.scale(simplify(scaled.tensor()), scaled.scale());
    }
    if (tensor instanceof MultipliedTensor product) {
      return Arithmetic.multiply(simplify(product.first()), simplify(product.second()));
    }
    if (!(tensor instanceof AddedTensor sum)) {
      return tensor;
    }
    return reduce(sum);
  }

  private TensorNode reduce(AddedTensor sum) {
    Stopwatch stopwatch = Stopwatch.createStarted();
    IndexList indices = sum.indices();
    List<ScaledTerm> terms = new ArrayList<>(sum.size());
    for (TensorNode summand : sum.summands()) {
      if (!summand.indices().isPermutationOf(indices)) {
        throw new CannotAddTensorsException(
            "Cannot add " + summand.indices() + " to a sum over " + indices);
      }
      terms.add(Arithmetic.separateScaleFactor(summand));
    }
    List<int[]> combinations = indices.allIndexCombinations();
    Matrix matrix = new Matrix(combinations.size(), terms.size());

    List<Boolean> numeric;
    try (TaskPool pool = new TaskPool(options.parallelism())) {
      numeric =
          pool.map(
              IntStream.range(0, terms.size()).boxed().toList(),
              column ->
                  fillColumn(matrix, column, terms.get(column).tensor(), indices, combinations));
    }
    if (numeric.contains(Boolean.FALSE)) {
      LOG.warn("Cannot simplify {}: a component carries symbolic variables", sum);
      return sum;
    }

    int rank = matrix.toRowEchelonForm();
    Map<Scalar, TensorNode> basis = new LinkedHashMap<>();
    for (int row = 0; row < rank; row++) {
      int pivot = matrix.pivotColumn(row);
      Scalar scale = terms.get(pivot).scale();
      for (int column = pivot + 1; column < terms.size(); column++) {
        if (!matrix.get(row, column).isZero()) {
          scale = scale.add(terms.get(column).scale().multiply(matrix.get(row, column)));
        }
      }
      basis.merge(scale, terms.get(pivot).tensor(), Arithmetic::add);
    }

    TensorNode result = new ZeroTensor();
    for (Map.Entry<Scalar, TensorNode> entry : basis.entrySet()) {
      result = Arithmetic.add(result, Arithmetic.scale(entry.getValue(), entry.getKey()));
    }
    LOG.debug(
        "Simplified {} summands over {} index combinations to rank {} in {} ms",
        terms.size(),
        combinations.size(),
        rank,
        stopwatch.elapsed(TimeUnit.MILLISECONDS));
    return result;
  }

  /** Writes one column; false if a component is not a plain number. */
  private static boolean fillColumn(
      Matrix matrix, int column, TensorNode unit, IndexList indices, List<int[]> combinations) {
    for (int row = 0; row < combinations.size(); row++) {
      Scalar value = unit.evaluate(IndexAssignments.of(indices, combinations.get(row)));
      if (value.hasVariables()) {
        return false;
      }
      matrix.set(row, column, value.asFraction());
    }
    return true;
  }
}
