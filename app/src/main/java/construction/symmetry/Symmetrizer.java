package construction.symmetry;

import com.google.common.base.Stopwatch;
import construction.core.EngineOptions;
import construction.index.Index;
import construction.index.IndexList;
import construction.index.Permutation;
import construction.scalar.Scalar;
import construction.tensor.Arithmetic;
import construction.tensor.ScaledTerm;
import construction.tensor.TensorNode;
import construction.tensor.ZeroTensor;
import construction.util.TaskPool;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Symmetrization, antisymmetrization and exchange symmetrization of tensor expressions.
 *
 * <p>Atomic tensors are averaged over the orbit of the chosen index slots; orbit members are
 * canonicalized and equal structures are merged by adding their coefficients. Sums are processed
 * summand by summand and the results pooled the same way.
 */
public final class Symmetrizer {
  private static final Logger LOG = LoggerFactory.getLogger(Symmetrizer.class);

  private final EngineOptions options;

  public Symmetrizer(EngineOptions options) {
    this.options = EngineOptions.normalize(options);
  }

  public TensorNode symmetrize(TensorNode tensor, IndexList indices) {
    return average(tensor, indices, false);
  }

  public TensorNode antiSymmetrize(TensorNode tensor, IndexList indices) {
    return average(tensor, indices, true);
  }

  /**
   * Averages {@code tensor} with its copy relabeled by {@code from[i] -> to[i]}. If both copies
   * have the same canonical structure the result is a single term.
   */
  public TensorNode exchangeSymmetrize(TensorNode tensor, IndexList from, IndexList to) {
    if (from.size() != to.size()) {
      throw new IllegalArgumentException(
          "Cannot exchange " + from.size() + " indices with " + to.size());
    }
    Map<Index, Index> mapping = from.mappingTo(to);
    return exchange(tensor, mapping);
  }

  private TensorNode exchange(TensorNode tensor, Map<Index, Index> mapping) {
    if (tensor.isAdded()) {
      return pooled(
          Arithmetic.summands(tensor),
          options.exchangeParallelism(),
          summand -> exchange(summand, mapping));
    }
    if (tensor.isScaled()) {
      ScaledTerm term = Arithmetic.separateScaleFactor(tensor);
      return Arithmetic.scale(exchange(term.tensor(), mapping), term.scale());
    }
    if (tensor.isZeroTensor()) {
      return tensor;
    }
    ScaledTerm original = Arithmetic.separateScaleFactor(tensor.canonicalize());
    TensorNode relabeled = tensor.withIndices(tensor.indices().rename(mapping)).canonicalize();
    ScaledTerm exchanged = Arithmetic.separateScaleFactor(relabeled);
    if (original.tensor().equals(exchanged.tensor())) {
      Scalar scale = original.scale().add(exchanged.scale()).multiply(Scalar.of(1, 2));
      return Arithmetic.scale(original.tensor(), scale);
    }
    return Arithmetic.scale(Arithmetic.add(tensor, relabeled), Scalar.of(1, 2));
  }

  private TensorNode average(TensorNode tensor, IndexList indices, boolean alternating) {
    if (tensor.isAdded()) {
      return pooled(
          Arithmetic.summands(tensor),
          options.symmetrizationParallelism(),
          summand -> average(summand, indices, alternating));
    }
    if (tensor.isScaled()) {
      ScaledTerm term = Arithmetic.separateScaleFactor(tensor);
      TensorNode averaged = average(term.tensor(), indices, alternating);
      if (averaged.isZeroTensor()) {
        return averaged;
      }
      return Arithmetic.scale(averaged, term.scale());
    }
    if (tensor.isZeroTensor()) {
      return tensor;
    }
    return averageOrbit(tensor, indices, alternating);
  }

  private TensorNode averageOrbit(TensorNode tensor, IndexList indices, boolean alternating) {
    Stopwatch stopwatch = Stopwatch.createStarted();
    List<IndexList> orbit = IndexOrbit.of(tensor.indices(), indices);
    List<TensorNode> members;
    try (TaskPool pool = new TaskPool(options.symmetrizationParallelism())) {
      members =
          pool.map(
              orbit,
              permuted -> {
                TensorNode member = tensor.withIndices(permuted);
                if (alternating && Permutation.from(tensor.indices(), permuted).sign() < 0) {
                  member = Arithmetic.scale(member, Scalar.of(-1));
                }
                return member.canonicalize();
              });
    }
    List<ScaledTerm> terms = new ArrayList<>(members.size());
    for (TensorNode member : members) {
      terms.add(Arithmetic.separateScaleFactor(member));
    }
    TensorNode result = sum(merge(terms));
    if (!result.isZeroTensor()) {
      result = Arithmetic.scale(result, Scalar.of(1, orbit.size()));
    }
    LOG.debug(
        "{} {} over {}: orbit of {} in {} ms",
        alternating ? "Antisymmetrized" : "Symmetrized",
        tensor,
        indices,
        orbit.size(),
        stopwatch.elapsed(TimeUnit.MILLISECONDS));
    return result;
  }

  /**
   * Applies {@code operation} to every summand and sums the results. When all results share one
   * overall coefficient up to sign, their terms are pooled and merged and the coefficient is
   * factored back out.
   */
  private TensorNode pooled(
      List<TensorNode> summands, int parallelism, UnaryOperator<TensorNode> operation) {
    List<ScaledTerm> parts;
    try (TaskPool pool = new TaskPool(parallelism)) {
      parts =
          pool.map(summands, summand -> Arithmetic.separateScaleFactor(operation.apply(summand)));
    }
    List<ScaledTerm> nonZero = new ArrayList<>(parts.size());
    for (ScaledTerm part : parts) {
      if (!part.tensor().isZeroTensor()) {
        nonZero.add(part);
      }
    }
    if (nonZero.isEmpty()) {
      return new ZeroTensor();
    }
    Scalar overall = nonZero.get(0).scale();
    boolean sameScale = true;
    for (ScaledTerm part : nonZero) {
      sameScale &= sameUpToSign(overall, part.scale());
    }
    if (!sameScale) {
      return sum(nonZero);
    }
    List<ScaledTerm> terms = new ArrayList<>();
    for (ScaledTerm part : nonZero) {
      Scalar sign = part.scale().equals(overall) ? Scalar.one() : Scalar.of(-1);
      for (TensorNode term : Arithmetic.summands(part.tensor())) {
        ScaledTerm split = Arithmetic.separateScaleFactor(term);
        terms.add(new ScaledTerm(split.scale().multiply(sign), split.tensor()));
      }
    }
    List<ScaledTerm> merged = merge(terms);
    if (merged.isEmpty()) {
      return new ZeroTensor();
    }
    Scalar last = merged.get(0).scale();
    boolean common = true;
    for (ScaledTerm term : merged) {
      common &= sameUpToSign(last, term.scale());
    }
    if (!common) {
      return Arithmetic.scale(sum(merged), overall);
    }
    List<ScaledTerm> signs = new ArrayList<>(merged.size());
    for (ScaledTerm term : merged) {
      signs.add(
          new ScaledTerm(term.scale().equals(last) ? Scalar.one() : Scalar.of(-1), term.tensor()));
    }
    return Arithmetic.scale(Arithmetic.scale(sum(signs), last), overall);
  }

  private static boolean sameUpToSign(Scalar a, Scalar b) {
    return a.equals(b) || a.equals(b.negate());
  }

  /** Adds up the coefficients of equal structures and drops those that cancel. */
  static List<ScaledTerm> merge(List<ScaledTerm> terms) {
    Map<TensorNode, Scalar> scales = new LinkedHashMap<>();
    for (ScaledTerm term : terms) {
      scales.merge(term.tensor(), term.scale(), Scalar::add);
    }
    List<ScaledTerm> merged = new ArrayList<>(scales.size());
    for (Map.Entry<TensorNode, Scalar> entry : scales.entrySet()) {
      if (!entry.getValue().isZero()) {
        merged.add(new ScaledTerm(entry.getValue(), entry.getKey()));
      }
    }
    return merged;
  }

  static TensorNode sum(List<ScaledTerm> terms) {
    TensorNode result = new ZeroTensor();
    for (ScaledTerm term : terms) {
      result = Arithmetic.add(result, term.toNode());
    }
    return result;
  }
}
