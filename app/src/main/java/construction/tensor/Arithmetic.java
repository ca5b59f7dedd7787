package construction.tensor;

import construction.index.IndexList;
import construction.scalar.Scalar;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Builders for sums, products and scalings that keep the tree flat: sums absorb sums, scales fold
 * into one factor, and zero operands short-circuit.
 *
 * <p>Index compatibility is not checked here; a malformed combination fails when it is evaluated.
 */
public final class Arithmetic {

  private Arithmetic() {}

  public static TensorNode add(TensorNode first, TensorNode second) {
    if (first.isZeroTensor()) {
      return second;
    }
    if (second.isZeroTensor()) {
      return first;
    }
    List<TensorNode> summands = new ArrayList<>();
    if (first instanceof AddedTensor left) {
      summands.addAll(left.summands());
    } else {
      summands.add(first);
    }
    if (second instanceof AddedTensor right) {
      summands.addAll(right.summands());
    } else {
      summands.add(second);
    }
    if (!first.isAdded() && second.isAdded()) {
      return new AddedTensor(summands, second.indices());
    }
    return new AddedTensor(summands, first.indices());
  }

  public static TensorNode multiply(TensorNode first, TensorNode second) {
    Optional<TensorNode> shortcut = ContractionHeuristics.apply(first, second);
    if (shortcut.isPresent()) {
      return shortcut.get();
    }
    if (first.isZeroTensor() || second.isZeroTensor()) {
      return new ZeroTensor();
    }
    return new MultipliedTensor(first, second);
  }

  public static TensorNode scale(TensorNode tensor, Scalar c) {
    if (c.isOne()) {
      return tensor;
    }
    if (c.isZero()) {
      return new ZeroTensor();
    }
    if (tensor.isZeroTensor()) {
      return tensor;
    }
    if (tensor instanceof ScaledTensor scaled) {
      Scalar product = scaled.scale().multiply(c);
      if (product.isZero()) {
        return new ZeroTensor();
      }
      if (product.isOne()) {
        return scaled.tensor();
      }
      return new ScaledTensor(scaled.tensor(), product);
    }
    if (tensor instanceof SubstituteTensor substitute) {
      return new SubstituteTensor(scale(substitute.tensor(), c), substitute.indices());
    }
    return new ScaledTensor(tensor, c);
  }

  /** The summands of a sum; any other tensor is its own single summand. */
  public static List<TensorNode> summands(TensorNode tensor) {
    if (tensor instanceof AddedTensor sum) {
      return sum.summands();
    }
    return List.of(tensor);
  }

  /** Splits off the leading coefficient, looking through index substitutions. */
  public static ScaledTerm separateScaleFactor(TensorNode tensor) {
    if (tensor instanceof ScaledTensor scaled) {
      return new ScaledTerm(scaled.scale(), scaled.tensor());
    }
    if (tensor instanceof SubstituteTensor substitute) {
      ScaledTerm inner = separateScaleFactor(substitute.tensor());
      return new ScaledTerm(inner.scale(), substitute(inner.tensor(), substitute.indices()));
    }
    return new ScaledTerm(Scalar.one(), tensor);
  }

  /**
   * Wraps {@code tensor} so that it is presented under {@code indices}. Sums are substituted
   * summand by summand and scales are pulled in front.
   */
  public static TensorNode substitute(TensorNode tensor, IndexList indices) {
    if (tensor instanceof AddedTensor sum) {
      TensorNode result = new ZeroTensor();
      for (TensorNode summand : sum.summands()) {
        result = add(result, substitute(summand, indices));
      }
      return result;
    }
    if (tensor instanceof ScaledTensor scaled) {
      return scale(substitute(scaled.tensor(), indices), scaled.scale());
    }
    return new SubstituteTensor(tensor, indices);
  }
}
