package construction.tensor;

import construction.index.IncompleteIndexAssignmentException;
import construction.index.IndexAssignments;
import construction.index.IndexList;
import construction.scalar.Scalar;
import java.util.Objects;

/**
 * Node of a tensor expression tree. Every node carries the list of its free indices and can be
 * evaluated component by component.
 *
 * <p>Nodes are immutable: operations that change the index structure return a fresh tree, so a
 * subtree may be shared between several parents.
 */
public abstract class TensorNode {
  private final IndexList indices;
  private String name = "";
  private String printedText = "";

  protected TensorNode(IndexList indices) {
    this.indices = Objects.requireNonNull(indices, "indices");
  }

  protected TensorNode(IndexList indices, String name, String printedText) {
    this(indices);
    this.name = Objects.requireNonNull(name, "name");
    this.printedText = Objects.requireNonNull(printedText, "printedText");
  }

  public abstract Kind kind();

  public final IndexList indices() {
    return indices;
  }

  public final String name() {
    return name;
  }

  public final String printedText() {
    return printedText;
  }

  /**
   * The component at {@code args}, one value per free index in slot order.
   *
   * @throws IncompleteIndexAssignmentException if the number of values does not match
   */
  public final Scalar evaluate(int... args) {
    if (args.length != indices.size()) {
      throw new IncompleteIndexAssignmentException(
          "Expected " + indices.size() + " index values, got " + args.length);
    }
    return evaluateAt(args);
  }

  /** The component picked out by name from {@code assignment}. */
  public final Scalar evaluate(IndexAssignments assignment) {
    return evaluateAt(assignment.apply(indices));
  }

  protected abstract Scalar evaluateAt(int[] args);

  /**
   * The same tensor with its free indices relabeled slot by slot to {@code newIndices}. Children
   * are relabeled consistently.
   */
  public abstract TensorNode withIndices(IndexList newIndices);

  /** Representative with the node's own indices in canonical order; the sign goes into a scale. */
  public TensorNode canonicalize() {
    return this;
  }

  public final TensorNode withName(String name, String printedText) {
    TensorNode copy = withIndices(indices);
    copy.name = Objects.requireNonNull(name, "name");
    copy.printedText = Objects.requireNonNull(printedText, "printedText");
    return copy;
  }

  /** Copies the name and printed text of this node onto {@code target}. */
  protected final <T extends TensorNode> T inherit(T target) {
    ((TensorNode) target).name = name;
    ((TensorNode) target).printedText = printedText;
    return target;
  }

  protected final void checkArity(IndexList newIndices) {
    if (newIndices.size() != indices.size()) {
      throw new IncompleteIndexAssignmentException(
          "Cannot relabel " + indices.size() + " indices with " + newIndices.size());
    }
  }

  public boolean isZeroTensor() {
    return kind() == Kind.ZERO;
  }

  public boolean isAdded() {
    return kind() == Kind.ADDITION;
  }

  public boolean isMultiplied() {
    return kind() == Kind.MULTIPLICATION;
  }

  public boolean isScaled() {
    return kind() == Kind.SCALED;
  }

  public boolean isSubstitute() {
    return kind() == Kind.SUBSTITUTE;
  }

  /** Structural equality: same kind, same index list and equal kind-specific content. */
  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TensorNode other)) {
      return false;
    }
    return kind() == other.kind() && indices.equals(other.indices) && sameContent(other);
  }

  /** Compares the kind-specific content of two nodes of the same kind and index list. */
  protected abstract boolean sameContent(TensorNode other);

  @Override
  public int hashCode() {
    return Objects.hash(kind(), indices);
  }
}
