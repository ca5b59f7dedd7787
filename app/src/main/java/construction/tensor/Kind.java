package construction.tensor;

/** Node kinds of the expression tree, with the tag written by the binary codec. */
public enum Kind {
  ADDITION(1, "Addition"),
  MULTIPLICATION(2, "Multiplication"),
  SCALED(3, "Scaled"),
  ZERO(4, "Zero"),
  SCALAR(101, "Scalar"),
  EPSILON(201, "Epsilon"),
  GAMMA(202, "Gamma"),
  EPSILON_GAMMA(203, "EpsilonGamma"),
  DELTA(204, "Delta"),
  SUBSTITUTE(301, "Substitute"),
  CUSTOM(-1, "Custom");

  private final int tag;
  private final String label;

  Kind(int tag, String label) {
    this.tag = tag;
    this.label = label;
  }

  public int tag() {
    return tag;
  }

  public String label() {
    return label;
  }

  /** The kind written under {@code tag}; unknown tags are custom tensors. */
  public static Kind fromTag(int tag) {
    for (Kind kind : values()) {
      if (kind.tag == tag) {
        return kind;
      }
    }
    return CUSTOM;
  }
}
