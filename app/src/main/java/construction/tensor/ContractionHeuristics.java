package construction.tensor;

import construction.index.Index;
import construction.index.IndexList;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.BinaryOperator;

/**
 * Shortcuts for products that reduce to a simpler tensor, looked up by the kinds of both factors.
 * A rule returns {@code null} when it does not apply to the given operands.
 */
final class ContractionHeuristics {
  private static final Map<Kind, Map<Kind, BinaryOperator<TensorNode>>> RULES =
      new EnumMap<>(Kind.class);

  static {
    for (Kind kind : Kind.values()) {
      register(Kind.DELTA, kind, ContractionHeuristics::deltaContraction);
    }
    register(Kind.GAMMA, Kind.GAMMA, ContractionHeuristics::metricContraction);
  }

  private ContractionHeuristics() {}

  private static void register(Kind left, Kind right, BinaryOperator<TensorNode> rule) {
    RULES.computeIfAbsent(left, ignored -> new EnumMap<>(Kind.class)).put(right, rule);
  }

  /** The rewritten product, trying {@code (first, second)} before {@code (second, first)}. */
  static Optional<TensorNode> apply(TensorNode first, TensorNode second) {
    TensorNode result = lookup(first, second);
    if (result == null) {
      result = lookup(second, first);
    }
    return Optional.ofNullable(result);
  }

  private static TensorNode lookup(TensorNode left, TensorNode right) {
    Map<Kind, BinaryOperator<TensorNode>> byRight = RULES.get(left.kind());
    if (byRight == null) {
      return null;
    }
    BinaryOperator<TensorNode> rule = byRight.get(right.kind());
    return rule == null ? null : rule.apply(left, right);
  }

  /**
   * {@code delta^a_b T_{..b..} = T_{..a..}}: if exactly one of the delta's indices occurs exactly
   * once in the other factor, that slot is renamed to the delta's other index. The slot keeps its
   * position.
   */
  private static TensorNode deltaContraction(TensorNode delta, TensorNode other) {
    Index up = delta.indices().get(0);
    Index down = delta.indices().get(1);
    if (up.equals(down)) {
      return null;
    }
    int upCount = count(other.indices(), up);
    int downCount = count(other.indices(), down);
    Index shared;
    Index replacement;
    if (upCount == 1 && downCount == 0) {
      shared = up;
      replacement = down;
    } else if (downCount == 1 && upCount == 0) {
      shared = down;
      replacement = up;
    } else {
      return null;
    }
    int position = other.indices().indexOf(shared);
    Index slot = other.indices().get(position);
    return other.withIndices(
        other.indices().replace(position, replacement.withContravariant(slot.isContravariant())));
  }

  /**
   * {@code gamma_{ab} gamma^{bc} = delta_a^c} for two metrics of the same signature sharing exactly
   * one index in opposite positions.
   */
  private static TensorNode metricContraction(TensorNode left, TensorNode right) {
    GammaTensor first = (GammaTensor) left;
    GammaTensor second = (GammaTensor) right;
    if (first.p() != second.p() || first.q() != second.q()) {
      return null;
    }
    IndexList all = first.indices().append(second.indices());
    if (all.contractions().size() != 1 || !all.allRangesEqual()) {
      return null;
    }
    IndexList remaining = all.withoutContractions();
    if (remaining.size() != 2 || remaining.get(0).equals(remaining.get(1))) {
      return null;
    }
    return new DeltaTensor(remaining);
  }

  private static int count(IndexList indices, Index index) {
    int count = 0;
    for (Index candidate : indices) {
      if (candidate.equals(index)) {
        count++;
      }
    }
    return count;
  }
}
