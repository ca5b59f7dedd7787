package construction.tensor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import construction.index.IndexList;
import construction.index.Permutation;
import construction.index.Range;
import construction.scalar.Scalar;
import org.junit.jupiter.api.Test;

final class TensorTest {

  private static final Range SPACE = Range.of(1, 3);
  private static final IndexList ABC = IndexList.parse("a b c", SPACE);

  @Test
  void multiplyingByOneAndZero() {
    Tensor epsilon = Tensor.epsilon(ABC);
    assertEquals(epsilon, epsilon.multiply(Scalar.one()));
    assertTrue(epsilon.multiply(Scalar.zero()).node().isZeroTensor());
    assertEquals(epsilon.canonicalize(), epsilon.add(Tensor.zero()).canonicalize());
  }

  @Test
  void isZeroChecksEveryComponent() {
    Tensor epsilon = Tensor.epsilon(ABC);
    assertFalse(epsilon.isZero());
    assertTrue(epsilon.subtract(epsilon).isZero());
    assertTrue(Tensor.of("T", "T", ABC).isZero());
    assertTrue(Tensor.zero().isZero());
  }

  @Test
  void isEqualComparesComponents() {
    Tensor epsilon = Tensor.epsilon(ABC);
    Tensor rotated = Tensor.substitute(Tensor.epsilon(IndexList.parse("b c a", SPACE)), ABC);
    assertTrue(epsilon.isEqual(rotated));
    assertFalse(epsilon.isEqual(epsilon.negate()));
    assertFalse(epsilon.isEqual(Tensor.epsilon(IndexList.parse("a b d", SPACE))));
  }

  @Test
  void permuteIndicesRelabelsSlots() {
    Tensor epsilon = Tensor.epsilon(ABC);
    Tensor swapped = epsilon.permuteIndices(Permutation.of(1, 0, 2));
    assertEquals(IndexList.parse("b a c", SPACE), swapped.indices());
    assertEquals(Scalar.of(1), swapped.evaluate(1, 2, 3));
  }

  @Test
  void contractionWithoutRepeatsIsARelabeling() {
    Tensor gamma = Tensor.spatialMetric(0);
    Tensor relabeled = Tensor.contraction(gamma, IndexList.parse("i j", SPACE));
    assertEquals(Kind.GAMMA, relabeled.kind());
    assertEquals(IndexList.parse("i j", SPACE), relabeled.indices());
  }

  @Test
  void spaceTimeFactories() {
    assertEquals(4, Tensor.spaceTimeEpsilon(0).indices().size());
    assertEquals("mu", Tensor.spaceTimeEpsilon(0).indices().get(0).name());
    assertEquals(IndexList.parse("b c d", SPACE), Tensor.spaceEpsilon(1).indices());
    assertEquals(Scalar.of(-1), Tensor.minkowskianMetric(0).evaluate(0, 0));
    assertEquals(Scalar.of(1), Tensor.euclideanMetric(0).evaluate(0, 0));
  }

  @Test
  void summandsAndVariables() {
    Tensor sum =
        Tensor.epsilon(ABC)
            .multiply(Scalar.variable("x"))
            .add(Tensor.of("T", "T", ABC).multiply(Scalar.of(2)));
    assertEquals(2, sum.summands().size());
    assertTrue(sum.hasVariables());
    assertFalse(Tensor.epsilon(ABC).hasVariables());
    assertEquals(Scalar.variable("x"), sum.summands().get(0).separateScaleFactor().scale());
  }

  @Test
  void printsLatexLikeText() {
    assertEquals("\\epsilon_{abc}", Tensor.epsilon(ABC).toString());
    assertEquals("0", Tensor.zero().toString());
    assertEquals("-\\epsilon_{abc}", Tensor.epsilon(ABC).negate().toString());
    assertEquals(
        "\\gamma_{ab} - \\gamma_{ba}",
        Tensor.gamma(IndexList.parse("a b", SPACE))
            .subtract(Tensor.gamma(IndexList.parse("b a", SPACE)))
            .toString());
    assertEquals("\\delta^{a}_{b}", Tensor.delta(IndexList.parse("a b", SPACE)).toString());
  }

  @Test
  void equalityIsStructural() {
    Tensor a = Tensor.gamma(IndexList.parse("a b", SPACE));
    Tensor b = Tensor.gamma(IndexList.parse("b a", SPACE));
    assertFalse(a.equals(b));
    assertEquals(a, b.canonicalize());
    assertEquals(a.hashCode(), b.canonicalize().hashCode());
  }
}
