package construction.tensor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import construction.index.Index;
import construction.index.IncompleteIndexAssignmentException;
import construction.index.IndexList;
import construction.index.Range;
import construction.scalar.Scalar;
import org.junit.jupiter.api.Test;

final class RelabelTest {

  private static final Range SPACE = Range.of(1, 3);

  private static IndexList indices(String names) {
    return IndexList.parse(names, SPACE);
  }

  @Test
  void relabelingIsPositional() {
    TensorNode epsilon = new EpsilonTensor(indices("a b c"));
    TensorNode relabeled = epsilon.withIndices(indices("c a b"));
    assertEquals(indices("c a b"), relabeled.indices());
    assertEquals(Scalar.of(1), relabeled.evaluate(1, 2, 3));
  }

  @Test
  void relabelingChecksArity() {
    TensorNode gamma = new GammaTensor(indices("a b"));
    assertThrows(IncompleteIndexAssignmentException.class, () -> gamma.withIndices(indices("a")));
  }

  @Test
  void sumsRelabelEverySummandConsistently() {
    TensorNode sum =
        Arithmetic.add(
            new EpsilonGammaTensor(0, 1, indices("a b")), new DeltaTensor(indices("b a")));
    TensorNode relabeled = sum.withIndices(indices("c d"));

    assertEquals(indices("c d"), relabeled.indices());
    assertEquals(indices("d c"), Arithmetic.summands(relabeled).get(1).indices());
    assertEquals(Scalar.of(2), relabeled.evaluate(2, 2));
  }

  @Test
  void contractedIndicesMakeRoomForNewFreeNames() {
    Index a = Index.of("a", SPACE);
    Index b = Index.of("b", SPACE);
    TensorNode product =
        Arithmetic.multiply(
            new EpsilonTensor(IndexList.of(a, b, Index.of("c", SPACE))),
            new EpsilonTensor(IndexList.of(a.flipped(), b.flipped(), Index.of("d", SPACE))));
    assertEquals(indices("c d"), product.indices());

    TensorNode relabeled = product.withIndices(indices("a e"));
    assertEquals(indices("a e"), relabeled.indices());
    for (int[] values : product.indices().allIndexCombinations()) {
      assertEquals(product.evaluate(values), relabeled.evaluate(values));
    }
  }

  @Test
  void substitutionsRelabelTheirChild() {
    TensorNode epsilon = new EpsilonTensor(indices("a b c"));
    TensorNode substitute = new SubstituteTensor(epsilon, indices("b a c"));
    assertEquals(Scalar.of(-1), substitute.evaluate(1, 2, 3));

    TensorNode relabeled = substitute.withIndices(indices("d e f"));
    assertEquals(indices("d e f"), relabeled.indices());
    assertEquals(Scalar.of(-1), relabeled.evaluate(1, 2, 3));
  }

  @Test
  void substitutionMustPermuteTheChildIndices() {
    TensorNode epsilon = new EpsilonTensor(indices("a b c"));
    assertThrows(
        IllegalArgumentException.class, () -> new SubstituteTensor(epsilon, indices("a b d")));
  }

  @Test
  void namesSurviveRelabeling() {
    TensorNode named = new GammaTensor(indices("a b")).withName("g", "g");
    TensorNode relabeled = named.withIndices(indices("c d"));
    assertEquals("g", relabeled.name());
    assertEquals("g", relabeled.printedText());
    assertEquals("gamma", new GammaTensor(indices("a b")).name());
  }
}
