package construction.symmetry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import construction.core.EngineOptions;
import construction.index.IndexAssignments;
import construction.index.IndexList;
import construction.index.Range;
import construction.scalar.Scalar;
import construction.tensor.Arithmetic;
import construction.tensor.CustomTensor;
import construction.tensor.EpsilonTensor;
import construction.tensor.GammaTensor;
import construction.tensor.MultipliedTensor;
import construction.tensor.TensorNode;
import org.junit.jupiter.api.Test;

final class SymmetrizerTest {

  private static final Range SPACE = Range.of(1, 3);

  private final Symmetrizer symmetrizer = new Symmetrizer(new EngineOptions(2, 2, 2));

  private static IndexList indices(String names) {
    return IndexList.parse(names, SPACE);
  }

  @Test
  void symmetrizingASymmetricTensorKeepsIt() {
    TensorNode gamma = new GammaTensor(indices("a b"));
    assertEquals(gamma, symmetrizer.symmetrize(gamma, indices("a b")));
  }

  @Test
  void antisymmetrizingASymmetricTensorVanishes() {
    TensorNode gamma = new GammaTensor(indices("a b"));
    assertTrue(symmetrizer.antiSymmetrize(gamma, indices("a b")).isZeroTensor());
  }

  @Test
  void epsilonIsAlreadyAntisymmetric() {
    TensorNode epsilon = new EpsilonTensor(indices("a b c"));
    assertEquals(epsilon, symmetrizer.antiSymmetrize(epsilon, indices("a b")));
    assertEquals(epsilon, symmetrizer.antiSymmetrize(epsilon, indices("a b c")));
    assertTrue(symmetrizer.symmetrize(epsilon, indices("b c")).isZeroTensor());
  }

  @Test
  void scalesAreKept() {
    TensorNode scaled = Arithmetic.scale(new GammaTensor(indices("a b")), Scalar.of(3));
    assertEquals(scaled, symmetrizer.symmetrize(scaled, indices("a b")));
  }

  @Test
  void symmetrizationAveragesTheOrbit() {
    TensorNode product =
        new MultipliedTensor(new GammaTensor(indices("a c")), new EpsilonTensor(indices("b d e")));
    TensorNode symmetrized = symmetrizer.symmetrize(product, indices("a b"));

    assertEquals(product.indices(), symmetrized.indices());
    for (int[] values : product.indices().allIndexCombinations()) {
      IndexAssignments assignment = IndexAssignments.of(product.indices(), values);
      int[] exchanged = {values[2], values[1], values[0], values[3], values[4]};
      IndexAssignments swapped = IndexAssignments.of(product.indices(), exchanged);
      Scalar expected =
          product.evaluate(assignment).add(product.evaluate(swapped)).multiply(Scalar.of(1, 2));
      assertEquals(expected, symmetrized.evaluate(assignment));
    }
  }

  @Test
  void symmetrizationIsIdempotent() {
    TensorNode product =
        new MultipliedTensor(new GammaTensor(indices("a c")), new GammaTensor(indices("b d")));
    TensorNode once = symmetrizer.symmetrize(product, indices("a b"));
    TensorNode twice = symmetrizer.symmetrize(once, indices("a b"));
    assertEquals(once.canonicalize(), twice.canonicalize());
  }

  @Test
  void sumsAreSymmetrizedTermByTerm() {
    IndexList plane = IndexList.parse("a b", Range.of(1, 2));
    TensorNode gamma = new GammaTensor(plane);
    TensorNode epsilon = Arithmetic.scale(new EpsilonTensor(plane), Scalar.variable("x"));
    TensorNode sum = Arithmetic.add(gamma, epsilon);

    assertEquals(gamma, symmetrizer.symmetrize(sum, plane));
    assertEquals(epsilon, symmetrizer.antiSymmetrize(sum, plane));
  }

  @Test
  void exchangeOfEqualStructuresIsASingleTerm() {
    TensorNode custom = new CustomTensor("T", "T", indices("a b"));
    assertEquals(custom, symmetrizer.exchangeSymmetrize(custom, indices("a b"), indices("b a")));

    TensorNode epsilon = new EpsilonTensor(indices("a b c"));
    assertTrue(
        symmetrizer
            .exchangeSymmetrize(epsilon, indices("a b c"), indices("b a c"))
            .isZeroTensor());
  }

  @Test
  void exchangeOfDifferentStructuresAverages() {
    TensorNode custom = new CustomTensor("T", "T", indices("c d"));
    TensorNode product = new MultipliedTensor(new GammaTensor(indices("a b")), custom);
    TensorNode exchanged =
        symmetrizer.exchangeSymmetrize(product, indices("a b c d"), indices("c d a b"));

    assertTrue(exchanged.isScaled());
    assertEquals(product.indices(), exchanged.indices());
    TensorNode average = Arithmetic.separateScaleFactor(exchanged).tensor();
    assertEquals(2, Arithmetic.summands(average).size());
  }

  @Test
  void exchangeNeedsMatchingLengths() {
    TensorNode gamma = new GammaTensor(indices("a b"));
    assertThrows(
        IllegalArgumentException.class,
        () -> symmetrizer.exchangeSymmetrize(gamma, indices("a b"), indices("b")));
  }
}
