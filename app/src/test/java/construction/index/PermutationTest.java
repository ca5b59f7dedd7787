package construction.index;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

final class PermutationTest {

  private static final Range RANGE = Range.of(0, 2);
  private static final IndexList ABC = IndexList.parse("a b c", RANGE);

  @Test
  void fromMapsOneListOntoTheOther() {
    IndexList target = IndexList.parse("b c a", RANGE);
    Permutation permutation = Permutation.from(ABC, target);
    assertEquals(target, permutation.apply(ABC));
    assertEquals(target, ABC.permuted(permutation));
  }

  @Test
  void signCountsTranspositions() {
    assertEquals(1, Permutation.identity(3).sign());
    assertEquals(-1, Permutation.of(1, 0, 2).sign());
    assertEquals(1, Permutation.of(1, 2, 0).sign());
    assertEquals(1, Permutation.of(3, 2, 1, 0, 4).sign());
  }

  @Test
  void inverseUndoesThePermutation() {
    Permutation permutation = Permutation.of(2, 0, 1);
    assertEquals(ABC, permutation.inverse().apply(permutation.apply(ABC)));
  }

  @Test
  void rejectsNonPermutations() {
    assertThrows(IllegalArgumentException.class, () -> Permutation.of(0, 0));
    assertThrows(
        IllegalArgumentException.class,
        () -> Permutation.from(ABC, IndexList.parse("a b d", RANGE)));
  }
}
