package construction.simplify;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import construction.index.IndexList;
import construction.index.Range;
import construction.scalar.Scalar;
import construction.scalar.Variable;
import construction.tensor.Arithmetic;
import construction.tensor.CustomTensor;
import construction.tensor.EpsilonTensor;
import construction.tensor.GammaTensor;
import construction.tensor.MultipliedTensor;
import construction.tensor.ScaledTensor;
import construction.tensor.TensorNode;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

final class VariableCollectorTest {

  private static final Range SPACE = Range.of(1, 3);
  private static final IndexList AB = IndexList.parse("a b", SPACE);

  private static final Variable X = Scalar.variable("x");
  private static final Variable Y = Scalar.variable("y");

  private static final TensorNode A = new CustomTensor("A", "A", AB);
  private static final TensorNode B = new CustomTensor("B", "B", AB);
  private static final TensorNode C = new CustomTensor("C", "C", AB);
  private static final TensorNode D = new CustomTensor("D", "D", AB);

  private static TensorNode sum(TensorNode... summands) {
    TensorNode result = summands[0];
    for (int i = 1; i < summands.length; i++) {
      result = Arithmetic.add(result, summands[i]);
    }
    return result;
  }

  @Test
  void collectGroupsByVariable() {
    TensorNode expression =
        sum(
            Arithmetic.scale(A, X),
            Arithmetic.scale(B, Y),
            Arithmetic.scale(C, X),
            Arithmetic.scale(D, Scalar.of(2)));

    TensorNode collected = VariableCollector.collectByVariables(expression);

    assertEquals(
        List.of(
            new ScaledTensor(Arithmetic.add(A, C), X),
            new ScaledTensor(B, Y),
            new ScaledTensor(D, Scalar.of(2))),
        Arithmetic.summands(collected));
  }

  @Test
  void collectSplitsMixedCoefficients() {
    TensorNode expression = Arithmetic.scale(A, X.add(Scalar.of(1)));
    assertEquals(
        List.of(new ScaledTensor(A, X), A),
        Arithmetic.summands(VariableCollector.collectByVariables(expression)));
  }

  @Test
  void substituteVariableRewritesCoefficients() {
    TensorNode expression = sum(Arithmetic.scale(A, X), Arithmetic.scale(B, Y));
    TensorNode substituted = VariableCollector.substituteVariable(expression, X, Scalar.of(2));
    assertEquals(
        List.of(new ScaledTensor(A, Scalar.of(2)), new ScaledTensor(B, Y)),
        Arithmetic.summands(substituted));
  }

  @Test
  void substituteVariablesCollectsAfterwards() {
    TensorNode expression = sum(Arithmetic.scale(A, X), Arithmetic.scale(B, Y));
    TensorNode substituted = VariableCollector.substituteVariables(expression, Map.of(X, Y));
    assertEquals(new ScaledTensor(Arithmetic.add(A, B), Y), substituted);
  }

  @Test
  void redefineNumbersEverySymbolicSummand() {
    TensorNode e = new CustomTensor("E", "E", IndexList.parse("a", SPACE));
    TensorNode f = new CustomTensor("F", "F", IndexList.parse("b", SPACE));
    TensorNode product = new MultipliedTensor(Arithmetic.scale(e, X), f);
    TensorNode expression =
        sum(Arithmetic.scale(A, X.add(Y)), Arithmetic.scale(B, Scalar.of(2)), D, product);

    TensorNode redefined = VariableCollector.redefineVariables(expression, "e", 3);

    assertEquals(
        List.of(
            new ScaledTensor(A, Scalar.variable("e", 4)),
            new ScaledTensor(B, Scalar.of(2)),
            D,
            new ScaledTensor(new MultipliedTensor(e, f), Scalar.variable("e", 5))),
        Arithmetic.summands(redefined));
  }

  @Test
  void extractSeparatesVariablesFromTheInhomogeneousPart() {
    TensorNode expression =
        sum(
            Arithmetic.scale(A, X.multiply(Scalar.of(2))),
            Arithmetic.scale(B, Scalar.of(3)),
            Arithmetic.scale(C, X),
            Arithmetic.scale(A, Y));

    ExtractedVariables extracted = VariableCollector.extractVariables(expression);

    assertEquals(List.of(X, Y), List.copyOf(extracted.variables().keySet()));
    assertEquals(
        Arithmetic.add(new ScaledTensor(A, Scalar.of(2)), C), extracted.variables().get(X));
    assertEquals(A, extracted.variables().get(Y));
    assertEquals(new ScaledTensor(B, Scalar.of(3)), extracted.inhomogeneous());
  }

  @Test
  void extractWithoutNumericPartLeavesZero() {
    ExtractedVariables extracted = VariableCollector.extractVariables(Arithmetic.scale(A, X));
    assertTrue(extracted.inhomogeneous().isZeroTensor());
  }

  @Test
  void extractRejectsNonLinearTerms() {
    TensorNode expression = Arithmetic.scale(A, X.multiply(Y));
    assertThrows(
        IllegalArgumentException.class, () -> VariableCollector.extractVariables(expression));
  }

  @Test
  void homogeneousSystemHasOneColumnPerVariable() {
    IndexList plane = IndexList.parse("a b", Range.of(1, 2));
    TensorNode expression =
        Arithmetic.add(
            Arithmetic.scale(new GammaTensor(plane), X),
            Arithmetic.scale(new EpsilonTensor(plane), Y));

    LinearSystem system = VariableCollector.toHomogeneousLinearSystem(expression);

    assertEquals(List.of(X, Y), system.variables());
    assertEquals(4, system.matrix().rows());
    assertEquals(2, system.matrix().columns());
    assertEquals(Scalar.of(1), system.matrix().get(0, 0));
    assertEquals(Scalar.of(0), system.matrix().get(1, 0));
    assertEquals(Scalar.of(1), system.matrix().get(1, 1));
    assertEquals(Scalar.of(-1), system.matrix().get(2, 1));
    assertEquals(Scalar.of(1), system.matrix().get(3, 0));
  }
}
