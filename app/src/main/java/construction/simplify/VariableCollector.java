package construction.simplify;

import com.google.common.base.Preconditions;
import construction.index.IndexAssignments;
import construction.index.IndexList;
import construction.linalg.Matrix;
import construction.scalar.Scalar;
import construction.scalar.Variable;
import construction.tensor.Arithmetic;
import construction.tensor.MultipliedTensor;
import construction.tensor.ScaledTensor;
import construction.tensor.ScaledTerm;
import construction.tensor.TensorNode;
import construction.tensor.ZeroTensor;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Operations on tensor expressions whose coefficients carry symbolic variables. */
public final class VariableCollector {
  private VariableCollector() {}

  /**
   * Expands the expression and groups its summands by variable monomial, so that every monomial
   * appears once in front of the sum of the tensors it multiplies. The numeric remainder comes
   * last.
   */
  public static TensorNode collectByVariables(TensorNode tensor) {
    Map<Scalar, TensorNode> byVariable = new LinkedHashMap<>();
    TensorNode rest = new ZeroTensor();
    for (TensorNode summand : Arithmetic.summands(Simplifier.expand(tensor))) {
      ScaledTerm term = Arithmetic.separateScaleFactor(summand);
      Scalar.VariableSplit split = term.scale().separateVariablesFromRest();
      for (Scalar.VariableTerm variable : split.variables()) {
        byVariable.merge(
            variable.variable(),
            Arithmetic.scale(term.tensor(), variable.coefficient()),
            Arithmetic::add);
      }
      rest = Arithmetic.add(rest, Arithmetic.scale(term.tensor(), split.rest()));
    }

    TensorNode result = new ZeroTensor();
    for (Map.Entry<Scalar, TensorNode> entry : byVariable.entrySet()) {
      result = Arithmetic.add(result, Arithmetic.scale(entry.getValue(), entry.getKey()));
    }
    return Arithmetic.add(result, rest);
  }

  /** Replaces {@code variable} by {@code expression} in the coefficient of every summand. */
  public static TensorNode substituteVariable(
      TensorNode tensor, Variable variable, Scalar expression) {
    TensorNode result = new ZeroTensor();
    for (TensorNode summand : Arithmetic.summands(tensor)) {
      ScaledTerm term = Arithmetic.separateScaleFactor(summand);
      Scalar scale = term.scale().substitute(variable, expression);
      result = Arithmetic.add(result, Arithmetic.scale(term.tensor(), scale));
    }
    return result;
  }

  /** Applies the substitutions in iteration order, then collects by variables. */
  public static TensorNode substituteVariables(
      TensorNode tensor, Map<Variable, ? extends Scalar> substitutions) {
    TensorNode result = tensor;
    for (Map.Entry<Variable, ? extends Scalar> substitution : substitutions.entrySet()) {
      result = substituteVariable(result, substitution.getKey(), substitution.getValue());
    }
    return collectByVariables(result);
  }

  /**
   * Gives every summand with a symbolic coefficient a fresh variable {@code name} numbered from
   * {@code 1 + offset}. In a product the scales of both factors are dropped in favor of the new
   * variable; numeric summands are kept.
   */
  public static TensorNode redefineVariables(TensorNode tensor, String name, int offset) {
    TensorNode result = new ZeroTensor();
    int next = 1 + offset;
    for (TensorNode summand : Arithmetic.summands(tensor)) {
      if (summand instanceof ScaledTensor scaled && scaled.scale().hasVariables()) {
        Scalar fresh = Scalar.variable(name, next++);
        result = Arithmetic.add(result, Arithmetic.scale(scaled.tensor(), fresh));
      } else if (summand instanceof MultipliedTensor product) {
        ScaledTerm first = Arithmetic.separateScaleFactor(product.first());
        ScaledTerm second = Arithmetic.separateScaleFactor(product.second());
        TensorNode unit = Arithmetic.multiply(first.tensor(), second.tensor());
        if (first.scale().hasVariables() || second.scale().hasVariables()) {
          unit = Arithmetic.scale(unit, Scalar.variable(name, next++));
        }
        result = Arithmetic.add(result, unit);
      } else {
        result = Arithmetic.add(result, summand);
      }
    }
    return result;
  }

  /**
   * Splits a tensor expression that is linear in its variables into one tensor per variable and
   * an inhomogeneous part.
   *
   * @throws IllegalArgumentException if a coefficient is of higher degree in the variables
   */
  public static ExtractedVariables extractVariables(TensorNode tensor) {
    Map<Scalar, TensorNode> variables = new LinkedHashMap<>();
    TensorNode inhomogeneous = new ZeroTensor();
    for (TensorNode summand : Arithmetic.summands(Simplifier.expand(tensor))) {
      ScaledTerm term = Arithmetic.separateScaleFactor(summand);
      Scalar.VariableSplit split = term.scale().separateVariablesFromRest();
      for (Scalar.VariableTerm variable : split.variables()) {
        if (!variable.isLinear()) {
          throw new IllegalArgumentException(
              "Cannot extract the non-linear term " + variable.variable() + " from " + summand);
        }
        variables.merge(
            variable.variable(),
            Arithmetic.scale(term.tensor(), variable.coefficient()),
            Arithmetic::add);
      }
      inhomogeneous = Arithmetic.add(inhomogeneous, Arithmetic.scale(term.tensor(), split.rest()));
    }
    return new ExtractedVariables(variables, inhomogeneous);
  }

  /**
   * Evaluates the tensor multiplying each variable at every index combination of {@code tensor}.
   * The inhomogeneous part is ignored.
   */
  public static LinearSystem toHomogeneousLinearSystem(TensorNode tensor) {
    ExtractedVariables extracted = extractVariables(tensor);
    IndexList indices = tensor.indices();
    List<int[]> combinations = indices.allIndexCombinations();
    Matrix matrix = new Matrix(combinations.size(), extracted.variables().size());
    List<Scalar> variables = new ArrayList<>(extracted.variables().keySet());

    int column = 0;
    for (TensorNode coefficient : extracted.variables().values()) {
      for (int row = 0; row < combinations.size(); row++) {
        Scalar value = coefficient.evaluate(IndexAssignments.of(indices, combinations.get(row)));
        Preconditions.checkArgument(
            !value.hasVariables(), "component %s of %s is not numeric", value, coefficient);
        matrix.set(row, column, value.asFraction());
      }
      column++;
    }
    return new LinearSystem(matrix, List.copyOf(variables));
  }
}
