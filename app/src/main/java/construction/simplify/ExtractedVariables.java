package construction.simplify;

import construction.scalar.Scalar;
import construction.tensor.TensorNode;
import java.util.Map;

/**
 * A linear tensor expression split by its symbolic variables.
 *
 * @param variables each variable with the tensor it multiplies, in order of first occurrence
 * @param inhomogeneous the part without any variable; a zero tensor if there is none
 */
public record ExtractedVariables(Map<Scalar, TensorNode> variables, TensorNode inhomogeneous) {}
