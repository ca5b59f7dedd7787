package construction.simplify;

import construction.linalg.Matrix;
import construction.scalar.Scalar;
import java.util.List;

/**
 * Coefficients of a homogeneous linear system: one row per index combination, one column per
 * variable.
 */
public record LinearSystem(Matrix matrix, List<Scalar> variables) {}
