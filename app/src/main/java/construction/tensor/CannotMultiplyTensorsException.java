package construction.tensor;

/** A product in which an index repeats without forming a contraction. */
public class CannotMultiplyTensorsException extends TensorException {

  public CannotMultiplyTensorsException() {
    super("Cannot multiply tensors due to incompatible indices");
  }

  public CannotMultiplyTensorsException(String message) {
    super(message);
  }
}
