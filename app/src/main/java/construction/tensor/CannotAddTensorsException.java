package construction.tensor;

/** Summands whose index lists are not permutations of each other. */
public class CannotAddTensorsException extends TensorException {

  public CannotAddTensorsException() {
    super("Cannot add tensors due to incompatible indices");
  }

  public CannotAddTensorsException(String message) {
    super(message);
  }
}
