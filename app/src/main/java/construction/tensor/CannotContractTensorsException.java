package construction.tensor;

/** A contraction between indices of the same name but different ranges. */
public class CannotContractTensorsException extends TensorException {

  public CannotContractTensorsException() {
    super("Cannot contract tensors due to incompatible indices");
  }

  public CannotContractTensorsException(String message) {
    super(message);
  }
}
