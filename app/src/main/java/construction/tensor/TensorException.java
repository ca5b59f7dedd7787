package construction.tensor;

/** Base class of the index-algebra errors raised while evaluating tensor expressions. */
public class TensorException extends RuntimeException {

  public TensorException(String message) {
    super(message);
  }

  public TensorException(String message, Throwable cause) {
    super(message, cause);
  }
}
