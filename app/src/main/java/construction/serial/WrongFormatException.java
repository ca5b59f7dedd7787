package construction.serial;

import construction.tensor.TensorException;

/** Raised when a byte stream does not hold a serialized tensor expression. */
public class WrongFormatException extends TensorException {

  public WrongFormatException() {
    super("The input is not a serialized tensor");
  }

  public WrongFormatException(String message) {
    super(message);
  }

  public WrongFormatException(String message, Throwable cause) {
    super(message, cause);
  }
}
