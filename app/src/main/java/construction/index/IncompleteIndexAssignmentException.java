package construction.index;

/** Raised when the number of supplied index values does not match an index list. */
public class IncompleteIndexAssignmentException extends RuntimeException {

  public IncompleteIndexAssignmentException() {
    super("The index assignment is incomplete");
  }

  public IncompleteIndexAssignmentException(String message) {
    super(message);
  }
}
