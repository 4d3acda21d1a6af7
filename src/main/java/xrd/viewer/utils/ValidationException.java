package xrd.viewer.utils;

/**
 * Thrown when numeric input cannot be processed by an algorithm, such as a series shorter than
 * the minimum length a baseline or smoothing routine needs. Operations throwing this leave any
 * data they were given untouched.
 */
public class ValidationException extends RuntimeException {

  private static final long serialVersionUID = -4406712593825730011L;

  public ValidationException(String message) {
    super(message);
  }

}
