package xrd.viewer.utils;

/**
 * Thrown when a processing parameter falls outside of its allowed domain (i.e., a Savitzky-Golay
 * polynomial order not less than the window size). Parameters are checked before any calculation
 * starts, so no data has been changed when this is thrown.
 */
public class InvalidParameterException extends RuntimeException {

  private static final long serialVersionUID = 1754016367129884902L;

  private final String parameterName;

  public InvalidParameterException(String parameterName, String message) {
    super(message);
    this.parameterName = parameterName;
  }

  /**
   * Get the name of the parameter that was rejected
   *
   * @return parameter name as used in the configuration file
   */
  public String getParameterName() {
    return parameterName;
  }

}
