package xrd.viewer.utils;

/**
 * Statistic taken over each window of a rolling baseline.
 */
public enum RollingMethod {

  MIN("Min"),
  MEDIAN("Median");

  private final String name;

  RollingMethod(String name) {
    this.name = name;
  }

  /**
   * Get the display name of this method (also used in configuration files)
   *
   * @return Name of method, as String
   */
  public String getName() {
    return name;
  }

  /**
   * Look up a method by its display name or enum constant name, ignoring case
   *
   * @param name Name to look up (i.e., "Min" or "MEDIAN")
   * @return Matching rolling method
   * @throws InvalidParameterException if no method has the given name
   */
  public static RollingMethod fromName(String name) {
    if (name != null) {
      String trimmed = name.trim();
      for (RollingMethod method : values()) {
        if (method.name.equalsIgnoreCase(trimmed) || method.name().equalsIgnoreCase(trimmed)) {
          return method;
        }
      }
    }
    throw new InvalidParameterException("method", "Unknown rolling baseline method: " + name);
  }
}
