package xrd.viewer.utils;

/**
 * Exception for trace files or manually entered rows that are not a table of two numeric
 * columns. The whole input is rejected; no rows are silently skipped.
 */
public class SeriesFormatException extends Exception {

  private static final long serialVersionUID = 8227164395312020556L;

  public SeriesFormatException(String message) {
    super(message);
  }

}
