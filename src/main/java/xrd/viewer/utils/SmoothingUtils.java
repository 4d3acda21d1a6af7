package xrd.viewer.utils;

import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.QRDecomposition;
import org.apache.commons.math3.linear.RealMatrix;

/**
 * Savitzky-Golay smoothing of evenly sampled traces.
 */
public class SmoothingUtils {

  public static final int DEFAULT_SAVGOL_WINDOW = 11;
  public static final int DEFAULT_SAVGOL_ORDER = 3;

  /**
   * Get the window size actually used for a requested Savitzky-Golay window. Even sizes are
   * incremented to the next odd value instead of being rejected.
   *
   * @param window Requested window size
   * @return Odd window size
   */
  public static int normalizeWindow(int window) {
    if (window % 2 == 0) {
      return window + 1;
    }
    return window;
  }

  /**
   * Check Savitzky-Golay parameters (after even window normalization)
   *
   * @param window Requested window size, at least 2
   * @param polyOrder Polynomial degree, at least 1 and less than the normalized window
   * @throws InvalidParameterException if either parameter is out of range
   */
  public static void checkSavgolParameters(int window, int polyOrder) {
    if (window < 2) {
      throw new InvalidParameterException("window",
          "Savitzky-Golay window must be at least 3 points, got " + window);
    }
    int oddWindow = normalizeWindow(window);
    if (polyOrder < 1) {
      throw new InvalidParameterException("poly_order",
          "Savitzky-Golay polynomial order must be at least 1, got " + polyOrder);
    }
    if (polyOrder >= oddWindow) {
      throw new InvalidParameterException("poly_order",
          "Savitzky-Golay polynomial order " + polyOrder + " must be less than window size "
              + oddWindow);
    }
  }

  /**
   * Smooth data by fitting a polynomial over each sliding window by least squares and taking its
   * value at the window center. For the first and last half-windows, the polynomial fitted to the
   * first (or last) full window is evaluated at each of those positions instead.
   *
   * @param data Evenly sampled values to smooth
   * @param window Window size in points; even sizes are incremented by one
   * @param polyOrder Degree of the fitted polynomial
   * @return Smoothed data, same length as the input
   * @throws InvalidParameterException if the window or order is out of range
   * @throws ValidationException if there are fewer points than the window size
   */
  public static double[] savitzkyGolay(double[] data, int window, int polyOrder) {
    checkSavgolParameters(window, polyOrder);
    window = normalizeWindow(window);
    int n = data.length;
    if (n < window) {
      throw new ValidationException("Savitzky-Golay window of " + window
          + " points is longer than the data (" + n + " points)");
    }

    int half = window / 2;
    // rows are polynomial coefficients as linear combinations of the window values,
    // with positions -half..half so the constant term is the value at the center
    RealMatrix vandermonde = NumericUtils.vandermonde(window, polyOrder, -half);
    double[][] projection = new QRDecomposition(vandermonde).getSolver()
        .solve(MatrixUtils.createRealIdentityMatrix(window)).getData();
    double[] centerWeights = projection[0];

    double[] smoothed = new double[n];
    for (int i = half; i < n - half; ++i) {
      double sum = 0.;
      for (int j = 0; j < window; ++j) {
        sum += centerWeights[j] * data[i - half + j];
      }
      smoothed[i] = sum;
    }

    double[] leading = windowCoefficients(projection, data, 0);
    for (int i = 0; i < half; ++i) {
      smoothed[i] = NumericUtils.evaluatePolynomial(leading, i - half);
    }
    double[] trailing = windowCoefficients(projection, data, n - window);
    for (int i = n - half; i < n; ++i) {
      smoothed[i] = NumericUtils.evaluatePolynomial(trailing, i - (n - 1 - half));
    }
    return smoothed;
  }

  /**
   * Get the coefficients of the least-squares polynomial for the window starting at the given
   * index, using the precomputed projection from window values to coefficients
   */
  private static double[] windowCoefficients(double[][] projection, double[] data, int start) {
    double[] coefficients = new double[projection.length];
    for (int k = 0; k < projection.length; ++k) {
      double sum = 0.;
      for (int j = 0; j < projection[k].length; ++j) {
        sum += projection[k][j] * data[start + j];
      }
      coefficients[k] = sum;
    }
    return coefficients;
  }

}
