package xrd.viewer.utils;

import java.util.Arrays;

/**
 * Contains static methods estimating the slowly-varying background of a diffraction trace.
 * Each method returns the background itself, one value per input point; subtracting it from the
 * trace is left to the caller. None of these methods modify their input.
 */
public class BaselineUtils {

  /**
   * Minimum number of points for the asymmetric least squares baseline
   * (the second-difference operator needs three points)
   */
  public static final int ALS_MIN_POINTS = 3;

  public static final double DEFAULT_ALS_LAMBDA = 1e5;
  public static final double DEFAULT_ALS_ASYMMETRY = 0.01;
  public static final int DEFAULT_ALS_ITERATIONS = 10;
  public static final int DEFAULT_ROLLING_WINDOW = 101;

  /**
   * Check that parameters for the asymmetric least squares baseline are within their domain
   *
   * @param lambda Smoothness penalty, must be positive
   * @param asymmetry Weight for points above the baseline, must lie strictly between 0 and 1
   * @param iterations Number of reweighting passes, at least 1
   * @throws InvalidParameterException if any parameter is out of range
   */
  public static void checkAlsParameters(double lambda, double asymmetry, int iterations) {
    if (!(lambda > 0.) || Double.isInfinite(lambda)) {
      throw new InvalidParameterException("lambda",
          "ALS lambda must be a positive finite value, got " + lambda);
    }
    if (!(asymmetry > 0. && asymmetry < 1.)) {
      throw new InvalidParameterException("p",
          "ALS asymmetry must be between 0 and 1 (exclusive), got " + asymmetry);
    }
    if (iterations < 1) {
      throw new InvalidParameterException("niter",
          "ALS needs at least one iteration, got " + iterations);
    }
  }

  /**
   * Check that parameters for the rolling baseline are within their domain
   *
   * @param window Width of the rolling window in points, at least 1
   * @param method Statistic taken over the window, not null
   * @throws InvalidParameterException if any parameter is out of range
   */
  public static void checkRollingParameters(int window, RollingMethod method) {
    if (window < 1) {
      throw new InvalidParameterException("window",
          "Rolling window must be at least 1 point, got " + window);
    }
    if (method == null) {
      throw new InvalidParameterException("method", "Rolling method must be specified");
    }
  }

  /**
   * Asymmetric least squares baseline (Eilers and Boelens, 2005). Minimizes
   * sum(w * (y - z)^2) + lambda * sum((second difference of z)^2), solving for z with the current
   * weights and then setting each weight to p where the data lies above z and 1 - p elsewhere.
   * This runs for exactly the given number of iterations with no convergence test.
   *
   * @param data Intensity values of the trace
   * @param lambda Smoothness penalty (larger values give a stiffer baseline)
   * @param asymmetry Weight given to points above the baseline
   * @param iterations Number of solve-and-reweight passes
   * @return Estimated baseline, same length as data
   * @throws InvalidParameterException if any parameter is out of range
   * @throws ValidationException if the data has fewer than 3 points
   */
  public static double[] alsBaseline(double[] data, double lambda, double asymmetry,
      int iterations) {
    checkAlsParameters(lambda, asymmetry, iterations);
    if (data.length < ALS_MIN_POINTS) {
      throw new ValidationException("ALS baseline needs at least " + ALS_MIN_POINTS
          + " points, got " + data.length);
    }

    int n = data.length;
    double[][] penalty = NumericUtils.secondDifferenceBands(n);
    double[] first = new double[n - 1];
    double[] second = new double[n - 2];
    for (int i = 0; i < first.length; ++i) {
      first[i] = lambda * penalty[1][i];
    }
    for (int i = 0; i < second.length; ++i) {
      second[i] = lambda * penalty[2][i];
    }

    double[] weights = new double[n];
    Arrays.fill(weights, 1.);
    double[] baseline = new double[n];
    double[] main = new double[n];
    double[] rhs = new double[n];

    for (int iter = 0; iter < iterations; ++iter) {
      // (W + lambda * D'D) z = W y
      for (int i = 0; i < n; ++i) {
        main[i] = weights[i] + lambda * penalty[0][i];
        rhs[i] = weights[i] * data[i];
      }
      baseline = NumericUtils.solveSymmetricPentadiagonal(main, first, second, rhs);
      for (int i = 0; i < n; ++i) {
        weights[i] = data[i] > baseline[i] ? asymmetry : 1. - asymmetry;
      }
    }
    return baseline;
  }

  /**
   * Rolling (morphological) baseline. Each output point is the minimum or median of a window
   * centered on that point with half-width floor(window / 2). Windows at the ends of the data are
   * clipped to the available points rather than padded.
   *
   * @param data Intensity values of the trace
   * @param window Width of the window in points
   * @param method Whether to take the minimum or the median of each window
   * @return Estimated baseline, same length as data
   * @throws InvalidParameterException if the window is less than 1 or no method is given
   */
  public static double[] rollingBaseline(double[] data, int window, RollingMethod method) {
    checkRollingParameters(window, method);
    int n = data.length;
    int half = window / 2;
    double[] baseline = new double[n];
    for (int i = 0; i < n; ++i) {
      int lower = Math.max(0, i - half);
      int upper = Math.min(n, i + half + 1);
      int length = upper - lower;
      switch (method) {
        case MIN:
          baseline[i] = NumericUtils.min(data, lower, length);
          break;
        case MEDIAN:
          baseline[i] = NumericUtils.median(data, lower, length);
          break;
        default:
          break;
      }
    }
    return baseline;
  }

  /**
   * Subtract a baseline from data point by point, producing a new array
   *
   * @param data Data to correct
   * @param baseline Background of the same length
   * @return data minus baseline
   */
  public static double[] subtract(double[] data, double[] baseline) {
    double[] corrected = new double[data.length];
    for (int i = 0; i < data.length; ++i) {
      corrected[i] = data[i] - baseline[i];
    }
    return corrected;
  }

}
