package xrd.viewer.utils;

import java.util.ArrayList;
import java.util.List;

/**
 * Contains static methods for locating diffraction peaks in a trace and measuring their width.
 */
public class PeakUtils {

  /**
   * Fraction of the largest intensity used as the default minimum peak height
   */
  public static final double DEFAULT_MIN_HEIGHT_FRACTION = 0.1;

  /**
   * Get the default minimum height for peak detection on the given data, 10% of its maximum
   *
   * @param data Intensity values
   * @return 0.1 * max(data), or NaN for empty data
   */
  public static double defaultMinHeight(double[] data) {
    return minHeightFromFraction(data, DEFAULT_MIN_HEIGHT_FRACTION);
  }

  /**
   * Get a minimum peak height as a fraction of the largest value in the data
   *
   * @param data Intensity values
   * @param fraction Fraction of the maximum, non-negative
   * @return fraction * max(data), or NaN for empty data
   * @throws InvalidParameterException if the fraction is negative or not a number
   */
  public static double minHeightFromFraction(double[] data, double fraction) {
    checkMinHeightFraction(fraction);
    return fraction * NumericUtils.max(data);
  }

  /**
   * Check that a minimum height fraction is a usable value
   *
   * @param fraction Fraction of the maximum intensity
   * @throws InvalidParameterException if the fraction is negative or not a number
   */
  public static void checkMinHeightFraction(double fraction) {
    if (!(fraction >= 0.) || Double.isInfinite(fraction)) {
      throw new InvalidParameterException("min_height_fraction",
          "Peak height fraction must be a non-negative finite value, got " + fraction);
    }
  }

  /**
   * Find local maxima in the data at or above the given height. A point is a maximum when it is
   * strictly greater than its left neighbour and the run of equal values starting at it ends in a
   * strictly lower value; for a flat top the first index of the run is reported. The first and
   * last points of the data are never reported.
   *
   * @param data Intensity values in order of increasing angle
   * @param minHeight Smallest value a maximum can have to be reported
   * @return Indices of the maxima in increasing order
   */
  public static List<Integer> detectPeaks(double[] data, double minHeight) {
    List<Integer> peaks = new ArrayList<>();
    int n = data.length;
    int i = 1;
    while (i < n - 1) {
      if (data[i - 1] < data[i]) {
        // walk to the end of any plateau
        int end = i;
        while (end + 1 < n - 1 && data[end + 1] == data[i]) {
          ++end;
        }
        if (data[end + 1] < data[i]) {
          if (data[i] >= minHeight) {
            peaks.add(i);
          }
          i = end + 1;
          continue;
        }
      }
      ++i;
    }
    return peaks;
  }

  /**
   * Find local maxima using the default height threshold of 10% of the maximum value
   *
   * @param data Intensity values in order of increasing angle
   * @return Indices of the maxima in increasing order
   */
  public static List<Integer> detectPeaks(double[] data) {
    return detectPeaks(data, defaultMinHeight(data));
  }

  /**
   * Compute the full width at half maximum of a peak. From the peak index, walk outward in each
   * direction while the data stays above half the peak value, then interpolate linearly between
   * the last two samples to find where the half level is crossed. If the half level is never
   * crossed before the end of the data, the boundary sample is used as the crossing point, so the
   * width is then a lower bound.
   *
   * @param x Angle values
   * @param y Intensity values, same length as x
   * @param peak Index of the peak
   * @return Width in units of x
   */
  public static double fwhm(double[] x, double[] y, int peak) {
    double half = y[peak] / 2.;

    int left = peak;
    while (left > 0 && y[left] > half) {
      --left;
    }
    double xLeft;
    if (left != peak && y[left] <= half && y[left] != y[left + 1]) {
      double fraction = (half - y[left]) / (y[left + 1] - y[left]);
      xLeft = x[left] + fraction * (x[left + 1] - x[left]);
    } else {
      xLeft = x[left];
    }

    int right = peak;
    while (right < y.length - 1 && y[right] > half) {
      ++right;
    }
    double xRight;
    if (right != peak && y[right] <= half && y[right] != y[right - 1]) {
      double fraction = (half - y[right]) / (y[right - 1] - y[right]);
      xRight = x[right] + fraction * (x[right - 1] - x[right]);
    } else {
      xRight = x[right];
    }

    return Math.abs(xRight - xLeft);
  }

  /**
   * Compute the full width at half maximum of each peak in a list
   *
   * @param x Angle values
   * @param y Intensity values
   * @param peaks Indices of peaks
   * @return Widths, in the same order as the peaks
   */
  public static double[] fwhm(double[] x, double[] y, List<Integer> peaks) {
    double[] widths = new double[peaks.size()];
    for (int i = 0; i < widths.length; ++i) {
      widths[i] = fwhm(x, y, peaks.get(i));
    }
    return widths;
  }

}
