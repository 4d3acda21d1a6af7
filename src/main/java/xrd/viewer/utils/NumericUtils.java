package xrd.viewer.utils;

import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.rank.Median;

/**
 * Class containing methods to serve as math functions shared by the baseline, smoothing and
 * peak routines: banded linear solves, windowed order statistics and small polynomial fits.
 */
public class NumericUtils {

  public static final ThreadLocal<DecimalFormat> DECIMAL_FORMAT =
      ThreadLocal.withInitial(() -> {
        DecimalFormat format = new DecimalFormat("#.####");
        setInfinityPrintable(format);
        return format;
      });

  /**
   * Build the three distinct bands of the symmetric matrix D'D, where D is the (n-2) x n
   * second-difference operator with rows [1, -2, 1]. The result holds the main diagonal
   * (length n), the first off-diagonal (length n-1) and the second off-diagonal (length n-2).
   * For n of at least 5 the main diagonal is 1, 5, 6, ..., 6, 5, 1.
   *
   * @param n Length of the series being penalized (at least 3)
   * @return Array of {main, first, second} diagonals
   */
  public static double[][] secondDifferenceBands(int n) {
    double[] main = new double[n];
    double[] first = new double[n - 1];
    double[] second = new double[n - 2];
    // row k of D is nonzero at columns k, k+1, k+2 for 0 <= k <= n-3
    int lastRow = n - 3;
    for (int i = 0; i < n; ++i) {
      if (i <= lastRow) {
        main[i] += 1.;
      }
      if (i - 1 >= 0 && i - 1 <= lastRow) {
        main[i] += 4.;
      }
      if (i - 2 >= 0 && i - 2 <= lastRow) {
        main[i] += 1.;
      }
      if (i < n - 1) {
        if (i <= lastRow) {
          first[i] -= 2.;
        }
        if (i - 1 >= 0 && i - 1 <= lastRow) {
          first[i] -= 2.;
        }
      }
      if (i < n - 2) {
        second[i] = 1.;
      }
    }
    return new double[][]{main, first, second};
  }

  /**
   * Solve Az = b for a symmetric positive-definite pentadiagonal matrix A given by its main
   * diagonal and its two upper off-diagonals. Uses a banded Cholesky factorization, so the cost
   * is linear in the size of the system.
   *
   * @param main Main diagonal, length n
   * @param first First off-diagonal A[i][i+1], length n-1
   * @param second Second off-diagonal A[i][i+2], length n-2
   * @param b Right-hand side, length n
   * @return Solution vector z
   */
  public static double[] solveSymmetricPentadiagonal(
      double[] main, double[] first, double[] second, double[] b) {

    int n = main.length;
    // lower factor stored by band: l0 = diagonal, l1[i] = L[i][i-1], l2[i] = L[i][i-2]
    double[] l0 = new double[n];
    double[] l1 = new double[n];
    double[] l2 = new double[n];

    for (int i = 0; i < n; ++i) {
      if (i >= 2) {
        l2[i] = second[i - 2] / l0[i - 2];
      }
      if (i >= 1) {
        double sum = first[i - 1];
        if (i >= 2) {
          sum -= l2[i] * l1[i - 1];
        }
        l1[i] = sum / l0[i - 1];
      }
      double diag = main[i] - (l1[i] * l1[i]) - (l2[i] * l2[i]);
      if (diag <= 0.) {
        throw new ValidationException("Banded system is not positive definite at row " + i);
      }
      l0[i] = Math.sqrt(diag);
    }

    // forward substitution with L
    double[] w = new double[n];
    for (int i = 0; i < n; ++i) {
      double sum = b[i];
      if (i >= 1) {
        sum -= l1[i] * w[i - 1];
      }
      if (i >= 2) {
        sum -= l2[i] * w[i - 2];
      }
      w[i] = sum / l0[i];
    }

    // back substitution with L transpose
    double[] z = new double[n];
    for (int i = n - 1; i >= 0; --i) {
      double sum = w[i];
      if (i + 1 < n) {
        sum -= l1[i + 1] * z[i + 1];
      }
      if (i + 2 < n) {
        sum -= l2[i + 2] * z[i + 2];
      }
      z[i] = sum / l0[i];
    }
    return z;
  }

  /**
   * Get the median of a contiguous slice of data. An even-length slice gives the mean of the
   * two middle values.
   *
   * @param data Data to take a slice of
   * @param begin First index of the slice
   * @param length Number of points in the slice
   * @return Median value of the slice
   */
  public static double median(double[] data, int begin, int length) {
    return new Median().evaluate(data, begin, length);
  }

  /**
   * Get the minimum of a contiguous slice of data
   *
   * @param data Data to take a slice of
   * @param begin First index of the slice
   * @param length Number of points in the slice
   * @return Minimum value of the slice
   */
  public static double min(double[] data, int begin, int length) {
    return StatUtils.min(data, begin, length);
  }

  /**
   * Get the largest value in an array, or NaN if the array is empty
   *
   * @param data Array to get the max of
   * @return Maximum value
   */
  public static double max(double[] data) {
    if (data.length == 0) {
      return Double.NaN;
    }
    return StatUtils.max(data);
  }

  /**
   * Evaluate a polynomial at the given position using Horner's method
   *
   * @param coefficients Coefficients, lowest order first
   * @param position Point to evaluate at
   * @return Value of the polynomial
   */
  public static double evaluatePolynomial(double[] coefficients, double position) {
    double result = 0.;
    for (int i = coefficients.length - 1; i >= 0; --i) {
      result = result * position + coefficients[i];
    }
    return result;
  }

  /**
   * Produce a Vandermonde matrix with rows for positions start, start+1, ..., start+rows-1 and
   * columns for powers 0 through order.
   *
   * @param rows Number of sample positions
   * @param order Highest power to include
   * @param start Position of the first row
   * @return Matrix of powers of each position
   */
  public static RealMatrix vandermonde(int rows, int order, int start) {
    double[][] entries = new double[rows][order + 1];
    for (int i = 0; i < rows; ++i) {
      double position = start + i;
      double power = 1.;
      for (int j = 0; j <= order; ++j) {
        entries[i][j] = power;
        power *= position;
      }
    }
    return new Array2DRowRealMatrix(entries, false);
  }

  /**
   * Sets decimalformat object so that infinity can be printed in a PDF document
   *
   * @param df DecimalFormat object to change the infinity symbol value of
   */
  public static void setInfinityPrintable(DecimalFormat df) {
    DecimalFormatSymbols symbols = df.getDecimalFormatSymbols();
    symbols.setInfinity("Inf.");
    df.setDecimalFormatSymbols(symbols);
  }

}
