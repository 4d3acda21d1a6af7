package xrd.viewer.utils;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static xrd.viewer.test.TestUtils.gaussian;
import static xrd.viewer.test.TestUtils.linspace;
import static xrd.viewer.test.TestUtils.nearestIndex;

import java.util.Random;
import org.junit.Test;

public class BaselineUtilsTest {

  @Test
  public void alsBaseline_linearDriftRemoved_peakAmplitudeKept() {
    double[] x = linspace(5., 80., 2000);
    double[] y = new double[x.length];
    for (int i = 0; i < x.length; ++i) {
      y[i] = 0.02 * x[i] + gaussian(x[i], 30., 0.1, 100.);
    }

    double[] baseline = BaselineUtils.alsBaseline(y, 1e5, 0.01, 10);
    double[] corrected = BaselineUtils.subtract(y, baseline);

    int peak = nearestIndex(x, 30.);
    assertEquals(100., corrected[peak], 5.);

    int lowIdx = nearestIndex(x, 10.);
    int highIdx = nearestIndex(x, 70.);
    assertEquals(0., corrected[lowIdx], 0.5);
    assertEquals(0., corrected[highIdx], 0.5);
    double slope = (corrected[highIdx] - corrected[lowIdx]) / (x[highIdx] - x[lowIdx]);
    assertEquals(0., slope, 1e-3);
  }

  @Test
  public void alsBaseline_straightLine_isItsOwnBaseline() {
    double[] y = new double[50];
    for (int i = 0; i < y.length; ++i) {
      y[i] = 3. - 0.25 * i;
    }
    double[] baseline = BaselineUtils.alsBaseline(y, 1e5, 0.01, 10);
    assertArrayEquals(y, baseline, 1e-6);
  }

  @Test
  public void alsBaseline_returnsSameLength() {
    double[] y = {1., 4., 2., 6., 3.};
    assertEquals(y.length, BaselineUtils.alsBaseline(y, 10., 0.1, 3).length);
  }

  @Test(expected = ValidationException.class)
  public void alsBaseline_twoPoints_rejected() {
    BaselineUtils.alsBaseline(new double[]{1., 2.}, 1e5, 0.01, 10);
  }

  @Test(expected = InvalidParameterException.class)
  public void alsBaseline_nonPositiveLambda_rejected() {
    BaselineUtils.alsBaseline(new double[]{1., 2., 3., 4.}, 0., 0.01, 10);
  }

  @Test
  public void checkAlsParameters_namesRejectedParameter() {
    try {
      BaselineUtils.checkAlsParameters(1e5, 1., 10);
    } catch (InvalidParameterException e) {
      assertEquals("p", e.getParameterName());
      return;
    }
    throw new AssertionError("asymmetry of 1 accepted");
  }

  @Test(expected = InvalidParameterException.class)
  public void checkAlsParameters_zeroIterations_rejected() {
    BaselineUtils.checkAlsParameters(1e5, 0.01, 0);
  }

  @Test
  public void rollingBaseline_minNeverAboveData() {
    Random random = new Random(4021L);
    double[] y = new double[500];
    for (int i = 0; i < y.length; ++i) {
      y[i] = 20. * Math.sin(i / 30.) + random.nextGaussian() * 5.;
    }
    for (int window : new int[]{1, 2, 7, 101, 1001}) {
      double[] baseline = BaselineUtils.rollingBaseline(y, window, RollingMethod.MIN);
      for (int i = 0; i < y.length; ++i) {
        assertTrue("window " + window + " index " + i, baseline[i] <= y[i]);
      }
    }
  }

  @Test
  public void rollingBaseline_windowOne_isIdentity() {
    double[] y = {4., -1., 7.5, 2., 2.};
    assertArrayEquals(y, BaselineUtils.rollingBaseline(y, 1, RollingMethod.MIN), 0.);
    assertArrayEquals(y, BaselineUtils.rollingBaseline(y, 1, RollingMethod.MEDIAN), 0.);
  }

  @Test
  public void rollingBaseline_clippedWindowsAtEdges() {
    double[] y = {1., 5., 2., 8., 3.};
    double[] min = BaselineUtils.rollingBaseline(y, 3, RollingMethod.MIN);
    assertArrayEquals(new double[]{1., 1., 2., 2., 3.}, min, 0.);
    // edge windows hold two points, so their median is the mean of both
    double[] median = BaselineUtils.rollingBaseline(y, 3, RollingMethod.MEDIAN);
    assertArrayEquals(new double[]{3., 2., 5., 3., 5.5}, median, 0.);
  }

  @Test
  public void rollingBaseline_evenWindow_usesFloorHalfWidth() {
    double[] y = {1., 5., 2., 8., 3.};
    // window 4 has half-width 2, the same as window 5
    assertArrayEquals(BaselineUtils.rollingBaseline(y, 5, RollingMethod.MIN),
        BaselineUtils.rollingBaseline(y, 4, RollingMethod.MIN), 0.);
  }

  @Test(expected = InvalidParameterException.class)
  public void rollingBaseline_zeroWindow_rejected() {
    BaselineUtils.rollingBaseline(new double[]{1., 2., 3.}, 0, RollingMethod.MIN);
  }

  @Test(expected = InvalidParameterException.class)
  public void rollingBaseline_noMethod_rejected() {
    BaselineUtils.rollingBaseline(new double[]{1., 2., 3.}, 3, null);
  }

  @Test
  public void subtract_pointwise() {
    double[] corrected = BaselineUtils.subtract(new double[]{5., 3., 1.}, new double[]{1., 1., 2.});
    assertArrayEquals(new double[]{4., 2., -1.}, corrected, 0.);
  }

}
