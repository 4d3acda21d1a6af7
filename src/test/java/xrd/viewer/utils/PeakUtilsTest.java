package xrd.viewer.utils;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static xrd.viewer.test.TestUtils.gaussian;
import static xrd.viewer.test.TestUtils.linspace;
import static xrd.viewer.test.TestUtils.nearestIndex;

import java.util.Arrays;
import java.util.List;
import org.junit.Test;

public class PeakUtilsTest {

  @Test
  public void detectPeaks_defaultThreshold_keepsThreePeaksDropsNoiseBump() {
    double[] x = linspace(0., 100., 2001);
    double[] y = new double[x.length];
    for (int i = 0; i < x.length; ++i) {
      y[i] = gaussian(x[i], 20., 1., 10.)
          + gaussian(x[i], 40., 1., 60.)
          + gaussian(x[i], 60., 1., 90.)
          + gaussian(x[i], 80., 1., 5.);
    }
    assertEquals(9., PeakUtils.defaultMinHeight(y), 1e-6);

    List<Integer> peaks = PeakUtils.detectPeaks(y);
    assertEquals(
        Arrays.asList(nearestIndex(x, 20.), nearestIndex(x, 40.), nearestIndex(x, 60.)), peaks);

    // lowering the threshold brings the bump back
    assertEquals(4, PeakUtils.detectPeaks(y, 4.).size());
  }

  @Test
  public void detectPeaks_plateau_reportsFirstIndex() {
    double[] y = {0., 1., 3., 3., 3., 1., 0.};
    assertEquals(Arrays.asList(2), PeakUtils.detectPeaks(y, 0.));
  }

  @Test
  public void detectPeaks_endpointsNeverPeaks() {
    double[] y = {5., 1., 2., 1., 6.};
    assertEquals(Arrays.asList(2), PeakUtils.detectPeaks(y, 0.));
  }

  @Test
  public void detectPeaks_plateauReachingEnd_notPeak() {
    double[] y = {0., 1., 3., 3.};
    assertTrue(PeakUtils.detectPeaks(y, 0.).isEmpty());
  }

  @Test
  public void detectPeaks_shoulderPlateau_notPeak() {
    double[] y = {0., 2., 2., 4., 1.};
    assertEquals(Arrays.asList(3), PeakUtils.detectPeaks(y, 0.));
  }

  @Test
  public void detectPeaks_flatOrEmpty_noPeaks() {
    assertTrue(PeakUtils.detectPeaks(new double[]{2., 2., 2., 2.}).isEmpty());
    assertTrue(PeakUtils.detectPeaks(new double[]{}).isEmpty());
    assertTrue(PeakUtils.detectPeaks(new double[]{1., 3.}).isEmpty());
  }

  @Test(expected = InvalidParameterException.class)
  public void minHeightFromFraction_negative_rejected() {
    PeakUtils.minHeightFromFraction(new double[]{1., 2.}, -0.1);
  }

  @Test
  public void fwhm_gaussian_matchesAnalyticWidth() {
    double[] x = linspace(10., 20., 1001);
    double[] y = new double[x.length];
    for (int i = 0; i < x.length; ++i) {
      y[i] = gaussian(x[i], 15., 0.2, 250.);
    }
    int peak = nearestIndex(x, 15.);
    double expected = 2. * Math.sqrt(2. * Math.log(2.)) * 0.2;
    assertEquals(0.4710, expected, 1e-4);
    assertEquals(expected, PeakUtils.fwhm(x, y, peak), expected * 0.01);
  }

  @Test
  public void fwhm_halfLevelNotCrossed_usesBoundary() {
    double[] x = {0., 1., 2.};
    double[] y = {6., 10., 4.};
    // left never drops to 5, so the first sample bounds it; right crosses at 2 - 1/6
    assertEquals(2. - 1. / 6., PeakUtils.fwhm(x, y, 1), 1e-12);
  }

  @Test
  public void fwhm_triangle_exact() {
    double[] x = {0., 1., 2., 3., 4.};
    double[] y = {0., 5., 10., 5., 0.};
    // neighbours sit exactly at half height
    assertEquals(2., PeakUtils.fwhm(x, y, 2), 1e-12);
  }

  @Test
  public void fwhm_list_inPeakOrder() {
    double[] x = {0., 1., 2., 3., 4., 5., 6.};
    double[] y = {0., 8., 0., 0., 2., 4., 0.};
    double[] widths = PeakUtils.fwhm(x, y, Arrays.asList(1, 5));
    assertArrayEquals(new double[]{1., 1.5}, widths, 1e-12);
  }

}
