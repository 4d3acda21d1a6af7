package xrd.viewer.processing;

import xrd.viewer.input.Dataset;
import xrd.viewer.input.Series;
import xrd.viewer.utils.BaselineUtils;

/**
 * Base of the steps that estimate a smooth background under a trace and subtract it. Besides the
 * corrected intensities, the background itself is left on the dataset so it can be drawn along
 * with the trace.
 */
public abstract class BaselinePreprocessor extends Preprocessor {

  /**
   * Estimate the background of a trace
   *
   * @param intensities Intensity values of the trace
   * @return Background values, one per point
   */
  protected abstract double[] computeBaseline(double[] intensities);

  @Override
  protected void backend(Dataset dataset) {
    Series series = dataset.getSeries();
    double[] intensities = series.getY();
    double[] baseline = computeBaseline(intensities);
    dataset.applyIntensity(getName(), BaselineUtils.subtract(intensities, baseline));
    dataset.setBackground(series.getX(), baseline);
  }

}
