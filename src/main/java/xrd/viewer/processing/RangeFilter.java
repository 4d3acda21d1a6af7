package xrd.viewer.processing;

import xrd.viewer.input.Dataset;
import xrd.viewer.utils.InvalidParameterException;
import xrd.viewer.utils.ValidationException;

/**
 * Keeps only the points of each trace whose 2θ lies within an inclusive range. Unlike the other
 * steps this changes the number of points, so the backup taken holds both angles and intensities.
 */
public class RangeFilter extends Preprocessor {

  private double min;
  private double max;

  /**
   * @param min Lowest angle kept
   * @param max Highest angle kept
   */
  public RangeFilter(double min, double max) {
    super();
    this.min = min;
    this.max = max;
  }

  @Override
  public String getName() {
    return "2θ Filter [" + min + ", " + max + "]";
  }

  @Override
  public void checkParameters() {
    if (Double.isNaN(min) || Double.isNaN(max)) {
      throw new InvalidParameterException("range", "2θ range bounds must be numbers");
    }
    if (min > max) {
      throw new InvalidParameterException("range",
          "2θ range minimum " + min + " is greater than maximum " + max);
    }
  }

  @Override
  protected void backend(Dataset dataset) {
    double[][] kept = dataset.getSeries().pointsInRange(min, max);
    if (kept[0].length == 0) {
      throw new ValidationException("No points of " + dataset.getName() + " lie within 2θ range ["
          + min + ", " + max + "]");
    }
    dataset.apply(getName(), kept[0], kept[1]);
  }

  public double getMin() {
    return min;
  }

  public double getMax() {
    return max;
  }

  public void setRange(double min, double max) {
    this.min = min;
    this.max = max;
  }

}
