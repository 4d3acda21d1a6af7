package xrd.viewer.input;

import java.util.Arrays;
import java.util.Optional;
import org.jfree.data.xy.XYSeries;

/**
 * Holds the angle (2θ) and intensity values of a diffraction trace. Values are kept in index
 * order, which is expected to be non-decreasing in angle, though this is not enforced.
 *
 * A series keeps at most one backup of its values. The backup is taken by the first transform
 * committed after creation or after the last reset, and restoring it discards it. Later transforms
 * do not replace it, so a reset always returns to the state before the first of them.
 */
public class Series {

  private double[] xValues;
  private double[] yValues;
  private Snapshot backup;

  /**
   * Create a series from parallel arrays of angle and intensity values (the arrays are copied)
   *
   * @param xValues Angle values
   * @param yValues Intensity values
   */
  public Series(double[] xValues, double[] yValues) {
    if (xValues.length != yValues.length) {
      throw new IllegalArgumentException("Angle and intensity arrays differ in length: "
          + xValues.length + " vs. " + yValues.length);
    }
    this.xValues = xValues.clone();
    this.yValues = yValues.clone();
    backup = null;
  }

  /**
   * Replace the intensity values of this series, taking a backup first if none exists
   *
   * @param newY New intensity values, same length as the current values
   */
  public void applyIntensity(double[] newY) {
    if (newY.length != xValues.length) {
      throw new IllegalArgumentException("Transformed intensity has " + newY.length
          + " points but the series has " + xValues.length);
    }
    ensureBackup();
    yValues = newY.clone();
  }

  /**
   * Replace both angle and intensity values of this series (used when a transform changes the
   * number of points), taking a backup first if none exists
   *
   * @param newX New angle values
   * @param newY New intensity values, same length as newX
   */
  public void apply(double[] newX, double[] newY) {
    if (newX.length != newY.length) {
      throw new IllegalArgumentException("Angle and intensity arrays differ in length: "
          + newX.length + " vs. " + newY.length);
    }
    ensureBackup();
    xValues = newX.clone();
    yValues = newY.clone();
  }

  private void ensureBackup() {
    if (backup == null) {
      backup = new Snapshot(xValues, yValues);
    }
  }

  /**
   * Restore the values held before the first transform since the last reset and discard the
   * backup. Does nothing if no backup exists.
   *
   * @return True if a backup was restored
   */
  public boolean reset() {
    if (backup == null) {
      return false;
    }
    xValues = backup.getX();
    yValues = backup.getY();
    backup = null;
    return true;
  }

  /**
   * Get the backup taken at the first transform since the last reset, if any
   *
   * @return Backup of the untransformed values, or empty if no transform has been applied
   */
  public Optional<Snapshot> getBackup() {
    return Optional.ofNullable(backup);
  }

  /**
   * @return True if a transform has been applied since creation or the last reset
   */
  public boolean hasBackup() {
    return backup != null;
  }

  /**
   * Get a copy of the angle values
   *
   * @return Angle values in index order
   */
  public double[] getX() {
    return xValues.clone();
  }

  /**
   * Get a copy of the current intensity values
   *
   * @return Intensity values in index order
   */
  public double[] getY() {
    return yValues.clone();
  }

  public int size() {
    return xValues.length;
  }

  /**
   * Get the points of this series whose angle lies within the given range (inclusive)
   *
   * @param min Lowest angle to keep
   * @param max Highest angle to keep
   * @return Pair of arrays {x, y} for the points within range
   */
  public double[][] pointsInRange(double min, double max) {
    int count = 0;
    for (double x : xValues) {
      if (x >= min && x <= max) {
        ++count;
      }
    }
    double[] keptX = new double[count];
    double[] keptY = new double[count];
    int idx = 0;
    for (int i = 0; i < xValues.length; ++i) {
      if (xValues[i] >= min && xValues[i] <= max) {
        keptX[idx] = xValues[i];
        keptY[idx] = yValues[i];
        ++idx;
      }
    }
    return new double[][]{keptX, keptY};
  }

  /**
   * Produce plottable data for this series, with a constant offset added to each intensity
   * (used to stack traces in a plot; the stored values are not changed)
   *
   * @param name Key of the resulting series
   * @param offset Amount to add to each intensity
   * @return Series of (angle, intensity + offset) points
   */
  public XYSeries toXYSeries(String name, double offset) {
    // autosort off so that index order is kept even if angles are not monotonic
    XYSeries xys = new XYSeries(name, false);
    for (int i = 0; i < xValues.length; ++i) {
      xys.add(xValues[i], yValues[i] + offset);
    }
    return xys;
  }

  /**
   * Immutable copy of the values of a series at the moment it was taken
   */
  public static final class Snapshot {

    private final double[] xValues;
    private final double[] yValues;

    Snapshot(double[] xValues, double[] yValues) {
      this.xValues = xValues.clone();
      this.yValues = yValues.clone();
    }

    public double[] getX() {
      return xValues.clone();
    }

    public double[] getY() {
      return yValues.clone();
    }

    @Override
    public boolean equals(Object other) {
      if (this == other) {
        return true;
      }
      if (!(other instanceof Snapshot)) {
        return false;
      }
      Snapshot snapshot = (Snapshot) other;
      return Arrays.equals(xValues, snapshot.xValues) && Arrays.equals(yValues, snapshot.yValues);
    }

    @Override
    public int hashCode() {
      return 31 * Arrays.hashCode(xValues) + Arrays.hashCode(yValues);
    }
  }

}
