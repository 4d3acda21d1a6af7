package xrd.viewer.input;

import java.awt.Color;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import org.jfree.data.xy.XYSeries;

/**
 * A named trace held in a session, along with the display attributes of its plot: a color and a
 * vertical offset used to stack traces. The offset only affects display data; stored intensities,
 * and so peak detection and all preprocessing, never include it.
 */
public class Dataset {

  /**
   * Color given to datasets that are added without one
   */
  public static final Color DEFAULT_COLOR = new Color(0x1f, 0x77, 0xb4);

  private final String name;
  private final Series series;
  private double offset;
  private Color color;
  private final List<String> history;
  private Series background;

  Dataset(String name, Series series, double offset, Color color) {
    this.name = name;
    this.series = series;
    this.offset = offset;
    this.color = color == null ? DEFAULT_COLOR : color;
    history = new ArrayList<>();
  }

  public String getName() {
    return name;
  }

  public Series getSeries() {
    return series;
  }

  public double getOffset() {
    return offset;
  }

  public void setOffset(double offset) {
    this.offset = offset;
  }

  public Color getColor() {
    return color;
  }

  public void setColor(Color color) {
    this.color = color == null ? DEFAULT_COLOR : color;
  }

  /**
   * Get the names of the transforms applied to this dataset since it was loaded or last reset,
   * in the order they were applied
   *
   * @return Unmodifiable list of transform names
   */
  public List<String> getHistory() {
    return Collections.unmodifiableList(history);
  }

  /**
   * Replace the intensity values of this dataset with the result of a transform
   *
   * @param transformName Name of the transform, recorded in the history
   * @param newY Transformed intensities, same length as the current data
   */
  public void applyIntensity(String transformName, double[] newY) {
    series.applyIntensity(newY);
    history.add(transformName);
  }

  /**
   * Replace the angle and intensity values of this dataset with the result of a transform that
   * changes the number of points
   *
   * @param transformName Name of the transform, recorded in the history
   * @param newX Transformed angles
   * @param newY Transformed intensities, same length as newX
   */
  public void apply(String transformName, double[] newX, double[] newY) {
    series.apply(newX, newY);
    history.add(transformName);
  }

  /**
   * Restore the data held before the first transform since the last reset
   *
   * @return True if there was anything to restore
   */
  boolean reset() {
    history.clear();
    background = null;
    return series.reset();
  }

  /**
   * Keep the background most recently removed from this dataset by a baseline correction, for
   * display alongside the trace
   *
   * @param x Angles the background was computed at
   * @param baseline Background intensities
   */
  public void setBackground(double[] x, double[] baseline) {
    background = new Series(x, baseline);
  }

  /**
   * Get the display curve of the last removed background, with this dataset's offset applied.
   * There is none before a baseline correction or after a reset.
   *
   * @return Series keyed "Background " followed by the dataset name, if a baseline was removed
   */
  public Optional<XYSeries> getBackground() {
    if (background == null) {
      return Optional.empty();
    }
    return Optional.of(background.toXYSeries("Background " + name, offset));
  }

  /**
   * Get the display curve of this dataset, with its offset applied
   *
   * @return Plottable series keyed by dataset name
   */
  public XYSeries toXYSeries() {
    return series.toXYSeries(name, offset);
  }

}
