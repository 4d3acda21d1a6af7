package xrd.viewer.processing;

import java.text.DecimalFormat;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.apache.log4j.Logger;
import org.jfree.data.xy.XYSeries;
import org.jfree.data.xy.XYSeriesCollection;
import xrd.viewer.input.Dataset;
import xrd.viewer.input.PhaseDatabase;
import xrd.viewer.input.Series;
import xrd.viewer.output.PeakRecord;
import xrd.viewer.utils.NumericUtils;
import xrd.viewer.utils.PeakUtils;

/**
 * Finds the diffraction peaks of a single trace and describes each by its position, intensity,
 * width at half maximum, matching reference phases and crystallinity class.
 *
 * Like the preprocessing steps, set the parameters first and then run the analysis on a dataset.
 * Peaks are only reported at or above a minimum height, by default a fraction of the trace's
 * largest intensity; an absolute height may be set instead. The analysis reads the stored
 * intensities, so a dataset's display offset never affects which peaks are found.
 */
public class PeakAnalysis {

  private static final Logger logger = Logger.getLogger(PeakAnalysis.class);

  private final PhaseMatcher matcher;
  private double minHeightFraction;
  private double minHeight;
  private boolean useAbsoluteHeight;

  private String datasetName;
  private List<String> history;
  private List<PeakRecord> peaks;
  private XYSeriesCollection xySeriesData;

  /**
   * @param database Reference phases peaks are matched against (shared, not modified)
   */
  public PeakAnalysis(PhaseDatabase database) {
    matcher = new PhaseMatcher(database);
    minHeightFraction = PeakUtils.DEFAULT_MIN_HEIGHT_FRACTION;
    useAbsoluteHeight = false;
    datasetName = "";
    history = new ArrayList<>();
    peaks = new ArrayList<>();
    xySeriesData = new XYSeriesCollection();
  }

  /**
   * Set the minimum peak height as a fraction of the trace maximum, replacing any absolute height
   *
   * @param fraction Non-negative fraction of the largest intensity
   * @throws xrd.viewer.utils.InvalidParameterException if the fraction is negative or not finite
   */
  public void setMinHeightFraction(double fraction) {
    PeakUtils.checkMinHeightFraction(fraction);
    minHeightFraction = fraction;
    useAbsoluteHeight = false;
  }

  public double getMinHeightFraction() {
    return minHeightFraction;
  }

  /**
   * Set an absolute minimum peak height, used instead of the fraction of the maximum
   *
   * @param height Smallest intensity a reported peak may have
   */
  public void setMinHeight(double height) {
    minHeight = height;
    useAbsoluteHeight = true;
  }

  /**
   * Get the minimum height peaks of the given intensities must reach with the current settings
   *
   * @param intensities Intensity values of a trace
   * @return Absolute height if one was set, otherwise the fraction of the maximum intensity
   */
  public double getMinHeightFor(double[] intensities) {
    if (useAbsoluteHeight) {
      return minHeight;
    }
    return PeakUtils.minHeightFromFraction(intensities, minHeightFraction);
  }

  public PhaseMatcher getMatcher() {
    return matcher;
  }

  /**
   * Find and describe the peaks of a dataset's current data
   *
   * @param dataset Dataset to analyse; it is not changed
   * @return Peak records in order of increasing index
   */
  public List<PeakRecord> runOnDataset(Dataset dataset) {
    Series series = dataset.getSeries();
    double[] x = series.getX();
    double[] y = series.getY();
    double threshold = getMinHeightFor(y);

    List<Integer> indices = PeakUtils.detectPeaks(y, threshold);
    double[] widths = PeakUtils.fwhm(x, y, indices);

    List<PeakRecord> records = new ArrayList<>();
    XYSeries peakMarkers = new XYSeries("Peaks", false);
    for (int i = 0; i < indices.size(); ++i) {
      int idx = indices.get(i);
      records.add(new PeakRecord(x[idx], y[idx], widths[i], matcher.match(x[idx])));
      peakMarkers.add(x[idx], y[idx] + dataset.getOffset());
    }

    datasetName = dataset.getName();
    history = new ArrayList<>(dataset.getHistory());
    peaks = Collections.unmodifiableList(records);
    xySeriesData = new XYSeriesCollection();
    xySeriesData.addSeries(dataset.toXYSeries());
    xySeriesData.addSeries(peakMarkers);
    dataset.getBackground().ifPresent(xySeriesData::addSeries);

    logger.info("Found " + records.size() + " peaks in " + datasetName
        + " at minimum height " + threshold);
    return peaks;
  }

  /**
   * @return Peaks found by the last run, or an empty list if none has been done
   */
  public List<PeakRecord> getPeaks() {
    return peaks;
  }

  /**
   * Return the plottable data of the last run: the trace, the detected peaks (series "Peaks") and,
   * if a baseline was removed, the background, all with the dataset's display offset
   *
   * @return Plottable data
   */
  public XYSeriesCollection getData() {
    return xySeriesData;
  }

  /**
   * @return Name of the dataset analysed by the last run
   */
  public String getDatasetName() {
    return datasetName;
  }

  /**
   * Produce the peak table of the last run as text, headed by the dataset name and the
   * preprocessing steps applied to it
   *
   * @return String containing human-readable data
   */
  public String getReportString() {
    StringBuilder sb = new StringBuilder();
    sb.append("Dataset: ").append(datasetName).append('\n');
    if (history.isEmpty()) {
      sb.append("Processing: none (raw data)\n");
    } else {
      sb.append("Processing: ").append(String.join(" > ", history)).append('\n');
    }
    sb.append("Phase database: ").append(matcher.getDatabase().getSource()).append('\n');
    sb.append('\n');
    sb.append(formatPeakTable(peaks));
    return sb.toString();
  }

  /**
   * Format peaks as a text table, one line per peak
   *
   * @param peaks Peaks to list
   * @return Table with a header line, or a note that no peaks were found
   */
  public static String formatPeakTable(List<PeakRecord> peaks) {
    if (peaks.isEmpty()) {
      return "No peaks found.\n";
    }
    DecimalFormat df = NumericUtils.DECIMAL_FORMAT.get();
    StringBuilder sb = new StringBuilder();
    sb.append(String.format("%-10s %-12s %-8s %-24s %s%n",
        "2θ", "Intensity", "FWHM", "PDF Match", "Crystallinity"));
    for (PeakRecord peak : peaks) {
      sb.append(String.format("%-10s %-12s %-8s %-24s %s%n",
          df.format(peak.getPosition()),
          df.format(peak.getIntensity()),
          df.format(peak.getFwhm()),
          peak.getMatchDisplay(),
          peak.getCrystallinity().getName()));
    }
    return sb.toString();
  }

}
