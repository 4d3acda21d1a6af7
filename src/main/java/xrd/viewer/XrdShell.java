package xrd.viewer;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.log4j.Logger;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.jfree.chart.ChartFactory;
import org.jfree.chart.JFreeChart;
import org.jfree.data.xy.XYSeriesCollection;
import xrd.viewer.input.Configuration;
import xrd.viewer.input.Dataset;
import xrd.viewer.input.DatasetStore;
import xrd.viewer.input.PhaseDatabase;
import xrd.viewer.input.Scope;
import xrd.viewer.input.Series;
import xrd.viewer.output.PeakRecord;
import xrd.viewer.processing.BatchResult;
import xrd.viewer.processing.PeakAnalysis;
import xrd.viewer.utils.ReportingUtils;
import xrd.viewer.utils.SeriesFormatException;
import xrd.viewer.utils.SeriesUtils;

/**
 * Runs the processing chain without a display: loads trace files, applies the configured
 * preprocessing steps to all of them, finds and matches their peaks, and writes one peak table
 * per trace plus a single PDF report.
 *
 * Usage: <code>XrdShell [-c config.xml] [-o outputFolder] [--no-plots] trace...</code>
 */
public class XrdShell {

  private static final Logger logger = Logger.getLogger(XrdShell.class);

  public static final String REPORT_FILENAME = "xrd-report.pdf";
  public static final String PEAK_TABLE_SUFFIX = "_peaks.csv";

  private static final int PLOT_WIDTH = 640;
  private static final int PLOT_HEIGHT = 480;

  private final Configuration config;
  private final DatasetStore store;
  private final PhaseDatabase database;
  private final List<BatchResult> batchResults;
  private final Map<String, String> analyses;
  private final Map<String, List<PeakRecord>> peakTables;
  private final Map<String, XYSeriesCollection> plotData;

  /**
   * @param config Configuration giving the pipeline, step parameters and phase database location
   * @throws IOException If the phase database exists but cannot be read
   */
  public XrdShell(Configuration config) throws IOException {
    this(config, PhaseDatabase.load(config.getPhaseDatabasePath()));
  }

  /**
   * @param config Configuration giving the pipeline and step parameters
   * @param database Phases to match peaks against
   */
  public XrdShell(Configuration config, PhaseDatabase database) {
    this.config = config;
    this.database = database;
    store = new DatasetStore();
    batchResults = new ArrayList<>();
    analyses = new LinkedHashMap<>();
    peakTables = new LinkedHashMap<>();
    plotData = new LinkedHashMap<>();
  }

  public DatasetStore getStore() {
    return store;
  }

  /**
   * Load trace files into the session, each named after its file
   *
   * @param paths Paths of two-column trace files
   * @return Datasets created, in the order of the paths
   * @throws IOException If a file cannot be read
   * @throws SeriesFormatException If a file is not a valid trace
   */
  public List<Dataset> loadTraces(List<String> paths) throws IOException, SeriesFormatException {
    List<Dataset> loaded = new ArrayList<>();
    for (String path : paths) {
      Series series = SeriesUtils.readSeries(path);
      loaded.add(store.addDataset(SeriesUtils.datasetNameFor(path), series));
    }
    return loaded;
  }

  /**
   * Apply each configured preprocessing step, in order, to all loaded datasets
   *
   * @return Outcome of each step
   * @throws xrd.viewer.utils.InvalidParameterException if a step name or parameter is not valid
   */
  public List<BatchResult> runPipeline() {
    List<PreprocessingFactory> steps = new ArrayList<>();
    for (String stepName : config.getPipelineSteps()) {
      steps.add(PreprocessingFactory.fromName(stepName));
    }
    for (PreprocessingFactory step : steps) {
      BatchResult result = step.createPreprocessor(config).runOnData(store, Scope.allDatasets());
      logger.info(result);
      batchResults.add(result);
    }
    return Collections.unmodifiableList(batchResults);
  }

  /**
   * Find the peaks of every loaded dataset
   *
   * @return Map from dataset name to its peaks, in the order datasets were added
   */
  public Map<String, List<PeakRecord>> analyzeAll() {
    PeakAnalysis analysis = new PeakAnalysis(database);
    analysis.setMinHeightFraction(config.getPeakMinHeightFraction());
    peakTables.clear();
    analyses.clear();
    plotData.clear();
    for (Dataset dataset : store.getDatasets()) {
      peakTables.put(dataset.getName(), analysis.runOnDataset(dataset));
      analyses.put(dataset.getName(), analysis.getReportString());
      plotData.put(dataset.getName(), analysis.getData());
    }
    return Collections.unmodifiableMap(peakTables);
  }

  /**
   * Write a peak table for each analysed dataset and a PDF report of all of them
   *
   * @param folder Folder to write into, created if needed
   * @param includePlots True to add a plot of each trace and its peaks to the report
   * @return The report file
   * @throws IOException If the folder or any file cannot be written
   */
  public File writeReports(File folder, boolean includePlots) throws IOException {
    if (!folder.exists() && !folder.mkdirs()) {
      throw new IOException("Could not create output folder " + folder.getAbsolutePath());
    }
    for (Map.Entry<String, List<PeakRecord>> table : peakTables.entrySet()) {
      File csv = new File(folder, toFilename(table.getKey()) + PEAK_TABLE_SUFFIX);
      ReportingUtils.writePeakTable(csv, table.getValue());
    }

    File report = new File(folder, REPORT_FILENAME);
    try (PDDocument pdf = new PDDocument()) {
      ReportingUtils.textToPDFPage(getSummary(), pdf);
      for (Map.Entry<String, String> analysis : analyses.entrySet()) {
        if (includePlots) {
          ReportingUtils.chartsToPDFPage(PLOT_WIDTH, PLOT_HEIGHT, pdf,
              createChart(analysis.getKey()));
        }
        ReportingUtils.textToPDFPage(analysis.getValue(), pdf);
      }
      pdf.save(report);
    }
    logger.info("Wrote report to " + report.getAbsolutePath());
    return report;
  }

  private JFreeChart createChart(String datasetName) {
    return ChartFactory.createXYLineChart(datasetName, "2θ (degrees)", "Intensity",
        plotData.get(datasetName));
  }

  /**
   * @return Text listing the loaded datasets, the phase database, and the outcome of each step
   */
  public String getSummary() {
    StringBuilder sb = new StringBuilder();
    sb.append("XRD peak report\n");
    sb.append("Configuration: ").append(config.getLoadedConfigPath()).append('\n');
    sb.append("Phase database: ").append(database.getSource())
        .append(" (").append(database.size()).append(" phases)\n");
    sb.append("Datasets: ").append(String.join(", ", store.getNames())).append("\n\n");
    for (BatchResult result : batchResults) {
      sb.append(result).append('\n');
    }
    return sb.toString();
  }

  /**
   * Turn a dataset name into a safe file name
   *
   * @param name Dataset name
   * @return Name with characters other than letters, digits, '.', '-' and '_' replaced
   */
  static String toFilename(String name) {
    return name.replaceAll("[^A-Za-z0-9._-]", "_");
  }

  /**
   * Load, process and report on traces in one call
   *
   * @param paths Paths of trace files
   * @param outputFolder Folder to write results into
   * @param includePlots True to add plots to the report
   * @return The report file
   * @throws IOException If a file cannot be read or written
   * @throws SeriesFormatException If a trace file is not valid
   */
  public File run(List<String> paths, File outputFolder, boolean includePlots)
      throws IOException, SeriesFormatException {
    loadTraces(paths);
    runPipeline();
    analyzeAll();
    return writeReports(outputFolder, includePlots);
  }

  public static void main(String[] args) {
    String configPath = null;
    String outputPath = null;
    boolean includePlots = true;
    List<String> paths = new ArrayList<>();
    for (int i = 0; i < args.length; ++i) {
      if (args[i].equals("-o") && i + 1 < args.length) {
        outputPath = args[++i];
      } else if (args[i].equals("-c") && i + 1 < args.length) {
        configPath = args[++i];
      } else if (args[i].equals("--no-plots")) {
        includePlots = false;
      } else {
        paths.add(args[i]);
      }
    }
    if (paths.isEmpty()) {
      System.err.println(
          "Usage: XrdShell [-c config.xml] [-o outputFolder] [--no-plots] trace...");
      System.exit(2);
    }

    Configuration config =
        configPath == null ? Configuration.getInstance() : Configuration.getInstance(configPath);
    if (outputPath == null) {
      outputPath = config.getDefaultOutputFolder();
    }
    try {
      XrdShell shell = new XrdShell(config);
      File report = shell.run(paths, new File(outputPath), includePlots);
      System.out.println("Report written to " + report.getAbsolutePath());
    } catch (IOException | SeriesFormatException | RuntimeException e) {
      logger.error("Processing failed", e);
      System.exit(1);
    }
  }

}
