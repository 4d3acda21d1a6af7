package xrd.viewer.input;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.configuration.ConfigurationException;
import org.apache.commons.configuration.XMLConfiguration;
import org.apache.log4j.Logger;
import xrd.viewer.utils.BaselineUtils;
import xrd.viewer.utils.PeakUtils;
import xrd.viewer.utils.RollingMethod;
import xrd.viewer.utils.SmoothingUtils;

/**
 * Configuration file including the default parameters of each preprocessing step, the location
 * of the phase reference database, the folders data is loaded from and reports are written to,
 * and the list of steps the headless driver runs.
 * Values missing from the file keep their built-in defaults; parameter ranges are checked by the
 * processing steps when they run, not here.
 */
public class Configuration {

  private static Configuration instance;

  private static final String DEFAULT_CONFIG_PATH = "xrd-viewer-config.xml";
  private static final Logger logger = Logger.getLogger(Configuration.class);

  private String loadedConfigPath = DEFAULT_CONFIG_PATH;

  private String defaultDataFolder = "data";
  private String defaultOutputFolder = System.getProperty("user.home");
  private String phaseDatabasePath = "pdf_cards.json";

  private double alsLambda = BaselineUtils.DEFAULT_ALS_LAMBDA;
  private double alsAsymmetry = BaselineUtils.DEFAULT_ALS_ASYMMETRY;
  private int alsIterations = BaselineUtils.DEFAULT_ALS_ITERATIONS;

  private int rollingWindow = BaselineUtils.DEFAULT_ROLLING_WINDOW;
  private String rollingMethod = RollingMethod.MIN.getName();

  private int savgolWindow = SmoothingUtils.DEFAULT_SAVGOL_WINDOW;
  private int savgolPolyOrder = SmoothingUtils.DEFAULT_SAVGOL_ORDER;

  private double peakMinHeightFraction = PeakUtils.DEFAULT_MIN_HEIGHT_FRACTION;

  private List<String> pipelineSteps = new ArrayList<>();

  /**
   * Read in a configuration from the given XML file. If the file cannot be read, an error is
   * logged and all values keep their defaults.
   *
   * @param configLocation Path to XML file
   */
  public Configuration(String configLocation) {
    pipelineSteps.add("ALS_BASELINE");
    logger.info("Attempting reading in config file from " + configLocation);
    try {
      XMLConfiguration config = new XMLConfiguration(configLocation);

      String defaultDataFolderParam = config.getString("LocalPaths.DataPath");
      if (defaultDataFolderParam != null) {
        defaultDataFolder = defaultDataFolderParam;
      }
      String defaultOutputFolderParam = config.getString("LocalPaths.ReportPath");
      if (defaultOutputFolderParam != null) {
        defaultOutputFolder = defaultOutputFolderParam;
      }
      String phaseDatabaseParam = config.getString("PhaseDatabase.Path");
      if (phaseDatabaseParam != null) {
        phaseDatabasePath = phaseDatabaseParam;
      }

      alsLambda = config.getDouble("ALS.Lambda", alsLambda);
      alsAsymmetry = config.getDouble("ALS.Asymmetry", alsAsymmetry);
      alsIterations = config.getInt("ALS.Iterations", alsIterations);

      rollingWindow = config.getInt("Rolling.Window", rollingWindow);
      String rollingMethodParam = config.getString("Rolling.Method");
      if (rollingMethodParam != null) {
        rollingMethod = rollingMethodParam;
      }

      savgolWindow = config.getInt("SavitzkyGolay.Window", savgolWindow);
      savgolPolyOrder = config.getInt("SavitzkyGolay.PolyOrder", savgolPolyOrder);

      peakMinHeightFraction = config.getDouble("Peaks.MinHeightFraction", peakMinHeightFraction);

      if (config.containsKey("Pipeline.Steps")) {
        pipelineSteps = new ArrayList<>();
        for (String step : config.getStringArray("Pipeline.Steps")) {
          if (!step.trim().isEmpty()) {
            pipelineSteps.add(step.trim());
          }
        }
      }

      try {
        loadedConfigPath = config.getFile().getCanonicalPath();
        logger.info("Successfully loaded in configuration: " + loadedConfigPath);
      } catch (IOException e) {
        logger.warn("Could not resolve canonical path of " + configLocation, e);
        loadedConfigPath = configLocation;
      }
    } catch (ConfigurationException e) {
      logger.error("Error encountered while reading XML file, load failed, using defaults", e);
    }
  }

  private static boolean copyEmbedXML(String pathToPlaceFile) {
    File fileOut = new File(pathToPlaceFile);
    try (InputStream stream =
        Configuration.class.getClassLoader().getResourceAsStream(DEFAULT_CONFIG_PATH)) {
      if (stream == null) {
        logger.error("Major error: config XML file not part of resources!!");
        return false;
      }
      logger.info("Copying over embedded jar file to absolute path " + fileOut.getAbsolutePath());
      Files.copy(stream, fileOut.toPath());
      return true;
    } catch (IOException e) {
      logger.warn("Could not copy over the file...", e);
    }
    return false;
  }

  /**
   * Gets the current instance of the configuration, or creates one if none exists
   * @return the current configuration instance
   */
  synchronized public static Configuration getInstance() {
    return getInstance(System.getProperty("user.dir") + File.separator + DEFAULT_CONFIG_PATH);
  }

  /**
   * Gets the current instance of the configuration, or creates one from a specified file if none
   * exists. If the file does not exist, the embedded default configuration is written there
   * first (falling back to the user's home directory if that location is not writable).
   * @param configLocation New configuration file location to read from
   * @return the current configuration instance
   */
  synchronized public static Configuration getInstance(String configLocation) {
    if (instance == null) {
      File config = new File(configLocation);
      if (!config.exists()) {
        boolean success = copyEmbedXML(configLocation);
        if (!success) {
          logger.warn("Could not find or write to specified config location: " + configLocation);
          logger.warn("Will attempt to initialize config file at user home directory.");
          configLocation = System.getProperty("user.home") + File.separator + DEFAULT_CONFIG_PATH;
          config = new File(configLocation);
          if (!config.exists()) {
            success = copyEmbedXML(configLocation);
            if (!success) {
              logger.warn("Could not find or write to user home directory either!");
            }
          }
        }
      }
      instance = new Configuration(configLocation);
    }
    return instance;
  }

  /**
   * Gets the default data folder. If none was specified in the XML file, the default is the 'data'
   * subdirectory under the current working directory.
   *
   * The property is defined from Configuration.LocalPaths.DataPath
   * @return The folder to start looking for trace files from.
   */
  public String getDefaultDataFolder() {
    return defaultDataFolder;
  }

  /**
   * Set the starting directory for trace file loading; ignored if the folder cannot be read.
   * @param replacement Path (relative or absolute) to the folder where data is kept.
   */
  public void setDefaultDataFolder(String replacement) {
    File folder = new File(replacement);
    if (folder.exists() && folder.canRead()) {
      defaultDataFolder = replacement;
    }
  }

  /**
   * Gets the default folder reports (peak tables and PDFs) are written to. If none was specified
   * in the XML file, this is the user's home directory.
   *
   * The property is defined from Configuration.LocalPaths.ReportPath
   * @return Folder to write reports to
   */
  public String getDefaultOutputFolder() {
    return defaultOutputFolder;
  }

  public void setDefaultOutputFolder(String replacement) {
    defaultOutputFolder = replacement;
  }

  /**
   * Gets the path of the JSON phase reference database.
   *
   * The property is defined from Configuration.PhaseDatabase.Path
   * @return Path to phase database, which may not exist
   */
  public String getPhaseDatabasePath() {
    return phaseDatabasePath;
  }

  public void setPhaseDatabasePath(String phaseDatabasePath) {
    this.phaseDatabasePath = phaseDatabasePath;
  }

  public double getAlsLambda() {
    return alsLambda;
  }

  public void setAlsLambda(double alsLambda) {
    this.alsLambda = alsLambda;
  }

  public double getAlsAsymmetry() {
    return alsAsymmetry;
  }

  public void setAlsAsymmetry(double alsAsymmetry) {
    this.alsAsymmetry = alsAsymmetry;
  }

  public int getAlsIterations() {
    return alsIterations;
  }

  public void setAlsIterations(int alsIterations) {
    this.alsIterations = alsIterations;
  }

  public int getRollingWindow() {
    return rollingWindow;
  }

  public void setRollingWindow(int rollingWindow) {
    this.rollingWindow = rollingWindow;
  }

  /**
   * Gets the configured rolling baseline method name ("Min" or "Median")
   * @return method name as given in the configuration
   */
  public String getRollingMethod() {
    return rollingMethod;
  }

  public void setRollingMethod(String rollingMethod) {
    this.rollingMethod = rollingMethod;
  }

  public int getSavgolWindow() {
    return savgolWindow;
  }

  public void setSavgolWindow(int savgolWindow) {
    this.savgolWindow = savgolWindow;
  }

  public int getSavgolPolyOrder() {
    return savgolPolyOrder;
  }

  public void setSavgolPolyOrder(int savgolPolyOrder) {
    this.savgolPolyOrder = savgolPolyOrder;
  }

  public double getPeakMinHeightFraction() {
    return peakMinHeightFraction;
  }

  public void setPeakMinHeightFraction(double peakMinHeightFraction) {
    this.peakMinHeightFraction = peakMinHeightFraction;
  }

  /**
   * Gets the names of the preprocessing steps run, in order, on every dataset by the headless
   * driver (values of xrd.viewer.PreprocessingFactory).
   *
   * The property is defined from Configuration.Pipeline.Steps
   * @return Step names, possibly empty
   */
  public List<String> getPipelineSteps() {
    return new ArrayList<>(pipelineSteps);
  }

  public void setPipelineSteps(List<String> pipelineSteps) {
    this.pipelineSteps = new ArrayList<>(pipelineSteps);
  }

  /**
   * @return Path of the file this configuration was read from
   */
  public String getLoadedConfigPath() {
    return loadedConfigPath;
  }

  /**
   * Write the current values back to the file this configuration was loaded from.
   */
  public void saveCurrentConfig() {
    XMLConfiguration config;
    try {
      config = new XMLConfiguration(loadedConfigPath);

      config.setProperty("LocalPaths.DataPath", defaultDataFolder);
      config.setProperty("LocalPaths.ReportPath", defaultOutputFolder);
      config.setProperty("PhaseDatabase.Path", phaseDatabasePath);
      config.setProperty("ALS.Lambda", alsLambda);
      config.setProperty("ALS.Asymmetry", alsAsymmetry);
      config.setProperty("ALS.Iterations", alsIterations);
      config.setProperty("Rolling.Window", rollingWindow);
      config.setProperty("Rolling.Method", rollingMethod);
      config.setProperty("SavitzkyGolay.Window", savgolWindow);
      config.setProperty("SavitzkyGolay.PolyOrder", savgolPolyOrder);
      config.setProperty("Peaks.MinHeightFraction", peakMinHeightFraction);
      config.setProperty("Pipeline.Steps", String.join(",", pipelineSteps));

      config.save();
    } catch (ConfigurationException e) {
      logger.error(e);
    }
  }

}
