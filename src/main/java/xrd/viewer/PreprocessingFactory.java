package xrd.viewer;

import xrd.viewer.input.Configuration;
import xrd.viewer.processing.AlsBaselinePreprocessor;
import xrd.viewer.processing.Preprocessor;
import xrd.viewer.processing.RollingBaselinePreprocessor;
import xrd.viewer.processing.SavitzkyGolayPreprocessor;
import xrd.viewer.utils.InvalidParameterException;

/**
 * Enumerated type defining each preprocessing step that can be run from a configured pipeline,
 * and creating the associated Preprocessor with its parameters read from a configuration.
 *
 * The 2θ range filter is not listed here since its bounds are chosen per session rather than
 * configured.
 */
public enum PreprocessingFactory {

  ALS_BASELINE("ALS Baseline") {
    @Override
    public Preprocessor createPreprocessor(Configuration config) {
      AlsBaselinePreprocessor als = new AlsBaselinePreprocessor();
      als.setLambda(config.getAlsLambda());
      als.setAsymmetry(config.getAlsAsymmetry());
      als.setIterations(config.getAlsIterations());
      return als;
    }
  },
  ROLLING_BASELINE("Rolling Baseline") {
    @Override
    public Preprocessor createPreprocessor(Configuration config) {
      RollingBaselinePreprocessor rolling = new RollingBaselinePreprocessor();
      rolling.setWindow(config.getRollingWindow());
      rolling.setMethod(config.getRollingMethod());
      return rolling;
    }
  },
  SAVITZKY_GOLAY("Savitzky-Golay Smoothing") {
    @Override
    public Preprocessor createPreprocessor(Configuration config) {
      SavitzkyGolayPreprocessor savgol = new SavitzkyGolayPreprocessor();
      savgol.setWindow(config.getSavgolWindow());
      savgol.setPolyOrder(config.getSavgolPolyOrder());
      return savgol;
    }
  };

  private final String name;

  PreprocessingFactory(String name) {
    this.name = name;
  }

  /**
   * Find the step with the given constant name, as listed in the configuration file
   *
   * @param stepName Name such as "ALS_BASELINE" (case-insensitive)
   * @return Matching step
   * @throws InvalidParameterException if no step has that name
   */
  public static PreprocessingFactory fromName(String stepName) {
    for (PreprocessingFactory step : values()) {
      if (step.name().equalsIgnoreCase(stepName.trim())) {
        return step;
      }
    }
    throw new InvalidParameterException("Pipeline.Steps", "Unknown preprocessing step: " + stepName);
  }

  /**
   * Create a step with its parameters taken from the given configuration
   *
   * @param config Configuration to read parameters from
   * @return New, unrun preprocessing step
   * @throws InvalidParameterException if a configured value cannot be used (i.e., an unknown
   * rolling method)
   */
  public abstract Preprocessor createPreprocessor(Configuration config);

  public String getName() {
    return name;
  }

}
