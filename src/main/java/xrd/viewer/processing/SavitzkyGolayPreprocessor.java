package xrd.viewer.processing;

import xrd.viewer.input.Dataset;
import xrd.viewer.utils.SmoothingUtils;

/**
 * Smooths each trace with a Savitzky-Golay filter. An even window is widened by one point.
 */
public class SavitzkyGolayPreprocessor extends Preprocessor {

  private int window;
  private int polyOrder;

  public SavitzkyGolayPreprocessor() {
    super();
    window = SmoothingUtils.DEFAULT_SAVGOL_WINDOW;
    polyOrder = SmoothingUtils.DEFAULT_SAVGOL_ORDER;
  }

  @Override
  public String getName() {
    return "Savitzky-Golay (window=" + SmoothingUtils.normalizeWindow(window)
        + ", order=" + polyOrder + ")";
  }

  @Override
  public void checkParameters() {
    SmoothingUtils.checkSavgolParameters(window, polyOrder);
  }

  @Override
  protected void backend(Dataset dataset) {
    double[] smoothed =
        SmoothingUtils.savitzkyGolay(dataset.getSeries().getY(), window, polyOrder);
    dataset.applyIntensity(getName(), smoothed);
  }

  public int getWindow() {
    return window;
  }

  public void setWindow(int window) {
    this.window = window;
  }

  public int getPolyOrder() {
    return polyOrder;
  }

  public void setPolyOrder(int polyOrder) {
    this.polyOrder = polyOrder;
  }

}
