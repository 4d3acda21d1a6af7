package xrd.viewer.processing;

import xrd.viewer.utils.BaselineUtils;
import xrd.viewer.utils.RollingMethod;

/**
 * Removes a background taken as the minimum or median of a centered window around each point,
 * clipped at the ends of the trace.
 */
public class RollingBaselinePreprocessor extends BaselinePreprocessor {

  private int window;
  private RollingMethod method;

  public RollingBaselinePreprocessor() {
    super();
    window = BaselineUtils.DEFAULT_ROLLING_WINDOW;
    method = RollingMethod.MIN;
  }

  @Override
  public String getName() {
    String methodName = method == null ? "?" : method.getName();
    return "Rolling Baseline (window=" + window + ", " + methodName + ")";
  }

  @Override
  public void checkParameters() {
    BaselineUtils.checkRollingParameters(window, method);
  }

  @Override
  protected double[] computeBaseline(double[] intensities) {
    return BaselineUtils.rollingBaseline(intensities, window, method);
  }

  public int getWindow() {
    return window;
  }

  public void setWindow(int window) {
    this.window = window;
  }

  public RollingMethod getMethod() {
    return method;
  }

  public void setMethod(RollingMethod method) {
    this.method = method;
  }

  /**
   * Set the method by name, as given in the configuration file
   *
   * @param methodName "Min" or "Median" (case-insensitive)
   * @throws xrd.viewer.utils.InvalidParameterException if the name is not a known method
   */
  public void setMethod(String methodName) {
    this.method = RollingMethod.fromName(methodName);
  }

}
