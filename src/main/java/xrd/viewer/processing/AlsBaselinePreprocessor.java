package xrd.viewer.processing;

import xrd.viewer.utils.BaselineUtils;

/**
 * Removes the background of each trace estimated by asymmetric least squares: a smooth curve
 * fitted with a second-difference penalty of weight lambda, where points above the curve get
 * weight p and the others 1 - p, refitted a fixed number of times.
 */
public class AlsBaselinePreprocessor extends BaselinePreprocessor {

  private double lambda;
  private double asymmetry;
  private int iterations;

  public AlsBaselinePreprocessor() {
    super();
    lambda = BaselineUtils.DEFAULT_ALS_LAMBDA;
    asymmetry = BaselineUtils.DEFAULT_ALS_ASYMMETRY;
    iterations = BaselineUtils.DEFAULT_ALS_ITERATIONS;
  }

  @Override
  public String getName() {
    return "ALS Baseline (lambda=" + lambda + ", p=" + asymmetry + ", niter=" + iterations + ")";
  }

  @Override
  public void checkParameters() {
    BaselineUtils.checkAlsParameters(lambda, asymmetry, iterations);
  }

  @Override
  protected double[] computeBaseline(double[] intensities) {
    return BaselineUtils.alsBaseline(intensities, lambda, asymmetry, iterations);
  }

  public double getLambda() {
    return lambda;
  }

  /**
   * @param lambda Smoothness penalty, positive; larger values give a stiffer background
   */
  public void setLambda(double lambda) {
    this.lambda = lambda;
  }

  public double getAsymmetry() {
    return asymmetry;
  }

  /**
   * @param asymmetry Weight p of points above the background, strictly between 0 and 1
   */
  public void setAsymmetry(double asymmetry) {
    this.asymmetry = asymmetry;
  }

  public int getIterations() {
    return iterations;
  }

  public void setIterations(int iterations) {
    this.iterations = iterations;
  }

}
