package xrd.viewer.output;

/**
 * Coarse sharpness class of a diffraction peak, derived only from its full width at half maximum
 * (degrees 2θ). Thresholds are half-open: a width equal to a threshold falls in the broader class.
 */
public enum Crystallinity {

  HIGHLY("Highly Crystalline"),
  MODERATELY("Moderately Crystalline"),
  POORLY("Poorly Crystalline");

  /**
   * Widths below this are highly crystalline
   */
  public static final double HIGHLY_MAX_FWHM = 0.2;

  /**
   * Widths below this (and at least HIGHLY_MAX_FWHM) are moderately crystalline
   */
  public static final double MODERATELY_MAX_FWHM = 0.5;

  private final String name;

  Crystallinity(String name) {
    this.name = name;
  }

  public String getName() {
    return name;
  }

  /**
   * Classify a peak by its width
   *
   * @param fwhm Full width at half maximum of the peak
   * @return HIGHLY below 0.2, MODERATELY from 0.2 up to but not including 0.5, POORLY otherwise
   */
  public static Crystallinity classify(double fwhm) {
    if (fwhm < HIGHLY_MAX_FWHM) {
      return HIGHLY;
    }
    if (fwhm < MODERATELY_MAX_FWHM) {
      return MODERATELY;
    }
    return POORLY;
  }

  @Override
  public String toString() {
    return name;
  }

}
