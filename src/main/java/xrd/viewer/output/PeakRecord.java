package xrd.viewer.output;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import xrd.viewer.processing.PhaseMatcher;

/**
 * One detected peak of a trace, as produced by a single peak analysis run. Records are never
 * modified; running the analysis again produces new ones.
 */
public class PeakRecord {

  private final double position;
  private final double intensity;
  private final double fwhm;
  private final Set<String> matchedPhases;
  private final Crystallinity crystallinity;

  /**
   * @param position 2θ of the local maximum
   * @param intensity Intensity at the maximum (without any display offset)
   * @param fwhm Full width at half maximum
   * @param matchedPhases Names of the phases whose reference positions lie near the peak, in
   * database order (copied)
   */
  public PeakRecord(double position, double intensity, double fwhm, Set<String> matchedPhases) {
    this.position = position;
    this.intensity = intensity;
    this.fwhm = fwhm;
    this.matchedPhases = Collections.unmodifiableSet(new LinkedHashSet<>(matchedPhases));
    crystallinity = Crystallinity.classify(fwhm);
  }

  public double getPosition() {
    return position;
  }

  public double getIntensity() {
    return intensity;
  }

  public double getFwhm() {
    return fwhm;
  }

  /**
   * @return Unmodifiable, ordered set of matched phase names, empty if none matched
   */
  public Set<String> getMatchedPhases() {
    return matchedPhases;
  }

  public boolean hasMatch() {
    return !matchedPhases.isEmpty();
  }

  public Crystallinity getCrystallinity() {
    return crystallinity;
  }

  /**
   * @return Matched names joined for display, or the no-match marker
   */
  public String getMatchDisplay() {
    return PhaseMatcher.formatMatches(matchedPhases);
  }

  @Override
  public String toString() {
    return "Peak at " + position + " (intensity " + intensity + ", FWHM " + fwhm + ", "
        + getMatchDisplay() + ", " + crystallinity.getName() + ")";
  }

}
