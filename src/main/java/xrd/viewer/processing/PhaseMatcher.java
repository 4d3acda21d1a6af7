package xrd.viewer.processing;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import xrd.viewer.input.PhaseDatabase;

/**
 * Matches peak positions against the reference positions of a phase database. A phase matches a
 * peak if any of its reference positions is within {@link #TOLERANCE} degrees 2θ of the peak.
 * The database is only read, so a matcher may be shared freely.
 */
public class PhaseMatcher {

  /**
   * Largest distance (degrees 2θ) between a peak and a reference position that counts as a match
   */
  public static final double TOLERANCE = 0.3;

  /**
   * Displayed in place of phase names when a peak matches nothing
   */
  public static final String NO_MATCH = "-";

  private final PhaseDatabase database;

  public PhaseMatcher(PhaseDatabase database) {
    this.database = database;
  }

  public PhaseDatabase getDatabase() {
    return database;
  }

  /**
   * Get the phases matching a peak position
   *
   * @param position 2θ of the peak
   * @return Names of the matching phases in database order, without duplicates; empty if none
   */
  public Set<String> match(double position) {
    Set<String> matches = new LinkedHashSet<>();
    for (Map.Entry<String, List<Double>> phase : database.asMap().entrySet()) {
      for (double reference : phase.getValue()) {
        if (Math.abs(position - reference) <= TOLERANCE) {
          matches.add(phase.getKey());
          break;
        }
      }
    }
    return matches;
  }

  /**
   * Join phase names for display
   *
   * @param matches Phase names in the order to show them
   * @return Names separated by ", ", or {@link #NO_MATCH} if there are none
   */
  public static String formatMatches(Collection<String> matches) {
    if (matches.isEmpty()) {
      return NO_MATCH;
    }
    return String.join(", ", matches);
  }

}
