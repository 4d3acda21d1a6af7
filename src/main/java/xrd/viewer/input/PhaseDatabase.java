package xrd.viewer.input;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.log4j.Logger;

/**
 * Reference table of crystalline phases, mapping each phase name to the 2θ positions (degrees)
 * of its characteristic peaks. The table is read from a JSON object of the form
 * <code>{"Quartz": [20.86, 26.64, 50.14], ...}</code> and is read-only once loaded, so one
 * instance can be shared by any number of peak analyses. Phases keep the order they have in the
 * file.
 */
public class PhaseDatabase {

  private static final Logger logger = Logger.getLogger(PhaseDatabase.class);

  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final TypeReference<LinkedHashMap<String, List<Double>>> TABLE_TYPE =
      new TypeReference<LinkedHashMap<String, List<Double>>>() {};

  private final Map<String, List<Double>> phases;
  private final String source;

  /**
   * Create a phase database from a map of phase names to reference positions (copied)
   *
   * @param phases Map from phase name to reference 2θ positions, iterated in the order to report
   * matches in
   * @param source Description of where the data came from (i.e., filename)
   */
  public PhaseDatabase(Map<String, List<Double>> phases, String source) {
    Map<String, List<Double>> copy = new LinkedHashMap<>();
    for (Map.Entry<String, List<Double>> entry : phases.entrySet()) {
      List<Double> positions = entry.getValue() == null ?
          new ArrayList<>() : new ArrayList<>(entry.getValue());
      if (positions.contains(null)) {
        throw new IllegalArgumentException("Phase " + entry.getKey()
            + " has a reference position that is not a number");
      }
      copy.put(entry.getKey(), Collections.unmodifiableList(positions));
    }
    this.phases = Collections.unmodifiableMap(copy);
    this.source = source;
  }

  /**
   * @return Database with no phases, which matches no peaks
   */
  public static PhaseDatabase empty() {
    return new PhaseDatabase(Collections.emptyMap(), "empty");
  }

  /**
   * Read a phase database from a JSON file. A file that does not exist gives an empty database
   * rather than an error.
   *
   * @param filename Path to the JSON file
   * @return Database of the phases in the file
   * @throws IOException If the file exists but cannot be read or is not a JSON object mapping
   * names to arrays of numbers
   */
  public static PhaseDatabase load(String filename) throws IOException {
    return load(new File(filename));
  }

  /**
   * Read a phase database from a JSON file. A file that does not exist gives an empty database
   * rather than an error.
   *
   * @param file JSON file
   * @return Database of the phases in the file
   * @throws IOException If the file exists but cannot be read or is not a JSON object mapping
   * names to arrays of numbers
   */
  public static PhaseDatabase load(File file) throws IOException {
    if (!file.exists()) {
      logger.warn("Phase database " + file.getAbsolutePath()
          + " not found, peaks will not be matched to phases");
      return empty();
    }
    Map<String, List<Double>> table = MAPPER.readValue(file, TABLE_TYPE);
    PhaseDatabase database = fromTable(table, file.getName());
    logger.info("Loaded " + database.size() + " phases from " + file.getAbsolutePath());
    return database;
  }

  /**
   * Read a phase database from a JSON stream (i.e., a resource on the classpath)
   *
   * @param stream Stream of JSON text
   * @param source Description of the stream for messages
   * @return Database of the phases in the stream
   * @throws IOException If the stream is not a JSON object mapping names to arrays of numbers
   */
  public static PhaseDatabase load(InputStream stream, String source) throws IOException {
    Map<String, List<Double>> table = MAPPER.readValue(stream, TABLE_TYPE);
    return fromTable(table, source);
  }

  private static PhaseDatabase fromTable(Map<String, List<Double>> table, String source)
      throws IOException {
    if (table == null) {
      throw new IOException("Phase database " + source + " is empty JSON (null)");
    }
    try {
      return new PhaseDatabase(table, source);
    } catch (IllegalArgumentException e) {
      throw new IOException("Phase database " + source + " is malformed: " + e.getMessage(), e);
    }
  }

  /**
   * Get the phase names in the order matches are reported in
   *
   * @return Unmodifiable, ordered set of phase names
   */
  public Set<String> getPhaseNames() {
    return phases.keySet();
  }

  /**
   * Get the reference positions of a phase
   *
   * @param phase Name of phase
   * @return Reference 2θ positions, or an empty list if the phase is not in the database
   */
  public List<Double> getReferencePositions(String phase) {
    List<Double> positions = phases.get(phase);
    return positions == null ? Collections.emptyList() : positions;
  }

  /**
   * @return Unmodifiable view of the whole table, in file order
   */
  public Map<String, List<Double>> asMap() {
    return phases;
  }

  public int size() {
    return phases.size();
  }

  public boolean isEmpty() {
    return phases.isEmpty();
  }

  /**
   * @return Description of where this database was read from
   */
  public String getSource() {
    return source;
  }

}
