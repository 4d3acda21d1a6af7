package xrd.viewer.input;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.Test;
import xrd.viewer.test.TestUtils;

public class PhaseDatabaseTest {

  private static InputStream json(String text) {
    return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
  }

  @Test
  public void load_keepsFileOrder() throws IOException {
    PhaseDatabase database = PhaseDatabase.load(TestUtils.PHASE_LOCATION + "test_cards.json");
    assertEquals(Arrays.asList("Quartz", "Calcite", "Halite", "Cristobalite"),
        Arrays.asList(database.getPhaseNames().toArray()));
    assertEquals(4, database.size());
    assertEquals(Arrays.asList(20.86, 26.6, 36.54, 50.1),
        database.getReferencePositions("Quartz"));
    assertEquals("test_cards.json", database.getSource());
  }

  @Test
  public void load_missingFile_givesEmptyDatabase() throws IOException {
    PhaseDatabase database = PhaseDatabase.load(TestUtils.PHASE_LOCATION + "no_such_file.json");
    assertTrue(database.isEmpty());
  }

  @Test(expected = IOException.class)
  public void load_stringInsteadOfArray_rejected() throws IOException {
    PhaseDatabase.load(TestUtils.PHASE_LOCATION + "malformed.json");
  }

  @Test(expected = IOException.class)
  public void load_nullPosition_rejected() throws IOException {
    PhaseDatabase.load(json("{\"Quartz\": [26.6, null]}"), "inline");
  }

  @Test(expected = IOException.class)
  public void load_jsonNull_rejected() throws IOException {
    PhaseDatabase.load(json("null"), "inline");
  }

  @Test
  public void load_fromClasspathResource() throws IOException {
    try (InputStream stream = getClass().getResourceAsStream("/phases/test_cards.json")) {
      PhaseDatabase database = PhaseDatabase.load(stream, "test_cards.json");
      assertEquals(Arrays.asList(29.4, 39.4, 43.1), database.getReferencePositions("Calcite"));
    }
  }

  @Test
  public void getReferencePositions_unknownPhase_isEmpty() {
    PhaseDatabase database = PhaseDatabase.empty();
    assertEquals(Collections.emptyList(), database.getReferencePositions("Quartz"));
  }

  @Test(expected = UnsupportedOperationException.class)
  public void asMap_isUnmodifiable() {
    Map<String, List<Double>> phases = new LinkedHashMap<>();
    phases.put("Halite", Arrays.asList(27.3, 31.7));
    new PhaseDatabase(phases, "inline").asMap().remove("Halite");
  }

  @Test
  public void constructor_copiesTable() {
    Map<String, List<Double>> phases = new LinkedHashMap<>();
    phases.put("Halite", Arrays.asList(27.3, 31.7));
    PhaseDatabase database = new PhaseDatabase(phases, "inline");
    phases.put("Calcite", Collections.singletonList(29.4));
    assertEquals(1, database.size());
  }

}
