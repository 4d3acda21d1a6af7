package xrd.viewer.utils;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import xrd.viewer.output.PeakRecord;

public class ReportingUtilsTest {

  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  @Test
  public void writePeakTable_headerAndRows() throws IOException {
    List<PeakRecord> peaks = Arrays.asList(
        new PeakRecord(26.64, 1000., 0.141,
            new LinkedHashSet<>(Arrays.asList("Quartz", "Cristobalite"))),
        new PeakRecord(33.1, 120.5, 0.62, Collections.emptySet()));
    File csv = folder.newFile("peaks.csv");
    ReportingUtils.writePeakTable(csv, peaks);

    List<String> lines = Files.readAllLines(csv.toPath(), StandardCharsets.UTF_8);
    assertEquals("2θ,Intensity,FWHM,PDF Match,Crystallinity", lines.get(0));
    assertEquals(3, lines.size());

    CsvMapper mapper = new CsvMapper();
    List<Map<String, String>> rows = new ArrayList<>();
    try (MappingIterator<Map<String, String>> it = mapper.readerForMapOf(String.class)
        .with(CsvSchema.emptySchema().withHeader()).readValues(csv)) {
      while (it.hasNext()) {
        rows.add(it.next());
      }
    }
    assertEquals(26.64, Double.parseDouble(rows.get(0).get("2θ")), 0.);
    assertEquals("Quartz, Cristobalite", rows.get(0).get("PDF Match"));
    assertEquals("Highly Crystalline", rows.get(0).get("Crystallinity"));
    assertEquals(120.5, Double.parseDouble(rows.get(1).get("Intensity")), 0.);
    assertEquals("-", rows.get(1).get("PDF Match"));
    assertEquals("Poorly Crystalline", rows.get(1).get("Crystallinity"));
  }

  @Test
  public void writePeakTable_noPeaks_headerOnly() throws IOException {
    File csv = folder.newFile("empty.csv");
    ReportingUtils.writePeakTable(csv, Collections.emptyList());
    List<String> lines = Files.readAllLines(csv.toPath(), StandardCharsets.UTF_8);
    assertEquals(1, lines.size());
  }

  @Test
  public void textToPDFPage_longTextContinuesOnNewPages() throws IOException {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < 100; ++i) {
      sb.append("Peak line ").append(i).append(" at 2θ\n");
    }
    File pdfFile = folder.newFile("report.pdf");
    try (PDDocument pdf = new PDDocument()) {
      ReportingUtils.textToPDFPage(sb.toString(), pdf);
      ReportingUtils.textToPDFPage("", pdf);
      pdf.save(pdfFile);
    }
    try (PDDocument loaded = PDDocument.load(pdfFile)) {
      assertEquals(3, loaded.getNumberOfPages());
    }
  }

  @Test
  public void textListToPDFPages_eachStringStartsAPage() throws IOException {
    try (PDDocument pdf = new PDDocument()) {
      ReportingUtils.textListToPDFPages(pdf, "first", "second", "third");
      assertEquals(3, pdf.getNumberOfPages());
    }
  }

  @Test
  public void wrapLines_longLineBrokenAtSpaces() throws IOException {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < 40; ++i) {
      sb.append("word").append(i).append(' ');
    }
    // courier is 7.2 points per character at 12 points, so 144 points hold 20 characters
    List<String> lines = ReportingUtils.wrapLines(sb.toString().trim(), 144f);
    assertTrue(lines.size() > 1);
    for (String line : lines) {
      assertTrue(line, line.length() <= 20);
      assertTrue(line, !line.startsWith(" "));
    }
    assertEquals(sb.toString().trim(), String.join(" ", lines));
  }

  @Test
  public void wrapLines_keepsBlankLines() throws IOException {
    assertEquals(Arrays.asList("a", "", "b"), ReportingUtils.wrapLines("a\n\nb", 400f));
  }

  @Test
  public void toPrintable_spellsOutTheta() {
    assertEquals("2theta Filter\n  x?", ReportingUtils.toPrintable("2θ Filter\r\n  x°"));
  }

}
