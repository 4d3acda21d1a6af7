package xrd.viewer.utils;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static xrd.viewer.test.TestUtils.TRACE_LOCATION;

import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import org.junit.Test;
import xrd.viewer.input.Series;

public class SeriesUtilsTest {

  @Test
  public void readSeries_tabSeparatedWithHeader() throws IOException, SeriesFormatException {
    Series series = SeriesUtils.readSeries(TRACE_LOCATION + "quartz.xy");
    assertEquals(2001, series.size());
    assertEquals(20.0, series.getX()[0], 0.);
    assertEquals(60.0, series.getY()[0], 0.);
    assertEquals(60.0, series.getX()[2000], 0.);
    assertFalse(series.hasBackup());
  }

  @Test
  public void readSeries_semicolonsBlankLinesAndExtraColumns()
      throws IOException, SeriesFormatException {
    Series series = SeriesUtils.readSeries(TRACE_LOCATION + "semicolon.csv");
    assertArrayEquals(new double[]{10., 10.5, 11.}, series.getX(), 0.);
    assertArrayEquals(new double[]{5., 6.5, 7.25}, series.getY(), 0.);
  }

  @Test
  public void readSeries_twoPointsIsEnough() throws IOException, SeriesFormatException {
    assertEquals(2, SeriesUtils.readSeries(TRACE_LOCATION + "short.txt").size());
  }

  @Test
  public void readSeries_nonNumericCell_namesLine() throws IOException {
    try {
      SeriesUtils.readSeries(TRACE_LOCATION + "bad_cell.txt");
      fail("Non-numeric cell was accepted");
    } catch (SeriesFormatException e) {
      assertTrue(e.getMessage(), e.getMessage().contains("Line 2"));
      assertTrue(e.getMessage(), e.getMessage().contains("bad_cell.txt"));
    }
  }

  @Test(expected = SeriesFormatException.class)
  public void readSeries_singleColumn_rejected() throws IOException, SeriesFormatException {
    SeriesUtils.readSeries(TRACE_LOCATION + "one_column.txt");
  }

  @Test(expected = SeriesFormatException.class)
  public void readSeries_onePointAfterHeader_rejected() throws IOException, SeriesFormatException {
    SeriesUtils.readSeries(TRACE_LOCATION + "header_only.txt");
  }

  @Test(expected = IOException.class)
  public void readSeries_missingFile_throwsIOException() throws IOException, SeriesFormatException {
    SeriesUtils.readSeries(TRACE_LOCATION + "no_such_trace.xy");
  }

  @Test
  public void parseLines_commasAndByteOrderMark() throws SeriesFormatException {
    List<String> lines = Arrays.asList("\uFEFF10.0, 1.0", "  10.1 ,2.0  ", "10.2,\t3.0");
    Series series = SeriesUtils.parseLines(lines);
    assertArrayEquals(new double[]{10., 10.1, 10.2}, series.getX(), 0.);
    assertArrayEquals(new double[]{1., 2., 3.}, series.getY(), 0.);
  }

  @Test(expected = SeriesFormatException.class)
  public void parseLines_halfNumericFirstLine_isNotHeader() throws SeriesFormatException {
    SeriesUtils.parseLines(Arrays.asList("angle 5", "1 2", "3 4"));
  }

  @Test(expected = SeriesFormatException.class)
  public void parseLines_headerAfterData_rejected() throws SeriesFormatException {
    SeriesUtils.parseLines(Arrays.asList("1 2", "angle intensity", "3 4"));
  }

  @Test(expected = SeriesFormatException.class)
  public void parseLines_notANumber_rejected() throws SeriesFormatException {
    SeriesUtils.parseLines(Arrays.asList("1 2", "3 NaN", "5 6"));
  }

  @Test
  public void fromRows_skipsBlankRows() throws SeriesFormatException {
    List<String[]> rows = Arrays.asList(
        new String[]{"10", "100"},
        new String[]{"", "  "},
        new String[]{null, null},
        new String[]{" 10.5 ", "150.5"});
    Series series = SeriesUtils.fromRows(rows);
    assertArrayEquals(new double[]{10., 10.5}, series.getX(), 0.);
    assertArrayEquals(new double[]{100., 150.5}, series.getY(), 0.);
  }

  @Test
  public void fromRows_halfFilledRow_namesRow() {
    List<String[]> rows = Arrays.asList(
        new String[]{"10", "100"},
        new String[]{"11", ""},
        new String[]{"12", "120"});
    try {
      SeriesUtils.fromRows(rows);
      fail("Row with a missing intensity was accepted");
    } catch (SeriesFormatException e) {
      assertTrue(e.getMessage(), e.getMessage().contains("Row 2"));
    }
  }

  @Test(expected = SeriesFormatException.class)
  public void fromRows_singlePoint_rejected() throws SeriesFormatException {
    SeriesUtils.fromRows(Arrays.asList(new String[]{"10", "100"}, new String[]{"", ""}));
  }

  @Test
  public void datasetNameFor_dropsFolder() {
    assertEquals("quartz.xy", SeriesUtils.datasetNameFor(TRACE_LOCATION + "quartz.xy"));
  }

}
