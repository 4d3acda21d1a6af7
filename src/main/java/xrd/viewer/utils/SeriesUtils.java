package xrd.viewer.utils;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import org.apache.log4j.Logger;
import xrd.viewer.input.Series;

/**
 * Contains static methods for reading diffraction traces from two-column text files and from
 * manually entered rows.
 */
public class SeriesUtils {

  private static final Logger logger = Logger.getLogger(SeriesUtils.class);

  /**
   * Separators allowed between columns: any run of whitespace, commas or semicolons
   */
  private static final String SEPARATORS = "[\\s,;]+";

  /**
   * Smallest number of points a loaded trace can have
   */
  public static final int MIN_POINTS = 2;

  /**
   * Read a trace from a text file of two numeric columns, 2θ then intensity
   *
   * @param filename Path of the file to read
   * @return Series of the file's points, in file order
   * @throws IOException If the file cannot be read
   * @throws SeriesFormatException If the file is not a table of numbers with at least 2 columns
   */
  public static Series readSeries(String filename) throws IOException, SeriesFormatException {
    return readSeries(new File(filename));
  }

  /**
   * Read a trace from a text file of two numeric columns, 2θ then intensity. Columns may be
   * separated by whitespace, tabs, commas or semicolons. Blank lines are skipped, as is a header
   * line whose first two cells are both non-numeric; columns past the second are ignored. Any
   * other non-numeric cell rejects the whole file.
   *
   * @param file File to read
   * @return Series of the file's points, in file order
   * @throws IOException If the file cannot be read
   * @throws SeriesFormatException If the file is not a table of numbers with at least 2 columns
   */
  public static Series readSeries(File file) throws IOException, SeriesFormatException {
    List<String> lines = new ArrayList<>();
    try (BufferedReader br = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8)) {
      String line;
      while ((line = br.readLine()) != null) {
        lines.add(line);
      }
    }
    try {
      return parseLines(lines);
    } catch (SeriesFormatException e) {
      logger.error("Could not parse trace file " + file.getName() + ": " + e.getMessage());
      throw new SeriesFormatException(file.getName() + ": " + e.getMessage());
    }
  }

  /**
   * Parse the lines of a two-column trace (see {@link #readSeries(File)} for the format)
   *
   * @param lines Text lines of the trace
   * @return Series of the parsed points
   * @throws SeriesFormatException If the lines are not a table of numbers with at least 2 columns
   */
  public static Series parseLines(List<String> lines) throws SeriesFormatException {
    List<Double> xs = new ArrayList<>();
    List<Double> ys = new ArrayList<>();
    boolean firstContentLine = true;

    for (int i = 0; i < lines.size(); ++i) {
      String line = lines.get(i).trim();
      // a byte-order mark at the start of the file is not part of the data
      if (i == 0 && line.startsWith("\uFEFF")) {
        line = line.substring(1).trim();
      }
      if (line.isEmpty()) {
        continue;
      }
      String[] cells = line.split(SEPARATORS);
      if (cells.length < 2) {
        throw new SeriesFormatException("Line " + (i + 1) + " has fewer than two columns: " + line);
      }
      Double x = parseCell(cells[0]);
      Double y = parseCell(cells[1]);
      if (firstContentLine && x == null && y == null) {
        // header row
        firstContentLine = false;
        continue;
      }
      firstContentLine = false;
      if (x == null || y == null) {
        throw new SeriesFormatException("Line " + (i + 1) + " has a non-numeric value: " + line);
      }
      xs.add(x);
      ys.add(y);
    }

    return toSeries(xs, ys);
  }

  /**
   * Build a series from manually entered rows of (2θ, intensity) text. Rows with both cells blank
   * are skipped; any other row must have two numbers.
   *
   * @param rows Rows of two cells each (a null cell counts as blank)
   * @return Series of the entered points, in row order
   * @throws SeriesFormatException If a row has a non-numeric or missing cell, or fewer than 2
   * points are entered
   */
  public static Series fromRows(List<String[]> rows) throws SeriesFormatException {
    List<Double> xs = new ArrayList<>();
    List<Double> ys = new ArrayList<>();
    for (int i = 0; i < rows.size(); ++i) {
      String[] row = rows.get(i);
      String xText = row.length > 0 && row[0] != null ? row[0].trim() : "";
      String yText = row.length > 1 && row[1] != null ? row[1].trim() : "";
      if (xText.isEmpty() && yText.isEmpty()) {
        continue;
      }
      Double x = parseCell(xText);
      Double y = parseCell(yText);
      if (x == null || y == null) {
        throw new SeriesFormatException("Row " + (i + 1) + " has a value that is not a number");
      }
      xs.add(x);
      ys.add(y);
    }
    return toSeries(xs, ys);
  }

  private static Series toSeries(List<Double> xs, List<Double> ys) throws SeriesFormatException {
    if (xs.size() < MIN_POINTS) {
      throw new SeriesFormatException("At least " + MIN_POINTS + " points are needed, found "
          + xs.size());
    }
    double[] x = new double[xs.size()];
    double[] y = new double[ys.size()];
    for (int i = 0; i < x.length; ++i) {
      x[i] = xs.get(i);
      y[i] = ys.get(i);
    }
    return new Series(x, y);
  }

  /**
   * Parse one cell as a finite number
   *
   * @param cell Text of the cell
   * @return Parsed value, or null if the cell is not a finite number
   */
  private static Double parseCell(String cell) {
    try {
      double value = Double.parseDouble(cell.trim());
      if (Double.isNaN(value) || Double.isInfinite(value)) {
        return null;
      }
      return value;
    } catch (NumberFormatException e) {
      return null;
    }
  }

  /**
   * Get the base name of a trace file, used as its default dataset name
   *
   * @param filename Path of the file
   * @return Name of the file without its folder
   */
  public static String datasetNameFor(String filename) {
    return new File(filename).getName();
  }

}
