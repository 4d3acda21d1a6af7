package xrd.viewer.utils;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.log4j.Logger;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.graphics.image.LosslessFactory;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.jfree.chart.JFreeChart;
import xrd.viewer.output.PeakRecord;

/**
 * This class defines functions relevant to creating output files, such as peak tables, images of
 * plots and PDF reports. These methods are all static.
 */
public class ReportingUtils {

  private static final Logger logger = Logger.getLogger(ReportingUtils.class);

  /**
   * Column headers of an exported peak table, in order
   */
  public static final String[] PEAK_TABLE_COLUMNS =
      {"2θ", "Intensity", "FWHM", "PDF Match", "Crystallinity"};

  // quote only values holding a separator, quote or line break
  private static final CsvMapper CSV_MAPPER = CsvMapper.builder()
      .enable(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING)
      .build();

  private static final PDFont REPORT_FONT = PDType1Font.COURIER;
  private static final float FONT_SIZE = 12;
  private static final float MARGIN = 72;

  /**
   * Write a peak table as CSV, one row per peak in the given order, with a header row. A peak that
   * matched no phase has "-" in the match column.
   *
   * @param file File to write (replaced if it exists)
   * @param peaks Peaks to export
   * @throws IOException If the file cannot be written
   */
  public static void writePeakTable(File file, List<PeakRecord> peaks) throws IOException {
    CsvSchema.Builder builder = CsvSchema.builder();
    for (String column : PEAK_TABLE_COLUMNS) {
      builder.addColumn(column);
    }
    CsvSchema schema = builder.setUseHeader(true).build();

    try (SequenceWriter writer = CSV_MAPPER.writer(schema).writeValues(file)) {
      for (PeakRecord peak : peaks) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put(PEAK_TABLE_COLUMNS[0], peak.getPosition());
        row.put(PEAK_TABLE_COLUMNS[1], peak.getIntensity());
        row.put(PEAK_TABLE_COLUMNS[2], peak.getFwhm());
        row.put(PEAK_TABLE_COLUMNS[3], peak.getMatchDisplay());
        row.put(PEAK_TABLE_COLUMNS[4], peak.getCrystallinity().getName());
        writer.write(row);
      }
    }
    logger.info("Wrote " + peaks.size() + " peaks to " + file.getAbsolutePath());
  }

  /**
   * Add a buffered image to a PDDocument page
   *
   * @param bi BufferedImage to be added to PDF
   * @param pdf PDF to have BufferedImage appended to
   * @throws IOException If the image cannot be encoded into the document
   */
  private static void bufferedImageToPDFPage(BufferedImage bi, PDDocument pdf)
      throws IOException {
    PDRectangle rec = new PDRectangle(bi.getWidth(), bi.getHeight());
    PDPage page = new PDPage(rec);
    PDImageXObject pdImageXObject = LosslessFactory.createFromImage(pdf, bi);
    pdf.addPage(page);
    try (PDPageContentStream contentStream = new PDPageContentStream(pdf, page,
        PDPageContentStream.AppendMode.OVERWRITE, true, false)) {
      contentStream.drawImage(pdImageXObject, 0, 0, bi.getWidth(), bi.getHeight());
    }
  }

  /**
   * Converts a series of charts into a buffered image. Each chart has the given width and height,
   * and the charts are concatenated vertically.
   *
   * @param width width of each chart plot
   * @param height height of each chart plot
   * @param charts series of charts to be plotted in
   * @return buffered image consisting of the concatenation of the given charts
   */
  public static BufferedImage chartsToImage(int width, int height, JFreeChart... charts) {
    BufferedImage[] bis = new BufferedImage[charts.length];
    for (int i = 0; i < charts.length; ++i) {
      bis[i] = charts[i].createBufferedImage(width, height);
    }
    return mergeBufferedImages(bis);
  }

  /**
   * Takes in a series of charts and produces a PDF page of those charts
   *
   * @param width Width of each chart to be added to the PDF
   * @param height Height of each chart to be added to the PDF
   * @param pdf PDF document to have the data appended to
   * @param charts series of charts to place in the PDF
   * @throws IOException If the image cannot be encoded into the document
   */
  public static void chartsToPDFPage(int width, int height, PDDocument pdf, JFreeChart... charts)
      throws IOException {
    BufferedImage bi = chartsToImage(width, height, charts);
    bufferedImageToPDFPage(bi, pdf);
  }

  /**
   * Combine a series of buffered images into a single buffered image. Images are concatenated
   * vertically and centered horizontally into an image as wide as the widest passed-in image
   *
   * @param images Buffered images to send in
   * @return Single concatenated buffered image
   */
  private static BufferedImage mergeBufferedImages(BufferedImage... images) {
    int maxWidth = 0;
    int totalHeight = 0;
    for (BufferedImage bi : images) {
      maxWidth = Math.max(maxWidth, bi.getWidth());
      totalHeight += bi.getHeight();
    }

    BufferedImage out = new BufferedImage(maxWidth, totalHeight, BufferedImage.TYPE_INT_RGB);
    Graphics2D g = out.createGraphics();
    int heightIndex = 0;
    for (BufferedImage bi : images) {
      int centeringOffset = (maxWidth - bi.getWidth()) / 2;
      g.drawImage(bi, null, centeringOffset, heightIndex);
      heightIndex += bi.getHeight();
    }
    g.dispose();
    return out;
  }

  /**
   * Add pages to a PDF document consisting of textual data, each string starting a new page
   *
   * @param pdf Document to append pages of text to
   * @param toWrite Series of strings to write to PDF
   * @throws IOException If text cannot be written to the document
   */
  public static void textListToPDFPages(PDDocument pdf, String... toWrite) throws IOException {
    for (String onePage : toWrite) {
      textToPDFPage(onePage, pdf);
    }
  }

  /**
   * Add textual data to a PDF document, starting on a new page. Long lines are wrapped at spaces
   * and text that does not fit on one page continues onto further pages. Characters the report
   * font cannot show (i.e., θ) are spelled out.
   *
   * @param toWrite String to add to the PDF
   * @param pdf Document to append the page(s) to
   * @throws IOException If text cannot be written to the document
   */
  public static void textToPDFPage(String toWrite, PDDocument pdf) throws IOException {
    if (toWrite.length() == 0) {
      return;
    }

    PDRectangle mediaBox = PDRectangle.LETTER;
    float leading = 1.5f * FONT_SIZE;
    float width = mediaBox.getWidth() - 2 * MARGIN;
    int linesPerPage = (int) ((mediaBox.getHeight() - 2 * MARGIN) / leading);

    List<String> lines = wrapLines(toPrintable(toWrite), width);

    for (int start = 0; start < lines.size(); start += linesPerPage) {
      PDPage page = new PDPage(mediaBox);
      pdf.addPage(page);
      float startX = mediaBox.getLowerLeftX() + MARGIN;
      float startY = mediaBox.getUpperRightY() - MARGIN;
      try (PDPageContentStream contentStream = new PDPageContentStream(pdf, page)) {
        contentStream.beginText();
        contentStream.setFont(REPORT_FONT, FONT_SIZE);
        contentStream.newLineAtOffset(startX, startY);
        int end = Math.min(lines.size(), start + linesPerPage);
        for (String line : lines.subList(start, end)) {
          contentStream.showText(line);
          contentStream.newLineAtOffset(0, -leading);
        }
        contentStream.endText();
      }
    }
  }

  /**
   * Split text into lines no wider than the given width in the report font, breaking at spaces
   * where possible
   *
   * @param text Text to split, may contain newlines
   * @param width Maximum line width in points
   * @return Lines to write
   * @throws IOException If the font has no metrics for a character of the text
   */
  static List<String> wrapLines(String text, float width) throws IOException {
    List<String> lines = new ArrayList<>();
    for (String paragraph : text.split("\n", -1)) {
      String remaining = paragraph;
      if (remaining.isEmpty()) {
        lines.add("");
        continue;
      }
      while (!remaining.isEmpty()) {
        if (stringWidth(remaining) <= width) {
          lines.add(remaining);
          break;
        }
        int breakAt = remaining.length();
        while (breakAt > 1 && stringWidth(remaining.substring(0, breakAt)) > width) {
          int space = remaining.lastIndexOf(' ', breakAt - 1);
          breakAt = space > 0 ? space : breakAt - 1;
        }
        lines.add(remaining.substring(0, breakAt));
        remaining = remaining.substring(breakAt).trim();
      }
    }
    return lines;
  }

  private static float stringWidth(String text) throws IOException {
    return FONT_SIZE * REPORT_FONT.getStringWidth(text) / 1000;
  }

  /**
   * Replace characters the standard PDF fonts cannot encode
   *
   * @param text Report text
   * @return Text using only characters the report font can show
   */
  static String toPrintable(String text) {
    StringBuilder sb = new StringBuilder();
    for (char c : text.toCharArray()) {
      if (c == 'θ') {
        sb.append("theta");
      } else if (c == '\t') {
        sb.append("    ");
      } else if (c == '\n' || (c >= 0x20 && c < 0x7F)) {
        sb.append(c);
      } else if (c != '\r') {
        sb.append('?');
      }
    }
    return sb.toString();
  }

}
