package com.flamingo.ai.raggateway.ingestion.parsing;

import com.flamingo.ai.raggateway.exception.DocumentParsingException;
import com.flamingo.ai.raggateway.ingestion.ExtractedContent;
import com.flamingo.ai.raggateway.ingestion.model.ContentNode;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;
import org.springframework.stereotype.Service;

/**
 * {@link DocumentParser} for PDF documents, built on Apache PDFBox 3.x.
 *
 * <p>Produces one content node per non-empty page. Lines whose average font size exceeds the
 * document-wide median by {@value #HEADING_MULTIPLIER}x are reported as the page's {@code
 * headings}.
 */
@Service
@Slf4j
public class PdfBoxDocumentParser implements DocumentParser {

  static final float HEADING_MULTIPLIER = 1.15f;

  @Override
  public ExtractedContent parse(InputStream inputStream, String fileName, String mimeType) {
    try {
      byte[] bytes = inputStream.readAllBytes();
      try (PDDocument pdfDoc = Loader.loadPDF(bytes)) {
        return extractPages(pdfDoc, fileName);
      }
    } catch (IOException e) {
      log.warn("PDFBox parsing failed for {}: {}", fileName, e.getMessage());
      throw new DocumentParsingException(mimeType, "Failed to parse PDF: " + e.getMessage(), e);
    }
  }

  @Override
  public boolean supports(String mimeType) {
    return "application/pdf".equalsIgnoreCase(mimeType);
  }

  // ---- private helpers ----

  private ExtractedContent extractPages(PDDocument pdfDoc, String fileName) throws IOException {
    PageLineStripper stripper = new PageLineStripper();
    stripper.getText(pdfDoc);
    List<List<LineInfo>> pages = stripper.getPages();

    double medianFontSize = medianFontSize(pages);
    log.debug("PDF {} has {} pages, median font size {}", fileName, pages.size(), medianFontSize);

    List<ContentNode> nodes = new ArrayList<>();
    for (int i = 0; i < pages.size(); i++) {
      List<LineInfo> lines = pages.get(i);
      String text = String.join("\n", lines.stream().map(LineInfo::text).toList()).strip();
      if (text.isEmpty()) {
        continue;
      }
      List<String> headings =
          lines.stream()
              .filter(line -> isHeading(line, medianFontSize))
              .map(line -> line.text().strip())
              .toList();

      Map<String, Object> metadata = new LinkedHashMap<>();
      metadata.put("page_number", i + 1);
      metadata.put("source", fileName);
      if (!headings.isEmpty()) {
        metadata.put("headings", headings);
      }
      nodes.add(new ContentNode(text, metadata));
    }

    if (nodes.isEmpty()) {
      throw new DocumentParsingException("application/pdf", "PDF contains no extractable text");
    }
    return new ExtractedContent(nodes, pdfDoc.getNumberOfPages());
  }

  private double medianFontSize(List<List<LineInfo>> pages) {
    List<Float> sizes =
        pages.stream()
            .flatMap(List::stream)
            .filter(l -> !l.text().isBlank())
            .map(LineInfo::avgFontSize)
            .sorted()
            .toList();

    if (sizes.isEmpty()) {
      return 12.0;
    }
    int mid = sizes.size() / 2;
    return sizes.size() % 2 == 0 ? (sizes.get(mid - 1) + sizes.get(mid)) / 2.0 : sizes.get(mid);
  }

  private boolean isHeading(LineInfo line, double median) {
    String text = line.text().strip();
    // very short or very long lines are never headings
    if (text.length() < 2 || text.length() > 200) {
      return false;
    }
    return line.avgFontSize() > median * HEADING_MULTIPLIER;
  }

  // ---- inner types ----

  /** Groups text into lines per page, keeping each line's average font size. */
  private static final class PageLineStripper extends PDFTextStripper {

    private final List<List<LineInfo>> pages = new ArrayList<>();
    private List<LineInfo> currentPage = new ArrayList<>();
    private final StringBuilder lineText = new StringBuilder();
    private final List<Float> lineSizes = new ArrayList<>();
    private float lastY = Float.NaN;

    PageLineStripper() throws IOException {
      super();
      setSortByPosition(true);
    }

    @Override
    protected void startPage(PDPage page) throws IOException {
      currentPage = new ArrayList<>();
      lastY = Float.NaN;
      super.startPage(page);
    }

    @Override
    protected void writeString(String text, List<TextPosition> textPositions) throws IOException {
      if (!textPositions.isEmpty()) {
        float y = textPositions.get(0).getY();
        if (Float.isNaN(lastY) || Math.abs(y - lastY) > 2.0f) {
          flushLine();
          lastY = y;
        } else if (lineText.length() > 0) {
          lineText.append(' ');
        }
        for (TextPosition pos : textPositions) {
          if (pos.getFontSizeInPt() > 0) {
            lineSizes.add(pos.getFontSizeInPt());
          }
        }
      }
      lineText.append(text);
      super.writeString(text, textPositions);
    }

    @Override
    protected void endPage(PDPage page) throws IOException {
      flushLine();
      pages.add(currentPage);
      super.endPage(page);
    }

    private void flushLine() {
      if (lineText.length() == 0) {
        return;
      }
      float avgSize =
          (float) lineSizes.stream().mapToDouble(Float::doubleValue).average().orElse(12.0);
      currentPage.add(new LineInfo(lineText.toString(), avgSize));
      lineText.setLength(0);
      lineSizes.clear();
    }

    List<List<LineInfo>> getPages() {
      return pages;
    }
  }

  /**
   * A single line of text on a PDF page.
   *
   * @param text line text, words separated by single spaces
   * @param avgFontSize average font size across the line's glyphs
   */
  record LineInfo(String text, float avgFontSize) {}
}
