package com.flamingo.ai.raggateway.ingestion.parsing;

import com.flamingo.ai.raggateway.exception.DocumentParsingException;
import com.flamingo.ai.raggateway.ingestion.ExtractedContent;
import com.flamingo.ai.raggateway.ingestion.model.ContentNode;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.sax.ToXMLContentHandler;
import org.springframework.stereotype.Service;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

/**
 * {@link DocumentParser} for Office documents (DOCX, DOC, ODT).
 *
 * <p>Apache Tika renders the document to XHTML; the DOM is then split into one content node per
 * heading-delimited section. Tables become Markdown pipe tables inside their section. Content that
 * precedes the first heading forms its own node.
 */
@Service
@Slf4j
public class TikaOfficeDocumentParser implements DocumentParser {

  private static final Set<String> SUPPORTED_MIME_PREFIXES =
      Set.of(
          "application/vnd.openxmlformats-officedocument.wordprocessingml",
          "application/msword",
          "application/vnd.oasis.opendocument.text");

  @Override
  public ExtractedContent parse(InputStream inputStream, String fileName, String mimeType) {
    try {
      return parseXhtml(toXhtml(inputStream, mimeType), fileName);
    } catch (DocumentParsingException e) {
      throw e;
    } catch (Exception e) {
      log.warn("Tika parsing failed for {} ({}): {}", fileName, mimeType, e.getMessage());
      throw new DocumentParsingException(
          mimeType, "Failed to parse document: " + e.getMessage(), e);
    }
  }

  @Override
  public boolean supports(String mimeType) {
    return mimeType != null && SUPPORTED_MIME_PREFIXES.stream().anyMatch(mimeType::startsWith);
  }

  // ---- private helpers ----

  private byte[] toXhtml(InputStream inputStream, String mimeType)
      throws IOException, SAXException, org.apache.tika.exception.TikaException {
    AutoDetectParser tikaParser = new AutoDetectParser();
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    ToXMLContentHandler handler = new ToXMLContentHandler(out, StandardCharsets.UTF_8.name());
    Metadata metadata = new Metadata();
    if (mimeType != null) {
      metadata.set(Metadata.CONTENT_TYPE, mimeType);
    }
    tikaParser.parse(inputStream, handler, metadata, new ParseContext());
    return out.toByteArray();
  }

  ExtractedContent parseXhtml(byte[] xhtmlBytes, String fileName)
      throws ParserConfigurationException, SAXException, IOException {
    DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
    dbf.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
    dbf.setNamespaceAware(true);
    org.w3c.dom.Document dom = dbf.newDocumentBuilder().parse(new ByteArrayInputStream(xhtmlBytes));
    dom.getDocumentElement().normalize();

    SectionCollector collector = new SectionCollector(fileName);
    walk(dom.getDocumentElement(), collector);
    collector.close();

    if (collector.nodes.isEmpty()) {
      throw new DocumentParsingException(null, "Document contains no extractable text");
    }
    return new ExtractedContent(collector.nodes, null);
  }

  private void walk(Element root, SectionCollector collector) {
    NodeList children = root.getChildNodes();
    for (int i = 0; i < children.getLength(); i++) {
      Node child = children.item(i);
      if (child.getNodeType() != Node.ELEMENT_NODE) {
        continue;
      }
      Element el = (Element) child;
      String tag = localName(el);

      if (tag.matches("h[1-6]")) {
        collector.openSection(Integer.parseInt(tag.substring(1)), el.getTextContent().strip());
      } else if ("table".equals(tag)) {
        collector.append(tableToMarkdown(el));
      } else if ("p".equals(tag) || "li".equals(tag)) {
        collector.append(el.getTextContent().strip());
      } else if ("head".equals(tag)) {
        continue;
      } else {
        walk(el, collector);
      }
    }
  }

  private String tableToMarkdown(Element tableEl) {
    StringBuilder sb = new StringBuilder();
    NodeList rows = tableEl.getElementsByTagNameNS("*", "tr");
    for (int r = 0; r < rows.getLength(); r++) {
      NodeList cells = rows.item(r).getChildNodes();
      List<String> values = new ArrayList<>();
      for (int c = 0; c < cells.getLength(); c++) {
        Node cell = cells.item(c);
        if (cell.getNodeType() == Node.ELEMENT_NODE
            && Set.of("td", "th").contains(localName((Element) cell))) {
          values.add(cell.getTextContent().strip().replace("|", "\\|"));
        }
      }
      if (values.isEmpty()) {
        continue;
      }
      sb.append("| ").append(String.join(" | ", values)).append(" |\n");
      if (r == 0) {
        sb.append("|").append(" --- |".repeat(values.size())).append("\n");
      }
    }
    return sb.toString().strip();
  }

  private static String localName(Element el) {
    String name = el.getLocalName() != null ? el.getLocalName() : el.getTagName();
    return name.toLowerCase();
  }

  /** Accumulates paragraphs under the currently open heading path. */
  private static final class SectionCollector {

    private final String fileName;
    private final List<ContentNode> nodes = new ArrayList<>();
    private final String[] headingPath = new String[7];
    private final StringBuilder body = new StringBuilder();
    private String currentTitle;

    SectionCollector(String fileName) {
      this.fileName = fileName;
    }

    void openSection(int level, String title) {
      close();
      headingPath[level] = title;
      for (int i = level + 1; i < headingPath.length; i++) {
        headingPath[i] = null;
      }
      currentTitle = title;
    }

    void append(String text) {
      if (text.isBlank()) {
        return;
      }
      if (body.length() > 0) {
        body.append("\n\n");
      }
      body.append(text);
    }

    void close() {
      if (body.length() == 0) {
        return;
      }
      List<String> breadcrumb = new ArrayList<>();
      for (String heading : headingPath) {
        if (heading != null && !heading.isEmpty()) {
          breadcrumb.add(heading);
        }
      }
      String text = currentTitle != null ? currentTitle + "\n\n" + body : body.toString();

      Map<String, Object> metadata = new LinkedHashMap<>();
      metadata.put("source", fileName);
      metadata.put("section_breadcrumb", List.copyOf(breadcrumb));
      nodes.add(new ContentNode(text, metadata));
      body.setLength(0);
    }
  }
}
