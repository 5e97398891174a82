package com.gentoro.docsmcp.docs.structure;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.gentoro.docsmcp.docs.model.DocumentStructure;
import com.gentoro.docsmcp.docs.model.ParagraphElement;
import com.gentoro.docsmcp.docs.model.SectionBreakElement;
import com.gentoro.docsmcp.docs.model.StructuralElement;
import com.gentoro.docsmcp.docs.model.TableCell;
import com.gentoro.docsmcp.docs.model.TableElement;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Flattens a document resource into {@link DocumentStructure}.
 *
 * <p>Missing or malformed fields read as empty or zero; the parser never throws on a sparse
 * document. Results are computed from the tree passed in and are never cached: callers re-parse
 * after every mutating batch.
 */
public class DocumentStructureParser {
  private static final org.slf4j.Logger log =
      com.gentoro.docsmcp.logging.LoggingService.getLogger(DocumentStructureParser.class);

  private final ContentTextCollector textCollector;

  public DocumentStructureParser() {
    this(new ContentTextCollector());
  }

  public DocumentStructureParser(ContentTextCollector textCollector) {
    this.textCollector = textCollector;
  }

  public DocumentStructure parse(JsonNode document) {
    JsonNode content = elements(document.path("body").path("content"));
    List<StructuralElement> body = new ArrayList<>();
    List<TableElement> tables = new ArrayList<>();

    for (JsonNode element : content) {
      parseElement(element)
          .ifPresent(
              parsed -> {
                body.add(parsed);
                if (parsed instanceof TableElement table) {
                  tables.add(table);
                }
              });
    }

    int totalLength =
        content.isEmpty() ? 0 : content.get(content.size() - 1).path("endIndex").asInt(0);

    DocumentStructure structure =
        new DocumentStructure(
            document.path("title").asText(""),
            totalLength,
            body,
            tables,
            segments(document.path("headers")),
            segments(document.path("footers")));
    log.debug(
        "Parsed document '{}': {} elements, {} tables, length {}",
        structure.title(),
        body.size(),
        tables.size(),
        totalLength);
    return structure;
  }

  /** Top-level tables of the main body. */
  public List<TableElement> findTables(JsonNode document) {
    return parse(document).tables();
  }

  Optional<StructuralElement> parseElement(JsonNode element) {
    int start = element.path("startIndex").asInt(0);
    int end = element.path("endIndex").asInt(0);
    if (element.has("paragraph")) {
      return Optional.of(
          new ParagraphElement(
              start, end, ContentTextCollector.paragraphText(element.get("paragraph"))));
    }
    if (element.has("table")) {
      return Optional.of(parseTable(start, end, element.get("table")));
    }
    if (element.has("sectionBreak")) {
      return Optional.of(new SectionBreakElement(start, end));
    }
    return Optional.empty();
  }

  private TableElement parseTable(int start, int end, JsonNode table) {
    List<List<TableCell>> cells = new ArrayList<>();
    int rowIndex = 0;
    for (JsonNode row : elements(table.path("tableRows"))) {
      List<TableCell> rowCells = new ArrayList<>();
      int columnIndex = 0;
      for (JsonNode cell : elements(row.path("tableCells"))) {
        rowCells.add(parseCell(rowIndex, columnIndex++, cell));
      }
      cells.add(rowCells);
      rowIndex++;
    }
    int rows = cells.size();
    int columns = rows > 0 ? cells.get(0).size() : 0;
    return new TableElement(start, end, rows, columns, cells);
  }

  private TableCell parseCell(int row, int column, JsonNode cell) {
    int start = cell.path("startIndex").asInt(0);
    int end = cell.path("endIndex").asInt(0);
    JsonNode content = elements(cell.path("content"));
    return new TableCell(
        row,
        column,
        start,
        end,
        insertionIndex(start, content),
        textCollector.collect(content, 1),
        content.size());
  }

  private static int insertionIndex(int cellStart, JsonNode content) {
    for (JsonNode element : content) {
      if (element.has("paragraph") && element.has("startIndex")) {
        return element.get("startIndex").asInt();
      }
    }
    return cellStart + 1;
  }

  /** Anything but an array reads as an empty element list. */
  private static JsonNode elements(JsonNode node) {
    return node.isArray() ? node : MissingNode.getInstance();
  }

  private Map<String, String> segments(JsonNode segments) {
    Map<String, String> result = new LinkedHashMap<>();
    Iterator<Map.Entry<String, JsonNode>> it = segments.fields();
    while (it.hasNext()) {
      Map.Entry<String, JsonNode> entry = it.next();
      result.put(entry.getKey(), textCollector.collect(entry.getValue().path("content"), 0));
    }
    return result;
  }
}
