package com.gentoro.docsmcp.docs.structure;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.docsmcp.docs.model.DocumentStructure;
import com.gentoro.docsmcp.docs.model.ParagraphElement;
import com.gentoro.docsmcp.docs.model.StructuralElement;
import com.gentoro.docsmcp.docs.model.TableCell;
import com.gentoro.docsmcp.docs.model.TableElement;
import com.gentoro.docsmcp.exception.NotFoundException;
import com.gentoro.docsmcp.utility.JacksonUtility;
import java.util.List;

/** JSON reports over a document tree, as returned by the structure inspection tools. */
public class StructureReporter {

  static final int TEXT_PREVIEW_LENGTH = 100;
  static final int TABLE_PREVIEW_ROWS = 3;

  private final DocumentStructureParser parser;
  private final DocumentComplexityAnalyzer complexityAnalyzer;

  public StructureReporter(DocumentStructureParser parser) {
    this.parser = parser;
    this.complexityAnalyzer = new DocumentComplexityAnalyzer(parser);
  }

  /** Complexity summary plus position and size of every top-level table. */
  public ObjectNode basic(JsonNode document) {
    ObjectNode report =
        (ObjectNode) JacksonUtility.valueToTree(complexityAnalyzer.analyze(document));
    List<TableElement> tables = parser.findTables(document);
    if (!tables.isEmpty()) {
      ArrayNode details = report.putArray("table_details");
      for (int i = 0; i < tables.size(); i++) {
        TableElement table = tables.get(i);
        details
            .addObject()
            .put("index", i)
            .put("rows", table.rows())
            .put("columns", table.columns())
            .put("start_index", table.startIndex())
            .put("end_index", table.endIndex());
      }
    }
    return report;
  }

  /** Every body element with its range, plus a data preview of each table. */
  public ObjectNode detailed(JsonNode document) {
    DocumentStructure structure = parser.parse(document);
    ObjectNode report = JacksonUtility.getJsonMapper().createObjectNode();
    report.put("title", structure.title());
    report.put("total_length", structure.totalLength());
    report
        .putObject("statistics")
        .put("elements", structure.body().size())
        .put("tables", structure.tables().size())
        .put("paragraphs", structure.paragraphCount())
        .put("has_headers", !structure.headers().isEmpty())
        .put("has_footers", !structure.footers().isEmpty());

    ArrayNode elements = report.putArray("elements");
    for (StructuralElement element : structure.body()) {
      ObjectNode summary =
          elements
              .addObject()
              .put("type", element.type().wireName())
              .put("start_index", element.startIndex())
              .put("end_index", element.endIndex());
      if (element instanceof TableElement table) {
        summary
            .put("rows", table.rows())
            .put("columns", table.columns())
            .put("cell_count", table.cellCount());
      } else if (element instanceof ParagraphElement paragraph) {
        String text = paragraph.text();
        summary.put(
            "text_preview",
            text.length() > TEXT_PREVIEW_LENGTH ? text.substring(0, TEXT_PREVIEW_LENGTH) : text);
      }
    }

    if (!structure.tables().isEmpty()) {
      ArrayNode tables = report.putArray("tables");
      for (int i = 0; i < structure.tables().size(); i++) {
        TableElement table = structure.tables().get(i);
        ObjectNode entry = tables.addObject().put("index", i);
        entry.putObject("position").put("start", table.startIndex()).put("end", table.endIndex());
        entry.putObject("dimensions").put("rows", table.rows()).put("columns", table.columns());
        List<List<String>> data = TableDataExtractor.toData(table);
        entry.set(
            "preview",
            JacksonUtility.valueToTree(data.subList(0, Math.min(TABLE_PREVIEW_ROWS, data.size()))));
      }
    }
    return report;
  }

  /**
   * Per-cell ranges, insertion indices and content of one table.
   *
   * @throws NotFoundException when the document has fewer than {@code tableIndex + 1} tables
   */
  public ObjectNode debugTable(JsonNode document, int tableIndex) {
    List<TableElement> tables = parser.findTables(document);
    if (tableIndex < 0 || tableIndex >= tables.size()) {
      throw new NotFoundException(
          "Table index "
              + tableIndex
              + " not found. Document has "
              + tables.size()
              + " table(s).");
    }
    TableElement table = tables.get(tableIndex);
    ObjectNode report = JacksonUtility.getJsonMapper().createObjectNode();
    report.put("table_index", tableIndex);
    report.put("dimensions", table.rows() + "x" + table.columns());
    report.put("table_range", "[" + table.startIndex() + "-" + table.endIndex() + "]");
    ArrayNode rows = report.putArray("cells");
    for (List<TableCell> row : table.cells()) {
      ArrayNode cells = rows.addArray();
      for (TableCell cell : row) {
        cells
            .addObject()
            .put("position", "(" + cell.row() + "," + cell.column() + ")")
            .put("range", "[" + cell.startIndex() + "-" + cell.endIndex() + "]")
            .put("insertion_index", cell.insertionIndex())
            .put("current_content", cell.content())
            .put("content_elements_count", cell.contentElementCount());
      }
    }
    return report;
  }
}
