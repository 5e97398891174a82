package com.gentoro.docsmcp.docs.batch;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.docsmcp.docs.index.DocumentIndex;
import com.gentoro.docsmcp.docs.request.EditOperation;
import com.gentoro.docsmcp.docs.request.EditRequests;
import com.gentoro.docsmcp.docs.request.TextStyle;
import com.gentoro.docsmcp.exception.ValidationException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Checks caller-supplied batch entries and turns them into service requests.
 *
 * <p>An entry is either a raw request (a single-key object named by the request kind) or a typed
 * shorthand with a {@code type} field. Raw requests of the modeled kinds have their required
 * fields checked; the other supported kinds are passed through untouched. Indices are used as
 * given.
 */
class BatchEntryParser {

  /** Required top-level fields of each modeled kind; a {@code |} separates alternatives. */
  private static final Map<String, List<String>> MODELED_KINDS =
      Map.of(
          "insertText", List.of("text", "location|endOfSegmentLocation"),
          "deleteContentRange", List.of("range"),
          "updateTextStyle", List.of("range", "textStyle", "fields"),
          "replaceAllText", List.of("containsText", "replaceText"),
          "insertTable", List.of("rows", "columns", "location|endOfSegmentLocation"),
          "insertInlineImage", List.of("uri", "location|endOfSegmentLocation"),
          "insertPageBreak", List.of("location|endOfSegmentLocation"),
          "createParagraphBullets", List.of("range", "bulletPreset"));

  static final Set<String> PASSTHROUGH_KINDS =
      Set.of(
          "insertTableRow",
          "insertTableColumn",
          "deleteTableRow",
          "deleteTableColumn",
          "updateParagraphStyle",
          "deleteParagraphBullets",
          "createHeader",
          "createFooter",
          "createNamedRange",
          "deleteNamedRange",
          "mergeTableCells",
          "unmergeTableCells",
          "updateTableCellStyle",
          "updateDocumentStyle");

  /** One checked entry: the requests it expands to and a short label. */
  record ParsedEntry(List<JsonNode> requests, String label) {}

  List<ParsedEntry> parse(List<? extends JsonNode> entries) {
    if (entries == null || entries.isEmpty()) {
      throw new ValidationException("'operations' must contain at least one entry");
    }
    List<ParsedEntry> parsed = new ArrayList<>();
    for (int i = 0; i < entries.size(); i++) {
      JsonNode entry = entries.get(i);
      if (entry == null || !entry.isObject()) {
        throw new ValidationException("Operation " + i + " must be a JSON object");
      }
      parsed.add(entry.has("type") ? parseShorthand(i, entry) : parseRaw(i, entry));
    }
    return parsed;
  }

  private ParsedEntry parseRaw(int position, JsonNode entry) {
    if (entry.size() != 1) {
      throw new ValidationException(
          "Operation "
              + position
              + " must have exactly one request kind as its only key, found "
              + entry.size()
              + " keys");
    }
    String kind = entry.fieldNames().next();
    JsonNode body = entry.get(kind);
    if (!body.isObject()) {
      throw new ValidationException(
          "Operation " + position + " (" + kind + ") must have an object body");
    }
    List<String> required = MODELED_KINDS.get(kind);
    if (required == null && !PASSTHROUGH_KINDS.contains(kind)) {
      throw new ValidationException(
          "Operation " + position + " has unsupported request kind '" + kind + "'");
    }
    if (required != null) {
      for (String field : required) {
        if (!hasAny(body, field.split("\\|"))) {
          throw new ValidationException(
              "Operation "
                  + position
                  + " ("
                  + kind
                  + ") is missing required field '"
                  + field.replace("|", "' or '")
                  + "'");
        }
      }
      if ("deleteContentRange".equals(kind)) {
        checkDeleteRange(position, body.path("range"));
      }
    }
    return new ParsedEntry(List.of(entry), kind);
  }

  private static boolean hasAny(JsonNode body, String[] names) {
    for (String name : names) {
      if (body.hasNonNull(name)) {
        return true;
      }
    }
    return false;
  }

  private static void checkDeleteRange(int position, JsonNode range) {
    int start = range.path("startIndex").asInt(0);
    int end = range.path("endIndex").asInt(0);
    if (end <= start) {
      throw new ValidationException(
          "Operation " + position + " deletes an empty range [" + start + "," + end + ")");
    }
    if (start == DocumentIndex.SECTION_MARKER && !range.hasNonNull("segmentId")) {
      throw new ValidationException(
          "Operation " + position + " deletes position 0, which can never be removed");
    }
  }

  private ParsedEntry parseShorthand(int position, JsonNode entry) {
    String type = entry.path("type").asText("");
    List<EditOperation> operations =
        switch (type) {
          case "insert_text" ->
              List.of(
                  EditRequests.insertText(
                      requiredInt(position, entry, "index"),
                      requiredText(position, entry, "text")));
          case "delete_text" -> {
            int start = nonMarkerStart(position, entry);
            yield List.of(
                EditRequests.deleteRange(start, requiredInt(position, entry, "end_index")));
          }
          case "replace_text" -> {
            int start = nonMarkerStart(position, entry);
            yield List.of(
                EditRequests.deleteRange(start, requiredInt(position, entry, "end_index")),
                EditRequests.insertText(start, requiredText(position, entry, "text")));
          }
          case "format_text" -> {
            TextStyle style = styleOf(entry);
            if (style.isEmpty()) {
              throw new ValidationException(
                  "Operation " + position + " (format_text) sets no formatting attribute");
            }
            yield List.of(
                EditRequests.formatText(
                    requiredInt(position, entry, "start_index"),
                    requiredInt(position, entry, "end_index"),
                    style));
          }
          case "insert_table" ->
              List.of(
                  EditRequests.insertTable(
                      requiredInt(position, entry, "index"),
                      requiredInt(position, entry, "rows"),
                      requiredInt(position, entry, "columns")));
          case "insert_page_break" ->
              List.of(EditRequests.insertPageBreak(requiredInt(position, entry, "index")));
          case "find_replace" ->
              List.of(
                  EditRequests.findReplace(
                      requiredText(position, entry, "find_text"),
                      entry.path("replace_text").asText(null),
                      entry.path("match_case").asBoolean(false)));
          default ->
              throw new ValidationException(
                  "Operation " + position + " has unsupported type '" + type + "'");
        };
    List<JsonNode> requests = new ArrayList<>();
    for (EditOperation operation : operations) {
      requests.add(operation.toRequest());
    }
    return new ParsedEntry(requests, type);
  }

  private static int nonMarkerStart(int position, JsonNode entry) {
    int start = requiredInt(position, entry, "start_index");
    if (start == DocumentIndex.SECTION_MARKER) {
      throw new ValidationException(
          "Operation " + position + " starts at position 0, which can never be removed");
    }
    return start;
  }

  private static TextStyle styleOf(JsonNode entry) {
    return new TextStyle(
        optionalBoolean(entry, "bold"),
        optionalBoolean(entry, "italic"),
        optionalBoolean(entry, "underline"),
        entry.hasNonNull("font_size") ? entry.get("font_size").asInt() : null,
        entry.hasNonNull("font_family") ? entry.get("font_family").asText() : null);
  }

  private static Boolean optionalBoolean(JsonNode entry, String field) {
    return entry.hasNonNull(field) ? entry.get(field).asBoolean() : null;
  }

  private static int requiredInt(int position, JsonNode entry, String field) {
    JsonNode value = entry.get(field);
    if (value == null || !value.isIntegralNumber() || !value.canConvertToInt()) {
      throw new ValidationException(
          "Operation "
              + position
              + " ("
              + entry.path("type").asText()
              + ") requires integer field '"
              + field
              + "'");
    }
    return value.asInt();
  }

  private static String requiredText(int position, JsonNode entry, String field) {
    JsonNode value = entry.get(field);
    if (value == null || !value.isTextual() || value.asText().isEmpty()) {
      throw new ValidationException(
          "Operation "
              + position
              + " ("
              + entry.path("type").asText()
              + ") requires non-empty text field '"
              + field
              + "'");
    }
    return value.asText();
  }

  static String replyKind(JsonNode reply) {
    Iterator<String> names = reply.fieldNames();
    return names.hasNext() ? names.next() : "empty";
  }
}
