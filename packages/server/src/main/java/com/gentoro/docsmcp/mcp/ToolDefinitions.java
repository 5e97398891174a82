package com.gentoro.docsmcp.mcp;

import com.gentoro.docsmcp.tools.DocsTools;
import io.modelcontextprotocol.spec.McpSchema;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Names, descriptions and input schemas of the published tools. */
final class ToolDefinitions {

  private ToolDefinitions() {}

  static McpSchema.Tool getDocContent() {
    return tool(
        DocsTools.GET_DOC_CONTENT,
        "Retrieves the text of a Google Doc: the main body followed by every tab, each tab block"
            + " labeled with its title.",
        properties(documentId()),
        List.of("document_id"));
  }

  static McpSchema.Tool modifyDocContent() {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("type", "object");
    payload.put(
        "properties",
        properties(
            enumProperty("operation", "edit_text", "find_replace", "headers_footers"),
            property("start_index", "integer", "edit_text: start of the range (0-based)"),
            property("end_index", "integer", "edit_text: end of the range, exclusive"),
            property("text", "string", "edit_text: text to insert or replace the range with"),
            property("bold", "boolean", "edit_text: bold on/off"),
            property("italic", "boolean", "edit_text: italic on/off"),
            property("underline", "boolean", "edit_text: underline on/off"),
            property("font_size", "integer", "edit_text: font size in points (1-400)"),
            property("font_family", "string", "edit_text: font family name"),
            property("find_text", "string", "find_replace: text to search for"),
            property("replace_text", "string", "find_replace: replacement text"),
            property("match_case", "boolean", "find_replace: case-sensitive match"),
            enumProperty("section_type", "header", "footer"),
            property("content", "string", "headers_footers: new header or footer text"),
            enumProperty("header_footer_type", "DEFAULT", "FIRST_PAGE_ONLY", "EVEN_PAGE")));
    payload.put("required", List.of("operation"));
    return tool(
        DocsTools.MODIFY_DOC_CONTENT,
        "Modifies document content. payload.operation is one of: edit_text (insert, replace"
            + " and/or format text in a range), find_replace (replace all occurrences),"
            + " headers_footers (set header or footer text, creating it when missing).",
        properties(documentId(), Map.<String, Object>entry("payload", payload)),
        List.of("document_id", "payload"));
  }

  static McpSchema.Tool insertDocElements() {
    Map<String, Object> tableData = new LinkedHashMap<>();
    tableData.put("type", "array");
    tableData.put("items", Map.of("type", "array", "items", Map.of("type", "string")));
    tableData.put("description", "table: rows of cell strings, the first row being the header");
    return tool(
        DocsTools.INSERT_DOC_ELEMENTS,
        "Inserts elements at an index: text_elements (element_type table, list or page_break),"
            + " image (from a URL or Drive file id) or table (created and filled with table_data).",
        properties(
            documentId(),
            enumProperty("operation", "text_elements", "image", "table"),
            property("index", "integer", "Insertion index (0 is moved to 1)"),
            enumProperty("element_type", "table", "list", "page_break"),
            property("rows", "integer", "text_elements/table: number of rows"),
            property("columns", "integer", "text_elements/table: number of columns"),
            property("list_type", "string", "text_elements/list: UNORDERED or ORDERED"),
            property("text", "string", "text_elements/list: item text"),
            property("image_source", "string", "image: http(s) URL or Drive file id"),
            property("width", "integer", "image: width in points"),
            property("height", "integer", "image: height in points"),
            Map.<String, Object>entry("table_data", tableData),
            property("bold_headers", "boolean", "table: bold the first row (default true)")),
        List.of("document_id", "operation", "index"));
  }

  static McpSchema.Tool manageDocOperations() {
    Map<String, Object> operations = new LinkedHashMap<>();
    operations.put("type", "array");
    operations.put("items", Map.of("type", "object"));
    operations.put(
        "description",
        "batch_update: raw requests such as {\"insertText\": {...}} or typed entries such as"
            + " {\"type\": \"insert_text\", \"index\": 1, \"text\": \"Hi\"}");
    return tool(
        DocsTools.MANAGE_DOC_OPERATIONS,
        "Runs document-level operations: batch_update (submit several edits atomically),"
            + " inspect_structure (element ranges and table positions) or debug_table (per-cell"
            + " ranges and insertion indices of one table).",
        properties(
            documentId(),
            enumProperty("operation", "batch_update", "inspect_structure", "debug_table"),
            Map.<String, Object>entry("operations", operations),
            property("detailed", "boolean", "inspect_structure: full element breakdown"),
            property("table_index", "integer", "debug_table: which table, 0 for the first")),
        List.of("document_id", "operation"));
  }

  private static McpSchema.Tool tool(
      String name, String description, Map<String, Object> properties, List<String> required) {
    return McpSchema.Tool.builder()
        .name(name)
        .description(description)
        .inputSchema(
            new McpSchema.JsonSchema(
                "object",
                properties,
                required,
                false,
                Collections.emptyMap(),
                Collections.emptyMap()))
        .build();
  }

  private static Map.Entry<String, Object> documentId() {
    return property("document_id", "string", "Id of the Google Doc");
  }

  private static Map.Entry<String, Object> property(String name, String type, String description) {
    return Map.entry(name, Map.of("type", type, "description", description));
  }

  private static Map.Entry<String, Object> enumProperty(String name, String... values) {
    return Map.entry(name, Map.of("type", "string", "enum", List.of(values)));
  }

  @SafeVarargs
  private static Map<String, Object> properties(Map.Entry<String, Object>... entries) {
    Map<String, Object> properties = new LinkedHashMap<>();
    for (Map.Entry<String, Object> entry : entries) {
      properties.put(entry.getKey(), entry.getValue());
    }
    return properties;
  }
}
