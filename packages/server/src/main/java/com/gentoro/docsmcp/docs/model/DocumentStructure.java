package com.gentoro.docsmcp.docs.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Flattened view of a document's main body.
 *
 * @param totalLength end index of the last body element, 0 for an empty body
 * @param tables the table elements of {@code body}, in document order
 * @param headers header segment id to its extracted text
 * @param footers footer segment id to its extracted text
 */
public record DocumentStructure(
    String title,
    int totalLength,
    List<StructuralElement> body,
    List<TableElement> tables,
    Map<String, String> headers,
    Map<String, String> footers) {

  public DocumentStructure {
    body = List.copyOf(body);
    tables = List.copyOf(tables);
    headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    footers = Collections.unmodifiableMap(new LinkedHashMap<>(footers));
  }

  public long paragraphCount() {
    return body.stream().filter(e -> e.type() == ElementType.PARAGRAPH).count();
  }

  public long sectionBreakCount() {
    return body.stream().filter(e -> e.type() == ElementType.SECTION_BREAK).count();
  }
}
