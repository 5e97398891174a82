package com.gentoro.docsmcp.docs.structure;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.docsmcp.docs.model.DocumentComplexity;
import com.gentoro.docsmcp.docs.model.DocumentStructure;
import com.gentoro.docsmcp.docs.model.TableElement;

/** Lightweight summary of a document for callers that do not need the element breakdown. */
public class DocumentComplexityAnalyzer {

  static final int COMPLEX_TABLES = 5;
  static final int COMPLEX_ELEMENTS = 100;
  static final int MODERATE_ELEMENTS = 20;

  private final DocumentStructureParser parser;

  public DocumentComplexityAnalyzer(DocumentStructureParser parser) {
    this.parser = parser;
  }

  public DocumentComplexity analyze(JsonNode document) {
    DocumentStructure structure = parser.parse(document);
    int elements = structure.body().size();
    int tables = structure.tables().size();
    int cells = structure.tables().stream().mapToInt(TableElement::cellCount).sum();

    return new DocumentComplexity(
        elements,
        tables,
        (int) structure.paragraphCount(),
        (int) structure.sectionBreakCount(),
        cells,
        structure.totalLength(),
        !structure.headers().isEmpty(),
        !structure.footers().isEmpty(),
        label(elements, tables));
  }

  static String label(int elements, int tables) {
    if (tables > COMPLEX_TABLES || elements > COMPLEX_ELEMENTS) {
      return "complex";
    }
    if (tables > 0 || elements > MODERATE_ELEMENTS) {
      return "moderate";
    }
    return "simple";
  }
}
