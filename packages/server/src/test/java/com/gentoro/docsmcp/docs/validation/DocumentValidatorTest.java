package com.gentoro.docsmcp.docs.validation;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.docsmcp.docs.request.TextStyle;
import com.gentoro.docsmcp.exception.ValidationException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class DocumentValidatorTest {

  private final DocumentValidator validator = new DocumentValidator();

  @Test
  void acceptsServiceDocumentIds() {
    assertDoesNotThrow(
        () -> validator.validateDocumentId("1BxiMVs0XRA5nFMdKvBdBZjgmUUqptlbs74OgvE2upms"));
  }

  @ParameterizedTest
  @ValueSource(strings = {"", "  ", "doc/123", "doc 123", "../etc"})
  void rejectsMalformedDocumentIds(String id) {
    assertThrows(ValidationException.class, () -> validator.validateDocumentId(id));
  }

  @Test
  void indices() {
    assertThrows(ValidationException.class, () -> validator.validateIndex(null, "index"));
    assertThrows(ValidationException.class, () -> validator.validateIndex(-1, "index"));
    assertDoesNotThrow(() -> validator.validateIndex(0, "index"));
    assertDoesNotThrow(() -> validator.validateIndexRange(1, 2));
    ValidationException e =
        assertThrows(ValidationException.class, () -> validator.validateIndexRange(5, 5));
    assertEquals("'end_index' (5) must be greater than 'start_index' (5)", e.getMessage());
  }

  @Test
  void fontSizeBounds() {
    assertDoesNotThrow(
        () -> validator.validateTextFormatting(new TextStyle(null, null, null, 1, null)));
    assertDoesNotThrow(
        () -> validator.validateTextFormatting(new TextStyle(null, null, null, 400, null)));
    assertThrows(
        ValidationException.class,
        () -> validator.validateTextFormatting(new TextStyle(null, null, null, 0, null)));
    assertThrows(
        ValidationException.class,
        () -> validator.validateTextFormatting(new TextStyle(null, null, null, 401, null)));
  }

  @Test
  void formattingNeedsAnAttribute() {
    assertThrows(
        ValidationException.class,
        () -> validator.validateTextFormatting(new TextStyle(null, null, null, null, null)));
    assertThrows(
        ValidationException.class,
        () -> validator.validateTextFormatting(new TextStyle(null, null, null, null, " ")));
    assertDoesNotThrow(() -> validator.validateTextFormatting(TextStyle.boldOnly()));
  }

  @Test
  void textContent() {
    assertThrows(ValidationException.class, () -> validator.validateTextContent("", "text"));
    assertThrows(ValidationException.class, () -> validator.validateTextContent(null, "text"));
    assertThrows(
        ValidationException.class,
        () ->
            validator.validateTextContent(
                "x".repeat(DocumentValidator.MAX_TEXT_LENGTH + 1), "text"));
    assertDoesNotThrow(() -> validator.validateTextContent("\n", "text"));
  }

  @Test
  void tableData() {
    assertDoesNotThrow(
        () -> validator.validateTableData(List.of(List.of("a", ""), List.of("", "d"))));
    assertThrows(ValidationException.class, () -> validator.validateTableData(List.of()));
    assertThrows(ValidationException.class, () -> validator.validateTableData(List.of(List.of())));
    ValidationException ragged =
        assertThrows(
            ValidationException.class,
            () -> validator.validateTableData(List.of(List.of("a", "b"), List.of("c"))));
    assertEquals("Row 1 of 'table_data' has 1 cells; every row must have 2", ragged.getMessage());
    assertThrows(
        ValidationException.class,
        () -> validator.validateTableData(List.of(Arrays.asList("a", null))));
  }

  @Test
  void tableLimits() {
    List<List<String>> tooWide =
        List.of(Collections.nCopies(DocumentValidator.MAX_TABLE_COLUMNS + 1, "x"));
    assertThrows(ValidationException.class, () -> validator.validateTableData(tooWide));

    List<List<String>> tooTall = new ArrayList<>();
    for (int i = 0; i <= DocumentValidator.MAX_TABLE_ROWS; i++) {
      tooTall.add(List.of("x"));
    }
    assertThrows(ValidationException.class, () -> validator.validateTableData(tooTall));
  }

  @Test
  void tableDimensions() {
    assertDoesNotThrow(() -> validator.validateTableDimensions(3, 4));
    assertThrows(ValidationException.class, () -> validator.validateTableDimensions(0, 4));
    assertThrows(ValidationException.class, () -> validator.validateTableDimensions(3, null));
    assertThrows(ValidationException.class, () -> validator.validateTableDimensions(3, 21));
  }
}
