package com.gentoro.docsmcp.docs.validation;

import com.gentoro.docsmcp.docs.request.TextStyle;
import com.gentoro.docsmcp.exception.ValidationException;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Parameter checks shared by the document tools. Every method either returns normally or throws
 * {@link ValidationException} with a message fit for the caller; nothing here talks to the
 * service.
 */
public class DocumentValidator {

  static final int MIN_FONT_SIZE = 1;
  static final int MAX_FONT_SIZE = 400;
  static final int MAX_TABLE_ROWS = 1000;
  static final int MAX_TABLE_COLUMNS = 20;
  static final int MAX_TEXT_LENGTH = 1_000_000;

  private static final Pattern DOCUMENT_ID = Pattern.compile("[A-Za-z0-9_-]+");

  public void validateDocumentId(String documentId) {
    if (documentId == null || documentId.isBlank()) {
      throw new ValidationException("Document ID is required");
    }
    if (!DOCUMENT_ID.matcher(documentId.trim()).matches()) {
      throw new ValidationException(
          "Invalid document ID '" + documentId + "': only letters, digits, '-' and '_' allowed");
    }
  }

  public void validateIndex(Integer index, String name) {
    if (index == null) {
      throw new ValidationException("'" + name + "' is required");
    }
    if (index < 0) {
      throw new ValidationException("'" + name + "' must be non-negative, got " + index);
    }
  }

  /** {@code start >= 0} and {@code end > start}. */
  public void validateIndexRange(int start, int end) {
    validateIndex(start, "start_index");
    if (end <= start) {
      throw new ValidationException(
          "'end_index' (" + end + ") must be greater than 'start_index' (" + start + ")");
    }
  }

  public void validateTextFormatting(TextStyle style) {
    if (style == null || style.isEmpty()) {
      throw new ValidationException(
          "At least one formatting parameter (bold, italic, underline, font_size, font_family)"
              + " is required");
    }
    if (style.fontSize() != null
        && (style.fontSize() < MIN_FONT_SIZE || style.fontSize() > MAX_FONT_SIZE)) {
      throw new ValidationException(
          "'font_size' must be between "
              + MIN_FONT_SIZE
              + " and "
              + MAX_FONT_SIZE
              + " points, got "
              + style.fontSize());
    }
    if (style.fontFamily() != null && style.fontFamily().isBlank()) {
      throw new ValidationException("'font_family' must not be blank");
    }
  }

  public void validateTextContent(String text, String name) {
    if (text == null || text.isEmpty()) {
      throw new ValidationException("'" + name + "' must not be empty");
    }
    if (text.length() > MAX_TEXT_LENGTH) {
      throw new ValidationException(
          "'" + name + "' is too long (" + text.length() + " > " + MAX_TEXT_LENGTH + ")");
    }
  }

  /** Non-empty, rectangular, no null cells, within the table size limits. */
  public void validateTableData(List<List<String>> data) {
    if (data == null || data.isEmpty()) {
      throw new ValidationException("'table_data' must contain at least one row");
    }
    if (data.size() > MAX_TABLE_ROWS) {
      throw new ValidationException(
          "'table_data' has " + data.size() + " rows; at most " + MAX_TABLE_ROWS + " allowed");
    }
    List<String> first = data.get(0);
    if (first == null || first.isEmpty()) {
      throw new ValidationException("Row 0 of 'table_data' must contain at least one cell");
    }
    int columns = first.size();
    if (columns > MAX_TABLE_COLUMNS) {
      throw new ValidationException(
          "'table_data' has " + columns + " columns; at most " + MAX_TABLE_COLUMNS + " allowed");
    }
    for (int r = 0; r < data.size(); r++) {
      List<String> row = data.get(r);
      if (row == null || row.size() != columns) {
        throw new ValidationException(
            "Row "
                + r
                + " of 'table_data' has "
                + (row == null ? 0 : row.size())
                + " cells; every row must have "
                + columns);
      }
      for (int c = 0; c < columns; c++) {
        if (row.get(c) == null) {
          throw new ValidationException(
              "Cell (" + r + "," + c + ") of 'table_data' is null; use \"\" for empty cells");
        }
      }
    }
  }

  public void validateTableDimensions(Integer rows, Integer columns) {
    if (rows == null || columns == null || rows <= 0 || columns <= 0) {
      throw new ValidationException(
          "'rows' and 'columns' are required and must be positive for table insertion");
    }
    if (rows > MAX_TABLE_ROWS || columns > MAX_TABLE_COLUMNS) {
      throw new ValidationException(
          "Table may have at most " + MAX_TABLE_ROWS + " rows and " + MAX_TABLE_COLUMNS
              + " columns");
    }
  }
}
