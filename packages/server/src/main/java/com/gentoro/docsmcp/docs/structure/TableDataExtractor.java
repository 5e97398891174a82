package com.gentoro.docsmcp.docs.structure;

import com.gentoro.docsmcp.docs.model.TableCell;
import com.gentoro.docsmcp.docs.model.TableElement;
import java.util.ArrayList;
import java.util.List;

/** Cell texts of a parsed table as rows of strings. */
public final class TableDataExtractor {

  private TableDataExtractor() {}

  /** Each cell's text without the paragraph terminator the service keeps at its end. */
  public static List<List<String>> toData(TableElement table) {
    List<List<String>> data = new ArrayList<>(table.rows());
    for (List<TableCell> row : table.cells()) {
      List<String> values = new ArrayList<>(row.size());
      for (TableCell cell : row) {
        values.add(stripTrailingNewline(cell.content()));
      }
      data.add(values);
    }
    return data;
  }

  static String stripTrailingNewline(String text) {
    if (text == null) return "";
    int end = text.length();
    while (end > 0 && text.charAt(end - 1) == '\n') {
      end--;
    }
    return text.substring(0, end);
  }
}
