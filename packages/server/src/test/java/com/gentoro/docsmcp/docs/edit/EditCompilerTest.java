package com.gentoro.docsmcp.docs.edit;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.docsmcp.docs.request.CreateBullets;
import com.gentoro.docsmcp.docs.request.DeleteRange;
import com.gentoro.docsmcp.docs.request.EditOperation;
import com.gentoro.docsmcp.docs.request.FormatText;
import com.gentoro.docsmcp.docs.request.InsertImage;
import com.gentoro.docsmcp.docs.request.InsertPageBreak;
import com.gentoro.docsmcp.docs.request.InsertTable;
import com.gentoro.docsmcp.docs.request.InsertText;
import com.gentoro.docsmcp.docs.request.TextStyle;
import com.gentoro.docsmcp.docs.validation.DocumentValidator;
import com.gentoro.docsmcp.exception.ValidationException;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class EditCompilerTest {

  private final EditCompiler compiler = new EditCompiler(new DocumentValidator());

  private static TextEditIntent text(Integer start, Integer end, String text) {
    return new TextEditIntent(start, end, text, null);
  }

  @Test
  @DisplayName("replace of [0,10) with 'hi' inserts at 1 then deletes the shifted old range")
  void replaceFromSectionMarker() {
    CompiledEdit edit = compiler.compileTextEdit(text(0, 10, "hi"));

    assertEquals(List.of(new InsertText(1, "hi"), new DeleteRange(3, 12)), edit.operations());
  }

  @Test
  @DisplayName("replace starting at 0 never deletes position 0")
  void replaceFromSectionMarkerKeepsMarker() {
    for (int end = 1; end < 30; end++) {
      for (String replacement : List.of("a", "hello", "multi\nline")) {
        CompiledEdit edit = compiler.compileTextEdit(text(0, end, replacement));
        for (EditOperation op : edit.operations()) {
          if (op instanceof DeleteRange delete) {
            assertTrue(delete.start() > 0, "delete touches position 0: " + delete);
            // the inserted text itself is never deleted
            assertTrue(delete.start() >= 1 + replacement.length());
          }
        }
      }
    }
  }

  @Test
  @DisplayName("index-0 replace leaves the same text as deleting [1,end) and inserting at 1")
  void replaceFromSectionMarkerIsEquivalentToDirectReplace() {
    String document = "\u0000The quick brown fox";
    int end = 10;
    String replacement = "A slow";

    String viaCompiler = apply(document, compiler.compileTextEdit(text(0, end, replacement)));
    String direct = "\u0000" + replacement + document.substring(end);

    assertEquals(direct, viaCompiler);
  }

  @Test
  @DisplayName("replace of [0,1) only covers the marker, so nothing is deleted")
  void replaceOfMarkerOnlyInserts() {
    CompiledEdit edit = compiler.compileTextEdit(text(0, 1, "x"));

    assertEquals(List.of(new InsertText(1, "x")), edit.operations());
  }

  @Test
  @DisplayName("replace after the marker deletes first, then inserts at the same start")
  void replaceInsideBody() {
    CompiledEdit edit = compiler.compileTextEdit(text(5, 9, "abc"));

    assertEquals(List.of(new DeleteRange(5, 9), new InsertText(5, "abc")), edit.operations());
    assertEquals("Replaced text in range [5,9)", edit.summary());
  }

  @Test
  @DisplayName("plain insert at 0 is moved to 1")
  void insertAtZeroRedirected() {
    CompiledEdit edit = compiler.compileTextEdit(text(0, null, "Hello"));

    assertEquals(List.of(new InsertText(1, "Hello")), edit.operations());
  }

  @Test
  @DisplayName("end equal to start with text is an insert")
  void degenerateRangeIsInsert() {
    CompiledEdit edit = compiler.compileTextEdit(text(7, 7, "x"));

    assertEquals(List.of(new InsertText(7, "x")), edit.operations());
  }

  @Test
  @DisplayName("formatting after a replace covers the new text")
  void formatFollowsNewText() {
    TextStyle bold = TextStyle.boldOnly();
    CompiledEdit edit = compiler.compileTextEdit(new TextEditIntent(0, 10, "hi", bold));

    assertEquals(3, edit.operations().size());
    assertEquals(new FormatText(1, 3, bold), edit.operations().get(2));
  }

  @Test
  @DisplayName("format-only intent applies to the caller range")
  void formatOnlyUsesCallerRange() {
    TextStyle italic = new TextStyle(null, true, null, null, null);
    CompiledEdit edit = compiler.compileTextEdit(new TextEditIntent(12, 20, null, italic));

    assertEquals(List.of(new FormatText(12, 20, italic)), edit.operations());
    assertEquals("Applied formatting (italic=true) to [12,20)", edit.summary());
  }

  @Test
  @DisplayName("format-only range starting at 0 is moved to 1 and widened when degenerate")
  void formatOnlyFromMarker() {
    TextStyle underline = new TextStyle(null, null, true, null, null);

    CompiledEdit wide = compiler.compileTextEdit(new TextEditIntent(0, 6, null, underline));
    assertEquals(List.of(new FormatText(1, 6, underline)), wide.operations());

    CompiledEdit narrow = compiler.compileTextEdit(new TextEditIntent(0, 1, null, underline));
    assertEquals(List.of(new FormatText(1, 2, underline)), narrow.operations());
  }

  @Test
  @DisplayName("formatting without end_index is rejected")
  void formatRequiresEnd() {
    ValidationException ex =
        assertThrows(
            ValidationException.class,
            () ->
                compiler.compileTextEdit(
                    new TextEditIntent(3, null, "abc", TextStyle.boldOnly())));
    assertTrue(ex.getMessage().contains("end_index"));
  }

  @Test
  @DisplayName("formatting with an empty range is rejected")
  void formatRequiresNonEmptyRange() {
    assertThrows(
        ValidationException.class,
        () -> compiler.compileTextEdit(new TextEditIntent(4, 4, null, TextStyle.boldOnly())));
  }

  @Test
  @DisplayName("end before start is rejected even for plain text")
  void endBeforeStartRejected() {
    assertThrows(ValidationException.class, () -> compiler.compileTextEdit(text(9, 3, "abc")));
  }

  @Test
  @DisplayName("missing start_index and nothing-to-do intents are rejected")
  void missingParameters() {
    assertThrows(ValidationException.class, () -> compiler.compileTextEdit(text(null, 5, "a")));
    assertThrows(ValidationException.class, () -> compiler.compileTextEdit(text(1, 5, null)));
    assertThrows(ValidationException.class, () -> compiler.compileTextEdit(text(1, 5, "")));
  }

  @Test
  @DisplayName("font size outside 1..400 is rejected")
  void fontSizeBounds() {
    TextStyle huge = new TextStyle(null, null, null, 401, null);
    assertThrows(
        ValidationException.class,
        () -> compiler.compileTextEdit(new TextEditIntent(1, 5, null, huge)));
  }

  @Test
  @DisplayName("list item 'Buy milk' at 20 styles exactly the item and its newline")
  void listItem() {
    CompiledEdit edit = compiler.compileListItem(20, "Buy milk", "UNORDERED");

    assertEquals(
        List.of(
            new InsertText(20, "Buy milk\n"),
            new CreateBullets(20, 29, "BULLET_DISC_CIRCLE_SQUARE")),
        edit.operations());
  }

  @Test
  @DisplayName("list bullets always span len(text) + 1")
  void listRangeLength() {
    for (String item : List.of("a", "two words", "émoji ✓")) {
      CompiledEdit edit = compiler.compileListItem(5, item, "ORDERED");
      CreateBullets bullets = (CreateBullets) edit.operations().get(1);
      assertEquals(item.length() + 1, bullets.range().length());
      assertEquals("NUMBERED_DECIMAL_ALPHA_ROMAN", bullets.presetId());
    }
  }

  @Test
  @DisplayName("list item without text uses the default label")
  void listItemDefaultText() {
    CompiledEdit edit = compiler.compileListItem(0, null, "ordered");

    assertEquals(new InsertText(1, "List item\n"), edit.operations().get(0));
    assertEquals(
        new CreateBullets(1, 11, "NUMBERED_DECIMAL_ALPHA_ROMAN"), edit.operations().get(1));
  }

  @Test
  @DisplayName("unknown list type is rejected")
  void listTypeValidated() {
    assertThrows(ValidationException.class, () -> compiler.compileListItem(3, "x", "CIRCLES"));
  }

  @Test
  @DisplayName("single-request intents redirect index 0")
  void singleRequestIntents() {
    assertEquals(List.of(new InsertPageBreak(1)), compiler.compilePageBreak(0).operations());
    assertEquals(
        List.of(new InsertTable(8, 2, 3)), compiler.compileEmptyTable(8, 2, 3).operations());
    assertThrows(ValidationException.class, () -> compiler.compileEmptyTable(8, 0, 3));
  }

  @Test
  @DisplayName("non-URL image sources are treated as Drive file ids")
  void imageSources() {
    InsertImage fromUrl =
        (InsertImage)
            compiler.compileImage(4, "https://example.com/a.png", 100, null).operations().get(0);
    assertEquals("https://example.com/a.png", fromUrl.uri());
    assertEquals(100, fromUrl.width());

    CompiledEdit fromDrive = compiler.compileImage(4, "1AbCdEf", null, null);
    assertEquals(
        "https://drive.google.com/uc?id=1AbCdEf",
        ((InsertImage) fromDrive.operations().get(0)).uri());
    assertTrue(fromDrive.summary().contains("Drive file 1AbCdEf"));
  }

  /** Applies inserts and deletes to a string standing in for the document. */
  private static String apply(String document, CompiledEdit edit) {
    StringBuilder sb = new StringBuilder(document);
    for (EditOperation op : edit.operations()) {
      if (op instanceof InsertText insert) {
        sb.insert(insert.index(), insert.text());
      } else if (op instanceof DeleteRange delete) {
        sb.delete(delete.start(), delete.end());
      }
    }
    return sb.toString();
  }
}
