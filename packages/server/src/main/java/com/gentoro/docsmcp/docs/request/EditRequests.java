package com.gentoro.docsmcp.docs.request;

/**
 * Stateless constructors for primitive edits. Each validates what it can see locally (index signs,
 * range ordering, empty text); none of them knows the document, so position 0 and end-of-segment
 * rules are enforced by the edit compiler, not here.
 */
public final class EditRequests {

  private EditRequests() {}

  public static InsertText insertText(int index, String text) {
    return new InsertText(index, text);
  }

  public static InsertText insertText(int index, String text, String segmentId) {
    return new InsertText(index, text, segmentId);
  }

  public static DeleteRange deleteRange(int start, int end) {
    return new DeleteRange(start, end);
  }

  public static DeleteRange deleteRange(int start, int end, String segmentId) {
    return new DeleteRange(start, end, segmentId);
  }

  public static FormatText formatText(int start, int end, TextStyle style) {
    return new FormatText(start, end, style);
  }

  public static FormatText formatText(
      int start,
      int end,
      Boolean bold,
      Boolean italic,
      Boolean underline,
      Integer fontSize,
      String fontFamily) {
    return new FormatText(start, end, new TextStyle(bold, italic, underline, fontSize, fontFamily));
  }

  public static FindReplace findReplace(String find, String replace, boolean matchCase) {
    return new FindReplace(find, replace, matchCase);
  }

  public static InsertTable insertTable(int index, int rows, int columns) {
    return new InsertTable(index, rows, columns);
  }

  public static InsertImage insertImage(int index, String uri, Integer width, Integer height) {
    return new InsertImage(index, uri, width, height);
  }

  public static InsertPageBreak insertPageBreak(int index) {
    return new InsertPageBreak(index);
  }

  /** Bullets over {@code [start, end)}; {@code listType} as accepted by {@link BulletPreset}. */
  public static CreateBullets bulletList(int start, int end, String listType) {
    return new CreateBullets(start, end, BulletPreset.resolve(listType));
  }
}
