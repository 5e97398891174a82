package com.gentoro.docsmcp.docs.request;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.List;

/**
 * Character formatting to apply. Only non-null attributes are sent, and the request's field mask
 * names exactly those, so untouched attributes keep their current value.
 *
 * @param fontSize size in points
 */
public record TextStyle(
    Boolean bold, Boolean italic, Boolean underline, Integer fontSize, String fontFamily) {

  public static TextStyle boldOnly() {
    return new TextStyle(true, null, null, null, null);
  }

  public boolean isEmpty() {
    return fields().isEmpty();
  }

  /** Service field names of the attributes this style sets. */
  public List<String> fields() {
    List<String> fields = new ArrayList<>();
    if (bold != null) fields.add("bold");
    if (italic != null) fields.add("italic");
    if (underline != null) fields.add("underline");
    if (fontSize != null) fields.add("fontSize");
    if (fontFamily != null && !fontFamily.isBlank()) fields.add("weightedFontFamily");
    return fields;
  }

  /** Compact {@code name=value} list used in operation summaries. */
  public String describe() {
    List<String> parts = new ArrayList<>();
    if (bold != null) parts.add("bold=" + bold);
    if (italic != null) parts.add("italic=" + italic);
    if (underline != null) parts.add("underline=" + underline);
    if (fontSize != null) parts.add("font_size=" + fontSize);
    if (fontFamily != null && !fontFamily.isBlank()) parts.add("font_family=" + fontFamily);
    return String.join(", ", parts);
  }

  ObjectNode toJson() {
    ObjectNode style = EditOperation.newObject();
    if (bold != null) style.put("bold", bold);
    if (italic != null) style.put("italic", italic);
    if (underline != null) style.put("underline", underline);
    if (fontSize != null) style.set("fontSize", EditOperation.points(fontSize));
    if (fontFamily != null && !fontFamily.isBlank()) {
      style.set("weightedFontFamily", EditOperation.newObject().put("fontFamily", fontFamily));
    }
    return style;
  }
}
