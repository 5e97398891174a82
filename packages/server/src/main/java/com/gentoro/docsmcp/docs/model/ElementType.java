package com.gentoro.docsmcp.docs.model;

/** Kinds of top-level structural elements the parser reports. */
public enum ElementType {
  PARAGRAPH("paragraph"),
  TABLE("table"),
  SECTION_BREAK("sectionBreak");

  private final String wireName;

  ElementType(String wireName) {
    this.wireName = wireName;
  }

  /** Field name tagging this element in the document resource, also used in reports. */
  public String wireName() {
    return wireName;
  }
}
