package com.gentoro.docsmcp.docs.model;

/** Paragraph with the concatenated content of its text runs, trailing newline included. */
public record ParagraphElement(int startIndex, int endIndex, String text)
    implements StructuralElement {

  @Override
  public ElementType type() {
    return ElementType.PARAGRAPH;
  }
}
