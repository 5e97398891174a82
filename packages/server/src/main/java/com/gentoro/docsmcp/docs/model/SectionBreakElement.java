package com.gentoro.docsmcp.docs.model;

public record SectionBreakElement(int startIndex, int endIndex) implements StructuralElement {

  @Override
  public ElementType type() {
    return ElementType.SECTION_BREAK;
  }
}
