package com.gentoro.docsmcp.docs.model;

import com.gentoro.docsmcp.docs.index.IndexRange;

/** A typed node of a parsed body, addressed by its range in the owning body's index space. */
public sealed interface StructuralElement
    permits ParagraphElement, TableElement, SectionBreakElement {

  ElementType type();

  int startIndex();

  int endIndex();

  default IndexRange range() {
    return IndexRange.of(startIndex(), endIndex());
  }
}
