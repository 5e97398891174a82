package com.gentoro.docsmcp.docs.index;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class IndexRangeTest {

  @Test
  void textRangeCountsUtf16Units() {
    assertEquals(IndexRange.of(4, 9), IndexRange.ofText(4, "hello"));
    // one supplementary character is two code units
    assertEquals(2, IndexRange.ofText(1, "😀").length());
  }

  @Test
  void shiftAndWiden() {
    IndexRange range = IndexRange.of(1, 10);
    assertEquals(IndexRange.of(3, 12), range.shift(2));
    assertEquals(IndexRange.of(5, 6), IndexRange.of(5, 5).atLeastOneUnit());
    assertSame(range, range.atLeastOneUnit());
    assertTrue(IndexRange.of(0, 3).coversSectionMarker());
    assertFalse(IndexRange.of(1, 3).coversSectionMarker());
    assertEquals("[1,10)", range.toString());
  }

  @Test
  void writableRedirectsOnlyTheMarker() {
    assertEquals(DocumentIndex.FIRST_WRITABLE, DocumentIndex.writable(0));
    assertEquals(7, DocumentIndex.writable(7));
  }
}
