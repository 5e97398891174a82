package com.gentoro.docsmcp.docs.index;

/**
 * Half-open range {@code [start, end)} in a document's flat index space.
 *
 * <p>Instances are plain values; they do not check {@code start < end} so that degenerate ranges
 * computed by the edit compiler can be inspected and widened explicitly.
 */
public record IndexRange(int start, int end) {

  public static IndexRange of(int start, int end) {
    return new IndexRange(start, end);
  }

  /** Range covering {@code text} once inserted at {@code index}. */
  public static IndexRange ofText(int index, String text) {
    return new IndexRange(index, index + DocumentIndex.width(text));
  }

  public int length() {
    return end - start;
  }

  public boolean isEmpty() {
    return end <= start;
  }

  /** Both ends moved by {@code delta}, as after an insert or delete ahead of the range. */
  public IndexRange shift(int delta) {
    return new IndexRange(start + delta, end + delta);
  }

  /** Same start, at least one unit wide. */
  public IndexRange atLeastOneUnit() {
    return end <= start ? new IndexRange(start, start + 1) : this;
  }

  public boolean covers(int index) {
    return index >= start && index < end;
  }

  public boolean coversSectionMarker() {
    return covers(DocumentIndex.SECTION_MARKER);
  }

  @Override
  public String toString() {
    return "[" + start + "," + end + ")";
  }
}
