package com.gentoro.docsmcp.docs.index;

/**
 * Addressing constants for a document body, tab body or header/footer segment.
 *
 * <p>Indices count UTF-16 code units, so a Java {@link String#length()} is the exact width of
 * inserted text. Position 0 holds the implicit section marker: nothing can be inserted there and
 * no delete may cover it.
 */
public final class DocumentIndex {

  public static final int SECTION_MARKER = 0;
  public static final int FIRST_WRITABLE = 1;

  private DocumentIndex() {}

  /** Redirects an insertion point that targets the section marker to the first writable slot. */
  public static int writable(int index) {
    return index == SECTION_MARKER ? FIRST_WRITABLE : index;
  }

  /** Width of {@code text} in the index space. */
  public static int width(String text) {
    return text == null ? 0 : text.length();
  }
}
