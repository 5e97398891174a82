package com.gentoro.docsmcp.docs.edit;

import com.gentoro.docsmcp.docs.request.TextStyle;

/**
 * Insert, replace and/or format text.
 *
 * <p>A non-degenerate {@code [startIndex, endIndex)} with text means replace; text without a range
 * (or with {@code endIndex == startIndex}) means insert at {@code startIndex}. A style applies to
 * the new text when text is given, otherwise to the range.
 */
public record TextEditIntent(Integer startIndex, Integer endIndex, String text, TextStyle style) {

  public boolean hasText() {
    return text != null;
  }

  public boolean hasStyle() {
    return style != null && !style.isEmpty();
  }

  public boolean isReplacement() {
    return hasText() && endIndex != null && startIndex != null && endIndex > startIndex;
  }
}
