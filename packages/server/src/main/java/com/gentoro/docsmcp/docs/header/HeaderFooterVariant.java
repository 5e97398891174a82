package com.gentoro.docsmcp.docs.header;

import com.gentoro.docsmcp.exception.ValidationException;
import java.util.Locale;

/** Which of a section's headers or footers is addressed. */
public enum HeaderFooterVariant {
  DEFAULT("default"),
  FIRST_PAGE_ONLY("firstPage"),
  EVEN_PAGE("evenPage");

  private final String stylePrefix;

  HeaderFooterVariant(String stylePrefix) {
    this.stylePrefix = stylePrefix;
  }

  /** {@code documentStyle} field holding the segment id, e.g. {@code firstPageFooterId}. */
  public String styleField(SectionType type) {
    return stylePrefix + type.styleFieldSuffix() + "Id";
  }

  /** Missing or blank reads as {@link #DEFAULT}. */
  public static HeaderFooterVariant parse(String value) {
    if (value == null || value.isBlank()) {
      return DEFAULT;
    }
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new ValidationException(
          "Invalid 'header_footer_type' '"
              + value
              + "': expected DEFAULT, FIRST_PAGE_ONLY or EVEN_PAGE",
          e);
    }
  }
}
