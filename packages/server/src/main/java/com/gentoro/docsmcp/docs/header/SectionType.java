package com.gentoro.docsmcp.docs.header;

import com.gentoro.docsmcp.exception.ValidationException;
import java.util.Locale;

public enum SectionType {
  HEADER("header", "createHeader", "Header"),
  FOOTER("footer", "createFooter", "Footer");

  private final String wireName;
  private final String createRequestKind;
  private final String styleFieldSuffix;

  SectionType(String wireName, String createRequestKind, String styleFieldSuffix) {
    this.wireName = wireName;
    this.createRequestKind = createRequestKind;
    this.styleFieldSuffix = styleFieldSuffix;
  }

  public String wireName() {
    return wireName;
  }

  public String createRequestKind() {
    return createRequestKind;
  }

  String styleFieldSuffix() {
    return styleFieldSuffix;
  }

  /** Key of the document resource's map holding segments of this type. */
  public String segmentsField() {
    return wireName + "s";
  }

  public static SectionType parse(String value) {
    if (value == null || value.isBlank()) {
      throw new ValidationException("'section_type' is required ('header' or 'footer')");
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (SectionType type : values()) {
      if (type.wireName.equals(normalized)) {
        return type;
      }
    }
    throw new ValidationException(
        "Invalid 'section_type' '" + value + "': expected 'header' or 'footer'");
  }
}
