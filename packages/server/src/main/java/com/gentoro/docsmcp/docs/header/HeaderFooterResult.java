package com.gentoro.docsmcp.docs.header;

/**
 * @param segmentId id of the header or footer written to
 * @param created true when the segment did not exist and was created by this call
 */
public record HeaderFooterResult(
    SectionType sectionType,
    HeaderFooterVariant variant,
    String segmentId,
    boolean created,
    int charactersWritten) {

  public String describe() {
    return (created ? "Created " : "Updated ")
        + variant.name().toLowerCase(java.util.Locale.ROOT).replace('_', ' ')
        + " "
        + sectionType.wireName()
        + " ("
        + segmentId
        + ") with "
        + charactersWritten
        + " characters";
  }
}
