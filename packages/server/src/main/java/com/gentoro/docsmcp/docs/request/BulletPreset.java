package com.gentoro.docsmcp.docs.request;

import com.gentoro.docsmcp.exception.ValidationException;
import java.util.Arrays;
import java.util.Locale;

/** List styles callers can ask for, mapped to the service's bullet glyph presets. */
public enum BulletPreset {
  UNORDERED("BULLET_DISC_CIRCLE_SQUARE"),
  ORDERED("NUMBERED_DECIMAL_ALPHA_ROMAN");

  private final String presetId;

  BulletPreset(String presetId) {
    this.presetId = presetId;
  }

  public String presetId() {
    return presetId;
  }

  /**
   * Resolves a list type ({@code UNORDERED}, {@code ORDERED}, case-insensitive) or a raw preset id
   * such as {@code BULLET_CHECKBOX} to the preset id sent to the service.
   */
  public static String resolve(String listType) {
    if (listType == null || listType.isBlank()) {
      throw new ValidationException("List type is required ('UNORDERED' or 'ORDERED')");
    }
    String normalized = listType.trim().toUpperCase(Locale.ROOT);
    return Arrays.stream(values())
        .filter(p -> p.name().equals(normalized))
        .map(BulletPreset::presetId)
        .findFirst()
        .orElseGet(
            () -> {
              if (normalized.startsWith("BULLET_") || normalized.startsWith("NUMBERED_")) {
                return normalized;
              }
              throw new ValidationException(
                  "Unsupported list type '" + listType + "'. Use 'UNORDERED' or 'ORDERED'");
            });
  }
}
