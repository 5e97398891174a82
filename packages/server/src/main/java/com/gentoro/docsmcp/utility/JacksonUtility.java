package com.gentoro.docsmcp.utility;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.gentoro.docsmcp.exception.SerializationException;

public class JacksonUtility {

  private static final ObjectMapper JSON_MAPPER =
      new ObjectMapper()
          // Document resources carry far more fields than the parser reads
          .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
          .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false)
          .setSerializationInclusion(JsonInclude.Include.NON_NULL);

  private static final ObjectMapper PRETTY_MAPPER =
      JSON_MAPPER.copy().enable(SerializationFeature.INDENT_OUTPUT);

  public static ObjectMapper getJsonMapper() {
    return JSON_MAPPER;
  }

  public static String toJson(Object object) {
    try {
      return JSON_MAPPER.writeValueAsString(object);
    } catch (Exception e) {
      throw new SerializationException("Failed to serialize object to JSON", e);
    }
  }

  /** Indented JSON, used for the human-facing structure reports. */
  public static String toPrettyJson(Object object) {
    try {
      return PRETTY_MAPPER.writeValueAsString(object);
    } catch (Exception e) {
      throw new SerializationException("Failed to serialize object to JSON", e);
    }
  }

  public static JsonNode readTree(String json) {
    try {
      return JSON_MAPPER.readTree(json == null || json.isBlank() ? "{}" : json);
    } catch (Exception e) {
      throw new SerializationException("Failed to parse JSON content", e);
    }
  }

  public static JsonNode valueToTree(Object value) {
    try {
      return JSON_MAPPER.valueToTree(value);
    } catch (IllegalArgumentException e) {
      throw new SerializationException("Failed to convert value to JSON tree", e);
    }
  }
}
