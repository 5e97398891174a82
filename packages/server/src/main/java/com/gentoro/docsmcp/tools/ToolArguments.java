package com.gentoro.docsmcp.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.docsmcp.exception.ValidationException;
import com.gentoro.docsmcp.utility.JacksonUtility;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Typed, read-only view over the arguments of one tool call. */
public final class ToolArguments {

  private final JsonNode node;

  private ToolArguments(JsonNode node) {
    this.node = node == null || node.isNull() ? JacksonUtility.readTree("{}") : node;
  }

  public static ToolArguments of(Map<String, Object> arguments) {
    return new ToolArguments(JacksonUtility.valueToTree(arguments == null ? Map.of() : arguments));
  }

  public static ToolArguments of(JsonNode node) {
    return new ToolArguments(node);
  }

  public boolean has(String name) {
    return node.hasNonNull(name);
  }

  public String string(String name) {
    JsonNode value = node.get(name);
    return value == null || value.isNull() ? null : value.asText();
  }

  public String requiredString(String name, String context) {
    String value = string(name);
    if (value == null || value.isEmpty()) {
      throw new ValidationException("'" + name + "' is required for " + context);
    }
    return value;
  }

  public Integer integer(String name) {
    JsonNode value = node.get(name);
    if (value == null || value.isNull()) {
      return null;
    }
    if (value.isIntegralNumber() && value.canConvertToInt()) {
      return value.asInt();
    }
    if (value.isTextual()) {
      try {
        return Integer.parseInt(value.asText().trim());
      } catch (NumberFormatException e) {
        throw new ValidationException(
            "'" + name + "' must be an integer, got '" + value.asText() + "'", e);
      }
    }
    throw new ValidationException("'" + name + "' must be an integer");
  }

  public Boolean bool(String name) {
    JsonNode value = node.get(name);
    if (value == null || value.isNull()) {
      return null;
    }
    if (value.isBoolean()) {
      return value.asBoolean();
    }
    if (value.isTextual()) {
      String text = value.asText().trim();
      if ("true".equalsIgnoreCase(text) || "false".equalsIgnoreCase(text)) {
        return Boolean.parseBoolean(text);
      }
    }
    throw new ValidationException("'" + name + "' must be a boolean");
  }

  public boolean bool(String name, boolean defaultValue) {
    Boolean value = bool(name);
    return value == null ? defaultValue : value;
  }

  public ToolArguments object(String name, String context) {
    JsonNode value = node.get(name);
    if (value == null || !value.isObject()) {
      throw new ValidationException("'" + name + "' object is required for " + context);
    }
    return new ToolArguments(value);
  }

  public List<JsonNode> array(String name) {
    JsonNode value = node.get(name);
    if (value == null || value.isNull()) {
      return null;
    }
    if (!value.isArray()) {
      throw new ValidationException("'" + name + "' must be an array");
    }
    List<JsonNode> items = new ArrayList<>();
    value.forEach(items::add);
    return items;
  }

  /** Rows of strings; numbers and booleans are taken as their text, nulls stay null. */
  public List<List<String>> table(String name) {
    List<JsonNode> rows = array(name);
    if (rows == null) {
      return null;
    }
    List<List<String>> table = new ArrayList<>();
    for (JsonNode row : rows) {
      if (!row.isArray()) {
        throw new ValidationException("Every row of '" + name + "' must be an array");
      }
      List<String> cells = new ArrayList<>();
      row.forEach(cell -> cells.add(cell.isNull() ? null : cell.asText()));
      table.add(cells);
    }
    return table;
  }
}
