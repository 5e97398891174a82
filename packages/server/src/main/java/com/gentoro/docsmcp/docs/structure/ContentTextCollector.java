package com.gentoro.docsmcp.docs.structure;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Concatenates the text of a content list ({@code body.content}, a cell's {@code content}, a
 * header's {@code content}) in document order, descending into tables cell by cell.
 *
 * <p>Traversal uses an explicit stack of frames, each carrying the nesting level of the content it
 * iterates. Table cells one level below {@code maxDepth} are skipped, which truncates that branch
 * only; the rest of the content is still collected.
 */
public final class ContentTextCollector {

  public static final int DEFAULT_MAX_DEPTH = 5;

  private final int maxDepth;

  public ContentTextCollector() {
    this(DEFAULT_MAX_DEPTH);
  }

  public ContentTextCollector(int maxDepth) {
    this.maxDepth = Math.max(0, maxDepth);
  }

  public int maxDepth() {
    return maxDepth;
  }

  /** Every paragraph's text, blank paragraphs included. */
  public String collect(JsonNode content, int depth) {
    return collect(content, depth, false);
  }

  /**
   * @param content array of structural elements; anything else yields an empty string
   * @param depth nesting level of {@code content}, 0 for a body
   * @param skipBlankParagraphs drop paragraphs whose text is only whitespace
   */
  public String collect(JsonNode content, int depth, boolean skipBlankParagraphs) {
    if (depth > maxDepth || content == null || !content.isArray()) {
      return "";
    }
    StringBuilder out = new StringBuilder();
    Deque<Frame> stack = new ArrayDeque<>();
    stack.push(new Frame(content.elements(), depth));

    while (!stack.isEmpty()) {
      Frame frame = stack.peek();
      if (!frame.elements.hasNext()) {
        stack.pop();
        continue;
      }
      JsonNode element = frame.elements.next();
      if (element.has("paragraph")) {
        String text = paragraphText(element.get("paragraph"));
        if (!skipBlankParagraphs || !text.isBlank()) {
          out.append(text);
        }
      } else if (element.has("table")) {
        int cellDepth = frame.depth + 1;
        if (cellDepth > maxDepth) {
          continue;
        }
        stack.push(new Frame(cellContents(element.get("table")).iterator(), cellDepth));
      }
    }
    return out.toString();
  }

  /** Concatenated {@code textRun.content} of a paragraph; runs without text add nothing. */
  public static String paragraphText(JsonNode paragraph) {
    StringBuilder sb = new StringBuilder();
    for (JsonNode pe : paragraph.path("elements")) {
      JsonNode content = pe.path("textRun").path("content");
      if (content.isTextual()) {
        sb.append(content.asText());
      }
    }
    return sb.toString();
  }

  /** All structural elements of all cells of a table, rows first then columns. */
  private static List<JsonNode> cellContents(JsonNode table) {
    List<JsonNode> elements = new ArrayList<>();
    for (JsonNode row : table.path("tableRows")) {
      for (JsonNode cell : row.path("tableCells")) {
        cell.path("content").forEach(elements::add);
      }
    }
    return elements;
  }

  private static final class Frame {
    final Iterator<JsonNode> elements;
    final int depth;

    Frame(Iterator<JsonNode> elements, int depth) {
      this.elements = elements;
      this.depth = depth;
    }
  }
}
