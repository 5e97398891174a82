package com.gentoro.docsmcp.docs.structure;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Plain-text rendering of a document: the main body first, then every tab depth-first.
 *
 * <p>Each tab contributes a block that starts with {@code "\n--- TAB: <title> ---\n"}, the title
 * indented by four spaces per nesting level. Blank paragraphs are omitted. Tabs have their own
 * index spaces, so no indices appear in this view.
 */
public class DocumentTextExtractor {

  static final String TAB_HEADER_FORMAT = "\n--- TAB: %s ---\n";
  static final String UNTITLED_TAB = "Untitled Tab";
  private static final String TAB_INDENT = "    ";

  private final ContentTextCollector textCollector;

  public DocumentTextExtractor() {
    this(new ContentTextCollector());
  }

  public DocumentTextExtractor(ContentTextCollector textCollector) {
    this.textCollector = textCollector;
  }

  public String extract(JsonNode document) {
    StringBuilder out = new StringBuilder();

    String main = textCollector.collect(document.path("body").path("content"), 0, true);
    if (!main.isBlank()) {
      out.append(main);
    }

    for (JsonNode tab : document.path("tabs")) {
      String tabText = extractTabTree(tab);
      if (!tabText.isBlank()) {
        out.append(tabText);
      }
    }
    return out.toString();
  }

  /** A top-level tab and all its descendants, pre-order. */
  String extractTabTree(JsonNode root) {
    StringBuilder out = new StringBuilder();
    Deque<PendingTab> stack = new ArrayDeque<>();
    stack.push(new PendingTab(root, 0));

    while (!stack.isEmpty()) {
      PendingTab pending = stack.pop();
      JsonNode documentTab = pending.tab.path("documentTab");
      if (!documentTab.isMissingNode()) {
        String title = documentTab.path("title").asText("");
        if (title.isEmpty()) {
          // the service itself reports tab titles under tabProperties
          title = pending.tab.path("tabProperties").path("title").asText("");
        }
        if (title.isEmpty()) {
          title = UNTITLED_TAB;
        }
        out.append(String.format(TAB_HEADER_FORMAT, TAB_INDENT.repeat(pending.level) + title));
        out.append(textCollector.collect(documentTab.path("body").path("content"), 0, true));
      }

      List<JsonNode> children = new ArrayList<>();
      pending.tab.path("childTabs").forEach(children::add);
      for (int i = children.size() - 1; i >= 0; i--) {
        stack.push(new PendingTab(children.get(i), pending.level + 1));
      }
    }
    return out.toString();
  }

  private record PendingTab(JsonNode tab, int level) {}
}
