package com.gentoro.docsmcp;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.docsmcp.exception.ConfigException;
import com.gentoro.docsmcp.exception.StateException;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;

class DocsMcpTest {

  private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
  private final PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);

  private static String sampleDocument() throws Exception {
    URL resource =
        Thread.currentThread()
            .getContextClassLoader()
            .getResource("documents/sample-document.json");
    assertNotNull(resource, "sample document fixture");
    return Path.of(resource.toURI()).toString();
  }

  private String output() {
    return buffer.toString(StandardCharsets.UTF_8);
  }

  @Test
  void dryRunPrintsReportsAndText() throws Exception {
    DocsMcp app =
        new DocsMcp(
            new String[] {
              "--config-file", "classpath:test-config.yaml",
              "--mode", "dry-run",
              "--document-file", sampleDocument()
            },
            out);

    app.initialize();

    String printed = output();
    assertFalse(app.isServerMode());
    assertTrue(printed.contains("--- SUMMARY ---"), printed);
    assertTrue(printed.contains("\"complexity\""), printed);
    assertTrue(printed.contains("--- STRUCTURE ---"), printed);
    assertTrue(printed.contains("\"title\" : \"Weekly Report\""), printed);
    assertTrue(printed.contains("--- CONTENT ---\nSummary\n"), printed);
    assertTrue(printed.contains("Done\n"), printed);
    assertTrue(
        printed.indexOf("--- SUMMARY ---") < printed.indexOf("--- STRUCTURE ---")
            && printed.indexOf("--- STRUCTURE ---") < printed.indexOf("--- CONTENT ---"));
  }

  @Test
  void dryRunWithMissingDocumentFails() {
    DocsMcp app =
        new DocsMcp(
            new String[] {
              "--config-file", "classpath:test-config.yaml",
              "--mode", "dry-run",
              "--document-file", "does/not/exist.json"
            },
            out);

    assertThrows(ConfigException.class, app::initialize);
  }

  @Test
  void helpPrintsUsageWithoutLoadingConfiguration() {
    DocsMcp app = new DocsMcp(new String[] {"--mode", "help"}, out);

    app.initialize();

    assertTrue(output().startsWith("Usage: docs-mcp-server"), output());
    assertThrows(StateException.class, app::configuration);
  }

  @Test
  void shutdownIsIdempotent() {
    DocsMcp app = new DocsMcp(new String[] {"--mode", "help"}, out);

    assertDoesNotThrow(
        () -> {
          app.shutdown();
          app.shutdown();
        });
  }
}
