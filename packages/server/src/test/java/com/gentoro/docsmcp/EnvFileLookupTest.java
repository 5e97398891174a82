package com.gentoro.docsmcp;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class EnvFileLookupTest {

  @TempDir Path tempDir;

  @Test
  @DisplayName("process environment wins over the .env.local file")
  void environmentFirst() throws Exception {
    Path file = write("DOCS_TOKEN=from-file\n");
    EnvFileLookup lookup =
        new EnvFileLookup(Map.of("DOCS_TOKEN", "from-env")::get, List.of(file));

    assertEquals("from-env", lookup.lookup("DOCS_TOKEN"));
  }

  @Test
  @DisplayName("the first existing candidate file supplies missing values")
  void firstExistingCandidate() throws Exception {
    Path file = write("DOCS_TOKEN=ya29.local\n");
    EnvFileLookup lookup =
        new EnvFileLookup(Map.<String, String>of()::get, List.of(tempDir.resolve("none"), file));

    assertEquals("ya29.local", lookup.lookup("DOCS_TOKEN"));
    assertNull(lookup.lookup("OTHER"));
  }

  @Test
  @DisplayName("comments, export prefixes, quotes and malformed lines")
  void fileFormat() throws Exception {
    Path file =
        write(
            "# local secrets\n"
                + "\n"
                + "export A=1\n"
                + "B = \"two words\"\n"
                + "C='x'\n"
                + "D=\"unbalanced'\n"
                + "not a pair\n"
                + "=orphan\n");

    assertEquals(
        Map.of("A", "1", "B", "two words", "C", "x", "D", "\"unbalanced'"),
        EnvFileLookup.read(file));
  }

  @Test
  void noFileMeansNoFallback() {
    EnvFileLookup lookup =
        new EnvFileLookup(Map.<String, String>of()::get, List.of(tempDir.resolve("missing")));

    assertNull(lookup.lookup("DOCS_TOKEN"));
  }

  private Path write(String content) throws Exception {
    Path file = tempDir.resolve(".env.local");
    Files.writeString(file, content, StandardCharsets.UTF_8);
    return file;
  }
}
