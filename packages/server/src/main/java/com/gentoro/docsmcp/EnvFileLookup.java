package com.gentoro.docsmcp;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import org.apache.commons.configuration2.interpol.Lookup;

/**
 * Resolves {@code ${env:NAME}} from the process environment, falling back to the first {@code
 * .env.local} file found among the candidate paths. The file is read once, on the first miss.
 *
 * <p>Lines are {@code NAME=value}, optionally prefixed with {@code export}. Blank lines and lines
 * starting with {@code #} are skipped; matching single or double quotes around a value are
 * removed.
 */
final class EnvFileLookup implements Lookup {
  private static final org.slf4j.Logger log =
      com.gentoro.docsmcp.logging.LoggingService.getLogger(EnvFileLookup.class);

  static final List<Path> DEFAULT_CANDIDATES =
      List.of(Path.of(".env.local"), Path.of("packages", "server", ".env.local"));

  private final Function<String, String> environment;
  private final List<Path> candidates;
  private volatile Map<String, String> fileValues;

  EnvFileLookup() {
    this(System::getenv, DEFAULT_CANDIDATES);
  }

  EnvFileLookup(Function<String, String> environment, List<Path> candidates) {
    this.environment = environment;
    this.candidates = candidates;
  }

  @Override
  public Object lookup(String key) {
    String value = environment.apply(key);
    if (value != null && !value.isEmpty()) {
      return value;
    }
    return fileValues().get(key);
  }

  private Map<String, String> fileValues() {
    Map<String, String> values = fileValues;
    if (values == null) {
      synchronized (this) {
        if (fileValues == null) {
          fileValues = load();
        }
        values = fileValues;
      }
    }
    return values;
  }

  private Map<String, String> load() {
    for (Path candidate : candidates) {
      if (Files.isRegularFile(candidate)) {
        return read(candidate);
      }
    }
    log.debug("No .env.local among {}; only process environment is used", candidates);
    return Map.of();
  }

  static Map<String, String> read(Path file) {
    List<String> lines;
    try {
      lines = Files.readAllLines(file, StandardCharsets.UTF_8);
    } catch (IOException e) {
      log.warn("Could not read {}; ignoring it", file.toAbsolutePath(), e);
      return Map.of();
    }
    Map<String, String> values = new LinkedHashMap<>();
    for (int i = 0; i < lines.size(); i++) {
      String line = lines.get(i).trim();
      if (line.isEmpty() || line.startsWith("#")) {
        continue;
      }
      if (line.startsWith("export ")) {
        line = line.substring("export ".length()).trim();
      }
      int eq = line.indexOf('=');
      if (eq <= 0) {
        log.warn("Skipping line {} of {}: expected NAME=value", i + 1, file.getFileName());
        continue;
      }
      values.put(line.substring(0, eq).trim(), unquote(line.substring(eq + 1).trim()));
    }
    log.info("Loaded {} value(s) from {}", values.size(), file.toAbsolutePath());
    return values;
  }

  private static String unquote(String value) {
    if (value.length() >= 2) {
      char first = value.charAt(0);
      if ((first == '"' || first == '\'') && value.charAt(value.length() - 1) == first) {
        return value.substring(1, value.length() - 1);
      }
    }
    return value;
  }
}
