package com.gentoro.docsmcp;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Command line parameters in {@code --name value} form.
 *
 * <p>Supported: {@code --config-file} (default {@code classpath:application.yaml}), {@code --mode}
 * ({@code server}, {@code dry-run} or {@code help}; default {@code server}) and, for dry runs,
 * {@code --document-file} pointing at a saved document JSON.
 */
public class StartupParameters {

  private static final Set<String> MODES = Set.of("server", "dry-run", "help");

  final Map<String, Object> parameters = new HashMap<>();

  {
    parameters.put("config-file", "classpath:application.yaml");
    parameters.put("mode", "server");
  }

  public StartupParameters(String[] arguments) {
    this.parameters.putAll(parseArguments(arguments));
    this.validate();
  }

  private Map<String, Object> parseArguments(String[] arguments) {
    Map<String, Object> result = new HashMap<>();
    for (int p = 0; p < arguments.length; p++) {

      if (!arguments[p].startsWith("--")) {
        continue;
      }

      String paramName = arguments[p].substring(2);
      String paramValue = null;

      if (p < arguments.length - 1 && !arguments[p + 1].startsWith("--")) {
        paramValue = arguments[p + 1];
        p++;
      }

      result.put(paramName, paramValue);
    }
    return result;
  }

  private void validate() {
    Object mode = parameters.get("mode");
    if (mode == null || !MODES.contains(mode.toString())) {
      throw new IllegalArgumentException("Invalid mode: " + mode);
    }

    if (parameters.get("config-file") == null
        || parameters.get("config-file").toString().isBlank()) {
      throw new IllegalArgumentException("Missing config file location");
    }

    if ("dry-run".equals(mode)
        && (parameters.get("document-file") == null
            || parameters.get("document-file").toString().isBlank())) {
      throw new IllegalArgumentException("dry-run mode requires --document-file");
    }
  }

  /**
   * Returns the configuration location string. Examples: "classpath:application.yaml",
   * "/etc/docs-mcp.yaml", "config/local.yaml".
   */
  public String configFile() {
    return getOptionalParameter("config-file", String.class).orElse("classpath:application.yaml");
  }

  public String mode() {
    return getParameter("mode", String.class);
  }

  public <T> T getParameter(String name, Class<T> type) {
    return type.cast(parameters.get(name));
  }

  public <T> Optional<T> getOptionalParameter(String name, Class<T> type) {
    return Optional.ofNullable(type.cast(parameters.get(name)));
  }

  public boolean isParameterPresent(String name) {
    return parameters.containsKey(name);
  }
}
