package com.gentoro.docsmcp.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logger factory for the server, plus level overrides read from the {@code logging.level} block of
 * the YAML configuration:
 *
 * <pre>
 * logging:
 *   level:
 *     root: WARN
 *     com:
 *       gentoro:
 *         docsmcp: DEBUG
 * </pre>
 *
 * Nested keys name the logger by their dotted path, {@code root} names the root logger.
 */
public final class LoggingService {
  private static final Logger log = LoggerFactory.getLogger(LoggingService.class);

  private LoggingService() {}

  public static Logger getLogger(Class<?> clazz) {
    return LoggerFactory.getLogger(clazz);
  }

  /**
   * Applies every level under {@code logging.level} and returns what was set, keyed by logger
   * name. Unknown level names are skipped with a warning; when SLF4J is not bound to Logback
   * nothing is changed and logback.xml stays in charge.
   */
  public static Map<String, Level> applyConfiguration(Configuration cfg) {
    Map<String, Level> applied = new LinkedHashMap<>();
    if (cfg == null) {
      return applied;
    }
    if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
      log.warn("Logging backend is not Logback; 'logging.level' settings are ignored");
      return applied;
    }

    Configuration levels = cfg.subset("logging.level");
    Iterator<String> keys = levels.getKeys();
    while (keys.hasNext()) {
      String key = keys.next();
      String name = "root".equalsIgnoreCase(key) ? Logger.ROOT_LOGGER_NAME : key;
      String value = levels.getString(key, "").trim();
      Level level = Level.toLevel(value, null);
      if (level == null) {
        log.warn("Ignoring unknown level '{}' for logger '{}'", value, name);
        continue;
      }
      context.getLogger(name).setLevel(level);
      applied.put(name, level);
    }
    log.debug("Applied logger levels {}", applied);
    return applied;
  }
}
