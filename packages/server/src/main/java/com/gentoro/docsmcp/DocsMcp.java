package com.gentoro.docsmcp;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.rolling.RollingFileAppender;
import ch.qos.logback.core.rolling.TimeBasedRollingPolicy;
import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.docsmcp.actuator.ActuatorService;
import com.gentoro.docsmcp.docs.service.DocumentService;
import com.gentoro.docsmcp.docs.service.GoogleDocsClient;
import com.gentoro.docsmcp.docs.structure.DocumentStructureParser;
import com.gentoro.docsmcp.docs.structure.DocumentTextExtractor;
import com.gentoro.docsmcp.docs.structure.StructureReporter;
import com.gentoro.docsmcp.exception.ConfigException;
import com.gentoro.docsmcp.exception.ExecutionException;
import com.gentoro.docsmcp.exception.StateException;
import com.gentoro.docsmcp.http.EmbeddedJettyServer;
import com.gentoro.docsmcp.http.OkHttpFactory;
import com.gentoro.docsmcp.logging.LoggingService;
import com.gentoro.docsmcp.mcp.McpServer;
import com.gentoro.docsmcp.tools.DocsTools;
import com.gentoro.docsmcp.utility.JacksonUtility;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import okhttp3.OkHttpClient;
import org.apache.commons.configuration2.Configuration;

/** Application container: wires configuration, the document client, the tools and Jetty. */
public class DocsMcp {

  private static final org.slf4j.Logger log = LoggingService.getLogger(DocsMcp.class);

  static final String DEFAULT_API_BASE_URL = "https://docs.googleapis.com";

  private final StartupParameters startupParameters;
  private final PrintStream out;
  private ConfigurationProvider configurationProvider;
  private OkHttpClient httpClient;
  private DocumentService documentService;
  private DocsTools docsTools;
  private EmbeddedJettyServer httpServer;
  private McpServer mcpServer;
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
  private final CountDownLatch shutdownLatch = new CountDownLatch(1);
  private volatile Thread shutdownHook;

  public DocsMcp(String[] applicationArgs) {
    this(applicationArgs, System.out);
  }

  DocsMcp(String[] applicationArgs, PrintStream out) {
    this.startupParameters = new StartupParameters(applicationArgs);
    this.out = out;
  }

  public void initialize() {
    // Route nothing through java.util.logging; SLF4J/Logback owns the output.
    LogManager.getLogManager().reset();
    Logger.getLogger("").setLevel(Level.OFF);

    if ("help".equals(startupParameters.mode())) {
      printUsage();
      return;
    }

    this.configurationProvider = new ConfigurationProvider(startupParameters.configFile());
    LoggingService.applyConfiguration(configuration());

    switch (startupParameters.mode()) {
      case "dry-run" -> {
        configureFileOnlyLogging();
        dryRun(startupParameters.getParameter("document-file", String.class));
      }
      case "server" -> startServer();
      default -> throw new IllegalArgumentException("Invalid mode: " + startupParameters.mode());
    }
  }

  private void startServer() {
    this.httpClient = OkHttpFactory.create(configuration());
    this.documentService =
        new GoogleDocsClient(
            httpClient, configuration().getString("docs.api.base-url", DEFAULT_API_BASE_URL));
    this.docsTools = new DocsTools(documentService, configuration());

    this.httpServer = new EmbeddedJettyServer(configuration());
    httpServer.prepare();
    try {
      new ActuatorService(httpServer).register();
      this.mcpServer = new McpServer(this);
      mcpServer.register();
      httpServer.start();
    } catch (Exception e) {
      shutdown();
      throw new ExecutionException("Could not start http server", e);
    }
  }

  /** Parses a saved document resource and prints its structure reports and text. */
  void dryRun(String documentFile) {
    Path path = Path.of(documentFile);
    if (!Files.isRegularFile(path)) {
      throw new ConfigException("Document file not found: " + path.toAbsolutePath());
    }
    JsonNode document;
    try {
      document = JacksonUtility.readTree(Files.readString(path, StandardCharsets.UTF_8));
    } catch (IOException e) {
      throw new ConfigException("Could not read document file " + path, e);
    }
    StructureReporter reporter = new StructureReporter(new DocumentStructureParser());
    out.println("--- SUMMARY ---");
    out.println(JacksonUtility.toPrettyJson(reporter.basic(document)));
    out.println("--- STRUCTURE ---");
    out.println(JacksonUtility.toPrettyJson(reporter.detailed(document)));
    out.println("--- CONTENT ---");
    out.println(new DocumentTextExtractor().extract(document));
    log.info("Dry run over {} completed", path);
  }

  /**
   * Detaches console appenders and sends log output to a daily rolling file under {@code
   * logging.dir}, so that a dry run's standard output carries the report only.
   */
  private void configureFileOnlyLogging() {
    LoggerContext context = (LoggerContext) org.slf4j.LoggerFactory.getILoggerFactory();
    ch.qos.logback.classic.Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);

    for (java.util.Iterator<Appender<ILoggingEvent>> it = root.iteratorForAppenders();
        it.hasNext(); ) {
      Appender<ILoggingEvent> app = it.next();
      if (app instanceof ConsoleAppender) {
        root.detachAppender(app);
      }
    }

    File logsDir = new File(configuration().getString("logging.dir", "logs"));
    if (!logsDir.exists()) {
      // noinspection ResultOfMethodCallIgnored
      logsDir.mkdirs();
    }

    RollingFileAppender<ILoggingEvent> fileAppender = new RollingFileAppender<>();
    fileAppender.setContext(context);
    fileAppender.setName("FILE");
    fileAppender.setFile(new File(logsDir, "docs-mcp.log").getPath());

    TimeBasedRollingPolicy<ILoggingEvent> rollingPolicy = new TimeBasedRollingPolicy<>();
    rollingPolicy.setContext(context);
    rollingPolicy.setParent(fileAppender);
    rollingPolicy.setFileNamePattern(new File(logsDir, "docs-mcp.%d{yyyy-MM-dd}.log.gz").getPath());
    rollingPolicy.setMaxHistory(7);
    rollingPolicy.start();

    PatternLayoutEncoder encoder = new PatternLayoutEncoder();
    encoder.setContext(context);
    encoder.setPattern("%d{yyyy-MM-dd HH:mm:ss.SSS} [%thread] %-5level %logger{36} - %msg%n");
    encoder.start();

    fileAppender.setEncoder(encoder);
    fileAppender.setRollingPolicy(rollingPolicy);
    fileAppender.start();

    root.addAppender(fileAppender);
    log.info("Dry run: console logging disabled; logging to {}", fileAppender.getFile());
  }

  private void printUsage() {
    out.println("Usage: docs-mcp-server [--config-file <location>] [--mode <mode>]");
    out.println();
    out.println("  --config-file    classpath:, file: or plain path to a YAML configuration");
    out.println("                   (default classpath:application.yaml)");
    out.println("  --mode           server (default), dry-run or help");
    out.println("  --document-file  dry-run only: saved document JSON to analyze");
  }

  /**
   * Block the current thread until a shutdown signal is received (e.g., Ctrl+C or JVM termination).
   */
  public void waitShutdownSignal() {
    if (shutdownHook == null) {
      synchronized (this) {
        if (shutdownHook == null) {
          shutdownHook = new Thread(this::shutdown, "docs-mcp-shutdown-hook");
          Runtime.getRuntime().addShutdownHook(shutdownHook);
        }
      }
    }

    try {
      shutdownLatch.await();
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    }
  }

  /** Release resources. Safe to call multiple times; executed only once. */
  public void shutdown() {
    if (shuttingDown.compareAndSet(false, true)) {
      try {
        closeQuietly(mcpServer);
        closeQuietly(httpServer);
        if (httpClient != null) {
          httpClient.dispatcher().executorService().shutdown();
          httpClient.connectionPool().evictAll();
        }
      } finally {
        shutdownLatch.countDown();
      }
    }
  }

  private void closeQuietly(AutoCloseable closeable) {
    if (closeable != null) {
      try {
        closeable.close();
      } catch (Exception e) {
        log.debug("Error while closing {}", closeable.getClass().getSimpleName(), e);
      }
    }
  }

  public boolean isServerMode() {
    return "server".equals(startupParameters.mode());
  }

  public Configuration configuration() {
    if (configurationProvider == null) {
      throw new StateException("DocsMcp not initialized. Call initialize() first.");
    }
    return configurationProvider.config();
  }

  public StartupParameters startupParameters() {
    return startupParameters;
  }

  public EmbeddedJettyServer httpServer() {
    return httpServer;
  }

  public DocumentService documentService() {
    return documentService;
  }

  public DocsTools docsTools() {
    return docsTools;
  }
}
