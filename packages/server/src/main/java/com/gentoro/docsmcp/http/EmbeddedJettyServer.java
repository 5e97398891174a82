package com.gentoro.docsmcp.http;

import com.gentoro.docsmcp.exception.ConfigException;
import com.gentoro.docsmcp.exception.ExceptionUtil;
import com.gentoro.docsmcp.exception.NetworkException;
import java.util.Objects;
import org.apache.commons.configuration2.Configuration;
import org.eclipse.jetty.ee10.servlet.ServletContextHandler;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;

/**
 * Embedded Jetty 12 server with a root {@link ServletContextHandler}.
 *
 * <p>This class owns the Jetty lifecycle (prepare, start, stop) and exposes the context handler
 * so that the MCP transport and the health endpoint can register their servlets.
 */
public class EmbeddedJettyServer implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.docsmcp.logging.LoggingService.getLogger(EmbeddedJettyServer.class);
  private final Configuration configuration;
  private final Object lifecycleLock = new Object();
  private Server server;
  private ServletContextHandler contextHandler;

  public EmbeddedJettyServer(Configuration configuration) {
    this.configuration = configuration;
  }

  /** Prepare the Jetty Server and root ServletContextHandler without starting it. */
  public void prepare() {
    log.trace("Initializing shared Jetty server");
    synchronized (lifecycleLock) {
      if (server != null) {
        log.trace("Server already prepared");
        return;
      }

      int port;
      try {
        port = configuration.getInt("http.port", 8080);
        log.trace("Resolving http.port: {}", port);
      } catch (Exception e) {
        throw new ConfigException("Failed to resolve http.port configuration", e);
      }

      String hostname;
      try {
        hostname = configuration.getString("http.hostname", "0.0.0.0");
        if (Objects.isNull(hostname) || hostname.isBlank()) {
          throw new ConfigException("Missing http.hostname configuration");
        }
        hostname = hostname.trim();
        log.trace("Resolving http.hostname: {}", hostname);
      } catch (Exception e) {
        throw ExceptionUtil.rethrowIfUnchecked(
            e, (ex) -> new ConfigException("Failed to resolve http.hostname configuration", ex));
      }

      try {
        if (!hostname.equals("0.0.0.0")) {
          server = new Server();
          ServerConnector connector = new ServerConnector(server);
          connector.setHost(hostname);
          connector.setPort(port);
          server.addConnector(connector);
        } else {
          server = new Server(port);
        }

        contextHandler = new ServletContextHandler();
        contextHandler.setContextPath("/");
        server.setHandler(contextHandler);
      } catch (Exception e) {
        throw new NetworkException(
            "There was a problem while attempting to initialize jetty service. "
                + "Check that the chosen port and hostname are available to this process",
            e);
      }
    }
  }

  /** Start Jetty if not already started, preparing it first when needed. */
  public void start() {
    log.trace("Starting shared Jetty server");
    synchronized (lifecycleLock) {
      if (server != null && server.isStarted()) {
        log.trace("Server already started");
        return;
      }

      if (server == null) {
        log.warn("Called start() before prepare()");
        prepare();
      }

      try {
        log.info("Starting shared Jetty server on port {}...", getPort());
        server.start();
        log.info("Jetty listening on http://localhost:{}", getPort());
      } catch (Exception e) {
        throw ExceptionUtil.rethrowIfUnchecked(
            e,
            (ex) ->
                new NetworkException(
                    "There was a problem while attempting to start jetty service. "
                        + "Check that the chosen port and hostname are available to this process",
                    ex));
      }
    }
  }

  public void stop() {
    log.trace("Stopping shared Jetty server");
    synchronized (lifecycleLock) {
      if (server != null) {
        try {
          if (server.isRunning() || server.isStarted() || server.isStarting()) {
            server.stop();
          }
        } catch (Exception e) {
          // Logged only, so that the remaining shutdown steps still run.
          log.error("Error stopping jetty server", e);
        } finally {
          server = null;
          contextHandler = null;
        }
      }
    }
  }

  public boolean isRunning() {
    synchronized (lifecycleLock) {
      return server != null && server.isRunning();
    }
  }

  public int getPort() {
    synchronized (lifecycleLock) {
      if (server != null && server.isStarted()) {
        return server.getURI().getPort();
      }
      return configuration.getInt("http.port", 8080);
    }
  }

  public ServletContextHandler getContextHandler() {
    synchronized (lifecycleLock) {
      return contextHandler;
    }
  }

  @Override
  public void close() {
    stop();
  }
}
