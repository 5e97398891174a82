package com.gentoro.docsmcp.actuator;

import com.gentoro.docsmcp.http.EmbeddedJettyServer;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.io.PrintWriter;
import org.eclipse.jetty.ee10.servlet.ServletHolder;

/**
 * Health check endpoint in the style of Spring Boot's actuator.
 *
 * <p>Registers a servlet at path: /actuator/health
 *
 * <p>Response body: {"status":"UP"}
 */
public class ActuatorService {
  private static final org.slf4j.Logger log =
      com.gentoro.docsmcp.logging.LoggingService.getLogger(ActuatorService.class);

  static final String HEALTH_PATH = "/actuator/health";

  private final EmbeddedJettyServer httpServer;

  public ActuatorService(EmbeddedJettyServer httpServer) {
    this.httpServer = httpServer;
  }

  /** Register the actuator servlet with the shared Jetty context handler. */
  public void register() {
    httpServer.getContextHandler().addServlet(new ServletHolder(new HealthServlet()), HEALTH_PATH);
    log.info("Actuator health endpoint registered at {}", HEALTH_PATH);
  }

  static class HealthServlet extends HttpServlet {
    @Override
    protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
      resp.setStatus(200);
      resp.setContentType("application/json");
      try (PrintWriter out = resp.getWriter()) {
        out.println("{\"status\": \"UP\"}");
      }
    }
  }
}
