package com.gentoro.docsmcp;

public class DocsMcpApp {

  private static final org.slf4j.Logger log =
      com.gentoro.docsmcp.logging.LoggingService.getLogger(DocsMcpApp.class);

  public static void main(String[] args) {
    try {
      DocsMcp app = new DocsMcp(args);
      app.initialize();
      if (app.isServerMode()) {
        app.waitShutdownSignal();
      }
    } catch (Exception e) {
      log.error("Application failed to start", e);
      System.exit(1);
    }
  }
}
