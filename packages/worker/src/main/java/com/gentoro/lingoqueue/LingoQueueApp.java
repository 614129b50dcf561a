package com.gentoro.lingoqueue;

public class LingoQueueApp {

  private static final org.slf4j.Logger log =
      com.gentoro.lingoqueue.logging.LoggingService.getLogger(LingoQueueApp.class);

  public static void main(String[] args) {
    try {
      LingoQueue app = new LingoQueue(args);
      app.initialize();
      // Keep the workers running until shutdown signal
      app.waitShutdownSignal();
    } catch (Exception e) {
      log.error("Application failed to start", e);
      System.exit(1);
    }
  }
}
