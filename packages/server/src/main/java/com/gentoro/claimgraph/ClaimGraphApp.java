package com.gentoro.claimgraph;

public class ClaimGraphApp {

  private static final org.slf4j.Logger log =
      com.gentoro.claimgraph.logging.LoggingService.getLogger(ClaimGraphApp.class);

  public static void main(String[] args) {
    try (ClaimGraphRuntime runtime = new ClaimGraphRuntime(args)) {
      runtime.initialize();
      runtime.run();
    } catch (Exception e) {
      log.error("Claim graph run failed", e);
      System.exit(1);
    }
  }
}
