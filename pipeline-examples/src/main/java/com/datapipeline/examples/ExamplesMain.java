package com.datapipeline.examples;

public final class ExamplesMain {
  public static void main(String[] args) throws Exception {
    System.out.println("== Data Pipeline Examples ==");
    Example01FullSetup.run();
    Example02IncrementalRun.run();
    Example03RecoveryAndErrorLog.run();
    System.out.println("-- done --");
  }
}
