package com.mk.fx.qa.stress.metrics;

/** Per-operation (or total) outcome counters at snapshot time. */
public record OperationCounts(String operation, long successes, long cancellations, long failures) {

  public long total() {
    return successes + cancellations + failures;
  }
}
