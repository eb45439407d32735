package com.mk.fx.qa.stress.metrics;

import java.util.Collection;

/**
 * Latency distribution in milliseconds, rounded to two decimals.
 *
 * @param samples number of samples the percentiles were computed from
 */
public record LatencyReport(
    long samples, double p50, double p75, double p99, double p999, double max) {

  public static LatencyReport from(Collection<Double> latenciesMs) {
    double[] sorted = PercentileEstimator.sortedCopy(latenciesMs);
    return new LatencyReport(
        sorted.length,
        round(PercentileEstimator.percentileOfSorted(sorted, 0.5)),
        round(PercentileEstimator.percentileOfSorted(sorted, 0.75)),
        round(PercentileEstimator.percentileOfSorted(sorted, 0.99)),
        round(PercentileEstimator.percentileOfSorted(sorted, 0.999)),
        round(PercentileEstimator.percentileOfSorted(sorted, 1.0)));
  }

  private static double round(double value) {
    return Math.round(value * 100.0) / 100.0;
  }
}
