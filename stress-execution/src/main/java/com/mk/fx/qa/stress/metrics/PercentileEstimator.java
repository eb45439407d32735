package com.mk.fx.qa.stress.metrics;

import java.util.Arrays;
import java.util.Collection;

/**
 * Linear-interpolation percentile estimator using the rank {@code (N - 1) * p + 1}. Integer ranks
 * return that order statistic; fractional ranks interpolate between the neighbouring two.
 */
public final class PercentileEstimator {

  private PercentileEstimator() {
    throw new UnsupportedOperationException("PercentileEstimator cannot be instantiated");
  }

  /** Sorts a copy of the samples and estimates percentile {@code p} in {@code [0, 1]}. */
  public static double percentile(Collection<Double> samples, double p) {
    return percentileOfSorted(sortedCopy(samples), p);
  }

  public static double[] sortedCopy(Collection<Double> samples) {
    double[] sorted = samples.stream().mapToDouble(Double::doubleValue).toArray();
    Arrays.sort(sorted);
    return sorted;
  }

  /**
   * Estimates percentile {@code p} of samples already sorted ascending.
   *
   * @throws IllegalArgumentException if there are no samples or {@code p} is outside {@code [0,1]}
   */
  public static double percentileOfSorted(double[] sorted, double p) {
    if (sorted.length == 0) {
      throw new IllegalArgumentException("Cannot compute a percentile of an empty sample");
    }
    if (Double.isNaN(p) || p < 0.0 || p > 1.0) {
      throw new IllegalArgumentException("Percentile must be between 0 and 1 but was " + p);
    }
    int n = sorted.length;
    double rank = (n - 1) * p + 1;
    if (rank == 1) {
      return sorted[0];
    }
    if (rank == n) {
      return sorted[n - 1];
    }
    int k = (int) rank;
    double fraction = rank - k;
    return sorted[k - 1] + fraction * (sorted[k] - sorted[k - 1]);
  }
}
