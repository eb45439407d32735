package com.mk.fx.qa.stress.metrics;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

class PercentileEstimatorTest {

  private static final List<Double> ONE_TO_FIVE = List.of(5.0, 3.0, 1.0, 4.0, 2.0);

  @Test
  void median_ofOneToFive_isThree() {
    assertEquals(3.0, PercentileEstimator.percentile(ONE_TO_FIVE, 0.5));
  }

  @Test
  void bounds_returnMinAndMax() {
    assertEquals(1.0, PercentileEstimator.percentile(ONE_TO_FIVE, 0.0));
    assertEquals(5.0, PercentileEstimator.percentile(ONE_TO_FIVE, 1.0));
  }

  @Test
  void singleSample_isEveryPercentile() {
    for (double p : new double[] {0.0, 0.5, 0.99, 1.0}) {
      assertEquals(7.0, PercentileEstimator.percentile(List.of(7.0), p));
    }
  }

  @Test
  void fractionalRank_interpolates() {
    // rank = 3 * 0.5 + 1 = 2.5 -> halfway between 20 and 30
    assertEquals(25.0, PercentileEstimator.percentile(List.of(10.0, 20.0, 30.0, 40.0), 0.5), 1e-9);
    // rank = 4 * 0.75 + 1 = 4 -> exactly the fourth value
    assertEquals(4.0, PercentileEstimator.percentile(ONE_TO_FIVE, 0.75));
  }

  @Test
  void emptySample_isRejected() {
    assertThrows(IllegalArgumentException.class, () -> PercentileEstimator.percentile(List.of(), 0.5));
  }

  @Test
  void percentileOutsideUnitInterval_isRejected() {
    assertThrows(IllegalArgumentException.class, () -> PercentileEstimator.percentile(ONE_TO_FIVE, -0.1));
    assertThrows(IllegalArgumentException.class, () -> PercentileEstimator.percentile(ONE_TO_FIVE, 1.5));
  }

  @Test
  void latencyReport_roundsToTwoDecimals() {
    var report = LatencyReport.from(List.of(1.004, 2.0, 3.0));
    assertEquals(3, report.samples());
    assertEquals(2.0, report.p50());
    assertEquals(3.0, report.max());
  }
}
