package com.mk.fx.qa.stress.model;

import java.time.Duration;
import java.util.Objects;

/**
 * Classified result of a single operation invocation.
 *
 * @param type success, cancellation or failure
 * @param duration wall-clock time spent in the invocation
 * @param error the raised error for failures, {@code null} otherwise
 */
public record OperationOutcome(OutcomeType type, Duration duration, Throwable error) {

  public OperationOutcome {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(duration, "duration");
    if (type == OutcomeType.FAILURE) {
      Objects.requireNonNull(error, "failure outcome requires an error");
    }
  }

  public static OperationOutcome success(Duration duration) {
    return new OperationOutcome(OutcomeType.SUCCESS, duration, null);
  }

  public static OperationOutcome cancelled(Duration duration) {
    return new OperationOutcome(OutcomeType.CANCELLED, duration, null);
  }

  public static OperationOutcome failure(Throwable error, Duration duration) {
    return new OperationOutcome(OutcomeType.FAILURE, duration, error);
  }
}
