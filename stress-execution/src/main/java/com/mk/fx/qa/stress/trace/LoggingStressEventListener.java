package com.mk.fx.qa.stress.trace;

import com.mk.fx.qa.stress.model.OperationOutcome;
import com.mk.fx.qa.stress.model.OutcomeType;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs each outcome on the {@code stress.trace} logger. Events arriving after {@link #close()} are
 * dropped.
 */
public class LoggingStressEventListener implements StressEventListener {

  private static final Logger TRACE = LoggerFactory.getLogger("stress.trace");

  private final AtomicBoolean closed = new AtomicBoolean(false);
  private final AtomicLong events = new AtomicLong();

  @Override
  public void onOutcome(int workerIndex, long iteration, String operation, OperationOutcome outcome) {
    if (closed.get()) {
      return;
    }
    events.incrementAndGet();
    if (outcome.type() == OutcomeType.FAILURE) {
      TRACE.info(
          "worker={} iteration={} operation={} outcome={} durationMs={} error={}",
          workerIndex,
          iteration,
          operation,
          outcome.type(),
          outcome.duration().toMillis(),
          outcome.error().toString());
    } else {
      TRACE.info(
          "worker={} iteration={} operation={} outcome={} durationMs={}",
          workerIndex,
          iteration,
          operation,
          outcome.type(),
          outcome.duration().toMillis());
    }
  }

  public long eventCount() {
    return events.get();
  }

  public boolean isClosed() {
    return closed.get();
  }

  @Override
  public void close() {
    if (closed.compareAndSet(false, true)) {
      TRACE.info("Trace listener closed after {} events", events.get());
    }
  }
}
