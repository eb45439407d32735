package com.mk.fx.qa.stress.trace;

import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.stress.model.OperationOutcome;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class LoggingStressEventListenerTest {

  @Test
  void countsEventsUntilClosed() {
    var listener = new LoggingStressEventListener();
    listener.onOutcome(0, 0, "a", OperationOutcome.success(Duration.ofMillis(3)));
    listener.onOutcome(1, 1, "b", OperationOutcome.failure(new IllegalStateException("x"), Duration.ZERO));

    listener.close();
    listener.close();
    listener.onOutcome(0, 2, "a", OperationOutcome.cancelled(Duration.ZERO));

    assertTrue(listener.isClosed());
    assertEquals(2, listener.eventCount());
  }

  @Test
  void failureOutcome_requiresError() {
    assertThrows(NullPointerException.class, () -> OperationOutcome.failure(null, Duration.ZERO));
  }
}
