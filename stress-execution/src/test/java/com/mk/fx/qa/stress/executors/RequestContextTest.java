package com.mk.fx.qa.stress.executors;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.Random;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import org.junit.jupiter.api.Test;

class RequestContextTest {

  private static RequestContext context(CancellationToken stop, Duration timeout) {
    return new RequestContext(null, new Random(1), stop, 2, timeout);
  }

  @Test
  void await_returnsCompletedValue() throws Exception {
    try (var ctx = context(new CancellationToken("stop"), Duration.ofSeconds(1))) {
      assertEquals("ok", ctx.await(CompletableFuture.completedFuture("ok")));
      assertFalse(ctx.isCancellationRequested());
      assertEquals(2, ctx.workerIndex());
    }
  }

  @Test
  void await_timeout_cancelsTokenAndFuture() {
    var pending = new CompletableFuture<String>();
    try (var ctx = context(new CancellationToken("stop"), Duration.ofMillis(50))) {
      var ex = assertThrows(OperationCancelledException.class, () -> ctx.await(pending));

      assertTrue(ctx.isCancellationRequested());
      assertSame(ctx.cancellationToken(), ex.getToken());
      assertTrue(pending.isCancelled());
    }
  }

  @Test
  void stopSignal_cancelsContextAndPendingFuture() throws Exception {
    var stop = new CancellationToken("stop");
    var pending = new CompletableFuture<String>();
    try (var ctx = context(stop, Duration.ofSeconds(5))) {
      var waiter = CompletableFuture.runAsync(() -> assertThrows(CancellationException.class, () -> ctx.await(pending)));
      Thread.sleep(50);

      stop.cancel();
      waiter.get();

      assertTrue(ctx.isCancellationRequested());
      assertTrue(pending.isCancelled());
    }
  }

  @Test
  void await_exceptionalFuture_throwsExecutionException() {
    try (var ctx = context(new CancellationToken("stop"), Duration.ofSeconds(1))) {
      var ex =
          assertThrows(
              ExecutionException.class,
              () -> ctx.await(CompletableFuture.failedFuture(new IllegalStateException("bad"))));
      assertInstanceOf(IllegalStateException.class, ex.getCause());
      assertFalse(ctx.isCancellationRequested());
    }
  }

  @Test
  void close_detachesFromStopSignal() {
    var stop = new CancellationToken("stop");
    var ctx = context(stop, Duration.ofSeconds(1));
    ctx.close();

    assertEquals(0, stop.registeredCallbacks());
    stop.cancel();
    assertFalse(ctx.isCancellationRequested());
  }

  @Test
  void randomHelpers_stayInRange() {
    try (var ctx = context(new CancellationToken("stop"), Duration.ofSeconds(1))) {
      for (int i = 0; i < 100; i++) {
        int value = ctx.nextRandomInt(5, 10);
        assertTrue(value >= 5 && value < 10);
        var text = ctx.nextRandomString(8);
        assertTrue(text.length() >= 1 && text.length() <= 8);
        assertTrue(text.chars().allMatch(Character::isLetterOrDigit));
      }
      assertFalse(ctx.nextRandomBoolean(0.0));
      assertTrue(ctx.nextRandomBoolean(1.0));
    }
  }
}
