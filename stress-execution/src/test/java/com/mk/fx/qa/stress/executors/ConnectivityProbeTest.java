package com.mk.fx.qa.stress.executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.mk.fx.qa.stress.rest.RestClientException;
import com.mk.fx.qa.stress.rest.StressHttpClient;
import java.io.IOException;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class ConnectivityProbeTest {

  private final StressHttpClient client = mock(StressHttpClient.class);

  private static RestClientException unreachable() {
    return new RestClientException("refused", new IOException("Connection refused"));
  }

  @Test
  void returnsOnFirstReachableAttempt() {
    when(client.probe(any())).thenThrow(unreachable()).thenReturn(404);

    new ConnectivityProbe(client, 3, Duration.ZERO, Duration.ofSeconds(1), new CancellationToken("stop"))
        .awaitReachable();

    verify(client, times(2)).probe(any());
  }

  @Test
  void givesUpAfterRetriesPlusOneAttempts() {
    when(client.probe(any())).thenThrow(unreachable());

    var ex =
        assertThrows(
            StressStartupException.class,
            () ->
                new ConnectivityProbe(
                        client, 4, Duration.ofMillis(1), Duration.ofSeconds(1), new CancellationToken("stop"))
                    .awaitReachable());

    verify(client, times(5)).probe(any());
    assertInstanceOf(RestClientException.class, ex.getCause());
  }

  @Test
  void zeroRetries_meansSingleAttempt() {
    when(client.probe(any())).thenThrow(unreachable());
    var probe = new ConnectivityProbe(client, 0, Duration.ZERO, Duration.ofSeconds(1), new CancellationToken("stop"));

    assertThrows(StressStartupException.class, probe::awaitReachable);
    verify(client, times(1)).probe(any());
  }

  @Test
  void stopDuringRetryWait_abortsProbing() {
    when(client.probe(any())).thenThrow(unreachable());
    var stop = new CancellationToken("stop");
    var probe = new ConnectivityProbe(client, 10, Duration.ofSeconds(30), Duration.ofSeconds(1), stop);

    var canceller =
        new Thread(
            () -> {
              try {
                Thread.sleep(100);
              } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
              }
              stop.cancel();
            });
    canceller.start();

    var started = System.nanoTime();
    assertThrows(StressStartupException.class, probe::awaitReachable);
    assertTrue(Duration.ofNanos(System.nanoTime() - started).compareTo(Duration.ofSeconds(10)) < 0);
    verify(client, times(1)).probe(any());
  }
}
