package com.mk.fx.qa.stress.service;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.mk.fx.qa.stress.cfg.StressProperties;
import com.mk.fx.qa.stress.executors.StressClient;
import com.mk.fx.qa.stress.model.StressClientState;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class StressRunLifecycleTest {

  @Mock StressClient stressClient;

  @Test
  void autoStart_startsClientWhenReady() {
    var lifecycle = new StressRunLifecycle(stressClient, new StressProperties());

    lifecycle.onApplicationReady();

    verify(stressClient).start();
  }

  @Test
  void autoStartDisabled_leavesClientIdle() {
    var properties = new StressProperties();
    properties.setAutoStart(false);
    var lifecycle = new StressRunLifecycle(stressClient, properties);

    lifecycle.onApplicationReady();

    verify(stressClient, never()).start();
  }

  @Test
  void shutdown_stopsAndPrintsReportOnce() {
    when(stressClient.state()).thenReturn(StressClientState.RUNNING);
    var lifecycle = new StressRunLifecycle(stressClient, new StressProperties());

    lifecycle.stopAndReport();
    lifecycle.onShutdown();

    verify(stressClient, times(2)).stop();
    verify(stressClient, times(1)).printFinalReport();
  }

  @Test
  void shutdownBeforeStart_printsNothing() {
    when(stressClient.state()).thenReturn(StressClientState.CREATED);
    var lifecycle = new StressRunLifecycle(stressClient, new StressProperties());

    lifecycle.onShutdown();

    verify(stressClient).stop();
    verify(stressClient, never()).printFinalReport();
  }

  @Test
  void concurrentStops_printReportOnlyAfterWorkersDrained() throws Exception {
    when(stressClient.state()).thenReturn(StressClientState.RUNNING);
    var drained = new CountDownLatch(1);
    var stopCalls = new AtomicInteger();
    doAnswer(
            invocation -> {
              // the first caller waits for the workers, later callers return at once
              if (stopCalls.incrementAndGet() == 1) {
                assertTrue(drained.await(5, TimeUnit.SECONDS));
              }
              return null;
            })
        .when(stressClient)
        .stop();
    var lifecycle = new StressRunLifecycle(stressClient, new StressProperties());

    var apiStop = new Thread(lifecycle::stopAndReport);
    var shutdown = new Thread(lifecycle::onShutdown);
    apiStop.start();
    while (stopCalls.get() == 0) {
      Thread.sleep(5);
    }
    shutdown.start();
    Thread.sleep(200);

    verify(stressClient, never()).printFinalReport();

    drained.countDown();
    apiStop.join(5_000);
    shutdown.join(5_000);

    verify(stressClient, times(1)).printFinalReport();
  }
}
