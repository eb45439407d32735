package com.mk.fx.qa.stress.service;

import com.mk.fx.qa.stress.cfg.StressProperties;
import com.mk.fx.qa.stress.executors.StressClient;
import com.mk.fx.qa.stress.model.StressClientState;
import jakarta.annotation.PreDestroy;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Ties the stress client to the application lifecycle: starts it once the application is ready and
 * stops it, printing the final report, when the application shuts down (Ctrl-C or SIGTERM).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StressRunLifecycle {

  private final StressClient stressClient;
  private final StressProperties properties;
  private final AtomicBoolean reported = new AtomicBoolean(false);

  @EventListener(ApplicationReadyEvent.class)
  public void onApplicationReady() {
    if (!properties.isAutoStart()) {
      log.info("Auto-start disabled; waiting for POST /api/stress/start");
      return;
    }
    stressClient.start();
  }

  /**
   * Stops the run and prints the final report once. Safe to call repeatedly and concurrently; the
   * report is printed only after the workers have drained.
   */
  public synchronized void stopAndReport() {
    var wasRunning = stressClient.state() == StressClientState.RUNNING;
    stressClient.stop();
    if (wasRunning && reported.compareAndSet(false, true)) {
      stressClient.printFinalReport();
      log.info("Stress run finished with {} errors", stressClient.totalErrorCount());
    }
  }

  @PreDestroy
  public void onShutdown() {
    log.info("Application shutting down, stopping stress client");
    stopAndReport();
  }
}
