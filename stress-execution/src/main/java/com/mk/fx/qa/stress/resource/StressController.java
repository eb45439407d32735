package com.mk.fx.qa.stress.resource;

import com.mk.fx.qa.stress.dto.HealthResponse;
import com.mk.fx.qa.stress.dto.StressControlResponse;
import com.mk.fx.qa.stress.dto.StressStatusResponse;
import com.mk.fx.qa.stress.executors.StressClient;
import com.mk.fx.qa.stress.metrics.StressRunReport;
import com.mk.fx.qa.stress.model.StressClientState;
import com.mk.fx.qa.stress.service.StressRunLifecycle;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@Tag(name = "Stress Run", description = "Endpoints for observing and controlling the stress run")
@RestController
@RequestMapping("/api/stress")
@RequiredArgsConstructor
public class StressController {

  private final StressClient stressClient;
  private final StressRunLifecycle lifecycle;
  private final ApiResponseFactory responseFactory;

  @Operation(summary = "Get run status", description = "Returns the lifecycle state and live counters.")
  @GetMapping("/status")
  public ResponseEntity<StressStatusResponse> status() {
    var config = stressClient.config();
    return responseFactory.ok(
        new StressStatusResponse(
            stressClient.state(),
            config.serverUri().toString(),
            config.concurrency(),
            config.randomSeed(),
            stressClient.snapshot()));
  }

  @Operation(
      summary = "Get run report",
      description = "Returns counters, latency percentiles and ranked failure types so far.")
  @GetMapping("/report")
  public ResponseEntity<StressRunReport> report() {
    return responseFactory.ok(stressClient.finalReport());
  }

  @Operation(summary = "Start the run", description = "Probes the target and launches the workers.")
  @PostMapping("/start")
  public ResponseEntity<StressControlResponse> start() {
    log.info("Start requested through the control API");
    stressClient.start();
    return responseFactory.ok(new StressControlResponse(stressClient.state(), "Stress run started"));
  }

  @Operation(
      summary = "Stop the run",
      description = "Raises the stop signal, waits for workers and prints the final report.")
  @PostMapping("/stop")
  public ResponseEntity<StressControlResponse> stop() {
    log.info("Stop requested through the control API");
    lifecycle.stopAndReport();
    return responseFactory.ok(new StressControlResponse(stressClient.state(), "Stress run stopped"));
  }

  @Operation(summary = "Health check", description = "UP unless the run has stopped.")
  @GetMapping("/healthy")
  public ResponseEntity<HealthResponse> health() {
    var healthy = stressClient.state() != StressClientState.STOPPED;
    log.debug("Health check: {}", healthy ? "UP" : "DOWN");
    return responseFactory.ok(new HealthResponse(healthy ? "UP" : "DOWN"));
  }
}
