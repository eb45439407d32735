package com.mk.fx.qa.stress.executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.mk.fx.qa.stress.model.NamedOperation;
import com.mk.fx.qa.stress.model.StressClientState;
import com.mk.fx.qa.stress.model.StressConfig;
import com.mk.fx.qa.stress.operations.RestOperationFactory;
import com.mk.fx.qa.stress.operations.RestOperationSpec;
import com.mk.fx.qa.stress.rest.StressHttpClient;
import com.mk.fx.qa.stress.trace.LoggingStressEventListener;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class StressClientTest {

  private HttpServer server;
  private URI baseUri;

  @BeforeEach
  void setUp() throws Exception {
    server = HttpServer.create(new InetSocketAddress(0), 0);
    server.createContext("/", exchange -> respond(exchange, 200));
    server.createContext("/err", exchange -> respond(exchange, 500));
    server.setExecutor(Executors.newFixedThreadPool(4));
    server.start();
    baseUri = URI.create("http://127.0.0.1:" + server.getAddress().getPort());
  }

  @AfterEach
  void tearDown() {
    if (server != null) server.stop(0);
  }

  private static void respond(HttpExchange exchange, int status) throws IOException {
    exchange.getRequestBody().readAllBytes();
    byte[] body = "OK".getBytes();
    exchange.sendResponseHeaders(status, body.length);
    try (OutputStream os = exchange.getResponseBody()) {
      os.write(body);
    }
  }

  private static StressConfig.StressConfigBuilder baseConfig(URI uri, List<NamedOperation> operations) {
    return StressConfig.builder()
        .serverUri(uri)
        .concurrency(2)
        .randomSeed(7)
        .requestTimeout(Duration.ofSeconds(2))
        .displayInterval(Duration.ofMillis(100))
        .probeRetries(2)
        .probeRetryInterval(Duration.ofMillis(10))
        .probeTimeout(Duration.ofSeconds(1))
        .shutdownGraceSlices(5)
        .shutdownSlice(Duration.ofMillis(200))
        .operations(operations);
  }

  private static StressHttpClient http(URI uri) {
    return StressHttpClient.builder().baseUri(uri).requestTimeout(Duration.ofSeconds(2)).build();
  }

  @Test
  void fullRun_countsSuccessesAndFailures_thenStops() throws Exception {
    var operations =
        RestOperationFactory.create(
            List.of(
                RestOperationSpec.builder().name("ok").path("/").build(),
                RestOperationSpec.builder().name("err").path("/err").build()));
    var listener = new LoggingStressEventListener();
    var client = new StressClient(baseConfig(baseUri, operations).build(), http(baseUri), listener);

    client.start();
    assertThat(client.state()).isEqualTo(StressClientState.RUNNING);
    Thread.sleep(400);
    client.stop();

    assertThat(client.state()).isEqualTo(StressClientState.STOPPED);
    assertThat(listener.isClosed()).isTrue();
    var report = client.finalReport();
    var totals = report.snapshot().totals();
    assertThat(totals.successes()).isPositive();
    assertThat(totals.failures()).isPositive();
    assertThat(totals.total()).isEqualTo(report.snapshot().totalRequests());
    assertThat(client.totalErrorCount()).isEqualTo(totals.failures());
    assertThat(report.failureTypes()).isNotEmpty();
    assertThat(report.failureTypes().get(0).errorText()).contains("Unexpected status 500");
    assertThat(report.latency()).isNotNull();
    assertThat(report.latency().samples()).isEqualTo(totals.total());

    // counters are frozen once stopped
    var after = client.snapshot().totalRequests();
    Thread.sleep(100);
    assertThat(client.snapshot().totalRequests()).isEqualTo(after);
    client.printFinalReport();
  }

  @Test
  void secondStart_isRejected() {
    var client =
        new StressClient(
            baseConfig(baseUri, List.of(new NamedOperation("noop", ctx -> CompletableFuture.completedFuture(null))))
                .build(),
            http(baseUri));
    try {
      client.start();
      assertThatThrownBy(client::start).isInstanceOf(IllegalStateException.class);
    } finally {
      client.stop();
    }
    assertThatThrownBy(client::start).isInstanceOf(IllegalStateException.class);
  }

  @Test
  void stopBeforeStart_isNoOp_andForbidsStart() {
    var client =
        new StressClient(
            baseConfig(baseUri, List.of(new NamedOperation("noop", ctx -> null))).build(), http(baseUri));

    client.stop();
    client.stop();

    assertThat(client.state()).isEqualTo(StressClientState.STOPPED);
    assertThat(client.snapshot().totalRequests()).isZero();
    assertThatThrownBy(client::start).isInstanceOf(IllegalStateException.class);
  }

  @Test
  void unreachableTarget_failsStart() throws Exception {
    int port;
    try (var socket = new ServerSocket(0)) {
      port = socket.getLocalPort();
    }
    var dead = URI.create("http://127.0.0.1:" + port);
    var client =
        new StressClient(baseConfig(dead, List.of(new NamedOperation("noop", ctx -> null))).build(), http(dead));

    assertThatThrownBy(client::start).isInstanceOf(StressStartupException.class);
    assertThat(client.state()).isEqualTo(StressClientState.STOPPED);
    assertThat(client.snapshot().totalRequests()).isZero();
    client.stop();
  }

  @Test
  void workersStuckPastGraceWindow_doNotBlockStop() {
    var config =
        baseConfig(
                baseUri,
                List.of(
                    new NamedOperation(
                        "stuck",
                        ctx -> {
                          Thread.sleep(2_000);
                          return null;
                        })))
            .concurrency(1)
            .shutdownGraceSlices(2)
            .shutdownSlice(Duration.ofMillis(50))
            .build();
    var client = new StressClient(config, http(baseUri));
    client.start();

    var started = System.nanoTime();
    client.stop();

    assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(1));
    assertThat(client.state()).isEqualTo(StressClientState.STOPPED);
  }
}
