package com.mk.fx.qa.stress.cfg;

import com.mk.fx.qa.stress.model.StressConfig;
import com.mk.fx.qa.stress.operations.RestOperationSpec;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Settings bound from {@code stress.client.*}.
 *
 * <pre>{@code
 * stress:
 *   client:
 *     server-uri: https://localhost:5001
 *     concurrency: 8
 *     request-timeout: 10s
 *     display-interval: 5s
 *     operations:
 *       - name: echo
 *         method: POST
 *         path: /echo
 *         random-payload-length: 512
 * }</pre>
 */
@Data
@Validated
@ConfigurationProperties(prefix = "stress.client")
public class StressProperties {

  @NotNull private URI serverUri = URI.create("http://localhost:5001");

  /** Worker count; zero or absent means one per available processor. */
  @Min(0)
  private int concurrency;

  /** Base seed; absent means a random seed chosen at startup. */
  private Integer randomSeed;

  @NotNull private Duration requestTimeout = Duration.ofSeconds(10);

  @NotNull private Duration connectTimeout = Duration.ofSeconds(5);

  @NotNull private Duration displayInterval = Duration.ofSeconds(5);

  @Min(0)
  private int probeRetries = StressConfig.DEFAULT_PROBE_RETRIES;

  @NotNull private Duration probeRetryInterval = Duration.ofSeconds(1);

  @NotNull private Duration probeTimeout = Duration.ofSeconds(5);

  @Min(1)
  private int shutdownGraceSlices = StressConfig.DEFAULT_SHUTDOWN_GRACE_SLICES;

  @NotNull private Duration shutdownSlice = Duration.ofSeconds(1);

  @NotNull private HttpClient.Version httpVersion = HttpClient.Version.HTTP_1_1;

  private boolean trustAllCertificates = true;

  private boolean trace;

  /** Start the run once the application is ready. */
  private boolean autoStart = true;

  private Map<String, String> headers = new LinkedHashMap<>();

  @Valid private List<RestOperationSpec> operations = new ArrayList<>();

  public int effectiveConcurrency() {
    return concurrency > 0 ? concurrency : Runtime.getRuntime().availableProcessors();
  }
}
