package com.mk.fx.qa.stress.cfg;

import com.mk.fx.qa.stress.executors.StressClient;
import com.mk.fx.qa.stress.model.StressConfig;
import com.mk.fx.qa.stress.operations.RestOperationFactory;
import com.mk.fx.qa.stress.rest.StressHttpClient;
import java.util.concurrent.ThreadLocalRandom;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
@EnableConfigurationProperties(StressProperties.class)
public class StressClientCfg {

  @Bean(destroyMethod = "close")
  public StressHttpClient stressHttpClient(StressProperties properties) {
    return StressHttpClient.builder()
        .baseUri(properties.getServerUri())
        .httpVersion(properties.getHttpVersion())
        .connectTimeout(properties.getConnectTimeout())
        .requestTimeout(properties.getRequestTimeout())
        .trustAllCertificates(properties.isTrustAllCertificates())
        .headers(properties.getHeaders())
        .build();
  }

  @Bean
  public StressConfig stressConfig(StressProperties properties) {
    var operations = RestOperationFactory.create(properties.getOperations());
    var seed =
        properties.getRandomSeed() != null
            ? properties.getRandomSeed()
            : ThreadLocalRandom.current().nextInt();
    log.info("Stress run seed: {}", seed);
    return StressConfig.builder()
        .serverUri(properties.getServerUri())
        .concurrency(properties.effectiveConcurrency())
        .requestTimeout(properties.getRequestTimeout())
        .randomSeed(seed)
        .displayInterval(properties.getDisplayInterval())
        .operations(operations)
        .probeRetries(properties.getProbeRetries())
        .probeRetryInterval(properties.getProbeRetryInterval())
        .probeTimeout(properties.getProbeTimeout())
        .shutdownGraceSlices(properties.getShutdownGraceSlices())
        .shutdownSlice(properties.getShutdownSlice())
        .trace(properties.isTrace())
        .build();
  }

  @Bean(destroyMethod = "")
  public StressClient stressClient(StressConfig stressConfig, StressHttpClient stressHttpClient) {
    return new StressClient(stressConfig, stressHttpClient);
  }
}
