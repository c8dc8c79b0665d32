package com.flamingo.ai.arabicsearch.config;

import com.flamingo.ai.arabicsearch.exception.BackendUnavailableException;
import com.flamingo.ai.arabicsearch.exception.ModelUnavailableException;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Retry policies. Every backend or model call is attempted at most twice, with a fixed wait
 * between the attempts.
 */
@Configuration
@Slf4j
public class ResilienceConfig {

  public static final String ELASTICSEARCH_RETRY = "elasticsearchRetry";
  public static final String EMBEDDING_BATCH_RETRY = "embeddingBatchRetry";

  private static final int MAX_ATTEMPTS = 2;

  @Bean(name = ELASTICSEARCH_RETRY)
  public Retry elasticsearchRetry(
      RetryRegistry retryRegistry, SearchProperties properties, MeterRegistry meterRegistry) {
    return retryOnce(
        retryRegistry,
        "elasticsearch",
        BackendUnavailableException.class,
        properties.getBackend().getRetryBackoff(),
        meterRegistry);
  }

  @Bean(name = EMBEDDING_BATCH_RETRY)
  public Retry embeddingBatchRetry(
      RetryRegistry retryRegistry, SearchProperties properties, MeterRegistry meterRegistry) {
    return retryOnce(
        retryRegistry,
        "embedding-batch",
        ModelUnavailableException.class,
        properties.getBackend().getRetryBackoff(),
        meterRegistry);
  }

  /** Builds a retry that re-attempts a call once on {@code retryOn}. */
  public static Retry retryOnce(
      RetryRegistry retryRegistry,
      String name,
      Class<? extends Throwable> retryOn,
      Duration backoff,
      MeterRegistry meterRegistry) {
    RetryConfig config =
        RetryConfig.custom()
            .maxAttempts(MAX_ATTEMPTS)
            .waitDuration(backoff)
            .retryExceptions(retryOn)
            .build();
    Retry retry = retryRegistry.retry(name, config);
    retry
        .getEventPublisher()
        .onRetry(
            event -> {
              log.warn(
                  "Retrying {} after attempt {} failed: {}",
                  name,
                  event.getNumberOfRetryAttempts(),
                  event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "");
              meterRegistry.counter("resilience.retries", "name", name).increment();
            });
    return retry;
  }
}
