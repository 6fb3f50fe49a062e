package com.flamingo.ai.docsorter.config;

import com.flamingo.ai.docsorter.service.ai.AttemptOutcome;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import java.time.Duration;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Retry and rate limiting for language-model calls.
 *
 * <p>Both instances are registered in the resilience4j registries so they show up on the actuator
 * {@code retries} and {@code ratelimiters} endpoints.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class ResilienceConfig {

  public static final String METADATA_EXTRACTION = "metadata-extraction";

  private final AnalysisConfig analysisConfig;

  @Bean
  public Retry metadataExtractionRetry(RetryRegistry retryRegistry) {
    AnalysisConfig.Retry retry = analysisConfig.getAi().getRetry();
    return retryRegistry.retry(
        METADATA_EXTRACTION,
        metadataRetryConfig(
            retry.getMaxAttempts(), retry.getInitialBackoffMs(), retry.getMultiplier()));
  }

  @Bean
  public RateLimiter metadataExtractionRateLimiter(RateLimiterRegistry rateLimiterRegistry) {
    AnalysisConfig.RateLimit rateLimit = analysisConfig.getAi().getRateLimit();
    return rateLimiterRegistry.rateLimiter(
        METADATA_EXTRACTION,
        rateLimiterConfig(rateLimit.getPermitsPerSecond(), rateLimit.getTimeoutMs()));
  }

  /**
   * Retry policy for a single extraction: exponential backoff, retried on any exception and on
   * unusable attempt outcomes.
   *
   * @param maxAttempts total attempts including the first
   * @param initialBackoffMs wait before the second attempt
   * @param multiplier backoff growth factor
   * @return retry configuration
   */
  public static RetryConfig metadataRetryConfig(
      int maxAttempts, long initialBackoffMs, double multiplier) {
    return RetryConfig.<AttemptOutcome>custom()
        .maxAttempts(Math.max(1, maxAttempts))
        .intervalFunction(
            IntervalFunction.ofExponentialBackoff(Math.max(1, initialBackoffMs), multiplier))
        .retryOnResult(outcome -> outcome == null || !outcome.isUsable())
        .retryExceptions(Exception.class)
        .build();
  }

  public static RateLimiterConfig rateLimiterConfig(int permitsPerSecond, long timeoutMs) {
    return RateLimiterConfig.custom()
        .limitForPeriod(Math.max(1, permitsPerSecond))
        .limitRefreshPeriod(Duration.ofSeconds(1))
        .timeoutDuration(Duration.ofMillis(timeoutMs))
        .build();
  }
}
