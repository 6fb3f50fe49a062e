package com.flamingo.ai.docsorter.service.analysis;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** {@link AnalysisTelemetry} recorded as Micrometer meters. */
@Component
@Slf4j
public class MicrometerAnalysisTelemetry implements AnalysisTelemetry {

  private final MeterRegistry meterRegistry;
  private final AtomicInteger cacheSize = new AtomicInteger();

  public MicrometerAnalysisTelemetry(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    meterRegistry.gauge("analysis.cache.size", cacheSize);
  }

  @Override
  public void cacheHit(int size) {
    cacheSize.set(size);
    meterRegistry.counter("analysis.cache", "result", "hit").increment();
  }

  @Override
  public void cacheMiss(int size) {
    cacheSize.set(size);
    meterRegistry.counter("analysis.cache", "result", "miss").increment();
  }

  @Override
  public void aiCall(String model, boolean success, Duration latency) {
    String outcome = success ? "success" : "failure";
    meterRegistry
        .counter("analysis.ai.calls", "outcome", outcome, "model", String.valueOf(model))
        .increment();
    Timer.builder("analysis.ai.latency")
        .tag("outcome", outcome)
        .register(meterRegistry)
        .record(latency);
    log.debug("AI call model={} outcome={} latency={}ms", model, outcome, latency.toMillis());
  }

  @Override
  public void retry(String reason) {
    meterRegistry.counter("analysis.ai.retries").increment();
    log.debug("Retrying AI call: {}", reason);
  }

  @Override
  public void error(String type) {
    meterRegistry.counter("analysis.ai.errors", "type", type).increment();
  }
}
