package com.flamingo.ai.docsorter.service.analysis;

import java.time.Duration;

/** Receives cache and language-model events from the AI path. */
public interface AnalysisTelemetry {

  void cacheHit(int cacheSize);

  void cacheMiss(int cacheSize);

  /**
   * Records one extraction call including its retries.
   *
   * @param model model identifier
   * @param success whether a usable analysis came back
   * @param latency wall time of the call
   */
  void aiCall(String model, boolean success, Duration latency);

  void retry(String reason);

  void error(String type);
}
