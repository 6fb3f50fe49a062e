package com.flamingo.ai.docsorter.config;

import com.flamingo.ai.docsorter.domain.AnalysisOptions;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the analysis pipeline. */
@Configuration
@ConfigurationProperties(prefix = "analysis")
@Getter
@Setter
public class AnalysisConfig {

  private Ai ai = new Ai();
  private Batch batch = new Batch();
  private Cache cache = new Cache();

  /**
   * Builds the per-call option defaults from the configured values.
   *
   * @return options with configured threshold, batch size and model
   */
  public AnalysisOptions defaultOptions() {
    return AnalysisOptions.builder()
        .useAI(ai.isEnabled())
        .aiConfidenceThreshold(ai.getConfidenceThreshold())
        .aiBatchSize(batch.getSize())
        .model(ai.getModel())
        .intelligentBatching(ai.isIntelligentBatching())
        .build();
  }

  @Getter
  @Setter
  public static class Ai {
    private boolean enabled = true;
    private String model = "gpt-4o-mini";
    private double confidenceThreshold = AnalysisOptions.DEFAULT_CONFIDENCE_THRESHOLD;
    private int maxTokens = 500;
    private double temperature = 0.1;

    /** Single-document prompt truncation. */
    private int maxInputChars = 3000;

    /** Per-document truncation inside a batch prompt. */
    private int batchMaxInputChars = 1000;

    private boolean intelligentBatching = true;
    private Retry retry = new Retry();
    private RateLimit rateLimit = new RateLimit();
  }

  @Getter
  @Setter
  public static class Retry {
    private int maxAttempts = 3;
    private long initialBackoffMs = 1000;
    private double multiplier = 2.0;
  }

  @Getter
  @Setter
  public static class RateLimit {
    private int permitsPerSecond = 10;
    private long timeoutMs = 30_000;
  }

  @Getter
  @Setter
  public static class Batch {
    private int size = AnalysisOptions.DEFAULT_BATCH_SIZE;
    private long interChunkDelayMs = 100;
    private int executorPoolSize = 5;
  }

  @Getter
  @Setter
  public static class Cache {
    private int capacity = 1000;
    private Persistence persistence = new Persistence();
  }

  @Getter
  @Setter
  public static class Persistence {
    private boolean enabled = false;
    private String path =
        System.getProperty("user.home") + "/.config/document-sorter/cache/ai_cache.json";
    private long flushIntervalMs = 30_000;
  }
}
