package com.flamingo.ai.docsorter.service.ai;

import com.flamingo.ai.docsorter.agent.MetadataPrompts;
import com.flamingo.ai.docsorter.config.AnalysisConfig;
import com.flamingo.ai.docsorter.domain.AnalysisOptions;
import com.flamingo.ai.docsorter.domain.AnalysisSource;
import com.flamingo.ai.docsorter.domain.DocumentAnalysis;
import com.flamingo.ai.docsorter.domain.DocumentInput;
import com.flamingo.ai.docsorter.exception.LlmServiceException;
import com.flamingo.ai.docsorter.service.analysis.AnalysisTelemetry;
import com.flamingo.ai.docsorter.service.analysis.ProcessingStats;
import com.flamingo.ai.docsorter.service.cache.ContentCache;
import com.flamingo.ai.docsorter.service.cache.ContentHasher;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.retry.Retry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Decides when to escalate to the language model and runs the AI extraction path.
 *
 * <p>Single items go through the content cache, then a retried, rate limited model call whose
 * response is validated and sanitized before it is cached. Batches either group requests by model
 * into one call per group (when the client supports it) or run chunks of single-item extractions
 * on the bounded analysis executor with a pause between chunks. Every failure is returned as an
 * {@link AiExtractionResult}; nothing here throws to the caller.
 */
@Service
@Slf4j
public class AiOrchestrator {

  /** Sleep between traditional batch chunks. */
  @FunctionalInterface
  public interface ChunkPause {
    void pause(Duration duration) throws InterruptedException;
  }

  private final LanguageModelClient client;
  private final ResponseValidator validator;
  private final MetadataSanitizer sanitizer;
  private final ContentCache cache;
  private final ProcessingStats stats;
  private final AnalysisTelemetry telemetry;
  private final AnalysisConfig config;
  private final Retry retry;
  private final RateLimiter rateLimiter;
  private final Executor executor;
  private final ChunkPause chunkPause;

  @Autowired
  public AiOrchestrator(
      LanguageModelClient client,
      ResponseValidator validator,
      MetadataSanitizer sanitizer,
      ContentCache cache,
      ProcessingStats stats,
      AnalysisTelemetry telemetry,
      AnalysisConfig config,
      Retry metadataExtractionRetry,
      RateLimiter metadataExtractionRateLimiter,
      @Qualifier("analysisExecutor") Executor executor) {
    this(
        client,
        validator,
        sanitizer,
        cache,
        stats,
        telemetry,
        config,
        metadataExtractionRetry,
        metadataExtractionRateLimiter,
        executor,
        duration -> Thread.sleep(duration.toMillis()));
  }

  AiOrchestrator(
      LanguageModelClient client,
      ResponseValidator validator,
      MetadataSanitizer sanitizer,
      ContentCache cache,
      ProcessingStats stats,
      AnalysisTelemetry telemetry,
      AnalysisConfig config,
      Retry retry,
      RateLimiter rateLimiter,
      Executor executor,
      ChunkPause chunkPause) {
    this.client = client;
    this.validator = validator;
    this.sanitizer = sanitizer;
    this.cache = cache;
    this.stats = stats;
    this.telemetry = telemetry;
    this.config = config;
    this.retry = retry;
    this.rateLimiter = rateLimiter;
    this.executor = executor;
    this.chunkPause = chunkPause;
    this.retry
        .getEventPublisher()
        .onRetry(
            event ->
                log.debug(
                    "Retry #{} of {} after {}ms",
                    event.getNumberOfRetryAttempts(),
                    event.getName(),
                    event.getWaitInterval().toMillis()));
  }

  public boolean isEnabled() {
    return config.getAi().isEnabled();
  }

  public boolean isAvailable() {
    return isEnabled() && client.isAvailable();
  }

  /**
   * Whether a heuristic result should be escalated: forced, below the confidence threshold, or
   * missing any of client, date and a real document type.
   *
   * @param analysis heuristic result
   * @param options per-call options
   * @return true when the AI path should run
   */
  public boolean shouldUseAI(DocumentAnalysis analysis, AnalysisOptions options) {
    if (options.isForceAI()) {
      return true;
    }
    if (analysis.getOverallConfidence() < options.getAiConfidenceThreshold()) {
      return true;
    }
    return !analysis.hasAllFields();
  }

  public AiExtractionResult extractMetadataAI(String text, AnalysisOptions options) {
    return extractMetadataAI(text, null, options);
  }

  /**
   * Extracts metadata for one text through the cache and the language model.
   *
   * @param text document text
   * @param model model override, null for the options or configured default
   * @param options per-call options
   * @return AI or cached analysis, or the reason there is none
   */
  public AiExtractionResult extractMetadataAI(String text, String model, AnalysisOptions options) {
    if (!isEnabled()) {
      return AiExtractionResult.failure(AiFailureReason.DISABLED, "AI extraction disabled");
    }
    if (text == null || text.isBlank()) {
      return AiExtractionResult.failure(AiFailureReason.EMPTY_INPUT, "No text to analyse");
    }

    String textHash = ContentHasher.sha256Hex(text);
    Optional<DocumentAnalysis> cached = lookup(textHash, options);
    if (cached.isPresent()) {
      return AiExtractionResult.success(cached.get());
    }

    if (!client.isAvailable()) {
      log.warn(
          "AI extraction [{}] skipped: no model configured", ContentHasher.shortHash(textHash));
      return AiExtractionResult.failure(AiFailureReason.UNAVAILABLE, "No model configured");
    }

    return extractUncached(text, textHash, resolveModel(model, options), options);
  }

  private AiExtractionResult extractUncached(
      String text, String textHash, String model, AnalysisOptions options) {
    long start = System.nanoTime();
    try {
      Optional<DocumentAnalysis> analysis = callAIService(text, textHash, model);
      telemetry.aiCall(model, analysis.isPresent(), Duration.ofNanos(System.nanoTime() - start));
      if (analysis.isEmpty()) {
        return AiExtractionResult.failure(
            AiFailureReason.RETRIES_EXHAUSTED, "No usable response after retries");
      }
      store(textHash, analysis.get(), options);
      return AiExtractionResult.success(analysis.get());
    } catch (RuntimeException e) {
      telemetry.error("extraction");
      log.warn(
          "AI extraction [{}] failed unexpectedly: {}",
          ContentHasher.shortHash(textHash),
          e.getMessage());
      return AiExtractionResult.failure(AiFailureReason.ERROR, e.getMessage());
    }
  }

  /**
   * Calls the model with retry and exponential backoff. Empty, unparseable, schema-violating and
   * data-free responses count as failed attempts, as do client exceptions.
   *
   * @param text document text
   * @param textHash hash of the text
   * @param model model identifier
   * @return sanitized AI analysis, empty once attempts are exhausted
   */
  Optional<DocumentAnalysis> callAIService(String text, String textHash, String model) {
    AnalysisConfig.Ai ai = config.getAi();
    ModelRequest request =
        new ModelRequest(
            model,
            MetadataPrompts.SYSTEM_PROMPT,
            MetadataPrompts.userPrompt(text, ai.getMaxInputChars()),
            ai.getMaxTokens(),
            ai.getTemperature());

    AtomicInteger attempts = new AtomicInteger();
    Supplier<AttemptOutcome> attempt =
        () -> {
          if (attempts.incrementAndGet() > 1) {
            telemetry.retry("attempt " + attempts.get());
          }
          return attemptOnce(request, textHash);
        };

    try {
      AttemptOutcome outcome = Retry.decorateSupplier(retry, attempt).get();
      if (outcome != null && outcome.isUsable()) {
        return Optional.of(outcome.analysis());
      }
      log.warn(
          "AI extraction [{}] unusable after {} attempts: {}",
          ContentHasher.shortHash(textHash),
          attempts.get(),
          outcome == null ? "no outcome" : outcome.failure());
    } catch (RuntimeException e) {
      if (e instanceof LlmServiceException && ((LlmServiceException) e).isRateLimited()) {
        telemetry.error("rate_limited");
      }
      log.warn(
          "AI extraction [{}] failed after {} attempts: {}",
          ContentHasher.shortHash(textHash),
          attempts.get(),
          e.getMessage());
    }
    return Optional.empty();
  }

  private AttemptOutcome attemptOnce(ModelRequest request, String textHash) {
    if (!rateLimiter.acquirePermission()) {
      return AttemptOutcome.unusable("rate limiter denied permit");
    }
    return toOutcome(client.complete(request), textHash);
  }

  private AttemptOutcome toOutcome(String raw, String textHash) {
    if (raw == null || raw.isBlank()) {
      return AttemptOutcome.unusable("empty response");
    }
    ValidationResult validation = validator.validate(raw);
    if (!validation.valid()) {
      log.debug(
          "AI response [{}] rejected: {} {}",
          ContentHasher.shortHash(textHash),
          validation.failureType(),
          validation.error());
      return AttemptOutcome.unusable(validation.failureType() + ": " + validation.error());
    }
    DocumentAnalysis analysis = sanitizer.toAnalysis(validation.data(), textHash);
    if (!analysis.hasAnyField()) {
      return AttemptOutcome.unusable("no usable data");
    }
    return AttemptOutcome.usable(analysis);
  }

  /**
   * Extracts metadata for several documents, preserving input order in the result.
   *
   * <p>The cache is consulted once per item up front; only the misses reach either batching
   * strategy. When intelligent batching fails, the items it left unresolved go through chunked
   * processing.
   *
   * @param items documents to analyse
   * @param options per-call options
   * @return one result per item, same order as {@code items}
   */
  public List<AiExtractionResult> extractMetadataAIBatch(
      List<DocumentInput> items, AnalysisOptions options) {
    if (items == null || items.isEmpty()) {
      return List.of();
    }
    AiExtractionResult[] results = new AiExtractionResult[items.size()];
    if (!isEnabled()) {
      Arrays.fill(
          results, AiExtractionResult.failure(AiFailureReason.DISABLED, "AI extraction disabled"));
      return Arrays.asList(results);
    }

    List<PendingItem> pending = resolveFromCache(items, options, results);
    if (pending.isEmpty()) {
      return Arrays.asList(results);
    }
    if (!client.isAvailable()) {
      log.warn("AI batch of {} items skipped: no model configured", pending.size());
      AiExtractionResult unavailable =
          AiExtractionResult.failure(AiFailureReason.UNAVAILABLE, "No model configured");
      pending.forEach(p -> results[p.index()] = unavailable);
      return Arrays.asList(results);
    }

    List<PendingItem> remaining = pending;
    if (options.isIntelligentBatching() && client.supportsBatching()) {
      try {
        intelligentBatch(pending, options, results);
        remaining = List.of();
      } catch (RuntimeException e) {
        telemetry.error("intelligent_batch");
        remaining = pending.stream().filter(p -> results[p.index()] == null).toList();
        log.warn(
            "Intelligent batching failed, {} of {} items fall back to chunked processing: {}",
            remaining.size(),
            pending.size(),
            e.getMessage());
      }
    }
    if (!remaining.isEmpty()) {
      traditionalBatch(remaining, options, results);
    }
    return Arrays.asList(results);
  }

  private List<PendingItem> resolveFromCache(
      List<DocumentInput> items, AnalysisOptions options, AiExtractionResult[] results) {
    List<PendingItem> pending = new ArrayList<>(items.size());
    for (int i = 0; i < items.size(); i++) {
      DocumentInput item = items.get(i);
      if (item.text() == null || item.text().isBlank()) {
        results[i] = AiExtractionResult.failure(AiFailureReason.EMPTY_INPUT, "No text to analyse");
        continue;
      }
      String textHash = ContentHasher.sha256Hex(item.text());
      Optional<DocumentAnalysis> cached = lookup(textHash, options);
      if (cached.isPresent()) {
        results[i] = AiExtractionResult.success(cached.get());
        continue;
      }
      pending.add(new PendingItem(i, item.text(), textHash, resolveModel(item.model(), options)));
    }
    return pending;
  }

  private void traditionalBatch(
      List<PendingItem> pending, AnalysisOptions options, AiExtractionResult[] results) {
    int concurrency = Math.max(1, options.getAiBatchSize());
    Duration delay = Duration.ofMillis(config.getBatch().getInterChunkDelayMs());
    int chunks = 0;

    for (int start = 0; start < pending.size(); start += concurrency) {
      int end = Math.min(start + concurrency, pending.size());
      List<CompletableFuture<IndexedResult>> inFlight = new ArrayList<>(end - start);
      for (PendingItem item : pending.subList(start, end)) {
        inFlight.add(submit(item, options));
      }
      for (CompletableFuture<IndexedResult> future : inFlight) {
        IndexedResult done = future.join();
        results[done.index()] = done.result();
      }
      chunks++;

      if (end < pending.size()) {
        pauseBetweenChunks(delay);
      }
    }
    log.info("Processed batch of {} items in {} chunks", pending.size(), chunks);
  }

  private CompletableFuture<IndexedResult> submit(PendingItem item, AnalysisOptions options) {
    try {
      return CompletableFuture.supplyAsync(
              () ->
                  new IndexedResult(
                      item.index(),
                      extractUncached(item.text(), item.textHash(), item.model(), options)),
              executor)
          .exceptionally(
              e ->
                  new IndexedResult(
                      item.index(),
                      AiExtractionResult.failure(AiFailureReason.ERROR, e.getMessage())));
    } catch (RejectedExecutionException e) {
      telemetry.error("rejected");
      log.warn(
          "Analysis executor rejected [{}]: {}",
          ContentHasher.shortHash(item.textHash()),
          e.getMessage());
      return CompletableFuture.completedFuture(
          new IndexedResult(
              item.index(),
              AiExtractionResult.failure(AiFailureReason.ERROR, "Analysis executor saturated")));
    }
  }

  private void intelligentBatch(
      List<PendingItem> pending, AnalysisOptions options, AiExtractionResult[] results) {
    Map<String, List<PendingItem>> byModel = new LinkedHashMap<>();
    pending.forEach(p -> byModel.computeIfAbsent(p.model(), m -> new ArrayList<>()).add(p));

    int groupSize = Math.max(1, options.getAiBatchSize());
    for (Map.Entry<String, List<PendingItem>> group : byModel.entrySet()) {
      List<PendingItem> items = group.getValue();
      for (int start = 0; start < items.size(); start += groupSize) {
        List<PendingItem> slice = items.subList(start, Math.min(start + groupSize, items.size()));
        completeGroup(group.getKey(), slice, options, results);
      }
    }
  }

  private void completeGroup(
      String model,
      List<PendingItem> group,
      AnalysisOptions options,
      AiExtractionResult[] results) {
    if (!rateLimiter.acquirePermission()) {
      throw new IllegalStateException("Rate limiter denied batch permit");
    }

    long start = System.nanoTime();
    List<String> responses =
        client.completeBatch(model, group.stream().map(PendingItem::text).toList());
    if (responses == null || responses.size() != group.size()) {
      throw new IllegalStateException(
          "Expected " + group.size() + " batch results for model " + model);
    }

    int usable = 0;
    for (int j = 0; j < group.size(); j++) {
      PendingItem item = group.get(j);
      AttemptOutcome outcome = toOutcome(responses.get(j), item.textHash());
      if (outcome.isUsable()) {
        store(item.textHash(), outcome.analysis(), options);
        results[item.index()] = AiExtractionResult.success(outcome.analysis());
        usable++;
      } else {
        log.debug(
            "Batch result [{}] unusable ({}), retrying individually",
            ContentHasher.shortHash(item.textHash()),
            outcome.failure());
        results[item.index()] = retryIndividually(item, options);
      }
    }
    telemetry.aiCall(model, usable > 0, Duration.ofNanos(System.nanoTime() - start));
    log.info("Batched {} documents for model {}: {} usable", group.size(), model, usable);
  }

  private AiExtractionResult retryIndividually(PendingItem item, AnalysisOptions options) {
    Optional<DocumentAnalysis> analysis =
        callAIService(item.text(), item.textHash(), item.model());
    if (analysis.isEmpty()) {
      return AiExtractionResult.failure(
          AiFailureReason.RETRIES_EXHAUSTED, "No usable response after retries");
    }
    store(item.textHash(), analysis.get(), options);
    return AiExtractionResult.success(analysis.get());
  }

  private Optional<DocumentAnalysis> lookup(String textHash, AnalysisOptions options) {
    if (!options.isUseCache() || options.isForceRefresh()) {
      return Optional.empty();
    }
    Optional<DocumentAnalysis> cached = cache.get(textHash);
    if (cached.isPresent()) {
      stats.recordCacheHit();
      telemetry.cacheHit(cache.size());
      log.debug("Content cache hit [{}]", ContentHasher.shortHash(textHash));
      return Optional.of(cached.get().toBuilder().source(AnalysisSource.AI_CACHED).build());
    }
    stats.recordCacheMiss();
    telemetry.cacheMiss(cache.size());
    return Optional.empty();
  }

  private void store(String textHash, DocumentAnalysis analysis, AnalysisOptions options) {
    if (options.isUseCache()) {
      cache.put(textHash, analysis);
    }
  }

  private String resolveModel(String model, AnalysisOptions options) {
    if (model != null && !model.isBlank()) {
      return model;
    }
    if (options.getModel() != null && !options.getModel().isBlank()) {
      return options.getModel();
    }
    return config.getAi().getModel();
  }

  private void pauseBetweenChunks(Duration delay) {
    if (delay.isZero() || delay.isNegative()) {
      return;
    }
    try {
      chunkPause.pause(delay);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while pausing between batch chunks");
    }
  }

  private record IndexedResult(int index, AiExtractionResult result) {}

  private record PendingItem(int index, String text, String textHash, String model) {}
}
