package com.flamingo.ai.ragworkbench.service.chunking;

import com.flamingo.ai.ragworkbench.config.ChunkingConfig;
import com.flamingo.ai.ragworkbench.domain.enums.ChunkingStrategyType;
import com.flamingo.ai.ragworkbench.exception.DocumentTooLargeException;
import com.flamingo.ai.ragworkbench.service.rag.chunking.ChunkingEngine;
import com.flamingo.ai.ragworkbench.service.rag.model.ChunkingResult;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Host-side facade over the {@link ChunkingEngine} used by the chunking preview UI.
 *
 * <p>Fills in defaults from configuration and the strategy presets, enforces the document size
 * limit and records Micrometer metrics for every run.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChunkingPreviewService {

  private final ChunkingEngine chunkingEngine;
  private final ChunkingConfig chunkingConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Chunks {@code text} for preview.
   *
   * @param text document text
   * @param strategyId requested strategy; null or blank selects the configured default
   * @param chunkSize target size; null selects the strategy preset
   * @param overlap overlap; null selects the strategy preset
   * @return the scored result, possibly with a truncated chunk list (the metrics keep the full
   *     count)
   * @throws DocumentTooLargeException if the text exceeds {@code chunking.max-document-chars}
   */
  public ChunkingResult preview(
      String text, String strategyId, Integer chunkSize, Integer overlap) {
    if (text.length() > chunkingConfig.getMaxDocumentChars()) {
      log.warn(
          "Rejecting chunking preview: {} chars exceeds limit of {}",
          text.length(),
          chunkingConfig.getMaxDocumentChars());
      throw new DocumentTooLargeException(text.length(), chunkingConfig.getMaxDocumentChars());
    }

    String requestedId =
        strategyId == null || strategyId.isBlank()
            ? chunkingConfig.getDefaultStrategy()
            : strategyId;
    ChunkingStrategyType preset =
        ChunkingStrategyType.fromId(requestedId).orElse(ChunkingStrategyType.FIXED);
    int size = chunkSize != null ? chunkSize : preset.getDefaultSize();
    int effectiveOverlap = overlap != null ? overlap : preset.getDefaultOverlap();

    Timer.Sample sample = Timer.start(meterRegistry);
    ChunkingResult result = chunkingEngine.analyze(text, requestedId, size, effectiveOverlap);
    String strategyTag = result.parameters().strategy().getId();
    sample.stop(
        Timer.builder("chunking.preview")
            .description("Time to chunk and score a document preview")
            .tag("strategy", strategyTag)
            .register(meterRegistry));
    DistributionSummary.builder("chunking.chunks.produced")
        .tag("strategy", strategyTag)
        .register(meterRegistry)
        .record(result.chunks().size());
    if (result.fallbackApplied()) {
      meterRegistry.counter("chunking.strategy.fallback").increment();
    }

    log.debug(
        "Chunking preview: strategy={}, size={}, overlap={}, chunks={}, avgQuality={}",
        strategyTag,
        result.parameters().targetSize(),
        result.parameters().overlap(),
        result.metrics().totalChunks(),
        String.format("%.2f", result.metrics().averageQuality()));

    return truncate(result);
  }

  /** Estimated token count of {@code text}. */
  @Timed(value = "chunking.tokens", description = "Time to estimate document tokens")
  public int estimateTokens(String text) {
    return chunkingEngine.estimateTokens(text);
  }

  /** Strategies offered to the UI, in catalog order. */
  public List<ChunkingStrategyType> strategies() {
    return List.of(ChunkingStrategyType.values());
  }

  private ChunkingResult truncate(ChunkingResult result) {
    int limit = chunkingConfig.getMaxPreviewChunks();
    if (limit <= 0 || result.chunks().size() <= limit) {
      return result;
    }
    return new ChunkingResult(
        result.parameters(),
        result.fallbackApplied(),
        result.chunks().subList(0, limit),
        result.metrics(),
        result.insights());
  }
}
