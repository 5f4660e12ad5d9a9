package com.flamingo.ai.ragworkbench.service.rag.chunking;

import com.flamingo.ai.ragworkbench.domain.enums.ChunkingStrategyType;
import com.flamingo.ai.ragworkbench.service.rag.chunking.assembler.ChunkAssembler;
import com.flamingo.ai.ragworkbench.service.rag.chunking.assembler.FixedSizeChunkAssembler;
import com.flamingo.ai.ragworkbench.service.rag.chunking.assembler.ParagraphBoundaryChunkAssembler;
import com.flamingo.ai.ragworkbench.service.rag.chunking.assembler.SemanticChunkAssembler;
import com.flamingo.ai.ragworkbench.service.rag.chunking.assembler.SentenceBoundaryChunkAssembler;
import com.flamingo.ai.ragworkbench.service.rag.chunking.assembler.SlidingWindowChunkAssembler;
import com.flamingo.ai.ragworkbench.service.rag.chunking.quality.ChunkQualityScorer;
import com.flamingo.ai.ragworkbench.service.rag.chunking.quality.StrategyInsightGenerator;
import com.flamingo.ai.ragworkbench.service.rag.chunking.splitter.ParagraphSplitter;
import com.flamingo.ai.ragworkbench.service.rag.chunking.splitter.SentenceSplitter;
import com.flamingo.ai.ragworkbench.service.rag.chunking.splitter.WordSplitter;
import com.flamingo.ai.ragworkbench.service.rag.model.ChunkRecord;
import com.flamingo.ai.ragworkbench.service.rag.model.ChunkingMetrics;
import com.flamingo.ai.ragworkbench.service.rag.model.ChunkingParameters;
import com.flamingo.ai.ragworkbench.service.rag.model.ChunkingResult;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Public entry point of the chunking engine.
 *
 * <p>Resolves the strategy, clamps the parameters, runs the matching {@link ChunkAssembler} and,
 * for {@link #analyze}, scores the result. The engine never fails on parameters:
 *
 * <ul>
 *   <li>an unknown or missing strategy id falls back to {@link ChunkingStrategyType#FIXED}
 *   <li>a non-positive target size is treated as 1
 *   <li>an overlap at or above the target size is reduced to {@code targetSize - 1}
 *   <li>blank text yields no chunks without running any assembler
 * </ul>
 *
 * <p>Only a {@code null} text is rejected, with a {@link NullPointerException}. The engine holds no
 * state between calls and is safe for concurrent use.
 */
@Service
@Slf4j
public class ChunkingEngine {

  private final TokenEstimator tokenEstimator;
  private final Map<ChunkingStrategyType, ChunkAssembler> assemblers;
  private final ChunkQualityScorer qualityScorer;
  private final StrategyInsightGenerator insightGenerator;

  public ChunkingEngine(
      TokenEstimator tokenEstimator,
      List<ChunkAssembler> assemblers,
      ChunkQualityScorer qualityScorer,
      StrategyInsightGenerator insightGenerator) {
    this.tokenEstimator = tokenEstimator;
    this.assemblers = new EnumMap<>(ChunkingStrategyType.class);
    for (ChunkAssembler assembler : assemblers) {
      this.assemblers.put(assembler.strategy(), assembler);
    }
    for (ChunkingStrategyType type : ChunkingStrategyType.values()) {
      if (!this.assemblers.containsKey(type)) {
        throw new IllegalStateException("No chunk assembler registered for strategy " + type);
      }
    }
    this.qualityScorer = qualityScorer;
    this.insightGenerator = insightGenerator;
  }

  /** Wires an engine with the default components, for use outside a Spring context. */
  public static ChunkingEngine createDefault() {
    return createDefault(
        StrategyInsightGenerator.DEFAULT_LOW_CHUNK_COUNT,
        StrategyInsightGenerator.DEFAULT_HIGH_CHUNK_COUNT);
  }

  /** Wires an engine with the default components and the given chunk-count insight thresholds. */
  public static ChunkingEngine createDefault(int lowChunkCount, int highChunkCount) {
    TokenEstimator estimator = new TokenEstimator();
    SentenceSplitter sentences = new SentenceSplitter(estimator);
    ParagraphSplitter paragraphs = new ParagraphSplitter(estimator);
    WordSplitter words = new WordSplitter(estimator);
    return new ChunkingEngine(
        estimator,
        List.of(
            new FixedSizeChunkAssembler(estimator),
            new SentenceBoundaryChunkAssembler(estimator, sentences),
            new ParagraphBoundaryChunkAssembler(estimator, paragraphs, sentences),
            new SemanticChunkAssembler(estimator, sentences),
            new SlidingWindowChunkAssembler(estimator, words)),
        new ChunkQualityScorer(),
        new StrategyInsightGenerator(lowChunkCount, highChunkCount));
  }

  /**
   * Splits {@code text} with the strategy named by {@code strategyId}.
   *
   * @param text document text; must not be null
   * @param strategyId one of {@code fixed}, {@code sentence}, {@code paragraph}, {@code semantic},
   *     {@code sliding}; anything else selects {@code fixed}
   * @param targetSize target chunk size
   * @param overlap overlap between consecutive chunks
   * @return chunks in order, empty for blank text
   */
  public List<ChunkRecord> chunk(String text, String strategyId, int targetSize, int overlap) {
    return chunk(text, resolveStrategy(strategyId), targetSize, overlap);
  }

  /** Splits {@code text} with {@code strategy}; see {@link #chunk(String, String, int, int)}. */
  public List<ChunkRecord> chunk(
      String text, ChunkingStrategyType strategy, int targetSize, int overlap) {
    Objects.requireNonNull(text, "text must not be null");
    ChunkingParameters parameters = parameters(strategy, targetSize, overlap);
    return run(text, parameters);
  }

  /**
   * Splits {@code text} and scores the result.
   *
   * @param text document text; must not be null
   * @param strategyId strategy identifier, unknown values select {@code fixed}
   * @param targetSize target chunk size
   * @param overlap overlap between consecutive chunks
   * @return chunks with metrics, insights and the effective parameters
   */
  public ChunkingResult analyze(String text, String strategyId, int targetSize, int overlap) {
    Objects.requireNonNull(text, "text must not be null");
    Optional<ChunkingStrategyType> requested = ChunkingStrategyType.fromId(strategyId);
    ChunkingStrategyType strategy = requested.orElseGet(() -> fallback(strategyId));
    ChunkingParameters parameters = parameters(strategy, targetSize, overlap);

    long started = System.nanoTime();
    List<ChunkRecord> chunks = run(text, parameters);
    long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

    ChunkingMetrics metrics = qualityScorer.score(chunks, parameters.targetSize(), elapsedMs);
    List<String> insights = insightGenerator.generate(chunks, strategy, metrics);
    return new ChunkingResult(parameters, requested.isEmpty(), chunks, metrics, insights);
  }

  /** Standalone token estimate; see {@link TokenEstimator}. */
  public int estimateTokens(String text) {
    Objects.requireNonNull(text, "text must not be null");
    return tokenEstimator.estimateTokens(text);
  }

  private List<ChunkRecord> run(String text, ChunkingParameters parameters) {
    if (text.isBlank()) {
      return List.of();
    }
    List<ChunkRecord> chunks = assemblers.get(parameters.strategy()).assemble(text, parameters);
    log.debug(
        "Chunked {} chars with strategy={}, size={}, overlap={}: {} chunks",
        text.length(),
        parameters.strategy().getId(),
        parameters.targetSize(),
        parameters.overlap(),
        chunks.size());
    return List.copyOf(chunks);
  }

  private ChunkingStrategyType resolveStrategy(String strategyId) {
    return ChunkingStrategyType.fromId(strategyId).orElseGet(() -> fallback(strategyId));
  }

  private ChunkingStrategyType fallback(String strategyId) {
    log.warn("Unknown chunking strategy '{}', falling back to fixed-size", strategyId);
    return ChunkingStrategyType.FIXED;
  }

  private ChunkingParameters parameters(
      ChunkingStrategyType strategy, int targetSize, int overlap) {
    ChunkingStrategyType resolved = strategy == null ? fallback(null) : strategy;
    ChunkingParameters parameters = ChunkingParameters.of(resolved, targetSize, overlap);
    if (parameters.differsFrom(targetSize, overlap)) {
      log.debug(
          "Clamped chunking parameters size={}, overlap={} to size={}, overlap={}",
          targetSize,
          overlap,
          parameters.targetSize(),
          parameters.overlap());
    }
    return parameters;
  }
}
