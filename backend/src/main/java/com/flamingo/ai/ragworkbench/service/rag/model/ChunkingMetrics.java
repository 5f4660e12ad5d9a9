package com.flamingo.ai.ragworkbench.service.rag.model;

import lombok.Builder;

/**
 * Aggregate statistics over one chunking run. Derived on demand, never stored.
 *
 * @param totalChunks number of chunks produced
 * @param averageTokens mean estimated tokens per chunk
 * @param minTokens smallest chunk, in estimated tokens
 * @param maxTokens largest chunk, in estimated tokens
 * @param averageCharacters mean characters per chunk
 * @param tokenStandardDeviation population standard deviation of chunk token counts
 * @param consistency {@code max(0, 1 - stddev / mean)}; 1.0 means uniform chunk sizes
 * @param averageQuality mean of the per-chunk quality scores, in {@code [0, 1]}
 * @param processingTimeMs wall-clock time spent chunking and scoring
 */
@Builder(toBuilder = true)
public record ChunkingMetrics(
    int totalChunks,
    double averageTokens,
    int minTokens,
    int maxTokens,
    double averageCharacters,
    double tokenStandardDeviation,
    double consistency,
    double averageQuality,
    long processingTimeMs) {

  /** Metrics for a run that produced no chunks. */
  public static ChunkingMetrics empty() {
    return ChunkingMetrics.builder().build();
  }
}
