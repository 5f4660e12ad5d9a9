package com.flamingo.ai.ragworkbench.service.rag.model;

import com.flamingo.ai.ragworkbench.domain.enums.ChunkingStrategyType;
import java.util.Objects;

/**
 * Effective segmentation parameters.
 *
 * <p>Construction never rejects values: a non-positive target size becomes 1 and the overlap is
 * held within {@code [0, targetSize - 1]}.
 *
 * @param strategy selected strategy
 * @param targetSize target chunk size, in characters or estimated tokens depending on strategy
 * @param overlap overlap between consecutive chunks, in the same unit as {@code targetSize} except
 *     for the semantic strategy, where it counts sentences
 */
public record ChunkingParameters(ChunkingStrategyType strategy, int targetSize, int overlap) {

  public ChunkingParameters {
    Objects.requireNonNull(strategy, "strategy must not be null");
    targetSize = Math.max(1, targetSize);
    overlap = Math.max(0, Math.min(overlap, targetSize - 1));
  }

  public static ChunkingParameters of(ChunkingStrategyType strategy, int targetSize, int overlap) {
    return new ChunkingParameters(strategy, targetSize, overlap);
  }

  /** Whether clamping changed the requested values. */
  public boolean differsFrom(int requestedSize, int requestedOverlap) {
    return targetSize != requestedSize || overlap != requestedOverlap;
  }
}
