package com.flamingo.ai.ragworkbench.service.rag.chunking.quality;

import com.flamingo.ai.ragworkbench.service.rag.model.ChunkRecord;
import com.flamingo.ai.ragworkbench.service.rag.model.ChunkingMetrics;
import java.util.List;
import java.util.OptionalDouble;
import org.springframework.stereotype.Component;

/**
 * Computes aggregate metrics over an assembled chunk list.
 *
 * <p>The quality of a single chunk is the mean of whichever of {@code completeness}, {@code
 * coherence}, {@code coherenceScore} and {@code semanticDensity} it carries, together with its
 * size ratio {@code min(tokens / target, target / tokens)}. The average quality is the mean over
 * all chunks that have at least one of these signals.
 */
@Component
public class ChunkQualityScorer {

  /**
   * Summarises {@code chunks}.
   *
   * @param chunks assembled chunks
   * @param targetSize effective target size the chunks were assembled with
   * @param processingTimeMs time spent producing the chunks
   * @return metrics; all zero except the processing time when {@code chunks} is empty
   */
  public ChunkingMetrics score(List<ChunkRecord> chunks, int targetSize, long processingTimeMs) {
    if (chunks.isEmpty()) {
      return ChunkingMetrics.empty().toBuilder().processingTimeMs(processingTimeMs).build();
    }

    int min = Integer.MAX_VALUE;
    int max = 0;
    long tokenSum = 0;
    long characterSum = 0;
    for (ChunkRecord chunk : chunks) {
      min = Math.min(min, chunk.estimatedTokens());
      max = Math.max(max, chunk.estimatedTokens());
      tokenSum += chunk.estimatedTokens();
      characterSum += chunk.characterCount();
    }
    double averageTokens = (double) tokenSum / chunks.size();
    double variance =
        chunks.stream()
                .mapToDouble(c -> Math.pow(c.estimatedTokens() - averageTokens, 2))
                .sum()
            / chunks.size();
    double deviation = Math.sqrt(variance);
    double consistency = averageTokens > 0 ? Math.max(0.0, 1 - deviation / averageTokens) : 0.0;

    return ChunkingMetrics.builder()
        .totalChunks(chunks.size())
        .averageTokens(averageTokens)
        .minTokens(min)
        .maxTokens(max)
        .averageCharacters((double) characterSum / chunks.size())
        .tokenStandardDeviation(deviation)
        .consistency(consistency)
        .averageQuality(averageQuality(chunks, targetSize))
        .processingTimeMs(processingTimeMs)
        .build();
  }

  /** Mean per-chunk quality, or 0 when no chunk has a quality signal. */
  public double averageQuality(List<ChunkRecord> chunks, int targetSize) {
    double total = 0;
    int scored = 0;
    for (ChunkRecord chunk : chunks) {
      OptionalDouble quality = chunkQuality(chunk, targetSize);
      if (quality.isPresent()) {
        total += quality.getAsDouble();
        scored++;
      }
    }
    return scored > 0 ? total / scored : 0.0;
  }

  /** Quality of a single chunk, empty when it carries no signal at all. */
  public OptionalDouble chunkQuality(ChunkRecord chunk, int targetSize) {
    double sum = 0;
    int signals = 0;
    for (Double value :
        new Double[] {
          chunk.completeness(), chunk.coherence(), chunk.coherenceScore(), chunk.semanticDensity()
        }) {
      if (value != null) {
        sum += value;
        signals++;
      }
    }
    if (chunk.estimatedTokens() > 0 && targetSize > 0) {
      double ratio = (double) chunk.estimatedTokens() / targetSize;
      sum += Math.min(ratio, 1 / ratio);
      signals++;
    }
    return signals > 0 ? OptionalDouble.of(sum / signals) : OptionalDouble.empty();
  }
}
