package com.flamingo.ai.ragworkbench.service.rag.chunking.quality;

import com.flamingo.ai.ragworkbench.domain.enums.ChunkingStrategyType;
import com.flamingo.ai.ragworkbench.service.rag.model.ChunkRecord;
import com.flamingo.ai.ragworkbench.service.rag.model.ChunkingMetrics;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Produces human-readable observations about a chunking run for the preview UI.
 *
 * <p>Insights are reporting only; nothing in the engine branches on them.
 */
public class StrategyInsightGenerator {

  public static final int DEFAULT_LOW_CHUNK_COUNT = 3;
  public static final int DEFAULT_HIGH_CHUNK_COUNT = 20;

  private final int lowChunkCount;
  private final int highChunkCount;

  public StrategyInsightGenerator() {
    this(DEFAULT_LOW_CHUNK_COUNT, DEFAULT_HIGH_CHUNK_COUNT);
  }

  /**
   * Creates a generator with custom chunk-count thresholds.
   *
   * @param lowChunkCount below this many chunks a smaller chunk size is suggested
   * @param highChunkCount above this many chunks a larger chunk size is suggested
   */
  public StrategyInsightGenerator(int lowChunkCount, int highChunkCount) {
    this.lowChunkCount = lowChunkCount;
    this.highChunkCount = highChunkCount;
  }

  public List<String> generate(
      List<ChunkRecord> chunks, ChunkingStrategyType strategy, ChunkingMetrics metrics) {
    if (chunks.isEmpty()) {
      return List.of();
    }

    List<String> insights = new ArrayList<>();
    long consistencyPercent = percent(metrics.consistency());

    switch (strategy) {
      case SENTENCE -> {
        insights.add(
            "Average of %d sentences per chunk"
                .formatted(Math.round(average(chunks, c -> toDouble(c.unitCount())))));
        insights.add(
            "%d%% of sentence boundaries preserved"
                .formatted(percent(average(chunks, ChunkRecord::completeness))));
        if (metrics.consistency() > 0.8) {
          insights.add("Excellent consistency across chunks (%d%%)".formatted(consistencyPercent));
        } else if (metrics.consistency() > 0.6) {
          insights.add(
              "Good consistency with some size variation (%d%%)".formatted(consistencyPercent));
        } else {
          insights.add(
              "High size variation, consider adjusting parameters (%d%%)"
                  .formatted(consistencyPercent));
        }
      }
      case PARAGRAPH -> {
        insights.add(
            "Average of %d paragraphs per chunk"
                .formatted(Math.round(average(chunks, c -> toDouble(c.unitCount())))));
        insights.add(
            "%d%% content coherence score"
                .formatted(percent(average(chunks, ChunkRecord::coherence))));
        insights.add("Best suited to documents with a clear paragraph structure");
      }
      case SEMANTIC -> {
        insights.add(
            "%d%% semantic coherence score"
                .formatted(percent(average(chunks, ChunkRecord::coherenceScore))));
        insights.add(
            "%d%% information density"
                .formatted(percent(average(chunks, ChunkRecord::semanticDensity))));
        Set<String> keywords = new HashSet<>();
        chunks.stream()
            .map(ChunkRecord::topicKeywords)
            .filter(Objects::nonNull)
            .forEach(keywords::addAll);
        insights.add("%d unique topic keywords identified".formatted(keywords.size()));
      }
      case SLIDING -> {
        List<ChunkRecord> overlapping =
            chunks.stream()
                .filter(c -> c.overlapPercentage() != null && c.overlapPercentage() > 0)
                .toList();
        insights.add(
            "Average overlap of %d%% between adjacent chunks"
                .formatted(
                    Math.round(average(overlapping, c -> toDouble(c.overlapPercentage())))));
        insights.add(
            "%d overlapping windows maximise information retention".formatted(chunks.size()));
        insights.add("Ideal for comprehensive coverage and context preservation");
      }
      case FIXED -> {
        insights.add(
            "Consistent %d tokens per chunk (±%d)"
                .formatted(
                    Math.round(metrics.averageTokens()),
                    Math.round(metrics.tokenStandardDeviation())));
        insights.add("Predictable sizes allow efficient processing and storage");
        if (metrics.consistency() > 0.9) {
          insights.add("Excellent uniformity, well suited to batch processing");
        } else {
          insights.add("Some variation from word boundaries, which is expected");
        }
      }
    }

    insights.add(chunkCountInsight(chunks.size()));
    return insights;
  }

  private String chunkCountInsight(int count) {
    if (count < lowChunkCount) {
      return "Very few chunks, consider a smaller chunk size for finer segmentation";
    }
    if (count > highChunkCount) {
      return "Many small chunks, consider a larger chunk size for efficiency";
    }
    return "Appropriate chunk count for effective retrieval (%d)".formatted(count);
  }

  private static double average(
      Collection<ChunkRecord> chunks, Function<ChunkRecord, Double> field) {
    return chunks.stream()
        .map(field)
        .filter(Objects::nonNull)
        .mapToDouble(Double::doubleValue)
        .average()
        .orElse(0.0);
  }

  private static Double toDouble(Integer value) {
    return value == null ? null : value.doubleValue();
  }

  private static long percent(double ratio) {
    return Math.round(ratio * 100);
  }
}
