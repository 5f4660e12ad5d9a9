package com.flamingo.ai.ragworkbench.api.dto.response;

import com.flamingo.ai.ragworkbench.service.rag.model.ChunkRecord;
import com.flamingo.ai.ragworkbench.service.rag.model.ChunkingMetrics;
import com.flamingo.ai.ragworkbench.service.rag.model.ChunkingResult;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a chunking preview. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChunkingPreviewResponse {

  /** Strategy actually used, after fallback. */
  private String strategy;

  private int chunkSize;
  private int overlap;

  /** True when the requested strategy was unknown and fixed-size was used instead. */
  private boolean fallbackApplied;

  /** True when {@link #chunks} holds fewer entries than {@code metrics.totalChunks}. */
  private boolean truncated;

  private List<ChunkRecord> chunks;
  private ChunkingMetrics metrics;
  private List<String> insights;

  /** Creates a ChunkingPreviewResponse from an engine result. */
  public static ChunkingPreviewResponse fromResult(ChunkingResult result) {
    return ChunkingPreviewResponse.builder()
        .strategy(result.parameters().strategy().getId())
        .chunkSize(result.parameters().targetSize())
        .overlap(result.parameters().overlap())
        .fallbackApplied(result.fallbackApplied())
        .truncated(result.chunks().size() < result.metrics().totalChunks())
        .chunks(result.chunks())
        .metrics(result.metrics())
        .insights(result.insights())
        .build();
  }
}
