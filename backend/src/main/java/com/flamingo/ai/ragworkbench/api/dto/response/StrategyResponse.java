package com.flamingo.ai.ragworkbench.api.dto.response;

import com.flamingo.ai.ragworkbench.domain.enums.ChunkingStrategyType;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO describing one chunking strategy and its presets. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StrategyResponse {

  private String id;
  private String name;
  private String description;
  private int defaultSize;
  private int defaultOverlap;
  private int minSize;
  private int maxSize;
  private boolean recommended;
  private List<String> features;

  /** Creates a StrategyResponse from a strategy constant. */
  public static StrategyResponse fromStrategy(ChunkingStrategyType strategy) {
    return StrategyResponse.builder()
        .id(strategy.getId())
        .name(strategy.getDisplayName())
        .description(strategy.getDescription())
        .defaultSize(strategy.getDefaultSize())
        .defaultOverlap(strategy.getDefaultOverlap())
        .minSize(strategy.getMinRecommendedSize())
        .maxSize(strategy.getMaxRecommendedSize())
        .recommended(strategy.isRecommended())
        .features(strategy.getFeatures())
        .build();
  }
}
