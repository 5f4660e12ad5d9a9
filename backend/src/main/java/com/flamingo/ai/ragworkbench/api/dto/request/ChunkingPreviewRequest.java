package com.flamingo.ai.ragworkbench.api.dto.request;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for a chunking preview. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChunkingPreviewRequest {

  @NotNull(message = "Text is required")
  private String text;

  /** Strategy id; if null, the configured default strategy is used. */
  private String strategy;

  /** Target chunk size; if null, the strategy's default size is used. */
  private Integer chunkSize;

  /** Overlap between chunks; if null, the strategy's default overlap is used. */
  private Integer overlap;
}
