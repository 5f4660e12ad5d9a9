package com.flamingo.ai.ragworkbench.api.dto.request;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for a standalone token estimate. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TokenEstimateRequest {

  @NotNull(message = "Text is required")
  private String text;
}
