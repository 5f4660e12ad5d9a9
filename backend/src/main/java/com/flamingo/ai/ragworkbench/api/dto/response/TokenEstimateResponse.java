package com.flamingo.ai.ragworkbench.api.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a token estimate. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TokenEstimateResponse {
  private int tokens;
  private int characters;
}
