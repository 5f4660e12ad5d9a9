package com.flamingo.ai.ragworkbench.api.rest;

import com.flamingo.ai.ragworkbench.api.dto.request.ChunkingPreviewRequest;
import com.flamingo.ai.ragworkbench.api.dto.request.TokenEstimateRequest;
import com.flamingo.ai.ragworkbench.api.dto.response.ChunkingPreviewResponse;
import com.flamingo.ai.ragworkbench.api.dto.response.StrategyResponse;
import com.flamingo.ai.ragworkbench.api.dto.response.TokenEstimateResponse;
import com.flamingo.ai.ragworkbench.service.chunking.ChunkingPreviewService;
import com.flamingo.ai.ragworkbench.service.rag.chunking.UnicodeText;
import com.flamingo.ai.ragworkbench.service.rag.model.ChunkingResult;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for chunking previews and token estimates. */
@RestController
@RequestMapping("/api/chunking")
@RequiredArgsConstructor
public class ChunkingController {

  private final ChunkingPreviewService chunkingPreviewService;

  /** Lists the available chunking strategies with their presets. */
  @GetMapping("/strategies")
  public ResponseEntity<List<StrategyResponse>> getStrategies() {
    List<StrategyResponse> responses =
        chunkingPreviewService.strategies().stream().map(StrategyResponse::fromStrategy).toList();
    return ResponseEntity.ok(responses);
  }

  /** Chunks the submitted text and returns the chunks with quality metrics. */
  @PostMapping("/preview")
  public ResponseEntity<ChunkingPreviewResponse> preview(
      @Valid @RequestBody ChunkingPreviewRequest request) {
    ChunkingResult result =
        chunkingPreviewService.preview(
            request.getText(), request.getStrategy(), request.getChunkSize(), request.getOverlap());
    return ResponseEntity.ok(ChunkingPreviewResponse.fromResult(result));
  }

  /** Estimates the token count of the submitted text. */
  @PostMapping("/tokens")
  public ResponseEntity<TokenEstimateResponse> estimateTokens(
      @Valid @RequestBody TokenEstimateRequest request) {
    String text = request.getText();
    return ResponseEntity.ok(
        TokenEstimateResponse.builder()
            .tokens(chunkingPreviewService.estimateTokens(text))
            .characters(UnicodeText.length(text))
            .build());
  }
}
