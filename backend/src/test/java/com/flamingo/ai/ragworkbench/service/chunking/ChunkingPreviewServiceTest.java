package com.flamingo.ai.ragworkbench.service.chunking;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.ragworkbench.config.ChunkingConfig;
import com.flamingo.ai.ragworkbench.domain.enums.ChunkingStrategyType;
import com.flamingo.ai.ragworkbench.exception.DocumentTooLargeException;
import com.flamingo.ai.ragworkbench.service.rag.chunking.ChunkingEngine;
import com.flamingo.ai.ragworkbench.service.rag.model.ChunkingResult;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ChunkingPreviewService Tests")
class ChunkingPreviewServiceTest {

  private static final String TEXT =
      "Chunking splits documents. Overlap keeps context. Retrieval finds chunks. "
          + "Embeddings encode meaning. Rerankers sort results.";

  private ChunkingConfig config;
  private MeterRegistry meterRegistry;
  private ChunkingPreviewService service;

  @BeforeEach
  void setUp() {
    config = new ChunkingConfig();
    meterRegistry = new SimpleMeterRegistry();
    service =
        new ChunkingPreviewService(ChunkingEngine.createDefault(), config, meterRegistry);
  }

  @Nested
  @DisplayName("Defaults")
  class Defaults {

    @Test
    @DisplayName("should use the configured default strategy and its preset")
    void shouldUseDefaultStrategyAndPreset() {
      ChunkingResult result = service.preview(TEXT, null, null, null);

      assertThat(result.parameters().strategy()).isEqualTo(ChunkingStrategyType.SENTENCE);
      assertThat(result.parameters().targetSize()).isEqualTo(512);
      assertThat(result.parameters().overlap()).isEqualTo(50);
      assertThat(result.fallbackApplied()).isFalse();
    }

    @Test
    @DisplayName("should use the preset of the requested strategy")
    void shouldUseRequestedPreset() {
      ChunkingResult result = service.preview(TEXT, "sliding", null, 64);

      assertThat(result.parameters().targetSize()).isEqualTo(512);
      assertThat(result.parameters().overlap()).isEqualTo(64);
    }

    @Test
    @DisplayName("should fall back to fixed-size and count the fallback")
    void shouldFallBackAndCount() {
      ChunkingResult result = service.preview(TEXT, "bogus", null, null);

      assertThat(result.fallbackApplied()).isTrue();
      assertThat(result.parameters().strategy()).isEqualTo(ChunkingStrategyType.FIXED);
      assertThat(meterRegistry.counter("chunking.strategy.fallback").count()).isEqualTo(1.0);
    }
  }

  @Nested
  @DisplayName("Limits")
  class Limits {

    @Test
    @DisplayName("should reject documents above the configured limit")
    void shouldRejectOversizedDocument() {
      config.setMaxDocumentChars(10);

      assertThatThrownBy(() -> service.preview(TEXT, "fixed", 100, 0))
          .isInstanceOf(DocumentTooLargeException.class)
          .satisfies(
              ex -> assertThat(((DocumentTooLargeException) ex).getMaxLength()).isEqualTo(10));
    }

    @Test
    @DisplayName("should truncate the chunk list but keep the full metrics")
    void shouldTruncateChunkList() {
      config.setMaxPreviewChunks(2);

      ChunkingResult result = service.preview(TEXT, "sentence", 30, 0);

      assertThat(result.chunks()).hasSize(2);
      assertThat(result.metrics().totalChunks()).isEqualTo(5);
    }
  }

  @Test
  @DisplayName("should record preview timing and chunk counts per strategy")
  void shouldRecordMetrics() {
    service.preview(TEXT, "paragraph", 100, 0);

    assertThat(meterRegistry.find("chunking.preview").tag("strategy", "paragraph").timer())
        .isNotNull()
        .satisfies(timer -> assertThat(timer.count()).isEqualTo(1));
    assertThat(
            meterRegistry
                .find("chunking.chunks.produced")
                .tag("strategy", "paragraph")
                .summary()
                .totalAmount())
        .isEqualTo(2.0);
  }

  @Test
  @DisplayName("should delegate token estimates to the engine")
  void shouldEstimateTokens() {
    assertThat(service.estimateTokens("The quick brown fox.")).isEqualTo(5);
  }
}
