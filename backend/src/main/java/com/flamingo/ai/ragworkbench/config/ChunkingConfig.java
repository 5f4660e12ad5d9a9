package com.flamingo.ai.ragworkbench.config;

import com.flamingo.ai.ragworkbench.service.rag.chunking.quality.StrategyInsightGenerator;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the chunking engine and its preview API. */
@Configuration
@ConfigurationProperties(prefix = "chunking")
@Getter
@Setter
public class ChunkingConfig {

  /** Strategy used when a preview request does not name one. */
  private String defaultStrategy = "sentence";

  /**
   * Longest document, in characters, accepted for chunking. Bounds the work a single request can
   * cause.
   */
  private int maxDocumentChars = 2_000_000;

  /** Maximum chunks returned in a preview response; 0 returns all of them. */
  private int maxPreviewChunks = 0;

  private Insights insights = new Insights();
  private Cors cors = new Cors();

  /** Thresholds for the chunk-count line of the strategy insights. */
  @Getter
  @Setter
  public static class Insights {
    /** Below this many chunks a smaller chunk size is suggested. */
    private int lowChunkCount = StrategyInsightGenerator.DEFAULT_LOW_CHUNK_COUNT;

    /** Above this many chunks a larger chunk size is suggested. */
    private int highChunkCount = StrategyInsightGenerator.DEFAULT_HIGH_CHUNK_COUNT;
  }

  @Getter
  @Setter
  public static class Cors {
    private List<String> allowedOrigins = new ArrayList<>(List.of("http://localhost:3000"));
  }
}
