package com.flamingo.ai.ragworkbench.config;

import com.flamingo.ai.ragworkbench.service.rag.chunking.quality.StrategyInsightGenerator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Builds the chunking engine components that take values from {@link ChunkingConfig}. */
@Configuration
public class ChunkingEngineConfig {

  @Bean
  public StrategyInsightGenerator strategyInsightGenerator(ChunkingConfig chunkingConfig) {
    ChunkingConfig.Insights insights = chunkingConfig.getInsights();
    return new StrategyInsightGenerator(insights.getLowChunkCount(), insights.getHighChunkCount());
  }
}
