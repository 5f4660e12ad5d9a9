package com.flamingo.ai.ragworkbench;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.ragworkbench.config.ChunkingConfig;
import com.flamingo.ai.ragworkbench.service.chunking.ChunkingPreviewService;
import com.flamingo.ai.ragworkbench.service.rag.chunking.ChunkingEngine;
import com.flamingo.ai.ragworkbench.service.rag.chunking.assembler.ChunkAssembler;
import com.flamingo.ai.ragworkbench.service.rag.chunking.quality.StrategyInsightGenerator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

/**
 * Integration test that verifies the Spring application context loads and wires every chunking
 * strategy. The engine has no external dependencies, so nothing needs to be mocked.
 */
@SpringBootTest
class ApplicationContextTest {

  @Autowired private ApplicationContext applicationContext;

  @Test
  @DisplayName("Application context should load successfully")
  void contextLoads() {
    assertThat(applicationContext).isNotNull();
  }

  @Test
  @DisplayName("Chunking beans should be available and bound to configuration")
  void chunkingBeansShouldBeAvailable() {
    assertThat(applicationContext.getBeansOfType(ChunkAssembler.class)).hasSize(5);
    assertThat(applicationContext.getBean(ChunkingPreviewService.class)).isNotNull();
    assertThat(applicationContext.getBean(StrategyInsightGenerator.class)).isNotNull();
    assertThat(applicationContext.getBean(ChunkingConfig.class).getDefaultStrategy())
        .isEqualTo("sentence");
  }

  @Test
  @DisplayName("Engine from the context should chunk text")
  void engineShouldChunkText() {
    ChunkingEngine engine = applicationContext.getBean(ChunkingEngine.class);

    assertThat(engine.chunk("Hello world. This is a test.", "sentence", 15, 5)).hasSize(2);
  }
}
