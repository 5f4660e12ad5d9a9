package com.flamingo.ai.ragworkbench.service.rag.chunking.assembler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.flamingo.ai.ragworkbench.domain.enums.ChunkingStrategyType;
import com.flamingo.ai.ragworkbench.service.rag.chunking.TokenEstimator;
import com.flamingo.ai.ragworkbench.service.rag.chunking.splitter.SentenceSplitter;
import com.flamingo.ai.ragworkbench.service.rag.model.ChunkRecord;
import com.flamingo.ai.ragworkbench.service.rag.model.ChunkingParameters;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SemanticChunkAssembler Tests")
class SemanticChunkAssemblerTest {

  // Six sentences of five estimated tokens each.
  private static final String SIX_SENTENCES =
      "Apple banana cherry dates. Eagle falcon goose heron. Iris lilac kale lemon. "
          + "Mango melon olive pear. Quince radish sage thyme. Violet walnut yarrow zest.";

  private SemanticChunkAssembler assembler;

  @BeforeEach
  void setUp() {
    TokenEstimator estimator = new TokenEstimator();
    assembler = new SemanticChunkAssembler(estimator, new SentenceSplitter(estimator));
  }

  private List<ChunkRecord> assemble(String text, int size, int overlap) {
    return assembler.assemble(
        text, ChunkingParameters.of(ChunkingStrategyType.SEMANTIC, size, overlap));
  }

  @Test
  @DisplayName("should break buffers where tokens reach 80% of the budget")
  void shouldBreakAtEightyPercent() {
    List<ChunkRecord> chunks = assemble(SIX_SENTENCES, 12, 0);

    assertThat(chunks)
        .extracting(c -> c.unitRange().toString())
        .containsExactly("1-2", "3-4", "5-6");
    assertThat(chunks.get(0).text())
        .isEqualTo("Apple banana cherry dates. Eagle falcon goose heron.");
    assertThat(chunks).extracting(ChunkRecord::strategyTag).containsOnly("semantic");
  }

  @Test
  @DisplayName("should carry no more than half of the emitted sentences")
  void shouldCarryOverlapSentences() {
    List<ChunkRecord> chunks = assemble(SIX_SENTENCES, 12, 5);

    assertThat(chunks)
        .extracting(c -> c.unitRange().toString())
        .containsExactly("1-2", "2-3", "3-4", "4-5", "5-6");
    for (int i = 1; i < chunks.size(); i++) {
      String previous = chunks.get(i - 1).text();
      String lastSentence = previous.substring(previous.lastIndexOf(". ") + 2);
      assertThat(chunks.get(i).text()).startsWith(lastSentence);
    }
  }

  @Test
  @DisplayName("should count overlap in sentences")
  void shouldCountOverlapInSentences() {
    StringBuilder text = new StringBuilder();
    for (char letter = 'a'; letter < 'a' + 12; letter++) {
      text.append("Note ").append(letter).append(" has five words. ");
    }

    List<ChunkRecord> chunks = assemble(text.toString().strip(), 30, 3);

    assertThat(chunks)
        .extracting(c -> c.unitRange().toString())
        .containsExactly("1-4", "3-6", "5-8", "7-10", "9-12");
    assertThat(chunks.get(1).text()).startsWith("Note c has five words. Note d has five words.");
  }

  @Test
  @DisplayName("should list the five most frequent topic keywords")
  void shouldExtractTopicKeywords() {
    ChunkRecord chunk =
        assemble(
                "Kafka streams process events. Kafka brokers store events. "
                    + "Consumers read events from Kafka.",
                1000,
                0)
            .get(0);

    assertThat(chunk.topicKeywords())
        .containsExactly("kafka", "events", "streams", "process", "brokers");
    assertThat(chunk.coherenceScore()).isCloseTo(4.0 / 9, within(1e-9));
  }

  @Test
  @DisplayName("should keep keywords in order of first appearance on ties")
  void shouldKeepFirstAppearanceOrder_onTies() {
    ChunkRecord chunk = assemble(SIX_SENTENCES, 12, 0).get(0);

    assertThat(chunk.topicKeywords())
        .containsExactly("apple", "banana", "cherry", "dates", "eagle");
    assertThat(chunk.coherenceScore()).isEqualTo(0.0);
    assertThat(chunk.semanticDensity()).isCloseTo(0.2, within(1e-9));
  }
}
