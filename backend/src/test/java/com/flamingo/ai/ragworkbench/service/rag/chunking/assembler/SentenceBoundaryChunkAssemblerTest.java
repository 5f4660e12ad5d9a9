package com.flamingo.ai.ragworkbench.service.rag.chunking.assembler;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.ragworkbench.domain.enums.ChunkingStrategyType;
import com.flamingo.ai.ragworkbench.service.rag.chunking.TokenEstimator;
import com.flamingo.ai.ragworkbench.service.rag.chunking.splitter.SentenceSplitter;
import com.flamingo.ai.ragworkbench.service.rag.model.ChunkRecord;
import com.flamingo.ai.ragworkbench.service.rag.model.ChunkingParameters;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SentenceBoundaryChunkAssembler Tests")
class SentenceBoundaryChunkAssemblerTest {

  private SentenceBoundaryChunkAssembler assembler;

  @BeforeEach
  void setUp() {
    TokenEstimator estimator = new TokenEstimator();
    assembler = new SentenceBoundaryChunkAssembler(estimator, new SentenceSplitter(estimator));
  }

  private List<ChunkRecord> assemble(String text, int size, int overlap) {
    return assembler.assemble(
        text, ChunkingParameters.of(ChunkingStrategyType.SENTENCE, size, overlap));
  }

  @Test
  @DisplayName("should carry the previous sentence into the next chunk as overlap")
  void shouldCarryOverlapSentence() {
    List<ChunkRecord> chunks = assemble("Hello world. This is a test.", 15, 5);

    assertThat(chunks)
        .extracting(ChunkRecord::text)
        .containsExactly("Hello world.", "Hello world. This is a test.");
    assertThat(chunks.get(0).unitRange()).hasToString("1-1");
    assertThat(chunks.get(1).unitRange()).hasToString("1-2");
    assertThat(chunks.get(1).unitCount()).isEqualTo(2);
  }

  @Test
  @DisplayName("should carry nothing when overlap is zero")
  void shouldCarryNothing_whenOverlapIsZero() {
    assertThat(assemble("One two three. Four five six. Seven eight nine.", 30, 0))
        .extracting(ChunkRecord::text)
        .containsExactly("One two three. Four five six.", "Seven eight nine.");
  }

  @Test
  @DisplayName("should carry the shortest sentence suffix that reaches the overlap")
  void shouldCarryShortestSufficientSuffix() {
    List<ChunkRecord> chunks =
        assemble("Alpha beta gamma. Delta epsilon. Zeta eta theta.", 35, 10);

    assertThat(chunks)
        .extracting(ChunkRecord::text)
        .containsExactly("Alpha beta gamma. Delta epsilon.", "Delta epsilon. Zeta eta theta.");
    assertThat(chunks.get(1).unitRange()).hasToString("2-3");
  }

  @Test
  @DisplayName("should emit an oversized sentence as its own chunk")
  void shouldEmitOversizedSentenceWhole() {
    String sentence = "This single sentence is much longer than the tiny budget.";

    assertThat(assemble(sentence, 10, 0)).extracting(ChunkRecord::text).containsExactly(sentence);
  }

  @Test
  @DisplayName("should score completeness by terminal punctuation")
  void shouldScoreCompleteness() {
    List<ChunkRecord> chunks = assemble("Complete sentence here. Incomplete tail", 100, 0);

    assertThat(chunks).singleElement().satisfies(c -> {
      assertThat(c.completeness()).isEqualTo(0.5);
      assertThat(c.strategyTag()).isEqualTo("sentence-boundary");
      assertThat(c.coherence()).isNull();
    });
  }
}
