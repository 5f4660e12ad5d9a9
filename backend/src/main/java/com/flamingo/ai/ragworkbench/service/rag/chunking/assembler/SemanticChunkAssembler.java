package com.flamingo.ai.ragworkbench.service.rag.chunking.assembler;

import com.flamingo.ai.ragworkbench.domain.enums.ChunkingStrategyType;
import com.flamingo.ai.ragworkbench.service.rag.chunking.LexicalMetrics;
import com.flamingo.ai.ragworkbench.service.rag.chunking.TokenEstimator;
import com.flamingo.ai.ragworkbench.service.rag.chunking.UnicodeText;
import com.flamingo.ai.ragworkbench.service.rag.chunking.splitter.SentenceSplitter;
import com.flamingo.ai.ragworkbench.service.rag.model.AtomicUnit;
import com.flamingo.ai.ragworkbench.service.rag.model.ChunkRecord;
import com.flamingo.ai.ragworkbench.service.rag.model.ChunkingParameters;
import com.flamingo.ai.ragworkbench.service.rag.model.UnitRange;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * {@link ChunkAssembler} that buffers sentences against an estimated-token budget.
 *
 * <p>When the next sentence would push the buffer past {@code targetSize} tokens, the buffer is cut
 * where its cumulative tokens first reach 80% of the budget (or at its midpoint if they never do).
 * The prefix is emitted; the rest stays buffered, preceded by the last {@code overlap} sentences
 * of the emitted prefix. For this strategy {@code overlap} counts sentences, not tokens, and never
 * carries more than half of the emitted prefix.
 *
 * <p>Each chunk carries {@code coherenceScore}, {@code topicKeywords} and {@code semanticDensity}.
 */
@Component
@RequiredArgsConstructor
public class SemanticChunkAssembler implements ChunkAssembler {

  private static final double BREAK_POINT_RATIO = 0.8;

  private final TokenEstimator tokenEstimator;
  private final SentenceSplitter sentenceSplitter;

  private record BufferedSentence(AtomicUnit unit, int index) {}

  @Override
  public ChunkingStrategyType strategy() {
    return ChunkingStrategyType.SEMANTIC;
  }

  @Override
  public List<ChunkRecord> assemble(String text, ChunkingParameters parameters) {
    int size = parameters.targetSize();
    int overlap = parameters.overlap();
    List<AtomicUnit> sentences = sentenceSplitter.split(text);

    List<ChunkRecord> chunks = new ArrayList<>();
    List<BufferedSentence> buffer = new ArrayList<>();
    int bufferTokens = 0;

    for (int i = 0; i < sentences.size(); i++) {
      AtomicUnit sentence = sentences.get(i);
      boolean overflow = !buffer.isEmpty() && bufferTokens + sentence.estimatedTokens() > size;
      buffer.add(new BufferedSentence(sentence, i));
      if (!overflow) {
        bufferTokens += sentence.estimatedTokens();
        continue;
      }

      int breakPoint = findBreakPoint(buffer, size);
      List<BufferedSentence> emitted = buffer.subList(0, breakPoint);
      chunks.add(emit(emitted, chunks.size() + 1));

      int carried = overlapSentenceCount(emitted, overlap);
      buffer = new ArrayList<>(buffer.subList(breakPoint - carried, buffer.size()));
      bufferTokens = buffer.stream().mapToInt(s -> s.unit().estimatedTokens()).sum();
    }

    if (!buffer.isEmpty()) {
      chunks.add(emit(buffer, chunks.size() + 1));
    }
    return chunks;
  }

  private static int findBreakPoint(List<BufferedSentence> buffer, int size) {
    int cumulative = 0;
    for (int i = 0; i < buffer.size(); i++) {
      cumulative += buffer.get(i).unit().estimatedTokens();
      if (cumulative >= size * BREAK_POINT_RATIO) {
        return i + 1;
      }
    }
    return Math.max(1, buffer.size() / 2);
  }

  private static int overlapSentenceCount(List<BufferedSentence> emitted, int overlap) {
    return overlap <= 0 ? 0 : Math.min(overlap, emitted.size() / 2);
  }

  private ChunkRecord emit(List<BufferedSentence> sentences, int sequenceIndex) {
    String content =
        sentences.stream().map(s -> s.unit().text()).collect(Collectors.joining(" ")).strip();
    List<AtomicUnit> units = sentences.stream().map(BufferedSentence::unit).toList();
    return ChunkRecord.builder()
        .sequenceIndex(sequenceIndex)
        .text(content)
        .estimatedTokens(tokenEstimator.estimateTokens(content))
        .characterCount(UnicodeText.length(content))
        .unitCount(sentences.size())
        .unitRange(
            UnitRange.ofZeroBased(
                sentences.get(0).index(), sentences.get(sentences.size() - 1).index()))
        .strategyTag(strategy().getTag())
        .coherenceScore(LexicalMetrics.semanticCoherence(content))
        .topicKeywords(LexicalMetrics.topicKeywords(content))
        .semanticDensity(LexicalMetrics.semanticDensity(units))
        .build();
  }
}
