package com.flamingo.ai.ragworkbench.service.rag.chunking.assembler;

import com.flamingo.ai.ragworkbench.domain.enums.ChunkingStrategyType;
import com.flamingo.ai.ragworkbench.service.rag.chunking.LexicalMetrics;
import com.flamingo.ai.ragworkbench.service.rag.chunking.TokenEstimator;
import com.flamingo.ai.ragworkbench.service.rag.chunking.splitter.SentenceSplitter;
import com.flamingo.ai.ragworkbench.service.rag.model.AtomicUnit;
import com.flamingo.ai.ragworkbench.service.rag.model.ChunkRecord;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Packs whole sentences into chunks of at most {@code targetSize} characters, joined by a single
 * space. {@code completeness} is the share of the chunk's sentences that end in terminal
 * punctuation.
 */
@Component
public class SentenceBoundaryChunkAssembler extends AbstractBoundaryChunkAssembler {

  private final SentenceSplitter sentenceSplitter;

  public SentenceBoundaryChunkAssembler(
      TokenEstimator tokenEstimator, SentenceSplitter sentenceSplitter) {
    super(tokenEstimator);
    this.sentenceSplitter = sentenceSplitter;
  }

  @Override
  public ChunkingStrategyType strategy() {
    return ChunkingStrategyType.SENTENCE;
  }

  @Override
  protected List<Segment> segments(String text, int targetSize) {
    List<AtomicUnit> sentences = sentenceSplitter.split(text);
    List<Segment> segments = new ArrayList<>(sentences.size());
    for (int i = 0; i < sentences.size(); i++) {
      segments.add(new Segment(sentences.get(i), i));
    }
    return segments;
  }

  @Override
  protected String separator(Segment previous, Segment next) {
    return " ";
  }

  @Override
  protected void annotate(
      ChunkRecord.ChunkRecordBuilder builder, List<Segment> segments, String content) {
    List<AtomicUnit> sentences = segments.stream().map(Segment::unit).toList();
    builder.completeness(LexicalMetrics.sentenceCompleteness(sentences));
  }
}
