package com.flamingo.ai.ragworkbench.service.rag.chunking.assembler;

import com.flamingo.ai.ragworkbench.domain.enums.ChunkingStrategyType;
import com.flamingo.ai.ragworkbench.service.rag.chunking.LexicalMetrics;
import com.flamingo.ai.ragworkbench.service.rag.chunking.TokenEstimator;
import com.flamingo.ai.ragworkbench.service.rag.chunking.UnicodeText;
import com.flamingo.ai.ragworkbench.service.rag.chunking.splitter.ParagraphSplitter;
import com.flamingo.ai.ragworkbench.service.rag.chunking.splitter.SentenceSplitter;
import com.flamingo.ai.ragworkbench.service.rag.model.AtomicUnit;
import com.flamingo.ai.ragworkbench.service.rag.model.ChunkRecord;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Packs whole paragraphs into chunks of at most {@code targetSize} characters, joined by a blank
 * line.
 *
 * <p>A paragraph longer than the budget on its own is broken into its sentences, which are then
 * packed like the sentence strategy does (joined by a space within the paragraph). Such a
 * paragraph is a hard boundary: the chunk before it is closed, its sentences never share a chunk
 * with a neighbouring paragraph, and the next paragraph starts a fresh chunk. Unit counts and
 * ranges always refer to paragraphs. {@code coherence} is the duplicate-word fraction of the chunk,
 * scaled by 3 and capped at 1.0.
 */
@Component
public class ParagraphBoundaryChunkAssembler extends AbstractBoundaryChunkAssembler {

  private static final String PARAGRAPH_SEPARATOR = "\n\n";

  private final ParagraphSplitter paragraphSplitter;
  private final SentenceSplitter sentenceSplitter;

  public ParagraphBoundaryChunkAssembler(
      TokenEstimator tokenEstimator,
      ParagraphSplitter paragraphSplitter,
      SentenceSplitter sentenceSplitter) {
    super(tokenEstimator);
    this.paragraphSplitter = paragraphSplitter;
    this.sentenceSplitter = sentenceSplitter;
  }

  @Override
  public ChunkingStrategyType strategy() {
    return ChunkingStrategyType.PARAGRAPH;
  }

  @Override
  protected List<Segment> segments(String text, int targetSize) {
    List<AtomicUnit> paragraphs = paragraphSplitter.split(text);
    List<Segment> segments = new ArrayList<>();
    for (int i = 0; i < paragraphs.size(); i++) {
      AtomicUnit paragraph = paragraphs.get(i);
      if (UnicodeText.length(paragraph.text()) <= targetSize) {
        segments.add(new Segment(paragraph, i));
        continue;
      }
      for (AtomicUnit sentence : sentenceSplitter.split(paragraph.text())) {
        segments.add(new Segment(sentence, i, true));
      }
    }
    return segments;
  }

  @Override
  protected String separator(Segment previous, Segment next) {
    return previous.ordinal() == next.ordinal() ? " " : PARAGRAPH_SEPARATOR;
  }

  @Override
  protected boolean forcesBreak(Segment previous, Segment next) {
    return previous.ordinal() != next.ordinal() && (previous.split() || next.split());
  }

  @Override
  protected void annotate(
      ChunkRecord.ChunkRecordBuilder builder, List<Segment> segments, String content) {
    builder.coherence(LexicalMetrics.paragraphCoherence(content));
  }
}
