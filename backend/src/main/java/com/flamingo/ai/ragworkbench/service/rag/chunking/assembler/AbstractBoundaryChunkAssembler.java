package com.flamingo.ai.ragworkbench.service.rag.chunking.assembler;

import com.flamingo.ai.ragworkbench.service.rag.chunking.TokenEstimator;
import com.flamingo.ai.ragworkbench.service.rag.chunking.UnicodeText;
import com.flamingo.ai.ragworkbench.service.rag.model.AtomicUnit;
import com.flamingo.ai.ragworkbench.service.rag.model.ChunkRecord;
import com.flamingo.ai.ragworkbench.service.rag.model.ChunkingParameters;
import com.flamingo.ai.ragworkbench.service.rag.model.UnitRange;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;

/**
 * Character-budgeted accumulation shared by the sentence and paragraph strategies.
 *
 * <p>Segments are appended while the joined length stays within {@code targetSize}. When the next
 * segment would overflow, the current chunk is emitted and the next one is seeded with the
 * shortest suffix of segments whose joined length reaches {@code overlap}. If even the whole chunk
 * is shorter than {@code overlap}, nothing is carried over. A single segment larger than the
 * budget is emitted on its own.
 *
 * <p>Subclasses may declare hard boundaries between two segments. At a hard boundary the current
 * chunk is emitted regardless of the remaining budget and the next chunk starts empty, without any
 * overlap carried across.
 */
@RequiredArgsConstructor
abstract class AbstractBoundaryChunkAssembler implements ChunkAssembler {

  /**
   * A unit placed in a chunk.
   *
   * @param unit the span
   * @param ordinal 0-based index of the unit reported in {@link ChunkRecord#unitRange()}
   * @param split whether the span is a piece of a unit that was too large to place whole
   */
  protected record Segment(AtomicUnit unit, int ordinal, boolean split) {

    protected Segment(AtomicUnit unit, int ordinal) {
      this(unit, ordinal, false);
    }
  }

  protected final TokenEstimator tokenEstimator;

  /** Breaks {@code text} into the segments to accumulate. */
  protected abstract List<Segment> segments(String text, int targetSize);

  /** Separator placed between two adjacent segments in a chunk. */
  protected abstract String separator(Segment previous, Segment next);

  /** Adds strategy-specific quality fields to a chunk about to be emitted. */
  protected abstract void annotate(
      ChunkRecord.ChunkRecordBuilder builder, List<Segment> segments, String content);

  /** Whether the chunk must end between {@code previous} and {@code next}. */
  protected boolean forcesBreak(Segment previous, Segment next) {
    return false;
  }

  @Override
  public List<ChunkRecord> assemble(String text, ChunkingParameters parameters) {
    int size = parameters.targetSize();
    int overlap = parameters.overlap();

    List<ChunkRecord> chunks = new ArrayList<>();
    List<Segment> current = new ArrayList<>();
    int currentLength = 0;

    for (Segment segment : segments(text, size)) {
      int segmentLength = UnicodeText.length(segment.unit().text());
      if (!current.isEmpty() && forcesBreak(last(current), segment)) {
        chunks.add(emit(current, chunks.size() + 1));
        current = new ArrayList<>();
        currentLength = 0;
      }
      if (!current.isEmpty()) {
        int separatorLength = separator(last(current), segment).length();
        if (currentLength + separatorLength + segmentLength > size) {
          chunks.add(emit(current, chunks.size() + 1));
          current = overlapSuffix(current, overlap);
          currentLength = joinedLength(current);
        }
      }
      if (!current.isEmpty()) {
        currentLength += separator(last(current), segment).length();
      }
      current.add(segment);
      currentLength += segmentLength;
    }

    if (!current.isEmpty()) {
      chunks.add(emit(current, chunks.size() + 1));
    }
    return chunks;
  }

  private ChunkRecord emit(List<Segment> segments, int sequenceIndex) {
    String content = join(segments).strip();
    Segment first = segments.get(0);
    Segment lastSegment = last(segments);
    int distinctUnits = 1;
    for (int i = 1; i < segments.size(); i++) {
      if (segments.get(i).ordinal() != segments.get(i - 1).ordinal()) {
        distinctUnits++;
      }
    }

    ChunkRecord.ChunkRecordBuilder builder =
        ChunkRecord.builder()
            .sequenceIndex(sequenceIndex)
            .text(content)
            .estimatedTokens(tokenEstimator.estimateTokens(content))
            .characterCount(UnicodeText.length(content))
            .unitCount(distinctUnits)
            .unitRange(UnitRange.ofZeroBased(first.ordinal(), lastSegment.ordinal()))
            .strategyTag(strategy().getTag());
    annotate(builder, segments, content);
    return builder.build();
  }

  private List<Segment> overlapSuffix(List<Segment> segments, int overlap) {
    List<Segment> suffix = new ArrayList<>();
    if (overlap <= 0) {
      return suffix;
    }
    int accumulated = 0;
    for (int j = segments.size() - 1; j >= 0; j--) {
      accumulated += UnicodeText.length(segments.get(j).unit().text());
      if (j < segments.size() - 1) {
        accumulated += separator(segments.get(j), segments.get(j + 1)).length();
      }
      if (accumulated >= overlap) {
        suffix.addAll(segments.subList(j, segments.size()));
        return suffix;
      }
    }
    return suffix;
  }

  private String join(List<Segment> segments) {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < segments.size(); i++) {
      if (i > 0) {
        sb.append(separator(segments.get(i - 1), segments.get(i)));
      }
      sb.append(segments.get(i).unit().text());
    }
    return sb.toString();
  }

  private int joinedLength(List<Segment> segments) {
    return segments.isEmpty() ? 0 : UnicodeText.length(join(segments));
  }

  private static Segment last(List<Segment> segments) {
    return segments.get(segments.size() - 1);
  }
}
