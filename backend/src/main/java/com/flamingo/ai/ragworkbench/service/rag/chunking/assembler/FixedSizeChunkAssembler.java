package com.flamingo.ai.ragworkbench.service.rag.chunking.assembler;

import com.flamingo.ai.ragworkbench.domain.enums.ChunkingStrategyType;
import com.flamingo.ai.ragworkbench.service.rag.chunking.TokenEstimator;
import com.flamingo.ai.ragworkbench.service.rag.chunking.UnicodeText;
import com.flamingo.ai.ragworkbench.service.rag.model.ChunkRecord;
import com.flamingo.ai.ragworkbench.service.rag.model.ChunkingParameters;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * {@link ChunkAssembler} that walks the document in windows of {@code targetSize} code points.
 *
 * <p>When a window ends inside a word and a whitespace lies within its last 20%, the window is cut
 * at that whitespace instead. The next window starts {@code overlap} code points before the end of
 * the previous one, nudged to just after a whitespace within 10 code points when one exists. The
 * start always moves forward by at least one code point.
 *
 * <p>Because of the word-boundary rule the chunk count is not strictly monotonic in {@code
 * targetSize}: with no overlap, a slightly smaller size can move where windows end and yield one
 * chunk fewer over prose. Over text without whitespace the windows are exact and the count only
 * grows as the size shrinks.
 */
@Component
@RequiredArgsConstructor
public class FixedSizeChunkAssembler implements ChunkAssembler {

  private static final double WORD_BREAK_THRESHOLD = 0.8;
  private static final int OVERLAP_SNAP_DISTANCE = 10;

  private final TokenEstimator tokenEstimator;

  @Override
  public ChunkingStrategyType strategy() {
    return ChunkingStrategyType.FIXED;
  }

  @Override
  public List<ChunkRecord> assemble(String text, ChunkingParameters parameters) {
    int size = parameters.targetSize();
    int overlap = parameters.overlap();
    int[] codePoints = text.codePoints().toArray();
    int length = codePoints.length;

    List<ChunkRecord> chunks = new ArrayList<>();
    int position = 0;
    while (position < length) {
      int end = Math.min(position + size, length);
      if (end < length) {
        end = preferWordBoundary(codePoints, position, end, size);
        end = UnicodeText.clusterBoundary(codePoints, end, position);
      }

      String content = UnicodeText.slice(codePoints, position, end).strip();
      if (!content.isEmpty()) {
        chunks.add(
            ChunkRecord.builder()
                .sequenceIndex(chunks.size() + 1)
                .text(content)
                .estimatedTokens(tokenEstimator.estimateTokens(content))
                .characterCount(UnicodeText.length(content))
                .unitCount(UnicodeText.wordCount(content))
                .startOffset(position)
                .endOffset(end)
                .strategyTag(strategy().getTag())
                .build());
      }

      if (end >= length) {
        break;
      }

      int next = end - overlap;
      if (overlap > 0) {
        next = snapAfterWhitespace(codePoints, next, position, end);
      }
      if (next <= position) {
        next = position + 1;
      }
      position = UnicodeText.clusterBoundary(codePoints, next, position);
    }
    return chunks;
  }

  private static int preferWordBoundary(int[] codePoints, int start, int end, int size) {
    boolean insideWord =
        !UnicodeText.isWhitespace(codePoints[end - 1])
            && !UnicodeText.isWhitespace(codePoints[end]);
    if (!insideWord) {
      return end;
    }
    for (int i = end - 1; i > start; i--) {
      if (UnicodeText.isWhitespace(codePoints[i])) {
        return (i - start) > size * WORD_BREAK_THRESHOLD ? i : end;
      }
    }
    return end;
  }

  /**
   * Returns the position just after the whitespace nearest to {@code candidate}, if that position
   * stays within {@code (start, end]}; otherwise returns {@code candidate} unchanged.
   */
  private static int snapAfterWhitespace(int[] codePoints, int candidate, int start, int end) {
    for (int distance = 0; distance <= OVERLAP_SNAP_DISTANCE; distance++) {
      for (int index : new int[] {candidate + distance, candidate - distance}) {
        if (index < 0 || index >= codePoints.length) {
          continue;
        }
        int snapped = index + 1;
        if (UnicodeText.isWhitespace(codePoints[index]) && snapped > start && snapped <= end) {
          return snapped;
        }
      }
    }
    return candidate;
  }
}
