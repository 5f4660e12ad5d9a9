package com.flamingo.ai.ragworkbench.service.rag.chunking.assembler;

import com.flamingo.ai.ragworkbench.domain.enums.ChunkingStrategyType;
import com.flamingo.ai.ragworkbench.service.rag.chunking.TokenEstimator;
import com.flamingo.ai.ragworkbench.service.rag.chunking.UnicodeText;
import com.flamingo.ai.ragworkbench.service.rag.chunking.splitter.WordSplitter;
import com.flamingo.ai.ragworkbench.service.rag.model.AtomicUnit;
import com.flamingo.ai.ragworkbench.service.rag.model.ChunkRecord;
import com.flamingo.ai.ragworkbench.service.rag.model.ChunkingParameters;
import com.flamingo.ai.ragworkbench.service.rag.model.UnitRange;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * {@link ChunkAssembler} producing overlapping windows of whitespace-delimited words.
 *
 * <p>A window takes words while their summed token estimates fit in {@code targetSize}; it always
 * takes at least one word. Windows below 30% of the budget are dropped unless they reach words no
 * earlier window covered. Assembly stops once a window reaches the last word.
 *
 * <p>The next window starts {@code floor(words * overlap / tokens)} words before the end of the
 * current one. This converts the token overlap into a proportional word count and is therefore
 * approximate, not an exact token-for-token overlap. With no overlap, or when the window holds no
 * more tokens than the overlap, the next window starts half a window further on. {@code
 * overlapTokens} reports the actual overlap: the longest run of words ending the previous chunk
 * that also starts this one.
 */
@Component
@RequiredArgsConstructor
public class SlidingWindowChunkAssembler implements ChunkAssembler {

  private static final double MINIMUM_FILL_RATIO = 0.3;
  private static final double MAX_OVERLAP_RATIO = 0.8;

  private final TokenEstimator tokenEstimator;
  private final WordSplitter wordSplitter;

  @Override
  public ChunkingStrategyType strategy() {
    return ChunkingStrategyType.SLIDING;
  }

  @Override
  public List<ChunkRecord> assemble(String text, ChunkingParameters parameters) {
    int size = parameters.targetSize();
    int overlap = parameters.overlap();
    List<AtomicUnit> words = wordSplitter.split(text);
    int total = words.size();
    int minimumFill = (int) Math.floor(size * MINIMUM_FILL_RATIO);

    List<ChunkRecord> chunks = new ArrayList<>();
    List<String> previousWords = List.of();
    int coveredUntil = 0;
    int position = 0;

    while (position < total) {
      int start = position;
      int tokens = 0;
      while (position < total && tokens < size) {
        int wordTokens = words.get(position).estimatedTokens();
        if (tokens + wordTokens > size && position > start) {
          break;
        }
        tokens += wordTokens;
        position++;
      }
      int end = position;
      int count = end - start;

      if (tokens >= minimumFill || end > coveredUntil) {
        List<String> windowWords =
            words.subList(start, end).stream().map(AtomicUnit::text).toList();
        chunks.add(emit(windowWords, previousWords, start, end, tokens, size, chunks.size() + 1));
        previousWords = windowWords;
        coveredUntil = Math.max(coveredUntil, end);
      }

      if (end >= total) {
        break;
      }

      if (overlap > 0 && tokens > overlap) {
        int targetOverlap = Math.min(overlap, (int) Math.floor(tokens * MAX_OVERLAP_RATIO));
        int overlapWords = (int) Math.floor(count * ((double) targetOverlap / tokens));
        overlapWords = Math.max(1, Math.min(overlapWords, count - 1));
        position = Math.max(start + 1, end - overlapWords);
      } else {
        position = start + Math.max(1, count / 2);
      }
    }
    return chunks;
  }

  private ChunkRecord emit(
      List<String> windowWords,
      List<String> previousWords,
      int start,
      int end,
      int tokens,
      int size,
      int sequenceIndex) {
    String content = String.join(" ", windowWords);
    int sharedWords = sharedWordRun(previousWords, windowWords);
    int overlapTokens =
        sharedWords > 0
            ? tokenEstimator.estimateTokens(String.join(" ", windowWords.subList(0, sharedWords)))
            : 0;
    int overlapPercentage =
        overlapTokens > 0 && tokens > 0 ? (int) Math.round(overlapTokens * 100.0 / tokens) : 0;

    return ChunkRecord.builder()
        .sequenceIndex(sequenceIndex)
        .text(content)
        .estimatedTokens(tokens)
        .characterCount(UnicodeText.length(content))
        .unitCount(windowWords.size())
        .unitRange(UnitRange.ofZeroBased(start, end - 1))
        .strategyTag(strategy().getTag())
        .completeness(Math.min(1.0, (double) tokens / size))
        .overlapTokens(overlapTokens)
        .overlapPercentage(overlapPercentage)
        .build();
  }

  /** Length of the longest run that ends {@code previous} and also starts {@code current}. */
  private static int sharedWordRun(List<String> previous, List<String> current) {
    for (int run = Math.min(previous.size(), current.size()); run > 0; run--) {
      List<String> tail = previous.subList(previous.size() - run, previous.size());
      if (tail.equals(current.subList(0, run))) {
        return run;
      }
    }
    return 0;
  }
}
