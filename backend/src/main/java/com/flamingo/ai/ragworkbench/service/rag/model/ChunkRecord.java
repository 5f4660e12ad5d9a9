package com.flamingo.ai.ragworkbench.service.rag.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import lombok.Builder;

/**
 * A single chunk produced by the chunking engine, ready for embedding and indexing.
 *
 * <p>Records are immutable once assembled. Strategy-specific fields are {@code null} when the
 * producing strategy does not compute them.
 *
 * @param sequenceIndex 1-based position in emission order
 * @param text trimmed chunk text
 * @param estimatedTokens heuristic token count
 * @param characterCount number of code points in {@code text}
 * @param unitCount sentences, paragraphs or words contained
 * @param unitRange first and last contributing unit (1-based, inclusive)
 * @param strategyTag tag of the producing strategy, e.g. {@code "sentence-boundary"}
 * @param startOffset code-point offset where the chunk window starts (fixed-size only)
 * @param endOffset code-point offset where the chunk window ends, exclusive (fixed-size only)
 * @param completeness fraction of complete sentences, or window fill ratio for sliding windows
 * @param coherence lexical repetition score of paragraph chunks
 * @param coherenceScore lexical repetition score of semantic chunks
 * @param semanticDensity average words per sentence normalised against 20
 * @param topicKeywords up to five most frequent non-stopword terms
 * @param overlapTokens estimated tokens shared with the preceding chunk
 * @param overlapPercentage {@code overlapTokens} as a rounded percentage of this chunk's tokens
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChunkRecord(
    int sequenceIndex,
    String text,
    int estimatedTokens,
    int characterCount,
    Integer unitCount,
    UnitRange unitRange,
    String strategyTag,
    Integer startOffset,
    Integer endOffset,
    Double completeness,
    Double coherence,
    Double coherenceScore,
    Double semanticDensity,
    List<String> topicKeywords,
    Integer overlapTokens,
    Integer overlapPercentage) {}
