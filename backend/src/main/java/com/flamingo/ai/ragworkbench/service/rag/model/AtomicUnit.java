package com.flamingo.ai.ragworkbench.service.rag.model;

/**
 * A contiguous, trimmed span of document text produced by a boundary splitter.
 *
 * <p>Units only live for the duration of a single assembler invocation.
 *
 * @param text trimmed, non-empty span text
 * @param type whether the span is a sentence, paragraph or word
 * @param estimatedTokens heuristic token count of {@code text}
 */
public record AtomicUnit(String text, UnitType type, int estimatedTokens) {}
