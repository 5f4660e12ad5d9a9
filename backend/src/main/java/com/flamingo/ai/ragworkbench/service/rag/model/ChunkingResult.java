package com.flamingo.ai.ragworkbench.service.rag.model;

import java.util.List;

/**
 * Output of a scored chunking run.
 *
 * @param parameters effective parameters after strategy resolution and clamping
 * @param fallbackApplied true when the requested strategy was unknown and fixed-size was used
 * @param chunks chunks in emission order
 * @param metrics aggregate statistics over {@code chunks}
 * @param insights human-readable observations for the preview UI
 */
public record ChunkingResult(
    ChunkingParameters parameters,
    boolean fallbackApplied,
    List<ChunkRecord> chunks,
    ChunkingMetrics metrics,
    List<String> insights) {}
