package com.flamingo.ai.ragworkbench.service.rag.chunking.assembler;

import com.flamingo.ai.ragworkbench.domain.enums.ChunkingStrategyType;
import com.flamingo.ai.ragworkbench.service.rag.model.ChunkRecord;
import com.flamingo.ai.ragworkbench.service.rag.model.ChunkingParameters;
import java.util.List;

/**
 * Turns document text into ordered {@link ChunkRecord}s for one segmentation strategy.
 *
 * <p>Implementations must be stateless and safe for concurrent use. For non-blank input they
 * return at least one chunk, and the chunk texts, read in order with repeated overlap removed,
 * cover the whole document up to whitespace at chunk edges. Every loop advances its position on
 * each iteration, so assembly terminates for any parameters.
 */
public interface ChunkAssembler {

  /** Strategy implemented by this assembler. */
  ChunkingStrategyType strategy();

  /**
   * Produces chunks from {@code text}.
   *
   * @param text document text; blank text yields an empty list
   * @param parameters clamped size and overlap
   * @return chunks with 1-based sequence indices in emission order
   */
  List<ChunkRecord> assemble(String text, ChunkingParameters parameters);
}
