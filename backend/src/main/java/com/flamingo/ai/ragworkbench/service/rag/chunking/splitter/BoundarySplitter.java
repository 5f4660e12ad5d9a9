package com.flamingo.ai.ragworkbench.service.rag.chunking.splitter;

import com.flamingo.ai.ragworkbench.service.rag.model.AtomicUnit;
import com.flamingo.ai.ragworkbench.service.rag.model.UnitType;
import java.util.List;

/**
 * Divides raw document text into ordered atomic units.
 *
 * <p>Implementations are stateless and safe for concurrent use. Units are trimmed and never empty.
 * For non-blank input at least one unit is returned: when no natural boundary is found the whole
 * trimmed text becomes a single unit, so every assembler makes progress.
 */
public interface BoundarySplitter {

  /**
   * Splits {@code text} into units.
   *
   * @param text document text; must not be null
   * @return ordered units, empty only for blank input
   */
  List<AtomicUnit> split(String text);

  /** Kind of unit this splitter produces. */
  UnitType unitType();
}
