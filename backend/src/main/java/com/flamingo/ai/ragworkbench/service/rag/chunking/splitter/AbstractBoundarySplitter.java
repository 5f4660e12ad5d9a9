package com.flamingo.ai.ragworkbench.service.rag.chunking.splitter;

import com.flamingo.ai.ragworkbench.service.rag.chunking.TokenEstimator;
import com.flamingo.ai.ragworkbench.service.rag.model.AtomicUnit;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;

/** Collects trimmed spans into units and applies the whole-text fallback. */
@RequiredArgsConstructor
abstract class AbstractBoundarySplitter implements BoundarySplitter {

  protected final TokenEstimator tokenEstimator;

  @Override
  public List<AtomicUnit> split(String text) {
    List<AtomicUnit> units = new ArrayList<>();
    scan(text, units);
    if (units.isEmpty() && !text.isBlank()) {
      addUnit(text, units);
    }
    return units;
  }

  /** Scans {@code text} and appends each detected span through {@link #addUnit}. */
  protected abstract void scan(String text, List<AtomicUnit> units);

  protected void addUnit(String span, List<AtomicUnit> units) {
    String trimmed = span.strip();
    if (!trimmed.isEmpty()) {
      units.add(new AtomicUnit(trimmed, unitType(), tokenEstimator.estimateTokens(trimmed)));
    }
  }
}
