package com.flamingo.ai.ragworkbench.service.rag.model;

/** Kind of span produced by a boundary splitter. */
public enum UnitType {
  SENTENCE,
  PARAGRAPH,
  WORD
}
