package com.flamingo.ai.ragworkbench.service.rag.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Inclusive, 1-based range of atomic units that contributed to a chunk.
 *
 * @param first index of the first contributing unit
 * @param last index of the last contributing unit
 */
public record UnitRange(int first, int last) {

  /** Builds a range from 0-based inclusive indices. */
  public static UnitRange ofZeroBased(int firstIndex, int lastIndex) {
    return new UnitRange(firstIndex + 1, lastIndex + 1);
  }

  /** Rendered as {@code "first-last"}, the form the preview UI displays. */
  @JsonValue
  @Override
  public String toString() {
    return first + "-" + last;
  }
}
