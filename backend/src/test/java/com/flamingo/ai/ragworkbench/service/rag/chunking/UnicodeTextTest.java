package com.flamingo.ai.ragworkbench.service.rag.chunking;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("UnicodeText Tests")
class UnicodeTextTest {

  @Test
  @DisplayName("should measure length in code points")
  void shouldMeasureCodePoints() {
    assertThat(UnicodeText.length("a\ud83d\ude00b")).isEqualTo(3);
  }

  @Test
  @DisplayName("should count whitespace-delimited words")
  void shouldCountWords() {
    assertThat(UnicodeText.wordCount("  one\ttwo\n\nthree ")).isEqualTo(3);
    assertThat(UnicodeText.wordCount("   ")).isZero();
  }

  @Test
  @DisplayName("should move a boundary back before a combining mark")
  void shouldMoveBackBeforeCombiningMark() {
    int[] codePoints = "abe\u0301c".codePoints().toArray();

    assertThat(UnicodeText.clusterBoundary(codePoints, 3, 0)).isEqualTo(2);
    assertThat(UnicodeText.clusterBoundary(codePoints, 4, 0)).isEqualTo(4);
  }

  @Test
  @DisplayName("should keep zero-width joiner sequences together")
  void shouldKeepJoinerSequencesTogether() {
    // man, ZWJ, laptop
    int[] codePoints = "x\ud83d\udc68\u200d\ud83d\udcbby".codePoints().toArray();

    assertThat(UnicodeText.clusterBoundary(codePoints, 3, 0)).isEqualTo(1);
    assertThat(UnicodeText.clusterBoundary(codePoints, 2, 0)).isEqualTo(1);
  }

  @Test
  @DisplayName("should move forward when the floor blocks the backward search")
  void shouldMoveForward_whenFloorBlocks() {
    int[] codePoints = "e\u0301\u0301x".codePoints().toArray();

    assertThat(UnicodeText.clusterBoundary(codePoints, 1, 0)).isEqualTo(3);
  }
}
