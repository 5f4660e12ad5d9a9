package com.flamingo.ai.ragworkbench.service.rag.chunking.splitter;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.ragworkbench.service.rag.chunking.TokenEstimator;
import com.flamingo.ai.ragworkbench.service.rag.model.AtomicUnit;
import com.flamingo.ai.ragworkbench.service.rag.model.UnitType;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SentenceSplitter Tests")
class SentenceSplitterTest {

  private final SentenceSplitter splitter = new SentenceSplitter(new TokenEstimator());

  @Test
  @DisplayName("should split at terminators followed by whitespace and an uppercase letter")
  void shouldSplitAtSentenceBoundaries() {
    List<AtomicUnit> units = splitter.split("Hello world. This is a test.");

    assertThat(units)
        .extracting(AtomicUnit::text)
        .containsExactly("Hello world.", "This is a test.");
    assertThat(units).extracting(AtomicUnit::type).containsOnly(UnitType.SENTENCE);
    assertThat(units.get(0).estimatedTokens()).isEqualTo(3);
  }

  @Test
  @DisplayName("should handle question and exclamation marks")
  void shouldHandleQuestionAndExclamationMarks() {
    assertThat(splitter.split("Is it ready? Yes! Ship it."))
        .extracting(AtomicUnit::text)
        .containsExactly("Is it ready?", "Yes!", "Ship it.");
  }

  @Test
  @DisplayName("should not split before a lowercase continuation")
  void shouldNotSplit_beforeLowercaseContinuation() {
    assertThat(splitter.split("Use e.g. this form. Next sentence"))
        .extracting(AtomicUnit::text)
        .containsExactly("Use e.g. this form.", "Next sentence");
  }

  @Test
  @DisplayName("should emit a trailing sentence without a terminator")
  void shouldEmitTrailingSentence_withoutTerminator() {
    assertThat(splitter.split("First sentence.   Trailing words without end  "))
        .extracting(AtomicUnit::text)
        .containsExactly("First sentence.", "Trailing words without end");
  }

  @Test
  @DisplayName("should return the whole text when no boundary is found")
  void shouldReturnWholeText_whenNoBoundaryFound() {
    assertThat(splitter.split("  just some words with no punctuation  "))
        .extracting(AtomicUnit::text)
        .containsExactly("just some words with no punctuation");
  }

  @Test
  @DisplayName("should recognise accented uppercase letters as sentence starts")
  void shouldRecogniseAccentedUppercase() {
    assertThat(splitter.split("Premi\u00e8re phrase. \u00c9lan suivant."))
        .extracting(AtomicUnit::text)
        .containsExactly("Premi\u00e8re phrase.", "\u00c9lan suivant.");
  }

  @Test
  @DisplayName("should return no units for blank text")
  void shouldReturnNoUnits_forBlankText() {
    assertThat(splitter.split("")).isEmpty();
    assertThat(splitter.split(" \n ")).isEmpty();
  }
}
