package com.flamingo.ai.ragworkbench.service.rag.chunking;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("TokenEstimator Tests")
class TokenEstimatorTest {

  private final TokenEstimator estimator = new TokenEstimator();

  @Test
  @DisplayName("should return zero for empty text")
  void shouldReturnZero_forEmptyText() {
    assertThat(estimator.estimateTokens("")).isZero();
  }

  @Test
  @DisplayName("should return at least one for whitespace-only text")
  void shouldReturnOne_forWhitespaceOnlyText() {
    assertThat(estimator.estimateTokens("   \n\t")).isEqualTo(1);
  }

  @Test
  @DisplayName("should count words plus a punctuation surcharge")
  void shouldCountWordsAndPunctuation() {
    // 4 words + ceil(1 / 2.5)
    assertThat(estimator.estimateTokens("The quick brown fox.")).isEqualTo(5);
    // 3 words + ceil(4 / 2.5)
    assertThat(estimator.estimateTokens("Hi, there! (ok)")).isEqualTo(5);
  }

  @Test
  @DisplayName("should add a surcharge for numeric runs")
  void shouldAddSurcharge_forNumbers() {
    // 4 words + floor(2 * 0.7)
    assertThat(estimator.estimateTokens("In 2024 and 2025")).isEqualTo(5);
    // 3 words + floor(1 * 0.7)
    assertThat(estimator.estimateTokens("Call 911 now")).isEqualTo(3);
  }

  @Test
  @DisplayName("should add a surcharge for words longer than six characters")
  void shouldAddSurcharge_forLongWords() {
    // 5 long words + floor(5 * 0.3)
    assertThat(
            estimator.estimateTokens("international cooperation requires extraordinary patience"))
        .isEqualTo(6);
  }

  @Test
  @DisplayName("should treat accented and non-Latin letters as word characters")
  void shouldTreatUnicodeLettersAsWords() {
    assertThat(estimator.estimateTokens("caf\u00e9 na\u00efve")).isEqualTo(2);
    assertThat(estimator.estimateTokens("\u6771\u4eac")).isEqualTo(1);
  }

  @Test
  @DisplayName("should be deterministic")
  void shouldBeDeterministic() {
    String text = "Retrieval-augmented generation, in 3 steps: chunk; embed; retrieve!";

    assertThat(estimator.estimateTokens(text)).isEqualTo(estimator.estimateTokens(text));
  }

  @Test
  @DisplayName("should never decrease when words are appended")
  void shouldNeverDecrease_whenWordsAreAppended() {
    String[] words =
        "The 2 quick, brown foxes jumped over 1000 extraordinarily lazy dogs.".split(" ");
    StringBuilder text = new StringBuilder();
    int previous = 0;
    for (String word : words) {
      text.append(word).append(' ');
      int current = estimator.estimateTokens(text.toString());
      assertThat(current).isGreaterThanOrEqualTo(previous);
      previous = current;
    }
  }
}
