package com.flamingo.ai.ragworkbench.service.rag.chunking;

import org.springframework.stereotype.Component;

/**
 * Approximates the token count of a text span without a real tokenizer.
 *
 * <p>The estimate is the number of word-like runs (letters, digits, underscore) plus
 *
 * <ul>
 *   <li>{@code ceil(punctuation / 2.5)} for the characters {@code . , ; : ! ? ( ) -}
 *   <li>{@code floor(numericRuns * 0.7)} for runs consisting only of digits
 *   <li>{@code floor(longWords * 0.3)} for runs longer than six characters
 * </ul>
 *
 * <p>Any non-empty input yields at least 1; the empty string yields 0. The result is a sizing
 * budget, not a billing count.
 */
@Component
public class TokenEstimator {

  private static final String PUNCTUATION = ".,;:!?()-";
  private static final int LONG_WORD_LENGTH = 6;

  /**
   * Estimates the token count of {@code text}.
   *
   * @param text text to measure; must not be null
   * @return 0 for the empty string, otherwise a positive estimate
   */
  public int estimateTokens(String text) {
    if (text.isEmpty()) {
      return 0;
    }

    int words = 0;
    int numbers = 0;
    int longWords = 0;
    int punctuation = 0;

    int i = 0;
    int length = text.length();
    while (i < length) {
      int cp = text.codePointAt(i);
      if (UnicodeText.isWordChar(cp)) {
        int runLength = 0;
        boolean numeric = true;
        while (i < length) {
          int c = text.codePointAt(i);
          if (!UnicodeText.isWordChar(c)) {
            break;
          }
          numeric &= Character.isDigit(c);
          runLength++;
          i += Character.charCount(c);
        }
        words++;
        if (numeric) {
          numbers++;
        }
        if (runLength > LONG_WORD_LENGTH) {
          longWords++;
        }
        continue;
      }
      if (PUNCTUATION.indexOf(cp) >= 0) {
        punctuation++;
      }
      i += Character.charCount(cp);
    }

    int estimate =
        words
            + (int) Math.ceil(punctuation / 2.5)
            + (int) Math.floor(numbers * 0.7)
            + (int) Math.floor(longWords * 0.3);
    return Math.max(1, estimate);
  }
}
