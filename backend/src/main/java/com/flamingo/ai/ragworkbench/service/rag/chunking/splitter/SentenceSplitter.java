package com.flamingo.ai.ragworkbench.service.rag.chunking.splitter;

import com.flamingo.ai.ragworkbench.service.rag.chunking.TokenEstimator;
import com.flamingo.ai.ragworkbench.service.rag.chunking.UnicodeText;
import com.flamingo.ai.ragworkbench.service.rag.model.AtomicUnit;
import com.flamingo.ai.ragworkbench.service.rag.model.UnitType;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Splits text into sentences.
 *
 * <p>A sentence ends at {@code .}, {@code !} or {@code ?} when it is followed by whitespace and
 * an uppercase letter, or by nothing but whitespace until the end of the text. Text after the last
 * detected terminator is still emitted as a trailing sentence.
 */
@Component
public class SentenceSplitter extends AbstractBoundarySplitter {

  public SentenceSplitter(TokenEstimator tokenEstimator) {
    super(tokenEstimator);
  }

  @Override
  protected void scan(String text, List<AtomicUnit> units) {
    int length = text.length();
    int start = 0;
    int i = 0;
    while (i < length) {
      int cp = text.codePointAt(i);
      int next = i + Character.charCount(cp);
      if (isTerminator(cp)) {
        int j = next;
        while (j < length && UnicodeText.isWhitespace(text.codePointAt(j))) {
          j += Character.charCount(text.codePointAt(j));
        }
        if (j == length || (j > next && startsSentence(text.codePointAt(j)))) {
          addUnit(text.substring(start, next), units);
          start = j;
          i = j;
          continue;
        }
      }
      i = next;
    }
    if (start < length) {
      addUnit(text.substring(start), units);
    }
  }

  @Override
  public UnitType unitType() {
    return UnitType.SENTENCE;
  }

  private static boolean isTerminator(int cp) {
    return cp == '.' || cp == '!' || cp == '?';
  }

  private static boolean startsSentence(int cp) {
    return Character.isUpperCase(cp) || Character.isTitleCase(cp);
  }
}
