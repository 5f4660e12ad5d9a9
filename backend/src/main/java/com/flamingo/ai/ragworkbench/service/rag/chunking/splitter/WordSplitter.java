package com.flamingo.ai.ragworkbench.service.rag.chunking.splitter;

import com.flamingo.ai.ragworkbench.service.rag.chunking.TokenEstimator;
import com.flamingo.ai.ragworkbench.service.rag.chunking.UnicodeText;
import com.flamingo.ai.ragworkbench.service.rag.model.AtomicUnit;
import com.flamingo.ai.ragworkbench.service.rag.model.UnitType;
import java.util.List;
import org.springframework.stereotype.Component;

/** Splits text on whitespace runs; used by the sliding-window assembler. */
@Component
public class WordSplitter extends AbstractBoundarySplitter {

  public WordSplitter(TokenEstimator tokenEstimator) {
    super(tokenEstimator);
  }

  @Override
  protected void scan(String text, List<AtomicUnit> units) {
    int length = text.length();
    int i = 0;
    while (i < length) {
      int cp = text.codePointAt(i);
      if (UnicodeText.isWhitespace(cp)) {
        i += Character.charCount(cp);
        continue;
      }
      int start = i;
      while (i < length && !UnicodeText.isWhitespace(text.codePointAt(i))) {
        i += Character.charCount(text.codePointAt(i));
      }
      addUnit(text.substring(start, i), units);
    }
  }

  @Override
  public UnitType unitType() {
    return UnitType.WORD;
  }
}
