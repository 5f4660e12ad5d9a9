package com.flamingo.ai.ragworkbench.service.rag.chunking.splitter;

import com.flamingo.ai.ragworkbench.service.rag.chunking.TokenEstimator;
import com.flamingo.ai.ragworkbench.service.rag.model.AtomicUnit;
import com.flamingo.ai.ragworkbench.service.rag.model.UnitType;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Splits text into paragraphs separated by one or more blank lines.
 *
 * <p>A separator is any whitespace run containing at least two line feeds, so lines holding only
 * spaces or tabs also count as blank.
 */
@Component
public class ParagraphSplitter extends AbstractBoundarySplitter {

  public ParagraphSplitter(TokenEstimator tokenEstimator) {
    super(tokenEstimator);
  }

  @Override
  protected void scan(String text, List<AtomicUnit> units) {
    int length = text.length();
    int start = 0;
    int i = 0;
    while (i < length) {
      if (!Character.isWhitespace(text.charAt(i))) {
        i++;
        continue;
      }
      int runStart = i;
      int lineFeeds = 0;
      while (i < length && Character.isWhitespace(text.charAt(i))) {
        if (text.charAt(i) == '\n') {
          lineFeeds++;
        }
        i++;
      }
      if (lineFeeds >= 2) {
        addUnit(text.substring(start, runStart), units);
        start = i;
      }
    }
    if (start < length) {
      addUnit(text.substring(start), units);
    }
  }

  @Override
  public UnitType unitType() {
    return UnitType.PARAGRAPH;
  }
}
