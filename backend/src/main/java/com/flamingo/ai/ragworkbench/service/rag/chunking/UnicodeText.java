package com.flamingo.ai.ragworkbench.service.rag.chunking;

/**
 * Code-point level helpers shared by splitters and assemblers.
 *
 * <p>All boundary decisions in the engine are made on code-point indices so that no split lands
 * inside a surrogate pair, and boundaries are nudged so that combining marks, variation selectors
 * and zero-width joiners stay attached to the character they extend.
 */
public final class UnicodeText {

  private static final int ZERO_WIDTH_JOINER = 0x200D;

  private UnicodeText() {}

  /** Number of code points in {@code text}. */
  public static int length(String text) {
    return text.codePointCount(0, text.length());
  }

  /** Builds a string from {@code codePoints[start, end)}. */
  public static String slice(int[] codePoints, int start, int end) {
    return new String(codePoints, start, end - start);
  }

  public static boolean isWhitespace(int codePoint) {
    return Character.isWhitespace(codePoint) || Character.isSpaceChar(codePoint);
  }

  /** Number of whitespace-delimited runs in {@code text}. */
  public static int wordCount(String text) {
    int count = 0;
    boolean inWord = false;
    int i = 0;
    while (i < text.length()) {
      int cp = text.codePointAt(i);
      boolean whitespace = isWhitespace(cp);
      if (!whitespace && !inWord) {
        count++;
      }
      inWord = !whitespace;
      i += Character.charCount(cp);
    }
    return count;
  }

  /** Letters, digits and underscore: the characters that make up a word-like token. */
  public static boolean isWordChar(int codePoint) {
    return Character.isLetterOrDigit(codePoint) || codePoint == '_';
  }

  /**
   * Whether {@code codePoint} extends the preceding character and must not start a new span.
   */
  public static boolean isExtending(int codePoint) {
    int type = Character.getType(codePoint);
    return type == Character.NON_SPACING_MARK
        || type == Character.ENCLOSING_MARK
        || type == Character.COMBINING_SPACING_MARK
        || codePoint == ZERO_WIDTH_JOINER
        || (codePoint >= 0xFE00 && codePoint <= 0xFE0F)
        || (codePoint >= 0xE0100 && codePoint <= 0xE01EF)
        || (codePoint >= 0x1F3FB && codePoint <= 0x1F3FF);
  }

  /**
   * Moves {@code index} so that it does not fall inside a grapheme cluster.
   *
   * <p>The index is first moved backward, but never to or below {@code floor}; if that is not
   * possible it is moved forward instead.
   *
   * @param codePoints the document as code points
   * @param index candidate boundary
   * @param floor exclusive lower bound for the backward search
   * @return a boundary index in {@code (floor, codePoints.length]}
   */
  public static int clusterBoundary(int[] codePoints, int index, int floor) {
    int candidate = index;
    while (candidate > floor + 1
        && candidate < codePoints.length
        && isClusterContinuation(codePoints, candidate)) {
      candidate--;
    }
    if (candidate < codePoints.length && isClusterContinuation(codePoints, candidate)) {
      candidate = index;
      while (candidate < codePoints.length && isClusterContinuation(codePoints, candidate)) {
        candidate++;
      }
    }
    return candidate;
  }

  private static boolean isClusterContinuation(int[] codePoints, int index) {
    return isExtending(codePoints[index])
        || (index > 0 && codePoints[index - 1] == ZERO_WIDTH_JOINER);
  }
}
