package com.flamingo.ai.ragworkbench.service.rag.chunking;

import com.flamingo.ai.ragworkbench.service.rag.model.AtomicUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Crude lexical proxies used to annotate chunks for reporting.
 *
 * <p>None of these scores drive segmentation; they are displayed next to each chunk in the preview
 * and folded into the average quality score.
 */
public final class LexicalMetrics {

  private static final int KEYWORD_LIMIT = 5;
  private static final int KEYWORD_MIN_LENGTH = 4;
  private static final int SEMANTIC_MIN_LENGTH = 3;
  private static final double WORDS_PER_DENSE_SENTENCE = 20.0;

  private static final Set<String> STOP_WORDS =
      Set.of(
          "the", "be", "to", "of", "and", "a", "in", "that", "have", "i", "it", "for", "not", "on",
          "with", "he", "as", "you", "do", "at", "this", "but", "his", "by", "from", "they", "she",
          "or", "an", "will", "my", "one", "all", "would", "there", "their", "what", "so", "up",
          "out", "if", "about", "who", "get", "which", "go", "me", "when", "make", "can", "like",
          "time", "no", "just", "him", "know", "take", "people", "into", "year", "your", "good",
          "some", "could", "them", "see", "other", "than", "then", "now", "look", "only", "come",
          "its", "over", "think", "also", "back", "after", "use", "two", "how", "our", "work",
          "first", "well", "way", "even", "new", "want", "because", "any", "these", "give", "day",
          "most", "us");

  private LexicalMetrics() {}

  /** Lower-cased word-like runs of {@code text}, in order of appearance. */
  public static List<String> words(String text) {
    List<String> words = new ArrayList<>();
    int i = 0;
    int length = text.length();
    while (i < length) {
      int cp = text.codePointAt(i);
      if (!UnicodeText.isWordChar(cp)) {
        i += Character.charCount(cp);
        continue;
      }
      int start = i;
      while (i < length && UnicodeText.isWordChar(text.codePointAt(i))) {
        i += Character.charCount(text.codePointAt(i));
      }
      words.add(text.substring(start, i).toLowerCase(Locale.ROOT));
    }
    return words;
  }

  public static boolean isStopWord(String word) {
    return STOP_WORDS.contains(word.toLowerCase(Locale.ROOT));
  }

  public static boolean endsWithTerminator(String sentence) {
    String trimmed = sentence.strip();
    if (trimmed.isEmpty()) {
      return false;
    }
    char last = trimmed.charAt(trimmed.length() - 1);
    return last == '.' || last == '!' || last == '?';
  }

  /** Fraction of {@code sentences} that end in terminal punctuation. */
  public static double sentenceCompleteness(List<AtomicUnit> sentences) {
    if (sentences.isEmpty()) {
      return 0.0;
    }
    long complete = sentences.stream().filter(s -> endsWithTerminator(s.text())).count();
    return (double) complete / sentences.size();
  }

  /** Duplicate-word fraction scaled by 3 and capped at 1.0. */
  public static double paragraphCoherence(String text) {
    List<String> words = words(text);
    if (words.isEmpty()) {
      return 0.0;
    }
    int unique = new HashSet<>(words).size();
    double repetition = (double) (words.size() - unique) / words.size();
    return Math.min(1.0, repetition * 3);
  }

  /**
   * Share of distinct words (three or more characters) that occur more than once, scaled by 2 and
   * capped at 1.0.
   */
  public static double semanticCoherence(String text) {
    Map<String, Integer> frequencies = frequencies(text, SEMANTIC_MIN_LENGTH, false);
    if (frequencies.isEmpty()) {
      return 0.0;
    }
    long repeated = frequencies.values().stream().filter(count -> count > 1).count();
    return Math.min(1.0, ((double) repeated / frequencies.size()) * 2);
  }

  /**
   * Up to five most frequent non-stopword terms of four or more characters. Ties keep the order in
   * which the terms first appear.
   */
  public static List<String> topicKeywords(String text) {
    Map<String, Integer> frequencies = frequencies(text, KEYWORD_MIN_LENGTH, true);
    return frequencies.entrySet().stream()
        .sorted(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder()))
        .limit(KEYWORD_LIMIT)
        .map(Map.Entry::getKey)
        .toList();
  }

  /** Average words per sentence normalised against 20 and capped at 1.0. */
  public static double semanticDensity(List<AtomicUnit> sentences) {
    if (sentences.isEmpty()) {
      return 0.0;
    }
    int totalWords = sentences.stream().mapToInt(s -> words(s.text()).size()).sum();
    double average = (double) totalWords / sentences.size();
    return Math.min(1.0, average / WORDS_PER_DENSE_SENTENCE);
  }

  private static Map<String, Integer> frequencies(
      String text, int minLength, boolean skipStopWords) {
    Map<String, Integer> frequencies = new LinkedHashMap<>();
    for (String word : words(text)) {
      if (UnicodeText.length(word) < minLength) {
        continue;
      }
      if (skipStopWords && isStopWord(word)) {
        continue;
      }
      frequencies.merge(word, 1, Integer::sum);
    }
    return frequencies;
  }
}
