package com.flamingo.ai.ragworkbench.domain.enums;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/** Defines the segmentation strategies supported by the chunking engine. */
public enum ChunkingStrategyType {
  /** Fixed character windows with a preference for word boundaries. */
  FIXED(
      "fixed",
      "fixed-size",
      "Fixed Size",
      "Splits text into evenly sized character windows",
      512,
      50,
      256,
      2048,
      false,
      List.of("Predictable sizes", "Even splitting", "Efficient storage")),

  /** Whole sentences packed up to the target character count. */
  SENTENCE(
      "sentence",
      "sentence-boundary",
      "Sentence-based",
      "Splits text at sentence boundaries, the default strategy",
      512,
      50,
      256,
      2048,
      true,
      List.of("Context preservation", "Natural splitting", "Fast processing")),

  /** Whole paragraphs packed up to the target character count. */
  PARAGRAPH(
      "paragraph",
      "paragraph-boundary",
      "Paragraph-based",
      "Splits documents at blank-line paragraph boundaries",
      768,
      75,
      512,
      4096,
      false,
      List.of("Keeps logical structure", "Preserves paragraphs", "Medium-sized chunks")),

  /** Sentences packed by estimated tokens with lexical quality signals. */
  SEMANTIC(
      "semantic",
      "semantic",
      "Semantic",
      "Token-budgeted sentence grouping with topic keywords and density scores",
      1024,
      128,
      512,
      2048,
      false,
      List.of("Context optimisation", "Meaning preservation", "High-quality retrieval")),

  /** Overlapping word windows sized by estimated tokens. */
  SLIDING(
      "sliding",
      "sliding-window",
      "Sliding Window",
      "Continuous overlapping windows for fine-grained retrieval",
      512,
      256,
      256,
      1536,
      false,
      List.of("High overlap", "Minimal information loss", "Fine-grained retrieval"));

  private final String id;
  private final String tag;
  private final String displayName;
  private final String description;
  private final int defaultSize;
  private final int defaultOverlap;
  private final int minRecommendedSize;
  private final int maxRecommendedSize;
  private final boolean recommended;
  private final List<String> features;

  ChunkingStrategyType(
      String id,
      String tag,
      String displayName,
      String description,
      int defaultSize,
      int defaultOverlap,
      int minRecommendedSize,
      int maxRecommendedSize,
      boolean recommended,
      List<String> features) {
    this.id = id;
    this.tag = tag;
    this.displayName = displayName;
    this.description = description;
    this.defaultSize = defaultSize;
    this.defaultOverlap = defaultOverlap;
    this.minRecommendedSize = minRecommendedSize;
    this.maxRecommendedSize = maxRecommendedSize;
    this.recommended = recommended;
    this.features = features;
  }

  /**
   * Resolves a strategy by its identifier, ignoring case and surrounding whitespace.
   *
   * @param id strategy identifier such as {@code "sentence"}; may be null
   * @return the matching strategy, or empty if the identifier is unknown
   */
  public static Optional<ChunkingStrategyType> fromId(String id) {
    if (id == null) {
      return Optional.empty();
    }
    String normalized = id.trim().toLowerCase(Locale.ROOT);
    for (ChunkingStrategyType type : values()) {
      if (type.id.equals(normalized)) {
        return Optional.of(type);
      }
    }
    return Optional.empty();
  }

  public String getId() {
    return id;
  }

  /** Tag stamped on every chunk produced by this strategy. */
  public String getTag() {
    return tag;
  }

  public String getDisplayName() {
    return displayName;
  }

  public String getDescription() {
    return description;
  }

  public int getDefaultSize() {
    return defaultSize;
  }

  public int getDefaultOverlap() {
    return defaultOverlap;
  }

  public int getMinRecommendedSize() {
    return minRecommendedSize;
  }

  public int getMaxRecommendedSize() {
    return maxRecommendedSize;
  }

  public boolean isRecommended() {
    return recommended;
  }

  /** Short selling points shown next to the strategy in the catalog. */
  public List<String> getFeatures() {
    return features;
  }
}
