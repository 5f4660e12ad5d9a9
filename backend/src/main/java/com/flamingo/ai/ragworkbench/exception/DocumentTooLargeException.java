package com.flamingo.ai.ragworkbench.exception;

/** Exception thrown when a document exceeds the configured chunking limit. */
public class DocumentTooLargeException extends RuntimeException {

  private final int length;
  private final int maxLength;

  public DocumentTooLargeException(int length, int maxLength) {
    super("Document length " + length + " exceeds the limit of " + maxLength + " characters");
    this.length = length;
    this.maxLength = maxLength;
  }

  public int getLength() {
    return length;
  }

  public int getMaxLength() {
    return maxLength;
  }

  public String getUserMessage() {
    return "Document is too large to chunk (limit: " + maxLength + " characters)";
  }
}
