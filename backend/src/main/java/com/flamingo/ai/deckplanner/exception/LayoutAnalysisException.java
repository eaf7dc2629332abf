package com.flamingo.ai.deckplanner.exception;

/** Exception thrown when a single layout's placeholder geometry cannot be analyzed. */
public class LayoutAnalysisException extends RuntimeException {

  private final int layoutIndex;
  private final String userMessage;

  public LayoutAnalysisException(int layoutIndex, String message) {
    super(message);
    this.layoutIndex = layoutIndex;
    this.userMessage = "Failed to analyze template layout";
  }

  public LayoutAnalysisException(int layoutIndex, String message, Throwable cause) {
    super(message, cause);
    this.layoutIndex = layoutIndex;
    this.userMessage = "Failed to analyze template layout";
  }

  public int getLayoutIndex() {
    return layoutIndex;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
