package com.flamingo.ai.deckplanner.exception;

/** Exception thrown when a template offers no layout that can hold slide content. */
public class NoUsableLayoutException extends RuntimeException {

  private final String templateId;
  private final String userMessage;

  public NoUsableLayoutException(String templateId, String message) {
    super(message);
    this.templateId = templateId;
    this.userMessage = "The selected template has no layouts that can hold slide content";
  }

  public String getTemplateId() {
    return templateId;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
