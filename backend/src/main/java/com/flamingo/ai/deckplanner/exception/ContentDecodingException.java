package com.flamingo.ai.deckplanner.exception;

/** Exception thrown when generated slide content cannot be decoded into a typed payload. */
public class ContentDecodingException extends RuntimeException {

  private final String userMessage;

  public ContentDecodingException(String message) {
    super(message);
    this.userMessage = "Generated slide content could not be read";
  }

  public ContentDecodingException(String message, Throwable cause) {
    super(message, cause);
    this.userMessage = "Generated slide content could not be read";
  }

  public String getUserMessage() {
    return userMessage;
  }
}
