package com.flamingo.ai.deckplanner.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/** Semantic role of a placeholder region within a slide layout. */
public enum PlaceholderRole {
  TITLE("title"),
  SUBTITLE("subtitle"),
  CONTENT("content"),
  CHART("chart"),
  TABLE("table"),
  IMAGE("image"),
  FOOTER("footer");

  private final String value;

  PlaceholderRole(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  /** Roles whose placeholders can receive slide body content. */
  public boolean isContentBearing() {
    return this == CONTENT || this == CHART || this == TABLE || this == IMAGE;
  }
}
