package com.flamingo.ai.deckplanner.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/** Arrangement of the content areas beneath a section subtitle. */
public enum SectionPattern {
  SINGLE("single"),
  GRID("grid"),
  COLUMNS("columns"),
  MIXED("mixed");

  private final String value;

  SectionPattern(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }
}
