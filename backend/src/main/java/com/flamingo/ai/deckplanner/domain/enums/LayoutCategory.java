package com.flamingo.ai.deckplanner.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/** Coarse layout family used when a caller needs a cover, divider or content layout. */
public enum LayoutCategory {
  BLANK("blank"),
  COVER("cover"),
  SECTION_DIVIDER("section_divider"),
  KPI_CARDS("kpicards"),
  SMALL_CONTENT("small_content"),
  LARGE_CONTENT("large_content");

  private final String value;

  LayoutCategory(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }
}
