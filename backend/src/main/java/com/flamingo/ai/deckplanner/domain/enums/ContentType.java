package com.flamingo.ai.deckplanner.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/** Kind of content a slide carries, as inferred from its payload. */
public enum ContentType {
  CHART("chart"),
  TABLE("table"),
  KPI_DASHBOARD("kpi_dashboard"),
  COMPARISON("comparison"),
  PICTOGRAM("pictogram"),
  BULLETS("bullets");

  private final String value;

  ContentType(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }
}
