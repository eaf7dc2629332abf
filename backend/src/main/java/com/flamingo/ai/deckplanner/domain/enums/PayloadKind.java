package com.flamingo.ai.deckplanner.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/** Discriminator tag of a decoded slide content payload. */
public enum PayloadKind {
  CHART("chart"),
  TABLE("table"),
  BULLETS("bullets"),
  COMPARISON("comparison"),
  KPI_LIST("kpi_list"),
  ICON_LIST("icon_list");

  private final String value;

  PayloadKind(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }
}
