package com.flamingo.ai.deckplanner.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/** Structural layout type derived from placeholder kinds and section counts. */
public enum LayoutType {
  KPI_DASHBOARD("kpi_dashboard"),
  CHART_LAYOUT("chart_layout"),
  TABLE_LAYOUT("table_layout"),
  IMAGE_LAYOUT("image_layout"),
  MULTI_SECTION("multi_section"),
  DOUBLE_SECTION("double_section"),
  SINGLE_SECTION("single_section"),
  TITLE_ONLY("title_only"),
  SINGLE_COLUMN("single_column"),
  DOUBLE_COLUMN("double_column"),
  TRIPLE_COLUMN("triple_column"),
  MULTI_COLUMN("multi_column"),
  FALLBACK("fallback");

  private final String value;

  LayoutType(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }
}
