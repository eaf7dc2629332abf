package com.flamingo.ai.deckplanner.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/** How hard it is to fill a layout with well-proportioned content. */
public enum FillDifficulty {
  EASY("easy", 7),
  MEDIUM("medium", 8),
  HARD("hard", 9);

  private final String value;
  private final int recommendedVerbosity;

  FillDifficulty(String value, int recommendedVerbosity) {
    this.value = value;
    this.recommendedVerbosity = recommendedVerbosity;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  public int getRecommendedVerbosity() {
    return recommendedVerbosity;
  }
}
