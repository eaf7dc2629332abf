package com.flamingo.ai.deckplanner.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/** Narrative role a layout is suited to play within a presentation. */
public enum StoryType {
  METRICS_DASHBOARD("metrics_dashboard"),
  DATA_VISUALIZATION("data_visualization"),
  DETAILED_ANALYSIS("detailed_analysis"),
  FOCUSED_MESSAGE("focused_message"),
  BALANCED_COMPARISON("balanced_comparison"),
  MAIN_SUPPORTING("main_supporting"),
  THREE_STAGE_NARRATIVE("three_stage_narrative"),
  FEATURE_GRID("feature_grid"),
  HIERARCHICAL_STORY("hierarchical_story"),
  GENERAL_CONTENT("general_content");

  /** Pairs of story types that can stand in for each other in a planned arc. */
  private static final List<Set<StoryType>> COMPATIBLE_GROUPS =
      List.of(
          EnumSet.of(DATA_VISUALIZATION, METRICS_DASHBOARD),
          EnumSet.of(BALANCED_COMPARISON, HIERARCHICAL_STORY),
          EnumSet.of(THREE_STAGE_NARRATIVE, FEATURE_GRID),
          EnumSet.of(FOCUSED_MESSAGE, MAIN_SUPPORTING));

  private final String value;

  StoryType(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  /**
   * Returns whether this story type shares a compatibility group with {@code other}. A type is not
   * considered compatible with itself; exact matches are scored separately.
   */
  public boolean isCompatibleWith(StoryType other) {
    if (other == null || other == this) {
      return false;
    }
    for (Set<StoryType> group : COMPATIBLE_GROUPS) {
      if (group.contains(this) && group.contains(other)) {
        return true;
      }
    }
    return false;
  }
}
