package com.flamingo.ai.deckplanner.service.selection;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.deckplanner.domain.enums.StoryType;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SequenceState Tests")
class SequenceStateTest {

  @Test
  @DisplayName("Should reject decks without slides and tiny history limits")
  void shouldValidateConstruction() {
    assertThatThrownBy(() -> new SequenceState(0, 50))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new SequenceState(5, 1))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  @DisplayName("Should reuse the last planned story type past the end of the arc")
  void shouldClampPlannedStoryIndex() {
    SequenceState state = new SequenceState(2, 50);
    state.plan(List.of(StoryType.FOCUSED_MESSAGE, StoryType.DATA_VISUALIZATION));

    assertThat(state.plannedStoryType(0)).isEqualTo(StoryType.FOCUSED_MESSAGE);
    assertThat(state.plannedStoryType(7)).isEqualTo(StoryType.DATA_VISUALIZATION);
  }

  @Test
  @DisplayName("Should refuse to plan twice")
  void shouldPlanOnce() {
    SequenceState state = new SequenceState(1, 50);
    state.plan(List.of(StoryType.FOCUSED_MESSAGE));

    assertThatThrownBy(() -> state.plan(List.of(StoryType.FEATURE_GRID)))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  @DisplayName("Should drop the oldest entries beyond the history limit")
  void shouldTruncateOldestEntries() {
    SequenceState state = new SequenceState(10, 3);
    state.record(1, StoryType.FOCUSED_MESSAGE);
    state.record(2, StoryType.DATA_VISUALIZATION);
    state.record(3, StoryType.BALANCED_COMPARISON);
    state.record(4, StoryType.FEATURE_GRID);

    assertThat(state.getUsedLayoutHistory()).containsExactly(2, 3, 4);
    assertThat(state.recentLayout(1)).isEqualTo(4);
    assertThat(state.recentStoryType(2)).isEqualTo(StoryType.BALANCED_COMPARISON);
    assertThat(state.lastLayouts(5)).containsExactly(2, 3, 4);
    assertThat(state.lastStoryTypes(2))
        .containsExactly(StoryType.BALANCED_COMPARISON, StoryType.FEATURE_GRID);
  }
}
