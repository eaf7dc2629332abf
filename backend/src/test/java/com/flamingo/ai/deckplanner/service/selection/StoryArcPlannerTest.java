package com.flamingo.ai.deckplanner.service.selection;

import static com.flamingo.ai.deckplanner.service.template.LayoutFixtures.capability;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

import com.flamingo.ai.deckplanner.config.LayoutConfig;
import com.flamingo.ai.deckplanner.domain.enums.ContentType;
import com.flamingo.ai.deckplanner.domain.enums.StoryType;
import com.flamingo.ai.deckplanner.exception.NoUsableLayoutException;
import com.flamingo.ai.deckplanner.service.content.BulletsPayload;
import com.flamingo.ai.deckplanner.service.template.LayoutFixtures;
import com.flamingo.ai.deckplanner.service.template.model.LayoutCapability;
import com.flamingo.ai.deckplanner.service.template.model.TemplateAnalysis;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("StoryArcPlanner Tests")
class StoryArcPlannerTest {

  private static final LayoutCapability TITLE =
      capability(0, "Title Slide", LayoutFixtures.titleSlide());
  private static final LayoutCapability CHART =
      capability(1, "Chart", LayoutFixtures.wideChartArea());
  private static final LayoutCapability COLUMNS =
      capability(2, "Two Columns", LayoutFixtures.balancedColumns());
  private static final LayoutCapability FOCUSED =
      capability(3, "Focused", LayoutFixtures.focusedArea());
  private static final LayoutCapability KPI = capability(4, "KPI", LayoutFixtures.kpiGrid());
  private static final LayoutCapability STAGES =
      capability(5, "Three Stages", LayoutFixtures.threeStages());
  private static final LayoutCapability DETAIL =
      capability(6, "Detail", LayoutFixtures.tallTextArea());

  private static final BulletsPayload CONTENT = BulletsPayload.of("Revenue grew", "Costs fell");

  @Mock private LayoutScorer layoutScorer;

  private LayoutConfig layoutConfig;
  private SimpleMeterRegistry meterRegistry;
  private StoryArcPlanner planner;

  @BeforeEach
  void setUp() {
    layoutConfig = new LayoutConfig();
    meterRegistry = new SimpleMeterRegistry();
    planner = new StoryArcPlanner(layoutConfig, layoutScorer, meterRegistry);
  }

  private static TemplateAnalysis analysis(LayoutCapability... layouts) {
    Map<Integer, LayoutCapability> byIndex = new LinkedHashMap<>();
    for (LayoutCapability layout : layouts) {
      byIndex.put(layout.index(), layout);
    }
    return new TemplateAnalysis("quarterly.pptx", byIndex);
  }

  private void scoring(Map<Integer, Double> scoresByLayout) {
    when(layoutScorer.score(any(), any(), any()))
        .thenAnswer(
            invocation -> scoresByLayout.get(invocation.<LayoutCapability>getArgument(0).index()));
  }

  private void scoringAll(double score) {
    when(layoutScorer.score(any(), any(), any())).thenReturn(score);
  }

  private List<LayoutSelection> run(int slides, TemplateAnalysis analysis) {
    SequenceState state = planner.start(slides);
    List<LayoutSelection> selections = new ArrayList<>();
    for (int i = 0; i < slides; i++) {
      selections.add(planner.select(state, i, analysis, ContentType.BULLETS, CONTENT));
    }
    return selections;
  }

  private void disableArcAdjustments() {
    LayoutConfig.Selection selection = layoutConfig.getSelection();
    selection.setStoryMatchBonus(0);
    selection.setCompatibleStoryBonus(0);
    selection.setRepeatPenalty(0);
    selection.setDiversityBonus(0);
  }

  @Nested
  @DisplayName("Story arc")
  class Arc {

    @Test
    @DisplayName("Should plan opening, cycling body and closing for ten slides")
    void shouldPlanTenSlideArc() {
      assertThat(planner.planArc(10))
          .containsExactly(
              StoryType.FOCUSED_MESSAGE,
              StoryType.DATA_VISUALIZATION,
              StoryType.BALANCED_COMPARISON,
              StoryType.THREE_STAGE_NARRATIVE,
              StoryType.METRICS_DASHBOARD,
              StoryType.DETAILED_ANALYSIS,
              StoryType.HIERARCHICAL_STORY,
              StoryType.FEATURE_GRID,
              StoryType.METRICS_DASHBOARD,
              StoryType.FOCUSED_MESSAGE);
    }

    @Test
    @DisplayName("Should open a thirty slide deck with exactly three focused messages")
    void shouldPlanThirtySlideArc() {
      List<StoryType> arc = planner.planArc(30);

      assertThat(arc).hasSize(30);
      assertThat(arc.subList(0, 3)).containsOnly(StoryType.FOCUSED_MESSAGE);
      assertThat(arc.get(3)).isEqualTo(StoryType.DATA_VISUALIZATION);
      // body of 21 slides, then five dashboards and a closing message
      assertThat(arc.get(23)).isEqualTo(StoryType.DATA_VISUALIZATION);
      assertThat(arc.subList(24, 29)).containsOnly(StoryType.METRICS_DASHBOARD);
      assertThat(arc.get(29)).isEqualTo(StoryType.FOCUSED_MESSAGE);
    }

    @Test
    @DisplayName("Should handle very short decks")
    void shouldPlanShortDecks() {
      assertThat(planner.planArc(1)).containsExactly(StoryType.FOCUSED_MESSAGE);
      assertThat(planner.planArc(2))
          .containsExactly(StoryType.FOCUSED_MESSAGE, StoryType.DATA_VISUALIZATION);
      assertThat(planner.planArc(3))
          .containsExactly(
              StoryType.FOCUSED_MESSAGE,
              StoryType.DATA_VISUALIZATION,
              StoryType.BALANCED_COMPARISON);
    }

    @Test
    @DisplayName("Should plan the arc on the first selection only")
    void shouldPlanLazily() {
      scoringAll(50.0);
      SequenceState state = planner.start(10);
      assertThat(state.isPlanned()).isFalse();

      planner.select(state, 0, analysis(CHART, FOCUSED), ContentType.BULLETS, CONTENT);

      assertThat(state.isPlanned()).isTrue();
      assertThat(state.getPlannedStoryArc()).isEqualTo(planner.planArc(10));
    }
  }

  @Nested
  @DisplayName("Selection")
  class Selection {

    @Test
    @DisplayName("Should prefer the layout matching the planned story type on equal content fit")
    void shouldFollowPlannedStory() {
      scoringAll(50.0);

      List<LayoutSelection> selections = run(2, analysis(CHART, COLUMNS, FOCUSED, KPI));

      assertThat(selections.get(0).layoutIndex()).isEqualTo(3);
      assertThat(selections.get(0).plannedStoryType()).isEqualTo(StoryType.FOCUSED_MESSAGE);
      assertThat(selections.get(0).score()).isEqualTo(80.0);
      assertThat(selections.get(1).layoutIndex()).isEqualTo(1);
      assertThat(selections.get(1).storyType()).isEqualTo(StoryType.DATA_VISUALIZATION);
    }

    @Test
    @DisplayName("Should pick the first layout on a tie")
    void shouldBreakTiesByLayoutOrder() {
      scoringAll(50.0);
      LayoutCapability otherChart = capability(7, "Chart 2", LayoutFixtures.wideChartArea());

      List<LayoutSelection> selections = run(1, analysis(otherChart, CHART));

      assertThat(selections.get(0).layoutIndex()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should never offer a layout without content placeholders")
    void shouldSkipTitleOnlyLayouts() {
      scoringAll(50.0);

      List<LayoutSelection> selections = run(5, analysis(TITLE, CHART, COLUMNS));

      assertThat(selections).extracting(LayoutSelection::layoutIndex).doesNotContain(0);
    }

    @Test
    @DisplayName("Should move away from a layout that won three slides in a row")
    void shouldVaryRepeatedWinner() {
      scoring(Map.of(1, 90.0, 2, 80.0, 3, 20.0));

      List<LayoutSelection> selections = run(3, analysis(CHART, COLUMNS, FOCUSED));

      assertThat(selections.get(0).layoutIndex()).isEqualTo(1);
      assertThat(selections.get(1).layoutIndex()).isEqualTo(1);
      assertThat(selections.get(2).layoutIndex()).isNotEqualTo(1);
    }

    @Test
    @DisplayName("Should flag a slide where no layout fits meaningfully")
    void shouldFlagDegradedSelection() {
      scoringAll(10.0);

      LayoutSelection selection = run(1, analysis(CHART, FOCUSED)).get(0);

      assertThat(selection.degraded()).isTrue();
      assertThat(selection.contentScore()).isEqualTo(10.0);
    }

    @Test
    @DisplayName("Should reject negative slide indexes")
    void shouldRejectNegativeIndex() {
      SequenceState state = planner.start(3);

      assertThatThrownBy(
              () -> planner.select(state, -1, analysis(CHART), ContentType.BULLETS, CONTENT))
          .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should fail when the template has no selectable layout")
    void shouldFailWithoutSelectableLayouts() {
      SequenceState state = planner.start(3);

      assertThatThrownBy(
              () -> planner.select(state, 0, analysis(TITLE), ContentType.BULLETS, CONTENT))
          .isInstanceOf(NoUsableLayoutException.class)
          .satisfies(
              e ->
                  assertThat(((NoUsableLayoutException) e).getTemplateId())
                      .isEqualTo("quarterly.pptx"));
    }

    @Test
    @DisplayName("Should keep at most the configured number of past selections")
    void shouldTruncateHistory() {
      layoutConfig.getSelection().setHistoryLimit(5);
      scoringAll(50.0);
      SequenceState state = planner.start(8);
      TemplateAnalysis analysis = analysis(CHART, COLUMNS, FOCUSED, KPI);

      for (int i = 0; i < 8; i++) {
        planner.select(state, i, analysis, ContentType.BULLETS, CONTENT);
      }

      assertThat(state.size()).isEqualTo(5);
      assertThat(state.getUsedStoryTypeHistory()).hasSize(5);
    }
  }

  @Nested
  @DisplayName("Diversity")
  class Diversity {

    @Test
    @DisplayName("Should swap to an alternative within the margin on a third repeat")
    void shouldSwapWithinMargin() {
      disableArcAdjustments();
      scoring(Map.of(1, 90.0, 2, 80.0, 3, 20.0));

      List<LayoutSelection> selections = run(3, analysis(CHART, COLUMNS, FOCUSED));

      LayoutSelection third = selections.get(2);
      assertThat(third.layoutIndex()).isEqualTo(2);
      assertThat(third.diversityAdjusted()).isTrue();
      assertThat(third.contentScore()).isEqualTo(80.0);
      assertThat(meterRegistry.counter("layout.selection.diversity.swap").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should keep the repeat when every alternative is too weak")
    void shouldKeepRepeatOutsideMargin() {
      disableArcAdjustments();
      scoring(Map.of(1, 90.0, 2, 70.0, 3, 20.0));

      List<LayoutSelection> selections = run(3, analysis(CHART, COLUMNS, FOCUSED));

      assertThat(selections).extracting(LayoutSelection::layoutIndex).containsExactly(1, 1, 1);
      assertThat(selections.get(2).diversityAdjusted()).isFalse();
      assertThat(meterRegistry.counter("layout.selection.diversity.unresolved").count())
          .isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should never pick the same story type three times in a row")
    void shouldAvoidThreeConsecutiveStories() {
      scoringAll(60.0);

      List<LayoutSelection> selections =
          run(12, analysis(CHART, COLUMNS, FOCUSED, KPI, STAGES, DETAIL));

      for (int i = 2; i < selections.size(); i++) {
        StoryType current = selections.get(i).storyType();
        assertThat(
                current == selections.get(i - 1).storyType()
                    && current == selections.get(i - 2).storyType())
            .as("slides %d-%d share story %s", i - 1, i + 1, current)
            .isFalse();
        assertThat(
                selections.get(i).layoutIndex() == selections.get(i - 1).layoutIndex()
                    && selections.get(i).layoutIndex() == selections.get(i - 2).layoutIndex())
            .isFalse();
      }
    }
  }
}
