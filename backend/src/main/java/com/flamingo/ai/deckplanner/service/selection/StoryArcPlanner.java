package com.flamingo.ai.deckplanner.service.selection;

import com.flamingo.ai.deckplanner.config.LayoutConfig;
import com.flamingo.ai.deckplanner.domain.enums.ContentType;
import com.flamingo.ai.deckplanner.domain.enums.StoryType;
import com.flamingo.ai.deckplanner.exception.NoUsableLayoutException;
import com.flamingo.ai.deckplanner.service.content.ContentPayload;
import com.flamingo.ai.deckplanner.service.template.model.LayoutCapability;
import com.flamingo.ai.deckplanner.service.template.model.TemplateAnalysis;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Chooses a layout for each slide of a deck, balancing content fit against a planned narrative
 * arc and layout variety.
 *
 * <p>The arc is planned once per run, on the first selection: an opening of focused messages, a
 * body cycling through the configured story types and a closing of metrics dashboards that ends on
 * a focused message. Each slide is then scored against every selectable layout:
 *
 * <ol>
 *   <li>content fit from {@link LayoutScorer}
 *   <li>a story bonus for matching (or compatible with) the planned story type
 *   <li>a penalty for layouts used repeatedly in the recent window
 *   <li>a bonus for layouts differing from both previous picks
 * </ol>
 *
 * <p>When the winner would make a third consecutive pick of the same story type or layout, an
 * alternative within the configured content-score margin is adopted if one exists. Variety is best
 * effort: an unresolved repeat is logged and counted, never raised.
 *
 * <p>The planner itself is stateless; all history lives in the caller's {@link SequenceState}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StoryArcPlanner {

  private static final double EPSILON = 1e-9;

  private final LayoutConfig layoutConfig;
  private final LayoutScorer layoutScorer;
  private final MeterRegistry meterRegistry;

  /** Fresh state for a run of {@code totalSlides} slides. */
  public SequenceState start(int totalSlides) {
    return new SequenceState(totalSlides, layoutConfig.getSelection().getHistoryLimit());
  }

  /**
   * Builds the story arc for a deck of {@code totalSlides}: opening = ceil(10%), body = floor(70%),
   * closing = the rest.
   */
  public List<StoryType> planArc(int totalSlides) {
    LayoutConfig.Arc arc = layoutConfig.getArc();
    // tolerance keeps 30 * 0.1 from rounding up to 4
    int opening =
        Math.min(totalSlides, (int) Math.ceil(totalSlides * arc.getOpeningFraction() - EPSILON));
    int body =
        Math.min(
            totalSlides - opening,
            (int) Math.floor(totalSlides * arc.getBodyFraction() + EPSILON));
    int closing = totalSlides - opening - body;

    List<StoryType> sequence = new ArrayList<>(totalSlides);
    for (int i = 0; i < opening; i++) {
      sequence.add(StoryType.FOCUSED_MESSAGE);
    }
    List<StoryType> bodyTypes = arc.getBodyTypes();
    for (int i = 0; i < body; i++) {
      sequence.add(
          bodyTypes.isEmpty() ? StoryType.GENERAL_CONTENT : bodyTypes.get(i % bodyTypes.size()));
    }
    for (int i = 0; i < closing; i++) {
      sequence.add(i == closing - 1 ? StoryType.FOCUSED_MESSAGE : StoryType.METRICS_DASHBOARD);
    }
    log.debug(
        "Planned story arc for {} slides: opening={}, body={}, closing={}",
        totalSlides,
        opening,
        body,
        closing);
    return sequence;
  }

  public LayoutSelection select(
      SequenceState state,
      int slideIndex,
      TemplateAnalysis analysis,
      ContentType contentType,
      ContentPayload payload) {
    if (slideIndex < 0) {
      throw new IllegalArgumentException("Slide index must not be negative: " + slideIndex);
    }
    List<LayoutCapability> candidates = analysis.selectableLayouts();
    if (candidates.isEmpty()) {
      throw new NoUsableLayoutException(
          analysis.templateId(),
          "Template '" + analysis.templateId() + "' has no layout that can hold slide content");
    }
    if (!state.isPlanned()) {
      state.plan(planArc(state.getTotalSlides()));
    }

    LayoutConfig.Selection config = layoutConfig.getSelection();
    StoryType planned = state.plannedStoryType(slideIndex);

    Map<Integer, Double> contentScores = new LinkedHashMap<>();
    Map<Integer, Double> totalScores = new LinkedHashMap<>();
    LayoutCapability best = null;
    for (LayoutCapability layout : candidates) {
      double contentScore = layoutScorer.score(layout, contentType, payload);
      double total = contentScore + arcAdjustment(state, layout, planned, config);
      contentScores.put(layout.index(), contentScore);
      totalScores.put(layout.index(), total);
      if (best == null || total > totalScores.get(best.index())) {
        best = layout;
      }
    }

    LayoutCapability chosen = best;
    boolean swapped = false;
    if (wouldRepeatThird(state, best)) {
      LayoutCapability alternative =
          findAlternative(state, best, candidates, contentScores, config);
      if (alternative != null) {
        log.info(
            "Slide {}: swapped layout {} for {} to avoid a third consecutive repeat",
            slideIndex + 1,
            best.index(),
            alternative.index());
        meterRegistry.counter("layout.selection.diversity.swap").increment();
        chosen = alternative;
        swapped = true;
      } else {
        log.warn(
            "Slide {}: no alternative within {} points of layout {}, keeping a third consecutive"
                + " {}",
            slideIndex + 1,
            config.getDiversityMargin(),
            best.index(),
            best.semanticStoryType().getValue());
        meterRegistry.counter("layout.selection.diversity.unresolved").increment();
      }
    }

    double bestContentScore = Collections.max(contentScores.values());
    boolean degraded = bestContentScore < config.getMinMeaningfulScore();
    if (degraded) {
      log.warn(
          "Slide {}: no layout reached a meaningful score for {} (best {}), using layout {}",
          slideIndex + 1,
          contentType.getValue(),
          bestContentScore,
          chosen.index());
    }

    state.record(chosen.index(), chosen.semanticStoryType());
    LayoutSelection selection =
        new LayoutSelection(
            slideIndex,
            chosen.index(),
            totalScores.get(chosen.index()),
            contentScores.get(chosen.index()),
            chosen.semanticStoryType(),
            planned,
            swapped,
            degraded);

    log.info(
        "Slide {}/{}: layout {} ('{}'), score {}, story {}, executive {}",
        slideIndex + 1,
        state.getTotalSlides(),
        chosen.index(),
        chosen.name(),
        String.format("%.1f", selection.score()),
        chosen.semanticStoryType().getValue(),
        String.format("%.0f", chosen.executiveSuitability()));
    return selection;
  }

  private double arcAdjustment(
      SequenceState state,
      LayoutCapability layout,
      StoryType planned,
      LayoutConfig.Selection config) {
    double adjustment = 0;
    StoryType story = layout.semanticStoryType();
    if (story == planned) {
      adjustment += config.getStoryMatchBonus();
    } else if (story.isCompatibleWith(planned)) {
      adjustment += config.getCompatibleStoryBonus();
    }

    long recentUses =
        state.lastLayouts(config.getRepeatWindow()).stream()
            .filter(i -> i == layout.index())
            .count();
    if (recentUses >= config.getRepeatThreshold()) {
      adjustment -= config.getRepeatPenalty();
    }

    if (state.size() >= 2
        && state.recentLayout(1) != layout.index()
        && state.recentLayout(2) != layout.index()) {
      adjustment += config.getDiversityBonus();
    }
    return adjustment;
  }

  private boolean wouldRepeatThird(SequenceState state, LayoutCapability layout) {
    if (state.size() < 2) {
      return false;
    }
    return repeatsStory(state, layout.semanticStoryType())
        || (state.recentLayout(1) == layout.index() && state.recentLayout(2) == layout.index());
  }

  private static boolean repeatsStory(SequenceState state, StoryType story) {
    return state.recentStoryType(1) == story && state.recentStoryType(2) == story;
  }

  /**
   * Best other layout whose content score is within the diversity margin of the current winner and
   * which does not itself complete a run of three. Layouts whose story type appeared in the recent
   * story window are ranked lower.
   */
  private LayoutCapability findAlternative(
      SequenceState state,
      LayoutCapability current,
      List<LayoutCapability> candidates,
      Map<Integer, Double> contentScores,
      LayoutConfig.Selection config) {
    double floor = contentScores.get(current.index()) - config.getDiversityMargin();
    List<StoryType> recentStories = state.lastStoryTypes(config.getRecentStoryWindow());

    LayoutCapability best = null;
    double bestScore = Double.NEGATIVE_INFINITY;
    for (LayoutCapability layout : candidates) {
      if (layout.index() == current.index() || repeatsStory(state, layout.semanticStoryType())) {
        continue;
      }
      double contentScore = contentScores.get(layout.index());
      if (contentScore < floor) {
        continue;
      }
      double adjusted = contentScore;
      if (recentStories.contains(layout.semanticStoryType())) {
        adjusted -= config.getRecentStoryPenalty();
      }
      if (adjusted > bestScore) {
        best = layout;
        bestScore = adjusted;
      }
    }
    return best;
  }
}
