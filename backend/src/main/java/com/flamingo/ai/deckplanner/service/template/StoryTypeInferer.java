package com.flamingo.ai.deckplanner.service.template;

import com.flamingo.ai.deckplanner.domain.enums.StoryType;
import com.flamingo.ai.deckplanner.service.template.model.KpiGrid;
import com.flamingo.ai.deckplanner.service.template.model.PlaceholderInfo;
import com.flamingo.ai.deckplanner.service.template.model.SemanticSection;
import java.util.Comparator;
import java.util.List;
import java.util.function.Predicate;
import org.springframework.stereotype.Component;

/**
 * Infers the narrative {@link StoryType} a layout is suited to.
 *
 * <p>Rules are evaluated in order and the first match wins. A layout without subtitles whose only
 * content is a single placeholder counts as one implicit section.
 */
@Component
public class StoryTypeInferer {

  static final double VERY_LARGE_AREA = 40.0;
  static final double LANDSCAPE_ASPECT = 1.5;
  static final double BALANCED_AREA_DIFFERENCE = 5.0;
  static final int FEATURE_GRID_MIN_PLACEHOLDERS = 6;

  /** Inputs visible to story rules. */
  public record StoryContext(
      List<SemanticSection> sections, List<PlaceholderInfo> contentPlaceholders, KpiGrid kpiGrid) {

    boolean singleSection() {
      return sections.size() == 1 || (sections.isEmpty() && contentPlaceholders.size() == 1);
    }

    /** Largest content area of the single (possibly implicit) section. */
    PlaceholderInfo singleSectionLargest() {
      List<PlaceholderInfo> areas =
          sections.isEmpty() ? contentPlaceholders : sections.get(0).contentAreas();
      return areas.stream().max(Comparator.comparingDouble(PlaceholderInfo::area)).orElseThrow();
    }

    long smallCount() {
      return contentPlaceholders.stream().filter(PlaceholderInfo::smallBox).count();
    }

    long largeCount() {
      return contentPlaceholders.stream().filter(PlaceholderInfo::largeBox).count();
    }
  }

  /** A single story rule. */
  public record StoryRule(String name, Predicate<StoryContext> matches, StoryType storyType) {}

  private static final List<StoryRule> RULES =
      List.of(
          new StoryRule("kpi-grid", ctx -> ctx.kpiGrid() != null, StoryType.METRICS_DASHBOARD),
          new StoryRule(
              "single-wide-area",
              ctx ->
                  ctx.singleSection()
                      && ctx.singleSectionLargest().area() > VERY_LARGE_AREA
                      && ctx.singleSectionLargest().aspectRatio() > LANDSCAPE_ASPECT,
              StoryType.DATA_VISUALIZATION),
          new StoryRule(
              "single-large-area",
              ctx -> ctx.singleSection() && ctx.singleSectionLargest().area() > VERY_LARGE_AREA,
              StoryType.DETAILED_ANALYSIS),
          new StoryRule("single-section", StoryContext::singleSection, StoryType.FOCUSED_MESSAGE),
          new StoryRule(
              "two-balanced-sections",
              ctx ->
                  ctx.sections().size() == 2
                      && Math.abs(
                              ctx.sections().get(0).totalCapacity()
                                  - ctx.sections().get(1).totalCapacity())
                          < BALANCED_AREA_DIFFERENCE,
              StoryType.BALANCED_COMPARISON),
          new StoryRule(
              "two-sections", ctx -> ctx.sections().size() == 2, StoryType.MAIN_SUPPORTING),
          new StoryRule(
              "three-sections",
              ctx -> ctx.sections().size() == 3,
              StoryType.THREE_STAGE_NARRATIVE),
          new StoryRule(
              "many-small",
              ctx ->
                  ctx.contentPlaceholders().size() >= FEATURE_GRID_MIN_PLACEHOLDERS
                      && ctx.contentPlaceholders().stream().allMatch(PlaceholderInfo::smallBox),
              StoryType.FEATURE_GRID),
          new StoryRule(
              "mixed-sizes",
              ctx -> ctx.largeCount() >= 1 && ctx.smallCount() >= 2,
              StoryType.HIERARCHICAL_STORY),
          new StoryRule("default", ctx -> true, StoryType.GENERAL_CONTENT));

  public StoryType infer(
      List<SemanticSection> sections, List<PlaceholderInfo> contentPlaceholders, KpiGrid kpiGrid) {
    StoryContext context = new StoryContext(sections, contentPlaceholders, kpiGrid);
    for (StoryRule rule : RULES) {
      if (rule.matches().test(context)) {
        return rule.storyType();
      }
    }
    return StoryType.GENERAL_CONTENT;
  }

  public List<StoryRule> rules() {
    return RULES;
  }
}
