package com.flamingo.ai.deckplanner.service.template;

import com.flamingo.ai.deckplanner.domain.enums.ContentType;
import com.flamingo.ai.deckplanner.domain.enums.FillDifficulty;
import com.flamingo.ai.deckplanner.domain.enums.LayoutType;
import com.flamingo.ai.deckplanner.domain.enums.PlaceholderRole;
import com.flamingo.ai.deckplanner.domain.enums.StoryType;
import com.flamingo.ai.deckplanner.service.template.LayoutClassifier.LayoutFlags;
import com.flamingo.ai.deckplanner.service.template.model.ContentCapacity;
import com.flamingo.ai.deckplanner.service.template.model.KpiGrid;
import com.flamingo.ai.deckplanner.service.template.model.LayoutCapability;
import com.flamingo.ai.deckplanner.service.template.model.PlaceholderGeometry;
import com.flamingo.ai.deckplanner.service.template.model.PlaceholderInfo;
import com.flamingo.ai.deckplanner.service.template.model.SemanticSection;
import com.flamingo.ai.deckplanner.service.template.model.SpatialGroup;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Aggregates role classification, spatial grouping, KPI grid detection and semantic sections into
 * one immutable {@link LayoutCapability}.
 *
 * <p>The build is a pure function of its inputs: identical geometry yields equal capabilities.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LayoutCapabilityBuilder {

  private final RoleClassifier roleClassifier;
  private final SpatialGrouper spatialGrouper;
  private final KpiGridDetector kpiGridDetector;
  private final SemanticSectionGrouper semanticSectionGrouper;
  private final StoryTypeInferer storyTypeInferer;
  private final LayoutMetricsCalculator metricsCalculator;
  private final LayoutClassifier layoutClassifier;

  public LayoutCapability build(
      int layoutIndex, String name, List<PlaceholderGeometry> geometries) {
    List<PlaceholderInfo> classified = new ArrayList<>(geometries.size());
    for (PlaceholderGeometry geometry : geometries) {
      classified.add(PlaceholderInfo.of(geometry, roleClassifier.classify(geometry)));
    }

    List<PlaceholderInfo> content =
        classified.stream().filter(p -> p.role().isContentBearing()).toList();
    LayoutFlags flags =
        new LayoutFlags(
            classified.stream().anyMatch(p -> p.role() == PlaceholderRole.TITLE),
            classified.stream().anyMatch(p -> p.typeId() == PlaceholderTypes.SUBTITLE),
            classified.stream().anyMatch(p -> p.role() == PlaceholderRole.CHART),
            classified.stream().anyMatch(p -> p.role() == PlaceholderRole.TABLE),
            classified.stream().anyMatch(p -> p.typeId() == PlaceholderTypes.PICTURE));

    List<SpatialGroup> groups = spatialGrouper.group(content);
    Map<Integer, PlaceholderInfo> annotated = new HashMap<>();
    groups.forEach(g -> g.members().forEach(p -> annotated.put(p.index(), p)));
    content = content.stream().map(p -> annotated.getOrDefault(p.index(), p)).toList();

    List<PlaceholderInfo> subtitles =
        spatialGrouper.matchSubtitles(
            classified.stream().filter(p -> p.role() == PlaceholderRole.SUBTITLE).toList(),
            groups);
    subtitles.forEach(p -> annotated.put(p.index(), p));

    List<PlaceholderInfo> all =
        classified.stream().map(p -> annotated.getOrDefault(p.index(), p)).toList();
    List<PlaceholderInfo> text =
        content.stream()
            .filter(p -> p.role() == PlaceholderRole.CONTENT)
            .filter(p -> PlaceholderTypes.TEXT.contains(p.typeId()))
            .toList();

    KpiGrid kpiGrid = kpiGridDetector.detect(content).orElse(null);
    List<SemanticSection> sections = semanticSectionGrouper.group(subtitles, content);
    StoryType storyType = storyTypeInferer.infer(sections, content, kpiGrid);

    double usableArea = content.stream().mapToDouble(PlaceholderInfo::area).sum();
    double complexity = metricsCalculator.complexity(sections, content);
    double balance = metricsCalculator.visualBalance(content);
    FillDifficulty difficulty = metricsCalculator.fillDifficulty(sections, content);
    List<ContentType> bestFor = layoutClassifier.bestFor(flags, content, groups, sections, kpiGrid);

    LayoutCapability capability =
        LayoutCapability.builder()
            .index(layoutIndex)
            .name(name)
            .hasTitle(flags.hasTitle())
            .hasSubtitle(flags.hasSubtitle())
            .hasChart(flags.hasChart())
            .hasTable(flags.hasTable())
            .hasPicture(flags.hasPicture())
            .allPlaceholders(all)
            .subtitlePlaceholders(subtitles)
            .contentPlaceholders(content)
            .textPlaceholders(text)
            .spatialGroups(groups)
            .semanticSections(sections)
            .kpiGrid(kpiGrid)
            .layoutType(
                layoutClassifier.layoutType(
                    flags, content.size(), text.size(), sections.size(), kpiGrid))
            .layoutCategory(layoutClassifier.category(name, flags, content, kpiGrid))
            .bestFor(bestFor)
            .semanticStoryType(storyType)
            .layoutStory(layoutClassifier.layoutStory(flags, groups, sections, kpiGrid))
            .usableContentArea(usableArea)
            .contentCapacity(metricsCalculator.capacity(content, sections, kpiGrid))
            .complexityScore(complexity)
            .visualBalance(balance)
            .fillDifficulty(difficulty)
            .recommendedVerbosity(difficulty.getRecommendedVerbosity())
            .executiveScore(metricsCalculator.executiveScore(sections, content, subtitles))
            .executiveSuitability(
                metricsCalculator.executiveSuitability(
                    balance, complexity, sections.size(), storyType))
            .contentDensityRecommendation(
                metricsCalculator.densityRecommendation(usableArea, sections.size(), storyType))
            .build();

    log.info(
        "Layout {} '{}': {} sections, {} content placeholders, story={}, best for {}",
        layoutIndex,
        name,
        sections.size(),
        content.size(),
        storyType.getValue(),
        bestFor);
    return capability;
  }

  /**
   * Minimal capability for a layout whose geometry could not be analyzed: no content placeholders,
   * bullets only, {@link LayoutType#FALLBACK}.
   */
  public LayoutCapability fallback(int layoutIndex, String name) {
    List<PlaceholderInfo> none = List.of();
    List<SemanticSection> noSections = List.of();
    StoryType storyType = StoryType.GENERAL_CONTENT;
    double complexity = metricsCalculator.complexity(noSections, none);
    double balance = metricsCalculator.visualBalance(none);
    FillDifficulty difficulty = metricsCalculator.fillDifficulty(noSections, none);
    LayoutFlags noFlags = new LayoutFlags(false, false, false, false, false);

    return LayoutCapability.builder()
        .index(layoutIndex)
        .name(name)
        .allPlaceholders(none)
        .subtitlePlaceholders(none)
        .contentPlaceholders(none)
        .textPlaceholders(none)
        .spatialGroups(List.of())
        .semanticSections(noSections)
        .layoutType(LayoutType.FALLBACK)
        .layoutCategory(layoutClassifier.category(name, noFlags, none, null))
        .bestFor(List.of(ContentType.BULLETS))
        .semanticStoryType(storyType)
        .layoutStory("Fallback layout")
        .usableContentArea(0)
        .contentCapacity(ContentCapacity.empty())
        .complexityScore(complexity)
        .visualBalance(balance)
        .fillDifficulty(difficulty)
        .recommendedVerbosity(difficulty.getRecommendedVerbosity())
        .executiveScore(metricsCalculator.executiveScore(noSections, none, none))
        .executiveSuitability(
            metricsCalculator.executiveSuitability(balance, complexity, 0, storyType))
        .contentDensityRecommendation(metricsCalculator.densityRecommendation(0, 0, storyType))
        .build();
  }
}
