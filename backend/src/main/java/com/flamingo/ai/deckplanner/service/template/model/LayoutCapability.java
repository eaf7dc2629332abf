package com.flamingo.ai.deckplanner.service.template.model;

import com.flamingo.ai.deckplanner.domain.enums.ContentType;
import com.flamingo.ai.deckplanner.domain.enums.FillDifficulty;
import com.flamingo.ai.deckplanner.domain.enums.LayoutCategory;
import com.flamingo.ai.deckplanner.domain.enums.LayoutType;
import com.flamingo.ai.deckplanner.domain.enums.PlaceholderRole;
import com.flamingo.ai.deckplanner.domain.enums.StoryType;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import lombok.Builder;

/**
 * Everything the planner knows about one slide layout.
 *
 * <p>Built once per template by {@link
 * com.flamingo.ai.deckplanner.service.template.LayoutCapabilityBuilder} and never mutated
 * afterwards; all collections are unmodifiable copies, so instances can be shared between threads.
 */
@Builder
public record LayoutCapability(
    int index,
    String name,
    boolean hasTitle,
    boolean hasSubtitle,
    boolean hasChart,
    boolean hasTable,
    boolean hasPicture,
    List<PlaceholderInfo> allPlaceholders,
    List<PlaceholderInfo> subtitlePlaceholders,
    List<PlaceholderInfo> contentPlaceholders,
    List<PlaceholderInfo> textPlaceholders,
    List<SpatialGroup> spatialGroups,
    List<SemanticSection> semanticSections,
    KpiGrid kpiGrid,
    LayoutType layoutType,
    LayoutCategory layoutCategory,
    List<ContentType> bestFor,
    StoryType semanticStoryType,
    String layoutStory,
    double usableContentArea,
    ContentCapacity contentCapacity,
    double complexityScore,
    double visualBalance,
    FillDifficulty fillDifficulty,
    int recommendedVerbosity,
    double executiveScore,
    double executiveSuitability,
    ContentDensityRecommendation contentDensityRecommendation) {

  public LayoutCapability {
    allPlaceholders = List.copyOf(allPlaceholders);
    subtitlePlaceholders = List.copyOf(subtitlePlaceholders);
    contentPlaceholders = List.copyOf(contentPlaceholders);
    textPlaceholders = List.copyOf(textPlaceholders);
    spatialGroups = List.copyOf(spatialGroups);
    semanticSections = List.copyOf(semanticSections);
    bestFor = List.copyOf(bestFor);
  }

  /** Returns the content placeholder with the largest area; the first one wins ties. */
  public Optional<PlaceholderInfo> largestContentPlaceholder() {
    return contentPlaceholders.stream().max(Comparator.comparingDouble(PlaceholderInfo::area));
  }

  public Optional<PlaceholderInfo> titlePlaceholder() {
    return allPlaceholders.stream().filter(p -> p.role() == PlaceholderRole.TITLE).findFirst();
  }

  public Optional<SpatialGroup> spatialGroup(String groupName) {
    return spatialGroups.stream().filter(g -> g.name().equals(groupName)).findFirst();
  }

  public Optional<KpiGrid> kpiGridIfPresent() {
    return Optional.ofNullable(kpiGrid);
  }

  public long smallBoxCount() {
    return contentPlaceholders.stream().filter(PlaceholderInfo::smallBox).count();
  }

  /** Layouts without content placeholders (covers, dividers, fallbacks) never host a slide body. */
  public boolean selectable() {
    return !contentPlaceholders.isEmpty();
  }
}
