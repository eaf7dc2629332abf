package com.flamingo.ai.deckplanner.service.template;

import com.flamingo.ai.deckplanner.domain.enums.ContentType;
import com.flamingo.ai.deckplanner.domain.enums.LayoutCategory;
import com.flamingo.ai.deckplanner.domain.enums.LayoutType;
import com.flamingo.ai.deckplanner.service.template.model.KpiGrid;
import com.flamingo.ai.deckplanner.service.template.model.PlaceholderInfo;
import com.flamingo.ai.deckplanner.service.template.model.SemanticSection;
import com.flamingo.ai.deckplanner.service.template.model.SpatialGroup;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.springframework.stereotype.Component;

/** Structural labels for a layout: type, category, best-fit content types and a short summary. */
@Component
public class LayoutClassifier {

  /** Placeholder flags of a layout, as collected while reading its placeholders. */
  public record LayoutFlags(
      boolean hasTitle,
      boolean hasSubtitle,
      boolean hasChart,
      boolean hasTable,
      boolean hasPicture) {}

  public LayoutType layoutType(
      LayoutFlags flags,
      int contentCount,
      int textCount,
      int sectionCount,
      KpiGrid kpiGrid) {
    if (kpiGrid != null) {
      return LayoutType.KPI_DASHBOARD;
    }
    if (flags.hasChart()) {
      return LayoutType.CHART_LAYOUT;
    }
    if (flags.hasTable()) {
      return LayoutType.TABLE_LAYOUT;
    }
    if (flags.hasPicture()) {
      return LayoutType.IMAGE_LAYOUT;
    }
    if (sectionCount >= 3) {
      return LayoutType.MULTI_SECTION;
    } else if (sectionCount == 2) {
      return LayoutType.DOUBLE_SECTION;
    } else if (sectionCount == 1) {
      return LayoutType.SINGLE_SECTION;
    }
    // object placeholders count as columns when the layout has no text bodies
    int columns = textCount > 0 ? textCount : contentCount;
    return switch (columns) {
      case 0 -> LayoutType.TITLE_ONLY;
      case 1 -> LayoutType.SINGLE_COLUMN;
      case 2 -> LayoutType.DOUBLE_COLUMN;
      case 3 -> LayoutType.TRIPLE_COLUMN;
      default -> LayoutType.MULTI_COLUMN;
    };
  }

  public LayoutCategory category(
      String layoutName,
      LayoutFlags flags,
      List<PlaceholderInfo> content,
      KpiGrid kpiGrid) {
    if (content.isEmpty()) {
      if (!flags.hasTitle()) {
        return LayoutCategory.BLANK;
      }
      String name = layoutName == null ? "" : layoutName.toLowerCase(Locale.ROOT);
      if (name.contains("title") && !name.contains("only")) {
        return LayoutCategory.COVER;
      }
      return LayoutCategory.SECTION_DIVIDER;
    }
    if (kpiGrid != null || content.stream().filter(PlaceholderInfo::smallBox).count() >= 4) {
      return LayoutCategory.KPI_CARDS;
    }
    if (content.stream().anyMatch(PlaceholderInfo::largeBox)) {
      return LayoutCategory.LARGE_CONTENT;
    }
    if (content.size() == 1 && content.get(0).area() > 10) {
      return LayoutCategory.LARGE_CONTENT;
    }
    return LayoutCategory.SMALL_CONTENT;
  }

  /** Content types the layout suits, in declaration order of {@link ContentType}. */
  public List<ContentType> bestFor(
      LayoutFlags flags,
      List<PlaceholderInfo> content,
      List<SpatialGroup> groups,
      List<SemanticSection> sections,
      KpiGrid kpiGrid) {
    Set<ContentType> bestFor = EnumSet.noneOf(ContentType.class);

    if (kpiGrid != null) {
      bestFor.add(ContentType.KPI_DASHBOARD);
    }
    if (flags.hasChart()) {
      bestFor.add(ContentType.CHART);
    }
    if (flags.hasTable()) {
      bestFor.add(ContentType.TABLE);
    }
    for (SemanticSection section : sections) {
      bestFor.addAll(section.bestFor());
    }
    if (hasGroup(groups, "left_column") && hasGroup(groups, "right_column")) {
      bestFor.add(ContentType.COMPARISON);
    }
    if (groups.size() == 3) {
      bestFor.add(ContentType.COMPARISON);
    }
    if (groups.size() >= 4 && kpiGrid == null) {
      bestFor.add(ContentType.PICTOGRAM);
    }
    if (content.stream().anyMatch(PlaceholderInfo::mediumBox)) {
      bestFor.add(ContentType.PICTOGRAM);
    }
    if (bestFor.isEmpty()) {
      bestFor.add(ContentType.BULLETS);
    }
    return List.copyOf(bestFor);
  }

  public String layoutStory(
      LayoutFlags flags,
      List<SpatialGroup> groups,
      List<SemanticSection> sections,
      KpiGrid kpiGrid) {
    if (kpiGrid != null) {
      return String.format("KPI Dashboard (%dx%d metrics)", kpiGrid.rows(), kpiGrid.cols());
    }
    if (sections.size() >= 3) {
      return sections.size() + " topic sections";
    }
    if (flags.hasChart()) {
      return "Chart with supporting text";
    }
    if (flags.hasTable()) {
      return "Data table presentation";
    }
    if (hasGroup(groups, "left_column") && hasGroup(groups, "right_column")) {
      return groups.size() == 3 ? "Three column layout" : "Two column comparison";
    }
    if (!groups.isEmpty() && groups.stream().allMatch(g -> g.name().startsWith("row_"))) {
      return "Vertical stack (" + groups.size() + " sections)";
    }
    if (groups.size() == 1) {
      return "Single content area";
    }
    return "Multi-area layout (" + groups.size() + " areas)";
  }

  private static boolean hasGroup(List<SpatialGroup> groups, String name) {
    return groups.stream().anyMatch(g -> g.name().equals(name));
  }
}
