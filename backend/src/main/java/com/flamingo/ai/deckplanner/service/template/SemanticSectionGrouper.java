package com.flamingo.ai.deckplanner.service.template;

import com.flamingo.ai.deckplanner.domain.enums.ContentType;
import com.flamingo.ai.deckplanner.domain.enums.SectionPattern;
import com.flamingo.ai.deckplanner.service.template.model.PlaceholderInfo;
import com.flamingo.ai.deckplanner.service.template.model.SemanticSection;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Pairs each subtitle with the content placeholders directly beneath it.
 *
 * <p>A content area joins a section when its top lies strictly between 0 and 1 inch below the
 * subtitle's top and its left edge is within 1.5 inches of the subtitle's. Subtitles are visited
 * in layout order and each content area is claimed by the first matching subtitle only. Subtitles
 * that claim nothing do not form a section.
 */
@Slf4j
@Component
public class SemanticSectionGrouper {

  static final double MAX_VERTICAL_GAP = 1.0;
  static final double MAX_HORIZONTAL_OFFSET = 1.5;
  static final double COLUMN_TOP_TOLERANCE = 0.5;
  static final int GRID_MIN_SMALL = 3;

  public List<SemanticSection> group(
      List<PlaceholderInfo> subtitles, List<PlaceholderInfo> contentAreas) {
    List<SemanticSection> sections = new ArrayList<>();
    Set<Integer> claimed = new HashSet<>();

    for (PlaceholderInfo subtitle : subtitles) {
      List<PlaceholderInfo> related = new ArrayList<>();
      for (PlaceholderInfo content : contentAreas) {
        if (claimed.contains(content.index())) {
          continue;
        }
        double verticalGap = content.top() - subtitle.top();
        if (!(verticalGap > 0 && verticalGap < MAX_VERTICAL_GAP)) {
          continue;
        }
        if (Math.abs(content.left() - subtitle.left()) > MAX_HORIZONTAL_OFFSET) {
          continue;
        }
        related.add(content);
        claimed.add(content.index());
      }

      if (!related.isEmpty()) {
        SectionPattern pattern = detectPattern(related);
        sections.add(new SemanticSection(subtitle, related, pattern, bestFor(related, pattern)));
      }
    }

    log.debug("Found {} semantic sections for {} subtitles", sections.size(), subtitles.size());
    return sections;
  }

  SectionPattern detectPattern(List<PlaceholderInfo> contentAreas) {
    if (contentAreas.size() == 1) {
      return SectionPattern.SINGLE;
    }
    long smallCount = contentAreas.stream().filter(PlaceholderInfo::smallBox).count();
    if (smallCount >= GRID_MIN_SMALL) {
      return SectionPattern.GRID;
    }
    List<PlaceholderInfo> byLeft =
        contentAreas.stream().sorted(Comparator.comparingDouble(PlaceholderInfo::left)).toList();
    if (Math.abs(byLeft.get(0).top() - byLeft.get(1).top()) < COLUMN_TOP_TOLERANCE) {
      return SectionPattern.COLUMNS;
    }
    return SectionPattern.MIXED;
  }

  List<ContentType> bestFor(List<PlaceholderInfo> contentAreas, SectionPattern pattern) {
    return switch (pattern) {
      case SINGLE -> {
        PlaceholderInfo only = contentAreas.get(0);
        if (only.largeBox()) {
          yield List.of(ContentType.CHART, ContentType.TABLE, ContentType.BULLETS);
        }
        if (only.mediumBox()) {
          yield List.of(ContentType.BULLETS, ContentType.PICTOGRAM);
        }
        yield List.of();
      }
      case GRID -> List.of(ContentType.KPI_DASHBOARD, ContentType.PICTOGRAM);
      case COLUMNS -> List.of(ContentType.COMPARISON, ContentType.BULLETS);
      case MIXED -> List.of();
    };
  }
}
