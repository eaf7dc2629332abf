package com.flamingo.ai.deckplanner.service.selection;

import com.flamingo.ai.deckplanner.domain.enums.ContentType;
import com.flamingo.ai.deckplanner.domain.enums.FillDifficulty;
import com.flamingo.ai.deckplanner.service.content.ContentPayload;
import com.flamingo.ai.deckplanner.service.content.TablePayload;
import com.flamingo.ai.deckplanner.service.template.LayoutMetricsCalculator;
import com.flamingo.ai.deckplanner.service.template.model.ContentCapacity;
import com.flamingo.ai.deckplanner.service.template.model.LayoutCapability;
import com.flamingo.ai.deckplanner.service.template.model.PlaceholderInfo;
import com.flamingo.ai.deckplanner.service.template.model.SemanticSection;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Scores how well a layout fits a piece of slide content, on a 0-100 scale.
 *
 * <p>The score starts with a base bonus when the content type is among the layout's {@code
 * bestFor} types, adds content-type specific capacity bonuses and finishes with small global
 * bonuses for well balanced, easy to fill layouts. The sum is clamped to [0, 100].
 */
@Slf4j
@Component
public class LayoutScorer {

  static final double BEST_FOR_BONUS = 40;
  static final double BALANCE_BONUS = 5;
  static final double EASY_FILL_BONUS = 3;
  static final double LARGE_CHART_AREA = 50;

  public double score(LayoutCapability layout, ContentType contentType, ContentPayload payload) {
    double score = 0;
    if (layout.bestFor().contains(contentType)) {
      score += BEST_FOR_BONUS;
    }

    score +=
        switch (contentType) {
          case CHART -> scoreChart(layout);
          case TABLE -> scoreTable(layout, payload);
          case KPI_DASHBOARD -> scoreKpi(layout, payload);
          case PICTOGRAM -> scorePictogram(layout, payload);
          case COMPARISON -> scoreComparison(layout, payload);
          case BULLETS -> scoreBullets(layout, payload);
        };

    if (layout.visualBalance() > 70) {
      score += BALANCE_BONUS;
    }
    if (layout.fillDifficulty() == FillDifficulty.EASY) {
      score += EASY_FILL_BONUS;
    }

    double clamped = LayoutMetricsCalculator.clamp(score);
    log.debug(
        "Layout {} ('{}') scored {} for {}", layout.index(), layout.name(), clamped, contentType);
    return clamped;
  }

  private double scoreChart(LayoutCapability layout) {
    double score = 0;
    ContentCapacity.Chart chart = layout.contentCapacity().chart();
    if (chart.suitable()) {
      score += 30;
      if (chart.availableArea() > LARGE_CHART_AREA) {
        score += 10;
      }
    }
    if (layout.semanticSections().size() == 1) {
      SemanticSection section = layout.semanticSections().get(0);
      if (section.contentAreas().size() == 1 && section.contentAreas().get(0).largeBox()) {
        score += 20;
      }
    }
    return score;
  }

  private double scoreTable(LayoutCapability layout, ContentPayload payload) {
    int neededCols = 0;
    int neededRows = 0;
    if (payload instanceof TablePayload table) {
      neededCols = table.headers().size();
      neededRows = table.rows().size();
    }
    ContentCapacity.Table capacity = layout.contentCapacity().table();
    if (capacity.maxCols() >= neededCols && capacity.maxRows() >= neededRows) {
      double score = 40;
      if (capacity.maxCols() <= neededCols + 2) {
        score += 10;
      }
      return score;
    }
    return 10;
  }

  private double scoreKpi(LayoutCapability layout, ContentPayload payload) {
    int needed = payload.itemCount();
    if (layout.kpiGrid() != null) {
      int available = layout.contentCapacity().kpiCount();
      if (available < needed) {
        return 0;
      }
      return available == needed ? 60 : 50;
    }
    return layout.smallBoxCount() >= needed ? 30 : 0;
  }

  private double scorePictogram(LayoutCapability layout, ContentPayload payload) {
    double score = 0;
    int needed = payload.itemCount();
    ContentCapacity.Pictograms pictograms = layout.contentCapacity().pictograms();
    if (pictograms.suitable() && pictograms.estimatedCount() >= needed) {
      score += 40;
      if (Math.abs(pictograms.estimatedCount() - needed) <= 1) {
        score += 10;
      }
    }
    if (layout.contentPlaceholders().stream().anyMatch(LayoutScorer::mediumWide)) {
      score += 10;
    }
    return score;
  }

  private double scoreComparison(LayoutCapability layout, ContentPayload payload) {
    int needed =
        switch (payload.kind()) {
          case COMPARISON, KPI_LIST -> payload.itemCount() > 0 ? payload.itemCount() : 2;
          default -> 2;
        };
    double score = 0;
    int sections = layout.semanticSections().size();
    if (sections == needed) {
      score += 50;
    } else if (Math.abs(sections - needed) == 1) {
      score += 30;
    }
    if (needed == 2 && layout.spatialGroup("left_column").isPresent()) {
      score += 10;
    }
    return score;
  }

  private double scoreBullets(LayoutCapability layout, ContentPayload payload) {
    int lines = payload.estimatedLines();
    int target = layout.contentDensityRecommendation().bulletsRecommended();
    int capacityLines = layout.contentCapacity().bullets().maxLines();

    double score;
    if (Math.abs(lines - target) <= 2) {
      score = 50;
    } else if (capacityLines >= lines) {
      score = 40;
      if (capacityLines <= lines + 5) {
        score += 10;
      }
    } else {
      score = 20;
    }
    if (layout.executiveSuitability() >= 70) {
      score += 10;
    }
    return score;
  }

  /** Returns whether {@code placeholder} could host a single wide pictogram row. */
  static boolean mediumWide(PlaceholderInfo placeholder) {
    return placeholder.mediumBox() && placeholder.wide();
  }
}
