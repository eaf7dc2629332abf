package com.flamingo.ai.deckplanner.service.template;

import com.flamingo.ai.deckplanner.domain.enums.FillDifficulty;
import com.flamingo.ai.deckplanner.domain.enums.StoryType;
import com.flamingo.ai.deckplanner.service.template.model.ContentCapacity;
import com.flamingo.ai.deckplanner.service.template.model.ContentDensityRecommendation;
import com.flamingo.ai.deckplanner.service.template.model.KpiGrid;
import com.flamingo.ai.deckplanner.service.template.model.PlaceholderInfo;
import com.flamingo.ai.deckplanner.service.template.model.SemanticSection;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.springframework.stereotype.Component;

/** Derived layout scores, capacity estimates and content density targets. All scores are 0-100. */
@Component
public class LayoutMetricsCalculator {

  private static final Set<StoryType> EXECUTIVE_STORIES =
      EnumSet.of(
          StoryType.METRICS_DASHBOARD,
          StoryType.DATA_VISUALIZATION,
          StoryType.BALANCED_COMPARISON,
          StoryType.THREE_STAGE_NARRATIVE);

  private static final Set<StoryType> CLEAR_STORIES =
      EnumSet.of(StoryType.FOCUSED_MESSAGE, StoryType.MAIN_SUPPORTING);

  static final int EXECUTIVE_WORD_DENSITY = 15;
  static final int SPARSE_WORD_DENSITY = 10;
  static final int DETAILED_WORD_DENSITY = 20;

  public double complexity(List<SemanticSection> sections, List<PlaceholderInfo> content) {
    long smallCount = content.stream().filter(PlaceholderInfo::smallBox).count();
    return clamp(15.0 * sections.size() + 8.0 * content.size() + 5.0 * smallCount);
  }

  /** 100 when all content areas are equal, dropping with the largest deviation from the mean. */
  public double visualBalance(List<PlaceholderInfo> content) {
    if (content.isEmpty()) {
      return 0.0;
    }
    double mean = content.stream().mapToDouble(PlaceholderInfo::area).average().orElse(0);
    double maxDeviation =
        content.stream().mapToDouble(p -> Math.abs(p.area() - mean)).max().orElse(0);
    double penalty = mean > 0 ? maxDeviation / mean * 100.0 : 100.0;
    return 100.0 - clamp(penalty);
  }

  public FillDifficulty fillDifficulty(
      List<SemanticSection> sections, List<PlaceholderInfo> content) {
    if (sections.size() <= 2 && content.size() <= 3) {
      return FillDifficulty.EASY;
    }
    if (sections.size() <= 4 && content.size() <= 6) {
      return FillDifficulty.MEDIUM;
    }
    return FillDifficulty.HARD;
  }

  public double executiveSuitability(
      double visualBalance, double complexity, int sectionCount, StoryType storyType) {
    double score = visualBalance / 100.0 * 40.0;

    if (complexity >= 30 && complexity <= 60) {
      score += 30;
    } else if (complexity < 30) {
      score += 20;
    } else {
      score += 10;
    }

    if (EXECUTIVE_STORIES.contains(storyType)) {
      score += 20;
    } else if (CLEAR_STORIES.contains(storyType)) {
      score += 15;
    } else {
      score += 5;
    }

    score += (sectionCount >= 1 && sectionCount <= 3) ? 10 : 3;
    return Math.min(score, 100.0);
  }

  /** Structural score: rewards few clear sections, subtitles and even proportions. */
  public double executiveScore(
      List<SemanticSection> sections,
      List<PlaceholderInfo> content,
      List<PlaceholderInfo> subtitles) {
    double score = 50.0;
    if (sections.size() >= 1 && sections.size() <= 3) {
      score += 20;
    } else if (sections.size() > 5) {
      score -= 15;
    }
    if (!subtitles.isEmpty()) {
      score += 15;
    }
    long textHeavy = content.stream().filter(p -> p.height() > 3.0).count();
    if (textHeavy > 2) {
      score -= 10;
    }
    if (roughlyBalanced(content)) {
      score += 15;
    }
    return clamp(score);
  }

  public ContentDensityRecommendation densityRecommendation(
      double usableArea, int sectionCount, StoryType storyType) {
    int density =
        switch (storyType) {
          case METRICS_DASHBOARD, FEATURE_GRID -> SPARSE_WORD_DENSITY;
          case DETAILED_ANALYSIS -> DETAILED_WORD_DENSITY;
          default -> EXECUTIVE_WORD_DENSITY;
        };
    int totalWords = (int) (usableArea * density);
    int wordsPerSection = sectionCount > 0 ? totalWords / sectionCount : totalWords;

    int bullets =
        switch (storyType) {
          case METRICS_DASHBOARD -> 4 + sectionCount * 2;
          case BALANCED_COMPARISON, THREE_STAGE_NARRATIVE -> 6 + sectionCount * 3;
          default -> 8 + sectionCount * 4;
        };

    boolean executive = density <= EXECUTIVE_WORD_DENSITY;
    return new ContentDensityRecommendation(
        totalWords, wordsPerSection, executive ? "executive" : "detailed", bullets,
        executive ? 6 : 8, true);
  }

  public ContentCapacity capacity(
      List<PlaceholderInfo> content, List<SemanticSection> sections, KpiGrid kpiGrid) {
    Comparator<PlaceholderInfo> byArea = Comparator.comparingDouble(PlaceholderInfo::area);

    ContentCapacity.Bullets bullets =
        content.stream()
            .filter(p -> p.height() > 1.0)
            .max(byArea)
            .map(
                p ->
                    new ContentCapacity.Bullets(
                        (int) (p.height() / 0.3), (int) (p.width() * 8), (int) (p.area() * 20)))
            .orElse(new ContentCapacity.Bullets(0, 0, 0));

    ContentCapacity.Table table =
        content.stream()
            .max(byArea)
            .map(
                p ->
                    new ContentCapacity.Table(
                        Math.max(2, (int) (p.width() / 1.5)),
                        Math.max(3, (int) (p.height() / 0.4))))
            .orElse(new ContentCapacity.Table(0, 0));

    Optional<PlaceholderInfo> largestLarge =
        content.stream().filter(PlaceholderInfo::largeBox).max(byArea);
    ContentCapacity.Chart chart =
        new ContentCapacity.Chart(
            largestLarge.isPresent(), 30, largestLarge.map(PlaceholderInfo::area).orElse(0.0));

    ContentCapacity.Pictograms pictograms =
        content.stream()
            .filter(p -> p.mediumBox() && p.wide())
            .findFirst()
            .map(p -> new ContentCapacity.Pictograms(true, (int) (p.width() / 1.5)))
            .orElse(new ContentCapacity.Pictograms(false, 0));

    int kpiCount = kpiGrid != null ? kpiGrid.boxes().size() : 0;
    return new ContentCapacity(bullets, table, chart, kpiCount, pictograms, sections.size());
  }

  private boolean roughlyBalanced(List<PlaceholderInfo> content) {
    if (content.size() < 2) {
      return true;
    }
    double mean = content.stream().mapToDouble(PlaceholderInfo::area).average().orElse(0);
    if (mean <= 0) {
      return false;
    }
    double maxDeviation =
        content.stream().mapToDouble(p -> Math.abs(p.area() - mean)).max().orElse(0);
    return maxDeviation / mean < 1.0;
  }

  public static double clamp(double value) {
    return Math.max(0.0, Math.min(100.0, value));
  }
}
