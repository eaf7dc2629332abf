package com.flamingo.ai.deckplanner.config;

import com.flamingo.ai.deckplanner.domain.enums.StoryType;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for layout selection and story arc planning. */
@Configuration
@ConfigurationProperties(prefix = "layout")
@Getter
@Setter
public class LayoutConfig {

  private Selection selection = new Selection();
  private Arc arc = new Arc();

  @Getter
  @Setter
  public static class Selection {
    /** Bonus when a layout's story type equals the planned story type for the slide. */
    private double storyMatchBonus = 30;

    /** Bonus when a layout's story type is in the same compatibility group as the planned one. */
    private double compatibleStoryBonus = 15;

    /** Penalty for a layout used {@code repeatThreshold} or more times in the recent window. */
    private double repeatPenalty = 20;

    private int repeatWindow = 5;
    private int repeatThreshold = 2;

    /** Bonus for a layout that differs from both of the previous two selections. */
    private double diversityBonus = 10;

    /**
     * Maximum content-score drop accepted when swapping to an alternative layout to avoid three
     * consecutive picks of the same story type.
     */
    private double diversityMargin = 12;

    private int recentStoryWindow = 3;

    /** Penalty applied to alternatives whose story type appeared in the recent story window. */
    private double recentStoryPenalty = 5;

    /** Number of past selections retained per generation run. */
    private int historyLimit = 50;

    /** Selections scoring below this are logged as degraded matches. */
    private double minMeaningfulScore = 20;
  }

  @Getter
  @Setter
  public static class Arc {
    /** Share of slides opening the deck with a focused message (rounded up). */
    private double openingFraction = 0.1;

    /** Share of slides forming the varied body of the deck (rounded down). */
    private double bodyFraction = 0.7;

    private List<StoryType> bodyTypes =
        new ArrayList<>(
            List.of(
                StoryType.DATA_VISUALIZATION,
                StoryType.BALANCED_COMPARISON,
                StoryType.THREE_STAGE_NARRATIVE,
                StoryType.METRICS_DASHBOARD,
                StoryType.DETAILED_ANALYSIS,
                StoryType.HIERARCHICAL_STORY,
                StoryType.FEATURE_GRID));
  }
}
