package com.flamingo.ai.deckplanner.service.selection;

import com.flamingo.ai.deckplanner.domain.enums.StoryType;

/**
 * Outcome of choosing a layout for one slide.
 *
 * @param slideIndex zero-based position of the slide in the deck
 * @param layoutIndex chosen layout
 * @param score combined content, story and diversity score of the chosen layout
 * @param contentScore content fit of the chosen layout alone, 0-100
 * @param storyType story type of the chosen layout
 * @param plannedStoryType story type the arc asked for at this position
 * @param diversityAdjusted true when the best scoring layout was swapped out to avoid a third
 *     consecutive repeat
 * @param degraded true when no candidate reached a meaningful content score
 */
public record LayoutSelection(
    int slideIndex,
    int layoutIndex,
    double score,
    double contentScore,
    StoryType storyType,
    StoryType plannedStoryType,
    boolean diversityAdjusted,
    boolean degraded) {}
