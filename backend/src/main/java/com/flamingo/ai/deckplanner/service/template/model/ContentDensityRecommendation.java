package com.flamingo.ai.deckplanner.service.template.model;

/**
 * How much text the content generator should produce for a layout.
 *
 * @param totalWordsTarget target word count for the whole layout
 * @param wordsPerSection target word count per semantic section
 * @param densityStyle {@code executive} for sparse layouts, {@code detailed} otherwise
 * @param bulletsRecommended target number of bullet lines
 * @param verbosityLevel verbosity hint on a 1-10 scale
 * @param avoidOverflow whether generated text must stay within the targets
 */
public record ContentDensityRecommendation(
    int totalWordsTarget,
    int wordsPerSection,
    String densityStyle,
    int bulletsRecommended,
    int verbosityLevel,
    boolean avoidOverflow) {}
