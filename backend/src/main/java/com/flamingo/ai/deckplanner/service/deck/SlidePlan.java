package com.flamingo.ai.deckplanner.service.deck;

import com.flamingo.ai.deckplanner.domain.enums.ContentType;
import com.flamingo.ai.deckplanner.service.mapping.PlaceholderMapping;
import com.flamingo.ai.deckplanner.service.selection.LayoutSelection;

/**
 * Everything the document writer needs for one slide.
 *
 * @param slideIndex zero-based slide position
 * @param layoutIndex chosen layout
 * @param contentType how the slide body was classified
 * @param selection scoring details of the layout choice
 * @param mapping placeholder assignments on the chosen layout
 */
public record SlidePlan(
    int slideIndex,
    int layoutIndex,
    ContentType contentType,
    LayoutSelection selection,
    PlaceholderMapping mapping) {

  public boolean degraded() {
    return selection.degraded() || mapping.degraded();
  }
}
