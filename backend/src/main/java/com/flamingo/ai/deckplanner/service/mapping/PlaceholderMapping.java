package com.flamingo.ai.deckplanner.service.mapping;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Placeholder assignments for one slide.
 *
 * @param layoutIndex layout the assignments refer to
 * @param assignments content keyed by placeholder index, in assignment order
 * @param degraded true when the content could not be laid out in its natural shape and was put
 *     into the largest content placeholder instead
 * @param degradedReason why the mapping degraded, {@code null} otherwise
 */
public record PlaceholderMapping(
    int layoutIndex,
    Map<Integer, PlaceholderContent> assignments,
    boolean degraded,
    String degradedReason) {

  public PlaceholderMapping {
    assignments = Collections.unmodifiableMap(new LinkedHashMap<>(assignments));
  }
}
