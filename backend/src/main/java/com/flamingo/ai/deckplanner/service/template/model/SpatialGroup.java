package com.flamingo.ai.deckplanner.service.template.model;

import java.util.List;

/**
 * Named cluster of content placeholders sharing an axis coordinate.
 *
 * @param name one of {@code center}, {@code row_N}, {@code left_column}, {@code center_column},
 *     {@code right_column} or {@code cell_N}
 * @param members placeholders in the group, in layout order
 */
public record SpatialGroup(String name, List<PlaceholderInfo> members) {

  public SpatialGroup {
    members = List.copyOf(members);
  }
}
