package com.flamingo.ai.deckplanner.service.template.model;

import java.util.List;

/**
 * A regular grid of small, similarly sized placeholders suited to metric callouts.
 *
 * @param boxes grid boxes in layout order
 * @param rows number of detected rows
 * @param cols number of boxes in the first detected row
 * @param totalArea summed box area
 * @param averageBoxArea mean box area
 */
public record KpiGrid(
    List<PlaceholderInfo> boxes, int rows, int cols, double totalArea, double averageBoxArea) {

  public KpiGrid {
    boxes = List.copyOf(boxes);
  }
}
