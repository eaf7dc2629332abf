package com.flamingo.ai.deckplanner.service.template.model;

/** Estimated amount of each content kind a layout can hold. */
public record ContentCapacity(
    Bullets bullets,
    Table table,
    Chart chart,
    int kpiCount,
    Pictograms pictograms,
    int sections) {

  public record Bullets(int maxLines, int charsPerLine, int estimatedWords) {}

  public record Table(int maxCols, int maxRows) {}

  public record Chart(boolean suitable, double minArea, double availableArea) {}

  public record Pictograms(boolean suitable, int estimatedCount) {}

  public static ContentCapacity empty() {
    return new ContentCapacity(
        new Bullets(0, 0, 0),
        new Table(0, 0),
        new Chart(false, 30, 0),
        0,
        new Pictograms(false, 0),
        0);
  }
}
