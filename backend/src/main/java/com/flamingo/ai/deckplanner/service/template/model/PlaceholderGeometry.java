package com.flamingo.ai.deckplanner.service.template.model;

/**
 * Normalized placeholder geometry in inches.
 *
 * @param index placeholder index within the layout
 * @param typeId numeric placeholder type id
 * @param typeName readable type name, e.g. {@code BODY} or {@code UNKNOWN_42}
 */
public record PlaceholderGeometry(
    int index, int typeId, String typeName, double left, double top, double width, double height) {

  public double area() {
    return width * height;
  }
}
