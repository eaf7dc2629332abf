package com.flamingo.ai.deckplanner.service.template.model;

import com.flamingo.ai.deckplanner.domain.enums.PlaceholderRole;

/**
 * Placeholder geometry enriched with its role and size classes.
 *
 * <p>Size classes partition all non-negative areas: small below 3 sq in, medium from 3 up to (but
 * excluding) 15 sq in, large from 15 sq in upwards.
 */
public record PlaceholderInfo(
    int index,
    int typeId,
    String typeName,
    double left,
    double top,
    double width,
    double height,
    double area,
    PlaceholderRole role,
    double aspectRatio,
    boolean smallBox,
    boolean mediumBox,
    boolean largeBox,
    boolean wide,
    boolean tall,
    String positionGroup) {

  public static final double SMALL_AREA_LIMIT = 3.0;
  public static final double LARGE_AREA_MIN = 15.0;
  public static final double WIDE_ASPECT = 2.0;
  public static final double TALL_ASPECT = 0.5;

  public static PlaceholderInfo of(PlaceholderGeometry geometry, PlaceholderRole role) {
    double area = geometry.area();
    double aspect = geometry.height() > 0 ? geometry.width() / geometry.height() : 1.0;
    return new PlaceholderInfo(
        geometry.index(),
        geometry.typeId(),
        geometry.typeName(),
        geometry.left(),
        geometry.top(),
        geometry.width(),
        geometry.height(),
        area,
        role,
        aspect,
        area < SMALL_AREA_LIMIT,
        area >= SMALL_AREA_LIMIT && area < LARGE_AREA_MIN,
        area >= LARGE_AREA_MIN,
        aspect > WIDE_ASPECT,
        aspect < TALL_ASPECT,
        "");
  }

  public PlaceholderInfo withPositionGroup(String group) {
    return new PlaceholderInfo(
        index, typeId, typeName, left, top, width, height, area, role, aspectRatio, smallBox,
        mediumBox, largeBox, wide, tall, group);
  }
}
