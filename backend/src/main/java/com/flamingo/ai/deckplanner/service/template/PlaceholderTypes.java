package com.flamingo.ai.deckplanner.service.template;

import java.util.Map;
import java.util.Set;

/** Placeholder type ids of the slide document format, as reported by template readers. */
public final class PlaceholderTypes {

  public static final int TITLE = 1;
  public static final int BODY = 2;
  public static final int CENTER_TITLE = 3;
  public static final int SUBTITLE = 4;
  public static final int DATE = 5;
  public static final int SLIDE_NUMBER = 6;
  public static final int FOOTER = 7;
  public static final int HEADER = 8;
  public static final int OBJECT = 9;
  public static final int CHART = 10;
  public static final int TABLE = 11;
  public static final int CLIP_ART = 12;
  public static final int ORG_CHART = 13;
  public static final int MEDIA = 14;
  public static final int PICTURE = 15;
  public static final int VERTICAL_BODY = 16;
  public static final int VERTICAL_OBJECT = 17;
  public static final int VERTICAL_TITLE = 18;

  /** Body and object placeholders whose role depends on their geometry. */
  public static final Set<Integer> GENERIC = Set.of(BODY, OBJECT, VERTICAL_BODY, VERTICAL_OBJECT);

  /** Generic placeholders that hold plain text rather than arbitrary objects. */
  public static final Set<Integer> TEXT = Set.of(BODY, VERTICAL_BODY);

  private static final Map<Integer, String> NAMES =
      Map.ofEntries(
          Map.entry(TITLE, "TITLE"),
          Map.entry(BODY, "BODY"),
          Map.entry(CENTER_TITLE, "CENTER_TITLE"),
          Map.entry(SUBTITLE, "SUBTITLE"),
          Map.entry(DATE, "DATE"),
          Map.entry(SLIDE_NUMBER, "SLIDE_NUMBER"),
          Map.entry(FOOTER, "FOOTER"),
          Map.entry(HEADER, "HEADER"),
          Map.entry(OBJECT, "OBJECT"),
          Map.entry(CHART, "CHART"),
          Map.entry(TABLE, "TABLE"),
          Map.entry(CLIP_ART, "CLIP_ART"),
          Map.entry(ORG_CHART, "ORG_CHART"),
          Map.entry(MEDIA, "MEDIA"),
          Map.entry(PICTURE, "PICTURE"),
          Map.entry(VERTICAL_BODY, "VERTICAL_BODY"),
          Map.entry(VERTICAL_OBJECT, "VERTICAL_OBJECT"),
          Map.entry(VERTICAL_TITLE, "VERTICAL_TITLE"));

  private PlaceholderTypes() {}

  public static String nameOf(int typeId) {
    return NAMES.getOrDefault(typeId, "UNKNOWN_" + typeId);
  }
}
