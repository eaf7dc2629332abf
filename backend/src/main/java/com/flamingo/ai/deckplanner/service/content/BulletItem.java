package com.flamingo.ai.deckplanner.service.content;

import java.util.List;

/**
 * One bullet with optional sub-bullets.
 *
 * @param text bullet text
 * @param children nested bullets one level deeper
 * @param headed whether {@code text} is a section heading, which takes two lines
 */
public record BulletItem(String text, List<BulletItem> children, boolean headed) {

  static final int CHARS_PER_LINE = 50;
  static final String ICON_MARKER = "[[";
  static final int HEADING_LINES = 2;

  public BulletItem {
    text = text == null ? "" : text;
    children = children == null ? List.of() : List.copyOf(children);
  }

  public BulletItem(String text, List<BulletItem> children) {
    this(text, children, false);
  }

  public static BulletItem headed(String heading, List<BulletItem> bullets) {
    return new BulletItem(heading, bullets, true);
  }

  public static BulletItem of(String text) {
    return new BulletItem(text, List.of());
  }

  public boolean iconMarked() {
    return text.contains(ICON_MARKER);
  }

  public int estimatedLines() {
    return (headed ? HEADING_LINES : linesFor(text)) + linesFor(children);
  }

  static int linesFor(String text) {
    return Math.max(1, text.length() / CHARS_PER_LINE);
  }

  static int linesFor(List<BulletItem> items) {
    return items.stream().mapToInt(BulletItem::estimatedLines).sum();
  }
}
