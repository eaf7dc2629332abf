package com.flamingo.ai.deckplanner.service.content;

import java.util.List;

/**
 * A heading with its own bullets, used for comparison columns and KPI cards.
 *
 * @param heading column or metric heading
 * @param bullets bullets shown under the heading
 */
public record HeadedBullets(String heading, List<BulletItem> bullets) {

  public HeadedBullets {
    heading = heading == null ? "" : heading;
    bullets = bullets == null ? List.of() : List.copyOf(bullets);
  }

  /** Two lines for the heading block plus its bullets. */
  public int estimatedLines() {
    return 2 + BulletItem.linesFor(bullets);
  }
}
