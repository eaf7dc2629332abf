package com.flamingo.ai.deckplanner.service.content;

import com.flamingo.ai.deckplanner.domain.enums.PayloadKind;
import java.util.Arrays;
import java.util.List;

/** Plain or hierarchical bullet list. */
public record BulletsPayload(List<BulletItem> items) implements ContentPayload {

  public BulletsPayload {
    items = items == null ? List.of() : List.copyOf(items);
  }

  public static BulletsPayload of(String... texts) {
    return new BulletsPayload(Arrays.stream(texts).map(BulletItem::of).toList());
  }

  @Override
  public PayloadKind kind() {
    return PayloadKind.BULLETS;
  }

  @Override
  public int itemCount() {
    return items.size();
  }

  @Override
  public int estimatedLines() {
    return BulletItem.linesFor(items);
  }
}
