package com.flamingo.ai.deckplanner.service.content;

import com.flamingo.ai.deckplanner.domain.enums.PayloadKind;
import java.util.List;

/** Icon entries in the generator's {@code [[icon-name]] caption} notation. */
public record IconListPayload(List<String> icons) implements ContentPayload {

  public IconListPayload {
    icons = icons == null ? List.of() : List.copyOf(icons);
  }

  @Override
  public PayloadKind kind() {
    return PayloadKind.ICON_LIST;
  }

  @Override
  public int itemCount() {
    return icons.size();
  }

  @Override
  public int estimatedLines() {
    return icons.stream().mapToInt(BulletItem::linesFor).sum();
  }
}
