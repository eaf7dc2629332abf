package com.flamingo.ai.deckplanner.service.content;

import com.flamingo.ai.deckplanner.domain.enums.PayloadKind;
import java.util.List;

/** Side-by-side columns, each a heading with bullets. */
public record ComparisonPayload(List<HeadedBullets> columns) implements ContentPayload {

  public ComparisonPayload {
    columns = columns == null ? List.of() : List.copyOf(columns);
  }

  @Override
  public PayloadKind kind() {
    return PayloadKind.COMPARISON;
  }

  @Override
  public int itemCount() {
    return columns.size();
  }

  @Override
  public int estimatedLines() {
    return columns.stream().mapToInt(HeadedBullets::estimatedLines).sum();
  }
}
