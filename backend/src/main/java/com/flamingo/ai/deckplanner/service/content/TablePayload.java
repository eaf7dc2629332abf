package com.flamingo.ai.deckplanner.service.content;

import com.flamingo.ai.deckplanner.domain.enums.PayloadKind;
import java.util.List;

/** Tabular content; every row is a list of cell texts. */
public record TablePayload(List<String> headers, List<List<String>> rows)
    implements ContentPayload {

  public TablePayload {
    headers = headers == null ? List.of() : List.copyOf(headers);
    rows = rows == null ? List.of() : rows.stream().map(List::copyOf).toList();
  }

  @Override
  public PayloadKind kind() {
    return PayloadKind.TABLE;
  }

  @Override
  public int itemCount() {
    return rows.size();
  }

  @Override
  public int estimatedLines() {
    return 5;
  }
}
