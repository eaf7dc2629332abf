package com.flamingo.ai.deckplanner.service.content;

import com.flamingo.ai.deckplanner.domain.enums.PayloadKind;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Chart data as produced by the content generator; passed through to the document writer as is.
 */
public record ChartPayload(Map<String, Object> data) implements ContentPayload {

  public ChartPayload {
    data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
  }

  @Override
  public PayloadKind kind() {
    return PayloadKind.CHART;
  }

  @Override
  public int itemCount() {
    return 1;
  }

  @Override
  public int estimatedLines() {
    return 5;
  }
}
