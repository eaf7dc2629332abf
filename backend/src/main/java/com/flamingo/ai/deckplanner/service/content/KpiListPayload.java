package com.flamingo.ai.deckplanner.service.content;

import com.flamingo.ai.deckplanner.domain.enums.PayloadKind;
import java.util.List;

/** Metric callouts: a short heading (the figure or label) with supporting bullets each. */
public record KpiListPayload(List<HeadedBullets> metrics) implements ContentPayload {

  public KpiListPayload {
    metrics = metrics == null ? List.of() : List.copyOf(metrics);
  }

  @Override
  public PayloadKind kind() {
    return PayloadKind.KPI_LIST;
  }

  @Override
  public int itemCount() {
    return metrics.size();
  }

  @Override
  public int estimatedLines() {
    return metrics.stream().mapToInt(HeadedBullets::estimatedLines).sum();
  }
}
