package com.flamingo.ai.deckplanner.service.content;

import com.flamingo.ai.deckplanner.domain.enums.ContentType;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Classifies a payload into the {@link ContentType} used for layout scoring.
 *
 * <p>Heading lists are judged by shape rather than by tag: four or more entries whose headings are
 * all shorter than 20 characters read as a KPI dashboard, anything else as a comparison. Bullet
 * lists whose every entry carries an icon marker read as a pictogram.
 */
@Component
public class ContentTypeInferer {

  static final int KPI_MIN_ENTRIES = 4;
  static final int KPI_MAX_HEADING_LENGTH = 20;

  public ContentType infer(ContentPayload payload) {
    if (payload instanceof ChartPayload) {
      return ContentType.CHART;
    }
    if (payload instanceof TablePayload) {
      return ContentType.TABLE;
    }
    if (payload instanceof IconListPayload icons) {
      return icons.icons().isEmpty() ? ContentType.BULLETS : ContentType.PICTOGRAM;
    }
    if (payload instanceof ComparisonPayload comparison) {
      return byShape(comparison.columns());
    }
    if (payload instanceof KpiListPayload kpis) {
      return byShape(kpis.metrics());
    }
    if (payload instanceof BulletsPayload bullets
        && !bullets.items().isEmpty()
        && bullets.items().stream().allMatch(b -> b.iconMarked() && b.children().isEmpty())) {
      return ContentType.PICTOGRAM;
    }
    return ContentType.BULLETS;
  }

  private ContentType byShape(List<HeadedBullets> entries) {
    if (entries.isEmpty()) {
      return ContentType.BULLETS;
    }
    return kpiShaped(entries) ? ContentType.KPI_DASHBOARD : ContentType.COMPARISON;
  }

  static boolean kpiShaped(List<HeadedBullets> entries) {
    return entries.size() >= KPI_MIN_ENTRIES
        && entries.stream().allMatch(e -> e.heading().length() < KPI_MAX_HEADING_LENGTH);
  }
}
