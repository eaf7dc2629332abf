package com.flamingo.ai.deckplanner.service.mapping;

import com.flamingo.ai.deckplanner.domain.enums.ContentType;
import com.flamingo.ai.deckplanner.service.content.BulletItem;
import com.flamingo.ai.deckplanner.service.content.BulletsPayload;
import com.flamingo.ai.deckplanner.service.content.ChartPayload;
import com.flamingo.ai.deckplanner.service.content.ComparisonPayload;
import com.flamingo.ai.deckplanner.service.content.ContentPayload;
import com.flamingo.ai.deckplanner.service.content.HeadedBullets;
import com.flamingo.ai.deckplanner.service.content.IconListPayload;
import com.flamingo.ai.deckplanner.service.content.KpiListPayload;
import com.flamingo.ai.deckplanner.service.content.SlideContent;
import com.flamingo.ai.deckplanner.service.content.TablePayload;
import com.flamingo.ai.deckplanner.service.template.model.LayoutCapability;
import com.flamingo.ai.deckplanner.service.template.model.PlaceholderInfo;
import com.flamingo.ai.deckplanner.service.template.model.SemanticSection;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Assigns a slide's content to the placeholders of its chosen layout.
 *
 * <p>The heading always goes to the title placeholder when the layout has one. The body is placed
 * according to its content type:
 *
 * <ul>
 *   <li>chart, table, bullets &rarr; the largest content placeholder
 *   <li>comparison &rarr; one entry per semantic section (heading to the subtitle, bullets to the
 *       first content area)
 *   <li>KPI dashboard &rarr; one metric per KPI grid box, else per semantic section
 *   <li>pictogram &rarr; one icon per KPI grid box, else per content placeholder from left to right
 * </ul>
 *
 * When the layout lacks what the content type needs, the whole body goes to the largest content
 * placeholder and the mapping is flagged as degraded.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PlaceholderContentMapper {

  private final MeterRegistry meterRegistry;

  public PlaceholderMapping map(
      LayoutCapability layout, ContentType contentType, SlideContent content) {
    Map<Integer, PlaceholderContent> assignments = new LinkedHashMap<>();
    String heading = content.heading();
    if (heading != null && !heading.isBlank()) {
      layout
          .titlePlaceholder()
          .ifPresent(t -> assignments.put(t.index(), new PlaceholderContent.Title(heading)));
    }

    ContentPayload payload = content.payload();
    String failure =
        switch (contentType) {
          case CHART -> mapChart(layout, payload, assignments);
          case TABLE -> mapTable(layout, payload, assignments);
          case COMPARISON -> mapSections(layout, headedEntries(payload), assignments);
          case KPI_DASHBOARD -> mapKpis(layout, payload, assignments);
          case PICTOGRAM -> mapIcons(layout, payload, assignments);
          case BULLETS -> mapBullets(layout, payload, assignments);
        };

    if (failure == null) {
      return new PlaceholderMapping(layout.index(), assignments, false, null);
    }
    return degrade(layout, contentType, payload, assignments, failure);
  }

  /**
   * Content placeholder with the largest area; every degraded path ends here. Empty only for
   * layouts without content placeholders.
   */
  public static Optional<PlaceholderInfo> largestContentPlaceholder(LayoutCapability layout) {
    return layout.largestContentPlaceholder();
  }

  private String mapChart(
      LayoutCapability layout, ContentPayload payload, Map<Integer, PlaceholderContent> out) {
    if (!(payload instanceof ChartPayload chart)) {
      return "chart requested without chart data";
    }
    Optional<PlaceholderInfo> target = largestContentPlaceholder(layout);
    if (target.isEmpty()) {
      return "layout has no content placeholder";
    }
    out.put(target.get().index(), new PlaceholderContent.Chart(chart.data()));
    return null;
  }

  private String mapTable(
      LayoutCapability layout, ContentPayload payload, Map<Integer, PlaceholderContent> out) {
    if (!(payload instanceof TablePayload table)) {
      return "table requested without table data";
    }
    Optional<PlaceholderInfo> target = largestContentPlaceholder(layout);
    if (target.isEmpty()) {
      return "layout has no content placeholder";
    }
    out.put(
        target.get().index(), new PlaceholderContent.Table(table.headers(), table.rows()));
    return null;
  }

  private String mapSections(
      LayoutCapability layout, List<HeadedBullets> entries, Map<Integer, PlaceholderContent> out) {
    List<SemanticSection> sections = layout.semanticSections();
    if (sections.size() < 2) {
      return "layout has " + sections.size() + " sections, at least 2 needed";
    }
    if (entries.isEmpty()) {
      return "no headed entries to place into sections";
    }
    int count = Math.min(entries.size(), sections.size());
    if (entries.size() > sections.size()) {
      log.debug(
          "Layout {} has {} sections for {} entries, dropping the rest",
          layout.index(),
          sections.size(),
          entries.size());
    }
    for (int i = 0; i < count; i++) {
      SemanticSection section = sections.get(i);
      HeadedBullets entry = entries.get(i);
      String title = entry.heading().isBlank() ? "Section " + (i + 1) : entry.heading();
      out.put(section.subtitle().index(), new PlaceholderContent.Subtitle(title));
      if (!section.contentAreas().isEmpty()) {
        out.put(
            section.contentAreas().get(0).index(),
            new PlaceholderContent.Bullets(entry.bullets()));
      }
    }
    return null;
  }

  private String mapKpis(
      LayoutCapability layout, ContentPayload payload, Map<Integer, PlaceholderContent> out) {
    List<HeadedBullets> metrics = headedEntries(payload);
    if (metrics.isEmpty()) {
      return "no metrics to place";
    }
    if (layout.kpiGrid() == null) {
      return mapSections(layout, metrics, out);
    }
    List<PlaceholderInfo> boxes = layout.kpiGrid().boxes();
    int count = Math.min(metrics.size(), boxes.size());
    for (int i = 0; i < count; i++) {
      HeadedBullets metric = metrics.get(i);
      String detail = metric.bullets().isEmpty() ? "" : metric.bullets().get(0).text();
      out.put(boxes.get(i).index(), new PlaceholderContent.Kpi(metric.heading(), detail));
    }
    return null;
  }

  private String mapIcons(
      LayoutCapability layout, ContentPayload payload, Map<Integer, PlaceholderContent> out) {
    List<String> icons = iconEntries(payload);
    if (icons.isEmpty()) {
      return "no icon entries to place";
    }
    List<PlaceholderInfo> targets;
    if (layout.kpiGrid() != null) {
      targets = layout.kpiGrid().boxes();
    } else {
      targets = new ArrayList<>(layout.contentPlaceholders());
      targets.sort(Comparator.comparingDouble(PlaceholderInfo::left));
    }
    if (targets.isEmpty()) {
      return "layout has no content placeholder";
    }
    int count = Math.min(icons.size(), targets.size());
    for (int i = 0; i < count; i++) {
      out.put(targets.get(i).index(), new PlaceholderContent.Icon(icons.get(i)));
    }
    return null;
  }

  private String mapBullets(
      LayoutCapability layout, ContentPayload payload, Map<Integer, PlaceholderContent> out) {
    Optional<PlaceholderInfo> target = largestContentPlaceholder(layout);
    if (target.isEmpty()) {
      return "layout has no content placeholder";
    }
    out.put(target.get().index(), new PlaceholderContent.Bullets(asBullets(payload)));
    return null;
  }

  private PlaceholderMapping degrade(
      LayoutCapability layout,
      ContentType contentType,
      ContentPayload payload,
      Map<Integer, PlaceholderContent> partial,
      String reason) {
    Map<Integer, PlaceholderContent> assignments = new LinkedHashMap<>();
    layout
        .titlePlaceholder()
        .map(PlaceholderInfo::index)
        .filter(partial::containsKey)
        .ifPresent(i -> assignments.put(i, partial.get(i)));

    Optional<PlaceholderInfo> target = largestContentPlaceholder(layout);
    target.ifPresent(t -> assignments.put(t.index(), fallbackContent(payload)));

    log.warn(
        "Degraded {} mapping on layout {} ('{}'): {}; using placeholder {}",
        contentType.getValue(),
        layout.index(),
        layout.name(),
        reason,
        target.map(t -> String.valueOf(t.index())).orElse("none"));
    meterRegistry.counter("layout.mapping.degraded").increment();
    return new PlaceholderMapping(layout.index(), assignments, true, reason);
  }

  private static PlaceholderContent fallbackContent(ContentPayload payload) {
    if (payload instanceof ChartPayload chart) {
      return new PlaceholderContent.Chart(chart.data());
    }
    if (payload instanceof TablePayload table) {
      return new PlaceholderContent.Table(table.headers(), table.rows());
    }
    return new PlaceholderContent.Bullets(asBullets(payload));
  }

  private static List<HeadedBullets> headedEntries(ContentPayload payload) {
    if (payload instanceof ComparisonPayload comparison) {
      return comparison.columns();
    }
    if (payload instanceof KpiListPayload kpis) {
      return kpis.metrics();
    }
    return List.of();
  }

  private static List<String> iconEntries(ContentPayload payload) {
    if (payload instanceof IconListPayload icons) {
      return icons.icons();
    }
    if (payload instanceof BulletsPayload bullets) {
      return bullets.items().stream().filter(BulletItem::iconMarked).map(BulletItem::text).toList();
    }
    return List.of();
  }

  /** Flattens any bullet-like payload into a single bullet list. */
  private static List<BulletItem> asBullets(ContentPayload payload) {
    if (payload instanceof BulletsPayload bullets) {
      return bullets.items();
    }
    if (payload instanceof IconListPayload icons) {
      return icons.icons().stream().map(BulletItem::of).toList();
    }
    List<HeadedBullets> entries = headedEntries(payload);
    List<BulletItem> items = new ArrayList<>(entries.size());
    for (HeadedBullets entry : entries) {
      items.add(BulletItem.headed(entry.heading(), entry.bullets()));
    }
    return items;
  }
}
