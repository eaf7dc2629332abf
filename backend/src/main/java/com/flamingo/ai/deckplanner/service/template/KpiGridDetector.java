package com.flamingo.ai.deckplanner.service.template;

import com.flamingo.ai.deckplanner.service.template.model.KpiGrid;
import com.flamingo.ai.deckplanner.service.template.model.PlaceholderInfo;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Detects metric-dashboard grids among content placeholders.
 *
 * <p>A grid needs at least four small boxes that fall into two or more rows of at least two boxes
 * each, where rows are formed by the box top rounded to a third of an inch, and no box area may
 * deviate from the mean box area by more than 30%.
 */
@Slf4j
@Component
public class KpiGridDetector {

  static final int MIN_BOXES = 4;
  static final int MIN_ROWS = 2;
  static final int MIN_BOXES_PER_ROW = 2;
  static final double MAX_AREA_DEVIATION = 0.3;

  public Optional<KpiGrid> detect(List<PlaceholderInfo> placeholders) {
    List<PlaceholderInfo> smallBoxes =
        placeholders.stream().filter(PlaceholderInfo::smallBox).toList();
    if (smallBoxes.size() < MIN_BOXES) {
      return Optional.empty();
    }

    Map<Double, List<PlaceholderInfo>> rows = new LinkedHashMap<>();
    for (PlaceholderInfo box : smallBoxes) {
      rows.computeIfAbsent(rowKey(box.top()), k -> new ArrayList<>()).add(box);
    }
    if (rows.size() < MIN_ROWS
        || rows.values().stream().anyMatch(row -> row.size() < MIN_BOXES_PER_ROW)) {
      return Optional.empty();
    }

    double totalArea = smallBoxes.stream().mapToDouble(PlaceholderInfo::area).sum();
    double averageArea = totalArea / smallBoxes.size();
    double maxDeviation =
        smallBoxes.stream().mapToDouble(b -> Math.abs(b.area() - averageArea)).max().orElse(0);
    if (maxDeviation > averageArea * MAX_AREA_DEVIATION) {
      return Optional.empty();
    }

    int gridRows = rows.size();
    int gridCols = rows.values().iterator().next().size();
    log.debug("KPI grid detected: {}x{} ({} boxes)", gridRows, gridCols, smallBoxes.size());
    return Optional.of(new KpiGrid(smallBoxes, gridRows, gridCols, totalArea, averageArea));
  }

  private static double rowKey(double top) {
    return Math.round(top * 3.0) / 3.0;
  }
}
