package com.flamingo.ai.deckplanner.service.template;

import com.flamingo.ai.deckplanner.service.template.model.PlaceholderInfo;
import com.flamingo.ai.deckplanner.service.template.model.SpatialGroup;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Clusters content placeholders into columns, rows or cells by their rounded coordinates.
 *
 * <p>Coordinates are rounded to a tenth of an inch before comparison. The number of distinct left
 * edges decides the grouping:
 *
 * <ul>
 *   <li>1 &rarr; {@code center} when all tops agree, otherwise one {@code row_N} per distinct top
 *   <li>2 &rarr; {@code left_column} / {@code right_column}, split at the midpoint
 *   <li>3 &rarr; {@code left_column} / {@code center_column} / {@code right_column}
 *   <li>more &rarr; one {@code cell_N} per placeholder
 * </ul>
 *
 * Every returned member carries its group name in {@link PlaceholderInfo#positionGroup()}.
 */
@Slf4j
@Component
public class SpatialGrouper {

  public List<SpatialGroup> group(List<PlaceholderInfo> placeholders) {
    if (placeholders == null || placeholders.isEmpty()) {
      return List.of();
    }

    TreeSet<Double> lefts = new TreeSet<>();
    TreeSet<Double> tops = new TreeSet<>();
    for (PlaceholderInfo p : placeholders) {
      lefts.add(round1(p.left()));
      tops.add(round1(p.top()));
    }

    Map<String, List<PlaceholderInfo>> groups = new LinkedHashMap<>();

    if (lefts.size() == 1) {
      if (tops.size() == 1) {
        groups.put("center", new ArrayList<>(placeholders));
      } else {
        int row = 1;
        for (double top : tops) {
          List<PlaceholderInfo> members = new ArrayList<>();
          for (PlaceholderInfo p : placeholders) {
            if (round1(p.top()) == top) {
              members.add(p);
            }
          }
          groups.put("row_" + row++, members);
        }
      }
    } else if (lefts.size() == 2) {
      double midX = (lefts.first() + lefts.last()) / 2;
      List<PlaceholderInfo> left = new ArrayList<>();
      List<PlaceholderInfo> right = new ArrayList<>();
      for (PlaceholderInfo p : placeholders) {
        if (p.left() < midX) {
          left.add(p);
        } else {
          right.add(p);
        }
      }
      groups.put("left_column", left);
      groups.put("right_column", right);
    } else if (lefts.size() == 3) {
      String[] names = {"left_column", "center_column", "right_column"};
      int column = 0;
      for (double left : lefts) {
        List<PlaceholderInfo> members = new ArrayList<>();
        for (PlaceholderInfo p : placeholders) {
          if (round1(p.left()) == left) {
            members.add(p);
          }
        }
        groups.put(names[column++], members);
      }
    } else {
      for (int i = 0; i < placeholders.size(); i++) {
        groups.put("cell_" + (i + 1), List.of(placeholders.get(i)));
      }
    }

    List<SpatialGroup> result = new ArrayList<>(groups.size());
    for (Map.Entry<String, List<PlaceholderInfo>> entry : groups.entrySet()) {
      String name = entry.getKey();
      result.add(
          new SpatialGroup(
              name, entry.getValue().stream().map(p -> p.withPositionGroup(name)).toList()));
    }

    log.debug(
        "Grouped {} placeholders into {} spatial groups ({} distinct lefts)",
        placeholders.size(),
        result.size(),
        lefts.size());
    return result;
  }

  /**
   * Tags each subtitle with the group whose first member is vertically closest, as {@code
   * <group>_subtitle}. Subtitles are returned unchanged when there are no groups.
   */
  public List<PlaceholderInfo> matchSubtitles(
      List<PlaceholderInfo> subtitles, List<SpatialGroup> groups) {
    List<PlaceholderInfo> result = new ArrayList<>(subtitles.size());
    for (PlaceholderInfo subtitle : subtitles) {
      String closest = null;
      double minDistance = Double.POSITIVE_INFINITY;
      for (SpatialGroup group : groups) {
        if (group.members().isEmpty()) {
          continue;
        }
        double distance = Math.abs(subtitle.top() - group.members().get(0).top());
        if (distance < minDistance) {
          minDistance = distance;
          closest = group.name();
        }
      }
      result.add(closest != null ? subtitle.withPositionGroup(closest + "_subtitle") : subtitle);
    }
    return result;
  }

  static double round1(double value) {
    return Math.round(value * 10.0) / 10.0;
  }
}
