package com.flamingo.ai.deckplanner.service.template.model;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Immutable capability set of one template, keyed by layout index.
 *
 * @param templateId identity the analysis was cached under
 * @param layouts capabilities ordered by layout index
 */
public record TemplateAnalysis(String templateId, Map<Integer, LayoutCapability> layouts) {

  public TemplateAnalysis {
    layouts = Collections.unmodifiableMap(new TreeMap<>(layouts));
  }

  public Optional<LayoutCapability> layout(int layoutIndex) {
    return Optional.ofNullable(layouts.get(layoutIndex));
  }

  public List<LayoutCapability> selectableLayouts() {
    return layouts.values().stream().filter(LayoutCapability::selectable).toList();
  }
}
