package com.flamingo.ai.deckplanner.service.template;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.flamingo.ai.deckplanner.service.template.model.LayoutCapability;
import com.flamingo.ai.deckplanner.service.template.model.TemplateAnalysis;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Exports capabilities as plain nested maps with snake_case keys, the shape the content
 * generation collaborator consumes.
 */
@Component
public class TemplateAnalysisExporter {

  private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

  private final ObjectMapper objectMapper;

  public TemplateAnalysisExporter(ObjectMapper objectMapper) {
    this.objectMapper =
        objectMapper.copy().setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
  }

  public Map<String, Object> export(TemplateAnalysis analysis) {
    Map<String, Object> layouts = new LinkedHashMap<>();
    analysis
        .layouts()
        .forEach((index, layout) -> layouts.put(String.valueOf(index), export(layout)));

    Map<String, Object> result = new LinkedHashMap<>();
    result.put("template_id", analysis.templateId());
    result.put("total_layouts", analysis.layouts().size());
    result.put("layouts", layouts);
    return result;
  }

  public Map<String, Object> export(LayoutCapability layout) {
    return objectMapper.convertValue(layout, MAP_TYPE);
  }
}
