package com.flamingo.ai.deckplanner.service.template;

import com.flamingo.ai.deckplanner.exception.LayoutAnalysisException;
import com.flamingo.ai.deckplanner.exception.NoUsableLayoutException;
import com.flamingo.ai.deckplanner.service.template.model.LayoutCapability;
import com.flamingo.ai.deckplanner.service.template.model.LayoutGeometry;
import com.flamingo.ai.deckplanner.service.template.model.PlaceholderGeometry;
import com.flamingo.ai.deckplanner.service.template.model.TemplateAnalysis;
import com.flamingo.ai.deckplanner.service.template.model.TemplateGeometry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Analyzes every layout of a template into a {@link TemplateAnalysis}.
 *
 * <p>A layout with malformed or missing geometry does not abort the analysis: it is replaced by a
 * fallback capability and the remaining layouts are analyzed as usual. The analysis fails only when
 * no layout at all can hold slide content.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TemplateAnalyzer {

  private final PlaceholderGeometryExtractor geometryExtractor;
  private final LayoutCapabilityBuilder capabilityBuilder;
  private final MeterRegistry meterRegistry;

  public TemplateAnalysis analyze(TemplateGeometry template) {
    Timer.Sample sample = Timer.start(meterRegistry);
    List<LayoutGeometry> layouts = template.layouts() == null ? List.of() : template.layouts();
    log.info("Analyzing template '{}' with {} layouts", template.templateId(), layouts.size());

    Map<Integer, LayoutCapability> capabilities = new LinkedHashMap<>();
    int fallbacks = 0;
    for (LayoutGeometry layout : layouts) {
      try {
        List<PlaceholderGeometry> geometries = geometryExtractor.extract(layout);
        capabilities.put(
            layout.layoutIndex(),
            capabilityBuilder.build(layout.layoutIndex(), layout.name(), geometries));
      } catch (LayoutAnalysisException e) {
        log.warn(
            "Layout {} of template '{}' could not be analyzed, using fallback: {}",
            e.getLayoutIndex(),
            template.templateId(),
            e.getMessage());
        meterRegistry.counter("template.analysis.fallback").increment();
        capabilities.put(
            layout.layoutIndex(), capabilityBuilder.fallback(layout.layoutIndex(), layout.name()));
        fallbacks++;
      }
    }

    TemplateAnalysis analysis = new TemplateAnalysis(template.templateId(), capabilities);
    sample.stop(meterRegistry.timer("template.analysis"));

    int usable = analysis.selectableLayouts().size();
    if (usable == 0) {
      throw new NoUsableLayoutException(
          template.templateId(),
          String.format(
              "Template '%s' has no layout with content placeholders (%d layouts, %d fallbacks)",
              template.templateId(), capabilities.size(), fallbacks));
    }

    log.info(
        "Analyzed template '{}': {} layouts, {} usable for content, {} fallbacks",
        template.templateId(),
        capabilities.size(),
        usable,
        fallbacks);
    return analysis;
  }
}
