package com.flamingo.ai.deckplanner.service.deck;

import com.flamingo.ai.deckplanner.domain.enums.ContentType;
import com.flamingo.ai.deckplanner.service.content.ContentTypeInferer;
import com.flamingo.ai.deckplanner.service.content.SlideContent;
import com.flamingo.ai.deckplanner.service.mapping.PlaceholderContentMapper;
import com.flamingo.ai.deckplanner.service.mapping.PlaceholderMapping;
import com.flamingo.ai.deckplanner.service.selection.LayoutSelection;
import com.flamingo.ai.deckplanner.service.selection.SequenceState;
import com.flamingo.ai.deckplanner.service.selection.StoryArcPlanner;
import com.flamingo.ai.deckplanner.service.template.TemplateAnalysisCache;
import com.flamingo.ai.deckplanner.service.template.model.LayoutCapability;
import com.flamingo.ai.deckplanner.service.template.model.TemplateAnalysis;
import com.flamingo.ai.deckplanner.service.template.model.TemplateGeometry;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs one layout planning pass over a deck.
 *
 * <p>Slides are processed strictly in order against a fresh {@link SequenceState}; selection
 * depends on the choices made for earlier slides, so a pass is never parallelized. Different decks
 * may be planned concurrently, sharing the cached template analysis.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DeckLayoutService {

  private final TemplateAnalysisCache analysisCache;
  private final ContentTypeInferer contentTypeInferer;
  private final StoryArcPlanner storyArcPlanner;
  private final PlaceholderContentMapper contentMapper;

  public List<SlidePlan> planDeck(TemplateGeometry template, List<SlideContent> slides) {
    return planDeck(analysisCache.getOrAnalyze(template), slides, null);
  }

  public List<SlidePlan> planDeck(
      TemplateGeometry template, List<SlideContent> slides, DeckWriter writer) {
    return planDeck(analysisCache.getOrAnalyze(template), slides, writer);
  }

  /**
   * Plans every slide against {@code analysis} and forwards each plan to {@code writer} as soon as
   * it is ready.
   *
   * @param writer receives the plans in deck order, may be {@code null}
   */
  public List<SlidePlan> planDeck(
      TemplateAnalysis analysis, List<SlideContent> slides, DeckWriter writer) {
    if (slides == null || slides.isEmpty()) {
      return List.of();
    }

    SequenceState state = storyArcPlanner.start(slides.size());
    List<SlidePlan> plans = new ArrayList<>(slides.size());
    for (int i = 0; i < slides.size(); i++) {
      SlideContent slide = slides.get(i);
      ContentType contentType = contentTypeInferer.infer(slide.payload());
      LayoutSelection selection =
          storyArcPlanner.select(state, i, analysis, contentType, slide.payload());
      int layoutIndex = selection.layoutIndex();
      LayoutCapability layout =
          analysis
              .layout(layoutIndex)
              .orElseThrow(() -> new IllegalStateException("Unknown layout " + layoutIndex));
      PlaceholderMapping mapping = contentMapper.map(layout, contentType, slide);

      SlidePlan plan = new SlidePlan(i, layout.index(), contentType, selection, mapping);
      plans.add(plan);
      if (writer != null) {
        writer.write(plan);
      }
    }

    long degraded = plans.stream().filter(SlidePlan::degraded).count();
    log.info(
        "Planned {} slides on template '{}' ({} degraded)",
        plans.size(),
        analysis.templateId(),
        degraded);
    return List.copyOf(plans);
  }
}
