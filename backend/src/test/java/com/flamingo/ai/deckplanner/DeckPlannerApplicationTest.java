package com.flamingo.ai.deckplanner;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.deckplanner.config.LayoutConfig;
import com.flamingo.ai.deckplanner.service.deck.DeckLayoutService;
import com.flamingo.ai.deckplanner.service.selection.StoryArcPlanner;
import com.flamingo.ai.deckplanner.service.template.TemplateAnalysisCache;
import com.flamingo.ai.deckplanner.service.template.TemplateAnalysisExporter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

/** Verifies the application context loads with the bundled configuration. */
@SpringBootTest
class DeckPlannerApplicationTest {

  @Autowired private ApplicationContext applicationContext;
  @Autowired private LayoutConfig layoutConfig;

  @Test
  @DisplayName("All planning service beans should be available")
  void coreServiceBeansShouldBeAvailable() {
    assertThat(applicationContext.getBean(DeckLayoutService.class)).isNotNull();
    assertThat(applicationContext.getBean(StoryArcPlanner.class)).isNotNull();
    assertThat(applicationContext.getBean(TemplateAnalysisCache.class)).isNotNull();
    assertThat(applicationContext.getBean(TemplateAnalysisExporter.class)).isNotNull();
  }

  @Test
  @DisplayName("Layout settings should bind from application.yml")
  void layoutConfigShouldBind() {
    assertThat(layoutConfig.getSelection().getDiversityMargin()).isEqualTo(12.0);
    assertThat(layoutConfig.getSelection().getHistoryLimit()).isEqualTo(50);
    assertThat(layoutConfig.getArc().getBodyTypes()).hasSize(7);
  }
}
