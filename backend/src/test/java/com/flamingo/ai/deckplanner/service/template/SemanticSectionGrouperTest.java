package com.flamingo.ai.deckplanner.service.template;

import static com.flamingo.ai.deckplanner.service.template.LayoutFixtures.geometry;
import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.deckplanner.domain.enums.ContentType;
import com.flamingo.ai.deckplanner.domain.enums.PlaceholderRole;
import com.flamingo.ai.deckplanner.domain.enums.SectionPattern;
import com.flamingo.ai.deckplanner.service.template.model.PlaceholderInfo;
import com.flamingo.ai.deckplanner.service.template.model.SemanticSection;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SemanticSectionGrouper Tests")
class SemanticSectionGrouperTest {

  private final SemanticSectionGrouper grouper = new SemanticSectionGrouper();

  private static PlaceholderInfo subtitle(int index, double left, double top) {
    return PlaceholderInfo.of(
        geometry(index, PlaceholderTypes.SUBTITLE, left, top, 4.0, 0.4), PlaceholderRole.SUBTITLE);
  }

  private static PlaceholderInfo content(
      int index, double left, double top, double width, double height) {
    return PlaceholderInfo.of(
        geometry(index, PlaceholderTypes.BODY, left, top, width, height), PlaceholderRole.CONTENT);
  }

  @Test
  @DisplayName("Should pair a subtitle with the content directly beneath it")
  void shouldPairSubtitleWithContentBelow() {
    List<SemanticSection> sections =
        grouper.group(List.of(subtitle(1, 0.5, 1.2)), List.of(content(2, 0.8, 1.8, 6, 4)));

    assertThat(sections).hasSize(1);
    SemanticSection section = sections.get(0);
    assertThat(section.sectionId()).isEqualTo("section_1");
    assertThat(section.pattern()).isEqualTo(SectionPattern.SINGLE);
    assertThat(section.totalCapacity()).isEqualTo(24.0);
    assertThat(section.bestFor())
        .containsExactly(ContentType.CHART, ContentType.TABLE, ContentType.BULLETS);
  }

  @Test
  @DisplayName("Should ignore content at or beyond one inch below, above, or far to the side")
  void shouldIgnoreContentOutsideWindow() {
    List<PlaceholderInfo> contents =
        List.of(
            content(2, 0.5, 2.2, 4, 2), // exactly 1.0 below
            content(3, 0.5, 1.0, 4, 2), // above
            content(4, 2.1, 1.5, 4, 2)); // 1.6 to the right

    assertThat(grouper.group(List.of(subtitle(1, 0.5, 1.2)), contents)).isEmpty();
  }

  @Test
  @DisplayName("Should let the first subtitle claim shared content")
  void shouldClaimContentOnce() {
    List<SemanticSection> sections =
        grouper.group(
            List.of(subtitle(1, 0.5, 1.2), subtitle(3, 1.0, 1.3)),
            List.of(content(2, 0.8, 1.8, 4, 3)));

    assertThat(sections).hasSize(1);
    assertThat(sections.get(0).subtitle().index()).isEqualTo(1);
  }

  @Test
  @DisplayName("Should detect columns, grids and mixed arrangements")
  void shouldDetectPatterns() {
    assertThat(
            grouper.detectPattern(
                List.of(content(2, 0.5, 1.8, 2, 2), content(3, 1.5, 1.9, 2, 2))))
        .isEqualTo(SectionPattern.COLUMNS);
    assertThat(
            grouper.detectPattern(
                List.of(
                    content(2, 0.5, 1.8, 1, 1),
                    content(3, 1.5, 1.8, 1, 1),
                    content(4, 2.5, 1.8, 1, 1))))
        .isEqualTo(SectionPattern.GRID);
    assertThat(
            grouper.detectPattern(
                List.of(content(2, 0.5, 1.8, 2, 2), content(3, 1.5, 2.5, 2, 2))))
        .isEqualTo(SectionPattern.MIXED);
  }

  @Test
  @DisplayName("Should recommend comparison for columns and KPIs for grids")
  void shouldRecommendByPattern() {
    assertThat(grouper.bestFor(List.of(), SectionPattern.COLUMNS))
        .containsExactly(ContentType.COMPARISON, ContentType.BULLETS);
    assertThat(grouper.bestFor(List.of(), SectionPattern.GRID))
        .containsExactly(ContentType.KPI_DASHBOARD, ContentType.PICTOGRAM);
    assertThat(
            grouper.bestFor(List.of(content(2, 0, 0, 4, 2)), SectionPattern.SINGLE))
        .containsExactly(ContentType.BULLETS, ContentType.PICTOGRAM);
  }
}
