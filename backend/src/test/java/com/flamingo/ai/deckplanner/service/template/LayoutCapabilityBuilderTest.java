package com.flamingo.ai.deckplanner.service.template;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.deckplanner.domain.enums.ContentType;
import com.flamingo.ai.deckplanner.domain.enums.FillDifficulty;
import com.flamingo.ai.deckplanner.domain.enums.LayoutCategory;
import com.flamingo.ai.deckplanner.domain.enums.LayoutType;
import com.flamingo.ai.deckplanner.domain.enums.StoryType;
import com.flamingo.ai.deckplanner.service.template.model.LayoutCapability;
import com.flamingo.ai.deckplanner.service.template.model.PlaceholderInfo;
import com.flamingo.ai.deckplanner.service.template.model.SpatialGroup;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("LayoutCapabilityBuilder Tests")
class LayoutCapabilityBuilderTest {

  private LayoutCapabilityBuilder builder;

  @BeforeEach
  void setUp() {
    builder = LayoutFixtures.capabilityBuilder();
  }

  @Test
  @DisplayName("Should build structurally equal capabilities from identical geometry")
  void shouldBeDeterministic() {
    LayoutCapability first = builder.build(3, "Two Content", LayoutFixtures.balancedColumns());
    LayoutCapability second = builder.build(3, "Two Content", LayoutFixtures.balancedColumns());

    assertThat(second).isEqualTo(first);
    assertThat(second.hashCode()).isEqualTo(first.hashCode());
  }

  @Test
  @DisplayName("Should describe a two column comparison layout")
  void shouldDescribeTwoColumnLayout() {
    LayoutCapability layout = builder.build(3, "Comparison", LayoutFixtures.balancedColumns());

    assertThat(layout.hasTitle()).isTrue();
    assertThat(layout.hasSubtitle()).isTrue();
    assertThat(layout.contentPlaceholders()).hasSize(2);
    assertThat(layout.textPlaceholders()).hasSize(2);
    assertThat(layout.semanticSections()).hasSize(2);
    assertThat(layout.spatialGroups())
        .extracting(SpatialGroup::name)
        .containsExactly("left_column", "right_column");
    assertThat(layout.subtitlePlaceholders())
        .extracting(PlaceholderInfo::positionGroup)
        .allMatch(group -> group.endsWith("_subtitle"));
    assertThat(layout.layoutType()).isEqualTo(LayoutType.DOUBLE_SECTION);
    assertThat(layout.layoutCategory()).isEqualTo(LayoutCategory.SMALL_CONTENT);
    assertThat(layout.bestFor())
        .containsExactly(ContentType.COMPARISON, ContentType.PICTOGRAM, ContentType.BULLETS);
    assertThat(layout.layoutStory()).isEqualTo("Two column comparison");
    assertThat(layout.fillDifficulty()).isEqualTo(FillDifficulty.EASY);
    assertThat(layout.recommendedVerbosity()).isEqualTo(7);
    assertThat(layout.usableContentArea()).isEqualTo(20.5);
    assertThat(layout.selectable()).isTrue();
  }

  @Test
  @DisplayName("Should describe a KPI dashboard layout")
  void shouldDescribeKpiLayout() {
    LayoutCapability layout = builder.build(5, "KPI Cards", LayoutFixtures.kpiGrid());

    assertThat(layout.kpiGrid()).isNotNull();
    assertThat(layout.kpiGrid().rows()).isEqualTo(2);
    assertThat(layout.semanticStoryType()).isEqualTo(StoryType.METRICS_DASHBOARD);
    assertThat(layout.layoutType()).isEqualTo(LayoutType.KPI_DASHBOARD);
    assertThat(layout.layoutCategory()).isEqualTo(LayoutCategory.KPI_CARDS);
    assertThat(layout.bestFor()).contains(ContentType.KPI_DASHBOARD);
    assertThat(layout.layoutStory()).isEqualTo("KPI Dashboard (2x3 metrics)");
  }

  @Test
  @DisplayName("Should describe a single large area layout")
  void shouldDescribeSingleAreaLayout() {
    LayoutCapability layout = builder.build(2, "Title and Content", LayoutFixtures.wideChartArea());

    assertThat(layout.semanticStoryType()).isEqualTo(StoryType.DATA_VISUALIZATION);
    assertThat(layout.layoutType()).isEqualTo(LayoutType.SINGLE_COLUMN);
    assertThat(layout.layoutCategory()).isEqualTo(LayoutCategory.LARGE_CONTENT);
    assertThat(layout.largestContentPlaceholder()).map(PlaceholderInfo::index).contains(1);
    assertThat(layout.titlePlaceholder()).map(PlaceholderInfo::index).contains(0);
  }

  @Test
  @DisplayName("Should mark a title slide as a non-selectable cover")
  void shouldMarkTitleSlideAsCover() {
    LayoutCapability layout = builder.build(0, "Title Slide", LayoutFixtures.titleSlide());

    assertThat(layout.selectable()).isFalse();
    assertThat(layout.layoutCategory()).isEqualTo(LayoutCategory.COVER);
    assertThat(layout.layoutType()).isEqualTo(LayoutType.TITLE_ONLY);
    assertThat(layout.bestFor()).containsExactly(ContentType.BULLETS);
  }

  @Test
  @DisplayName("Should build a bullets-only fallback without content placeholders")
  void shouldBuildFallback() {
    LayoutCapability fallback = builder.fallback(7, "Broken");

    assertThat(fallback.layoutType()).isEqualTo(LayoutType.FALLBACK);
    assertThat(fallback.bestFor()).containsExactly(ContentType.BULLETS);
    assertThat(fallback.contentPlaceholders()).isEmpty();
    assertThat(fallback.selectable()).isFalse();
    assertThat(fallback.semanticStoryType()).isEqualTo(StoryType.GENERAL_CONTENT);
  }
}
