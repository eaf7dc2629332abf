package com.flamingo.ai.deckplanner.service.template.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flamingo.ai.deckplanner.domain.enums.ContentType;
import com.flamingo.ai.deckplanner.domain.enums.SectionPattern;
import java.util.List;

/**
 * A subtitle together with the content areas positioned directly beneath it.
 *
 * @param subtitle the heading placeholder of the section
 * @param contentAreas content placeholders claimed by this section, in layout order
 * @param pattern arrangement of the content areas
 * @param bestFor content types this section is suited to
 */
public record SemanticSection(
    PlaceholderInfo subtitle,
    List<PlaceholderInfo> contentAreas,
    SectionPattern pattern,
    List<ContentType> bestFor) {

  public SemanticSection {
    contentAreas = List.copyOf(contentAreas);
    bestFor = List.copyOf(bestFor);
  }

  @JsonProperty("section_id")
  public String sectionId() {
    return "section_" + subtitle.index();
  }

  @JsonProperty("total_capacity")
  public double totalCapacity() {
    return contentAreas.stream().mapToDouble(PlaceholderInfo::area).sum();
  }
}
