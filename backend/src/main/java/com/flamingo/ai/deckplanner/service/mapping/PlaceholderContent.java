package com.flamingo.ai.deckplanner.service.mapping;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flamingo.ai.deckplanner.service.content.BulletItem;
import java.util.List;
import java.util.Map;

/**
 * Content destined for a single placeholder, handed to the document writer as is.
 *
 * <p>{@link #type()} names the rendering the writer should apply: {@code title}, {@code subtitle},
 * {@code bullets}, {@code chart}, {@code table}, {@code icon} or {@code kpi}.
 */
public interface PlaceholderContent {

  @JsonProperty("type")
  String type();

  record Title(String text) implements PlaceholderContent {
    @Override
    public String type() {
      return "title";
    }
  }

  record Subtitle(String text) implements PlaceholderContent {
    @Override
    public String type() {
      return "subtitle";
    }
  }

  record Bullets(List<BulletItem> items) implements PlaceholderContent {
    public Bullets {
      items = List.copyOf(items);
    }

    @Override
    public String type() {
      return "bullets";
    }
  }

  record Chart(Map<String, Object> data) implements PlaceholderContent {
    @Override
    public String type() {
      return "chart";
    }
  }

  record Table(List<String> headers, List<List<String>> rows) implements PlaceholderContent {
    @Override
    public String type() {
      return "table";
    }
  }

  /** One pictogram in {@code [[icon-name]] caption} notation. */
  record Icon(String notation) implements PlaceholderContent {
    @Override
    public String type() {
      return "icon";
    }
  }

  /**
   * One metric card.
   *
   * @param label metric heading
   * @param detail first supporting bullet, empty when there is none
   */
  record Kpi(String label, String detail) implements PlaceholderContent {
    @Override
    public String type() {
      return "kpi";
    }
  }
}
