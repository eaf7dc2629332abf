package com.flamingo.ai.deckplanner.service.content;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.deckplanner.exception.ContentDecodingException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Decodes the content generator's slide JSON into a typed {@link SlideContent}.
 *
 * <p>Recognized fields are {@code heading}, {@code bullet_points}, {@code chart}, {@code table}
 * ({@code headers} and {@code rows}) and {@code key_message}. A non-empty chart wins over a table,
 * and a table over bullets. Bullet lists made only of {@code [[icon]]} strings become icon lists;
 * lists made only of objects with a {@code heading} become KPI metrics when they are KPI-shaped
 * (see {@link ContentTypeInferer}) and comparison columns otherwise. Anything else is
 * decoded as a (possibly nested) bullet list.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ContentPayloadDecoder {

  private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

  private final ObjectMapper objectMapper;

  public SlideContent decode(String json) {
    try {
      return decode(objectMapper.readTree(json));
    } catch (JsonProcessingException e) {
      throw new ContentDecodingException("Slide content is not valid JSON", e);
    }
  }

  public SlideContent decode(JsonNode slide) {
    if (slide == null || !slide.isObject()) {
      throw new ContentDecodingException("Slide content must be a JSON object");
    }
    String heading = slide.path("heading").asText("");
    String keyMessage = slide.hasNonNull("key_message") ? slide.get("key_message").asText() : null;
    return new SlideContent(heading, decodePayload(slide), keyMessage);
  }

  private ContentPayload decodePayload(JsonNode slide) {
    JsonNode chart = slide.get("chart");
    if (isPresent(chart)) {
      if (!chart.isObject()) {
        throw new ContentDecodingException("'chart' must be an object");
      }
      return new ChartPayload(objectMapper.convertValue(chart, MAP_TYPE));
    }

    JsonNode table = slide.get("table");
    if (isPresent(table)) {
      return decodeTable(table);
    }

    JsonNode bullets = slide.get("bullet_points");
    if (bullets == null || bullets.isNull()) {
      return new BulletsPayload(List.of());
    }
    if (bullets.isTextual()) {
      return new BulletsPayload(List.of(BulletItem.of(bullets.asText())));
    }
    if (!bullets.isArray()) {
      throw new ContentDecodingException("'bullet_points' must be a list or a string");
    }
    if (bullets.isEmpty()) {
      return new BulletsPayload(List.of());
    }

    if (allMatch(bullets, n -> n.isTextual() && n.asText().contains(BulletItem.ICON_MARKER))) {
      List<String> icons = new ArrayList<>();
      bullets.forEach(n -> icons.add(n.asText()));
      return new IconListPayload(icons);
    }
    if (allMatch(bullets, n -> n.isObject() && n.has("heading"))) {
      List<HeadedBullets> columns = new ArrayList<>();
      bullets.forEach(n -> columns.add(decodeHeaded(n)));
      return ContentTypeInferer.kpiShaped(columns)
          ? new KpiListPayload(columns)
          : new ComparisonPayload(columns);
    }
    return new BulletsPayload(decodeBullets(bullets));
  }

  private TablePayload decodeTable(JsonNode table) {
    if (!table.isObject()) {
      throw new ContentDecodingException("'table' must be an object");
    }
    List<String> headers = new ArrayList<>();
    table.path("headers").forEach(h -> headers.add(h.asText()));
    List<List<String>> rows = new ArrayList<>();
    for (JsonNode row : table.path("rows")) {
      List<String> cells = new ArrayList<>();
      if (row.isArray()) {
        row.forEach(c -> cells.add(c.asText()));
      } else {
        cells.add(row.asText());
      }
      rows.add(cells);
    }
    return new TablePayload(headers, rows);
  }

  private HeadedBullets decodeHeaded(JsonNode node) {
    JsonNode items = node.path("bullet_points");
    List<BulletItem> bullets =
        items.isArray()
            ? decodeBullets(items)
            : items.isMissingNode() || items.isNull()
                ? List.of()
                : List.of(BulletItem.of(items.asText()));
    return new HeadedBullets(node.path("heading").asText(""), bullets);
  }

  /**
   * Nested arrays become children of the preceding bullet; a nested array with no preceding bullet
   * is lifted to the current level.
   */
  private List<BulletItem> decodeBullets(JsonNode array) {
    List<BulletItem> items = new ArrayList<>();
    for (JsonNode node : array) {
      if (node.isArray()) {
        List<BulletItem> children = decodeBullets(node);
        if (items.isEmpty()) {
          items.addAll(children);
        } else {
          BulletItem previous = items.remove(items.size() - 1);
          List<BulletItem> merged = new ArrayList<>(previous.children());
          merged.addAll(children);
          items.add(new BulletItem(previous.text(), merged, previous.headed()));
        }
      } else if (node.isObject()) {
        HeadedBullets headed = decodeHeaded(node);
        items.add(BulletItem.headed(headed.heading(), headed.bullets()));
      } else {
        items.add(BulletItem.of(node.asText()));
      }
    }
    return items;
  }

  private static boolean isPresent(JsonNode node) {
    if (node == null || node.isNull() || node.isMissingNode()) {
      return false;
    }
    if (node.isContainerNode()) {
      return !node.isEmpty();
    }
    if (node.isTextual()) {
      return !node.asText().isBlank();
    }
    if (node.isBoolean()) {
      return node.booleanValue();
    }
    return true;
  }

  private static boolean allMatch(JsonNode array, Predicate<JsonNode> test) {
    for (JsonNode node : array) {
      if (!test.test(node)) {
        return false;
      }
    }
    return true;
  }
}
