package com.flamingo.ai.deckplanner.service.template;

import com.flamingo.ai.deckplanner.domain.enums.PlaceholderRole;
import com.flamingo.ai.deckplanner.service.template.model.PlaceholderGeometry;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;
import org.springframework.stereotype.Component;

/**
 * Labels placeholders with a {@link PlaceholderRole}.
 *
 * <p>Rules are evaluated top to bottom and the first match wins. Dedicated type ids decide the
 * role outright; generic body and object placeholders are disambiguated by their geometry, since
 * templates frequently use short body boxes as section headings.
 */
@Component
public class RoleClassifier {

  /** A single classification rule. */
  public record RoleRule(
      String name, Predicate<PlaceholderGeometry> matches, PlaceholderRole role) {}

  private static final List<RoleRule> RULES =
      List.of(
          new RoleRule(
              "subtitle-type",
              typeIn(Set.of(PlaceholderTypes.SUBTITLE)),
              PlaceholderRole.SUBTITLE),
          new RoleRule(
              "title-type",
              typeIn(
                  Set.of(
                      PlaceholderTypes.TITLE,
                      PlaceholderTypes.CENTER_TITLE,
                      PlaceholderTypes.VERTICAL_TITLE)),
              PlaceholderRole.TITLE),
          new RoleRule(
              "footer-type",
              typeIn(
                  Set.of(
                      PlaceholderTypes.DATE,
                      PlaceholderTypes.SLIDE_NUMBER,
                      PlaceholderTypes.FOOTER,
                      PlaceholderTypes.HEADER)),
              PlaceholderRole.FOOTER),
          new RoleRule("chart-type", typeIn(Set.of(PlaceholderTypes.CHART)), PlaceholderRole.CHART),
          new RoleRule("table-type", typeIn(Set.of(PlaceholderTypes.TABLE)), PlaceholderRole.TABLE),
          new RoleRule(
              "image-type",
              typeIn(
                  Set.of(
                      PlaceholderTypes.PICTURE,
                      PlaceholderTypes.CLIP_ART,
                      PlaceholderTypes.ORG_CHART,
                      PlaceholderTypes.MEDIA)),
              PlaceholderRole.IMAGE),
          new RoleRule(
              "generic-short",
              typeIn(PlaceholderTypes.GENERIC).and(g -> g.height() < 0.5),
              PlaceholderRole.SUBTITLE),
          new RoleRule(
              "generic-tiny",
              typeIn(PlaceholderTypes.GENERIC).and(g -> g.area() < 1.0),
              PlaceholderRole.SUBTITLE),
          new RoleRule(
              "generic-banner",
              typeIn(PlaceholderTypes.GENERIC).and(g -> aspectRatio(g) > 3.0 && g.height() < 0.8),
              PlaceholderRole.SUBTITLE),
          new RoleRule("default", g -> true, PlaceholderRole.CONTENT));

  public PlaceholderRole classify(PlaceholderGeometry geometry) {
    for (RoleRule rule : RULES) {
      if (rule.matches().test(geometry)) {
        return rule.role();
      }
    }
    return PlaceholderRole.CONTENT;
  }

  public List<RoleRule> rules() {
    return RULES;
  }

  private static Predicate<PlaceholderGeometry> typeIn(Set<Integer> typeIds) {
    return g -> typeIds.contains(g.typeId());
  }

  private static double aspectRatio(PlaceholderGeometry g) {
    return g.height() > 0 ? g.width() / g.height() : 1.0;
  }
}
