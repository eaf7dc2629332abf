package com.flamingo.ai.deckplanner.service.template;

import com.flamingo.ai.deckplanner.service.template.model.LayoutCapability;
import com.flamingo.ai.deckplanner.service.template.model.LayoutGeometry;
import com.flamingo.ai.deckplanner.service.template.model.PlaceholderGeometry;
import com.flamingo.ai.deckplanner.service.template.model.RawPlaceholderShape;
import java.util.ArrayList;
import java.util.List;

/** Hand-measured placeholder geometries (inches) for common slide layouts. */
public final class LayoutFixtures {

  private LayoutFixtures() {}

  public static PlaceholderGeometry geometry(
      int index, int typeId, double left, double top, double width, double height) {
    return new PlaceholderGeometry(
        index, typeId, PlaceholderTypes.nameOf(typeId), left, top, width, height);
  }

  public static LayoutCapabilityBuilder capabilityBuilder() {
    return new LayoutCapabilityBuilder(
        new RoleClassifier(),
        new SpatialGrouper(),
        new KpiGridDetector(),
        new SemanticSectionGrouper(),
        new StoryTypeInferer(),
        new LayoutMetricsCalculator(),
        new LayoutClassifier());
  }

  public static LayoutCapability capability(
      int layoutIndex, String name, List<PlaceholderGeometry> geometries) {
    return capabilityBuilder().build(layoutIndex, name, geometries);
  }

  public static PlaceholderGeometry title() {
    return geometry(0, PlaceholderTypes.TITLE, 0.5, 0.3, 12.0, 0.9);
  }

  /** Title slide: title and subtitle only. */
  public static List<PlaceholderGeometry> titleSlide() {
    return List.of(
        geometry(0, PlaceholderTypes.CENTER_TITLE, 1.0, 2.5, 11.0, 1.5),
        geometry(1, PlaceholderTypes.SUBTITLE, 1.0, 4.2, 11.0, 1.0));
  }

  /** One landscape body of 10 x 5 in (50 sq in, aspect 2.0). */
  public static List<PlaceholderGeometry> wideChartArea() {
    return List.of(title(), geometry(1, PlaceholderTypes.OBJECT, 0.5, 1.5, 10.0, 5.0));
  }

  /** One portrait body of 6.5 x 7 in (45.5 sq in). */
  public static List<PlaceholderGeometry> tallTextArea() {
    return List.of(title(), geometry(1, PlaceholderTypes.BODY, 0.5, 1.4, 6.5, 7.0));
  }

  /** One medium body of 4 x 3 in. */
  public static List<PlaceholderGeometry> focusedArea() {
    return List.of(title(), geometry(1, PlaceholderTypes.BODY, 4.5, 2.5, 4.0, 3.0));
  }

  /** Five 2 x 1 in boxes: three on the first row, two on the second. */
  public static List<PlaceholderGeometry> kpiGrid() {
    return List.of(
        title(),
        geometry(1, PlaceholderTypes.OBJECT, 0.5, 2.0, 2.0, 1.0),
        geometry(2, PlaceholderTypes.OBJECT, 3.0, 2.0, 2.0, 1.0),
        geometry(3, PlaceholderTypes.OBJECT, 5.5, 2.0, 2.0, 1.0),
        geometry(4, PlaceholderTypes.OBJECT, 0.5, 4.0, 2.0, 1.0),
        geometry(5, PlaceholderTypes.OBJECT, 3.0, 4.0, 2.0, 1.0));
  }

  /** Two subtitled columns holding 10 and 10.5 sq in. */
  public static List<PlaceholderGeometry> balancedColumns() {
    return List.of(
        title(),
        geometry(1, PlaceholderTypes.SUBTITLE, 0.5, 1.2, 4.5, 0.4),
        geometry(2, PlaceholderTypes.BODY, 0.5, 1.8, 4.0, 2.5),
        geometry(3, PlaceholderTypes.SUBTITLE, 5.5, 1.2, 4.5, 0.4),
        geometry(4, PlaceholderTypes.BODY, 5.5, 1.8, 4.2, 2.5));
  }

  /** Two subtitled columns holding 5 and 20 sq in. */
  public static List<PlaceholderGeometry> mainAndSupporting() {
    return List.of(
        title(),
        geometry(1, PlaceholderTypes.SUBTITLE, 0.5, 1.2, 4.5, 0.4),
        geometry(2, PlaceholderTypes.BODY, 0.5, 1.8, 5.0, 4.0),
        geometry(3, PlaceholderTypes.SUBTITLE, 6.5, 1.2, 3.0, 0.4),
        geometry(4, PlaceholderTypes.BODY, 6.5, 1.8, 2.0, 2.5));
  }

  /** Three subtitled columns of 3.5 x 3 in each. */
  public static List<PlaceholderGeometry> threeStages() {
    return List.of(
        title(),
        geometry(1, PlaceholderTypes.SUBTITLE, 0.5, 1.2, 3.5, 0.4),
        geometry(2, PlaceholderTypes.BODY, 0.5, 1.8, 3.5, 3.0),
        geometry(3, PlaceholderTypes.SUBTITLE, 4.5, 1.2, 3.5, 0.4),
        geometry(4, PlaceholderTypes.BODY, 4.5, 1.8, 3.5, 3.0),
        geometry(5, PlaceholderTypes.SUBTITLE, 8.5, 1.2, 3.5, 0.4),
        geometry(6, PlaceholderTypes.BODY, 8.5, 1.8, 3.5, 3.0));
  }

  /** The same geometries as raw EMU shapes. */
  public static LayoutGeometry toLayoutGeometry(
      int layoutIndex, String name, List<PlaceholderGeometry> geometries) {
    List<RawPlaceholderShape> shapes = new ArrayList<>(geometries.size());
    for (PlaceholderGeometry g : geometries) {
      shapes.add(
          new RawPlaceholderShape(
              g.index(),
              g.typeId(),
              PlaceholderGeometryExtractor.toEmu(g.left()),
              PlaceholderGeometryExtractor.toEmu(g.top()),
              PlaceholderGeometryExtractor.toEmu(g.width()),
              PlaceholderGeometryExtractor.toEmu(g.height())));
    }
    return new LayoutGeometry(layoutIndex, name, shapes);
  }
}
