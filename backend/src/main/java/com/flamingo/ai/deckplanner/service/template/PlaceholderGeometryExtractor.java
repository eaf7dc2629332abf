package com.flamingo.ai.deckplanner.service.template;

import com.flamingo.ai.deckplanner.exception.LayoutAnalysisException;
import com.flamingo.ai.deckplanner.service.template.model.LayoutGeometry;
import com.flamingo.ai.deckplanner.service.template.model.PlaceholderGeometry;
import com.flamingo.ai.deckplanner.service.template.model.RawPlaceholderShape;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Converts raw placeholder shapes in EMU into inch-based {@link PlaceholderGeometry} records.
 *
 * <p>A layout is rejected with {@link LayoutAnalysisException} when it has no placeholders, when a
 * shape has a negative extent, or when two shapes share a placeholder index.
 */
@Component
public class PlaceholderGeometryExtractor {

  public static final double EMU_PER_INCH = 914_400.0;

  public List<PlaceholderGeometry> extract(LayoutGeometry layout) {
    List<RawPlaceholderShape> shapes = layout.shapes();
    if (shapes == null || shapes.isEmpty()) {
      throw new LayoutAnalysisException(
          layout.layoutIndex(), "Layout " + layout.layoutIndex() + " has no placeholders");
    }

    List<PlaceholderGeometry> result = new ArrayList<>(shapes.size());
    Set<Integer> seenIndices = new HashSet<>();
    for (RawPlaceholderShape shape : shapes) {
      if (shape == null) {
        throw new LayoutAnalysisException(
            layout.layoutIndex(), "Layout " + layout.layoutIndex() + " contains a null shape");
      }
      if (shape.width() < 0 || shape.height() < 0) {
        throw new LayoutAnalysisException(
            layout.layoutIndex(),
            String.format(
                "Placeholder %d has negative extent %dx%d EMU",
                shape.index(), shape.width(), shape.height()));
      }
      if (!seenIndices.add(shape.index())) {
        throw new LayoutAnalysisException(
            layout.layoutIndex(), "Duplicate placeholder index " + shape.index());
      }
      result.add(toGeometry(shape));
    }
    return result;
  }

  public PlaceholderGeometry toGeometry(RawPlaceholderShape shape) {
    return new PlaceholderGeometry(
        shape.index(),
        shape.typeId(),
        PlaceholderTypes.nameOf(shape.typeId()),
        shape.left() / EMU_PER_INCH,
        shape.top() / EMU_PER_INCH,
        shape.width() / EMU_PER_INCH,
        shape.height() / EMU_PER_INCH);
  }

  /** Converts inches to EMU, rounding to the nearest unit. */
  public static long toEmu(double inches) {
    return Math.round(inches * EMU_PER_INCH);
  }
}
