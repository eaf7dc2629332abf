package com.flamingo.ai.deckplanner.service.template.model;

import java.util.List;

/**
 * Raw placeholder shapes of one slide layout, in the order the template reader returned them.
 *
 * @param layoutIndex index of the layout within its template
 * @param name layout name as stored in the template
 * @param shapes placeholder shapes, may be empty or {@code null} for malformed layouts
 */
public record LayoutGeometry(int layoutIndex, String name, List<RawPlaceholderShape> shapes) {}
