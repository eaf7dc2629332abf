package com.flamingo.ai.deckplanner.service.template.model;

/**
 * A placeholder shape as delivered by a template reader, in the document's native unit (EMU).
 *
 * @param index placeholder index within the layout
 * @param typeId numeric placeholder type id of the source format
 * @param left left edge in EMU
 * @param top top edge in EMU
 * @param width width in EMU
 * @param height height in EMU
 */
public record RawPlaceholderShape(
    int index, int typeId, long left, long top, long width, long height) {}
