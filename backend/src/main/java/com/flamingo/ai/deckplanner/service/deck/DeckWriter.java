package com.flamingo.ai.deckplanner.service.deck;

/**
 * Renders planned slides into an output document. Implementations live outside this module; the
 * planner only hands over one {@link SlidePlan} per slide, in deck order.
 */
public interface DeckWriter {

  void write(SlidePlan slide);
}
