package com.flamingo.ai.deckplanner.service.content;

/**
 * Generated content for one slide.
 *
 * @param heading slide heading, rendered into the layout's title placeholder
 * @param payload body content
 * @param keyMessage optional takeaway line, may be {@code null}
 */
public record SlideContent(String heading, ContentPayload payload, String keyMessage) {

  public static SlideContent of(String heading, ContentPayload payload) {
    return new SlideContent(heading, payload, null);
  }
}
