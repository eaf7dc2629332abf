package com.flamingo.ai.deckplanner.service.content;

import com.flamingo.ai.deckplanner.domain.enums.PayloadKind;

/**
 * Typed slide body content, decoded once at the boundary by {@link ContentPayloadDecoder}.
 *
 * <p>Implementations are the records in this package; {@link #kind()} is the explicit tag callers
 * switch on.
 */
public interface ContentPayload {

  PayloadKind kind();

  /** Number of top-level entries (bullets, columns, metrics, icons, table rows). */
  int itemCount();

  /** Rough number of text lines the content needs when rendered as bullets. */
  int estimatedLines();
}
