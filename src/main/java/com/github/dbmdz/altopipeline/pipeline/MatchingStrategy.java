package com.github.dbmdz.altopipeline.pipeline;

import com.github.dbmdz.altopipeline.model.TextElement;
import java.util.Optional;

/**
 * Decides whether a candidate element enters the next selection.
 *
 * <p>New ways of selecting elements can be plugged into {@link Selection#apply(MatchingStrategy)}
 * without touching the selection logic itself.
 */
public interface MatchingStrategy {
  /** Identifier recorded in the {@code matchedBy} trail of every selected element. */
  String getOperationId();

  /**
   * Evaluate a single candidate. Must not mutate the element, recording the match is done in
   * {@link #commit(Match)}.
   */
  Optional<Match> evaluate(TextElement element);

  /** Record a successful match on its element. */
  default void commit(Match match) {
    match.getElement().addMatchedBy(getOperationId());
  }
}
