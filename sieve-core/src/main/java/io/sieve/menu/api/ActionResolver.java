package io.sieve.menu.api;

import java.util.Optional;

/**
 * Maps raw key strokes to {@link SemanticAction}s. The mapping itself is external configuration;
 * the session only asks whether a stroke triggers a given action.
 */
@FunctionalInterface
public interface ActionResolver {

  /**
   * Tests whether the stroke is bound to the action.
   *
   * @param action the action to test
   * @param stroke the pressed key
   * @return {@code true} if pressing {@code stroke} should trigger {@code action}
   */
  boolean test(SemanticAction action, KeyStroke stroke);

  /**
   * Resolves the highest priority action bound to the stroke.
   *
   * @param stroke the pressed key
   * @return the first action, in declaration order, bound to the stroke
   */
  default Optional<SemanticAction> resolve(KeyStroke stroke) {
    for (SemanticAction action : SemanticAction.values()) {
      if (test(action, stroke)) {
        return Optional.of(action);
      }
    }
    return Optional.empty();
  }
}
