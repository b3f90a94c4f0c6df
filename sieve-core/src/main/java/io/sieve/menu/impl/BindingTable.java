package io.sieve.menu.impl;

import io.sieve.menu.api.ActionResolver;
import io.sieve.menu.api.KeyStroke;
import io.sieve.menu.api.SemanticAction;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/** {@link ActionResolver} backed by the {@code kb-*} bindings of a configuration. */
public final class BindingTable implements ActionResolver {
  private final Map<SemanticAction, Set<KeyStroke>> bindings = new EnumMap<>(SemanticAction.class);

  /**
   * Parses the bindings.
   *
   * @param config comma separated strokes per action
   * @throws io.sieve.menu.api.SieveConfigurationException if a stroke cannot be parsed
   */
  public BindingTable(Map<SemanticAction, String> config) {
    for (Map.Entry<SemanticAction, String> e : config.entrySet()) {
      List<KeyStroke> strokes = KeyStroke.parseList(e.getValue());
      bindings.put(e.getKey(), strokes.stream().collect(Collectors.toUnmodifiableSet()));
    }
  }

  @Override
  public boolean test(SemanticAction action, KeyStroke stroke) {
    Set<KeyStroke> strokes = bindings.get(action);
    return strokes != null && strokes.contains(stroke);
  }

  /** Strokes bound to the action, empty if none. */
  public Set<KeyStroke> strokes(SemanticAction action) {
    return bindings.getOrDefault(action, Set.of());
  }
}
