package com.gruelbox.retry;

import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import lombok.extern.slf4j.Slf4j;

/**
 * A thread-safe registry of named actions which a {@link NamedActionRetrier} can run by name.
 * Names are case sensitive.
 */
@Slf4j
public final class ActionRegistry {

  private final ConcurrentMap<String, FallibleOperation<?>> actions = new ConcurrentHashMap<>();

  /**
   * @param name The name. May not be blank.
   * @param action The action.
   * @return This registry, for chaining.
   * @throws IllegalArgumentException If the name is blank or already taken.
   */
  public ActionRegistry register(String name, FallibleOperation<?> action) {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Action name may not be blank");
    }
    if (action == null) {
      throw new IllegalArgumentException("Action '" + name + "' may not be null");
    }
    if (actions.putIfAbsent(name, action) != null) {
      throw new IllegalArgumentException("Action '" + name + "' is already registered");
    }
    log.debug("Registered action '{}'", name);
    return this;
  }

  public Optional<FallibleOperation<?>> find(String name) {
    return Optional.ofNullable(name).map(actions::get);
  }

  /**
   * @return The registered names, sorted.
   */
  public Set<String> names() {
    return new TreeSet<>(actions.keySet());
  }
}
