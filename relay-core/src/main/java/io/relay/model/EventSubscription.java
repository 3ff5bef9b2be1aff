package io.relay.model;

import io.relay.EventType;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * The set of event types an endpoint receives: either every type (wildcard) or an
 * explicit set of names.
 *
 * <p>Matching lives in {@link io.relay.registry.SubscriptionMatcher}.
 *
 * @param wildcard   {@code true} to receive all event types
 * @param eventTypes subscribed names; always empty for a wildcard subscription
 */
public record EventSubscription(boolean wildcard, Set<String> eventTypes) {
  public static final String WILDCARD = "*";

  public EventSubscription {
    Objects.requireNonNull(eventTypes, "eventTypes");
    if (wildcard) {
      eventTypes = Set.of();
    } else {
      if (eventTypes.isEmpty()) {
        throw new IllegalArgumentException("Subscription must be a wildcard or name at least one event type");
      }
      TreeSet<String> sorted = new TreeSet<>();
      for (String name : eventTypes) {
        sorted.add(validateName(name));
      }
      eventTypes = Collections.unmodifiableSet(sorted);
    }
  }

  public static EventSubscription all() {
    return new EventSubscription(true, Set.of());
  }

  public static EventSubscription of(EventType... types) {
    TreeSet<String> names = new TreeSet<>();
    for (EventType type : types) {
      names.add(type.name());
    }
    return new EventSubscription(false, names);
  }

  public static EventSubscription ofNames(Collection<String> names) {
    if (names.contains(WILDCARD)) {
      return all();
    }
    return new EventSubscription(false, new TreeSet<>(names));
  }

  /** Storage form: {@code "*"} or the sorted, comma-separated names. */
  public String encode() {
    return wildcard ? WILDCARD : String.join(",", eventTypes);
  }

  public static EventSubscription decode(String encoded) {
    Objects.requireNonNull(encoded, "encoded");
    if (WILDCARD.equals(encoded.trim())) {
      return all();
    }
    TreeSet<String> names = new TreeSet<>();
    Arrays.stream(encoded.split(","))
        .map(String::trim)
        .filter(s -> !s.isEmpty())
        .forEach(names::add);
    return new EventSubscription(false, names);
  }

  private static String validateName(String name) {
    Objects.requireNonNull(name, "event type name");
    if (name.isBlank() || name.indexOf(',') >= 0 || WILDCARD.equals(name)) {
      throw new IllegalArgumentException("Invalid event type name: " + name);
    }
    return name;
  }
}
