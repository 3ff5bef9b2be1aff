package io.relay;

import io.relay.model.EventSubscription;

import java.util.Objects;

/**
 * An {@link EventType} named at runtime, for example from a subscription form.
 *
 * <pre>{@code
 * EventType type = StringEventType.of("invoice.paid");
 * }</pre>
 *
 * @param name the persisted event type name; not blank, no commas, not the wildcard
 */
public record StringEventType(String name) implements EventType {

  public StringEventType {
    Objects.requireNonNull(name, "name");
    if (name.isBlank()) {
      throw new IllegalArgumentException("Event type name cannot be blank");
    }
    if (name.indexOf(',') >= 0 || name.equals(EventSubscription.WILDCARD)) {
      throw new IllegalArgumentException("Invalid event type name: " + name);
    }
  }

  public static StringEventType of(String name) {
    return new StringEventType(name);
  }

  @Override
  public String toString() {
    return name;
  }
}
