package io.relay.registry;

import io.relay.EventType;
import io.relay.model.EventSubscription;

import java.util.Objects;

/**
 * Decides whether an endpoint's subscription covers an event type. Pure function.
 */
public final class SubscriptionMatcher {

  private SubscriptionMatcher() {
  }

  public static boolean matches(EventSubscription subscription, String eventType) {
    Objects.requireNonNull(subscription, "subscription");
    Objects.requireNonNull(eventType, "eventType");
    return subscription.wildcard() || subscription.eventTypes().contains(eventType);
  }

  public static boolean matches(EventSubscription subscription, EventType eventType) {
    return matches(subscription, eventType.name());
  }
}
