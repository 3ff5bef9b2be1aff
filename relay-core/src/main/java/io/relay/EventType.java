package io.relay;

/**
 * Identifies the kind of a webhook event, such as {@code invoice.paid}.
 *
 * <p>Enums give compile-time safety:
 * <pre>{@code
 * public enum BillingEvents implements EventType {
 *   INVOICE_PAID,
 *   SUBSCRIPTION_CANCELED
 * }
 * }</pre>
 *
 * <p>Use {@link StringEventType} for names decided at runtime, such as those an
 * endpoint owner types into a subscription form.
 */
public interface EventType {

    /**
     * Returns the persisted name of this event type. Subscriptions match on this value.
     *
     * @return the event type name, never null
     */
    String name();
}
