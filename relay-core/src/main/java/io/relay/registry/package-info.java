/**
 * Webhook endpoint registration and event subscription matching.
 *
 * @see io.relay.registry.WebhookRegistry
 * @see io.relay.registry.SubscriptionMatcher
 */
package io.relay.registry;
