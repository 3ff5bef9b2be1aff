/**
 * Outbound delivery pipeline.
 *
 * <p>{@link io.relay.delivery.WebhookPublisher} writes one PENDING row per matching endpoint.
 * {@link io.relay.delivery.DeliveryPoller} claims due rows with a version compare-and-set and
 * hands them to the {@link io.relay.delivery.DeliveryDispatcher}, whose worker pool signs each
 * payload, sends it through the {@link io.relay.spi.WebhookTransport} and records the outcome.
 * Failed attempts are rescheduled by the {@link io.relay.delivery.RetryPolicy}; the
 * {@link io.relay.delivery.EndpointConcurrencyLimiter} caps in-flight requests per endpoint.
 *
 * @see io.relay.delivery.WebhookPublisher
 * @see io.relay.delivery.DeliveryPoller
 * @see io.relay.delivery.DeliveryDispatcher
 * @see io.relay.delivery.FixedScheduleRetryPolicy
 */
package io.relay.delivery;
