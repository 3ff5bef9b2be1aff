/**
 * Tooling for deliveries that ran out of attempts.
 *
 * <p>{@link io.relay.failed.FailedDeliveryManager} queries, counts and inspects FAILED
 * deliveries and cancels deliveries still waiting to be sent.
 *
 * @see io.relay.spi.DeliveryStore#queryByStatus
 */
package io.relay.failed;
