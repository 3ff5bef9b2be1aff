/**
 * Service Provider Interfaces (SPI) for plugging the relay into storage, HTTP and metrics.
 *
 * <p>The store interfaces take the caller's {@link java.sql.Connection} so that writes can join
 * an existing transaction.
 *
 * @see io.relay.spi.ConnectionProvider
 * @see io.relay.spi.IdempotencyStore
 * @see io.relay.spi.EndpointStore
 * @see io.relay.spi.DeliveryStore
 * @see io.relay.spi.IncomingEventStore
 * @see io.relay.spi.WebhookTransport
 * @see io.relay.spi.Purger
 * @see io.relay.spi.MetricsExporter
 */
package io.relay.spi;
