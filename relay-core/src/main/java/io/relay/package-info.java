/**
 * Root API for the relay: idempotent request handling, signed outbound webhook delivery
 * with retries, and deduplicated inbound webhook intake, all persisted through JDBC.
 *
 * <h2>Core Design</h2>
 * <p>An {@link io.relay.idempotency.IdempotencyGate} makes mutating API calls safe to retry:
 * the first request with a key runs, later ones replay the stored response. Domain events are
 * fanned out by the {@linkplain io.relay.delivery.WebhookPublisher publisher} into one
 * delivery row per subscribed endpoint, optionally inside the caller's transaction. A
 * {@linkplain io.relay.delivery.DeliveryPoller poller} claims due rows and the
 * {@linkplain io.relay.delivery.DeliveryDispatcher dispatcher} signs and sends them, retrying
 * on a fixed back-off schedule until the attempt budget is exhausted. Inbound webhooks are
 * verified, stored once per {@code (source, event id)} and processed asynchronously by the
 * {@linkplain io.relay.incoming.IncomingWebhookGateway gateway}.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>relay-core</b> - engines, pipeline and SPIs (no external deps)</li>
 *   <li><b>relay-jdbc</b> - {@linkplain io.relay.jdbc JDBC stores} and purgers (H2, PostgreSQL)</li>
 *   <li><b>relay-httpclient</b> - Apache HttpClient 5 {@link io.relay.spi.WebhookTransport}</li>
 *   <li><b>relay-micrometer</b> - Micrometer metrics bridge</li>
 *   <li><b>relay-spring-boot-starter</b> - auto-configuration, idempotency filter and inbound
 *       endpoint</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * var stores       = JdbcRelayStores.detect(dataSource);
 * var connProvider = new DataSourceConnectionProvider(dataSource);
 *
 * try (Relay relay = Relay.builder()
 *     .connectionProvider(connProvider)
 *     .idempotencyStore(stores.idempotencyStore())
 *     .endpointStore(stores.endpointStore())
 *     .deliveryStore(stores.deliveryStore())
 *     .transport(HttpClientWebhookTransport.builder().build())
 *     .build()) {
 *
 *   CreatedEndpoint created = relay.registry().register("acct_1",
 *       "https://example.com/hooks", EventSubscription.of(StringEventType.of("invoice.paid")), null);
 *
 *   relay.publisher().publish(WebhookEvent.of("evt_1",
 *       StringEventType.of("invoice.paid"), "acct_1", "{\"invoice\":\"in_1\"}"));
 * }
 * }</pre>
 *
 * @see io.relay.Relay
 * @see io.relay.WebhookEvent
 * @see io.relay.EventType
 */
package io.relay;
