/**
 * JDBC implementations of the relay store SPIs.
 *
 * <p>Status changes on deliveries are guarded by a {@code version} column so concurrent
 * pollers and workers never overwrite each other's outcome. Inserts that must happen at most
 * once go through the dialect's insert-if-absent statement.
 *
 * @see io.relay.jdbc.store.JdbcIdempotencyStore
 * @see io.relay.jdbc.store.JdbcEndpointStore
 * @see io.relay.jdbc.store.JdbcDeliveryStore
 * @see io.relay.jdbc.store.JdbcIncomingEventStore
 */
package io.relay.jdbc.store;
