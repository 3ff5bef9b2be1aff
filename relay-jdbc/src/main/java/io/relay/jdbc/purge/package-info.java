/**
 * Batched DELETE purgers for expired idempotency keys, finished deliveries and processed
 * inbound events.
 *
 * @see io.relay.jdbc.purge.AbstractJdbcPurger
 */
package io.relay.jdbc.purge;
