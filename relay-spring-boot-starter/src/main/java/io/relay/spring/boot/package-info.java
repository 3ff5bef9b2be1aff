/**
 * Spring Boot auto-configuration for the relay.
 *
 * <p>{@link io.relay.spring.boot.RelayAutoConfiguration} wires a {@link io.relay.Relay}
 * from {@code relay.*} properties; {@link io.relay.spring.boot.RelayWebAutoConfiguration}
 * adds the {@code Idempotency-Key} filter and the inbound webhook endpoint in servlet
 * applications.
 *
 * @see io.relay.spring.boot.RelayProperties
 */
package io.relay.spring.boot;
