/**
 * Inbound webhook intake.
 *
 * <p>{@link io.relay.incoming.IncomingWebhookGateway} verifies the signature of each request
 * against its {@link io.relay.incoming.IncomingSource}, stores the event once per
 * {@code (source, event id)} and runs the {@link io.relay.incoming.IncomingEventProcessor} off
 * the request thread. {@link io.relay.incoming.IncomingEventManager} inspects and retries
 * events that ended in ERROR.
 */
package io.relay.incoming;
