package io.relay.incoming;

import io.relay.model.IncomingWebhookEvent;

/**
 * Application callback that handles an accepted inbound event. Runs on the inbound
 * processing pool, never on the request thread.
 *
 * <p>Returning normally marks the event PROCESSED. Throwing marks it ERROR with the
 * exception message; it is not retried automatically.
 */
@FunctionalInterface
public interface IncomingEventProcessor {

    void process(IncomingWebhookEvent event) throws Exception;
}
