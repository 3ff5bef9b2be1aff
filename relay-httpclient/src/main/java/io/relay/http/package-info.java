/**
 * Apache HttpClient 5 implementation of {@link io.relay.spi.WebhookTransport}.
 */
package io.relay.http;
