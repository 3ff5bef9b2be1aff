/**
 * HMAC-SHA256 webhook signatures.
 *
 * <p>{@link io.relay.signature.SignatureEngine} produces and checks
 * {@code t=<unix seconds>,v1=<hex>} headers with a replay tolerance.
 * {@link io.relay.signature.SignatureVerifier} implementations cover the schemes accepted from
 * third-party senders.
 */
package io.relay.signature;
