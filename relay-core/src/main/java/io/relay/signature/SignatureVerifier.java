package io.relay.signature;

/**
 * Source-specific scheme for authenticating an inbound webhook.
 *
 * @see TimestampedSignatureVerifier
 * @see BodyHmacSignatureVerifier
 */
@FunctionalInterface
public interface SignatureVerifier {

    /**
     * Verifies the raw request body against the signature header.
     *
     * @param rawBody         request body exactly as received
     * @param signatureHeader value of the source's signature header, may be {@code null}
     * @param secret          shared secret for the source
     * @throws SignatureVerificationException if the request is not authentic
     */
    void verify(String rawBody, String signatureHeader, String secret);
}
