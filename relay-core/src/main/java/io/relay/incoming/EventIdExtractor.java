package io.relay.incoming;

/**
 * Reads the sender's event id out of a raw inbound body. The id is the dedup key
 * together with the source name.
 *
 * @see JsonFieldEventIdExtractor
 */
@FunctionalInterface
public interface EventIdExtractor {

    /**
     * @param rawBody request body exactly as received
     * @return the event id, or {@code null} if the body carries none
     * @throws IllegalArgumentException if the body cannot be parsed
     */
    String extract(String rawBody);
}
