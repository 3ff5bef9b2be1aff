package io.relay.util;

/**
 * Minimal JSON access used by the inbound gateway to read an event id out of a raw
 * webhook body without binding the whole document.
 *
 * <p>The default implementation ({@link DefaultJsonCodec}) has no dependencies.
 * Applications that already carry Jackson or Gson can implement this interface
 * and pass it to {@link io.relay.incoming.JsonFieldEventIdExtractor}.
 *
 * @see #getDefault()
 */
public interface JsonCodec {

    /**
     * Returns the default singleton implementation.
     *
     * @return the default {@link JsonCodec}
     */
    static JsonCodec getDefault() {
        return DefaultJsonCodec.INSTANCE;
    }

    /**
     * Reads a top-level scalar member of a JSON object as text.
     *
     * <p>String members are returned unescaped; number and boolean members are returned
     * as their literal text. Nested objects and arrays are skipped over.
     *
     * @param json  the JSON document, expected to be an object
     * @param field the member name
     * @return the member value, or {@code null} if absent, {@code null} or not a scalar
     * @throws IllegalArgumentException if the input is not a well-formed JSON object
     */
    String readTopLevelField(String json, String field);
}
