package io.relay.incoming;

import io.relay.util.JsonCodec;

import java.util.Objects;

/**
 * Takes the event id from a top-level member of a JSON body, {@code "id"} by default.
 */
public final class JsonFieldEventIdExtractor implements EventIdExtractor {
  public static final String DEFAULT_FIELD = "id";

  private final String field;
  private final JsonCodec jsonCodec;

  public JsonFieldEventIdExtractor() {
    this(DEFAULT_FIELD, JsonCodec.getDefault());
  }

  public JsonFieldEventIdExtractor(String field) {
    this(field, JsonCodec.getDefault());
  }

  public JsonFieldEventIdExtractor(String field, JsonCodec jsonCodec) {
    this.field = Objects.requireNonNull(field, "field");
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
  }

  @Override
  public String extract(String rawBody) {
    String id = jsonCodec.readTopLevelField(rawBody, field);
    return id == null || id.isBlank() ? null : id;
  }
}
