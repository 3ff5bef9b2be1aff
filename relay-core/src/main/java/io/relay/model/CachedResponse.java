package io.relay.model;

/**
 * The response of a completed idempotent request, replayed verbatim on retries.
 *
 * @param status      HTTP status code
 * @param contentType response content type, may be {@code null}
 * @param body        response body, may be {@code null}
 */
public record CachedResponse(int status, String contentType, String body) {
  public CachedResponse {
    if (status < 100 || status > 599) {
      throw new IllegalArgumentException("status must be a valid HTTP status: " + status);
    }
  }
}
