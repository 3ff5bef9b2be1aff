package io.relay.registry;

import io.relay.model.EndpointSummary;

/**
 * Result of registering an endpoint. This is the only time the signing secret is returned;
 * the caller must show it to the endpoint owner now.
 */
public record CreatedEndpoint(EndpointSummary endpoint, String secret) {

  @Override
  public String toString() {
    return "CreatedEndpoint[endpoint=" + endpoint + ", secret=<redacted>]";
  }
}
