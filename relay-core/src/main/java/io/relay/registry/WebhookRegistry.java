package io.relay.registry;

import io.relay.model.EndpointSummary;
import io.relay.model.EventSubscription;
import io.relay.model.WebhookEndpoint;
import io.relay.spi.ConnectionProvider;
import io.relay.spi.EndpointStore;
import io.relay.spi.RelayStoreException;

import java.net.URI;
import java.net.URISyntaxException;
import java.security.SecureRandom;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Durable configuration of outbound webhook endpoints.
 *
 * <p>Endpoints must use {@code https}. Each gets a random signing secret at creation,
 * returned once in {@link CreatedEndpoint}; later reads return {@link EndpointSummary}.
 * Disabling an endpoint stops new attempts; its queued deliveries wait untouched until
 * it is enabled again or they are cancelled.
 */
public final class WebhookRegistry {
  private static final Logger logger = Logger.getLogger(WebhookRegistry.class.getName());

  private static final String SECRET_PREFIX = "whsec_";
  private static final int SECRET_BYTES = 32;

  private final ConnectionProvider connectionProvider;
  private final EndpointStore endpointStore;
  private final Clock clock;
  private final SecureRandom random = new SecureRandom();

  public WebhookRegistry(ConnectionProvider connectionProvider, EndpointStore endpointStore) {
    this(connectionProvider, endpointStore, Clock.systemUTC());
  }

  public WebhookRegistry(ConnectionProvider connectionProvider, EndpointStore endpointStore, Clock clock) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.endpointStore = Objects.requireNonNull(endpointStore, "endpointStore");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Registers an enabled endpoint.
   *
   * @param ownerId      owning tenant
   * @param url          target URL; must be absolute {@code https}
   * @param subscription event types to deliver
   * @param description  free text, may be {@code null}
   * @return the endpoint and its signing secret
   * @throws IllegalArgumentException if the URL is not an absolute https URL
   */
  public CreatedEndpoint register(String ownerId, String url, EventSubscription subscription,
      String description) {
    Objects.requireNonNull(ownerId, "ownerId");
    Objects.requireNonNull(subscription, "subscription");
    validateUrl(url);

    Instant now = clock.instant();
    String secret = newSecret();
    WebhookEndpoint endpoint = new WebhookEndpoint(UUID.randomUUID().toString(), ownerId, url,
        secret, subscription, true, description, now, now);
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      endpointStore.insert(conn, endpoint);
    } catch (SQLException e) {
      throw new RelayStoreException("Failed to register endpoint for owner " + ownerId, e);
    }
    logger.log(Level.INFO, "Registered webhook endpoint {0} for owner {1}",
        new Object[]{endpoint.id(), ownerId});
    return new CreatedEndpoint(endpoint.toSummary(), secret);
  }

  /** @return {@code true} if the endpoint exists */
  public boolean enable(String endpointId) {
    return setEnabled(endpointId, true);
  }

  /** @return {@code true} if the endpoint exists */
  public boolean disable(String endpointId) {
    return setEnabled(endpointId, false);
  }

  /**
   * Replaces the signing secret. Deliveries signed after this call use the new secret.
   *
   * @return the new secret, or empty if the endpoint does not exist
   */
  public Optional<String> rotateSecret(String endpointId) {
    Objects.requireNonNull(endpointId, "endpointId");
    String secret = newSecret();
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      if (endpointStore.updateSecret(conn, endpointId, secret, clock.instant()) == 0) {
        return Optional.empty();
      }
    } catch (SQLException e) {
      throw new RelayStoreException("Failed to rotate secret for endpoint " + endpointId, e);
    }
    logger.log(Level.INFO, "Rotated secret of webhook endpoint {0}", endpointId);
    return Optional.of(secret);
  }

  public Optional<EndpointSummary> find(String endpointId) {
    Objects.requireNonNull(endpointId, "endpointId");
    try (Connection conn = connectionProvider.getConnection()) {
      return endpointStore.findById(conn, endpointId).map(WebhookEndpoint::toSummary);
    } catch (SQLException e) {
      throw new RelayStoreException("Failed to load endpoint " + endpointId, e);
    }
  }

  public List<EndpointSummary> listByOwner(String ownerId) {
    Objects.requireNonNull(ownerId, "ownerId");
    try (Connection conn = connectionProvider.getConnection()) {
      return endpointStore.listByOwner(conn, ownerId).stream()
          .map(WebhookEndpoint::toSummary)
          .toList();
    } catch (SQLException e) {
      throw new RelayStoreException("Failed to list endpoints for owner " + ownerId, e);
    }
  }

  private boolean setEnabled(String endpointId, boolean enabled) {
    Objects.requireNonNull(endpointId, "endpointId");
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      boolean updated = endpointStore.setEnabled(conn, endpointId, enabled, clock.instant()) > 0;
      if (updated) {
        logger.log(Level.INFO, "Webhook endpoint {0} {1}",
            new Object[]{endpointId, enabled ? "enabled" : "disabled"});
      }
      return updated;
    } catch (SQLException e) {
      throw new RelayStoreException("Failed to update endpoint " + endpointId, e);
    }
  }

  private String newSecret() {
    byte[] bytes = new byte[SECRET_BYTES];
    random.nextBytes(bytes);
    return SECRET_PREFIX + HexFormat.of().formatHex(bytes);
  }

  static void validateUrl(String url) {
    Objects.requireNonNull(url, "url");
    URI uri;
    try {
      uri = new URI(url);
    } catch (URISyntaxException e) {
      throw new IllegalArgumentException("Invalid endpoint URL: " + url, e);
    }
    if (!"https".equalsIgnoreCase(uri.getScheme())) {
      throw new IllegalArgumentException("Endpoint URL must use https: " + url);
    }
    if (uri.getHost() == null || uri.getHost().isEmpty()) {
      throw new IllegalArgumentException("Endpoint URL must include a host: " + url);
    }
  }
}
