package io.relay.http;

import io.relay.spi.WebhookTransport;
import io.relay.util.DaemonThreadFactory;
import io.relay.util.Truncation;

import org.apache.hc.client5.http.classic.methods.HttpPost;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.ParseException;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.http.io.entity.StringEntity;
import org.apache.hc.core5.io.CloseMode;
import org.apache.hc.core5.util.Timeout;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link WebhookTransport} backed by a pooled Apache HttpClient 5 classic client.
 *
 * <p>The request timeout is a deadline on the whole attempt: connecting, sending and reading
 * the full response. When it passes, the exchange is cancelled and {@link #send} throws a
 * {@link SocketTimeoutException}, even if the endpoint is still trickling bytes. It is also
 * applied as the connect and socket response timeout. Redirects are not followed; a 3xx
 * counts as a failed attempt. Response bodies are truncated before they are handed back.
 *
 * @see HttpClientWebhookTransport.Builder
 */
public final class HttpClientWebhookTransport implements WebhookTransport, AutoCloseable {
  private static final Logger logger = Logger.getLogger(HttpClientWebhookTransport.class.getName());

  private final CloseableHttpClient httpClient;
  private final Duration connectionRequestTimeout;
  private final ScheduledExecutorService deadlines =
      Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("relay-http-deadline-"));

  private HttpClientWebhookTransport(Builder builder) {
    if (builder.maxConnections <= 0) {
      throw new IllegalArgumentException("maxConnections must be > 0");
    }
    if (builder.maxConnectionsPerRoute <= 0) {
      throw new IllegalArgumentException("maxConnectionsPerRoute must be > 0");
    }
    if (builder.connectionRequestTimeout.isNegative() || builder.connectionRequestTimeout.isZero()) {
      throw new IllegalArgumentException("connectionRequestTimeout must be positive");
    }
    this.connectionRequestTimeout = builder.connectionRequestTimeout;

    PoolingHttpClientConnectionManager connectionManager = new PoolingHttpClientConnectionManager();
    connectionManager.setMaxTotal(builder.maxConnections);
    connectionManager.setDefaultMaxPerRoute(builder.maxConnectionsPerRoute);

    this.httpClient = HttpClients.custom()
        .setConnectionManager(connectionManager)
        .setUserAgent(builder.userAgent)
        .disableRedirectHandling()
        .disableAutomaticRetries()
        .disableCookieManagement()
        .build();
    logger.log(Level.INFO, "Webhook transport pool: maxConnections={0} perRoute={1}",
        new Object[]{builder.maxConnections, builder.maxConnectionsPerRoute});
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Creates a transport with default pool sizes. */
  public static HttpClientWebhookTransport create() {
    return builder().build();
  }

  @Override
  public Response send(Request request) throws IOException {
    Objects.requireNonNull(request, "request");
    Timeout timeout = Timeout.ofMilliseconds(request.timeout().toMillis());

    HttpPost post = new HttpPost(request.url());
    post.setConfig(RequestConfig.custom()
        .setConnectionRequestTimeout(Timeout.ofMilliseconds(connectionRequestTimeout.toMillis()))
        .setConnectTimeout(timeout)
        .setResponseTimeout(timeout)
        .build());
    for (Map.Entry<String, String> header : request.headers().entrySet()) {
      post.setHeader(header.getKey(), header.getValue());
    }
    post.setEntity(new StringEntity(request.body(), ContentType.APPLICATION_JSON));

    AtomicBoolean expired = new AtomicBoolean();
    ScheduledFuture<?> deadline = deadlines.schedule(() -> {
      expired.set(true);
      post.cancel();
    }, request.timeout().toMillis(), TimeUnit.MILLISECONDS);
    Response response;
    try {
      response = httpClient.execute(post, r -> {
        HttpEntity entity = r.getEntity();
        String body = null;
        if (entity != null) {
          try {
            body = Truncation.truncate(EntityUtils.toString(entity, StandardCharsets.UTF_8));
          } catch (ParseException e) {
            logger.log(Level.FINE, "Unreadable response body from " + request.url(), e);
          }
        }
        return new Response(r.getCode(), body);
      });
    } catch (IOException | RuntimeException e) {
      if (expired.get()) {
        throw deadlineExceeded(request, e);
      }
      throw e;
    } finally {
      deadline.cancel(false);
    }
    // a body without Content-Length can end early when the exchange is cancelled
    if (expired.get()) {
      throw deadlineExceeded(request, null);
    }
    return response;
  }

  private static SocketTimeoutException deadlineExceeded(Request request, Exception cause) {
    SocketTimeoutException timeout = new SocketTimeoutException(
        "Webhook attempt to " + request.url() + " exceeded " + request.timeout().toMillis() + " ms");
    if (cause != null) {
      timeout.initCause(cause);
    }
    return timeout;
  }

  /** Closes the client, its connection pool and the deadline timer. */
  @Override
  public void close() {
    deadlines.shutdownNow();
    httpClient.close(CloseMode.GRACEFUL);
  }

  /** Builder for {@link HttpClientWebhookTransport}. */
  public static final class Builder {
    private int maxConnections = 200;
    private int maxConnectionsPerRoute = 20;
    private Duration connectionRequestTimeout = Duration.ofSeconds(5);
    private String userAgent = "relay-webhooks/1.0";

    private Builder() {}

    /**
     * Sets the total pool size.
     *
     * <p>Optional. Defaults to {@code 200}.
     *
     * @param maxConnections total connections across all endpoints
     * @return this builder
     */
    public Builder maxConnections(int maxConnections) {
      this.maxConnections = maxConnections;
      return this;
    }

    /**
     * Sets the pool size per host.
     *
     * <p>Optional. Defaults to {@code 20}.
     *
     * @param maxConnectionsPerRoute connections to one endpoint host
     * @return this builder
     */
    public Builder maxConnectionsPerRoute(int maxConnectionsPerRoute) {
      this.maxConnectionsPerRoute = maxConnectionsPerRoute;
      return this;
    }

    /**
     * Sets how long a send waits for a free pooled connection.
     *
     * <p>Optional. Defaults to {@code 5 seconds}.
     *
     * @param connectionRequestTimeout pool wait
     * @return this builder
     */
    public Builder connectionRequestTimeout(Duration connectionRequestTimeout) {
      this.connectionRequestTimeout = Objects.requireNonNull(connectionRequestTimeout,
          "connectionRequestTimeout");
      return this;
    }

    public Builder userAgent(String userAgent) {
      this.userAgent = Objects.requireNonNull(userAgent, "userAgent");
      return this;
    }

    public HttpClientWebhookTransport build() {
      return new HttpClientWebhookTransport(this);
    }
  }
}
