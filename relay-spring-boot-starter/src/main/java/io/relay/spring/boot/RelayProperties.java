package io.relay.spring.boot;

import io.relay.delivery.FixedScheduleRetryPolicy;
import io.relay.jdbc.TableNames;
import io.relay.signature.SignatureEngine;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the relay.
 *
 * @see RelayAutoConfiguration
 */
@ConfigurationProperties(prefix = "relay")
public class RelayProperties {

    private final Tables tables = new Tables();
    private final Idempotency idempotency = new Idempotency();
    private final Delivery delivery = new Delivery();
    private final Http http = new Http();
    private final Poller poller = new Poller();
    private final Incoming incoming = new Incoming();
    private final Purge purge = new Purge();
    private final Metrics metrics = new Metrics();

    /**
     * Concurrency per named queue, merged over the defaults
     * ({@code deliveries=4}, {@code incoming=2}).
     */
    private Map<String, Integer> queues = new LinkedHashMap<>();

    public Tables getTables() {
        return tables;
    }

    public Idempotency getIdempotency() {
        return idempotency;
    }

    public Delivery getDelivery() {
        return delivery;
    }

    public Http getHttp() {
        return http;
    }

    public Poller getPoller() {
        return poller;
    }

    public Incoming getIncoming() {
        return incoming;
    }

    public Purge getPurge() {
        return purge;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public Map<String, Integer> getQueues() {
        return queues;
    }

    public void setQueues(Map<String, Integer> queues) {
        this.queues = queues;
    }

    public static class Tables {
        private String idempotencyKeys = TableNames.DEFAULT_IDEMPOTENCY_KEYS;
        private String endpoints = TableNames.DEFAULT_ENDPOINTS;
        private String deliveries = TableNames.DEFAULT_DELIVERIES;
        private String events = TableNames.DEFAULT_EVENTS;

        public String getIdempotencyKeys() {
            return idempotencyKeys;
        }

        public void setIdempotencyKeys(String idempotencyKeys) {
            this.idempotencyKeys = idempotencyKeys;
        }

        public String getEndpoints() {
            return endpoints;
        }

        public void setEndpoints(String endpoints) {
            this.endpoints = endpoints;
        }

        public String getDeliveries() {
            return deliveries;
        }

        public void setDeliveries(String deliveries) {
            this.deliveries = deliveries;
        }

        public String getEvents() {
            return events;
        }

        public void setEvents(String events) {
            this.events = events;
        }

        TableNames toTableNames() {
            return new TableNames(idempotencyKeys, endpoints, deliveries, events);
        }
    }

    public static class Idempotency {
        /**
         * Whether the idempotency gate and its servlet filter are installed.
         */
        private boolean enabled = true;
        private Duration ttl = Duration.ofHours(24);
        private Duration stalenessWindow = Duration.ofSeconds(30);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getTtl() {
            return ttl;
        }

        public void setTtl(Duration ttl) {
            this.ttl = ttl;
        }

        public Duration getStalenessWindow() {
            return stalenessWindow;
        }

        public void setStalenessWindow(Duration stalenessWindow) {
            this.stalenessWindow = stalenessWindow;
        }
    }

    public static class Delivery {
        /**
         * Whether this node sends deliveries. When false the node only records them.
         */
        private boolean enabled = true;
        private int maxAttempts = 5;
        private Duration requestTimeout = Duration.ofSeconds(30);
        private List<Duration> retrySchedule = new ArrayList<>(FixedScheduleRetryPolicy.DEFAULT_SCHEDULE);
        /**
         * Attempts allowed in flight per endpoint on this node; 0 disables the cap.
         */
        private int maxConcurrentPerEndpoint = 0;
        private long drainTimeoutMs = 5000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getRequestTimeout() {
            return requestTimeout;
        }

        public void setRequestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
        }

        public List<Duration> getRetrySchedule() {
            return retrySchedule;
        }

        public void setRetrySchedule(List<Duration> retrySchedule) {
            this.retrySchedule = retrySchedule;
        }

        public int getMaxConcurrentPerEndpoint() {
            return maxConcurrentPerEndpoint;
        }

        public void setMaxConcurrentPerEndpoint(int maxConcurrentPerEndpoint) {
            this.maxConcurrentPerEndpoint = maxConcurrentPerEndpoint;
        }

        public long getDrainTimeoutMs() {
            return drainTimeoutMs;
        }

        public void setDrainTimeoutMs(long drainTimeoutMs) {
            this.drainTimeoutMs = drainTimeoutMs;
        }
    }

    public static class Http {
        private int maxConnections = 200;
        private int maxConnectionsPerRoute = 20;
        private Duration connectionRequestTimeout = Duration.ofSeconds(5);

        public int getMaxConnections() {
            return maxConnections;
        }

        public void setMaxConnections(int maxConnections) {
            this.maxConnections = maxConnections;
        }

        public int getMaxConnectionsPerRoute() {
            return maxConnectionsPerRoute;
        }

        public void setMaxConnectionsPerRoute(int maxConnectionsPerRoute) {
            this.maxConnectionsPerRoute = maxConnectionsPerRoute;
        }

        public Duration getConnectionRequestTimeout() {
            return connectionRequestTimeout;
        }

        public void setConnectionRequestTimeout(Duration connectionRequestTimeout) {
            this.connectionRequestTimeout = connectionRequestTimeout;
        }
    }

    public static class Poller {
        private long intervalMs = 1000;
        private int batchSize = 50;
        private Duration claimLease = Duration.ofMinutes(5);

        public long getIntervalMs() {
            return intervalMs;
        }

        public void setIntervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public Duration getClaimLease() {
            return claimLease;
        }

        public void setClaimLease(Duration claimLease) {
            this.claimLease = claimLease;
        }
    }

    public static class Incoming {
        /**
         * Base path of the inbound endpoint; the source name is appended as the last segment.
         */
        private String path = "/webhooks/incoming";
        /**
         * How long an event may stay PROCESSING before it is released for another attempt.
         */
        private Duration processingLease = Duration.ofMinutes(5);
        /**
         * Delay between recovery sweeps in milliseconds; 0 disables them.
         */
        private long recoveryIntervalMs = 60_000;
        private Map<String, Source> sources = new LinkedHashMap<>();

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public Duration getProcessingLease() {
            return processingLease;
        }

        public void setProcessingLease(Duration processingLease) {
            this.processingLease = processingLease;
        }

        public long getRecoveryIntervalMs() {
            return recoveryIntervalMs;
        }

        public void setRecoveryIntervalMs(long recoveryIntervalMs) {
            this.recoveryIntervalMs = recoveryIntervalMs;
        }

        public Map<String, Source> getSources() {
            return sources;
        }

        public void setSources(Map<String, Source> sources) {
            this.sources = sources;
        }
    }

    public static class Source {
        private String secret;
        private Scheme scheme = Scheme.TIMESTAMPED;
        private String signatureHeader = "X-Webhook-Signature";
        private String eventIdField = "id";
        private Duration tolerance = SignatureEngine.DEFAULT_TOLERANCE;

        public String getSecret() {
            return secret;
        }

        public void setSecret(String secret) {
            this.secret = secret;
        }

        public Scheme getScheme() {
            return scheme;
        }

        public void setScheme(Scheme scheme) {
            this.scheme = scheme;
        }

        public String getSignatureHeader() {
            return signatureHeader;
        }

        public void setSignatureHeader(String signatureHeader) {
            this.signatureHeader = signatureHeader;
        }

        public String getEventIdField() {
            return eventIdField;
        }

        public void setEventIdField(String eventIdField) {
            this.eventIdField = eventIdField;
        }

        public Duration getTolerance() {
            return tolerance;
        }

        public void setTolerance(Duration tolerance) {
            this.tolerance = tolerance;
        }
    }

    public enum Scheme {
        /** {@code t=<ts>,v1=<hex>} over {@code "<ts>.<body>"}. */
        TIMESTAMPED,
        /** Hex HMAC-SHA256 of the raw body. */
        BODY_HMAC
    }

    public static class Purge {
        private boolean enabled = true;
        private long intervalSeconds = 3600;
        private Duration deliveryRetention = Duration.ofDays(30);
        private Duration incomingRetention = Duration.ofDays(30);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getIntervalSeconds() {
            return intervalSeconds;
        }

        public void setIntervalSeconds(long intervalSeconds) {
            this.intervalSeconds = intervalSeconds;
        }

        public Duration getDeliveryRetention() {
            return deliveryRetention;
        }

        public void setDeliveryRetention(Duration deliveryRetention) {
            this.deliveryRetention = deliveryRetention;
        }

        public Duration getIncomingRetention() {
            return incomingRetention;
        }

        public void setIncomingRetention(Duration incomingRetention) {
            this.incomingRetention = incomingRetention;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "relay";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
