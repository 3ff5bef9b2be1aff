package io.relay.spring.boot;

import io.relay.Relay;
import io.relay.delivery.FixedScheduleRetryPolicy;
import io.relay.delivery.QueueSettings;
import io.relay.http.HttpClientWebhookTransport;
import io.relay.incoming.IncomingEventProcessor;
import io.relay.incoming.IncomingSource;
import io.relay.incoming.JsonFieldEventIdExtractor;
import io.relay.jdbc.DataSourceConnectionProvider;
import io.relay.jdbc.JdbcRelayStores;
import io.relay.signature.BodyHmacSignatureVerifier;
import io.relay.signature.SignatureEngine;
import io.relay.signature.SignatureVerifier;
import io.relay.signature.TimestampedSignatureVerifier;
import io.relay.spi.ConnectionProvider;
import io.relay.spi.MetricsExporter;
import io.relay.spi.WebhookTransport;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.time.Duration;
import java.util.Map;

/**
 * Auto-configuration for the relay.
 *
 * <p>Wires a {@link Relay} composite from a {@link DataSource} and {@link RelayProperties}.
 * Sending is enabled when a {@link WebhookTransport} bean exists (one backed by Apache
 * HttpClient is provided by default); the inbound gateway is enabled when an
 * {@link IncomingEventProcessor} bean exists.
 *
 * @see RelayProperties
 * @see RelayMicrometerAutoConfiguration
 * @see RelayWebAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(Relay.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(RelayProperties.class)
public class RelayAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public JdbcRelayStores relayStores(DataSource dataSource, RelayProperties props) {
    return JdbcRelayStores.detect(dataSource, props.getTables().toTableNames());
  }

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
    return new DataSourceConnectionProvider(dataSource);
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public Relay relay(RelayProperties props,
      ConnectionProvider connectionProvider,
      JdbcRelayStores stores,
      ObjectProvider<WebhookTransport> transportProvider,
      ObjectProvider<MetricsExporter> metricsProvider,
      ObjectProvider<IncomingEventProcessor> processorProvider) {

    Map<String, RelayProperties.Source> sources = props.getIncoming().getSources();
    IncomingEventProcessor processor = processorProvider.getIfAvailable();
    if (processor == null && !sources.isEmpty()) {
      throw new IllegalStateException(
          "relay.incoming.sources is set but no IncomingEventProcessor bean is defined");
    }

    RelayProperties.Delivery delivery = props.getDelivery();
    Relay.Builder builder = Relay.builder()
        .connectionProvider(connectionProvider)
        .endpointStore(stores.endpointStore())
        .deliveryStore(stores.deliveryStore())
        .queueSettings(QueueSettings.of(props.getQueues()))
        .retryPolicy(new FixedScheduleRetryPolicy(delivery.getRetrySchedule()))
        .maxAttempts(delivery.getMaxAttempts())
        .requestTimeout(delivery.getRequestTimeout())
        .maxConcurrentPerEndpoint(delivery.getMaxConcurrentPerEndpoint())
        .drainTimeoutMs(delivery.getDrainTimeoutMs())
        .pollIntervalMs(props.getPoller().getIntervalMs())
        .pollBatchSize(props.getPoller().getBatchSize())
        .claimLease(props.getPoller().getClaimLease());

    if (props.getIdempotency().isEnabled()) {
      builder.idempotencyStore(stores.idempotencyStore())
          .idempotencyTtl(props.getIdempotency().getTtl())
          .stalenessWindow(props.getIdempotency().getStalenessWindow());
    }
    if (delivery.isEnabled()) {
      transportProvider.ifAvailable(builder::transport);
    }
    metricsProvider.ifAvailable(builder::metrics);

    if (processor != null) {
      builder.incomingEventStore(stores.incomingEventStore())
          .incomingProcessor(processor)
          .incomingProcessingLease(props.getIncoming().getProcessingLease())
          .incomingRecoveryIntervalMs(props.getIncoming().getRecoveryIntervalMs());
      sources.forEach((name, source) -> builder.incomingSource(toIncomingSource(name, source)));
    }

    RelayProperties.Purge purge = props.getPurge();
    if (purge.isEnabled()) {
      builder.purgeIntervalSeconds(purge.getIntervalSeconds())
          .purger(stores.deliveryRetentionPurger(), purge.getDeliveryRetention());
      if (props.getIdempotency().isEnabled()) {
        builder.purger(stores.idempotencyKeyPurger(), Duration.ZERO);
      }
      if (processor != null) {
        builder.purger(stores.incomingEventRetentionPurger(), purge.getIncomingRetention());
      }
    }
    return builder.build();
  }

  static IncomingSource toIncomingSource(String name, RelayProperties.Source source) {
    if (source.getSecret() == null || source.getSecret().isEmpty()) {
      throw new IllegalStateException("relay.incoming.sources." + name + ".secret is required");
    }
    SignatureVerifier verifier = switch (source.getScheme()) {
      case TIMESTAMPED -> new TimestampedSignatureVerifier(new SignatureEngine(), source.getTolerance());
      case BODY_HMAC -> new BodyHmacSignatureVerifier();
    };
    return new IncomingSource(name, source.getSecret(), verifier,
        new JsonFieldEventIdExtractor(source.getEventIdField()));
  }

  @Configuration(proxyBeanMethods = false)
  @ConditionalOnClass(HttpClientWebhookTransport.class)
  @ConditionalOnProperty(prefix = "relay.delivery", name = "enabled", matchIfMissing = true)
  static class HttpTransportConfiguration {

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean(WebhookTransport.class)
    public HttpClientWebhookTransport webhookTransport(RelayProperties props) {
      RelayProperties.Http http = props.getHttp();
      return HttpClientWebhookTransport.builder()
          .maxConnections(http.getMaxConnections())
          .maxConnectionsPerRoute(http.getMaxConnectionsPerRoute())
          .connectionRequestTimeout(http.getConnectionRequestTimeout())
          .build();
    }
  }
}
