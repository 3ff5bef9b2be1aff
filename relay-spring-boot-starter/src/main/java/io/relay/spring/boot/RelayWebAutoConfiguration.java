package io.relay.spring.boot;

import io.relay.Relay;
import io.relay.incoming.IncomingEventProcessor;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.core.Ordered;
import org.springframework.web.filter.OncePerRequestFilter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Servlet wiring: the {@link IdempotencyFilter} and the {@link IncomingWebhookController}.
 */
@AutoConfiguration(after = RelayAutoConfiguration.class)
@ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
@ConditionalOnClass(OncePerRequestFilter.class)
@ConditionalOnBean(Relay.class)
public class RelayWebAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(name = "idempotencyFilterRegistration")
  @ConditionalOnProperty(prefix = "relay.idempotency", name = "enabled", matchIfMissing = true)
  public FilterRegistrationBean<IdempotencyFilter> idempotencyFilterRegistration(Relay relay) {
    FilterRegistrationBean<IdempotencyFilter> registration =
        new FilterRegistrationBean<>(new IdempotencyFilter(relay.idempotencyGate()));
    registration.addUrlPatterns("/*");
    registration.setOrder(Ordered.LOWEST_PRECEDENCE - 100);
    return registration;
  }

  @Bean
  @ConditionalOnMissingBean
  @ConditionalOnBean(IncomingEventProcessor.class)
  public IncomingWebhookController incomingWebhookController(Relay relay, RelayProperties props) {
    Map<String, String> headers = new LinkedHashMap<>();
    props.getIncoming().getSources().forEach((name, source) -> headers.put(name, source.getSignatureHeader()));
    return new IncomingWebhookController(relay.incomingGateway(), headers);
  }
}
