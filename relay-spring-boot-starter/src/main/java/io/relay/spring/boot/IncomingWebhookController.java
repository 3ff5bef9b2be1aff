package io.relay.spring.boot;

import io.relay.incoming.IncomingWebhookGateway;
import io.relay.incoming.ReceiveResult;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Receives third-party webhooks at {@code POST {relay.incoming.path}/{source}} and hands the
 * raw body to the {@link IncomingWebhookGateway}.
 *
 * <p>The body is read as bytes and passed through undecoded; the gateway rejects bodies
 * that are not valid UTF-8 with 400 {@code invalid_body}.
 */
@RestController
public class IncomingWebhookController {
  static final String DEFAULT_SIGNATURE_HEADER = "X-Webhook-Signature";

  private final IncomingWebhookGateway gateway;
  private final Map<String, String> signatureHeaders;

  /**
   * @param gateway          the inbound gateway
   * @param signatureHeaders header carrying the signature, per source name; sources not listed
   *                         use {@value #DEFAULT_SIGNATURE_HEADER}
   */
  public IncomingWebhookController(IncomingWebhookGateway gateway, Map<String, String> signatureHeaders) {
    this.gateway = Objects.requireNonNull(gateway, "gateway");
    this.signatureHeaders = Map.copyOf(signatureHeaders);
  }

  @PostMapping(path = "${relay.incoming.path:/webhooks/incoming}/{source}")
  public ResponseEntity<String> receive(@PathVariable("source") String source,
      @RequestBody(required = false) byte[] body,
      HttpServletRequest request) {
    String header = request.getHeader(signatureHeaders.getOrDefault(source, DEFAULT_SIGNATURE_HEADER));
    ReceiveResult result = gateway.receive(source, body, header);
    return ResponseEntity.status(result.httpStatus())
        .contentType(MediaType.APPLICATION_JSON)
        .body("{\"status\":\"" + result.outcome().name().toLowerCase(Locale.ROOT) + "\"}");
  }
}
