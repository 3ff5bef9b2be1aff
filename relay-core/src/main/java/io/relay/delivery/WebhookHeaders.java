package io.relay.delivery;

/**
 * Headers sent with every outbound delivery.
 */
public final class WebhookHeaders {
  public static final String SIGNATURE = "X-Webhook-Signature";
  public static final String EVENT_TYPE = "X-Webhook-Event-Type";
  public static final String EVENT_ID = "X-Webhook-Event-Id";
  public static final String DELIVERY_ID = "X-Webhook-Delivery-Id";
  public static final String CONTENT_TYPE = "Content-Type";
  public static final String JSON = "application/json";

  private WebhookHeaders() {
  }
}
