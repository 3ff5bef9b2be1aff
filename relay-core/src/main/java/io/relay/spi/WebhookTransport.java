package io.relay.spi;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Sends one signed webhook request. Implementations must honour the request timeout.
 *
 * @see io.relay.http.HttpClientWebhookTransport
 */
public interface WebhookTransport {

    /**
     * POSTs the request body to the request URL.
     *
     * @return the response; non-2xx statuses are returned, not thrown
     * @throws IOException on timeout, connection failure or other network error
     */
    Response send(Request request) throws IOException;

    /**
     * An outbound request.
     *
     * @param url     target URL
     * @param headers request headers, including the signature
     * @param body    JSON body
     * @param timeout bound on the whole exchange
     */
    record Request(String url, Map<String, String> headers, String body, Duration timeout) {
        public Request {
            Objects.requireNonNull(url, "url");
            Objects.requireNonNull(body, "body");
            Objects.requireNonNull(timeout, "timeout");
            headers = Map.copyOf(headers);
        }
    }

    /**
     * A response received from the endpoint.
     *
     * @param statusCode HTTP status
     * @param body       response body, possibly truncated by the transport
     */
    record Response(int statusCode, String body) {
        public boolean isSuccessful() {
            return statusCode >= 200 && statusCode < 300;
        }
    }
}
