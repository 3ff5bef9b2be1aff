package io.relay.incoming;

/**
 * Answer to an inbound webhook request.
 *
 * @param httpStatus status code to send to the sender
 * @param outcome    what the gateway did with the request
 * @param message    short reason, suitable for the response body
 */
public record ReceiveResult(int httpStatus, Outcome outcome, String message) {

  public enum Outcome {
    /** Stored and submitted for processing. */
    ACCEPTED(200),
    /** Already received earlier; acknowledged without reprocessing. */
    DUPLICATE(200),
    UNKNOWN_SOURCE(400),
    INVALID_SIGNATURE(400),
    /** Body bytes are not valid UTF-8. */
    INVALID_BODY(400),
    MISSING_EVENT_ID(400),
    /** Could not be stored; the sender should retry. */
    STORE_UNAVAILABLE(500);

    private final int httpStatus;

    Outcome(int httpStatus) {
      this.httpStatus = httpStatus;
    }

    public int httpStatus() {
      return httpStatus;
    }
  }

  static ReceiveResult of(Outcome outcome, String message) {
    return new ReceiveResult(outcome.httpStatus(), outcome, message);
  }

  public boolean acknowledged() {
    return httpStatus == 200;
  }
}
