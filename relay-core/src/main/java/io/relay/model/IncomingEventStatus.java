package io.relay.model;

public enum IncomingEventStatus {
  RECEIVED(0),
  PROCESSING(1),
  PROCESSED(2),
  ERROR(3);

  private final int code;

  IncomingEventStatus(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  public static IncomingEventStatus fromCode(int code) {
    for (IncomingEventStatus status : values()) {
      if (status.code == code) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown incoming event status code: " + code);
  }
}
