package io.relay.model;

public enum IdempotencyStatus {
  LOCKED(0),
  COMPLETED(1);

  private final int code;

  IdempotencyStatus(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  public static IdempotencyStatus fromCode(int code) {
    for (IdempotencyStatus status : values()) {
      if (status.code == code) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown idempotency status code: " + code);
  }
}
