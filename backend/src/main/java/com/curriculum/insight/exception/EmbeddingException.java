package com.curriculum.insight.exception;

import lombok.Getter;

/** Failure reported by the embedding provider boundary. */
@Getter
public class EmbeddingException extends RuntimeException {

  public enum Reason {
    PROVIDER_ERROR,
    TIMEOUT,
    RATE_LIMITED,
    INTERRUPTED
  }

  private final Reason reason;

  public EmbeddingException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public EmbeddingException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public boolean isRateLimited() {
    return reason == Reason.RATE_LIMITED;
  }

  public boolean isTimeout() {
    return reason == Reason.TIMEOUT;
  }
}
