package com.ritbot.hft.rit.client;

import lombok.Getter;

/**
 * Failure talking to the venue. {@link Kind#TRANSIENT} covers timeouts and connection errors.
 */
@Getter
public class ExchangeException extends RuntimeException {

  public enum Kind {
    TRANSIENT,
    REJECTED,
    MALFORMED
  }

  private final Kind kind;
  private final int statusCode;

  public ExchangeException(Kind kind, int statusCode, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.statusCode = statusCode;
  }

  public static ExchangeException transientFailure(String operation, Throwable cause) {
    return new ExchangeException(Kind.TRANSIENT, -1,
        "%s failed: %s".formatted(operation, cause == null ? "unknown" : cause.toString()), cause);
  }

  public static ExchangeException rejected(String operation, int statusCode, String body) {
    return new ExchangeException(Kind.REJECTED, statusCode,
        "%s rejected status=%d body=%s".formatted(operation, statusCode, abbreviate(body)), null);
  }

  public static ExchangeException malformed(String operation, String detail) {
    return new ExchangeException(Kind.MALFORMED, -1,
        "%s returned malformed payload: %s".formatted(operation, detail), null);
  }

  public boolean isTransient() {
    return kind == Kind.TRANSIENT;
  }

  private static String abbreviate(String body) {
    if (body == null) {
      return "";
    }
    return body.length() <= 200 ? body : body.substring(0, 200) + "...";
  }
}
