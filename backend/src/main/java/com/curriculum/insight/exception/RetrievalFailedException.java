package com.curriculum.insight.exception;

import lombok.Getter;

@Getter
public class RetrievalFailedException extends RuntimeException {

  private final String operation;
  private final String query;

  public RetrievalFailedException(String operation, String query, Throwable cause) {
    super(
        String.format(
            "%s failed for query '%s': %s",
            operation, abbreviate(query), cause != null ? cause.getMessage() : "unknown error"),
        cause);
    this.operation = operation;
    this.query = query;
  }

  private static String abbreviate(String query) {
    if (query == null) {
      return "";
    }
    return query.length() <= 80 ? query : query.substring(0, 80) + "...";
  }
}
