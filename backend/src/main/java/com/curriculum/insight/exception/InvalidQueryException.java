package com.curriculum.insight.exception;

/** Malformed retrieval options; raised before any external call is made. */
public class InvalidQueryException extends IllegalArgumentException {

  public InvalidQueryException(String message) {
    super(message);
  }
}
