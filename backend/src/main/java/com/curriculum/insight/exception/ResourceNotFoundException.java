package com.curriculum.insight.exception;

public class ResourceNotFoundException extends RuntimeException {

  public ResourceNotFoundException(String resource, String id) {
    super(String.format("%s not found: %s", resource, id));
  }
}
