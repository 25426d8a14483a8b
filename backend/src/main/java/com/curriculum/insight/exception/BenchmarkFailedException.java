package com.curriculum.insight.exception;

import lombok.Getter;

@Getter
public class BenchmarkFailedException extends RuntimeException {

  private final String programId;

  public BenchmarkFailedException(String programId, Throwable cause) {
    super(
        (programId != null
                ? String.format("Benchmarking failed for program '%s': ", programId)
                : "Benchmarking failed: ")
            + (cause != null ? cause.getMessage() : "unknown error"),
        cause);
    this.programId = programId;
  }
}
