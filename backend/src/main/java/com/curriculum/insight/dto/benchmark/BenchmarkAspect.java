package com.curriculum.insight.dto.benchmark;

import com.fasterxml.jackson.annotation.JsonValue;

/** What a gap or strength is about. */
public enum BenchmarkAspect {
  TOPIC("topic"),
  ASSESSMENT("assessment"),
  STRUCTURE("structure");

  private final String value;

  BenchmarkAspect(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }
}
