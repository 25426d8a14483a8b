package com.curriculum.insight.dto.benchmark;

import com.fasterxml.jackson.annotation.JsonValue;

public enum GapSeverity {
  HIGH("high"),
  MEDIUM("medium"),
  LOW("low");

  private final String value;

  GapSeverity(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }
}
