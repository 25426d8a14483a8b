package com.curriculum.insight.dto.benchmark;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Strength {
  private BenchmarkAspect type;
  private String description;
  private String advantage;
}
