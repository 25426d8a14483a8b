package com.curriculum.insight.dto.benchmark;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Gap {
  private BenchmarkAspect type;
  private String description;
  private String competitorInstitution;
  private GapSeverity severity;
  private String recommendation;

  /** Best similarity of the competitor topic against any generated topic. */
  private double bestMatchSimilarity;
}
