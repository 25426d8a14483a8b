package com.curriculum.insight.dto.benchmark;

import java.time.Instant;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BenchmarkReport {
  private String programId;
  private Instant generatedAt;
  private List<InstitutionComparison> comparisons;

  /** Mean of the comparison scores, rounded half up. */
  private int overallSimilarity;

  private List<Gap> gaps;
  private List<Strength> strengths;
  private List<String> recommendations;
  private String summary;
}
