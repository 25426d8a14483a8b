package com.curriculum.insight.dto.benchmark;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Scores against one competitor, each rounded to an integer in [0,100]. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InstitutionComparison {
  private String institutionName;
  private String programName;
  private int similarityScore;
  private int topicCoverage;
  private int assessmentAlignment;
  private int structureAlignment;
}
