package com.curriculum.insight.dto.benchmark;

import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Outcome of comparing the generated curriculum with a single competitor program. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompetitorComparison {
  private InstitutionComparison comparison;
  private List<Gap> gaps;
  private List<Strength> strengths;
}
