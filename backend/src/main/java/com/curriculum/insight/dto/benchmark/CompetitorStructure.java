package com.curriculum.insight.dto.benchmark;

import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Program structure as declared by the competitor. Every field is optional. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompetitorStructure {
  private Double totalHours;
  private List<CompetitorModule> modules;
  private List<String> assessmentTypes;
  private List<String> deliveryMethods;
}
