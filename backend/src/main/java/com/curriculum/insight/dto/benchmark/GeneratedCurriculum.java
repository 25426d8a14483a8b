package com.curriculum.insight.dto.benchmark;

import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GeneratedCurriculum {

  /** Declared program hours; when absent the unit hours are summed. */
  private Double totalHours;

  private List<CurriculumUnit> units;
}
