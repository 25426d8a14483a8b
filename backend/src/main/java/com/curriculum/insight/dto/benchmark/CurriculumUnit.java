package com.curriculum.insight.dto.benchmark;

import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** One unit of the generated curriculum. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CurriculumUnit {
  private String unitTitle;

  /** Free text; topics are separated by commas, semicolons, full stops or new lines. */
  private String indicativeContent;

  private List<String> assessmentMethods;
  private Double hours;
}
