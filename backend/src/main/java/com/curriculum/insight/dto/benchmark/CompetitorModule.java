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
public class CompetitorModule {
  private String code;
  private String title;
  private Double hours;
  private List<String> topics;
}
