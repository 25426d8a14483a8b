package com.curriculum.insight.dto.benchmark;

import java.time.Instant;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CompetitorProgram {
  private String id;
  private String institutionName;
  private String programName;
  private String level;
  private List<CompetitorTopic> topics;
  private CompetitorStructure structure;
  private Instant createdAt;
}
