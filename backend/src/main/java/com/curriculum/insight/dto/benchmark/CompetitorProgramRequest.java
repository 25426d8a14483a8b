package com.curriculum.insight.dto.benchmark;

import java.util.List;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A competitor program to import. Topics may be names or objects.")
public class CompetitorProgramRequest {

  @NotBlank(message = "Institution name is required")
  private String institutionName;

  @NotBlank(message = "Program name is required")
  private String programName;

  private String level;

  @NotNull(message = "Topics are required")
  private List<CompetitorTopic> topics;

  private CompetitorStructure structure;
}
