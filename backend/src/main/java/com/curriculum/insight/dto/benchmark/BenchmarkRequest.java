package com.curriculum.insight.dto.benchmark;

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
@Schema(description = "Benchmark a generated curriculum against every stored competitor program")
public class BenchmarkRequest {

  @NotBlank(message = "Program id is required")
  private String programId;

  @NotNull(message = "Curriculum is required")
  private GeneratedCurriculum curriculum;
}
