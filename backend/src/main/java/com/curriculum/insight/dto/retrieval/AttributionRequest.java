package com.curriculum.insight.dto.retrieval;

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
@Schema(description = "Content to annotate with a reference list built from its sources")
public class AttributionRequest {

  @NotBlank(message = "Content is required")
  private String content;

  @NotNull(message = "Sources are required")
  private List<RetrievedContext> sources;
}
