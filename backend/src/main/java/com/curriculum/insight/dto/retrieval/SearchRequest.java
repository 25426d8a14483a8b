package com.curriculum.insight.dto.retrieval;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Single-query search request")
public class SearchRequest {

  @NotBlank(message = "Query is required")
  @Schema(description = "Free-text query", example = "data visualization best practices")
  private String query;

  private RetrievalOptions options;
}
