package com.curriculum.insight.dto.retrieval;

import java.util.List;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Optional search filters. Unset fields fall back to the configured retrieval defaults. */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Filters applied to a retrieval query")
public class RetrievalOptions {

  @Schema(
      description = "Only entries from these domains are considered",
      example = "[\"data-science\"]")
  private List<String> domains;

  @Schema(description = "Minimum credibility score (0-100)", example = "70")
  private Integer minCredibility;

  @Schema(description = "Minimum cosine similarity in [0,1]", example = "0.75")
  private Double minSimilarity;

  @Schema(description = "Maximum number of results", example = "10")
  private Integer limit;

  @Schema(description = "Weight of publication recency in [0,1]; 0 disables reweighting")
  private Double recencyWeight;
}
