package com.curriculum.insight.dto.corpus;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonProperty;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A document chunk to add to the knowledge corpus")
public class IndexEntryRequest {

  @NotBlank(message = "Content is required")
  private String content;

  @NotBlank(message = "Domain is required")
  private String domain;

  @Min(value = 0, message = "Credibility score must be between 0 and 100")
  @Max(value = 100, message = "Credibility score must be between 0 and 100")
  private int credibilityScore;

  private LocalDate publicationDate;

  private Set<String> tags;

  @JsonProperty("isFoundational")
  private boolean foundational;

  private String title;
  private String author;
  private String sourceUrl;
  private String sourceType;

  @Schema(description = "Precomputed embedding; generated from content when absent")
  private List<Float> vector;
}
