package com.curriculum.insight.dto.retrieval;

import java.time.LocalDate;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** A retrieved passage with the metadata needed to cite its source. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RetrievedContext {
  private String content;
  private String sourceId;
  private double relevanceScore;
  private String title;
  private String author;
  private String domain;
  private LocalDate publicationDate;
  private String sourceUrl;
  private int credibilityScore;
}
