package com.curriculum.insight.dto.retrieval;

import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchResponse {
  private String query;
  private int totalResults;
  private List<RetrievalResult> results;
}
