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
public class ContentWithCitations {
  private String content;
  private List<Citation> citations;
  private List<RetrievedContext> sources;
}
