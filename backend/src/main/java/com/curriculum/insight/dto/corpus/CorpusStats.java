package com.curriculum.insight.dto.corpus;

import java.util.Map;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CorpusStats {
  private long totalDocuments;
  private int averageCredibility;
  private Map<String, Long> domainDistribution;
}
