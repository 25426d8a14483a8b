package com.curriculum.insight.dto.retrieval;

import com.curriculum.insight.service.corpus.EmbeddedEntry;

import lombok.Builder;
import lombok.Value;

/**
 * One ranked match. {@code similarityScore} is the score the ranking used, which is not the raw
 * cosine value once recency or composite weighting has been applied.
 */
@Value
@Builder(toBuilder = true)
public class RetrievalResult {
  EmbeddedEntry entry;
  double similarityScore;
  int rank;
}
