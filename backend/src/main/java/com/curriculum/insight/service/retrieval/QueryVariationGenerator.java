package com.curriculum.insight.service.retrieval;

import java.util.List;

import org.springframework.stereotype.Component;

/** Expands a single query into phrasings that surface related material. */
@Component
public class QueryVariationGenerator {

  public List<String> generate(String query) {
    return List.of(
        query,
        String.format("What are the key concepts related to %s?", query),
        String.format("Explain %s in detail", query));
  }
}
