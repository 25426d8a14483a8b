package com.curriculum.insight.service.corpus;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * An embedded chunk of a knowledge-corpus document. Entries are created on ingestion and never
 * modified afterwards; they are only removed by id or by predicate.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class EmbeddedEntry {

  /** Unique identifier. */
  private String id;

  /** Text payload of the chunk. */
  private String content;

  /** Embedding vector; dimensionality is fixed per corpus. Never serialized in responses. */
  @JsonProperty(access = JsonProperty.Access.WRITE_ONLY)
  private List<Float> vector;

  /** Category tag (e.g. "data-science"). */
  private String domain;

  /** Source credibility, 0-100. */
  private int credibilityScore;

  /** Publication date; null means unknown recency. */
  private LocalDate publicationDate;

  private Set<String> tags;

  /** Foundational sources are exempt from recency filtering. */
  @JsonProperty("isFoundational")
  private boolean foundational;

  private String title;
  private String author;
  private String sourceUrl;

  /** Origin of the document: pdf, docx, url or manual. */
  private String sourceType;

  private Instant createdAt;
}
