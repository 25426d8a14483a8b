package com.curriculum.insight.service.retrieval;

/**
 * How retrieval admits corpus entries that have no publication date and are not foundational.
 * Foundational entries are always admitted; dated entries are admitted when inside the recency
 * window.
 */
public enum UndatedEntryPolicy {
  /** Undated entries pass the recency filter. */
  INCLUDE,
  /** Undated entries are filtered out. */
  EXCLUDE
}
