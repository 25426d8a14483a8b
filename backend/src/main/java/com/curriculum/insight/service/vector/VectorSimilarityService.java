package com.curriculum.insight.service.vector;

import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;

import org.springframework.stereotype.Service;

import com.curriculum.insight.config.ApplicationProperties;
import com.curriculum.insight.exception.DimensionMismatchException;

import lombok.RequiredArgsConstructor;

/**
 * Similarity and ranking primitives shared by retrieval and benchmarking: cosine similarity over
 * embeddings, linear recency decay, and the two score-blending modes.
 */
@Service
@RequiredArgsConstructor
public class VectorSimilarityService {

  /** Score given to entries whose publication date is unknown. */
  public static final double NEUTRAL_RECENCY_SCORE = 0.5;

  static final double COMPOSITE_SIMILARITY_WEIGHT = 0.6;
  static final double COMPOSITE_CREDIBILITY_WEIGHT = 0.3;
  static final double COMPOSITE_RECENCY_WEIGHT = 0.1;

  private static final double DAYS_PER_YEAR = 365.0;

  private final Clock clock;
  private final ApplicationProperties properties;

  /**
   * Calculate cosine similarity between two embedding vectors.
   *
   * @param embedding1 First embedding vector
   * @param embedding2 Second embedding vector
   * @return Cosine similarity between -1 and 1, or 0 when either vector has zero magnitude
   * @throws DimensionMismatchException if the vectors differ in length
   */
  public double cosineSimilarity(List<Float> embedding1, List<Float> embedding2) {
    if (embedding1.size() != embedding2.size()) {
      throw new DimensionMismatchException(embedding1.size(), embedding2.size());
    }

    double dotProduct = 0.0;
    double norm1 = 0.0;
    double norm2 = 0.0;

    for (int i = 0; i < embedding1.size(); i++) {
      double a = embedding1.get(i);
      double b = embedding2.get(i);
      dotProduct += a * b;
      norm1 += a * a;
      norm2 += b * b;
    }

    if (norm1 == 0.0 || norm2 == 0.0) {
      return 0.0;
    }

    double similarity = dotProduct / (Math.sqrt(norm1) * Math.sqrt(norm2));
    // Floating-point noise can push identical vectors marginally past 1
    return Math.max(-1.0, Math.min(1.0, similarity));
  }

  /**
   * Recency score in [0,1]: 1.0 for today, decaying linearly to 0 at the end of the recency
   * window. Unknown dates score {@value #NEUTRAL_RECENCY_SCORE}.
   */
  public double recencyScore(LocalDate publicationDate) {
    if (publicationDate == null) {
      return NEUTRAL_RECENCY_SCORE;
    }
    double ageInYears = ChronoUnit.DAYS.between(publicationDate, today()) / DAYS_PER_YEAR;
    double score = 1.0 - ageInYears / recencyWindowYears();
    return Math.max(0.0, Math.min(1.0, score));
  }

  /** True when the publication date falls inside the recency window (inclusive). */
  public boolean isWithinRecencyWindow(LocalDate publicationDate) {
    return publicationDate != null
        && !publicationDate.isBefore(today().minusYears(recencyWindowYears()));
  }

  /** {@code similarity * (1 - recencyWeight) + recencyScore * recencyWeight}. */
  public double recencyWeightedScore(
      double similarity, LocalDate publicationDate, double recencyWeight) {
    return similarity * (1 - recencyWeight) + recencyScore(publicationDate) * recencyWeight;
  }

  /** {@code 0.6 * similarity + 0.3 * credibility/100 + 0.1 * recency}. */
  public double compositeScore(double similarity, int credibilityScore, LocalDate publicationDate) {
    return similarity * COMPOSITE_SIMILARITY_WEIGHT
        + (credibilityScore / 100.0) * COMPOSITE_CREDIBILITY_WEIGHT
        + recencyScore(publicationDate) * COMPOSITE_RECENCY_WEIGHT;
  }

  /** The current date in the configured clock's zone. */
  public LocalDate today() {
    return LocalDate.now(clock);
  }

  private int recencyWindowYears() {
    return properties.getRetrieval().getRecencyWindowYears();
  }
}
