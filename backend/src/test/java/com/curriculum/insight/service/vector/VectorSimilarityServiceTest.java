package com.curriculum.insight.service.vector;

import static com.curriculum.insight.fixtures.TestFixtures.TODAY;
import static com.curriculum.insight.fixtures.TestFixtures.vector;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.curriculum.insight.exception.DimensionMismatchException;
import com.curriculum.insight.fixtures.TestFixtures;

@DisplayName("VectorSimilarityService Tests")
class VectorSimilarityServiceTest {

  private VectorSimilarityService service;

  @BeforeEach
  void setUp() {
    service = new VectorSimilarityService(TestFixtures.fixedClock(), TestFixtures.properties());
  }

  @Nested
  @DisplayName("Cosine similarity")
  class CosineSimilarityTests {

    @Test
    @DisplayName("Should score a vector against itself as 1")
    void shouldScoreIdenticalVectorsAsOne() {
      List<Float> v = vector(0.3, -1.2, 4.5, 0.01);

      assertThat(service.cosineSimilarity(v, v)).isCloseTo(1.0, within(1e-9));
    }

    @Test
    @DisplayName("Should score opposite vectors as -1")
    void shouldScoreOppositeVectorsAsMinusOne() {
      assertThat(service.cosineSimilarity(vector(1, 2, 3), vector(-1, -2, -3)))
          .isCloseTo(-1.0, within(1e-9));
    }

    @Test
    @DisplayName("Should be symmetric")
    void shouldBeSymmetric() {
      List<Float> a = vector(0.2, 0.7, -0.1);
      List<Float> b = vector(0.9, -0.3, 0.4);

      assertThat(service.cosineSimilarity(a, b)).isEqualTo(service.cosineSimilarity(b, a));
    }

    @Test
    @DisplayName("Should score orthogonal vectors as 0")
    void shouldScoreOrthogonalVectorsAsZero() {
      assertThat(service.cosineSimilarity(vector(1, 0), vector(0, 1))).isEqualTo(0.0);
    }

    @Test
    @DisplayName("Should return 0 for zero-magnitude input")
    void shouldReturnZeroForZeroMagnitude() {
      assertThat(service.cosineSimilarity(vector(0, 0, 0), vector(1, 2, 3))).isEqualTo(0.0);
      assertThat(service.cosineSimilarity(vector(1, 2, 3), vector(0, 0, 0))).isEqualTo(0.0);
      assertThat(service.cosineSimilarity(vector(0, 0), vector(0, 0))).isEqualTo(0.0);
    }

    @Test
    @DisplayName("Should reject vectors of different length")
    void shouldRejectDimensionMismatch() {
      assertThatThrownBy(() -> service.cosineSimilarity(vector(1, 2), vector(1, 2, 3)))
          .isInstanceOf(DimensionMismatchException.class)
          .hasMessageContaining("2")
          .hasMessageContaining("3");
    }
  }

  @Nested
  @DisplayName("Recency")
  class RecencyTests {

    @Test
    @DisplayName("Should score today as 1, five years ago as 0 and unknown as 0.5")
    void shouldScoreBoundaries() {
      assertThat(service.recencyScore(TODAY)).isEqualTo(1.0);
      assertThat(service.recencyScore(TODAY.minusYears(5))).isEqualTo(0.0);
      assertThat(service.recencyScore(null)).isEqualTo(0.5);
    }

    @Test
    @DisplayName("Should decay linearly inside the window")
    void shouldDecayLinearly() {
      assertThat(service.recencyScore(TODAY.minusDays(365))).isCloseTo(0.8, within(1e-9));
      assertThat(service.recencyScore(TODAY.minusYears(10))).isEqualTo(0.0);
    }

    @Test
    @DisplayName("Should clamp future dates to 1")
    void shouldClampFutureDates() {
      assertThat(service.recencyScore(TODAY.plusDays(30))).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should treat the window boundary as inside")
    void shouldIncludeWindowBoundary() {
      assertThat(service.isWithinRecencyWindow(TODAY.minusYears(5))).isTrue();
      assertThat(service.isWithinRecencyWindow(TODAY.minusYears(5).minusDays(1))).isFalse();
      assertThat(service.isWithinRecencyWindow(null)).isFalse();
    }
  }

  @Nested
  @DisplayName("Score blending")
  class BlendingTests {

    @Test
    @DisplayName("Should blend similarity and recency by weight")
    void shouldBlendRecency() {
      assertThat(service.recencyWeightedScore(0.9, TODAY, 0.0)).isCloseTo(0.9, within(1e-9));
      assertThat(service.recencyWeightedScore(0.9, TODAY, 1.0)).isCloseTo(1.0, within(1e-9));
      assertThat(service.recencyWeightedScore(0.8, null, 0.5)).isCloseTo(0.65, within(1e-9));
    }

    @Test
    @DisplayName("Should weight composite score 0.6 / 0.3 / 0.1")
    void shouldComputeCompositeScore() {
      // 0.6 * 0.9 + 0.3 * 0.8 + 0.1 * 1.0
      assertThat(service.compositeScore(0.9, 80, TODAY)).isCloseTo(0.88, within(1e-9));
      // undated entries take the neutral recency score
      assertThat(service.compositeScore(1.0, 100, null)).isCloseTo(0.95, within(1e-9));
    }
  }
}
