package com.curriculum.insight.service.benchmark;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

import org.springframework.stereotype.Component;

import com.curriculum.insight.config.ApplicationProperties;
import com.curriculum.insight.dto.benchmark.Gap;
import com.curriculum.insight.dto.benchmark.GapSeverity;
import com.curriculum.insight.dto.benchmark.InstitutionComparison;
import com.curriculum.insight.dto.benchmark.Strength;

import lombok.RequiredArgsConstructor;

/** Rule-based recommendations and summary text for a benchmark report. */
@Component
@RequiredArgsConstructor
public class RecommendationGenerator {

  static final String NO_GAPS_RECOMMENDATION =
      "Curriculum demonstrates excellent coverage compared to competitors. "
          + "Continue monitoring industry trends.";
  static final String WELL_ALIGNED_RECOMMENDATION =
      "Curriculum is well-aligned with competitor offerings";

  private static final double STRONG_ALIGNMENT = 80;
  private static final double MODERATE_ALIGNMENT = 60;

  private final ApplicationProperties properties;

  public List<String> recommendations(List<Gap> gaps, List<Strength> strengths) {
    List<String> recommendations = new ArrayList<>();

    List<Gap> highSeverity = bySeverity(gaps, GapSeverity.HIGH);
    long mediumSeverity = gaps.stream().filter(g -> g.getSeverity() == GapSeverity.MEDIUM).count();

    if (!highSeverity.isEmpty()) {
      recommendations.add(
          String.format(
              "Priority: Address %d high-severity content gaps to ensure curriculum"
                  + " competitiveness",
              highSeverity.size()));
      highSeverity.stream()
          .sorted(Comparator.comparingDouble(Gap::getBestMatchSimilarity))
          .limit(properties.getBenchmark().getMaxHighSeverityCallouts())
          .map(Gap::getRecommendation)
          .forEach(recommendations::add);
    }

    if (mediumSeverity > 0) {
      recommendations.add(
          String.format(
              "Consider addressing %d medium-severity gaps to enhance curriculum depth",
              mediumSeverity));
    }

    if (!strengths.isEmpty()) {
      recommendations.add(
          String.format(
              "Leverage %d unique strengths in marketing materials to differentiate from"
                  + " competitors",
              strengths.size()));
    }

    if (gaps.isEmpty()) {
      recommendations.add(NO_GAPS_RECOMMENDATION);
    }

    if (recommendations.isEmpty()) {
      recommendations.add(WELL_ALIGNED_RECOMMENDATION);
    }
    return recommendations;
  }

  public String summary(
      List<InstitutionComparison> comparisons, List<Gap> gaps, List<Strength> strengths) {
    double averageSimilarity =
        comparisons.stream()
            .mapToInt(InstitutionComparison::getSimilarityScore)
            .average()
            .orElse(0);

    StringBuilder summary = new StringBuilder();
    summary.append(
        String.format(
            "Benchmarking analysis compared the generated curriculum against %d competitor"
                + " institution(s). ",
            comparisons.size()));
    summary.append(
        String.format(
            "The overall similarity score is %d%%, indicating ", Math.round(averageSimilarity)));

    if (averageSimilarity >= STRONG_ALIGNMENT) {
      summary.append("strong alignment with industry standards. ");
    } else if (averageSimilarity >= MODERATE_ALIGNMENT) {
      summary.append("moderate alignment with opportunities for enhancement. ");
    } else {
      summary.append("significant opportunities for improvement to match competitor offerings. ");
    }

    summary.append(
        String.format(
            "Analysis identified %d content gap(s) and %d unique strength(s). ",
            gaps.size(), strengths.size()));

    int highSeverity = bySeverity(gaps, GapSeverity.HIGH).size();
    if (highSeverity > 0) {
      summary.append(
          String.format("%d high-priority gap(s) require immediate attention. ", highSeverity));
    }
    return summary.toString().trim();
  }

  private static List<Gap> bySeverity(List<Gap> gaps, GapSeverity severity) {
    return gaps.stream().filter(g -> g.getSeverity() == severity).collect(Collectors.toList());
  }
}
