package com.curriculum.insight.service.benchmark;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

import org.springframework.stereotype.Component;

import com.curriculum.insight.config.ApplicationProperties;
import com.curriculum.insight.dto.benchmark.CompetitorStructure;
import com.curriculum.insight.dto.benchmark.CurriculumUnit;
import com.curriculum.insight.dto.benchmark.GeneratedCurriculum;

import lombok.RequiredArgsConstructor;

/**
 * Alignment sub-scores of a curriculum against one competitor. All scores are unrounded
 * percentages in [0,100].
 */
@Component
@RequiredArgsConstructor
public class AlignmentCalculator {

  /** Score used when the competitor supplies no data for an aspect. */
  static final double NEUTRAL_SCORE = 50.0;

  static final double TOPIC_WEIGHT = 0.5;
  static final double ASSESSMENT_WEIGHT = 0.25;
  static final double STRUCTURE_WEIGHT = 0.25;

  /** Module-count differences are penalised at half the rate of hour differences. */
  static final double MODULE_PENALTY_FACTOR = 50.0;

  private final ApplicationProperties properties;

  /**
   * Share of generated topics whose best match against the competitor exceeds the coverage
   * threshold. The denominator is always the full generated-topic count.
   *
   * @param generatedBestMatches best similarity per generated topic
   */
  public double topicCoverage(double[] generatedBestMatches) {
    if (generatedBestMatches.length == 0) {
      return 0.0;
    }
    double threshold = properties.getBenchmark().getCoverageThreshold();
    long covered = 0;
    for (double best : generatedBestMatches) {
      if (best > threshold) {
        covered++;
      }
    }
    return covered * 100.0 / generatedBestMatches.length;
  }

  /**
   * Share of competitor assessment types matched by a generated assessment method, comparing
   * lowercase strings by containment in either direction.
   */
  public double assessmentAlignment(List<CurriculumUnit> units, CompetitorStructure structure) {
    List<String> competitorTypes = structure == null ? null : structure.getAssessmentTypes();
    if (competitorTypes == null || competitorTypes.isEmpty()) {
      return NEUTRAL_SCORE;
    }

    Set<String> generatedTypes =
        assessmentMethods(units).stream()
            .map(method -> method.toLowerCase(Locale.ROOT))
            .collect(Collectors.toSet());

    long matched =
        competitorTypes.stream()
            .filter(Objects::nonNull)
            .map(type -> type.toLowerCase(Locale.ROOT))
            .filter(type -> matchesAny(type, generatedTypes))
            .count();

    return Math.min(100.0, matched * 100.0 / competitorTypes.size());
  }

  /**
   * Mean of the hours-closeness and module-count-closeness sub-scores that can be computed from
   * the competitor's data; {@value #NEUTRAL_SCORE} when neither can.
   */
  public double structureAlignment(GeneratedCurriculum curriculum, CompetitorStructure structure) {
    if (structure == null) {
      return NEUTRAL_SCORE;
    }

    double total = 0.0;
    int factors = 0;

    Double competitorHours = structure.getTotalHours();
    if (competitorHours != null && competitorHours > 0) {
      double hoursDifference = Math.abs(generatedHours(curriculum) - competitorHours);
      total += Math.max(0.0, 100.0 - hoursDifference / competitorHours * 100.0);
      factors++;
    }

    if (structure.getModules() != null && !structure.getModules().isEmpty()) {
      int competitorModules = structure.getModules().size();
      int generatedModules = units(curriculum).size();
      double moduleDifference = Math.abs(generatedModules - competitorModules);
      total +=
          Math.max(0.0, 100.0 - moduleDifference / competitorModules * MODULE_PENALTY_FACTOR);
      factors++;
    }

    return factors > 0 ? total / factors : NEUTRAL_SCORE;
  }

  /** {@code 0.5 * topicCoverage + 0.25 * assessmentAlignment + 0.25 * structureAlignment}. */
  public double similarityScore(
      double topicCoverage, double assessmentAlignment, double structureAlignment) {
    return topicCoverage * TOPIC_WEIGHT
        + assessmentAlignment * ASSESSMENT_WEIGHT
        + structureAlignment * STRUCTURE_WEIGHT;
  }

  /**
   * Total program hours: the declared total, else the sum of unit hours, else the configured
   * default.
   */
  double generatedHours(GeneratedCurriculum curriculum) {
    Double declared = curriculum == null ? null : curriculum.getTotalHours();
    if (declared != null && declared > 0) {
      return declared;
    }
    double unitHours =
        units(curriculum).stream()
            .map(CurriculumUnit::getHours)
            .filter(Objects::nonNull)
            .mapToDouble(Double::doubleValue)
            .sum();
    return unitHours > 0 ? unitHours : properties.getBenchmark().getDefaultProgramHours();
  }

  /** Distinct assessment methods across all units, as written. */
  static Set<String> assessmentMethods(List<CurriculumUnit> units) {
    if (units == null) {
      return Set.of();
    }
    return units.stream()
        .map(CurriculumUnit::getAssessmentMethods)
        .filter(Objects::nonNull)
        .flatMap(List::stream)
        .filter(Objects::nonNull)
        .collect(Collectors.toSet());
  }

  private static boolean matchesAny(String competitorType, Set<String> generatedTypes) {
    return generatedTypes.stream()
        .anyMatch(
            generated -> generated.contains(competitorType) || competitorType.contains(generated));
  }

  private static List<CurriculumUnit> units(GeneratedCurriculum curriculum) {
    return curriculum == null || curriculum.getUnits() == null
        ? List.of()
        : curriculum.getUnits();
  }
}
