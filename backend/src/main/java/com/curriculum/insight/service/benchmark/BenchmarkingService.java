package com.curriculum.insight.service.benchmark;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;

import com.curriculum.insight.config.ApplicationProperties;
import com.curriculum.insight.dto.benchmark.BenchmarkAspect;
import com.curriculum.insight.dto.benchmark.BenchmarkReport;
import com.curriculum.insight.dto.benchmark.CompetitorComparison;
import com.curriculum.insight.dto.benchmark.CompetitorProgram;
import com.curriculum.insight.dto.benchmark.CompetitorStructure;
import com.curriculum.insight.dto.benchmark.CompetitorTopic;
import com.curriculum.insight.dto.benchmark.Gap;
import com.curriculum.insight.dto.benchmark.GapSeverity;
import com.curriculum.insight.dto.benchmark.GeneratedCurriculum;
import com.curriculum.insight.dto.benchmark.InstitutionComparison;
import com.curriculum.insight.dto.benchmark.Strength;
import com.curriculum.insight.exception.BenchmarkFailedException;
import com.curriculum.insight.exception.DimensionMismatchException;
import com.curriculum.insight.exception.ResourceNotFoundException;
import com.curriculum.insight.service.vector.EmbeddingService;
import com.curriculum.insight.service.vector.VectorSimilarityService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Benchmarks a generated curriculum against competitor programs.
 *
 * <p>For every competitor the generated and competitor topics are compared pairwise by embedding
 * similarity. A competitor topic without a close enough generated counterpart is a gap; a
 * generated topic without a close enough competitor counterpart is a strength. Topic coverage,
 * assessment alignment and structure alignment are blended into one score per competitor.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BenchmarkingService {

  static final String NO_COMPETITORS_RECOMMENDATION =
      "No competitor programs available for comparison";
  static final String NO_COMPETITORS_SUMMARY = "No competitor data available for benchmarking";
  static final String UNIQUE_TOPIC_ADVANTAGE =
      "This topic provides additional coverage not found in competitor programs";

  private final CompetitorStore competitorStore;
  private final BenchmarkReportStore reportStore;
  private final TopicExtractor topicExtractor;
  private final AlignmentCalculator alignmentCalculator;
  private final RecommendationGenerator recommendationGenerator;
  private final EmbeddingService embeddingService;
  private final VectorSimilarityService similarityService;
  private final ApplicationProperties properties;
  private final Clock clock;

  /**
   * Benchmark a curriculum against every stored competitor program and keep the report as the
   * latest for the program.
   *
   * @param programId identifier of the generated program
   * @param curriculum the generated curriculum
   * @return the new report
   * @throws BenchmarkFailedException if embedding or scoring fails
   */
  public BenchmarkReport benchmark(String programId, GeneratedCurriculum curriculum) {
    Set<String> topics = topicExtractor.extractTopics(curriculum.getUnits());
    BenchmarkReport report =
        compareCurriculum(programId, topics, curriculum, competitorStore.list());
    reportStore.save(report);
    return report;
  }

  /** The latest report produced for a program. */
  public BenchmarkReport getLatestReport(String programId) {
    return reportStore
        .findLatest(programId)
        .orElseThrow(() -> new ResourceNotFoundException("Benchmark report", programId));
  }

  /**
   * Compare extracted topics against the given competitors. With no competitors the report is
   * empty and carries a single recommendation explaining why.
   *
   * @param programId identifier of the generated program
   * @param topics topics of the generated curriculum
   * @param curriculum the generated curriculum, for assessment and structure alignment
   * @param competitors competitor programs to compare against
   * @return a freshly built report
   */
  public BenchmarkReport compareCurriculum(
      String programId,
      Set<String> topics,
      GeneratedCurriculum curriculum,
      List<CompetitorProgram> competitors) {
    if (competitors.isEmpty()) {
      log.info("No competitor programs available, returning empty report for {}", programId);
      return BenchmarkReport.builder()
          .programId(programId)
          .generatedAt(Instant.now(clock))
          .comparisons(List.of())
          .overallSimilarity(0)
          .gaps(List.of())
          .strengths(List.of())
          .recommendations(List.of(NO_COMPETITORS_RECOMMENDATION))
          .summary(NO_COMPETITORS_SUMMARY)
          .build();
    }

    try {
      Map<String, List<Float>> embeddings = embedTopics(topics, competitors);

      List<InstitutionComparison> comparisons = new ArrayList<>();
      List<Gap> gaps = new ArrayList<>();
      List<Strength> strengths = new ArrayList<>();
      for (CompetitorProgram competitor : competitors) {
        CompetitorComparison result = compare(topics, curriculum, competitor, embeddings);
        comparisons.add(result.getComparison());
        gaps.addAll(result.getGaps());
        strengths.addAll(result.getStrengths());
      }

      double mean =
          comparisons.stream()
              .mapToInt(InstitutionComparison::getSimilarityScore)
              .average()
              .orElse(0);

      BenchmarkReport report =
          BenchmarkReport.builder()
              .programId(programId)
              .generatedAt(Instant.now(clock))
              .comparisons(comparisons)
              .overallSimilarity((int) Math.round(mean))
              .gaps(gaps)
              .strengths(strengths)
              .recommendations(recommendationGenerator.recommendations(gaps, strengths))
              .summary(recommendationGenerator.summary(comparisons, gaps, strengths))
              .build();

      log.info(
          "Benchmarked program {} against {} competitor(s): overall similarity {}, {} gap(s), {}"
              + " strength(s)",
          programId,
          competitors.size(),
          report.getOverallSimilarity(),
          gaps.size(),
          strengths.size());
      return report;

    } catch (RuntimeException e) {
      log.error("Benchmark failed for program {}: {}", programId, e.getMessage());
      throw new BenchmarkFailedException(programId, e);
    }
  }

  /**
   * Compare the generated topics with a single competitor.
   *
   * @param programId identifier of the generated program, reported on failure
   * @throws BenchmarkFailedException if a topic cannot be embedded or scoring fails
   */
  public CompetitorComparison compareWithCompetitor(
      String programId,
      Set<String> topics,
      GeneratedCurriculum curriculum,
      CompetitorProgram competitor) {
    try {
      return compare(topics, curriculum, competitor, embedTopics(topics, List.of(competitor)));
    } catch (RuntimeException e) {
      log.error(
          "Comparison of program {} with {} failed: {}",
          programId,
          competitor.getInstitutionName(),
          e.getMessage());
      throw new BenchmarkFailedException(programId, e);
    }
  }

  private CompetitorComparison compare(
      Set<String> topics,
      GeneratedCurriculum curriculum,
      CompetitorProgram competitor,
      Map<String, List<Float>> embeddings) {
    List<String> generated = new ArrayList<>(topics);
    List<String> competitorTopics = topicNames(competitor);

    double[][] similarities = new double[generated.size()][competitorTopics.size()];
    for (int i = 0; i < generated.size(); i++) {
      for (int j = 0; j < competitorTopics.size(); j++) {
        similarities[i][j] = similarity(embeddings, generated.get(i), competitorTopics.get(j));
      }
    }

    // Negative similarity counts as no match, so best matches start at zero
    double[] generatedBest = new double[generated.size()];
    double[] competitorBest = new double[competitorTopics.size()];
    for (int i = 0; i < generated.size(); i++) {
      for (int j = 0; j < competitorTopics.size(); j++) {
        generatedBest[i] = Math.max(generatedBest[i], similarities[i][j]);
        competitorBest[j] = Math.max(competitorBest[j], similarities[i][j]);
      }
    }

    double topicCoverage = alignmentCalculator.topicCoverage(generatedBest);
    double assessmentAlignment =
        alignmentCalculator.assessmentAlignment(curriculum.getUnits(), competitor.getStructure());
    double structureAlignment =
        alignmentCalculator.structureAlignment(curriculum, competitor.getStructure());
    double similarityScore =
        alignmentCalculator.similarityScore(topicCoverage, assessmentAlignment, structureAlignment);

    InstitutionComparison comparison =
        InstitutionComparison.builder()
            .institutionName(competitor.getInstitutionName())
            .programName(competitor.getProgramName())
            .similarityScore((int) Math.round(similarityScore))
            .topicCoverage((int) Math.round(topicCoverage))
            .assessmentAlignment((int) Math.round(assessmentAlignment))
            .structureAlignment((int) Math.round(structureAlignment))
            .build();

    log.debug(
        "{} / {}: coverage {}, assessment {}, structure {}",
        competitor.getInstitutionName(),
        competitor.getProgramName(),
        comparison.getTopicCoverage(),
        comparison.getAssessmentAlignment(),
        comparison.getStructureAlignment());

    return CompetitorComparison.builder()
        .comparison(comparison)
        .gaps(identifyGaps(competitorTopics, competitorBest, competitor.getInstitutionName()))
        .strengths(identifyStrengths(generated, generatedBest, curriculum, competitor))
        .build();
  }

  private List<Gap> identifyGaps(
      List<String> competitorTopics, double[] competitorBest, String institution) {
    ApplicationProperties.Benchmark thresholds = properties.getBenchmark();
    List<Gap> gaps = new ArrayList<>();

    for (int j = 0; j < competitorTopics.size(); j++) {
      double best = competitorBest[j];
      if (best >= thresholds.getGapThreshold()) {
        continue;
      }
      String topic = competitorTopics.get(j);
      gaps.add(
          Gap.builder()
              .type(BenchmarkAspect.TOPIC)
              .description(
                  String.format(
                      "Topic \"%s\" is covered by %s but not adequately addressed in the"
                          + " generated curriculum",
                      topic, institution))
              .competitorInstitution(institution)
              .severity(severity(best))
              .recommendation(
                  String.format(
                      "Consider adding content on \"%s\" to improve curriculum comprehensiveness",
                      topic))
              .bestMatchSimilarity(best)
              .build());
    }
    return gaps;
  }

  private List<Strength> identifyStrengths(
      List<String> generated,
      double[] generatedBest,
      GeneratedCurriculum curriculum,
      CompetitorProgram competitor) {
    double threshold = properties.getBenchmark().getStrengthThreshold();
    List<Strength> strengths = new ArrayList<>();

    for (int i = 0; i < generated.size(); i++) {
      if (generatedBest[i] < threshold) {
        strengths.add(
            Strength.builder()
                .type(BenchmarkAspect.TOPIC)
                .description(String.format("Unique topic: \"%s\"", generated.get(i)))
                .advantage(UNIQUE_TOPIC_ADVANTAGE)
                .build());
      }
    }

    CompetitorStructure structure = competitor.getStructure();
    if (structure != null && structure.getAssessmentTypes() != null) {
      int generatedTypes = AlignmentCalculator.assessmentMethods(curriculum.getUnits()).size();
      int competitorTypes = structure.getAssessmentTypes().size();
      if (generatedTypes > competitorTypes) {
        strengths.add(
            Strength.builder()
                .type(BenchmarkAspect.ASSESSMENT)
                .description("More diverse assessment methods")
                .advantage(
                    String.format(
                        "Curriculum includes %d assessment types compared to competitor's %d",
                        generatedTypes, competitorTypes))
                .build());
      }
    }
    return strengths;
  }

  private GapSeverity severity(double bestMatch) {
    ApplicationProperties.Benchmark thresholds = properties.getBenchmark();
    if (bestMatch < thresholds.getHighSeverityThreshold()) {
      return GapSeverity.HIGH;
    }
    if (bestMatch < thresholds.getMediumSeverityThreshold()) {
      return GapSeverity.MEDIUM;
    }
    return GapSeverity.LOW;
  }

  private double similarity(
      Map<String, List<Float>> embeddings, String generatedTopic, String competitorTopic) {
    try {
      return similarityService.cosineSimilarity(
          embeddings.get(generatedTopic), embeddings.get(competitorTopic));
    } catch (DimensionMismatchException e) {
      log.warn(
          "Treating '{}' and '{}' as unrelated: {}",
          generatedTopic,
          competitorTopic,
          e.getMessage());
      return 0.0;
    }
  }

  /** Embeds every distinct topic of the curriculum and the competitors in one batch. */
  private Map<String, List<Float>> embedTopics(
      Set<String> topics, List<CompetitorProgram> competitors) {
    Set<String> texts = new LinkedHashSet<>(topics);
    competitors.forEach(competitor -> texts.addAll(topicNames(competitor)));

    List<String> ordered = new ArrayList<>(texts);
    List<List<Float>> vectors = embeddingService.embedAll(ordered);

    Map<String, List<Float>> embeddings = new HashMap<>();
    for (int i = 0; i < ordered.size(); i++) {
      embeddings.put(ordered.get(i), vectors.get(i));
    }
    return embeddings;
  }

  private static List<String> topicNames(CompetitorProgram competitor) {
    if (competitor.getTopics() == null) {
      return List.of();
    }
    return competitor.getTopics().stream()
        .filter(Objects::nonNull)
        .map(CompetitorTopic::getName)
        .filter(name -> name != null && !name.isBlank())
        .collect(Collectors.toList());
  }
}
