package com.curriculum.insight.service.retrieval;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Predicate;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;

import com.curriculum.insight.config.ApplicationProperties;
import com.curriculum.insight.dto.retrieval.RetrievalOptions;
import com.curriculum.insight.dto.retrieval.RetrievalResult;
import com.curriculum.insight.exception.DimensionMismatchException;
import com.curriculum.insight.exception.InvalidQueryException;
import com.curriculum.insight.exception.RetrievalFailedException;
import com.curriculum.insight.service.corpus.CorpusStore;
import com.curriculum.insight.service.corpus.EmbeddedEntry;
import com.curriculum.insight.service.vector.EmbeddingService;
import com.curriculum.insight.service.vector.VectorSimilarityService;

import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.With;
import lombok.extern.slf4j.Slf4j;

/**
 * Semantic search over the knowledge corpus.
 *
 * <p>Results are ordered by credibility and then similarity, optionally reweighted by recency, and
 * carry 1-based ranks. Every failure after option validation is reported as a {@link
 * RetrievalFailedException}; no partial result list is ever returned.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RetrievalEngine {

  static final String SEARCH = "search";
  static final String MULTI_QUERY_SEARCH = "multiQuerySearch";
  static final String RANKED_SEARCH = "searchWithRanking";

  /** Each variant of a multi-query search fetches this many times the limit before merging. */
  static final int MULTI_QUERY_CANDIDATE_FACTOR = 2;

  private static final Comparator<RetrievalResult> BY_CREDIBILITY_THEN_SIMILARITY =
      Comparator.comparingInt((RetrievalResult r) -> r.getEntry().getCredibilityScore())
          .reversed()
          .thenComparing(Comparator.comparingDouble(RetrievalResult::getSimilarityScore).reversed())
          .thenComparing(r -> r.getEntry().getId());

  private static final Comparator<RetrievalResult> BY_SCORE =
      Comparator.comparingDouble(RetrievalResult::getSimilarityScore)
          .reversed()
          .thenComparing(r -> r.getEntry().getId());

  private final CorpusStore corpusStore;
  private final EmbeddingService embeddingService;
  private final VectorSimilarityService similarityService;
  private final SearchResponseCache responseCache;
  private final QueryVariationGenerator variationGenerator;
  private final ApplicationProperties properties;

  /**
   * Ranked semantic search for a single query.
   *
   * @param query the query text
   * @param options filters; {@code null} uses the defaults
   * @return at most {@code limit} results, ranked from 1
   * @throws InvalidQueryException if the query or options are malformed
   * @throws RetrievalFailedException if embedding or scoring fails
   */
  public List<RetrievalResult> search(String query, RetrievalOptions options) {
    requireQueryText(query);
    SearchSettings settings = resolve(options);

    try {
      List<RetrievalResult> results = cachedSearch(query, settings);
      log.info("Search returned {} result(s) for query '{}'", results.size(), query);
      return results;
    } catch (RuntimeException e) {
      log.error("Search failed for query '{}': {}", query, e.getMessage());
      throw new RetrievalFailedException(SEARCH, query, e);
    }
  }

  /**
   * Search with several phrasings of the same question and merge the results. Duplicate entries
   * keep their first occurrence in variant order. If any variant fails the whole call fails.
   *
   * @param variants query variants, processed in list order
   * @param options filters; {@code null} uses the defaults
   * @return merged results sorted by score, at most {@code limit}, ranked from 1
   */
  public List<RetrievalResult> multiQuerySearch(List<String> variants, RetrievalOptions options) {
    if (variants == null || variants.isEmpty()) {
      throw new InvalidQueryException("At least one query variant is required");
    }
    variants.forEach(RetrievalEngine::requireQueryText);
    SearchSettings settings = resolve(options);
    String description = String.join(" | ", variants);

    try {
      if (variants.size() == 1) {
        return cachedSearch(variants.get(0), settings);
      }
      List<RetrievalResult> merged = mergeVariants(variants, settings);
      log.info(
          "Multi-query search over {} variant(s) returned {} result(s)",
          variants.size(),
          merged.size());
      return merged;
    } catch (RuntimeException e) {
      log.error("Multi-query search failed for '{}': {}", description, e.getMessage());
      throw new RetrievalFailedException(MULTI_QUERY_SEARCH, description, e);
    }
  }

  /**
   * Same as {@link #search} but the score of each result is replaced with {@code 0.6 * similarity
   * + 0.3 * credibility + 0.1 * recency} and the results are re-sorted by it.
   */
  public List<RetrievalResult> searchWithRanking(String query, RetrievalOptions options) {
    requireQueryText(query);
    SearchSettings settings = resolve(options);

    try {
      List<RetrievalResult> composite =
          cachedSearch(query, settings).stream()
              .map(
                  result ->
                      result.toBuilder()
                          .similarityScore(
                              similarityService.compositeScore(
                                  result.getSimilarityScore(),
                                  result.getEntry().getCredibilityScore(),
                                  result.getEntry().getPublicationDate()))
                          .build())
              .sorted(BY_SCORE)
              .collect(Collectors.toList());
      return withRanks(composite, composite.size());
    } catch (RuntimeException e) {
      log.error("Ranked search failed for query '{}': {}", query, e.getMessage());
      throw new RetrievalFailedException(RANKED_SEARCH, query, e);
    }
  }

  /** Multi-query search over the standard variations of {@code query}. */
  public List<RetrievalResult> multiQueryRetrieval(String query, RetrievalOptions options) {
    requireQueryText(query);
    return multiQuerySearch(variationGenerator.generate(query), options);
  }

  private List<RetrievalResult> cachedSearch(String query, SearchSettings settings) {
    String key = responseCache.currentKey(SEARCH, query, settings.fingerprint());
    Optional<List<RetrievalResult>> cached = responseCache.get(key);
    if (cached.isPresent()) {
      log.debug("Search cache hit for query '{}'", query);
      return cached.get();
    }

    List<RetrievalResult> results = rank(embeddingService.embed(query), settings);
    responseCache.put(key, results);
    return results;
  }

  private List<RetrievalResult> mergeVariants(List<String> variants, SearchSettings settings) {
    SearchSettings candidateSettings =
        settings.withLimit(settings.getLimit() * MULTI_QUERY_CANDIDATE_FACTOR);

    // Resolve cached variants first, then embed the rest in one concurrent batch
    Map<String, List<RetrievalResult>> perVariant = new HashMap<>();
    Map<String, String> uncachedKeys = new LinkedHashMap<>();
    for (String variant : variants) {
      if (perVariant.containsKey(variant) || uncachedKeys.containsKey(variant)) {
        continue;
      }
      String key = responseCache.currentKey(SEARCH, variant, candidateSettings.fingerprint());
      Optional<List<RetrievalResult>> cached = responseCache.get(key);
      if (cached.isPresent()) {
        perVariant.put(variant, cached.get());
      } else {
        uncachedKeys.put(variant, key);
      }
    }

    List<String> uncached = new ArrayList<>(uncachedKeys.keySet());
    List<List<Float>> vectors = embeddingService.embedAll(uncached);
    for (int i = 0; i < uncached.size(); i++) {
      String variant = uncached.get(i);
      List<RetrievalResult> results = rank(vectors.get(i), candidateSettings);
      responseCache.put(uncachedKeys.get(variant), results);
      perVariant.put(variant, results);
    }

    Map<String, RetrievalResult> firstById = new LinkedHashMap<>();
    for (String variant : variants) {
      for (RetrievalResult result : perVariant.get(variant)) {
        firstById.putIfAbsent(result.getEntry().getId(), result);
      }
    }

    List<RetrievalResult> merged = new ArrayList<>(firstById.values());
    merged.sort(BY_SCORE);
    return withRanks(merged, settings.getLimit());
  }

  private List<RetrievalResult> rank(List<Float> queryVector, SearchSettings settings) {
    List<EmbeddedEntry> candidates = corpusStore.query(metadataFilter(settings));

    List<RetrievalResult> matches = new ArrayList<>();
    for (EmbeddedEntry entry : candidates) {
      if (entry.getVector() == null) {
        log.warn("Skipping corpus entry {}: no embedding", entry.getId());
        continue;
      }
      double similarity;
      try {
        similarity = similarityService.cosineSimilarity(entry.getVector(), queryVector);
      } catch (DimensionMismatchException e) {
        log.warn("Skipping corpus entry {}: {}", entry.getId(), e.getMessage());
        continue;
      }
      if (similarity >= settings.getMinSimilarity()) {
        matches.add(RetrievalResult.builder().entry(entry).similarityScore(similarity).build());
      }
    }
    log.debug(
        "{} of {} candidate(s) passed the similarity floor", matches.size(), candidates.size());

    matches.sort(BY_CREDIBILITY_THEN_SIMILARITY);

    if (settings.getRecencyWeight() > 0) {
      matches =
          matches.stream()
              .map(
                  result ->
                      result.toBuilder()
                          .similarityScore(
                              similarityService.recencyWeightedScore(
                                  result.getSimilarityScore(),
                                  result.getEntry().getPublicationDate(),
                                  settings.getRecencyWeight()))
                          .build())
              .sorted(BY_SCORE)
              .collect(Collectors.toList());
    }

    return withRanks(matches, settings.getLimit());
  }

  private Predicate<EmbeddedEntry> metadataFilter(SearchSettings settings) {
    UndatedEntryPolicy undatedPolicy = properties.getRetrieval().getUndatedEntries();
    return entry -> {
      if (settings.getDomains() != null && !settings.getDomains().contains(entry.getDomain())) {
        return false;
      }
      if (settings.getMinCredibility() != null
          && entry.getCredibilityScore() < settings.getMinCredibility()) {
        return false;
      }
      if (entry.isFoundational()) {
        return true;
      }
      if (entry.getPublicationDate() == null) {
        return undatedPolicy == UndatedEntryPolicy.INCLUDE;
      }
      return similarityService.isWithinRecencyWindow(entry.getPublicationDate());
    };
  }

  private static List<RetrievalResult> withRanks(List<RetrievalResult> sorted, int limit) {
    List<RetrievalResult> ranked = new ArrayList<>(Math.min(sorted.size(), limit));
    for (int i = 0; i < sorted.size() && i < limit; i++) {
      ranked.add(sorted.get(i).toBuilder().rank(i + 1).build());
    }
    return List.copyOf(ranked);
  }

  private static void requireQueryText(String query) {
    if (query == null || query.isBlank()) {
      throw new InvalidQueryException("Query text must not be blank");
    }
  }

  private SearchSettings resolve(RetrievalOptions options) {
    RetrievalOptions given = options != null ? options : new RetrievalOptions();
    ApplicationProperties.Retrieval defaults = properties.getRetrieval();

    double minSimilarity =
        given.getMinSimilarity() != null
            ? given.getMinSimilarity()
            : defaults.getDefaultMinSimilarity();
    double recencyWeight =
        given.getRecencyWeight() != null
            ? given.getRecencyWeight()
            : defaults.getDefaultRecencyWeight();
    int limit = given.getLimit() != null ? given.getLimit() : defaults.getDefaultLimit();

    if (!(minSimilarity >= 0.0 && minSimilarity <= 1.0)) {
      throw new InvalidQueryException(
          "minSimilarity must be between 0 and 1, got " + minSimilarity);
    }
    if (!(recencyWeight >= 0.0 && recencyWeight <= 1.0)) {
      throw new InvalidQueryException(
          "recencyWeight must be between 0 and 1, got " + recencyWeight);
    }
    if (limit <= 0) {
      throw new InvalidQueryException("limit must be greater than 0, got " + limit);
    }

    Set<String> domains =
        given.getDomains() == null || given.getDomains().isEmpty()
            ? null
            : new TreeSet<>(given.getDomains());

    return new SearchSettings(
        domains,
        given.getMinCredibility(),
        minSimilarity,
        limit,
        recencyWeight,
        similarityService.today());
  }

  /**
   * Options with defaults applied. {@code today} is part of the fingerprint because recency
   * admission and recency scores change with the date.
   */
  @Value
  @With
  static class SearchSettings {
    Set<String> domains;
    Integer minCredibility;
    double minSimilarity;
    int limit;
    double recencyWeight;
    LocalDate today;

    String fingerprint() {
      return String.format(
          "domains=%s;minCredibility=%s;minSimilarity=%s;limit=%d;recencyWeight=%s;today=%s",
          domains, minCredibility, minSimilarity, limit, recencyWeight, today);
    }
  }
}
