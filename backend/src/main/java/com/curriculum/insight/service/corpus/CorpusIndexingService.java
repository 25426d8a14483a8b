package com.curriculum.insight.service.corpus;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;

import com.curriculum.insight.dto.corpus.CorpusStats;
import com.curriculum.insight.dto.corpus.IndexEntryRequest;
import com.curriculum.insight.exception.DimensionMismatchException;
import com.curriculum.insight.service.retrieval.SearchResponseCache;
import com.curriculum.insight.service.vector.EmbeddingService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** Adds documents to the knowledge corpus, removes them, and reports corpus statistics. */
@Slf4j
@Service
@RequiredArgsConstructor
public class CorpusIndexingService {

  private final CorpusStore corpusStore;
  private final EmbeddingService embeddingService;
  private final SearchResponseCache responseCache;
  private final Clock clock;

  /**
   * Index a single document chunk.
   *
   * @param request the chunk and its metadata
   * @return the stored entry
   */
  public EmbeddedEntry index(IndexEntryRequest request) {
    return indexAll(List.of(request)).get(0);
  }

  /**
   * Index several chunks. Chunks without a precomputed vector are embedded concurrently; nothing is
   * stored unless every chunk is embedded successfully.
   *
   * @param requests chunks to index
   * @return the stored entries, in request order
   */
  public List<EmbeddedEntry> indexAll(List<IndexEntryRequest> requests) {
    if (requests.isEmpty()) {
      return List.of();
    }

    List<String> toEmbed =
        requests.stream()
            .filter(r -> r.getVector() == null || r.getVector().isEmpty())
            .map(IndexEntryRequest::getContent)
            .collect(Collectors.toList());
    List<List<Float>> generated = embeddingService.embedAll(toEmbed);

    Integer dimension = currentDimension();
    Instant now = Instant.now(clock);
    List<EmbeddedEntry> entries = new ArrayList<>(requests.size());
    int generatedIndex = 0;

    for (IndexEntryRequest request : requests) {
      List<Float> vector =
          request.getVector() == null || request.getVector().isEmpty()
              ? generated.get(generatedIndex++)
              : List.copyOf(request.getVector());

      if (dimension == null) {
        dimension = vector.size();
      } else if (dimension != vector.size()) {
        throw new DimensionMismatchException(dimension, vector.size());
      }

      entries.add(
          EmbeddedEntry.builder()
              .id(UUID.randomUUID().toString())
              .content(request.getContent())
              .vector(vector)
              .domain(request.getDomain())
              .credibilityScore(request.getCredibilityScore())
              .publicationDate(request.getPublicationDate())
              .tags(request.getTags() == null ? Set.of() : Set.copyOf(request.getTags()))
              .foundational(request.isFoundational())
              .title(request.getTitle())
              .author(request.getAuthor())
              .sourceUrl(request.getSourceUrl())
              .sourceType(request.getSourceType() != null ? request.getSourceType() : "manual")
              .createdAt(now)
              .build());
    }

    corpusStore.insert(entries);
    responseCache.invalidateAll();
    log.info("Indexed {} corpus entries ({} embedded)", entries.size(), toEmbed.size());
    return entries;
  }

  /**
   * Delete entries by id.
   *
   * @return number of entries removed
   */
  public int deleteByIds(List<String> ids) {
    int removed = corpusStore.deleteByIds(new HashSet<>(ids));
    responseCache.invalidateAll();
    log.info("Removed {} of {} requested corpus entries", removed, ids.size());
    return removed;
  }

  /**
   * Delete every entry of a domain.
   *
   * @return number of entries removed
   */
  public int deleteByDomain(String domain) {
    int removed = corpusStore.deleteWhere(entry -> Objects.equals(domain, entry.getDomain()));
    responseCache.invalidateAll();
    log.info("Removed {} corpus entries from domain '{}'", removed, domain);
    return removed;
  }

  public CorpusStats getStats() {
    List<EmbeddedEntry> all = corpusStore.query(entry -> true);

    double averageCredibility =
        all.stream().mapToInt(EmbeddedEntry::getCredibilityScore).average().orElse(0.0);
    Map<String, Long> domainDistribution =
        all.stream()
            .collect(
                Collectors.groupingBy(
                    entry -> entry.getDomain() != null ? entry.getDomain() : "unknown",
                    TreeMap::new,
                    Collectors.counting()));

    return CorpusStats.builder()
        .totalDocuments(all.size())
        .averageCredibility((int) Math.round(averageCredibility))
        .domainDistribution(domainDistribution)
        .build();
  }

  private Integer currentDimension() {
    return corpusStore.query(entry -> entry.getVector() != null).stream()
        .findFirst()
        .map(entry -> entry.getVector().size())
        .orElse(null);
  }
}
