package com.curriculum.insight.service.retrieval;

import java.time.LocalDate;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;

import com.curriculum.insight.dto.retrieval.Citation;
import com.curriculum.insight.dto.retrieval.ContentWithCitations;
import com.curriculum.insight.dto.retrieval.RetrievalOptions;
import com.curriculum.insight.dto.retrieval.RetrievalResult;
import com.curriculum.insight.dto.retrieval.RetrievedContext;
import com.curriculum.insight.service.corpus.CorpusStore;
import com.curriculum.insight.service.corpus.EmbeddedEntry;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** Turns search results into citable context and appends APA 7th edition references. */
@Slf4j
@Service
@RequiredArgsConstructor
public class SourceAttributionService {

  static final String UNKNOWN_AUTHOR = "Unknown Author";
  static final String UNTITLED = "Untitled";
  static final String REFERENCES_HEADING = "\n\n## References\n\n";

  private final RetrievalEngine retrievalEngine;
  private final CorpusStore corpusStore;

  /**
   * Retrieve passages relevant to a query together with their source metadata.
   *
   * @param query the query text
   * @param options search filters
   * @return contexts in rank order
   */
  public List<RetrievedContext> retrieveContext(String query, RetrievalOptions options) {
    return retrievalEngine.search(query, options).stream()
        .map(SourceAttributionService::toContext)
        .collect(Collectors.toList());
  }

  /**
   * Format a source as {@code Author. (Year, Month Day). Title. Domain. URL}. Undated sources use
   * {@code (n.d.)}; the domain and URL are omitted when unknown.
   */
  public String generateApaCitation(RetrievedContext source) {
    String author = isBlank(source.getAuthor()) ? UNKNOWN_AUTHOR : source.getAuthor();
    String title = isBlank(source.getTitle()) ? UNTITLED : source.getTitle();

    StringBuilder citation = new StringBuilder();
    citation.append(author).append(". (").append(formatDate(source.getPublicationDate()));
    citation.append("). ").append(title).append('.');

    if (!isBlank(source.getDomain())) {
      citation.append(' ').append(source.getDomain()).append('.');
    }
    String url = resolveSourceUrl(source);
    if (!isBlank(url)) {
      citation.append(' ').append(url);
    }
    return citation.toString();
  }

  /**
   * Append a numbered reference list for the given sources to generated content.
   *
   * @param content generated text
   * @param sources sources the text drew on, in citation order
   * @return the annotated content and one citation per source
   */
  public ContentWithCitations attributeSources(String content, List<RetrievedContext> sources) {
    List<Citation> citations = new ArrayList<>(sources.size());
    for (int i = 0; i < sources.size(); i++) {
      RetrievedContext source = sources.get(i);
      citations.add(
          Citation.builder()
              .sourceId(source.getSourceId())
              .citationText(generateApaCitation(source))
              .position(i + 1)
              .build());
    }

    StringBuilder annotated = new StringBuilder(content);
    if (!citations.isEmpty()) {
      annotated.append(REFERENCES_HEADING);
      for (Citation citation : citations) {
        annotated
            .append(citation.getPosition())
            .append(". ")
            .append(citation.getCitationText())
            .append('\n');
      }
    }
    log.debug("Attributed {} source(s)", citations.size());

    return ContentWithCitations.builder()
        .content(annotated.toString())
        .citations(citations)
        .sources(List.copyOf(sources))
        .build();
  }

  private String resolveSourceUrl(RetrievedContext source) {
    if (!isBlank(source.getSourceUrl()) || source.getSourceId() == null) {
      return source.getSourceUrl();
    }
    return corpusStore.findById(source.getSourceId()).map(EmbeddedEntry::getSourceUrl).orElse(null);
  }

  private static String formatDate(LocalDate date) {
    if (date == null) {
      return "n.d.";
    }
    return String.format(
        "%d, %s %d",
        date.getYear(),
        date.getMonth().getDisplayName(TextStyle.FULL, Locale.US),
        date.getDayOfMonth());
  }

  private static RetrievedContext toContext(RetrievalResult result) {
    EmbeddedEntry entry = result.getEntry();
    return RetrievedContext.builder()
        .content(entry.getContent())
        .sourceId(entry.getId())
        .relevanceScore(result.getSimilarityScore())
        .title(entry.getTitle())
        .author(entry.getAuthor())
        .domain(entry.getDomain())
        .publicationDate(entry.getPublicationDate())
        .sourceUrl(entry.getSourceUrl())
        .credibilityScore(entry.getCredibilityScore())
        .build();
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
