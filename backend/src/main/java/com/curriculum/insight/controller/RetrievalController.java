package com.curriculum.insight.controller;

import java.util.List;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.curriculum.insight.dto.retrieval.AttributionRequest;
import com.curriculum.insight.dto.retrieval.ContentWithCitations;
import com.curriculum.insight.dto.retrieval.MultiQuerySearchRequest;
import com.curriculum.insight.dto.retrieval.RetrievalResult;
import com.curriculum.insight.dto.retrieval.RetrievedContext;
import com.curriculum.insight.dto.retrieval.SearchRequest;
import com.curriculum.insight.dto.retrieval.SearchResponse;
import com.curriculum.insight.service.retrieval.RetrievalEngine;
import com.curriculum.insight.service.retrieval.SourceAttributionService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api/retrieval")
@RequiredArgsConstructor
@Tag(name = "Retrieval", description = "Semantic search over the knowledge corpus")
public class RetrievalController {

  private final RetrievalEngine retrievalEngine;
  private final SourceAttributionService sourceAttributionService;

  @PostMapping("/search")
  @Operation(
      summary = "Semantic search",
      description =
          "Ranks corpus entries by credibility and similarity to the query, optionally"
              + " reweighted by recency")
  @ApiResponses(
      value = {
        @ApiResponse(responseCode = "200", description = "Ranked results"),
        @ApiResponse(responseCode = "400", description = "Invalid query or options"),
        @ApiResponse(responseCode = "429", description = "Embedding provider rate limited"),
        @ApiResponse(responseCode = "504", description = "Embedding provider timed out")
      })
  public ResponseEntity<SearchResponse> search(@Valid @RequestBody SearchRequest request) {
    log.info("Search request: '{}'", request.getQuery());
    List<RetrievalResult> results =
        retrievalEngine.search(request.getQuery(), request.getOptions());
    return ResponseEntity.ok(toResponse(request.getQuery(), results));
  }

  @PostMapping("/multi-query-search")
  @Operation(
      summary = "Multi-query search",
      description =
          "Searches every variant, merges the results keeping the first occurrence of each"
              + " entry, and ranks them by score. Without explicit variants the standard"
              + " variations of the query are used.")
  public ResponseEntity<SearchResponse> multiQuerySearch(
      @RequestBody MultiQuerySearchRequest request) {
    List<RetrievalResult> results;
    String description;
    if (request.getVariants() != null && !request.getVariants().isEmpty()) {
      description = String.join(" | ", request.getVariants());
      results = retrievalEngine.multiQuerySearch(request.getVariants(), request.getOptions());
    } else {
      description = request.getQuery();
      results = retrievalEngine.multiQueryRetrieval(request.getQuery(), request.getOptions());
    }
    log.info("Multi-query search for '{}' returned {} result(s)", description, results.size());
    return ResponseEntity.ok(toResponse(description, results));
  }

  @PostMapping("/ranked-search")
  @Operation(
      summary = "Composite-ranked search",
      description =
          "Semantic search whose scores are replaced by 0.6 x similarity + 0.3 x credibility +"
              + " 0.1 x recency")
  public ResponseEntity<SearchResponse> rankedSearch(@Valid @RequestBody SearchRequest request) {
    List<RetrievalResult> results =
        retrievalEngine.searchWithRanking(request.getQuery(), request.getOptions());
    return ResponseEntity.ok(toResponse(request.getQuery(), results));
  }

  @PostMapping("/context")
  @Operation(
      summary = "Retrieve context",
      description = "Returns matching passages with the source metadata needed for citations")
  public ResponseEntity<List<RetrievedContext>> retrieveContext(
      @Valid @RequestBody SearchRequest request) {
    return ResponseEntity.ok(
        sourceAttributionService.retrieveContext(request.getQuery(), request.getOptions()));
  }

  @PostMapping("/attribution")
  @Operation(
      summary = "Attribute sources",
      description = "Appends an APA 7th edition reference list for the given sources")
  public ResponseEntity<ContentWithCitations> attributeSources(
      @Valid @RequestBody AttributionRequest request) {
    return ResponseEntity.ok(
        sourceAttributionService.attributeSources(request.getContent(), request.getSources()));
  }

  private static SearchResponse toResponse(String query, List<RetrievalResult> results) {
    return SearchResponse.builder()
        .query(query)
        .totalResults(results.size())
        .results(results)
        .build();
  }
}
