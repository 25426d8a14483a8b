package com.curriculum.insight.controller;

import java.util.List;
import java.util.Map;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.curriculum.insight.dto.corpus.BulkIndexRequest;
import com.curriculum.insight.dto.corpus.CorpusStats;
import com.curriculum.insight.dto.corpus.DeleteEntriesRequest;
import com.curriculum.insight.dto.corpus.IndexEntryRequest;
import com.curriculum.insight.service.corpus.CorpusIndexingService;
import com.curriculum.insight.service.corpus.EmbeddedEntry;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api/corpus")
@RequiredArgsConstructor
@Tag(name = "Corpus", description = "Manage the embedded knowledge corpus")
public class CorpusController {

  private final CorpusIndexingService corpusIndexingService;

  @PostMapping("/entries")
  @Operation(summary = "Index a document chunk")
  @ApiResponses(
      value = {
        @ApiResponse(responseCode = "201", description = "Entry indexed"),
        @ApiResponse(responseCode = "400", description = "Invalid entry")
      })
  public ResponseEntity<EmbeddedEntry> indexEntry(@Valid @RequestBody IndexEntryRequest request) {
    return ResponseEntity.status(HttpStatus.CREATED).body(corpusIndexingService.index(request));
  }

  @PostMapping("/entries/bulk")
  @Operation(
      summary = "Index several document chunks",
      description = "Embeds the chunks concurrently; nothing is stored if any chunk fails")
  public ResponseEntity<List<EmbeddedEntry>> indexEntries(
      @Valid @RequestBody BulkIndexRequest request) {
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(corpusIndexingService.indexAll(request.getEntries()));
  }

  @DeleteMapping("/entries")
  @Operation(summary = "Delete entries by id or by domain")
  public ResponseEntity<Map<String, Object>> deleteEntries(
      @RequestBody DeleteEntriesRequest request) {
    boolean hasIds = request.getIds() != null && !request.getIds().isEmpty();
    boolean hasDomain = request.getDomain() != null && !request.getDomain().isBlank();
    if (!hasIds && !hasDomain) {
      throw new IllegalArgumentException("Either ids or domain must be provided");
    }

    int deleted = 0;
    if (hasIds) {
      deleted += corpusIndexingService.deleteByIds(request.getIds());
    }
    if (hasDomain) {
      deleted += corpusIndexingService.deleteByDomain(request.getDomain());
    }
    return ResponseEntity.ok(Map.of("deleted", deleted));
  }

  @GetMapping("/stats")
  @Operation(summary = "Corpus statistics")
  public ResponseEntity<CorpusStats> getStats() {
    return ResponseEntity.ok(corpusIndexingService.getStats());
  }
}
