package com.curriculum.insight.controller;

import java.util.Map;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.curriculum.insight.service.corpus.CorpusStore;
import com.curriculum.insight.service.vector.EmbeddingProvider;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Tag(name = "Health")
public class HealthController {

  private final EmbeddingProvider embeddingProvider;
  private final CorpusStore corpusStore;

  @GetMapping("/health")
  @Operation(summary = "Health check", description = "Check if the service is up")
  @ApiResponses(value = {@ApiResponse(responseCode = "200", description = "Service is healthy")})
  public ResponseEntity<Map<String, Object>> health() {
    return ResponseEntity.ok(
        Map.of(
            "status", "UP",
            "timestamp", System.currentTimeMillis(),
            "embeddingModel", embeddingProvider.getModelId(),
            "corpusSize", corpusStore.count()));
  }
}
