package com.curriculum.insight.controller;

import java.io.IOException;
import java.util.List;

import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import com.curriculum.insight.dto.benchmark.BenchmarkReport;
import com.curriculum.insight.dto.benchmark.BenchmarkRequest;
import com.curriculum.insight.dto.benchmark.CompetitorProgram;
import com.curriculum.insight.dto.benchmark.CompetitorProgramRequest;
import com.curriculum.insight.service.benchmark.BenchmarkingService;
import com.curriculum.insight.service.benchmark.CompetitorProgramService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api/benchmarks")
@RequiredArgsConstructor
@Tag(name = "Benchmarks", description = "Compare generated curricula with competitor programs")
public class BenchmarkController {

  private final BenchmarkingService benchmarkingService;
  private final CompetitorProgramService competitorProgramService;

  @PostMapping("/compare")
  @Operation(
      summary = "Benchmark a curriculum",
      description =
          "Compares the curriculum with every stored competitor program and keeps the report as"
              + " the latest for the program")
  @ApiResponses(
      value = {
        @ApiResponse(responseCode = "200", description = "Benchmark report"),
        @ApiResponse(responseCode = "400", description = "Invalid request"),
        @ApiResponse(responseCode = "502", description = "Embedding provider failure")
      })
  public ResponseEntity<BenchmarkReport> compare(@Valid @RequestBody BenchmarkRequest request) {
    log.info("Benchmark requested for program {}", request.getProgramId());
    return ResponseEntity.ok(
        benchmarkingService.benchmark(request.getProgramId(), request.getCurriculum()));
  }

  @GetMapping("/reports/{programId}")
  @Operation(summary = "Latest benchmark report of a program")
  public ResponseEntity<BenchmarkReport> getLatestReport(@PathVariable String programId) {
    return ResponseEntity.ok(benchmarkingService.getLatestReport(programId));
  }

  @PostMapping("/competitors")
  @Operation(summary = "Add a competitor program")
  public ResponseEntity<CompetitorProgram> addCompetitor(
      @Valid @RequestBody CompetitorProgramRequest request) {
    return ResponseEntity.status(HttpStatus.CREATED).body(competitorProgramService.create(request));
  }

  @PostMapping("/competitors/bulk")
  @Operation(summary = "Add several competitor programs")
  public ResponseEntity<List<CompetitorProgram>> addCompetitors(
      @RequestBody List<CompetitorProgramRequest> requests) {
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(competitorProgramService.createAll(requests));
  }

  @PostMapping(value = "/competitors/import", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  @Operation(
      summary = "Import competitor programs from CSV",
      description =
          "Columns: institutionName, programName, level, topics, totalHours, assessmentTypes,"
              + " deliveryMethods. List cells separate items with ';'.")
  public ResponseEntity<List<CompetitorProgram>> importCompetitors(
      @Parameter(description = "CSV file", required = true) @RequestParam("file")
          MultipartFile file)
      throws IOException {
    if (file.isEmpty()) {
      throw new IllegalArgumentException("File is empty");
    }
    List<CompetitorProgram> imported = competitorProgramService.importCsv(file.getInputStream());
    log.info(
        "Imported {} competitor program(s) from {}", imported.size(), file.getOriginalFilename());
    return ResponseEntity.status(HttpStatus.CREATED).body(imported);
  }

  @GetMapping("/competitors")
  @Operation(summary = "List competitor programs, newest first")
  public ResponseEntity<List<CompetitorProgram>> listCompetitors() {
    return ResponseEntity.ok(competitorProgramService.list());
  }

  @GetMapping("/competitors/{id}")
  @Operation(summary = "Get a competitor program")
  public ResponseEntity<CompetitorProgram> getCompetitor(@PathVariable String id) {
    return ResponseEntity.ok(competitorProgramService.get(id));
  }

  @DeleteMapping("/competitors/{id}")
  @Operation(summary = "Delete a competitor program")
  public ResponseEntity<Void> deleteCompetitor(@PathVariable String id) {
    competitorProgramService.delete(id);
    return ResponseEntity.noContent().build();
  }
}
