package com.curriculum.insight.service.benchmark;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.stereotype.Component;

import com.curriculum.insight.dto.benchmark.BenchmarkReport;

/** Keeps the most recent report per program. A new report replaces the previous one. */
@Component
public class BenchmarkReportStore {

  private final Map<String, BenchmarkReport> latestByProgram = new ConcurrentHashMap<>();

  public void save(BenchmarkReport report) {
    latestByProgram.put(report.getProgramId(), report);
  }

  public Optional<BenchmarkReport> findLatest(String programId) {
    if (programId == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(latestByProgram.get(programId));
  }
}
