package com.curriculum.insight.service.benchmark;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

import org.springframework.stereotype.Repository;

import com.curriculum.insight.config.ApplicationProperties;
import com.curriculum.insight.dto.benchmark.CompetitorProgram;
import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Competitor store held in memory and mirrored to a JSON file after every change. Without a
 * configured storage file the store is memory only.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class FileBackedCompetitorStore implements CompetitorStore {

  private static final Comparator<CompetitorProgram> NEWEST_FIRST =
      Comparator.comparing(
              CompetitorProgram::getCreatedAt, Comparator.nullsLast(Comparator.reverseOrder()))
          .thenComparing(CompetitorProgram::getId);

  private final ObjectMapper objectMapper;
  private final ApplicationProperties applicationProperties;
  private final Map<String, CompetitorProgram> programs = new ConcurrentHashMap<>();
  private Path storageFile;

  @PostConstruct
  public void init() {
    String configured = applicationProperties.getCompetitors().getStorageFile();
    if (configured == null || configured.isBlank()) {
      log.info("No competitor storage file configured, keeping competitor programs in memory");
      return;
    }
    storageFile = Paths.get(configured);
    loadPrograms();
  }

  @Override
  public List<CompetitorProgram> list() {
    return programs.values().stream().sorted(NEWEST_FIRST).collect(Collectors.toList());
  }

  @Override
  public Optional<CompetitorProgram> getById(String id) {
    if (id == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(programs.get(id));
  }

  @Override
  public CompetitorProgram insert(CompetitorProgram program) {
    if (program.getId() == null || program.getId().isBlank()) {
      throw new IllegalArgumentException("Competitor programs require an id");
    }
    programs.put(program.getId(), program);
    savePrograms();
    return program;
  }

  @Override
  public boolean deleteById(String id) {
    if (id == null) {
      return false;
    }
    CompetitorProgram removed = programs.remove(id);
    if (removed != null) {
      savePrograms();
      return true;
    }
    return false;
  }

  private void loadPrograms() {
    if (!Files.exists(storageFile)) {
      log.debug("No competitor file found at {}, starting with an empty store", storageFile);
      return;
    }

    try {
      List<CompetitorProgram> stored =
          objectMapper.readValue(
              Files.readString(storageFile),
              objectMapper
                  .getTypeFactory()
                  .constructCollectionType(List.class, CompetitorProgram.class));

      for (CompetitorProgram program : stored) {
        if (program.getId() == null || program.getId().isBlank()) {
          log.warn("Ignoring stored competitor program without id: {}", program.getProgramName());
          continue;
        }
        if (program.getCreatedAt() == null) {
          program.setCreatedAt(Instant.EPOCH);
        }
        programs.put(program.getId(), program);
      }
      log.info("Loaded {} competitor programs from {}", programs.size(), storageFile);

    } catch (IOException e) {
      log.error("Failed to load competitor programs from {}", storageFile, e);
    }
  }

  private synchronized void savePrograms() {
    if (storageFile == null) {
      return;
    }
    try {
      Path parent = storageFile.getParent();
      if (parent != null && !Files.exists(parent)) {
        Files.createDirectories(parent);
      }
      List<CompetitorProgram> snapshot = new ArrayList<>(list());
      Files.writeString(
          storageFile, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(snapshot));
      log.debug("Saved {} competitor programs to {}", snapshot.size(), storageFile);

    } catch (IOException e) {
      throw new UncheckedIOException("Failed to save competitor programs to " + storageFile, e);
    }
  }
}
