package com.curriculum.insight.service.benchmark;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;

import com.curriculum.insight.dto.benchmark.CompetitorProgram;
import com.curriculum.insight.dto.benchmark.CompetitorProgramRequest;
import com.curriculum.insight.dto.benchmark.CompetitorStructure;
import com.curriculum.insight.dto.benchmark.CompetitorTopic;
import com.curriculum.insight.exception.ResourceNotFoundException;
import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvValidationException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** Imports, lists and deletes competitor programs. */
@Slf4j
@Service
@RequiredArgsConstructor
public class CompetitorProgramService {

  static final String LIST_SEPARATOR = ";";

  static final String COLUMN_INSTITUTION = "institutionname";
  static final String COLUMN_PROGRAM = "programname";
  static final String COLUMN_LEVEL = "level";
  static final String COLUMN_TOPICS = "topics";
  static final String COLUMN_TOTAL_HOURS = "totalhours";
  static final String COLUMN_ASSESSMENT_TYPES = "assessmenttypes";
  static final String COLUMN_DELIVERY_METHODS = "deliverymethods";

  private final CompetitorStore competitorStore;
  private final Clock clock;

  public CompetitorProgram create(CompetitorProgramRequest request) {
    requireText(request.getInstitutionName(), "Institution name is required");
    requireText(request.getProgramName(), "Program name is required");

    CompetitorProgram program =
        CompetitorProgram.builder()
            .id(UUID.randomUUID().toString())
            .institutionName(request.getInstitutionName().trim())
            .programName(request.getProgramName().trim())
            .level(request.getLevel())
            .topics(normalizeTopics(request.getTopics()))
            .structure(
                request.getStructure() != null
                    ? request.getStructure()
                    : new CompetitorStructure())
            .createdAt(Instant.now(clock))
            .build();

    competitorStore.insert(program);
    log.info(
        "Stored competitor program '{}' from {} with {} topic(s)",
        program.getProgramName(),
        program.getInstitutionName(),
        program.getTopics().size());
    return program;
  }

  /**
   * Import several programs. Every request is checked before any program is stored.
   *
   * @return stored programs in request order
   */
  public List<CompetitorProgram> createAll(List<CompetitorProgramRequest> requests) {
    for (int i = 0; i < requests.size(); i++) {
      CompetitorProgramRequest request = requests.get(i);
      String position = "Program " + (i + 1);
      requireText(request.getInstitutionName(), position + ": institution name is required");
      requireText(request.getProgramName(), position + ": program name is required");
    }
    return requests.stream().map(this::create).collect(Collectors.toList());
  }

  /**
   * Import programs from CSV. The header row names the columns {@code institutionName,
   * programName, level, topics, totalHours, assessmentTypes, deliveryMethods} (any order, case
   * insensitive); list cells separate their items with {@value #LIST_SEPARATOR}.
   *
   * @param csv the CSV content
   * @return stored programs in row order
   * @throws IOException if the stream cannot be read
   */
  public List<CompetitorProgram> importCsv(InputStream csv) throws IOException {
    return createAll(parseCsv(csv));
  }

  List<CompetitorProgramRequest> parseCsv(InputStream csv) throws IOException {
    List<CompetitorProgramRequest> requests = new ArrayList<>();

    try (CSVReader reader = new CSVReader(new InputStreamReader(csv, StandardCharsets.UTF_8))) {
      String[] headers = reader.readNext();
      if (headers == null || headers.length == 0) {
        throw new IllegalArgumentException("CSV file has no headers");
      }

      Map<String, Integer> columns = new HashMap<>();
      for (int i = 0; i < headers.length; i++) {
        columns.put(headers[i].trim().toLowerCase(Locale.ROOT), i);
      }
      for (String required : List.of(COLUMN_INSTITUTION, COLUMN_PROGRAM, COLUMN_TOPICS)) {
        if (!columns.containsKey(required)) {
          throw new IllegalArgumentException("CSV file is missing the '" + required + "' column");
        }
      }

      String[] row;
      int line = 1;
      while ((row = reader.readNext()) != null) {
        line++;
        if (Arrays.stream(row).allMatch(cell -> cell == null || cell.isBlank())) {
          log.debug("Skipping blank CSV line {}", line);
          continue;
        }

        List<String> assessmentTypes = splitList(cell(row, columns, COLUMN_ASSESSMENT_TYPES));
        List<String> deliveryMethods = splitList(cell(row, columns, COLUMN_DELIVERY_METHODS));
        requests.add(
            CompetitorProgramRequest.builder()
                .institutionName(cell(row, columns, COLUMN_INSTITUTION))
                .programName(cell(row, columns, COLUMN_PROGRAM))
                .level(cell(row, columns, COLUMN_LEVEL))
                .topics(
                    splitList(cell(row, columns, COLUMN_TOPICS)).stream()
                        .map(CompetitorTopic::named)
                        .collect(Collectors.toList()))
                .structure(
                    CompetitorStructure.builder()
                        .totalHours(parseHours(cell(row, columns, COLUMN_TOTAL_HOURS), line))
                        .assessmentTypes(assessmentTypes.isEmpty() ? null : assessmentTypes)
                        .deliveryMethods(deliveryMethods.isEmpty() ? null : deliveryMethods)
                        .build())
                .build());
      }
    } catch (CsvValidationException e) {
      throw new IllegalArgumentException("Malformed CSV: " + e.getMessage(), e);
    }

    if (requests.isEmpty()) {
      throw new IllegalArgumentException("CSV file contains no competitor programs");
    }
    return requests;
  }

  public List<CompetitorProgram> list() {
    return competitorStore.list();
  }

  public CompetitorProgram get(String id) {
    return competitorStore
        .getById(id)
        .orElseThrow(() -> new ResourceNotFoundException("Competitor program", id));
  }

  public void delete(String id) {
    if (!competitorStore.deleteById(id)) {
      throw new ResourceNotFoundException("Competitor program", id);
    }
    log.info("Deleted competitor program {}", id);
  }

  /** Trims topic names and drops topics without a name. */
  private static List<CompetitorTopic> normalizeTopics(List<CompetitorTopic> topics) {
    if (topics == null) {
      return List.of();
    }
    return topics.stream()
        .filter(Objects::nonNull)
        .filter(topic -> topic.getName() != null && !topic.getName().isBlank())
        .map(
            topic ->
                CompetitorTopic.builder()
                    .name(topic.getName().trim())
                    .description(topic.getDescription())
                    .hours(topic.getHours())
                    .moduleCode(topic.getModuleCode())
                    .build())
        .collect(Collectors.toList());
  }

  private static String cell(String[] row, Map<String, Integer> columns, String column) {
    Integer index = columns.get(column);
    if (index == null || index >= row.length || row[index] == null) {
      return null;
    }
    String value = row[index].trim();
    return value.isEmpty() ? null : value;
  }

  private static List<String> splitList(String value) {
    if (value == null) {
      return List.of();
    }
    return Arrays.stream(value.split(LIST_SEPARATOR))
        .map(String::trim)
        .filter(item -> !item.isEmpty())
        .collect(Collectors.toList());
  }

  private static Double parseHours(String value, int line) {
    if (value == null) {
      return null;
    }
    try {
      return Double.valueOf(value);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(
          "Line " + line + ": totalHours must be a number, got '" + value + "'", e);
    }
  }

  private static void requireText(String value, String message) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(message);
    }
  }
}
