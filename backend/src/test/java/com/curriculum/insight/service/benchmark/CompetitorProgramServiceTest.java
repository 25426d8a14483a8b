package com.curriculum.insight.service.benchmark;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.curriculum.insight.dto.benchmark.CompetitorProgram;
import com.curriculum.insight.dto.benchmark.CompetitorProgramRequest;
import com.curriculum.insight.dto.benchmark.CompetitorStructure;
import com.curriculum.insight.dto.benchmark.CompetitorTopic;
import com.curriculum.insight.exception.ResourceNotFoundException;
import com.curriculum.insight.fixtures.TestFixtures;
import com.fasterxml.jackson.databind.ObjectMapper;

@DisplayName("CompetitorProgramService Tests")
class CompetitorProgramServiceTest {

  private FileBackedCompetitorStore store;
  private CompetitorProgramService service;

  @BeforeEach
  void setUp() {
    store = new FileBackedCompetitorStore(new ObjectMapper(), TestFixtures.properties());
    service = new CompetitorProgramService(store, TestFixtures.fixedClock());
  }

  private static CompetitorProgramRequest request(String institution, String... topics) {
    return CompetitorProgramRequest.builder()
        .institutionName(institution)
        .programName("BSc Data Science")
        .topics(Arrays.stream(topics).map(CompetitorTopic::named).collect(Collectors.toList()))
        .build();
  }

  private static InputStream csv(String content) {
    return new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8));
  }

  @Nested
  @DisplayName("Creating programs")
  class CreateTests {

    @Test
    @DisplayName("Should assign an id and timestamp, trim names and drop blank topics")
    void shouldCreateProgram() {
      CompetitorProgramRequest request = request("  State University ", " Statistics ", " ");
      request.getTopics().add(null);

      CompetitorProgram program = service.create(request);

      assertThat(program.getId()).isNotBlank();
      assertThat(program.getInstitutionName()).isEqualTo("State University");
      assertThat(program.getTopics())
          .extracting(CompetitorTopic::getName)
          .containsExactly("Statistics");
      assertThat(program.getStructure()).isEqualTo(new CompetitorStructure());
      assertThat(program.getCreatedAt()).isEqualTo(Instant.parse("2025-06-15T00:00:00Z"));
      assertThat(service.get(program.getId())).isSameAs(program);
    }

    @Test
    @DisplayName("Should keep topic details supplied as objects")
    void shouldKeepTopicDetails() {
      CompetitorProgramRequest request = request("State University");
      request.setTopics(
          List.of(
              CompetitorTopic.builder().name("Ethics ").hours(12.0).moduleCode("DS101").build()));

      CompetitorTopic topic = service.create(request).getTopics().get(0);

      assertThat(topic.getName()).isEqualTo("Ethics");
      assertThat(topic.getHours()).isEqualTo(12.0);
      assertThat(topic.getModuleCode()).isEqualTo("DS101");
    }

    @Test
    @DisplayName("Should validate every request before storing any")
    void shouldValidateBatchFirst() {
      List<CompetitorProgramRequest> requests =
          List.of(request("State University", "Statistics"), request(" ", "Ethics"));

      assertThatThrownBy(() -> service.createAll(requests))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessage("Program 2: institution name is required");
      assertThat(service.list()).isEmpty();
    }

    @Test
    @DisplayName("Should report unknown programs as not found")
    void shouldRejectUnknownIds() {
      assertThatThrownBy(() -> service.get("missing"))
          .isInstanceOf(ResourceNotFoundException.class);
      assertThatThrownBy(() -> service.delete("missing"))
          .isInstanceOf(ResourceNotFoundException.class)
          .hasMessage("Competitor program not found: missing");
    }

    @Test
    @DisplayName("Should delete a stored program")
    void shouldDeleteProgram() {
      CompetitorProgram program = service.create(request("State University", "Statistics"));

      service.delete(program.getId());

      assertThat(service.list()).isEmpty();
    }
  }

  @Nested
  @DisplayName("CSV import")
  class CsvImportTests {

    @Test
    @DisplayName("Should import rows with case-insensitive headers and list cells")
    void shouldImportCsv() throws Exception {
      String content =
          "InstitutionName,ProgramName,Level,Topics,TotalHours,AssessmentTypes,DeliveryMethods\n"
              + "State University,MSc Analytics,Masters,\"Statistics; Machine Learning\",360,"
              + "Exam;Project,Online\n"
              + "\n"
              + "Tech Institute,BSc Data Science,,Databases,,,\n";

      List<CompetitorProgram> programs = service.importCsv(csv(content));

      assertThat(programs).hasSize(2);
      CompetitorProgram first = programs.get(0);
      assertThat(first.getInstitutionName()).isEqualTo("State University");
      assertThat(first.getLevel()).isEqualTo("Masters");
      assertThat(first.getTopics())
          .extracting(CompetitorTopic::getName)
          .containsExactly("Statistics", "Machine Learning");
      assertThat(first.getStructure().getTotalHours()).isEqualTo(360.0);
      assertThat(first.getStructure().getAssessmentTypes()).containsExactly("Exam", "Project");
      assertThat(first.getStructure().getDeliveryMethods()).containsExactly("Online");

      CompetitorProgram second = programs.get(1);
      assertThat(second.getLevel()).isNull();
      assertThat(second.getStructure().getTotalHours()).isNull();
      assertThat(second.getStructure().getAssessmentTypes()).isNull();
      assertThat(store.list()).hasSize(2);
    }

    @Test
    @DisplayName("Should require the institution, program and topics columns")
    void shouldRequireColumns() {
      assertThatThrownBy(() -> service.importCsv(csv("institutionName,topics\nA,B\n")))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessageContaining("programname");
    }

    @Test
    @DisplayName("Should name the line of a malformed hours value")
    void shouldRejectNonNumericHours() {
      String content = "institutionName,programName,topics,totalHours\nA,B,C,many\n";

      assertThatThrownBy(() -> service.importCsv(csv(content)))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessageStartingWith("Line 2: totalHours must be a number");
    }

    @Test
    @DisplayName("Should reject a file without data rows")
    void shouldRejectEmptyFile() {
      assertThatThrownBy(() -> service.importCsv(csv("institutionName,programName,topics\n")))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessage("CSV file contains no competitor programs");
      assertThatThrownBy(() -> service.importCsv(csv("")))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessage("CSV file has no headers");
    }

    @Test
    @DisplayName("Should reject rows without an institution name")
    void shouldRejectMissingInstitution() {
      String content = "institutionName,programName,topics\nA,B,C\n,D,E\n";

      assertThatThrownBy(() -> service.importCsv(csv(content)))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessage("Program 2: institution name is required");
      assertThat(store.list()).isEmpty();
    }
  }
}
