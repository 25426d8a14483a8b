package com.curriculum.insight;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;

/** Runs the full stack against the local hashing embedding provider. */
@SpringBootTest
@AutoConfigureMockMvc
@DirtiesContext
@TestPropertySource(properties = {"spring.profiles.active=test"})
@DisplayName("Curriculum insight end-to-end")
class CurriculumInsightIntegrationTest {

  @Autowired private MockMvc mockMvc;

  @Test
  @DisplayName("Should index, search and benchmark through the HTTP API")
  void shouldIndexSearchAndBenchmark() throws Exception {
    mockMvc
        .perform(
            post("/api/corpus/entries/bulk")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    "{\"entries\":["
                        + "{\"content\":\"Bar charts compare categories\",\"domain\":\"dataviz\","
                        + "\"credibilityScore\":85,\"isFoundational\":true,\"title\":\"Charts\"},"
                        + "{\"content\":\"Regression models\",\"domain\":\"statistics\","
                        + "\"credibilityScore\":70,\"isFoundational\":true}]}"))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.length()").value(2));

    mockMvc
        .perform(
            post("/api/retrieval/search")
                .header("X-Correlation-Id", "it-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    "{\"query\":\"bar charts compare categories\","
                        + "\"options\":{\"minSimilarity\":0.99}}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.totalResults").value(1))
        .andExpect(jsonPath("$.results[0].entry.title").value("Charts"))
        .andExpect(jsonPath("$.results[0].rank").value(1));

    mockMvc
        .perform(get("/api/corpus/stats"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.totalDocuments").value(2))
        .andExpect(jsonPath("$.domainDistribution.dataviz").value(1));

    mockMvc
        .perform(
            post("/api/benchmarks/competitors")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    "{\"institutionName\":\"State University\",\"programName\":\"MSc\","
                        + "\"topics\":[\"Data Visualization\","
                        + "{\"name\":\"Quantum Cryptography Hardware\",\"hours\":20}]}"))
        .andExpect(status().isCreated());

    mockMvc
        .perform(
            post("/api/benchmarks/compare")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    "{\"programId\":\"prog-1\",\"curriculum\":{\"units\":"
                        + "[{\"unitTitle\":\"Data Visualization\"}]}}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.comparisons[0].topicCoverage").value(100))
        .andExpect(jsonPath("$.gaps.length()").value(1))
        .andExpect(jsonPath("$.gaps[0].severity").value("high"))
        .andExpect(jsonPath("$.strengths.length()").value(0));

    mockMvc
        .perform(get("/api/benchmarks/reports/prog-1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.programId").value("prog-1"));

    mockMvc
        .perform(get("/api/health"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.embeddingModel").value("local-hashing-128"))
        .andExpect(jsonPath("$.corpusSize").value(2));
  }
}
