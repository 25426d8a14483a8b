package com.curriculum.insight.controller;

import static com.curriculum.insight.fixtures.TestFixtures.entry;
import static com.curriculum.insight.fixtures.TestFixtures.vector;
import static org.hamcrest.Matchers.startsWith;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import com.curriculum.insight.dto.retrieval.AttributionRequest;
import com.curriculum.insight.dto.retrieval.Citation;
import com.curriculum.insight.dto.retrieval.ContentWithCitations;
import com.curriculum.insight.dto.retrieval.MultiQuerySearchRequest;
import com.curriculum.insight.dto.retrieval.RetrievalOptions;
import com.curriculum.insight.dto.retrieval.RetrievalResult;
import com.curriculum.insight.dto.retrieval.RetrievedContext;
import com.curriculum.insight.dto.retrieval.SearchRequest;
import com.curriculum.insight.exception.EmbeddingException;
import com.curriculum.insight.exception.InvalidQueryException;
import com.curriculum.insight.exception.RetrievalFailedException;
import com.curriculum.insight.service.retrieval.RetrievalEngine;
import com.curriculum.insight.service.retrieval.SourceAttributionService;
import com.fasterxml.jackson.databind.ObjectMapper;

@WebMvcTest(RetrievalController.class)
@DisplayName("RetrievalController Tests")
class RetrievalControllerTest {

  @Autowired private MockMvc mockMvc;

  @Autowired private ObjectMapper objectMapper;

  @MockBean private RetrievalEngine retrievalEngine;

  @MockBean private SourceAttributionService sourceAttributionService;

  private static RetrievalResult result(String id, double score, int rank) {
    return RetrievalResult.builder()
        .entry(entry(id, vector(1, 0)).build())
        .similarityScore(score)
        .rank(rank)
        .build();
  }

  private String json(Object value) throws Exception {
    return objectMapper.writeValueAsString(value);
  }

  @Nested
  @DisplayName("POST /api/retrieval/search")
  class SearchTests {

    @Test
    @DisplayName("Should return ranked results without embedding vectors")
    void shouldReturnResults() throws Exception {
      SearchRequest request =
          SearchRequest.builder()
              .query("data visualization")
              .options(RetrievalOptions.builder().limit(5).build())
              .build();
      when(retrievalEngine.search(eq("data visualization"), any(RetrievalOptions.class)))
          .thenReturn(List.of(result("e1", 0.92, 1), result("e2", 0.81, 2)));

      mockMvc
          .perform(
              post("/api/retrieval/search")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content(json(request)))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.query").value("data visualization"))
          .andExpect(jsonPath("$.totalResults").value(2))
          .andExpect(jsonPath("$.results[0].entry.id").value("e1"))
          .andExpect(jsonPath("$.results[0].rank").value(1))
          .andExpect(jsonPath("$.results[0].entry.vector").doesNotExist())
          .andExpect(jsonPath("$.results[1].similarityScore").value(0.81));
    }

    @Test
    @DisplayName("Should reject a blank query")
    void shouldRejectBlankQuery() throws Exception {
      mockMvc
          .perform(
              post("/api/retrieval/search")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content("{\"query\":\" \"}"))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.validationErrors.query").exists());

      verify(retrievalEngine, never()).search(any(), any());
    }

    @Test
    @DisplayName("Should map invalid options to 400")
    void shouldMapInvalidOptions() throws Exception {
      when(retrievalEngine.search(eq("q"), any()))
          .thenThrow(new InvalidQueryException("limit must be greater than 0, got 0"));

      mockMvc
          .perform(
              post("/api/retrieval/search")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content("{\"query\":\"q\",\"options\":{\"limit\":0}}"))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.message").value("limit must be greater than 0, got 0"));
    }

    @Test
    @DisplayName("Should surface a rate-limited provider as 429")
    void shouldMapRateLimit() throws Exception {
      when(retrievalEngine.search(eq("q"), isNull()))
          .thenThrow(
              new RetrievalFailedException(
                  "search",
                  "q",
                  new EmbeddingException(EmbeddingException.Reason.RATE_LIMITED, "Throttled")));

      mockMvc
          .perform(
              post("/api/retrieval/search")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content("{\"query\":\"q\"}"))
          .andExpect(status().isTooManyRequests())
          .andExpect(jsonPath("$.message", startsWith("search failed for query 'q'")));
    }

    @Test
    @DisplayName("Should surface a provider timeout as 504")
    void shouldMapTimeout() throws Exception {
      when(retrievalEngine.search(eq("q"), isNull()))
          .thenThrow(
              new RetrievalFailedException(
                  "search",
                  "q",
                  new EmbeddingException(EmbeddingException.Reason.TIMEOUT, "Too slow")));

      mockMvc
          .perform(
              post("/api/retrieval/search")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content("{\"query\":\"q\"}"))
          .andExpect(status().isGatewayTimeout());
    }
  }

  @Nested
  @DisplayName("POST /api/retrieval/multi-query-search")
  class MultiQueryTests {

    @Test
    @DisplayName("Should search the given variants")
    void shouldSearchVariants() throws Exception {
      MultiQuerySearchRequest request =
          MultiQuerySearchRequest.builder().variants(List.of("charts", "plots")).build();
      when(retrievalEngine.multiQuerySearch(eq(List.of("charts", "plots")), isNull()))
          .thenReturn(List.of(result("e1", 0.9, 1)));

      mockMvc
          .perform(
              post("/api/retrieval/multi-query-search")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content(json(request)))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.query").value("charts | plots"))
          .andExpect(jsonPath("$.totalResults").value(1));
    }

    @Test
    @DisplayName("Should generate variations when only a query is given")
    void shouldGenerateVariations() throws Exception {
      when(retrievalEngine.multiQueryRetrieval(eq("charts"), isNull())).thenReturn(List.of());

      mockMvc
          .perform(
              post("/api/retrieval/multi-query-search")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content("{\"query\":\"charts\"}"))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.totalResults").value(0));

      verify(retrievalEngine, never()).multiQuerySearch(anyList(), any());
    }
  }

  @Test
  @DisplayName("POST /api/retrieval/ranked-search should use composite ranking")
  void shouldRankedSearch() throws Exception {
    when(retrievalEngine.searchWithRanking(eq("q"), isNull()))
        .thenReturn(List.of(result("e2", 0.84, 1)));

    mockMvc
        .perform(
            post("/api/retrieval/ranked-search")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\":\"q\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.results[0].similarityScore").value(0.84));
  }

  @Test
  @DisplayName("POST /api/retrieval/context should return citable passages")
  void shouldRetrieveContext() throws Exception {
    when(sourceAttributionService.retrieveContext(eq("q"), isNull()))
        .thenReturn(
            List.of(
                RetrievedContext.builder()
                    .sourceId("e1")
                    .content("Passage")
                    .relevanceScore(0.9)
                    .build()));

    mockMvc
        .perform(
            post("/api/retrieval/context")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\":\"q\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].sourceId").value("e1"))
        .andExpect(jsonPath("$[0].content").value("Passage"));
  }

  @Test
  @DisplayName("POST /api/retrieval/attribution should return annotated content")
  void shouldAttributeSources() throws Exception {
    RetrievedContext source = RetrievedContext.builder().sourceId("e1").title("Charts").build();
    AttributionRequest request =
        AttributionRequest.builder().content("Body").sources(List.of(source)).build();
    when(sourceAttributionService.attributeSources(eq("Body"), anyList()))
        .thenReturn(
            ContentWithCitations.builder()
                .content("Body\n\n## References\n\n1. Unknown Author. (n.d.). Charts.\n")
                .citations(
                    List.of(
                        Citation.builder()
                            .sourceId("e1")
                            .citationText("Unknown Author. (n.d.). Charts.")
                            .position(1)
                            .build()))
                .sources(List.of(source))
                .build());

    mockMvc
        .perform(
            post("/api/retrieval/attribution")
                .contentType(MediaType.APPLICATION_JSON)
                .content(json(request)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.citations[0].position").value(1))
        .andExpect(jsonPath("$.content", startsWith("Body\n\n## References")));
  }
}
