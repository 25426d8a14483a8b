package com.curriculum.insight.dto.retrieval;

import java.util.List;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(
    description =
        "Multi-query search. Explicit variants are searched as given; otherwise the standard"
            + " variations of the query are generated.")
public class MultiQuerySearchRequest {

  private List<String> variants;

  private String query;

  private RetrievalOptions options;
}
