package com.curriculum.insight.dto.corpus;

import java.util.List;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BulkIndexRequest {

  @Valid
  @NotEmpty(message = "At least one entry is required")
  private List<IndexEntryRequest> entries;
}
