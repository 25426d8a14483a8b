package com.curriculum.insight.dto.corpus;

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
@Schema(description = "Selects corpus entries to delete, by id and/or by domain")
public class DeleteEntriesRequest {

  private List<String> ids;

  @Schema(description = "Delete every entry of this domain")
  private String domain;
}
