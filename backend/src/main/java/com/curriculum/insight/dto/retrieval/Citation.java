package com.curriculum.insight.dto.retrieval;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Citation {
  private String sourceId;
  private String citationText;

  /** 1-based position in the reference list. */
  private int position;
}
