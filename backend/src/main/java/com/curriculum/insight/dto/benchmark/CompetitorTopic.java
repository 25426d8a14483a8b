package com.curriculum.insight.dto.benchmark;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A topic taught by a competitor program. Imported data may give a topic as a bare name or as an
 * object; both forms are resolved to this type when the program is read.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonDeserialize(using = CompetitorTopicDeserializer.class)
public class CompetitorTopic {
  private String name;
  private String description;
  private Double hours;
  private String moduleCode;

  public static CompetitorTopic named(String name) {
    return CompetitorTopic.builder().name(name).build();
  }
}
