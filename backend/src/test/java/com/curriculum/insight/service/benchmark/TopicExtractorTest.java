package com.curriculum.insight.service.benchmark;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.curriculum.insight.dto.benchmark.CurriculumUnit;

@DisplayName("TopicExtractor Tests")
class TopicExtractorTest {

  private final TopicExtractor extractor = new TopicExtractor();

  @Test
  @DisplayName("Should take unit titles and content fragments in order of first appearance")
  void shouldExtractTitlesAndFragments() {
    List<CurriculumUnit> units =
        List.of(
            CurriculumUnit.builder()
                .unitTitle("Data Visualization")
                .indicativeContent("Bar charts, scatter plots; dashboards.\nColour theory")
                .build(),
            CurriculumUnit.builder()
                .unitTitle("Statistics")
                .indicativeContent("Regression, bar charts")
                .build());

    assertThat(extractor.extractTopics(units))
        .containsExactly(
            "Data Visualization",
            "Bar charts",
            "scatter plots",
            "dashboards",
            "Colour theory",
            "Statistics",
            "Regression",
            "bar charts");
  }

  @Test
  @DisplayName("Should drop fragments shorter than four characters")
  void shouldDropShortFragments() {
    List<CurriculumUnit> units =
        List.of(CurriculumUnit.builder().indicativeContent("SQL, R, ETL jobs,  , APIs").build());

    assertThat(extractor.extractTopics(units)).containsExactly("ETL jobs", "APIs");
  }

  @Test
  @DisplayName("Should return no topics for missing units")
  void shouldHandleMissingUnits() {
    assertThat(extractor.extractTopics(null)).isEmpty();
    assertThat(extractor.extractTopics(List.of())).isEmpty();
  }
}
