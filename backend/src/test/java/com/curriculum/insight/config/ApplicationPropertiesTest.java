package com.curriculum.insight.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.TestPropertySource;

import com.curriculum.insight.service.retrieval.UndatedEntryPolicy;

@SpringBootTest(classes = ApplicationProperties.class)
@EnableConfigurationProperties(ApplicationProperties.class)
@TestPropertySource(
    properties = {
      "insight.retrieval.default-min-similarity=0.6",
      "insight.retrieval.default-limit=5",
      "insight.retrieval.undated-entries=include",
      "insight.benchmark.gap-threshold=0.65",
      "insight.benchmark.max-high-severity-callouts=5",
      "insight.embedding.provider=local",
      "insight.embedding.dimensions=64",
      "insight.cache.enabled=true",
      "insight.cache.max-size=500",
      "insight.cache.expire-after-write-minutes=30",
      "insight.competitors.storage-file=/tmp/competitors.json"
    })
public class ApplicationPropertiesTest {

  @Autowired private ApplicationProperties applicationProperties;

  @Test
  public void testRetrievalProperties() {
    ApplicationProperties.Retrieval retrieval = applicationProperties.getRetrieval();
    assertEquals(0.6, retrieval.getDefaultMinSimilarity());
    assertEquals(5, retrieval.getDefaultLimit());
    assertEquals(UndatedEntryPolicy.INCLUDE, retrieval.getUndatedEntries());
    assertEquals(5, retrieval.getRecencyWindowYears());
  }

  @Test
  public void testBenchmarkProperties() {
    ApplicationProperties.Benchmark benchmark = applicationProperties.getBenchmark();
    assertEquals(0.65, benchmark.getGapThreshold());
    assertEquals(5, benchmark.getMaxHighSeverityCallouts());
    assertEquals(0.7, benchmark.getCoverageThreshold());
    assertEquals(120.0, benchmark.getDefaultProgramHours());
  }

  @Test
  public void testEmbeddingAndCacheProperties() {
    assertEquals("local", applicationProperties.getEmbedding().getProvider());
    assertEquals(64, applicationProperties.getEmbedding().getDimensions());
    assertTrue(applicationProperties.getCache().isEnabled());
    assertEquals(500, applicationProperties.getCache().getMaxSize());
    assertEquals(30, applicationProperties.getCache().getExpireAfterWriteMinutes());
    assertEquals("/tmp/competitors.json", applicationProperties.getCompetitors().getStorageFile());
  }

  @Test
  public void testDefaults() {
    ApplicationProperties defaults = new ApplicationProperties();
    assertEquals(0.75, defaults.getRetrieval().getDefaultMinSimilarity());
    assertEquals(10, defaults.getRetrieval().getDefaultLimit());
    assertEquals(UndatedEntryPolicy.EXCLUDE, defaults.getRetrieval().getUndatedEntries());
    assertEquals("bedrock", defaults.getEmbedding().getProvider());
    assertFalse(defaults.getCache().isEnabled());
  }
}
