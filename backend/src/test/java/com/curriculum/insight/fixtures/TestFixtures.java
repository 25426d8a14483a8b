package com.curriculum.insight.fixtures;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import com.curriculum.insight.config.ApplicationProperties;
import com.curriculum.insight.config.MdcTaskDecorator;
import com.curriculum.insight.service.corpus.EmbeddedEntry;

/** Shared builders for unit tests. */
public final class TestFixtures {

  /** All recency math in tests runs against this date. */
  public static final LocalDate TODAY = LocalDate.of(2025, 6, 15);

  private TestFixtures() {}

  public static Clock fixedClock() {
    return Clock.fixed(TODAY.atStartOfDay().toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
  }

  public static ApplicationProperties properties() {
    ApplicationProperties properties = new ApplicationProperties();
    properties.getEmbedding().setTimeoutMs(2000);
    properties.getEmbedding().setMaxConcurrency(4);
    return properties;
  }

  public static ApplicationProperties propertiesWithCache() {
    ApplicationProperties properties = properties();
    properties.getCache().setEnabled(true);
    properties.getCache().setMaxSize(100);
    properties.getCache().setExpireAfterWriteMinutes(5);
    return properties;
  }

  public static ThreadPoolTaskExecutor executor(int threads) {
    return executor(threads, 100);
  }

  public static ThreadPoolTaskExecutor executor(int threads, int queueCapacity) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(threads);
    executor.setMaxPoolSize(threads);
    executor.setQueueCapacity(queueCapacity);
    executor.setThreadNamePrefix("test-embed-");
    executor.setTaskDecorator(new MdcTaskDecorator());
    executor.initialize();
    return executor;
  }

  public static List<Float> vector(double... values) {
    List<Float> vector = new ArrayList<>(values.length);
    for (double value : values) {
      vector.add((float) value);
    }
    return vector;
  }

  public static EmbeddedEntry.EmbeddedEntryBuilder entry(String id, List<Float> vector) {
    return EmbeddedEntry.builder()
        .id(id)
        .content("Content of " + id)
        .vector(vector)
        .domain("data-science")
        .credibilityScore(80)
        .publicationDate(TODAY.minusYears(1))
        .tags(Set.of())
        .title("Title " + id)
        .createdAt(Instant.EPOCH);
  }
}
