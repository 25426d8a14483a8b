package com.curriculum.insight.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import com.curriculum.insight.service.retrieval.UndatedEntryPolicy;

import lombok.Data;

@Data
@Component
@ConfigurationProperties(prefix = "insight")
public class ApplicationProperties {

  private Retrieval retrieval = new Retrieval();
  private Benchmark benchmark = new Benchmark();
  private Embedding embedding = new Embedding();
  private Cache cache = new Cache();
  private Competitors competitors = new Competitors();

  @Data
  public static class Retrieval {
    private double defaultMinSimilarity = 0.75;
    private int defaultLimit = 10;
    private double defaultRecencyWeight = 0.0;
    private int recencyWindowYears = 5;

    /** Admission of entries without a publication date that are not foundational. */
    private UndatedEntryPolicy undatedEntries = UndatedEntryPolicy.EXCLUDE;
  }

  @Data
  public static class Benchmark {
    private double coverageThreshold = 0.7;
    private double gapThreshold = 0.6;
    private double highSeverityThreshold = 0.3;
    private double mediumSeverityThreshold = 0.5;
    private double strengthThreshold = 0.5;
    private double defaultProgramHours = 120;
    private int maxHighSeverityCallouts = 3;
  }

  @Data
  public static class Embedding {
    /** Either "bedrock" or "local". */
    private String provider = "bedrock";

    private String modelId = "amazon.titan-embed-text-v2:0";
    private String region = "us-east-1";
    private int dimensions = 256;
    private long timeoutMs = 30000;
    private int maxConcurrency = 8;
  }

  @Data
  public static class Cache {
    private boolean enabled;
    private long maxSize;
    private long expireAfterWriteMinutes;
  }

  @Data
  public static class Competitors {
    /** JSON file backing the competitor store. Blank keeps competitors in memory only. */
    private String storageFile;
  }
}
