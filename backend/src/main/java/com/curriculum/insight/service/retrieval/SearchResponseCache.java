package com.curriculum.insight.service.retrieval;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import org.springframework.stereotype.Component;

import com.curriculum.insight.config.ApplicationProperties;
import com.curriculum.insight.dto.retrieval.RetrievalResult;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.hash.Hashing;

import lombok.extern.slf4j.Slf4j;

/**
 * Pass-through cache of ranked search results keyed by a SHA-256 hash of the operation, query
 * text and resolved options. A disabled cache never returns a hit.
 *
 * <p>Keys also carry the corpus generation, which every corpus change advances. A search that read
 * the corpus before a change can only write under the old generation, where no later lookup
 * looks.
 */
@Slf4j
@Component
public class SearchResponseCache {

  private final Cache<String, List<RetrievalResult>> cache;
  private final AtomicLong generation = new AtomicLong();

  public SearchResponseCache(ApplicationProperties properties) {
    ApplicationProperties.Cache cacheProperties = properties.getCache();
    if (cacheProperties.isEnabled() && cacheProperties.getMaxSize() > 0) {
      this.cache =
          CacheBuilder.newBuilder()
              .maximumSize(cacheProperties.getMaxSize())
              .expireAfterWrite(
                  Math.max(1, cacheProperties.getExpireAfterWriteMinutes()), TimeUnit.MINUTES)
              .build();
      log.info(
          "Search response cache enabled (max {} entries, {} min TTL)",
          cacheProperties.getMaxSize(),
          cacheProperties.getExpireAfterWriteMinutes());
    } else {
      this.cache = null;
    }
  }

  public static String key(String operation, String queryText, String optionsFingerprint) {
    return Hashing.sha256()
        .newHasher()
        .putString(operation, StandardCharsets.UTF_8)
        .putByte((byte) 0)
        .putString(queryText, StandardCharsets.UTF_8)
        .putByte((byte) 0)
        .putString(optionsFingerprint, StandardCharsets.UTF_8)
        .hash()
        .toString();
  }

  /** Key under the current corpus generation. Take it before reading the corpus. */
  public String currentKey(String operation, String queryText, String optionsFingerprint) {
    return key(operation, queryText, optionsFingerprint + ";generation=" + generation.get());
  }

  public long generation() {
    return generation.get();
  }

  public Optional<List<RetrievalResult>> get(String key) {
    if (cache == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(cache.getIfPresent(key));
  }

  public void put(String key, List<RetrievalResult> results) {
    if (cache != null) {
      cache.put(key, List.copyOf(results));
    }
  }

  /**
   * Advances the corpus generation and drops every cached response. Called after each corpus
   * change.
   */
  public void invalidateAll() {
    generation.incrementAndGet();
    if (cache != null) {
      cache.invalidateAll();
    }
  }

  public boolean isEnabled() {
    return cache != null;
  }
}
