package com.curriculum.insight.service.vector;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import com.curriculum.insight.config.ApplicationProperties;
import com.curriculum.insight.exception.EmbeddingException;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;

import lombok.extern.slf4j.Slf4j;

/**
 * Entry point to the embedding provider. Caches embeddings of reused text and fans out
 * independent texts concurrently under a single shared deadline. When any request fails or the
 * deadline passes, every outstanding request of the batch is cancelled.
 */
@Slf4j
@Service
public class EmbeddingService {

  private final EmbeddingProvider provider;
  private final ThreadPoolTaskExecutor executor;
  private final long timeoutMs;
  private final Cache<String, List<Float>> embeddingCache;

  public EmbeddingService(
      EmbeddingProvider provider,
      @Qualifier("embeddingTaskExecutor") ThreadPoolTaskExecutor executor,
      ApplicationProperties properties) {
    this.provider = provider;
    this.executor = executor;
    this.timeoutMs = properties.getEmbedding().getTimeoutMs();

    ApplicationProperties.Cache cacheProperties = properties.getCache();
    if (cacheProperties.isEnabled() && cacheProperties.getMaxSize() > 0) {
      this.embeddingCache =
          CacheBuilder.newBuilder()
              .maximumSize(cacheProperties.getMaxSize())
              .expireAfterWrite(
                  Math.max(1, cacheProperties.getExpireAfterWriteMinutes()), TimeUnit.MINUTES)
              .build();
    } else {
      this.embeddingCache = null;
    }
  }

  /**
   * Embed a single text.
   *
   * @param text the text to embed
   * @return the embedding vector
   */
  public List<Float> embed(String text) {
    return embedAll(List.of(text)).get(0);
  }

  /**
   * Embed several texts concurrently. Duplicate texts are embedded once.
   *
   * @param texts the texts to embed
   * @return embeddings in the same order as {@code texts}
   * @throws EmbeddingException if any request fails, times out or is rate limited
   */
  public List<List<Float>> embedAll(List<String> texts) {
    if (texts.isEmpty()) {
      return List.of();
    }

    Map<String, List<Float>> resolved = new HashMap<>();
    List<String> pending = new ArrayList<>();
    for (String text : new LinkedHashSet<>(texts)) {
      List<Float> cached = embeddingCache != null ? embeddingCache.getIfPresent(text) : null;
      if (cached != null) {
        resolved.put(text, cached);
      } else {
        pending.add(text);
      }
    }

    if (!pending.isEmpty()) {
      log.debug(
          "Embedding {} text(s) with {} ({} served from cache)",
          pending.size(),
          provider.getModelId(),
          resolved.size());
      resolved.putAll(fanOut(pending));
    }

    return texts.stream().map(resolved::get).collect(Collectors.toList());
  }

  /**
   * At most one task per pool thread is submitted at a time, so a batch never depends on the
   * executor's queue capacity however many texts it holds.
   */
  private Map<String, List<Float>> fanOut(List<String> pending) {
    CompletionService<List<Float>> completionService = new ExecutorCompletionService<>(executor);
    Map<Future<List<Float>>, String> inFlight = new IdentityHashMap<>();
    Map<String, List<Float>> results = new HashMap<>();
    Iterator<String> waiting = pending.iterator();
    int window = Math.max(1, executor.getMaxPoolSize());
    long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);

    try {
      while (inFlight.size() < window && waiting.hasNext()) {
        submit(completionService, inFlight, waiting.next());
      }

      for (int received = 0; received < pending.size(); received++) {
        long remaining = deadline - System.nanoTime();
        Future<List<Float>> done =
            completionService.poll(Math.max(0, remaining), TimeUnit.NANOSECONDS);
        if (done == null) {
          throw new EmbeddingException(
              EmbeddingException.Reason.TIMEOUT,
              String.format(
                  "Embedding %d text(s) exceeded %d ms (%d completed)",
                  pending.size(), timeoutMs, received));
        }

        String text = inFlight.remove(done);
        List<Float> embedding = done.get();
        if (embedding == null || embedding.isEmpty()) {
          throw new EmbeddingException(
              EmbeddingException.Reason.PROVIDER_ERROR, "Embedding provider returned no vector");
        }
        List<Float> immutable = List.copyOf(embedding);
        results.put(text, immutable);
        if (embeddingCache != null) {
          embeddingCache.put(text, immutable);
        }
        if (waiting.hasNext()) {
          submit(completionService, inFlight, waiting.next());
        }
      }
      return results;

    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof EmbeddingException) {
        throw (EmbeddingException) cause;
      }
      throw new EmbeddingException(
          EmbeddingException.Reason.PROVIDER_ERROR, "Failed to generate embedding", cause);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new EmbeddingException(
          EmbeddingException.Reason.INTERRUPTED, "Embedding request interrupted", e);
    } catch (RejectedExecutionException e) {
      throw new EmbeddingException(
          EmbeddingException.Reason.PROVIDER_ERROR, "Embedding executor saturated", e);
    } finally {
      if (!inFlight.isEmpty()) {
        log.debug("Cancelling {} outstanding embedding request(s)", inFlight.size());
        inFlight.keySet().forEach(future -> future.cancel(true));
      }
    }
  }

  private void submit(
      CompletionService<List<Float>> completionService,
      Map<Future<List<Float>>, String> inFlight,
      String text) {
    inFlight.put(completionService.submit(() -> provider.embed(text)), text);
  }

  /** Drops every cached embedding. */
  public void clearCache() {
    if (embeddingCache != null) {
      embeddingCache.invalidateAll();
    }
  }
}
