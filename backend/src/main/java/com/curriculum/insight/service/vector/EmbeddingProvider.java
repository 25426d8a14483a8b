package com.curriculum.insight.service.vector;

import java.util.List;

/**
 * External capability that turns text into a fixed-length embedding vector. Implementations must
 * be deterministic enough that the same text yields vectors with a self-similarity of 1.0.
 */
public interface EmbeddingProvider {

  /**
   * Generate an embedding for a single text.
   *
   * @param text the text to embed
   * @return the embedding vector
   * @throws com.curriculum.insight.exception.EmbeddingException on provider failure, timeout or
   *     rate limiting
   */
  List<Float> embed(String text);

  /** Identifier of the underlying model, used in logs and cache keys. */
  String getModelId();
}
