package com.curriculum.insight.service.vector;

import java.nio.charset.StandardCharsets;
import java.text.Normalizer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import com.curriculum.insight.config.ApplicationProperties;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

import lombok.extern.slf4j.Slf4j;

/**
 * Offline embedding provider for local development and tests.
 *
 * <p>Uses bag-of-words term frequencies folded into a fixed number of dimensions with the hashing
 * trick, then L2-normalized. Texts sharing vocabulary score high, unrelated texts score near 0.
 */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "insight.embedding", name = "provider", havingValue = "local")
public class LocalHashingEmbeddingProvider implements EmbeddingProvider {

  private static final String MODEL_ID = "local-hashing";

  private final Pattern splitPattern = Pattern.compile("[^\\p{Alnum}]+");
  private final HashFunction hashFunction = Hashing.murmur3_32_fixed();
  private final int dimensions;

  public LocalHashingEmbeddingProvider(ApplicationProperties properties) {
    this.dimensions = Math.max(8, properties.getEmbedding().getDimensions());
    log.info("Using local hashing embeddings with {} dimensions", dimensions);
  }

  @Override
  public List<Float> embed(String text) {
    float[] vector = new float[dimensions];
    for (Map.Entry<String, Integer> term : termFrequency(normalize(text)).entrySet()) {
      int hash = hashFunction.hashString(term.getKey(), StandardCharsets.UTF_8).asInt();
      int index = Math.floorMod(hash, dimensions);
      // Sign bit spreads collisions instead of stacking them
      float sign = (hash & 0x40000000) == 0 ? 1f : -1f;
      vector[index] += sign * term.getValue();
    }

    double norm = 0.0;
    for (float v : vector) {
      norm += v * v;
    }
    norm = Math.sqrt(norm);

    List<Float> embedding = new ArrayList<>(dimensions);
    for (float v : vector) {
      embedding.add(norm == 0.0 ? 0f : (float) (v / norm));
    }
    return embedding;
  }

  @Override
  public String getModelId() {
    return MODEL_ID + "-" + dimensions;
  }

  private String normalize(String s) {
    if (s == null) {
      return "";
    }
    String n =
        Normalizer.normalize(s, Normalizer.Form.NFKC)
            .toLowerCase(Locale.ROOT)
            .replace('\n', ' ')
            .replace('\r', ' ');
    return n.replaceAll("\\s+", " ").trim();
  }

  private Map<String, Integer> termFrequency(String text) {
    Map<String, Integer> tf = new LinkedHashMap<>();
    for (String token : splitPattern.split(text)) {
      String tok = token.strip();
      if (tok.length() < 2) {
        continue;
      }
      tf.merge(tok, 1, Integer::sum);
    }
    return tf;
  }
}
