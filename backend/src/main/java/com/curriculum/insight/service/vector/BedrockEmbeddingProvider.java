package com.curriculum.insight.service.vector;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import com.curriculum.insight.config.ApplicationProperties;
import com.curriculum.insight.exception.EmbeddingException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.core.exception.ApiCallAttemptTimeoutException;
import software.amazon.awssdk.core.exception.ApiCallTimeoutException;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.bedrockruntime.BedrockRuntimeClient;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelRequest;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelResponse;
import software.amazon.awssdk.services.bedrockruntime.model.ModelTimeoutException;
import software.amazon.awssdk.services.bedrockruntime.model.ServiceQuotaExceededException;
import software.amazon.awssdk.services.bedrockruntime.model.ThrottlingException;

/**
 * Embedding provider backed by AWS Bedrock. Uses the Amazon Titan Text Embeddings model, one
 * request per text (Titan has no batch mode).
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(
    prefix = "insight.embedding",
    name = "provider",
    havingValue = "bedrock",
    matchIfMissing = true)
public class BedrockEmbeddingProvider implements EmbeddingProvider {

  private final ObjectMapper objectMapper;
  private final ApplicationProperties properties;
  private final BedrockRuntimeClient bedrockClient;

  @Override
  public List<Float> embed(String text) {
    log.debug(
        "Generating embedding for text: {}",
        text.substring(0, Math.min(text.length(), 100)) + "...");

    String payload;
    try {
      payload = objectMapper.writeValueAsString(Map.of("inputText", text));
    } catch (JsonProcessingException e) {
      throw new EmbeddingException(
          EmbeddingException.Reason.PROVIDER_ERROR, "Failed to build embedding request", e);
    }

    InvokeModelRequest invokeRequest =
        InvokeModelRequest.builder()
            .modelId(getModelId())
            .contentType("application/json")
            .accept("application/json")
            .body(SdkBytes.fromString(payload, StandardCharsets.UTF_8))
            .build();

    InvokeModelResponse response;
    try {
      response = bedrockClient.invokeModel(invokeRequest);
    } catch (ThrottlingException | ServiceQuotaExceededException e) {
      log.warn("Bedrock rate limit hit while embedding: {}", e.getMessage());
      throw new EmbeddingException(
          EmbeddingException.Reason.RATE_LIMITED, "Embedding provider rate limit exceeded", e);
    } catch (ModelTimeoutException | ApiCallTimeoutException | ApiCallAttemptTimeoutException e) {
      throw new EmbeddingException(
          EmbeddingException.Reason.TIMEOUT, "Embedding provider timed out", e);
    } catch (SdkException e) {
      log.error("Error generating embedding for text", e);
      throw new EmbeddingException(
          EmbeddingException.Reason.PROVIDER_ERROR, "Failed to generate embedding", e);
    }

    return parseEmbedding(response.body().asUtf8String());
  }

  @Override
  public String getModelId() {
    return properties.getEmbedding().getModelId();
  }

  private List<Float> parseEmbedding(String responseJson) {
    try {
      @SuppressWarnings("unchecked")
      Map<String, Object> responseMap = objectMapper.readValue(responseJson, Map.class);

      @SuppressWarnings("unchecked")
      List<Number> embedding = (List<Number>) responseMap.get("embedding");
      if (embedding == null || embedding.isEmpty()) {
        throw new EmbeddingException(
            EmbeddingException.Reason.PROVIDER_ERROR, "No embedding in model response");
      }

      return embedding.stream().map(Number::floatValue).collect(Collectors.toList());
    } catch (JsonProcessingException e) {
      throw new EmbeddingException(
          EmbeddingException.Reason.PROVIDER_ERROR, "Unreadable embedding response", e);
    }
  }
}
