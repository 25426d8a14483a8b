package com.curriculum.insight.config;

import java.time.Duration;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.bedrockruntime.BedrockRuntimeClient;

@Slf4j
@Configuration
@ConditionalOnProperty(
    prefix = "insight.embedding",
    name = "provider",
    havingValue = "bedrock",
    matchIfMissing = true)
public class EmbeddingClientConfig {

  @Bean(destroyMethod = "close")
  public BedrockRuntimeClient bedrockRuntimeClient(ApplicationProperties properties) {
    ApplicationProperties.Embedding embedding = properties.getEmbedding();
    log.info(
        "Creating Bedrock runtime client for embeddings (region: {}, model: {})",
        embedding.getRegion(),
        embedding.getModelId());
    return BedrockRuntimeClient.builder()
        .region(Region.of(embedding.getRegion()))
        .credentialsProvider(DefaultCredentialsProvider.create())
        .overrideConfiguration(
            ClientOverrideConfiguration.builder()
                .apiCallTimeout(Duration.ofMillis(embedding.getTimeoutMs()))
                .build())
        .build();
  }
}
