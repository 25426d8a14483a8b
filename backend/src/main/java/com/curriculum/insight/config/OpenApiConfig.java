package com.curriculum.insight.config;

import java.util.List;

import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;

@Configuration
public class OpenApiConfig {

  private static final String DESCRIPTION =
      "Semantic retrieval over an embedded knowledge corpus and benchmarking of generated"
          + " curricula against competitor programs.";

  @Value("${springdoc.info.title:Curriculum Insight API}")
  private String title;

  @Value("${springdoc.info.version:1.0.0}")
  private String version;

  @Value("${server.port:8080}")
  private String serverPort;

  @Bean
  public OpenAPI customOpenAPI() {
    return new OpenAPI()
        .info(new Info().title(title).version(version).description(DESCRIPTION))
        .tags(
            List.of(
                new Tag().name("Retrieval").description("Semantic search and source attribution"),
                new Tag().name("Corpus").description("Indexing of knowledge entries"),
                new Tag().name("Benchmarks").description("Curriculum benchmarking")))
        .servers(List.of(new Server().url("http://localhost:" + serverPort)));
  }

  @Bean
  public GroupedOpenApi retrievalApi() {
    return GroupedOpenApi.builder()
        .group("retrieval")
        .pathsToMatch("/api/retrieval/**", "/api/corpus/**")
        .build();
  }

  @Bean
  public GroupedOpenApi benchmarkApi() {
    return GroupedOpenApi.builder().group("benchmarks").pathsToMatch("/api/benchmarks/**").build();
  }
}
