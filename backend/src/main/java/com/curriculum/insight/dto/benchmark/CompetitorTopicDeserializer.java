package com.curriculum.insight.dto.benchmark;

import java.io.IOException;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

/** Reads a {@link CompetitorTopic} from either a JSON string (the name) or a JSON object. */
public class CompetitorTopicDeserializer extends StdDeserializer<CompetitorTopic> {

  public CompetitorTopicDeserializer() {
    super(CompetitorTopic.class);
  }

  @Override
  public CompetitorTopic deserialize(JsonParser parser, DeserializationContext context)
      throws IOException {
    JsonNode node = parser.getCodec().readTree(parser);

    if (node.isTextual()) {
      return CompetitorTopic.named(node.asText().trim());
    }
    if (!node.isObject()) {
      return context.reportInputMismatch(
          CompetitorTopic.class,
          "Competitor topic must be a string or an object, got %s",
          node.getNodeType());
    }

    JsonNode name = node.get("name");
    if (name == null || !name.isTextual() || name.asText().isBlank()) {
      return context.reportInputMismatch(
          CompetitorTopic.class, "Competitor topic object requires a non-blank 'name'");
    }

    return CompetitorTopic.builder()
        .name(name.asText().trim())
        .description(textOrNull(node, "description"))
        .hours(node.hasNonNull("hours") ? node.get("hours").asDouble() : null)
        .moduleCode(textOrNull(node, "moduleCode"))
        .build();
  }

  private static String textOrNull(JsonNode node, String field) {
    return node.hasNonNull(field) ? node.get(field).asText() : null;
  }
}
