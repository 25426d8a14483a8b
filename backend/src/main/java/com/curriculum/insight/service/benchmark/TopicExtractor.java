package com.curriculum.insight.service.benchmark;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

import com.curriculum.insight.dto.benchmark.CurriculumUnit;

/** Derives the topic vocabulary of a generated curriculum from its units. */
@Component
public class TopicExtractor {

  private static final Pattern CONTENT_SEPARATORS = Pattern.compile("[,;.\\n]");
  private static final int MIN_FRAGMENT_LENGTH = 4;

  /**
   * Each unit contributes its title verbatim followed by the fragments of its indicative content
   * that are longer than three characters. Order of first appearance is kept.
   *
   * @param units curriculum units, may be empty
   * @return distinct topics in order of first appearance
   */
  public Set<String> extractTopics(List<CurriculumUnit> units) {
    Set<String> topics = new LinkedHashSet<>();
    if (units == null) {
      return topics;
    }

    for (CurriculumUnit unit : units) {
      if (unit.getUnitTitle() != null) {
        topics.add(unit.getUnitTitle());
      }
      if (unit.getIndicativeContent() == null) {
        continue;
      }
      for (String fragment : CONTENT_SEPARATORS.split(unit.getIndicativeContent())) {
        String topic = fragment.trim();
        if (topic.length() >= MIN_FRAGMENT_LENGTH) {
          topics.add(topic);
        }
      }
    }
    return topics;
  }
}
