package com.curriculum.insight.service.corpus;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import java.util.stream.Collectors;

import org.springframework.stereotype.Repository;

import lombok.extern.slf4j.Slf4j;

@Slf4j
@Repository
public class InMemoryCorpusStore implements CorpusStore {

  private final Map<String, EmbeddedEntry> entries = new ConcurrentHashMap<>();

  @Override
  public List<EmbeddedEntry> query(Predicate<EmbeddedEntry> filter) {
    return entries.values().stream().filter(filter).collect(Collectors.toList());
  }

  @Override
  public void insert(Collection<EmbeddedEntry> newEntries) {
    for (EmbeddedEntry entry : newEntries) {
      if (entry.getId() == null || entry.getId().isBlank()) {
        throw new IllegalArgumentException("Corpus entries require an id");
      }
      entries.put(entry.getId(), entry);
    }
    log.debug("Inserted {} corpus entries, corpus size {}", newEntries.size(), entries.size());
  }

  @Override
  public Optional<EmbeddedEntry> findById(String id) {
    if (id == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(entries.get(id));
  }

  @Override
  public int deleteByIds(Collection<String> ids) {
    int removed = 0;
    for (String id : ids) {
      if (id != null && entries.remove(id) != null) {
        removed++;
      }
    }
    return removed;
  }

  @Override
  public int deleteWhere(Predicate<EmbeddedEntry> predicate) {
    List<String> matching = new ArrayList<>();
    entries.forEach(
        (id, entry) -> {
          if (predicate.test(entry)) {
            matching.add(id);
          }
        });
    return deleteByIds(matching);
  }

  @Override
  public long count() {
    return entries.size();
  }
}
