package com.curriculum.insight.service.corpus;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/** Keyed store of embedded corpus entries. Retrieval only ever reads from it. */
public interface CorpusStore {

  /**
   * Returns every entry matching the filter predicate.
   *
   * @param filter metadata predicate
   * @return matching entries, in no guaranteed order
   */
  List<EmbeddedEntry> query(Predicate<EmbeddedEntry> filter);

  /**
   * Inserts entries. An entry whose id already exists replaces the stored one.
   *
   * @param entries entries to store
   */
  void insert(Collection<EmbeddedEntry> entries);

  Optional<EmbeddedEntry> findById(String id);

  /**
   * Deletes entries by id.
   *
   * @return number of entries removed
   */
  int deleteByIds(Collection<String> ids);

  /**
   * Deletes every entry matching the predicate.
   *
   * @return number of entries removed
   */
  int deleteWhere(Predicate<EmbeddedEntry> predicate);

  long count();
}
