package com.curriculum.insight.service.benchmark;

import java.util.List;
import java.util.Optional;

import com.curriculum.insight.dto.benchmark.CompetitorProgram;

/** Storage for imported competitor programs. Programs are never modified once stored. */
public interface CompetitorStore {

  /** All programs, newest first. */
  List<CompetitorProgram> list();

  Optional<CompetitorProgram> getById(String id);

  /**
   * Store a program that already carries its id.
   *
   * @return the stored program
   */
  CompetitorProgram insert(CompetitorProgram program);

  /** Returns true if a program was removed. */
  boolean deleteById(String id);
}
