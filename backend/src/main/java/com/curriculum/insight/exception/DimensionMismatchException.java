package com.curriculum.insight.exception;

import lombok.Getter;

/** Two vectors of different length were compared. */
@Getter
public class DimensionMismatchException extends IllegalArgumentException {

  private final int leftDimension;
  private final int rightDimension;

  public DimensionMismatchException(int leftDimension, int rightDimension) {
    super(
        String.format(
            "Embeddings must have the same dimension (%d vs %d)", leftDimension, rightDimension));
    this.leftDimension = leftDimension;
    this.rightDimension = rightDimension;
  }
}
