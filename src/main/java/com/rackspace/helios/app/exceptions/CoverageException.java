package com.rackspace.helios.app.exceptions;

import java.time.Instant;
import lombok.Getter;

/**
 * An exogenous series does not provide values for every training and horizon step.
 */
public class CoverageException extends RuntimeException {

  @Getter
  private final String series;
  @Getter
  private final Instant firstUncovered;

  public CoverageException(String series, Instant firstUncovered) {
    super("Exogenous series " + series + " has no value at " + firstUncovered);
    this.series = series;
    this.firstUncovered = firstUncovered;
  }
}
