package com.rackspace.helios.app.model;

import java.time.Duration;
import java.time.Instant;
import lombok.Data;

@Data
public class GoldSummary {
  String entityId;
  String metric;
  Instant windowStart;
  Instant windowEnd;
  /**
   * The configured window width; <code>windowEnd</code> may differ from
   * <code>windowStart + window</code> across a daylight saving change of the reference zone.
   */
  Duration window;
  AggregateKind aggregateKind;
  double value;
  /**
   * points_present / points_expected for the window.
   */
  double completenessRatio;
  int pointsPresent;
  int pointsExpected;
}
