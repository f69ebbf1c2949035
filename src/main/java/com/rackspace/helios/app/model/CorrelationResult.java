package com.rackspace.helios.app.model;

import java.time.Instant;
import lombok.Data;

@Data
public class CorrelationResult {
  /**
   * The two entity ids joined by <code>|</code>, first series first.
   */
  String entityPair;
  String metricPair;
  Instant windowStart;
  Instant windowEnd;
  /**
   * The second series is read at <code>t + lag</code> intervals against the first series at
   * <code>t</code>.
   */
  int lag;
  double coefficient;
  int pairedPoints;
}
