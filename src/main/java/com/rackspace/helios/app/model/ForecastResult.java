package com.rackspace.helios.app.model;

import java.time.Instant;
import lombok.Data;

@Data
public class ForecastResult {
  String entityId;
  String metric;
  Instant generatedAt;
  Instant horizonTimestamp;
  double pointEstimate;
  double lowerBound;
  double upperBound;
  String modelId;
}
