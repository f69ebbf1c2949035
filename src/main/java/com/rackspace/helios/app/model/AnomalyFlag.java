package com.rackspace.helios.app.model;

import java.time.Instant;
import lombok.Data;

@Data
public class AnomalyFlag {
  String entityId;
  String metric;
  Instant timestamp;
  double severity;
  String method;
  double referenceValue;
  double value;
}
