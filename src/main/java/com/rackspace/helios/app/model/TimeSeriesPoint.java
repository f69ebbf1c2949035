package com.rackspace.helios.app.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TimeSeriesPoint {
  String entityId;
  String metric;
  Instant timestamp;
  /**
   * Null only when the quality flag is {@link QualityFlag#MISSING}.
   */
  Double value;
  QualityFlag qualityFlag;
  Layer layer;
  /**
   * Set when the value was chosen among conflicting raw observations of the same timestamp.
   */
  boolean corrected;

  @JsonIgnore
  public boolean hasValue() {
    return value != null && qualityFlag != QualityFlag.MISSING;
  }
}
