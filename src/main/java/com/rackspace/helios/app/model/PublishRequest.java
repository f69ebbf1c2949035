package com.rackspace.helios.app.model;

import java.time.Instant;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import lombok.Data;

@Data
public class PublishRequest {
  @NotBlank
  String table;
  @NotNull
  PublishSource source;
  @NotBlank
  String entityId;
  /**
   * Required by every source except {@link PublishSource#CORRELATIONS}.
   */
  String metric;
  /**
   * Only used for {@link PublishSource#GOLD}.
   */
  AggregateKind kind;
  /**
   * Second entity of the pair, only used for {@link PublishSource#CORRELATIONS}.
   */
  String pairedEntityId;
  /**
   * The forecast run to publish, only used for {@link PublishSource#FORECASTS}. Its points are
   * further limited to horizon timestamps in <code>[start, end)</code>.
   */
  Instant generatedAt;
  @NotNull
  Instant start;
  @NotNull
  Instant end;
}
