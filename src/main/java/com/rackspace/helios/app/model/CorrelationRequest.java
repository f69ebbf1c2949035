package com.rackspace.helios.app.model;

import java.time.Instant;
import javax.validation.Valid;
import javax.validation.constraints.NotNull;
import lombok.Data;

@Data
public class CorrelationRequest {
  @Valid
  @NotNull
  SeriesRef weather;
  @Valid
  @NotNull
  SeriesRef energy;
  @NotNull
  Instant start;
  @NotNull
  Instant end;
}
