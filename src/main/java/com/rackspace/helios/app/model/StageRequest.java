package com.rackspace.helios.app.model;

import java.time.Instant;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import lombok.Data;

@Data
public class StageRequest {
  @NotBlank
  String entityId;
  @NotBlank
  String metric;
  @NotNull
  Instant start;
  @NotNull
  Instant end;
}
