package com.rackspace.helios.app.model;

import javax.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SeriesRef {
  @NotBlank
  String entityId;
  @NotBlank
  String metric;

  @Override
  public String toString() {
    return entityId + "/" + metric;
  }
}
