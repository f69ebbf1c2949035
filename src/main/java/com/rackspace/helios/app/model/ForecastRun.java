package com.rackspace.helios.app.model;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ForecastRun {
  List<ForecastResult> results;
  ForecastDiagnostics diagnostics;
}
