/*
 * Copyright 2022 Rackspace US, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.rackspace.helios.app.model;

import java.time.Instant;
import java.util.List;
import lombok.Data;

/**
 * Summary of a fitted forecast model, kept alongside its forecast points under the same
 * <code>modelId</code> for later evaluation.
 */
@Data
public class ForecastDiagnostics {
  String modelId;
  String entityId;
  String metric;
  Instant trainingStart;
  Instant trainingEnd;
  ForecastConfig config;
  List<String> exogenous;
  double[] seasonalProfile;
  double[] exogenousCoefficients;
  double[] arCoefficients;
  double[] maCoefficients;
  double residualMean;
  double residualStdDev;
  int residualCount;
  int iterations;
  boolean converged;
}
