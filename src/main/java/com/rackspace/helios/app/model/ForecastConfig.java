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

import javax.validation.constraints.DecimalMax;
import javax.validation.constraints.DecimalMin;
import javax.validation.constraints.Min;
import lombok.Data;

/**
 * Fixed settings of a seasonal ARMA model with exogenous regressors. Two fits with equal
 * configuration over equal training data produce equal models.
 */
@Data
public class ForecastConfig {
  /**
   * Season length in canonical intervals, for example 24 for a daily cycle of hourly data.
   */
  @Min(1)
  int seasonalPeriod = 24;

  @Min(0)
  int arOrder = 1;

  @Min(0)
  int maOrder = 1;

  @DecimalMin("0.5")
  @DecimalMax("0.999")
  double confidenceLevel = 0.95;

  @Min(1)
  int maxIterations = 100;

  double tolerance = 1e-6;

  /**
   * Relative ridge penalty added to the regression diagonal so constant regressors do not make
   * the design singular.
   */
  double ridge = 1e-8;

  @Override
  public String toString() {
    return String.format("ARMA(%d,%d) seasonal=%d level=%s maxIterations=%d tolerance=%s",
        arOrder, maOrder, seasonalPeriod, confidenceLevel, maxIterations, tolerance);
  }
}
