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

package com.rackspace.helios.app.analytics;

import com.rackspace.helios.app.config.AnalyticsProperties;
import com.rackspace.helios.app.model.AnomalyFlag;
import com.rackspace.helios.app.model.AnomalyMethod;
import com.rackspace.helios.app.model.SilverSeries;
import java.util.List;

/**
 * Flags points of a silver series that deviate from their local reference. Implementations
 * ignore {@link com.rackspace.helios.app.model.QualityFlag#MISSING} points and never modify the
 * series.
 */
public interface OutlierDetection {

  AnomalyMethod method();

  /**
   * @return flags in timestamp order
   */
  List<AnomalyFlag> detect(SilverSeries series, AnalyticsProperties.Anomaly parameters);
}
