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

package com.rackspace.helios.app.services;

import com.rackspace.helios.app.analytics.OutlierDetection;
import com.rackspace.helios.app.config.AnalyticsProperties;
import com.rackspace.helios.app.model.AnomalyFlag;
import com.rackspace.helios.app.model.AnomalyMethod;
import com.rackspace.helios.app.model.SilverSeries;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class AnomalyDetector {

  private final AnalyticsProperties analyticsProperties;
  private final Map<AnomalyMethod, OutlierDetection> detections = new EnumMap<>(AnomalyMethod.class);

  @Autowired
  public AnomalyDetector(AnalyticsProperties analyticsProperties, List<OutlierDetection> detections) {
    this.analyticsProperties = analyticsProperties;
    detections.forEach(detection -> this.detections.put(detection.method(), detection));
  }

  public List<AnomalyFlag> detect(SilverSeries series) {
    return detect(series, analyticsProperties.getAnomaly());
  }

  /**
   * @return flags in timestamp order; the series itself is left untouched
   */
  public List<AnomalyFlag> detect(SilverSeries series, AnalyticsProperties.Anomaly parameters) {
    final OutlierDetection detection = detections.get(parameters.getMethod());
    if (detection == null) {
      throw new IllegalArgumentException("No detection available for " + parameters.getMethod());
    }
    final List<AnomalyFlag> flags = detection.detect(series, parameters);
    log.debug("Method {} flagged {} of {} points of {}/{}", parameters.getMethod().getLabel(),
        flags.size(), series.size(), series.getEntityId(), series.getMetric());
    return flags;
  }
}
