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
import com.rackspace.helios.app.exceptions.InsufficientDataException;
import com.rackspace.helios.app.model.AnomalyFlag;
import com.rackspace.helios.app.model.AnomalyMethod;
import com.rackspace.helios.app.model.SilverSeries;
import com.rackspace.helios.app.model.TimeSeriesPoint;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Statistical process control over a DCT low-pass smoothing of the series: points outside
 * <code>mean &plusmn; threshold &times; std</code> of the smoothed signal are flagged.
 */
@Component
@Slf4j
public class DctSpcDetection implements OutlierDetection {

  static final int MIN_POINTS = 10;
  private static final double FLAT_EPSILON = 1e-9;

  @Override
  public AnomalyMethod method() {
    return AnomalyMethod.DCT_SPC;
  }

  @Override
  public List<AnomalyFlag> detect(SilverSeries series, AnalyticsProperties.Anomaly parameters) {
    final List<TimeSeriesPoint> present = series.getPoints().stream()
        .filter(TimeSeriesPoint::hasValue)
        .collect(Collectors.toList());
    if (present.size() < MIN_POINTS) {
      throw new InsufficientDataException(String.format(
          "DCT outlier detection of %s/%s needs at least %d points, found %d",
          series.getEntityId(), series.getMetric(), MIN_POINTS, present.size()));
    }

    final double[] values = present.stream().mapToDouble(TimeSeriesPoint::getValue).toArray();
    final int keep = (int) (parameters.getDctCutoff() * values.length);
    final double[] smoothed = DiscreteCosineTransform.lowPass(values, keep);
    final double mean = RobustStatistics.mean(smoothed);
    final double std = RobustStatistics.standardDeviation(smoothed, mean);
    if (!(std > FLAT_EPSILON * Math.max(Math.abs(mean), 1.0))) {
      log.debug("Smoothed signal of {}/{} is flat, nothing to flag",
          series.getEntityId(), series.getMetric());
      return List.of();
    }

    final double upper = mean + parameters.getThreshold() * std;
    final double lower = mean - parameters.getThreshold() * std;
    final List<AnomalyFlag> flags = new ArrayList<>();
    for (int i = 0; i < values.length; i++) {
      if (values[i] > upper || values[i] < lower) {
        flags.add(new AnomalyFlag()
            .setEntityId(series.getEntityId())
            .setMetric(series.getMetric())
            .setTimestamp(present.get(i).getTimestamp())
            .setSeverity(Math.abs(values[i] - mean) / std)
            .setMethod(method().getLabel())
            .setReferenceValue(mean)
            .setValue(values[i]));
      }
    }
    return flags;
  }
}
