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
import com.rackspace.helios.app.model.TimeSeriesPoint;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Compares each point against the median of the preceding <code>windowSize</code> present
 * values, scaled by their median absolute deviation. The first <code>windowSize</code> present
 * points have no complete reference window and are skipped.
 */
@Component
@Slf4j
public class RollingMadDetection implements OutlierDetection {

  @Override
  public AnomalyMethod method() {
    return AnomalyMethod.ROLLING_MAD;
  }

  @Override
  public List<AnomalyFlag> detect(SilverSeries series, AnalyticsProperties.Anomaly parameters) {
    final List<TimeSeriesPoint> present = series.getPoints().stream()
        .filter(TimeSeriesPoint::hasValue)
        .collect(Collectors.toList());
    final int windowSize = parameters.getWindowSize();
    if (present.size() <= windowSize) {
      log.debug("Series {}/{} has {} present points, none past the warm-up of {}",
          series.getEntityId(), series.getMetric(), present.size(), windowSize);
      return List.of();
    }

    final double[] values = present.stream().mapToDouble(TimeSeriesPoint::getValue).toArray();
    final double[] window = new double[windowSize];
    final List<AnomalyFlag> flags = new ArrayList<>();
    for (int i = windowSize; i < values.length; i++) {
      System.arraycopy(values, i - windowSize, window, 0, windowSize);
      final double median = RobustStatistics.median(window);
      final double scale = Math.max(
          RobustStatistics.MAD_SCALE * RobustStatistics.medianAbsoluteDeviation(window, median),
          parameters.getMinScale());
      final double deviation = Math.abs(values[i] - median);
      if (deviation > parameters.getThreshold() * scale) {
        final TimeSeriesPoint point = present.get(i);
        flags.add(new AnomalyFlag()
            .setEntityId(series.getEntityId())
            .setMetric(series.getMetric())
            .setTimestamp(point.getTimestamp())
            .setSeverity(deviation / scale)
            .setMethod(method().getLabel())
            .setReferenceValue(median)
            .setValue(values[i]));
      }
    }
    return flags;
  }
}
