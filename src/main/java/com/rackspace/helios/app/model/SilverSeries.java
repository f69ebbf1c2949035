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

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.Data;

/**
 * Points of one entity/metric on a fixed canonical interval covering <code>[start, end)</code>.
 * A non-empty series has exactly one point per grid slot; gaps are either
 * {@link QualityFlag#INTERPOLATED} or explicit {@link QualityFlag#MISSING} points.
 */
@Data
public class SilverSeries {
  String entityId;
  String metric;
  Duration interval;
  Instant start;
  Instant end;
  List<TimeSeriesPoint> points = List.of();

  @JsonIgnore
  public boolean isEmpty() {
    return points.isEmpty();
  }

  public int size() {
    return points.size();
  }

  public long missingCount() {
    return points.stream().filter(point -> !point.hasValue()).count();
  }

  /**
   * @return the values in grid order with <code>null</code> in place of missing points
   */
  public Double[] values() {
    return points.stream()
        .map(point -> point.hasValue() ? point.getValue() : null)
        .toArray(Double[]::new);
  }

  public Map<Instant, TimeSeriesPoint> byTimestamp() {
    return points.stream()
        .collect(Collectors.toMap(TimeSeriesPoint::getTimestamp, Function.identity()));
  }

  /**
   * Fills every grid slot of <code>[start, end)</code> that has no stored point with a
   * {@link QualityFlag#MISSING} point. An empty point list stays empty.
   */
  public static SilverSeries onGrid(String entityId, String metric, Duration interval,
                                    Instant start, Instant end, List<TimeSeriesPoint> stored) {
    final SilverSeries series = new SilverSeries()
        .setEntityId(entityId)
        .setMetric(metric)
        .setInterval(interval)
        .setStart(start)
        .setEnd(end);
    if (stored.isEmpty()) {
      return series;
    }

    final Map<Instant, TimeSeriesPoint> byTimestamp = stored.stream()
        .collect(Collectors.toMap(TimeSeriesPoint::getTimestamp, Function.identity(),
            (first, second) -> second));
    final List<TimeSeriesPoint> points = new ArrayList<>();
    for (Instant ts = start; ts.isBefore(end); ts = ts.plus(interval)) {
      final TimeSeriesPoint point = byTimestamp.get(ts);
      points.add(point != null ? point :
          new TimeSeriesPoint(entityId, metric, ts, null, QualityFlag.MISSING, Layer.SILVER, false));
    }
    return series.setPoints(List.copyOf(points));
  }
}
