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

import com.rackspace.helios.app.config.AnalyticsProperties;
import com.rackspace.helios.app.config.LagRange;
import com.rackspace.helios.app.model.CorrelationResult;
import com.rackspace.helios.app.model.SilverSeries;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Sliding-window Pearson correlation of two aligned series across a range of lags. At lag
 * <code>L</code> the first series at index <code>t</code> is paired with the second series at
 * <code>t + L</code>, which may fall outside the window but not outside the series.
 */
@Service
@Slf4j
public class CorrelationEngine {

  /**
   * Strongest correlation first, then the smallest absolute lag, then the earliest lag.
   */
  static final Comparator<CorrelationResult> BEST_LAG_ORDER =
      Comparator.<CorrelationResult>comparingDouble(result -> -Math.abs(result.getCoefficient()))
          .thenComparingInt(result -> Math.abs(result.getLag()))
          .thenComparingInt(CorrelationResult::getLag);

  /**
   * Relative to the sum of squares, below this a side counts as constant.
   */
  private static final double ZERO_VARIANCE = 1e-20;

  private final AnalyticsProperties analyticsProperties;

  @Autowired
  public CorrelationEngine(AnalyticsProperties analyticsProperties) {
    this.analyticsProperties = analyticsProperties;
  }

  public List<CorrelationResult> correlate(SilverSeries a, SilverSeries b) {
    final AnalyticsProperties.Correlation correlation = analyticsProperties.getCorrelation();
    return correlate(a, b, correlation.getWindowSize(), correlation.effectiveStep(),
        correlation.getLagRange(), correlation.getMinPoints());
  }

  /**
   * @return results ordered by window start and then by lag; (window, lag) combinations with
   * fewer than <code>minPoints</code> valid pairs or zero variance are omitted
   */
  public List<CorrelationResult> correlate(SilverSeries a, SilverSeries b, int windowSize,
                                           int step, LagRange lags, int minPoints) {
    checkAligned(a, b);
    if (windowSize < 2 || step < 1) {
      throw new IllegalArgumentException("Window size must be at least 2 and step at least 1");
    }
    final Double[] x = a.values();
    final Double[] y = b.values();
    final int n = x.length;
    final String entityPair = a.getEntityId() + "|" + b.getEntityId();
    final String metricPair = a.getMetric() + "|" + b.getMetric();

    final List<CorrelationResult> results = new ArrayList<>();
    int omitted = 0;
    for (int w = 0; w + windowSize <= n; w += step) {
      for (int lag : lags) {
        final Pearson pearson = new Pearson(windowSize);
        for (int t = w; t < w + windowSize; t++) {
          final int j = t + lag;
          if (j >= 0 && j < n && x[t] != null && y[j] != null) {
            pearson.add(x[t], y[j]);
          }
        }
        final double coefficient = pearson.coefficient();
        if (pearson.count < minPoints || Double.isNaN(coefficient)) {
          omitted++;
          continue;
        }
        results.add(new CorrelationResult()
            .setEntityPair(entityPair)
            .setMetricPair(metricPair)
            .setWindowStart(a.getPoints().get(w).getTimestamp())
            .setWindowEnd(a.getPoints().get(w).getTimestamp()
                .plus(a.getInterval().multipliedBy(windowSize)))
            .setLag(lag)
            .setCoefficient(coefficient)
            .setPairedPoints(pearson.count));
      }
    }
    if (omitted > 0) {
      log.warn("Omitted {} window/lag combinations of {} with too few pairs or no variance",
          omitted, entityPair);
    }
    return results;
  }

  /**
   * @return the best lag of each window, in window order
   */
  public static List<CorrelationResult> bestLags(List<CorrelationResult> results) {
    final Map<String, List<CorrelationResult>> byWindow = results.stream()
        .collect(Collectors.groupingBy(
            result -> result.getEntityPair() + "@" + result.getWindowStart(),
            Collectors.toList()));
    final TreeMap<Instant, CorrelationResult> best = new TreeMap<>();
    byWindow.values().forEach(window -> window.stream()
        .min(BEST_LAG_ORDER)
        .ifPresent(result -> best.put(result.getWindowStart(), result)));
    return new ArrayList<>(best.values());
  }

  private static void checkAligned(SilverSeries a, SilverSeries b) {
    if (!a.getInterval().equals(b.getInterval())
        || !a.getStart().equals(b.getStart())
        || a.size() != b.size()) {
      throw new IllegalArgumentException(String.format(
          "Series %s/%s and %s/%s are not aligned on the same grid",
          a.getEntityId(), a.getMetric(), b.getEntityId(), b.getMetric()));
    }
  }

  private static class Pearson {
    final double[] xs;
    final double[] ys;
    int count;

    Pearson(int capacity) {
      xs = new double[capacity];
      ys = new double[capacity];
    }

    void add(double x, double y) {
      xs[count] = x;
      ys[count] = y;
      count++;
    }

    /**
     * @return NaN when either side has no variance
     */
    double coefficient() {
      if (count == 0) {
        return Double.NaN;
      }
      double meanX = 0;
      double meanY = 0;
      for (int i = 0; i < count; i++) {
        meanX += xs[i];
        meanY += ys[i];
      }
      meanX /= count;
      meanY /= count;

      double covariance = 0;
      double varianceX = 0;
      double varianceY = 0;
      double squaresX = 0;
      double squaresY = 0;
      for (int i = 0; i < count; i++) {
        final double dx = xs[i] - meanX;
        final double dy = ys[i] - meanY;
        covariance += dx * dy;
        varianceX += dx * dx;
        varianceY += dy * dy;
        squaresX += xs[i] * xs[i];
        squaresY += ys[i] * ys[i];
      }
      if (varianceX <= ZERO_VARIANCE * squaresX || varianceY <= ZERO_VARIANCE * squaresY) {
        return Double.NaN;
      }
      return Math.max(-1, Math.min(1, covariance / Math.sqrt(varianceX * varianceY)));
    }
  }
}
