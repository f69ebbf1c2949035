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

import com.rackspace.helios.app.aggregate.AggregatedWindow;
import com.rackspace.helios.app.aggregate.TemporalNormalizer;
import com.rackspace.helios.app.aggregate.WindowCollectors;
import com.rackspace.helios.app.config.AppProperties;
import com.rackspace.helios.app.model.AggregateKind;
import com.rackspace.helios.app.model.GoldSummary;
import com.rackspace.helios.app.model.SilverSeries;
import com.rackspace.helios.app.utils.DateTimeUtils;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeMap;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Aggregates a silver series into fixed, non-overlapping windows aligned in the reference zone.
 * Missing points never fail a window; they lower its completeness ratio.
 */
@Service
@Slf4j
public class GoldAggregator {

  private final AppProperties appProperties;

  @Autowired
  public GoldAggregator(AppProperties appProperties) {
    this.appProperties = appProperties;
  }

  /**
   * @return one summary per window and kind, ordered by window start and then by the order of
   * <code>kinds</code>
   */
  public List<GoldSummary> aggregate(SilverSeries series, Duration window, List<AggregateKind> kinds) {
    if (window.compareTo(series.getInterval()) < 0) {
      throw new IllegalArgumentException("Aggregate window " + window
          + " is shorter than the series interval " + series.getInterval());
    }
    final TemporalNormalizer normalizer = new TemporalNormalizer(window, appProperties.getReferenceZone());

    final TreeMap<Instant, AggregatedWindow> windows = series.getPoints().stream()
        .collect(Collectors.groupingBy(
            point -> point.getTimestamp().with(normalizer),
            TreeMap::new,
            WindowCollectors.windowCollector(normalizer)));

    final List<GoldSummary> summaries = new ArrayList<>();
    windows.values().forEach(agg -> {
      if (agg.getCount() == 0) {
        log.warn("Omitting window {} of {}/{}: no points with a value",
            agg.getWindowStart(), series.getEntityId(), series.getMetric());
        return;
      }
      final int expected = DateTimeUtils.slotCount(
          agg.getWindowStart(), agg.getWindowEnd(), series.getInterval());
      for (AggregateKind kind : kinds) {
        summaries.add(new GoldSummary()
            .setEntityId(series.getEntityId())
            .setMetric(series.getMetric())
            .setWindowStart(agg.getWindowStart())
            .setWindowEnd(agg.getWindowEnd())
            .setWindow(window)
            .setAggregateKind(kind)
            .setValue(agg.valueOf(kind))
            .setPointsPresent(agg.getCount())
            .setPointsExpected(expected)
            .setCompletenessRatio((double) agg.getCount() / expected));
      }
    });
    log.debug("Aggregated {} points of {}/{} into {} windows of {}", series.size(),
        series.getEntityId(), series.getMetric(), windows.size(), window);
    return summaries;
  }

  /**
   * @return the summaries whose completeness ratio is at least <code>threshold</code>
   */
  public static List<GoldSummary> filterComplete(List<GoldSummary> summaries, double threshold) {
    return summaries.stream()
        .filter(summary -> summary.getCompletenessRatio() >= threshold)
        .collect(Collectors.toList());
  }
}
