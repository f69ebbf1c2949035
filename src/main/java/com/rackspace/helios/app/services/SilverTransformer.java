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

import com.rackspace.helios.app.aggregate.TemporalNormalizer;
import com.rackspace.helios.app.config.AppProperties;
import com.rackspace.helios.app.exceptions.ValidationException;
import com.rackspace.helios.app.model.Layer;
import com.rackspace.helios.app.model.QualityFlag;
import com.rackspace.helios.app.model.RawPoint;
import com.rackspace.helios.app.model.RejectedPoint;
import com.rackspace.helios.app.model.SilverSeries;
import com.rackspace.helios.app.model.TimeSeriesPoint;
import com.rackspace.helios.app.model.TransformResult;
import com.rackspace.helios.app.utils.DateTimeUtils;
import com.rackspace.helios.app.validation.RawPointValidator;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Turns the raw points of one entity/metric into a gap-free series on the canonical interval.
 * The transform is a pure function of its input and configuration, so re-running it over the
 * same bronze snapshot always yields an equal series.
 */
@Service
@Slf4j
public class SilverTransformer {

  private static final Comparator<RawPoint> MOST_RECENT_WINS = Comparator
      .comparing((RawPoint point) -> point.getIngestedAt() == null ? Instant.MIN : point.getIngestedAt())
      .thenComparingDouble(point -> point.getValue().doubleValue());

  private final AppProperties appProperties;
  private final RawPointValidator validator;
  private final UnitNormalizer unitNormalizer;
  private final Counter rejectedCounter;

  @Autowired
  public SilverTransformer(AppProperties appProperties,
                           RawPointValidator validator,
                           UnitNormalizer unitNormalizer,
                           MeterRegistry meterRegistry) {
    this.appProperties = appProperties;
    this.validator = validator;
    this.unitNormalizer = unitNormalizer;
    this.rejectedCounter = meterRegistry.counter("helios.points.rejected");
  }

  /**
   * Raw points up to {@link #neighbourMargin()} before or after the range are used only as
   * interpolation neighbours, so that a run over a sub-range fills its gaps the same way as a run
   * over a wider range.
   *
   * @param start start of range, inclusive; rounded down to the grid
   * @param end end of range, exclusive
   * @param raw the raw points of the series in any order
   */
  public TransformResult transform(String entityId, String metric, Instant start, Instant end,
                                   List<RawPoint> raw) {
    final Duration interval = appProperties.getCanonicalInterval();
    final Instant gridStart = gridStart(start);
    final Instant gridEnd = gridEnd(gridStart, end);
    final Duration margin = neighbourMargin();
    final Instant paddedStart = gridStart.minus(margin);
    final Instant paddedEnd = gridEnd.plus(margin);
    final List<RejectedPoint> rejected = new ArrayList<>();

    // validated points grouped by exact instant
    final TreeMap<Instant, List<RawPoint>> byInstant = new TreeMap<>();
    for (RawPoint point : raw) {
      final boolean inRange = point.getTimestamp() == null || isWithin(point.getInstant(), gridStart, end);
      if (!inRange && !isWithin(point.getInstant(), paddedStart, gridStart)
          && !isWithin(point.getInstant(), gridEnd, paddedEnd)) {
        log.trace("Ignoring raw point of {}/{} outside of [{}, {}): {}",
            entityId, metric, paddedStart, paddedEnd, point.getTimestamp());
        continue;
      }
      final RawPoint normalized;
      try {
        normalized = normalize(point, entityId, metric);
      } catch (ValidationException e) {
        if (inRange) {
          log.warn("Dropping raw point of {}/{} at {}: {}",
              entityId, metric, point.getTimestamp(), e.getMessage());
          rejectedCounter.increment();
          rejected.add(new RejectedPoint(point, e.getMessage()));
        } else {
          // reported by the run that covers it
          log.trace("Skipping invalid neighbour of {}/{} at {}: {}",
              entityId, metric, point.getTimestamp(), e.getMessage());
        }
        continue;
      }
      byInstant.computeIfAbsent(normalized.getInstant(), key -> new ArrayList<>()).add(normalized);
    }

    final SilverSeries series = new SilverSeries()
        .setEntityId(entityId)
        .setMetric(metric)
        .setInterval(interval)
        .setStart(gridStart)
        .setEnd(end);
    if (byInstant.isEmpty()) {
      log.debug("No raw points for {}/{} in [{}, {})", entityId, metric, gridStart, end);
      return new TransformResult(series, rejected);
    }

    final int leading = (int) (margin.getSeconds() / interval.getSeconds());
    final int slots = DateTimeUtils.slotCount(paddedStart, paddedEnd, interval);
    final double[] sums = new double[slots];
    final int[] counts = new int[slots];
    final boolean[] corrected = new boolean[slots];
    for (Map.Entry<Instant, List<RawPoint>> entry : byInstant.entrySet()) {
      final int slot = DateTimeUtils.slotIndex(paddedStart, entry.getKey(), interval);
      final RawPoint chosen = resolveDuplicates(entry.getValue());
      sums[slot] += chosen.getValue().doubleValue();
      counts[slot]++;
      corrected[slot] |= isConflicting(entry.getValue());
    }

    final Double[] values = new Double[slots];
    for (int i = 0; i < slots; i++) {
      values[i] = counts[i] > 0 ? sums[i] / counts[i] : null;
    }

    final List<TimeSeriesPoint> filled = fillGaps(entityId, metric, paddedStart, interval, values, corrected);
    final int inRangeSlots = DateTimeUtils.slotCount(gridStart, end, interval);
    return new TransformResult(
        series.setPoints(List.copyOf(filled.subList(leading, leading + inRangeSlots))),
        rejected);
  }

  /**
   * How far beyond a range raw points are read to find interpolation neighbours.
   */
  public Duration neighbourMargin() {
    return appProperties.getCanonicalInterval().multipliedBy(appProperties.getMaxInterpolationGap());
  }

  /**
   * @return start of the raw points a transform of <code>[start, end)</code> reads
   */
  public Instant neighbourStart(Instant start) {
    return gridStart(start).minus(neighbourMargin());
  }

  /**
   * @return exclusive end of the raw points a transform of <code>[start, end)</code> reads
   */
  public Instant neighbourEnd(Instant start, Instant end) {
    return gridEnd(gridStart(start), end).plus(neighbourMargin());
  }

  private Instant gridStart(Instant start) {
    return start.with(new TemporalNormalizer(
        appProperties.getCanonicalInterval(), appProperties.getReferenceZone()));
  }

  private Instant gridEnd(Instant gridStart, Instant end) {
    final Duration interval = appProperties.getCanonicalInterval();
    return gridStart.plus(interval.multipliedBy(DateTimeUtils.slotCount(gridStart, end, interval)));
  }

  private static boolean isWithin(Instant ts, Instant start, Instant end) {
    return !ts.isBefore(start) && ts.isBefore(end);
  }

  private RawPoint normalize(RawPoint point, String entityId, String metric) {
    validator.validate(point, entityId, metric);
    final double canonical = unitNormalizer.toCanonical(
        metric, point.getValue().doubleValue(), point.getUnit());
    return new RawPoint()
        .setEntityId(point.getEntityId())
        .setMetric(point.getMetric())
        .setTimestamp(point.getTimestamp())
        .setValue(canonical)
        .setUnit(appProperties.getCanonicalUnits().get(metric))
        .setSource(point.getSource())
        .setIngestedAt(point.getIngestedAt());
  }

  /**
   * Exact duplicates collapse to one point. Conflicting values keep the most recently ingested
   * one, and the larger value when ingestion times tie.
   */
  private RawPoint resolveDuplicates(List<RawPoint> sameInstant) {
    return sameInstant.stream().max(MOST_RECENT_WINS).orElseThrow();
  }

  private boolean isConflicting(List<RawPoint> sameInstant) {
    return sameInstant.stream()
        .mapToDouble(point -> point.getValue().doubleValue())
        .distinct()
        .count() > 1;
  }

  private List<TimeSeriesPoint> fillGaps(String entityId, String metric, Instant gridStart,
                                         Duration interval, Double[] values, boolean[] corrected) {
    final int maxGap = appProperties.getMaxInterpolationGap();
    final List<TimeSeriesPoint> points = new ArrayList<>(values.length);

    int previousKnown = -1;
    for (int i = 0; i < values.length; i++) {
      final Instant ts = gridStart.plus(interval.multipliedBy(i));
      if (values[i] != null) {
        points.add(new TimeSeriesPoint(entityId, metric, ts, values[i], QualityFlag.RAW,
            Layer.SILVER, corrected[i]));
        previousKnown = i;
        continue;
      }

      final int nextKnown = nextKnown(values, i);
      final int gap = (nextKnown < 0 ? values.length : nextKnown) - previousKnown - 1;
      if (previousKnown >= 0 && nextKnown >= 0 && gap <= maxGap) {
        final double v0 = values[previousKnown];
        final double v1 = values[nextKnown];
        final double fraction = (double) (i - previousKnown) / (nextKnown - previousKnown);
        points.add(new TimeSeriesPoint(entityId, metric, ts, v0 + (v1 - v0) * fraction,
            QualityFlag.INTERPOLATED, Layer.SILVER, false));
      } else {
        points.add(new TimeSeriesPoint(entityId, metric, ts, null, QualityFlag.MISSING,
            Layer.SILVER, false));
      }
    }
    return points;
  }

  private static int nextKnown(Double[] values, int from) {
    for (int i = from + 1; i < values.length; i++) {
      if (values[i] != null) {
        return i;
      }
    }
    return -1;
  }
}
