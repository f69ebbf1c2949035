package com.rackspace.helios.app;

import com.rackspace.helios.app.model.Layer;
import com.rackspace.helios.app.model.QualityFlag;
import com.rackspace.helios.app.model.SilverSeries;
import com.rackspace.helios.app.model.TimeSeriesPoint;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public class SeriesFixtures {

  public static final Instant START = Instant.parse("2024-01-01T00:00:00Z");
  public static final Duration HOUR = Duration.ofHours(1);

  private SeriesFixtures() {
  }

  /**
   * Builds an hourly silver series from {@link #START}; <code>null</code> values become missing
   * points.
   */
  public static SilverSeries hourly(String entityId, String metric, Double... values) {
    return hourly(entityId, metric, START, values);
  }

  public static SilverSeries hourly(String entityId, String metric, Instant start, Double... values) {
    final List<TimeSeriesPoint> points = new ArrayList<>(values.length);
    for (int i = 0; i < values.length; i++) {
      points.add(new TimeSeriesPoint(entityId, metric, start.plus(HOUR.multipliedBy(i)), values[i],
          values[i] == null ? QualityFlag.MISSING : QualityFlag.RAW, Layer.SILVER, false));
    }
    return new SilverSeries()
        .setEntityId(entityId)
        .setMetric(metric)
        .setInterval(HOUR)
        .setStart(start)
        .setEnd(start.plus(HOUR.multipliedBy(values.length)))
        .setPoints(points);
  }

  public static SilverSeries hourly(String entityId, String metric, double[] values) {
    final Double[] boxed = new Double[values.length];
    for (int i = 0; i < values.length; i++) {
      boxed[i] = values[i];
    }
    return hourly(entityId, metric, boxed);
  }
}
