package com.rackspace.helios.app.analytics;

import com.rackspace.helios.app.config.AnalyticsProperties;
import com.rackspace.helios.app.exceptions.InsufficientDataException;
import com.rackspace.helios.app.model.AnomalyFlag;
import com.rackspace.helios.app.model.AnomalyMethod;
import com.rackspace.helios.app.model.SilverSeries;
import com.rackspace.helios.app.model.TimeSeriesPoint;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Local outlier factor over the values of a series, ignoring time order. Suited to skewed,
 * mostly-zero metrics such as precipitation where a rolling median has no spread.
 * <p>
 * The neighbourhood size is <code>max(10, n &times; contamination &times; 5)</code>. A point is
 * flagged when its factor is above the <code>(1 - contamination)</code> percentile of all factors.
 * </p>
 */
@Component
@Slf4j
public class LocalOutlierFactorDetection implements OutlierDetection {

  static final int MIN_NEIGHBOURS = 10;
  private static final double DENSITY_EPSILON = 1e-10;

  @Override
  public AnomalyMethod method() {
    return AnomalyMethod.LOF;
  }

  @Override
  public List<AnomalyFlag> detect(SilverSeries series, AnalyticsProperties.Anomaly parameters) {
    final List<TimeSeriesPoint> present = series.getPoints().stream()
        .filter(TimeSeriesPoint::hasValue)
        .collect(Collectors.toList());
    final int n = present.size();
    if (n <= MIN_NEIGHBOURS) {
      throw new InsufficientDataException(String.format(
          "Local outlier factor of %s/%s needs more than %d points, found %d",
          series.getEntityId(), series.getMetric(), MIN_NEIGHBOURS, n));
    }

    final double contamination = parameters.getContamination();
    final int k = Math.min(n - 1,
        Math.max(MIN_NEIGHBOURS, (int) (n * contamination * 5)));
    final double[] values = present.stream().mapToDouble(TimeSeriesPoint::getValue).toArray();

    final int[][] neighbours = nearestNeighbours(values, k);
    final double[] kDistance = new double[n];
    for (int i = 0; i < n; i++) {
      kDistance[i] = Math.abs(values[i] - values[neighbours[i][k - 1]]);
    }
    final double[] density = new double[n];
    for (int i = 0; i < n; i++) {
      double reach = 0;
      for (int o : neighbours[i]) {
        reach += Math.max(kDistance[o], Math.abs(values[i] - values[o]));
      }
      density[i] = 1 / (reach / k + DENSITY_EPSILON);
    }
    final double[] factors = new double[n];
    for (int i = 0; i < n; i++) {
      double sum = 0;
      for (int o : neighbours[i]) {
        sum += density[o];
      }
      factors[i] = sum / k / density[i];
    }

    final double cutoff = percentile(factors, 1 - contamination);
    final List<AnomalyFlag> flags = new ArrayList<>();
    for (int i = 0; i < n; i++) {
      if (factors[i] > cutoff) {
        double reference = 0;
        for (int o : neighbours[i]) {
          reference += values[o];
        }
        flags.add(new AnomalyFlag()
            .setEntityId(series.getEntityId())
            .setMetric(series.getMetric())
            .setTimestamp(present.get(i).getTimestamp())
            .setSeverity(factors[i])
            .setMethod(method().getLabel())
            .setReferenceValue(reference / k)
            .setValue(values[i]));
      }
    }
    log.trace("Local outlier factor of {}/{} used {} neighbours and cutoff {}",
        series.getEntityId(), series.getMetric(), k, cutoff);
    return flags;
  }

  /**
   * @return for each point, the indices of its <code>k</code> nearest other points by ascending
   * distance, the lower-valued one first on equal distances
   */
  static int[][] nearestNeighbours(double[] values, int k) {
    final int n = values.length;
    final Integer[] order = IntStream.range(0, n).boxed().toArray(Integer[]::new);
    Arrays.sort(order, Comparator.comparingDouble((Integer i) -> values[i]).thenComparingInt(i -> i));

    final int[][] neighbours = new int[n][k];
    for (int rank = 0; rank < n; rank++) {
      final int point = order[rank];
      int left = rank - 1;
      int right = rank + 1;
      for (int found = 0; found < k; found++) {
        final boolean takeLeft;
        if (left < 0) {
          takeLeft = false;
        } else if (right >= n) {
          takeLeft = true;
        } else {
          takeLeft = values[point] - values[order[left]] <= values[order[right]] - values[point];
        }
        neighbours[point][found] = takeLeft ? order[left--] : order[right++];
      }
    }
    return neighbours;
  }

  /**
   * Linearly interpolated percentile, <code>fraction</code> in <code>[0, 1]</code>.
   */
  static double percentile(double[] values, double fraction) {
    final double[] sorted = values.clone();
    Arrays.sort(sorted);
    final double position = fraction * (sorted.length - 1);
    final int lower = (int) Math.floor(position);
    final int upper = Math.min(lower + 1, sorted.length - 1);
    return sorted[lower] + (sorted[upper] - sorted[lower]) * (position - lower);
  }
}
