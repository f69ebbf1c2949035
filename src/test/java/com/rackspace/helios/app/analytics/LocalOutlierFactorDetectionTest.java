package com.rackspace.helios.app.analytics;

import static com.rackspace.helios.app.SeriesFixtures.HOUR;
import static com.rackspace.helios.app.SeriesFixtures.START;
import static com.rackspace.helios.app.SeriesFixtures.hourly;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.rackspace.helios.app.config.AnalyticsProperties;
import com.rackspace.helios.app.exceptions.InsufficientDataException;
import com.rackspace.helios.app.model.AnomalyMethod;
import org.junit.jupiter.api.Test;

class LocalOutlierFactorDetectionTest {

  final LocalOutlierFactorDetection detection = new LocalOutlierFactorDetection();
  final AnalyticsProperties.Anomaly parameters = new AnalyticsProperties.Anomaly()
      .setMethod(AnomalyMethod.LOF)
      .setContamination(0.01);

  private static Double[] precipitation(int n) {
    final Double[] values = new Double[n];
    for (int i = 0; i < n; i++) {
      values[i] = (i % 10) * 0.1;
    }
    return values;
  }

  @Test
  void flagsIsolatedValue() {
    final Double[] values = precipitation(200);
    values[150] = 25.0;

    assertThat(detection.detect(hourly("NO1", "precipitation", values), parameters))
        .singleElement()
        .satisfies(flag -> {
          assertThat(flag.getTimestamp()).isEqualTo(START.plus(HOUR.multipliedBy(150)));
          assertThat(flag.getMethod()).isEqualTo("lof");
          assertThat(flag.getValue()).isEqualTo(25.0);
          assertThat(flag.getReferenceValue()).isCloseTo(0.9, within(1e-9));
          assertThat(flag.getSeverity()).isGreaterThan(1e6);
        });
  }

  @Test
  void missingPointsAreSkipped() {
    final Double[] values = precipitation(200);
    values[20] = null;
    values[21] = null;
    values[180] = 40.0;

    assertThat(detection.detect(hourly("NO1", "precipitation", values), parameters))
        .singleElement()
        .satisfies(flag ->
            assertThat(flag.getTimestamp()).isEqualTo(START.plus(HOUR.multipliedBy(180))));
  }

  @Test
  void evenSeriesHasNoOutliers() {
    assertThat(detection.detect(hourly("NO1", "precipitation", precipitation(200)), parameters))
        .isEmpty();
  }

  @Test
  void tooFewPoints() {
    assertThatThrownBy(() -> detection.detect(hourly("NO1", "precipitation", precipitation(10)),
        parameters))
        .isInstanceOf(InsufficientDataException.class)
        .hasMessageContaining("found 10");
  }

  @Test
  void nearestNeighboursOfSortedValues() {
    final int[][] neighbours = LocalOutlierFactorDetection.nearestNeighbours(
        new double[]{0, 1, 3, 4, 10}, 2);

    assertThat(neighbours[0]).containsExactly(1, 2);
    assertThat(neighbours[2]).containsExactly(3, 1);
    assertThat(neighbours[4]).containsExactly(3, 2);
  }

  @Test
  void interpolatedPercentile() {
    assertThat(LocalOutlierFactorDetection.percentile(new double[]{5, 1, 4, 2, 3}, 0.9))
        .isCloseTo(4.6, within(1e-12));
  }
}
