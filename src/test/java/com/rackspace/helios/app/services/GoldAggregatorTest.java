package com.rackspace.helios.app.services;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.rackspace.helios.app.config.AppProperties;
import com.rackspace.helios.app.model.AggregateKind;
import com.rackspace.helios.app.model.GoldSummary;
import com.rackspace.helios.app.model.Layer;
import com.rackspace.helios.app.model.QualityFlag;
import com.rackspace.helios.app.model.SilverSeries;
import com.rackspace.helios.app.model.TimeSeriesPoint;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.function.IntFunction;
import org.junit.jupiter.api.Test;

class GoldAggregatorTest {

  private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");
  private static final Duration HOUR = Duration.ofHours(1);

  final GoldAggregator goldAggregator = new GoldAggregator(new AppProperties());

  private static SilverSeries hourly(int hours, IntFunction<Double> valueAt) {
    final List<TimeSeriesPoint> points = new ArrayList<>();
    for (int i = 0; i < hours; i++) {
      final Double value = valueAt.apply(i);
      points.add(new TimeSeriesPoint("NO1", "production", START.plus(HOUR.multipliedBy(i)), value,
          value == null ? QualityFlag.MISSING : QualityFlag.RAW, Layer.SILVER, false));
    }
    return new SilverSeries()
        .setEntityId("NO1")
        .setMetric("production")
        .setInterval(HOUR)
        .setStart(START)
        .setEnd(START.plus(HOUR.multipliedBy(hours)))
        .setPoints(points);
  }

  @Test
  void dailySums() {
    final SilverSeries series = hourly(48, i -> (double) i);

    final List<GoldSummary> summaries = goldAggregator.aggregate(
        series, Duration.ofDays(1), List.of(AggregateKind.SUM, AggregateKind.MEAN));

    assertThat(summaries).hasSize(4);
    assertThat(summaries.get(0).getAggregateKind()).isEqualTo(AggregateKind.SUM);
    assertThat(summaries.get(0).getValue()).isEqualTo(276);
    assertThat(summaries.get(1).getValue()).isEqualTo(11.5);
    assertThat(summaries.get(2).getWindowStart()).isEqualTo(Instant.parse("2024-01-02T00:00:00Z"));
    assertThat(summaries.get(2).getWindowEnd()).isEqualTo(Instant.parse("2024-01-03T00:00:00Z"));
    assertThat(summaries.get(2).getValue()).isEqualTo(852);
    assertThat(summaries).allMatch(summary -> summary.getCompletenessRatio() == 1.0);
  }

  @Test
  void sumMatchesSilverTotal() {
    final SilverSeries series = hourly(72, i -> i % 5 == 0 ? null : 1.5 * i);

    final double silverTotal = series.getPoints().stream()
        .filter(TimeSeriesPoint::hasValue)
        .mapToDouble(TimeSeriesPoint::getValue)
        .sum();
    final double goldTotal = goldAggregator.aggregate(series, Duration.ofDays(1), List.of(AggregateKind.SUM))
        .stream()
        .mapToDouble(GoldSummary::getValue)
        .sum();

    assertThat(goldTotal).isCloseTo(silverTotal, within(1e-9));
  }

  @Test
  void missingPointsLowerCompleteness() {
    final SilverSeries series = hourly(24, i -> i < 6 ? null : 2.0);

    final List<GoldSummary> summaries = goldAggregator.aggregate(
        series, Duration.ofDays(1), List.of(AggregateKind.MIN, AggregateKind.MAX, AggregateKind.COUNT));

    assertThat(summaries).hasSize(3);
    assertThat(summaries).allSatisfy(summary -> {
      assertThat(summary.getPointsPresent()).isEqualTo(18);
      assertThat(summary.getPointsExpected()).isEqualTo(24);
      assertThat(summary.getCompletenessRatio()).isEqualTo(0.75);
    });
    assertThat(summaries).extracting(GoldSummary::getValue).containsExactly(2.0, 2.0, 18.0);
    assertThat(GoldAggregator.filterComplete(summaries, 0.8)).isEmpty();
    assertThat(GoldAggregator.filterComplete(summaries, 0.75)).hasSize(3);
  }

  @Test
  void windowsWithoutValuesAreOmitted() {
    final SilverSeries series = hourly(48, i -> i < 24 ? null : 1.0);

    final List<GoldSummary> summaries = goldAggregator.aggregate(
        series, Duration.ofDays(1), List.of(AggregateKind.SUM));

    assertThat(summaries).singleElement()
        .extracting(GoldSummary::getWindowStart)
        .isEqualTo(Instant.parse("2024-01-02T00:00:00Z"));
  }

  @Test
  void windowsAlignToReferenceZone() {
    final GoldAggregator osloAggregator = new GoldAggregator(
        new AppProperties().setReferenceZone(ZoneId.of("Europe/Oslo")));

    final List<GoldSummary> summaries = osloAggregator.aggregate(
        hourly(24, i -> 1.0), Duration.ofDays(1), List.of(AggregateKind.SUM));

    // 00:00Z is 01:00 in Oslo, so the first local day ends at 23:00Z
    assertThat(summaries).extracting(GoldSummary::getWindowStart)
        .containsExactly(Instant.parse("2023-12-31T23:00:00Z"), Instant.parse("2024-01-01T23:00:00Z"));
    assertThat(summaries).extracting(GoldSummary::getValue).containsExactly(23.0, 1.0);
  }

  @Test
  void windowShorterThanInterval() {
    assertThatThrownBy(() -> goldAggregator.aggregate(
        hourly(2, i -> 1.0), Duration.ofMinutes(30), List.of(AggregateKind.SUM)))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
