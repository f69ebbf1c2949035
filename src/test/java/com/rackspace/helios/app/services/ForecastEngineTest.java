package com.rackspace.helios.app.services;

import static com.rackspace.helios.app.SeriesFixtures.HOUR;
import static com.rackspace.helios.app.SeriesFixtures.START;
import static com.rackspace.helios.app.SeriesFixtures.hourly;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.rackspace.helios.app.exceptions.CoverageException;
import com.rackspace.helios.app.exceptions.InsufficientDataException;
import com.rackspace.helios.app.exceptions.MissingPointException;
import com.rackspace.helios.app.model.ForecastConfig;
import com.rackspace.helios.app.model.ForecastResult;
import com.rackspace.helios.app.model.ForecastRun;
import com.rackspace.helios.app.model.SilverSeries;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ForecastEngineTest {

  private static final int TRAINING_HOURS = 24 * 14;
  private static final int HORIZON = 24;
  private static final Instant TRAINING_END = START.plus(HOUR.multipliedBy(TRAINING_HOURS));
  private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

  ExecutorService executor;
  ForecastEngine forecastEngine;

  Double[] temperature;
  Double[] consumption;

  @BeforeEach
  void setUp() {
    executor = Executors.newSingleThreadExecutor();
    forecastEngine = new ForecastEngine(new HashService(), Clock.fixed(NOW, ZoneOffset.UTC), executor);

    final Random random = new Random(2024);
    temperature = new Double[TRAINING_HOURS + HORIZON];
    for (int t = 0; t < temperature.length; t++) {
      temperature[t] = 2 + 4 * Math.sin(2 * Math.PI * t / 24) + random.nextGaussian();
    }
    consumption = new Double[TRAINING_HOURS];
    double noise = 0;
    for (int t = 0; t < consumption.length; t++) {
      noise = 0.5 * noise + random.nextGaussian();
      consumption[t] = 1000 + 200 * Math.cos(2 * Math.PI * t / 24) - 15 * temperature[t] + noise;
    }
  }

  @AfterEach
  void tearDown() throws InterruptedException {
    executor.shutdown();
    executor.awaitTermination(5, TimeUnit.SECONDS);
  }

  private static ForecastConfig arConfig() {
    return new ForecastConfig()
        .setSeasonalPeriod(24)
        .setArOrder(1)
        .setMaOrder(0);
  }

  private ForecastRun forecast(ForecastConfig config) {
    return forecastEngine.forecast(
        hourly("NO1", "consumption", consumption),
        List.of(hourly("NO1", "temperature_2m", temperature)),
        START, TRAINING_END, HORIZON, config);
  }

  @Test
  void forecastsHorizon() {
    final ForecastRun run = forecast(arConfig());

    assertThat(run.getResults()).hasSize(HORIZON);
    final ForecastResult first = run.getResults().get(0);
    assertThat(first.getHorizonTimestamp()).isEqualTo(TRAINING_END);
    assertThat(first.getGeneratedAt()).isEqualTo(NOW);
    assertThat(run.getResults().get(HORIZON - 1).getHorizonTimestamp())
        .isEqualTo(TRAINING_END.plus(HOUR.multipliedBy(HORIZON - 1)));
    assertThat(run.getResults()).allSatisfy(result -> {
      assertThat(result.getEntityId()).isEqualTo("NO1");
      assertThat(result.getMetric()).isEqualTo("consumption");
      assertThat(result.getModelId()).isEqualTo(run.getDiagnostics().getModelId());
      assertThat(result.getLowerBound()).isLessThanOrEqualTo(result.getPointEstimate());
      assertThat(result.getPointEstimate()).isLessThanOrEqualTo(result.getUpperBound());
    });

    double previousWidth = 0;
    for (ForecastResult result : run.getResults()) {
      final double width = result.getUpperBound() - result.getLowerBound();
      assertThat(width).isGreaterThanOrEqualTo(previousWidth);
      previousWidth = width;
    }

    // consumption peaks at phase 0, around 1000 + 200 - 15 * 2
    assertThat(first.getPointEstimate()).isBetween(1100.0, 1250.0);

    assertThat(run.getDiagnostics().isConverged()).isTrue();
    assertThat(run.getDiagnostics().getIterations()).isEqualTo(1);
    assertThat(run.getDiagnostics().getExogenous()).containsExactly("NO1/temperature_2m");
    assertThat(run.getDiagnostics().getExogenousCoefficients()[0]).isBetween(-17.0, -13.0);
    assertThat(run.getDiagnostics().getTrainingStart()).isEqualTo(START);
    assertThat(run.getDiagnostics().getTrainingEnd()).isEqualTo(TRAINING_END);
  }

  @Test
  void defaultConfigFitsUncorrelatedResiduals() {
    final int trainingHours = 24 * 28;
    final Random random = new Random(7);
    final Double[] weather = new Double[trainingHours + HORIZON];
    for (int t = 0; t < weather.length; t++) {
      weather[t] = 2 + 4 * Math.sin(2 * Math.PI * t / 24) + random.nextGaussian();
    }
    final Double[] load = new Double[trainingHours];
    for (int t = 0; t < load.length; t++) {
      load[t] = 1000 + 200 * Math.cos(2 * Math.PI * t / 24) - 15 * weather[t] + random.nextGaussian();
    }

    final ForecastRun run = forecastEngine.forecast(
        hourly("NO1", "consumption", load),
        List.of(hourly("NO1", "temperature_2m", weather)),
        START, START.plus(HOUR.multipliedBy(trainingHours)), HORIZON, new ForecastConfig());

    assertThat(run.getDiagnostics().isConverged()).isTrue();
    assertThat(run.getResults()).hasSize(HORIZON);
    assertThat(run.getResults().get(0).getPointEstimate()).isBetween(1100.0, 1250.0);
    assertThat(run.getDiagnostics().getExogenousCoefficients()[0]).isBetween(-17.0, -13.0);
  }

  @Test
  void rerunIsDeterministic() {
    final ForecastRun first = forecast(arConfig());
    final ForecastRun second = forecast(arConfig());

    assertThat(second.getResults()).isEqualTo(first.getResults());
    assertThat(second.getDiagnostics().getModelId()).isEqualTo(first.getDiagnostics().getModelId());
  }

  @Test
  void asyncForecast() throws Exception {
    final ForecastRun run = forecastEngine.forecastAsync(
        hourly("NO1", "consumption", consumption),
        List.of(hourly("NO1", "temperature_2m", temperature)),
        START, TRAINING_END, HORIZON, arConfig()).get(30, TimeUnit.SECONDS);

    assertThat(run.getResults()).isEqualTo(forecast(arConfig()).getResults());
  }

  @Test
  void exogenousMustCoverHorizon() {
    temperature[TRAINING_HOURS + 5] = null;
    // also missing training data, coverage is checked first
    consumption[10] = null;

    assertThatThrownBy(() -> forecast(arConfig()))
        .isInstanceOf(CoverageException.class)
        .satisfies(e -> assertThat(((CoverageException) e).getFirstUncovered())
            .isEqualTo(TRAINING_END.plus(HOUR.multipliedBy(5))));
  }

  @Test
  void exogenousShorterThanHorizon() {
    final SilverSeries truncated = hourly("NO1", "temperature_2m",
        java.util.Arrays.copyOf(temperature, TRAINING_HOURS));

    assertThatThrownBy(() -> forecastEngine.forecast(
        hourly("NO1", "consumption", consumption), List.of(truncated),
        START, TRAINING_END, HORIZON, arConfig()))
        .isInstanceOf(CoverageException.class);
  }

  @Test
  void missingTrainingPoint() {
    consumption[10] = null;

    assertThatThrownBy(() -> forecast(arConfig()))
        .isInstanceOf(MissingPointException.class)
        .hasMessageContaining(START.plus(HOUR.multipliedBy(10)).toString());
  }

  @Test
  void tooShortTraining() {
    final Instant shortEnd = START.plus(HOUR.multipliedBy(40));

    assertThatThrownBy(() -> forecastEngine.forecast(
        hourly("NO1", "consumption", consumption),
        List.of(hourly("NO1", "temperature_2m", temperature)),
        START, shortEnd, HORIZON, arConfig()))
        .isInstanceOf(InsufficientDataException.class)
        .hasMessageContaining("at least 48");
  }

  @Test
  void horizonOfAtLeastOneStep() {
    assertThatThrownBy(() -> forecastEngine.forecast(
        hourly("NO1", "consumption", consumption), List.of(), START, TRAINING_END, 0, arConfig()))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void withoutExogenousSeries() {
    final ForecastRun run = forecastEngine.forecast(
        hourly("NO1", "consumption", consumption), List.of(), START, TRAINING_END, 48, arConfig());

    assertThat(run.getResults()).hasSize(48);
    assertThat(run.getDiagnostics().getExogenous()).isEmpty();
    assertThat(run.getDiagnostics().getSeasonalProfile()).hasSize(24);
  }
}
