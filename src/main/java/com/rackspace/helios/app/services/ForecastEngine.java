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

import com.rackspace.helios.app.analytics.SeasonalArmaxFitter;
import com.rackspace.helios.app.analytics.SeasonalArmaxModel;
import com.rackspace.helios.app.exceptions.CoverageException;
import com.rackspace.helios.app.exceptions.InsufficientDataException;
import com.rackspace.helios.app.exceptions.MissingPointException;
import com.rackspace.helios.app.model.ForecastConfig;
import com.rackspace.helios.app.model.ForecastDiagnostics;
import com.rackspace.helios.app.model.ForecastResult;
import com.rackspace.helios.app.model.ForecastRun;
import com.rackspace.helios.app.model.SeriesRef;
import com.rackspace.helios.app.model.SilverSeries;
import com.rackspace.helios.app.model.TimeSeriesPoint;
import com.rackspace.helios.app.utils.DateTimeUtils;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Fits a seasonal ARMAX model over a training window and projects it over a horizon that
 * directly follows the window. Nothing is fitted unless the exogenous series cover both training
 * window and horizon and the training window has no missing points.
 */
@Service
@Slf4j
public class ForecastEngine {

  private final HashService hashService;
  private final Clock clock;
  private final ExecutorService pipelineWorkers;

  @Autowired
  public ForecastEngine(HashService hashService, Clock clock,
                        @Qualifier("pipelineWorkers") ExecutorService pipelineWorkers) {
    this.hashService = hashService;
    this.clock = clock;
    this.pipelineWorkers = pipelineWorkers;
  }

  /**
   * @param endogenous the series to forecast, covering at least the training window
   * @param exogenous regressors covering the training window and the horizon
   * @param trainingStart inclusive
   * @param trainingEnd exclusive, also the first horizon timestamp
   * @param horizonSteps number of intervals to forecast
   * @throws CoverageException if an exogenous series lacks a value in the training window or
   * the horizon
   * @throws MissingPointException if the training window has missing points
   * @throws InsufficientDataException if the training window is too short for the configuration
   * @throws com.rackspace.helios.app.exceptions.FitConvergenceException if the model cannot be
   * estimated
   */
  public ForecastRun forecast(SilverSeries endogenous, List<SilverSeries> exogenous,
                              Instant trainingStart, Instant trainingEnd, int horizonSteps,
                              ForecastConfig config) {
    if (horizonSteps < 1) {
      throw new IllegalArgumentException("Horizon must be at least one step");
    }
    final Duration interval = endogenous.getInterval();
    final List<Instant> training = DateTimeUtils.grid(trainingStart, trainingEnd, interval);
    final List<Instant> horizon = new ArrayList<>(horizonSteps);
    for (int h = 0; h < horizonSteps; h++) {
      horizon.add(trainingEnd.plus(interval.multipliedBy(h)));
    }

    final int k = exogenous.size();
    final double[][] exogenousTraining = new double[k][];
    final double[][] exogenousHorizon = new double[k][];
    for (int j = 0; j < k; j++) {
      final SilverSeries regressor = exogenous.get(j);
      if (!regressor.getInterval().equals(interval)) {
        throw new IllegalArgumentException("Exogenous series " + describe(regressor)
            + " is not on the interval " + interval);
      }
      final Map<Instant, TimeSeriesPoint> byTimestamp = regressor.byTimestamp();
      exogenousTraining[j] = covered(regressor, byTimestamp, training);
      exogenousHorizon[j] = covered(regressor, byTimestamp, horizon);
    }

    final Map<Instant, TimeSeriesPoint> endogenousPoints = endogenous.byTimestamp();
    final double[] y = new double[training.size()];
    for (int t = 0; t < y.length; t++) {
      final TimeSeriesPoint point = endogenousPoints.get(training.get(t));
      if (point == null || !point.hasValue()) {
        throw new MissingPointException("Training window of " + describe(endogenous)
            + " has a missing point at " + training.get(t));
      }
      y[t] = point.getValue();
    }

    final int m = config.getSeasonalPeriod();
    final int required = Math.max(m + k + config.getArOrder() + config.getMaOrder() + 2, 2 * m);
    if (y.length < required) {
      throw new InsufficientDataException(String.format(
          "Forecast of %s needs at least %d training points, found %d",
          describe(endogenous), required, y.length));
    }

    final int[] trainingPhases = phases(training, interval, m);
    final SeasonalArmaxModel model = SeasonalArmaxFitter.fit(y, trainingPhases, exogenousTraining, config);
    final List<SeasonalArmaxModel.Projection> projections =
        model.project(phases(horizon, interval, m), exogenousHorizon);

    final List<SeriesRef> exogenousRefs = exogenous.stream()
        .map(series -> new SeriesRef(series.getEntityId(), series.getMetric()))
        .collect(Collectors.toList());
    final String modelId = hashService.modelId(endogenous.getEntityId(), endogenous.getMetric(),
        exogenousRefs, trainingStart, trainingEnd, config);
    final Instant generatedAt = clock.instant();

    final List<ForecastResult> results = new ArrayList<>(horizonSteps);
    for (int h = 0; h < horizonSteps; h++) {
      final SeasonalArmaxModel.Projection projection = projections.get(h);
      results.add(new ForecastResult()
          .setEntityId(endogenous.getEntityId())
          .setMetric(endogenous.getMetric())
          .setGeneratedAt(generatedAt)
          .setHorizonTimestamp(horizon.get(h))
          .setPointEstimate(projection.getPoint())
          .setLowerBound(projection.getLower())
          .setUpperBound(projection.getUpper())
          .setModelId(modelId));
    }

    final ForecastDiagnostics diagnostics = new ForecastDiagnostics()
        .setModelId(modelId)
        .setEntityId(endogenous.getEntityId())
        .setMetric(endogenous.getMetric())
        .setTrainingStart(trainingStart)
        .setTrainingEnd(trainingEnd)
        .setConfig(config)
        .setExogenous(exogenousRefs.stream().map(SeriesRef::toString).collect(Collectors.toList()))
        .setSeasonalProfile(model.getSeasonalProfile())
        .setExogenousCoefficients(model.getExogenousCoefficients())
        .setArCoefficients(model.getArCoefficients())
        .setMaCoefficients(model.getMaCoefficients())
        .setResidualMean(model.getResidualMean())
        .setResidualStdDev(model.getResidualStdDev())
        .setResidualCount(model.getResidualCount())
        .setIterations(model.getIterations())
        .setConverged(true);

    log.debug("Model {} of {} fitted in {} iterations, residual std dev {}", modelId,
        describe(endogenous), model.getIterations(), model.getResidualStdDev());
    return new ForecastRun(results, diagnostics);
  }

  /**
   * Runs {@link #forecast} on the pipeline worker pool. Callers may abandon the returned future;
   * the fit has no side effects to undo.
   */
  public CompletableFuture<ForecastRun> forecastAsync(SilverSeries endogenous,
                                                      List<SilverSeries> exogenous,
                                                      Instant trainingStart, Instant trainingEnd,
                                                      int horizonSteps, ForecastConfig config) {
    return CompletableFuture.supplyAsync(
        () -> forecast(endogenous, exogenous, trainingStart, trainingEnd, horizonSteps, config),
        pipelineWorkers);
  }

  private static double[] covered(SilverSeries regressor, Map<Instant, TimeSeriesPoint> byTimestamp,
                                  List<Instant> timestamps) {
    final double[] values = new double[timestamps.size()];
    for (int t = 0; t < values.length; t++) {
      final TimeSeriesPoint point = byTimestamp.get(timestamps.get(t));
      if (point == null || !point.hasValue()) {
        throw new CoverageException(describe(regressor), timestamps.get(t));
      }
      values[t] = point.getValue();
    }
    return values;
  }

  private static int[] phases(List<Instant> timestamps, Duration interval, int period) {
    return timestamps.stream()
        .mapToInt(ts -> DateTimeUtils.seasonalPhase(ts, interval, period))
        .toArray();
  }

  private static String describe(SilverSeries series) {
    return series.getEntityId() + "/" + series.getMetric();
  }
}
