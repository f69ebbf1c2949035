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

import com.rackspace.helios.app.config.AggregateProperties;
import com.rackspace.helios.app.config.AnalyticsProperties;
import com.rackspace.helios.app.config.AppProperties;
import com.rackspace.helios.app.config.PipelineProperties;
import com.rackspace.helios.app.exceptions.ValidationException;
import com.rackspace.helios.app.model.AnomalyFlag;
import com.rackspace.helios.app.model.CorrelationRequest;
import com.rackspace.helios.app.model.CorrelationResult;
import com.rackspace.helios.app.model.ForecastConfig;
import com.rackspace.helios.app.model.ForecastRequest;
import com.rackspace.helios.app.model.ForecastRun;
import com.rackspace.helios.app.model.GoldSummary;
import com.rackspace.helios.app.model.PublishRequest;
import com.rackspace.helios.app.model.PublishSource;
import com.rackspace.helios.app.model.SeriesRef;
import com.rackspace.helios.app.model.SilverSeries;
import com.rackspace.helios.app.model.StageRequest;
import com.rackspace.helios.app.model.TransformResult;
import com.rackspace.helios.app.repos.BronzeStore;
import com.rackspace.helios.app.repos.ResultsStore;
import com.rackspace.helios.app.repos.SeriesStore;
import com.rackspace.helios.app.repos.SummaryStore;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutorService;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Runs one pipeline stage for one series, or one pair of series, over a bounded range: reads the
 * stage input from its store, computes on the pipeline workers and writes the output. Store
 * failures propagate to the caller unchanged.
 */
@Service
@Slf4j
public class PipelineService {

  private final BronzeStore bronzeStore;
  private final SeriesStore seriesStore;
  private final SummaryStore summaryStore;
  private final ResultsStore resultsStore;
  private final SilverTransformer silverTransformer;
  private final GoldAggregator goldAggregator;
  private final AnomalyDetector anomalyDetector;
  private final CorrelationEngine correlationEngine;
  private final ForecastEngine forecastEngine;
  private final ServingSync servingSync;
  private final AppProperties appProperties;
  private final AggregateProperties aggregateProperties;
  private final AnalyticsProperties analyticsProperties;
  private final PipelineProperties pipelineProperties;
  private final Scheduler workers;

  @Autowired
  public PipelineService(BronzeStore bronzeStore,
                         SeriesStore seriesStore,
                         SummaryStore summaryStore,
                         ResultsStore resultsStore,
                         SilverTransformer silverTransformer,
                         GoldAggregator goldAggregator,
                         AnomalyDetector anomalyDetector,
                         CorrelationEngine correlationEngine,
                         ForecastEngine forecastEngine,
                         ServingSync servingSync,
                         AppProperties appProperties,
                         AggregateProperties aggregateProperties,
                         AnalyticsProperties analyticsProperties,
                         PipelineProperties pipelineProperties,
                         @Qualifier("pipelineWorkers") ExecutorService pipelineWorkers) {
    this.bronzeStore = bronzeStore;
    this.seriesStore = seriesStore;
    this.summaryStore = summaryStore;
    this.resultsStore = resultsStore;
    this.silverTransformer = silverTransformer;
    this.goldAggregator = goldAggregator;
    this.anomalyDetector = anomalyDetector;
    this.correlationEngine = correlationEngine;
    this.forecastEngine = forecastEngine;
    this.servingSync = servingSync;
    this.appProperties = appProperties;
    this.aggregateProperties = aggregateProperties;
    this.analyticsProperties = analyticsProperties;
    this.pipelineProperties = pipelineProperties;
    this.workers = Schedulers.fromExecutorService(pipelineWorkers, "pipeline");
  }

  public Mono<TransformResult> runSilver(StageRequest request) {
    log.debug("Running silver stage for {}", request);
    // neighbours just outside the range keep interpolation stable across sub-range re-runs
    return bronzeStore.readRange(request.getEntityId(), request.getMetric(),
            silverTransformer.neighbourStart(request.getStart()),
            silverTransformer.neighbourEnd(request.getStart(), request.getEnd()))
        .collectList()
        .publishOn(workers)
        .map(raw -> silverTransformer.transform(request.getEntityId(), request.getMetric(),
            request.getStart(), request.getEnd(), raw))
        .flatMap(result -> result.getSeries().isEmpty() ?
            Mono.just(result) :
            seriesStore.writeSeries(result.getSeries()).thenReturn(result))
        .name("helios.stage")
        .tag("stage", "silver")
        .metrics();
  }

  public Mono<List<GoldSummary>> runGold(StageRequest request) {
    log.debug("Running gold stage for {}", request);
    return readSeries(request)
        .publishOn(workers)
        .map(series -> GoldAggregator.filterComplete(
            goldAggregator.aggregate(series, aggregateProperties.getWindow(),
                aggregateProperties.getKinds()),
            aggregateProperties.getCompletenessThreshold()))
        .flatMap(summaries -> summaryStore.writeSummaries(summaries).thenReturn(summaries))
        .name("helios.stage")
        .tag("stage", "gold")
        .metrics();
  }

  public Mono<List<AnomalyFlag>> runAnomalies(StageRequest request) {
    log.debug("Running anomaly stage for {}", request);
    return readSeries(request)
        .publishOn(workers)
        .map(anomalyDetector::detect)
        .flatMap(flags -> resultsStore.writeAnomalies(flags).thenReturn(flags))
        .name("helios.stage")
        .tag("stage", "anomalies")
        .metrics();
  }

  public Mono<List<CorrelationResult>> runCorrelation(CorrelationRequest request) {
    log.debug("Running correlation stage for {} against {}", request.getWeather(),
        request.getEnergy());
    return readSeries(request.getWeather(), request.getStart(), request.getEnd())
        .zipWith(readSeries(request.getEnergy(), request.getStart(), request.getEnd()))
        .publishOn(workers)
        .map(pair -> correlationEngine.correlate(pair.getT1(), pair.getT2()))
        .flatMap(results -> resultsStore.writeCorrelations(results).thenReturn(results))
        .name("helios.stage")
        .tag("stage", "correlation")
        .metrics();
  }

  /**
   * The fit runs on the pipeline workers and is abandoned when it takes longer than the
   * configured fit timeout.
   */
  public Mono<ForecastRun> runForecast(ForecastRequest request) {
    final AnalyticsProperties.Forecast forecast = analyticsProperties.getForecast();
    final Instant trainingEnd = request.getTrainingEnd();
    final Instant trainingStart = request.getTrainingStart() != null ?
        request.getTrainingStart() : trainingEnd.minus(forecast.getTrainingWindow());
    final Duration horizon = request.getHorizon() != null ? request.getHorizon() : forecast.getHorizon();
    final Duration interval = appProperties.getCanonicalInterval();
    final int horizonSteps = (int) (horizon.getSeconds() / interval.getSeconds());
    if (horizonSteps < 1) {
      return Mono.error(new ValidationException(
          "Forecast horizon " + horizon + " is shorter than the interval " + interval));
    }
    final Instant horizonEnd = trainingEnd.plus(interval.multipliedBy(horizonSteps));
    final ForecastConfig config = forecast.getModel();
    log.debug("Running forecast stage for {}/{} trained over [{}, {}) with {}",
        request.getEntityId(), request.getMetric(), trainingStart, trainingEnd, config);

    final Mono<SilverSeries> endogenous = seriesStore.readSeries(request.getEntityId(),
        request.getMetric(), trainingStart, trainingEnd);
    final Mono<List<SilverSeries>> exogenous = Flux.fromIterable(request.getExogenous())
        .concatMap(ref -> readSeries(ref, trainingStart, horizonEnd))
        .collectList();

    return Mono.zip(endogenous, exogenous)
        .flatMap(inputs -> Mono.fromFuture(forecastEngine.forecastAsync(inputs.getT1(),
                inputs.getT2(), trainingStart, trainingEnd, horizonSteps, config))
            .timeout(pipelineProperties.getFitTimeout()))
        .flatMap(run -> resultsStore.writeForecasts(run).thenReturn(run))
        .name("helios.stage")
        .tag("stage", "forecast")
        .metrics();
  }

  /**
   * Copies the stored records of one source and series to the serving store. Bronze is never
   * published.
   */
  public Mono<Long> publish(PublishRequest request) {
    final PublishSource source = request.getSource();
    if (source != PublishSource.CORRELATIONS && StringUtils.isBlank(request.getMetric())) {
      return Mono.error(new ValidationException("A metric is required to publish " + source));
    }
    final Mono<? extends List<?>> records;
    switch (source) {
      case SILVER:
        records = seriesStore.readSeries(request.getEntityId(), request.getMetric(),
            request.getStart(), request.getEnd()).map(SilverSeries::getPoints);
        break;
      case GOLD:
        if (request.getKind() == null) {
          return Mono.error(new ValidationException("An aggregate kind is required to publish gold summaries"));
        }
        records = summaryStore.readSummaries(request.getEntityId(), request.getMetric(),
            request.getKind(), request.getStart(), request.getEnd()).collectList();
        break;
      case ANOMALIES:
        records = resultsStore.readAnomalies(request.getEntityId(), request.getMetric(),
            request.getStart(), request.getEnd()).collectList();
        break;
      case CORRELATIONS:
        if (StringUtils.isBlank(request.getPairedEntityId())) {
          return Mono.error(new ValidationException("A paired entity is required to publish correlations"));
        }
        records = resultsStore.readCorrelations(
            request.getEntityId() + "|" + request.getPairedEntityId(),
            request.getStart(), request.getEnd()).collectList();
        break;
      case FORECASTS:
        if (request.getGeneratedAt() == null) {
          return Mono.error(new ValidationException("generatedAt is required to publish forecasts"));
        }
        records = resultsStore.readForecasts(request.getEntityId(), request.getMetric(),
                request.getGeneratedAt())
            .filter(result -> !result.getHorizonTimestamp().isBefore(request.getStart())
                && result.getHorizonTimestamp().isBefore(request.getEnd()))
            .collectList();
        break;
      default:
        return Mono.error(new ValidationException("Unknown publish source " + source));
    }
    return records
        .flatMap(list -> servingSync.publish(request.getTable(), list))
        .name("helios.stage")
        .tag("stage", "publish")
        .metrics();
  }

  private Mono<SilverSeries> readSeries(StageRequest request) {
    return seriesStore.readSeries(request.getEntityId(), request.getMetric(),
        request.getStart(), request.getEnd());
  }

  private Mono<SilverSeries> readSeries(SeriesRef ref, Instant start, Instant end) {
    return seriesStore.readSeries(ref.getEntityId(), ref.getMetric(), start, end);
  }
}
