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

package com.rackspace.helios.app.repos;

import com.datastax.oss.driver.api.core.cql.Row;
import com.datastax.oss.driver.api.core.cql.SimpleStatement;
import com.datastax.oss.driver.api.core.cql.SimpleStatementBuilder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rackspace.helios.app.exceptions.StoreUnavailableException;
import com.rackspace.helios.app.model.AnomalyFlag;
import com.rackspace.helios.app.model.CorrelationResult;
import com.rackspace.helios.app.model.ForecastConfig;
import com.rackspace.helios.app.model.ForecastDiagnostics;
import com.rackspace.helios.app.model.ForecastResult;
import com.rackspace.helios.app.model.ForecastRun;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.data.cassandra.core.cql.ReactiveCqlTemplate;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
@Slf4j
public class CassandraResultsStore implements ResultsStore {

  private final ReactiveCqlTemplate cqlTemplate;
  private final DataTablesStatements dataTablesStatements;
  private final ObjectMapper objectMapper;
  private final Counter dbOperationErrorsCounter;

  @Autowired
  public CassandraResultsStore(ReactiveCqlTemplate cqlTemplate,
                               DataTablesStatements dataTablesStatements,
                               ObjectMapper objectMapper, MeterRegistry meterRegistry) {
    this.cqlTemplate = cqlTemplate;
    this.dataTablesStatements = dataTablesStatements;
    this.objectMapper = objectMapper;
    dbOperationErrorsCounter = meterRegistry.counter("helios.db.operation.errors",
        "type", "results");
  }

  @Override
  public Mono<Void> writeAnomalies(List<AnomalyFlag> flags) {
    return write("anomaly flags", Flux.fromIterable(flags)
        .map(flag -> new SimpleStatementBuilder(dataTablesStatements.anomalyInsert())
            .addPositionalValues(
                flag.getEntityId(),
                flag.getMetric(),
                flag.getTimestamp(),
                flag.getMethod(),
                flag.getSeverity(),
                flag.getReferenceValue(),
                flag.getValue()
            )
            .build()));
  }

  @Override
  public Flux<AnomalyFlag> readAnomalies(String entityId, String metric, Instant start,
                                         Instant end) {
    return read("anomaly flags of " + entityId + "/" + metric,
        cqlTemplate.queryForRows(dataTablesStatements.anomalyQuery(), entityId, metric, start, end)
            // ts, method, severity, reference_value, value
            .map(row -> new AnomalyFlag()
                .setEntityId(entityId)
                .setMetric(metric)
                .setTimestamp(row.getInstant(0))
                .setMethod(row.getString(1))
                .setSeverity(row.getDouble(2))
                .setReferenceValue(row.getDouble(3))
                .setValue(row.getDouble(4))));
  }

  @Override
  public Mono<Void> writeCorrelations(List<CorrelationResult> results) {
    return write("correlation results", Flux.fromIterable(results)
        .map(result -> new SimpleStatementBuilder(dataTablesStatements.correlationInsert())
            .addPositionalValues(
                result.getEntityPair(),
                result.getWindowStart(),
                result.getMetricPair(),
                result.getLag(),
                result.getWindowEnd(),
                result.getCoefficient(),
                result.getPairedPoints()
            )
            .build()));
  }

  @Override
  public Flux<CorrelationResult> readCorrelations(String entityPair, Instant start, Instant end) {
    return read("correlation results of " + entityPair,
        cqlTemplate.queryForRows(dataTablesStatements.correlationQuery(), entityPair, start, end)
            // window_start, metric_pair, lag, window_end, coefficient, paired_points
            .map(row -> new CorrelationResult()
                .setEntityPair(entityPair)
                .setWindowStart(row.getInstant(0))
                .setMetricPair(row.getString(1))
                .setLag(row.getInt(2))
                .setWindowEnd(row.getInstant(3))
                .setCoefficient(row.getDouble(4))
                .setPairedPoints(row.getInt(5))));
  }

  @Override
  public Mono<Void> writeForecasts(ForecastRun run) {
    final Flux<SimpleStatement> results = Flux.fromIterable(run.getResults())
        .map(result -> new SimpleStatementBuilder(dataTablesStatements.forecastInsert())
            .addPositionalValues(
                result.getEntityId(),
                result.getMetric(),
                result.getGeneratedAt(),
                result.getHorizonTimestamp(),
                result.getPointEstimate(),
                result.getLowerBound(),
                result.getUpperBound(),
                result.getModelId()
            )
            .build());
    return write("forecast model", Mono.fromCallable(() -> toModelInsert(run.getDiagnostics())).flux())
        .then(write("forecast results", results));
  }

  private SimpleStatement toModelInsert(ForecastDiagnostics diagnostics) throws JsonProcessingException {
    return new SimpleStatementBuilder(dataTablesStatements.forecastModelInsert())
        .addPositionalValues(
            diagnostics.getModelId(),
            diagnostics.getEntityId(),
            diagnostics.getMetric(),
            diagnostics.getTrainingStart(),
            diagnostics.getTrainingEnd(),
            objectMapper.writeValueAsString(diagnostics.getConfig()),
            diagnostics.getExogenous(),
            toList(diagnostics.getSeasonalProfile()),
            toList(diagnostics.getExogenousCoefficients()),
            toList(diagnostics.getArCoefficients()),
            toList(diagnostics.getMaCoefficients()),
            diagnostics.getResidualMean(),
            diagnostics.getResidualStdDev(),
            diagnostics.getResidualCount(),
            diagnostics.getIterations(),
            diagnostics.isConverged()
        )
        .build();
  }

  @Override
  public Flux<ForecastResult> readForecasts(String entityId, String metric, Instant generatedAt) {
    return read("forecasts of " + entityId + "/" + metric,
        cqlTemplate.queryForRows(dataTablesStatements.forecastQuery(), entityId, metric, generatedAt)
            // horizon_ts, point, lower, upper, model_id
            .map(row -> new ForecastResult()
                .setEntityId(entityId)
                .setMetric(metric)
                .setGeneratedAt(generatedAt)
                .setHorizonTimestamp(row.getInstant(0))
                .setPointEstimate(row.getDouble(1))
                .setLowerBound(row.getDouble(2))
                .setUpperBound(row.getDouble(3))
                .setModelId(row.getString(4))));
  }

  @Override
  public Mono<ForecastDiagnostics> readForecastModel(String modelId) {
    return read("forecast model " + modelId,
        cqlTemplate.queryForRows(dataTablesStatements.forecastModelQuery(), modelId)
            .<ForecastDiagnostics>handle((row, sink) -> {
              try {
                sink.next(toDiagnostics(row));
              } catch (JsonProcessingException e) {
                sink.error(new IllegalStateException("Stored configuration of model " + modelId
                    + " is not readable", e));
              }
            }))
        .next();
  }

  private ForecastDiagnostics toDiagnostics(Row row) throws JsonProcessingException {
    // model_id, entity_id, metric, training_start, training_end, config, exogenous,
    // seasonal_profile, exogenous_coefficients, ar_coefficients, ma_coefficients,
    // residual_mean, residual_std_dev, residual_count, iterations, converged
    return new ForecastDiagnostics()
        .setModelId(row.getString(0))
        .setEntityId(row.getString(1))
        .setMetric(row.getString(2))
        .setTrainingStart(row.getInstant(3))
        .setTrainingEnd(row.getInstant(4))
        .setConfig(objectMapper.readValue(row.getString(5), ForecastConfig.class))
        .setExogenous(row.getList(6, String.class))
        .setSeasonalProfile(toArray(row.getList(7, Double.class)))
        .setExogenousCoefficients(toArray(row.getList(8, Double.class)))
        .setArCoefficients(toArray(row.getList(9, Double.class)))
        .setMaCoefficients(toArray(row.getList(10, Double.class)))
        .setResidualMean(row.getDouble(11))
        .setResidualStdDev(row.getDouble(12))
        .setResidualCount(row.getInt(13))
        .setIterations(row.getInt(14))
        .setConverged(row.getBoolean(15));
  }

  private Mono<Void> write(String what, Flux<SimpleStatement> statements) {
    return CqlBatches.execute(cqlTemplate, statements)
        .doOnError(e -> dbOperationErrorsCounter.increment())
        .onErrorMap(DataAccessException.class,
            e -> new StoreUnavailableException("Failed to write " + what, e))
        .checkpoint();
  }

  private <T> Flux<T> read(String what, Flux<T> rows) {
    return rows
        .doOnError(e -> dbOperationErrorsCounter.increment())
        .onErrorMap(DataAccessException.class,
            e -> new StoreUnavailableException("Failed to read " + what, e))
        .checkpoint();
  }

  private static List<Double> toList(double[] values) {
    return Arrays.stream(values).boxed().collect(Collectors.toList());
  }

  private static double[] toArray(List<Double> values) {
    return values.stream().mapToDouble(Double::doubleValue).toArray();
  }
}
