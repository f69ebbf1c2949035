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
import com.rackspace.helios.app.aggregate.TemporalNormalizer;
import com.rackspace.helios.app.config.AppProperties;
import com.rackspace.helios.app.exceptions.StoreUnavailableException;
import com.rackspace.helios.app.model.Layer;
import com.rackspace.helios.app.model.QualityFlag;
import com.rackspace.helios.app.model.SilverSeries;
import com.rackspace.helios.app.model.TimeSeriesPoint;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Instant;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.data.cassandra.core.cql.ReactiveCqlTemplate;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
@Slf4j
public class CassandraSeriesStore implements SeriesStore {

  private final ReactiveCqlTemplate cqlTemplate;
  private final DataTablesStatements dataTablesStatements;
  private final TimeSlotPartitioner timeSlotPartitioner;
  private final AppProperties appProperties;
  private final Counter dbOperationErrorsCounter;

  @Autowired
  public CassandraSeriesStore(ReactiveCqlTemplate cqlTemplate,
                              DataTablesStatements dataTablesStatements,
                              TimeSlotPartitioner timeSlotPartitioner,
                              AppProperties appProperties, MeterRegistry meterRegistry) {
    this.cqlTemplate = cqlTemplate;
    this.dataTablesStatements = dataTablesStatements;
    this.timeSlotPartitioner = timeSlotPartitioner;
    this.appProperties = appProperties;
    dbOperationErrorsCounter = meterRegistry.counter("helios.db.operation.errors",
        "type", "silver");
  }

  /**
   * Missing points are written with no value so that a re-run replaces an earlier value at the
   * same timestamp.
   */
  @Override
  public Mono<Void> writeSeries(SilverSeries series) {
    log.debug("Writing {} silver points of {}/{}", series.size(), series.getEntityId(),
        series.getMetric());
    return CqlBatches.execute(cqlTemplate, Flux.fromIterable(series.getPoints())
            .map(this::toInsert))
        .doOnError(e -> dbOperationErrorsCounter.increment())
        .onErrorMap(DataAccessException.class,
            e -> new StoreUnavailableException("Failed to write silver series of "
                + series.getEntityId() + "/" + series.getMetric(), e))
        .checkpoint();
  }

  private SimpleStatement toInsert(TimeSeriesPoint point) {
    return new SimpleStatementBuilder(dataTablesStatements.silverInsert())
        .addPositionalValues(
            // ENTITY_ID, METRIC, TIME_PARTITION_SLOT, TIMESTAMP, VALUE, QUALITY, CORRECTED
            point.getEntityId(),
            point.getMetric(),
            timeSlotPartitioner.timeSlot(point.getTimestamp()),
            point.getTimestamp(),
            point.hasValue() ? point.getValue() : null,
            point.getQualityFlag().name(),
            point.isCorrected()
        )
        .build();
  }

  @Override
  public Mono<SilverSeries> readSeries(String entityId, String metric, Instant start, Instant end) {
    final Instant gridStart = start.with(new TemporalNormalizer(
        appProperties.getCanonicalInterval(), appProperties.getReferenceZone()));
    return Flux.fromIterable(timeSlotPartitioner.partitionsOverRange(gridStart, end))
        .concatMap(timeSlot -> cqlTemplate.queryForRows(dataTablesStatements.silverQuery(),
            entityId, metric, timeSlot, gridStart, end))
        .map(row -> toPoint(entityId, metric, row))
        .collectList()
        .map(points -> SilverSeries.onGrid(entityId, metric, appProperties.getCanonicalInterval(),
            gridStart, end, points))
        .doOnError(e -> dbOperationErrorsCounter.increment())
        .onErrorMap(DataAccessException.class,
            e -> new StoreUnavailableException("Failed to read silver series of " + entityId + "/" + metric, e))
        .checkpoint();
  }

  private static TimeSeriesPoint toPoint(String entityId, String metric, Row row) {
    // ts, value, quality, corrected
    return new TimeSeriesPoint(entityId, metric,
        row.getInstant(0),
        row.isNull(1) ? null : row.getDouble(1),
        QualityFlag.valueOf(row.getString(2)),
        Layer.SILVER,
        row.getBoolean(3));
  }
}
