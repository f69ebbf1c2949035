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
import com.rackspace.helios.app.exceptions.StoreUnavailableException;
import com.rackspace.helios.app.model.RawPoint;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.data.cassandra.core.cql.ReactiveCqlTemplate;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Keeps every raw point with the offset it was reported in. Rows are keyed by timestamp, source
 * and ingestion time so that re-delivered and conflicting observations are all retained.
 */
@Repository
@Slf4j
public class CassandraBronzeStore implements BronzeStore {

  private static final String NO_SOURCE = "";

  private final ReactiveCqlTemplate cqlTemplate;
  private final DataTablesStatements dataTablesStatements;
  private final TimeSlotPartitioner timeSlotPartitioner;
  private final Clock clock;
  private final Counter dbOperationErrorsCounter;

  @Autowired
  public CassandraBronzeStore(ReactiveCqlTemplate cqlTemplate,
                              DataTablesStatements dataTablesStatements,
                              TimeSlotPartitioner timeSlotPartitioner,
                              Clock clock, MeterRegistry meterRegistry) {
    this.cqlTemplate = cqlTemplate;
    this.dataTablesStatements = dataTablesStatements;
    this.timeSlotPartitioner = timeSlotPartitioner;
    this.clock = clock;
    dbOperationErrorsCounter = meterRegistry.counter("helios.db.operation.errors",
        "type", "bronze");
  }

  @Override
  public Mono<RawPoint> append(RawPoint point) {
    log.trace("Appending raw point={}", point);
    if (point.getIngestedAt() == null) {
      point.setIngestedAt(clock.instant());
    }
    final Instant ts = point.getInstant();
    return cqlTemplate.execute(
            dataTablesStatements.bronzeInsert(),
            point.getEntityId(),
            point.getMetric(),
            timeSlotPartitioner.timeSlot(ts),
            ts,
            point.getSource() == null ? NO_SOURCE : point.getSource(),
            point.getIngestedAt(),
            point.getTimestamp().getOffset().getTotalSeconds(),
            point.getValue().doubleValue(),
            point.getUnit()
        )
        .doOnError(e -> dbOperationErrorsCounter.increment())
        .onErrorMap(DataAccessException.class,
            e -> new StoreUnavailableException("Failed to append raw point to bronze", e))
        .checkpoint()
        .thenReturn(point);
  }

  @Override
  public Flux<RawPoint> readRange(String entityId, String metric, Instant start, Instant end) {
    return Flux.fromIterable(timeSlotPartitioner.partitionsOverRange(start, end))
        .concatMap(timeSlot -> cqlTemplate.queryForRows(dataTablesStatements.bronzeQuery(),
            entityId, metric, timeSlot, start, end))
        .map(row -> toRawPoint(entityId, metric, row))
        .doOnError(e -> dbOperationErrorsCounter.increment())
        .onErrorMap(DataAccessException.class,
            e -> new StoreUnavailableException("Failed to read bronze range of " + entityId + "/" + metric, e))
        .checkpoint();
  }

  private static RawPoint toRawPoint(String entityId, String metric, Row row) {
    // ts, source, ingested_at, utc_offset, value, unit
    final String source = row.getString(1);
    return new RawPoint()
        .setEntityId(entityId)
        .setMetric(metric)
        .setTimestamp(row.getInstant(0).atOffset(ZoneOffset.ofTotalSeconds(row.getInt(3))))
        .setSource(NO_SOURCE.equals(source) ? null : source)
        .setIngestedAt(row.getInstant(2))
        .setValue(row.getDouble(4))
        .setUnit(row.getString(5));
  }
}
