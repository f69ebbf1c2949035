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

import com.datastax.oss.driver.api.core.cql.SimpleStatementBuilder;
import com.rackspace.helios.app.config.AggregateProperties;
import com.rackspace.helios.app.exceptions.StoreUnavailableException;
import com.rackspace.helios.app.model.AggregateKind;
import com.rackspace.helios.app.model.GoldSummary;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.data.cassandra.core.cql.ReactiveCqlTemplate;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
@Slf4j
public class CassandraSummaryStore implements SummaryStore {

  private final ReactiveCqlTemplate cqlTemplate;
  private final DataTablesStatements dataTablesStatements;
  private final AggregateProperties aggregateProperties;
  private final Counter dbOperationErrorsCounter;

  @Autowired
  public CassandraSummaryStore(ReactiveCqlTemplate cqlTemplate,
                               DataTablesStatements dataTablesStatements,
                               AggregateProperties aggregateProperties,
                               MeterRegistry meterRegistry) {
    this.cqlTemplate = cqlTemplate;
    this.dataTablesStatements = dataTablesStatements;
    this.aggregateProperties = aggregateProperties;
    dbOperationErrorsCounter = meterRegistry.counter("helios.db.operation.errors",
        "type", "gold");
  }

  @Override
  public Mono<Void> writeSummaries(List<GoldSummary> summaries) {
    log.debug("Writing {} gold summaries", summaries.size());
    return CqlBatches.execute(cqlTemplate, Flux.fromIterable(summaries)
            .map(summary -> new SimpleStatementBuilder(dataTablesStatements.goldInsert())
                .addPositionalValues(
                    summary.getEntityId(),
                    summary.getMetric(),
                    summary.getAggregateKind().name(),
                    summary.getWindow().getSeconds(),
                    summary.getWindowStart(),
                    summary.getWindowEnd(),
                    summary.getValue(),
                    summary.getCompletenessRatio(),
                    summary.getPointsPresent(),
                    summary.getPointsExpected()
                )
                .build()))
        .doOnError(e -> dbOperationErrorsCounter.increment())
        .onErrorMap(DataAccessException.class,
            e -> new StoreUnavailableException("Failed to write gold summaries", e))
        .checkpoint();
  }

  @Override
  public Flux<GoldSummary> readSummaries(String entityId, String metric, AggregateKind kind,
                                         Instant start, Instant end) {
    return readSummaries(entityId, metric, kind, aggregateProperties.getWindow(), start, end);
  }

  @Override
  public Flux<GoldSummary> readSummaries(String entityId, String metric, AggregateKind kind,
                                         Duration window, Instant start, Instant end) {
    return cqlTemplate.queryForRows(dataTablesStatements.goldQuery(),
            entityId, metric, kind.name(), window.getSeconds(), start, end)
        // window_start, window_end, value, completeness, present, expected
        .map(row -> new GoldSummary()
            .setEntityId(entityId)
            .setMetric(metric)
            .setAggregateKind(kind)
            .setWindow(window)
            .setWindowStart(row.getInstant(0))
            .setWindowEnd(row.getInstant(1))
            .setValue(row.getDouble(2))
            .setCompletenessRatio(row.getDouble(3))
            .setPointsPresent(row.getInt(4))
            .setPointsExpected(row.getInt(5)))
        .doOnError(e -> dbOperationErrorsCounter.increment())
        .onErrorMap(DataAccessException.class,
            e -> new StoreUnavailableException("Failed to read gold summaries of " + entityId + "/" + metric, e))
        .checkpoint();
  }
}
