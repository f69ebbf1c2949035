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

package com.rackspace.helios.app.config;

import static com.rackspace.helios.app.repos.DataTablesStatements.*;

import com.datastax.oss.driver.api.core.CqlSession;
import com.datastax.oss.driver.api.core.type.DataTypes;
import com.rackspace.helios.app.repos.DataTablesStatements;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.cassandra.core.cql.generator.CreateTableCqlGenerator;
import org.springframework.data.cassandra.core.cql.keyspace.CreateTableSpecification;
import org.springframework.data.cassandra.core.cql.keyspace.DefaultOption;
import org.springframework.data.cassandra.core.cql.keyspace.Option;
import org.springframework.data.cassandra.core.cql.keyspace.TableOption;
import org.springframework.data.cassandra.core.cql.keyspace.TableOption.CompactionOption;
import org.springframework.data.cassandra.core.cql.session.init.KeyspacePopulator;
import org.springframework.data.cassandra.core.cql.session.init.ScriptException;
import org.springframework.stereotype.Component;

/**
 * Creates the layer tables. Bronze and silver tables are partitioned by time slot and use
 * time-window compaction sized from the partition width.
 * @see DataTablesStatements
 */
@Component
@Slf4j
public class DataTablesPopulator implements KeyspacePopulator {

  private static final DefaultOption COMPACTION_WINDOW_UNIT = new DefaultOption("compaction_window_unit", String.class, true, false, true);
  /**
   * value is number of the compaction_window_unit increments.
   */
  private static final DefaultOption COMPACTION_WINDOW_SIZE = new DefaultOption("compaction_window_size", Long.class, true, false, false);

  private final AppProperties appProperties;

  @Autowired
  public DataTablesPopulator(AppProperties appProperties) {
    this.appProperties = appProperties;
  }

  @Override
  public void populate(CqlSession session) throws ScriptException {
    tableSpecifications().forEach(spec -> createTable(spec, session));
  }

  public List<String> render() {
    return tableSpecifications()
        .stream()
        .map(CreateTableCqlGenerator::toCql)
        .collect(Collectors.toList());
  }

  private List<CreateTableSpecification> tableSpecifications() {
    return List.of(
        bronzeTableSpec(),
        silverTableSpec(),
        goldTableSpec(),
        anomalyTableSpec(),
        correlationTableSpec(),
        forecastTableSpec(),
        forecastModelTableSpec()
    );
  }

  private void createTable(CreateTableSpecification createTableSpec,
                                CqlSession session) {
    log.debug("Creating table {}", createTableSpec.getName());
    // Cassandra doesn't like reactive version of create table
    session.execute(CreateTableCqlGenerator.toCql(createTableSpec));
  }

  private CreateTableSpecification bronzeTableSpec() {
    return CreateTableSpecification
        .createTable(BRONZE_TABLE)
        .ifNotExists()
        .partitionKeyColumn(ENTITY_ID, DataTypes.TEXT)
        .partitionKeyColumn(METRIC, DataTypes.TEXT)
        .partitionKeyColumn(TIME_PARTITION_SLOT, DataTypes.TIMESTAMP)
        .clusteredKeyColumn(TIMESTAMP, DataTypes.TIMESTAMP)
        .clusteredKeyColumn(SOURCE, DataTypes.TEXT)
        .clusteredKeyColumn(INGESTED_AT, DataTypes.TIMESTAMP)
        .column(UTC_OFFSET, DataTypes.INT)
        .column(VALUE, DataTypes.DOUBLE)
        .column(UNIT, DataTypes.TEXT)
        .with(TableOption.COMPACTION, compactionOptions(appProperties.getPartitionWidth()))
        .with(TableOption.GC_GRACE_SECONDS, appProperties.getDataTableGcGraceSeconds());
  }

  private CreateTableSpecification silverTableSpec() {
    return CreateTableSpecification
        .createTable(SILVER_TABLE)
        .ifNotExists()
        .partitionKeyColumn(ENTITY_ID, DataTypes.TEXT)
        .partitionKeyColumn(METRIC, DataTypes.TEXT)
        .partitionKeyColumn(TIME_PARTITION_SLOT, DataTypes.TIMESTAMP)
        .clusteredKeyColumn(TIMESTAMP, DataTypes.TIMESTAMP)
        .column(VALUE, DataTypes.DOUBLE)
        .column(QUALITY, DataTypes.TEXT)
        .column(CORRECTED, DataTypes.BOOLEAN)
        .with(TableOption.COMPACTION, compactionOptions(appProperties.getPartitionWidth()))
        .with(TableOption.GC_GRACE_SECONDS, appProperties.getDataTableGcGraceSeconds());
  }

  private CreateTableSpecification goldTableSpec() {
    return CreateTableSpecification
        .createTable(GOLD_TABLE)
        .ifNotExists()
        .partitionKeyColumn(ENTITY_ID, DataTypes.TEXT)
        .partitionKeyColumn(METRIC, DataTypes.TEXT)
        .partitionKeyColumn(AGGREGATE_KIND, DataTypes.TEXT)
        .partitionKeyColumn(WINDOW_WIDTH, DataTypes.BIGINT)
        .clusteredKeyColumn(WINDOW_START, DataTypes.TIMESTAMP)
        .column(WINDOW_END, DataTypes.TIMESTAMP)
        .column(VALUE, DataTypes.DOUBLE)
        .column(COMPLETENESS, DataTypes.DOUBLE)
        .column(PRESENT, DataTypes.INT)
        .column(EXPECTED, DataTypes.INT)
        .with(TableOption.GC_GRACE_SECONDS, appProperties.getDataTableGcGraceSeconds());
  }

  private CreateTableSpecification anomalyTableSpec() {
    return CreateTableSpecification
        .createTable(ANOMALY_TABLE)
        .ifNotExists()
        .partitionKeyColumn(ENTITY_ID, DataTypes.TEXT)
        .partitionKeyColumn(METRIC, DataTypes.TEXT)
        .clusteredKeyColumn(TIMESTAMP, DataTypes.TIMESTAMP)
        .clusteredKeyColumn(METHOD, DataTypes.TEXT)
        .column(SEVERITY, DataTypes.DOUBLE)
        .column(REFERENCE_VALUE, DataTypes.DOUBLE)
        .column(VALUE, DataTypes.DOUBLE)
        .with(TableOption.GC_GRACE_SECONDS, appProperties.getDataTableGcGraceSeconds());
  }

  private CreateTableSpecification correlationTableSpec() {
    return CreateTableSpecification
        .createTable(CORRELATION_TABLE)
        .ifNotExists()
        .partitionKeyColumn(ENTITY_PAIR, DataTypes.TEXT)
        .clusteredKeyColumn(WINDOW_START, DataTypes.TIMESTAMP)
        .clusteredKeyColumn(METRIC_PAIR, DataTypes.TEXT)
        .clusteredKeyColumn(LAG, DataTypes.INT)
        .column(WINDOW_END, DataTypes.TIMESTAMP)
        .column(COEFFICIENT, DataTypes.DOUBLE)
        .column(PAIRED_POINTS, DataTypes.INT)
        .with(TableOption.GC_GRACE_SECONDS, appProperties.getDataTableGcGraceSeconds());
  }

  private CreateTableSpecification forecastTableSpec() {
    return CreateTableSpecification
        .createTable(FORECAST_TABLE)
        .ifNotExists()
        .partitionKeyColumn(ENTITY_ID, DataTypes.TEXT)
        .partitionKeyColumn(METRIC, DataTypes.TEXT)
        .clusteredKeyColumn(GENERATED_AT, DataTypes.TIMESTAMP)
        .clusteredKeyColumn(HORIZON_TIMESTAMP, DataTypes.TIMESTAMP)
        .column(POINT_ESTIMATE, DataTypes.DOUBLE)
        .column(LOWER_BOUND, DataTypes.DOUBLE)
        .column(UPPER_BOUND, DataTypes.DOUBLE)
        .column(MODEL_ID, DataTypes.TEXT)
        .with(TableOption.GC_GRACE_SECONDS, appProperties.getDataTableGcGraceSeconds());
  }

  private CreateTableSpecification forecastModelTableSpec() {
    return CreateTableSpecification
        .createTable(FORECAST_MODEL_TABLE)
        .ifNotExists()
        .partitionKeyColumn(MODEL_ID, DataTypes.TEXT)
        .column(ENTITY_ID, DataTypes.TEXT)
        .column(METRIC, DataTypes.TEXT)
        .column(TRAINING_START, DataTypes.TIMESTAMP)
        .column(TRAINING_END, DataTypes.TIMESTAMP)
        .column(CONFIG, DataTypes.TEXT)
        .column(EXOGENOUS, DataTypes.listOf(DataTypes.TEXT))
        .column(SEASONAL_PROFILE, DataTypes.listOf(DataTypes.DOUBLE))
        .column(EXOGENOUS_COEFFICIENTS, DataTypes.listOf(DataTypes.DOUBLE))
        .column(AR_COEFFICIENTS, DataTypes.listOf(DataTypes.DOUBLE))
        .column(MA_COEFFICIENTS, DataTypes.listOf(DataTypes.DOUBLE))
        .column(RESIDUAL_MEAN, DataTypes.DOUBLE)
        .column(RESIDUAL_STD_DEV, DataTypes.DOUBLE)
        .column(RESIDUAL_COUNT, DataTypes.INT)
        .column(ITERATIONS, DataTypes.INT)
        .column(CONVERGED, DataTypes.BOOLEAN);
  }

  private Map<Option,Object> compactionOptions(Duration partitionWidth) {
    // one compaction window per partition time slot
    final TimeUnit windowUnit;
    final long windowSize;
    if (partitionWidth.compareTo(Duration.ofDays(1)) >= 0) {
      windowUnit = TimeUnit.DAYS;
      windowSize = partitionWidth.toDays();
    } else if (partitionWidth.compareTo(Duration.ofHours(1)) >= 0) {
      windowUnit = TimeUnit.HOURS;
      windowSize = partitionWidth.toHours();
    } else {
      windowUnit = TimeUnit.MINUTES;
      windowSize = Math.max(partitionWidth.toMinutes(), 1);
    }

    return Map.of(
        CompactionOption.CLASS, "TimeWindowCompactionStrategy",
        COMPACTION_WINDOW_UNIT, windowUnit,
        COMPACTION_WINDOW_SIZE, windowSize
    );
  }
}
