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

import java.util.Collections;
import org.springframework.stereotype.Component;

/**
 * Provides a consolidated declaration of the tables, insert and query statements of the
 * bronze, silver, gold and analytics layers.
 */
@Component
public class DataTablesStatements {

  public static final String BRONZE_TABLE = "bronze_raw";
  public static final String SILVER_TABLE = "silver_points";
  public static final String GOLD_TABLE = "gold_summaries";
  public static final String ANOMALY_TABLE = "anomaly_flags";
  public static final String CORRELATION_TABLE = "correlation_results";
  public static final String FORECAST_TABLE = "forecast_results";
  public static final String FORECAST_MODEL_TABLE = "forecast_models";

  public static final String ENTITY_ID = "entity_id";
  public static final String METRIC = "metric";
  public static final String TIME_PARTITION_SLOT = "time_slot";
  public static final String TIMESTAMP = "ts";
  public static final String UTC_OFFSET = "utc_offset";
  public static final String VALUE = "value";
  public static final String UNIT = "unit";
  public static final String SOURCE = "source";
  public static final String INGESTED_AT = "ingested_at";
  public static final String QUALITY = "quality";
  public static final String CORRECTED = "corrected";
  public static final String AGGREGATE_KIND = "aggregate_kind";
  public static final String WINDOW_WIDTH = "window_width";
  public static final String WINDOW_START = "window_start";
  public static final String WINDOW_END = "window_end";
  public static final String COMPLETENESS = "completeness";
  public static final String PRESENT = "present";
  public static final String EXPECTED = "expected";
  public static final String METHOD = "method";
  public static final String SEVERITY = "severity";
  public static final String REFERENCE_VALUE = "reference_value";
  public static final String ENTITY_PAIR = "entity_pair";
  public static final String METRIC_PAIR = "metric_pair";
  public static final String LAG = "lag";
  public static final String COEFFICIENT = "coefficient";
  public static final String PAIRED_POINTS = "paired_points";
  public static final String GENERATED_AT = "generated_at";
  public static final String HORIZON_TIMESTAMP = "horizon_ts";
  public static final String POINT_ESTIMATE = "point";
  public static final String LOWER_BOUND = "lower";
  public static final String UPPER_BOUND = "upper";
  public static final String MODEL_ID = "model_id";
  public static final String TRAINING_START = "training_start";
  public static final String TRAINING_END = "training_end";
  public static final String CONFIG = "config";
  public static final String EXOGENOUS = "exogenous";
  public static final String SEASONAL_PROFILE = "seasonal_profile";
  public static final String EXOGENOUS_COEFFICIENTS = "exogenous_coefficients";
  public static final String AR_COEFFICIENTS = "ar_coefficients";
  public static final String MA_COEFFICIENTS = "ma_coefficients";
  public static final String RESIDUAL_MEAN = "residual_mean";
  public static final String RESIDUAL_STD_DEV = "residual_std_dev";
  public static final String RESIDUAL_COUNT = "residual_count";
  public static final String ITERATIONS = "iterations";
  public static final String CONVERGED = "converged";

  //CQL Queries
  private static final String BRONZE_INSERT = insert(BRONZE_TABLE,
      ENTITY_ID, METRIC, TIME_PARTITION_SLOT, TIMESTAMP, SOURCE, INGESTED_AT, UTC_OFFSET, VALUE, UNIT);

  private static final String BRONZE_QUERY = "SELECT "
      + String.join(",", TIMESTAMP, SOURCE, INGESTED_AT, UTC_OFFSET, VALUE, UNIT)
      + " FROM " + BRONZE_TABLE + " WHERE " + ENTITY_ID + " = ? AND " + METRIC + " = ?"
      + "  AND " + TIME_PARTITION_SLOT + " = ?"
      + "  AND " + TIMESTAMP + " >= ? AND " + TIMESTAMP + " < ?";

  private static final String SILVER_INSERT = insert(SILVER_TABLE,
      ENTITY_ID, METRIC, TIME_PARTITION_SLOT, TIMESTAMP, VALUE, QUALITY, CORRECTED);

  private static final String SILVER_QUERY = "SELECT "
      + String.join(",", TIMESTAMP, VALUE, QUALITY, CORRECTED)
      + " FROM " + SILVER_TABLE + " WHERE " + ENTITY_ID + " = ? AND " + METRIC + " = ?"
      + "  AND " + TIME_PARTITION_SLOT + " = ?"
      + "  AND " + TIMESTAMP + " >= ? AND " + TIMESTAMP + " < ?";

  private static final String GOLD_INSERT = insert(GOLD_TABLE,
      ENTITY_ID, METRIC, AGGREGATE_KIND, WINDOW_WIDTH, WINDOW_START, WINDOW_END, VALUE,
      COMPLETENESS, PRESENT, EXPECTED);

  private static final String GOLD_QUERY = "SELECT "
      + String.join(",", WINDOW_START, WINDOW_END, VALUE, COMPLETENESS, PRESENT, EXPECTED)
      + " FROM " + GOLD_TABLE + " WHERE " + ENTITY_ID + " = ? AND " + METRIC + " = ?"
      + "  AND " + AGGREGATE_KIND + " = ? AND " + WINDOW_WIDTH + " = ?"
      + "  AND " + WINDOW_START + " >= ? AND " + WINDOW_START + " < ?";

  private static final String ANOMALY_INSERT = insert(ANOMALY_TABLE,
      ENTITY_ID, METRIC, TIMESTAMP, METHOD, SEVERITY, REFERENCE_VALUE, VALUE);

  private static final String ANOMALY_QUERY = "SELECT "
      + String.join(",", TIMESTAMP, METHOD, SEVERITY, REFERENCE_VALUE, VALUE)
      + " FROM " + ANOMALY_TABLE + " WHERE " + ENTITY_ID + " = ? AND " + METRIC + " = ?"
      + "  AND " + TIMESTAMP + " >= ? AND " + TIMESTAMP + " < ?";

  private static final String CORRELATION_INSERT = insert(CORRELATION_TABLE,
      ENTITY_PAIR, WINDOW_START, METRIC_PAIR, LAG, WINDOW_END, COEFFICIENT, PAIRED_POINTS);

  private static final String CORRELATION_QUERY = "SELECT "
      + String.join(",", WINDOW_START, METRIC_PAIR, LAG, WINDOW_END, COEFFICIENT, PAIRED_POINTS)
      + " FROM " + CORRELATION_TABLE + " WHERE " + ENTITY_PAIR + " = ?"
      + "  AND " + WINDOW_START + " >= ? AND " + WINDOW_START + " < ?";

  private static final String FORECAST_INSERT = insert(FORECAST_TABLE,
      ENTITY_ID, METRIC, GENERATED_AT, HORIZON_TIMESTAMP, POINT_ESTIMATE, LOWER_BOUND, UPPER_BOUND,
      MODEL_ID);

  private static final String FORECAST_QUERY = "SELECT "
      + String.join(",", HORIZON_TIMESTAMP, POINT_ESTIMATE, LOWER_BOUND, UPPER_BOUND, MODEL_ID)
      + " FROM " + FORECAST_TABLE + " WHERE " + ENTITY_ID + " = ? AND " + METRIC + " = ?"
      + "  AND " + GENERATED_AT + " = ?";

  private static final String FORECAST_MODEL_INSERT = insert(FORECAST_MODEL_TABLE,
      MODEL_ID, ENTITY_ID, METRIC, TRAINING_START, TRAINING_END, CONFIG, EXOGENOUS,
      SEASONAL_PROFILE, EXOGENOUS_COEFFICIENTS, AR_COEFFICIENTS, MA_COEFFICIENTS, RESIDUAL_MEAN,
      RESIDUAL_STD_DEV, RESIDUAL_COUNT, ITERATIONS, CONVERGED);

  private static final String FORECAST_MODEL_QUERY = "SELECT "
      + String.join(",", MODEL_ID, ENTITY_ID, METRIC, TRAINING_START, TRAINING_END, CONFIG, EXOGENOUS,
      SEASONAL_PROFILE, EXOGENOUS_COEFFICIENTS, AR_COEFFICIENTS, MA_COEFFICIENTS, RESIDUAL_MEAN,
      RESIDUAL_STD_DEV, RESIDUAL_COUNT, ITERATIONS, CONVERGED)
      + " FROM " + FORECAST_MODEL_TABLE + " WHERE " + MODEL_ID + " = ?";

  private static String insert(String table, String... columns) {
    return "INSERT INTO " + table + " (" + String.join(",", columns) + ") VALUES ("
        + String.join(",", Collections.nCopies(columns.length, "?")) + ")";
  }

  /**
   * @return INSERT CQL statement with placeholders entityId, metric, timeSlot, timestamp,
   * source, ingestedAt, utcOffset, value, unit
   */
  public String bronzeInsert() {
    return BRONZE_INSERT;
  }

  /**
   * @return A SELECT CQL statement with placeholders entityId, metric, timeSlot, starting
   * timestamp, ending timestamp and returns timestamp, source, ingestedAt, utcOffset, value, unit
   */
  public String bronzeQuery() {
    return BRONZE_QUERY;
  }

  /**
   * @return INSERT CQL statement with placeholders entityId, metric, timeSlot, timestamp, value,
   * quality, corrected
   */
  public String silverInsert() {
    return SILVER_INSERT;
  }

  /**
   * @return A SELECT CQL statement with placeholders entityId, metric, timeSlot, starting
   * timestamp, ending timestamp and returns timestamp, value, quality, corrected
   */
  public String silverQuery() {
    return SILVER_QUERY;
  }

  public String goldInsert() {
    return GOLD_INSERT;
  }

  /**
   * @return A SELECT CQL statement with placeholders entityId, metric, kind, window width in
   * seconds, starting window, ending window
   */
  public String goldQuery() {
    return GOLD_QUERY;
  }

  public String anomalyInsert() {
    return ANOMALY_INSERT;
  }

  public String anomalyQuery() {
    return ANOMALY_QUERY;
  }

  public String correlationInsert() {
    return CORRELATION_INSERT;
  }

  public String correlationQuery() {
    return CORRELATION_QUERY;
  }

  public String forecastInsert() {
    return FORECAST_INSERT;
  }

  public String forecastQuery() {
    return FORECAST_QUERY;
  }

  public String forecastModelInsert() {
    return FORECAST_MODEL_INSERT;
  }

  public String forecastModelQuery() {
    return FORECAST_MODEL_QUERY;
  }
}
