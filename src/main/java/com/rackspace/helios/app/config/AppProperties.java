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

import java.time.Duration;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.HashMap;
import java.util.Map;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties("helios")
@Component
@Data
@Validated
public class AppProperties {
  /**
   * The fixed step silver series are resampled to.
   */
  @NotNull
  @DurationUnit(ChronoUnit.MINUTES)
  Duration canonicalInterval = Duration.ofHours(1);

  /**
   * The longest run of empty grid slots, in canonical intervals, that is filled by linear
   * interpolation. Longer gaps are emitted as missing points.
   */
  @Min(0)
  int maxInterpolationGap = 3;

  /**
   * Zone that grid slots and aggregation windows are aligned to.
   */
  @NotNull
  ZoneId referenceZone = ZoneId.of("UTC");

  /**
   * Canonical unit per metric. Raw points of a listed metric are converted to this unit;
   * points of unlisted metrics must not declare a unit.
   */
  @NotNull
  Map<String, String> canonicalUnits = new HashMap<>(Map.of(
      "production", "MWh",
      "consumption", "MWh",
      "temperature_2m", "C",
      "precipitation", "mm",
      "windspeed_10m", "m/s",
      "windgusts_10m", "m/s",
      "winddirection_10m", "deg"
  ));

  /**
   * The width of time slots used for partitioning stored series, which can reduce the number
   * of Cassandra files that need to be scanned by a range read.
   */
  @NotNull
  Duration partitionWidth = Duration.ofDays(7);

  /**
   * When initially creating the Cassandra data table schemas,
   * this value will be used for the expired data garbage collection.
   */
  @Min(60)
  int dataTableGcGraceSeconds = 86400;

  /**
   * Database of the query-facing serving store.
   */
  @NotNull
  String servingDatabase = "helios";
}
