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

package com.rackspace.helios.app.aggregate;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoField;
import java.time.temporal.Temporal;
import java.time.temporal.TemporalAdjuster;
import lombok.Getter;

/**
 * Rounds a timestamp down to a multiple of <code>rounding</code> on the local time line of a
 * zone, so that daily windows start at local midnight.
 */
public class TemporalNormalizer implements TemporalAdjuster {

  @Getter
  final Duration rounding;
  @Getter
  final ZoneId zone;

  public TemporalNormalizer(Duration rounding) {
    this(rounding, ZoneOffset.UTC);
  }

  public TemporalNormalizer(Duration rounding, ZoneId zone) {
    if (rounding.getSeconds() <= 0) {
      throw new IllegalArgumentException("Rounding must be at least one second: " + rounding);
    }
    this.rounding = rounding;
    this.zone = zone;
  }

  @Override
  public Temporal adjustInto(Temporal temporal) {
    final Instant instant = Instant.ofEpochSecond(temporal.getLong(ChronoField.INSTANT_SECONDS));
    return temporal
        .with(ChronoField.NANO_OF_SECOND, 0)
        .with(ChronoField.INSTANT_SECONDS, normalize(instant).getEpochSecond());
  }

  /**
   * @param windowStart a normalized timestamp
   * @return the start of the following window
   */
  public Instant next(Instant windowStart) {
    // stepping the instant keeps a repeated local hour as its own window
    final Instant stepped = normalize(windowStart.plus(rounding));
    if (stepped.isAfter(windowStart)) {
      return stepped;
    }
    // window longer than the rounding, such as a day that ends daylight saving time
    return toInstant(localSeconds(windowStart) + rounding.getSeconds(), offsetAt(windowStart));
  }

  private Instant normalize(Instant instant) {
    return toInstant(round(localSeconds(instant)), offsetAt(instant));
  }

  private ZoneOffset offsetAt(Instant instant) {
    return zone.getRules().getOffset(instant);
  }

  private long localSeconds(Instant instant) {
    return instant.atZone(zone).toLocalDateTime().toEpochSecond(ZoneOffset.UTC);
  }

  /**
   * @param preferredOffset resolves a local time that occurs twice when the clocks go back
   */
  private Instant toInstant(long localSeconds, ZoneOffset preferredOffset) {
    return ZonedDateTime.ofLocal(
        LocalDateTime.ofEpochSecond(localSeconds, 0, ZoneOffset.UTC), zone, preferredOffset)
        .toInstant();
  }

  private long round(long seconds) {
    return seconds - Math.floorMod(seconds, rounding.getSeconds());
  }
}
