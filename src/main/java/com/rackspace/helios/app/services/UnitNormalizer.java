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

import com.rackspace.helios.app.config.AppProperties;
import com.rackspace.helios.app.exceptions.ValidationException;
import java.util.Locale;
import java.util.Map;
import java.util.function.DoubleUnaryOperator;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Converts raw values into the canonical unit configured for their metric.
 */
@Component
public class UnitNormalizer {

  /**
   * Conversions into each supported canonical unit keyed by lower-cased source unit.
   */
  private static final Map<String, Map<String, DoubleUnaryOperator>> CONVERSIONS = Map.of(
      "mwh", Map.of(
          "wh", v -> v / 1_000_000,
          "kwh", v -> v / 1_000,
          "mwh", v -> v,
          "gwh", v -> v * 1_000),
      "kwh", Map.of(
          "wh", v -> v / 1_000,
          "kwh", v -> v,
          "mwh", v -> v * 1_000,
          "gwh", v -> v * 1_000_000),
      "c", Map.of(
          "c", v -> v,
          "k", v -> v - 273.15,
          "f", v -> (v - 32) * 5 / 9),
      "mm", Map.of(
          "mm", v -> v,
          "cm", v -> v * 10,
          "m", v -> v * 1_000),
      "m/s", Map.of(
          "m/s", v -> v,
          "km/h", v -> v / 3.6,
          "kn", v -> v * 0.514444),
      "deg", Map.of(
          "deg", v -> v)
  );

  private final AppProperties appProperties;

  @Autowired
  public UnitNormalizer(AppProperties appProperties) {
    this.appProperties = appProperties;
  }

  /**
   * @param unit the unit the value was reported in, or null for the canonical unit
   * @throws ValidationException if the unit cannot be converted to the metric's canonical unit
   */
  public double toCanonical(String metric, double value, String unit) {
    final String canonical = appProperties.getCanonicalUnits().get(metric);
    if (canonical == null) {
      if (unit != null) {
        throw new ValidationException("No canonical unit configured for metric " + metric
            + " to convert " + unit + " into");
      }
      return value;
    }
    if (unit == null) {
      return value;
    }

    final Map<String, DoubleUnaryOperator> conversions = CONVERSIONS.get(normalize(canonical));
    final DoubleUnaryOperator conversion = conversions == null ?
        (normalize(canonical).equals(normalize(unit)) ? DoubleUnaryOperator.identity() : null) :
        conversions.get(normalize(unit));
    if (conversion == null) {
      throw new ValidationException("Unit " + unit + " cannot be converted to " + canonical
          + " for metric " + metric);
    }
    return conversion.applyAsDouble(value);
  }

  private static String normalize(String unit) {
    return unit.trim().toLowerCase(Locale.ROOT).replace("°", "");
  }
}
