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

package com.rackspace.helios.app.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import lombok.Getter;

/**
 * Norwegian electricity price areas and the reference weather location used for each.
 */
@Getter
public enum PriceArea {
  NO1("Oslo", 59.9139, 10.7522),
  NO2("Kristiansand", 58.1467, 7.9956),
  NO3("Trondheim", 63.4305, 10.3951),
  NO4("Tromsø", 69.6492, 18.9553),
  NO5("Bergen", 60.39299, 5.32415);

  private final String city;
  private final double latitude;
  private final double longitude;

  PriceArea(String city, double latitude, double longitude) {
    this.city = city;
    this.latitude = latitude;
    this.longitude = longitude;
  }

  /**
   * Entity id of the weather series paired with this price area.
   */
  public String weatherStation() {
    return "station-" + city.toLowerCase(Locale.ROOT);
  }

  public static Optional<PriceArea> fromEntityId(String entityId) {
    return Arrays.stream(values())
        .filter(area -> area.name().equalsIgnoreCase(entityId))
        .findFirst();
  }
}
