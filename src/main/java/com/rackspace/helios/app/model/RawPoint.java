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

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.Instant;
import java.time.OffsetDateTime;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import lombok.Data;

/**
 * A raw observation as it arrived from an upstream source. Bronze points are immutable once
 * appended; a correction is a new point with a later <code>ingestedAt</code>.
 */
@Data
public class RawPoint {
  @NotBlank
  String entityId;

  @NotBlank
  String metric;

  /**
   * Observation time with the offset the source reported.
   */
  @NotNull
  OffsetDateTime timestamp;

  @NotNull
  Number value;

  /**
   * Unit of <code>value</code>. When absent the metric's canonical unit is assumed.
   */
  String unit;

  String source;

  Instant ingestedAt;

  @JsonIgnore
  public Instant getInstant() {
    return timestamp == null ? null : timestamp.toInstant();
  }
}
