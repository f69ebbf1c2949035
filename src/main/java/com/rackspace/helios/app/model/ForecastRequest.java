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

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import javax.validation.Valid;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import lombok.Data;

@Data
public class ForecastRequest {
  @NotBlank
  String entityId;
  @NotBlank
  String metric;

  @Valid
  List<SeriesRef> exogenous = List.of();

  /**
   * Defaults to <code>trainingEnd</code> minus the configured training window.
   */
  Instant trainingStart;

  @NotNull
  Instant trainingEnd;

  /**
   * Defaults to the configured forecast horizon.
   */
  Duration horizon;
}
