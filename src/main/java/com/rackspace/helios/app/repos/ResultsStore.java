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

import com.rackspace.helios.app.model.AnomalyFlag;
import com.rackspace.helios.app.model.CorrelationResult;
import com.rackspace.helios.app.model.ForecastDiagnostics;
import com.rackspace.helios.app.model.ForecastResult;
import com.rackspace.helios.app.model.ForecastRun;
import java.time.Instant;
import java.util.List;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Outputs of the analytics stages. Anomalies are keyed by (entity, metric, timestamp),
 * correlations by (entity pair, window start) and forecasts by (entity, metric, generated at).
 */
public interface ResultsStore {

  Mono<Void> writeAnomalies(List<AnomalyFlag> flags);

  Flux<AnomalyFlag> readAnomalies(String entityId, String metric, Instant start, Instant end);

  Mono<Void> writeCorrelations(List<CorrelationResult> results);

  /**
   * @param entityPair the two entity ids joined by <code>|</code>
   */
  Flux<CorrelationResult> readCorrelations(String entityPair, Instant start, Instant end);

  /**
   * Writes the forecast points together with the diagnostics of the model that produced them.
   */
  Mono<Void> writeForecasts(ForecastRun run);

  Flux<ForecastResult> readForecasts(String entityId, String metric, Instant generatedAt);

  Mono<ForecastDiagnostics> readForecastModel(String modelId);
}
