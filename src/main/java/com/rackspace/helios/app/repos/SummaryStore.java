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

import com.rackspace.helios.app.model.AggregateKind;
import com.rackspace.helios.app.model.GoldSummary;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

public interface SummaryStore {

  Mono<Void> writeSummaries(List<GoldSummary> summaries);

  /**
   * Reads summaries of the configured aggregate window whose window starts in
   * <code>[start, end)</code>.
   */
  Flux<GoldSummary> readSummaries(String entityId, String metric, AggregateKind kind,
                                  Instant start, Instant end);

  Flux<GoldSummary> readSummaries(String entityId, String metric, AggregateKind kind,
                                  Duration window, Instant start, Instant end);
}
