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

import com.rackspace.helios.app.model.RawPoint;
import java.time.Instant;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Append-only store of raw points as received. Points are never transformed or removed.
 */
public interface BronzeStore {

  Mono<RawPoint> append(RawPoint point);

  /**
   * @param start inclusive
   * @param end exclusive
   */
  Flux<RawPoint> readRange(String entityId, String metric, Instant start, Instant end);
}
