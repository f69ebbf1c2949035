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

import com.rackspace.helios.app.exceptions.StoreUnavailableException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.data.mongodb.core.ReactiveMongoTemplate;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

/**
 * Serving store backed by MongoDB, one collection per published table. Records are inserted as
 * documents without transformation.
 */
@Repository
@Slf4j
public class MongoServingStore implements ServingStore {

  private final ReactiveMongoTemplate mongoTemplate;
  private final Counter dbOperationErrorsCounter;

  @Autowired
  public MongoServingStore(ReactiveMongoTemplate mongoTemplate, MeterRegistry meterRegistry) {
    this.mongoTemplate = mongoTemplate;
    dbOperationErrorsCounter = meterRegistry.counter("helios.db.operation.errors",
        "type", "serving");
  }

  @Override
  public Mono<Long> publish(String table, List<?> records) {
    if (records.isEmpty()) {
      return Mono.just(0L);
    }
    return mongoTemplate.insert(records, table)
        .count()
        .doOnNext(count -> log.debug("Inserted {} documents into {}", count, table))
        .doOnError(e -> dbOperationErrorsCounter.increment())
        .onErrorMap(DataAccessException.class,
            e -> new StoreUnavailableException("Failed to publish to " + table, e))
        .checkpoint();
  }
}
