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

import com.datastax.oss.driver.api.core.cql.BatchStatement;
import com.datastax.oss.driver.api.core.cql.BatchStatementBuilder;
import com.datastax.oss.driver.api.core.cql.BatchType;
import com.datastax.oss.driver.api.core.cql.SimpleStatement;
import java.util.List;
import org.springframework.data.cassandra.core.cql.ReactiveCqlTemplate;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

class CqlBatches {

  /**
   * Keeps batches well below Cassandra's default batch size failure threshold.
   */
  static final int MAX_BATCH_STATEMENTS = 100;

  private CqlBatches() {
  }

  /**
   * Executes the statements as logged batches of at most {@link #MAX_BATCH_STATEMENTS}, one
   * batch after the other.
   */
  static Mono<Void> execute(ReactiveCqlTemplate cqlTemplate, Flux<SimpleStatement> statements) {
    return statements
        .buffer(MAX_BATCH_STATEMENTS)
        // ...and create a batch statement containing those
        .map(CqlBatches::logged)
        // ...and execute the batch
        .concatMap(cqlTemplate::execute)
        .then();
  }

  private static BatchStatement logged(List<SimpleStatement> statements) {
    final BatchStatementBuilder batchStatementBuilder = new BatchStatementBuilder(BatchType.LOGGED);
    // NOTE: tried addStatements, but unable to cast iterables
    statements.forEach(batchStatementBuilder::addStatement);
    return batchStatementBuilder.build();
  }
}
