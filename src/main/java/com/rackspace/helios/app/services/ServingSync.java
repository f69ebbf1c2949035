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

import com.rackspace.helios.app.repos.ServingStore;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;

/**
 * Copies records as they are into the serving store.
 */
@Service
@Slf4j
public class ServingSync {

  private final ServingStore servingStore;

  @Autowired
  public ServingSync(ServingStore servingStore) {
    this.servingStore = servingStore;
  }

  /**
   * @return the number of records published
   */
  public Mono<Long> publish(String table, List<?> records) {
    if (!StringUtils.hasText(table)) {
      return Mono.error(new IllegalArgumentException("A serving table name is required"));
    }
    log.debug("Publishing {} records to {}", records.size(), table);
    return servingStore.publish(table, records);
  }
}
