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

package com.rackspace.helios.app.web;

import com.rackspace.helios.app.model.AppendResponse;
import com.rackspace.helios.app.model.RawPoint;
import com.rackspace.helios.app.repos.BronzeStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Profile;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api")
@Slf4j
@Profile("ingest")
public class WriteController {

  private final BronzeStore bronzeStore;

  @Autowired
  public WriteController(BronzeStore bronzeStore) {
    this.bronzeStore = bronzeStore;
  }

  /**
   * Appends raw points to bronze as received. Unit and value checks happen when the points are
   * transformed to silver, so a point that is structurally complete is always kept here.
   */
  @PostMapping("/bronze")
  public Mono<AppendResponse> appendRaw(@RequestBody @Validated Flux<RawPoint> points) {
    return points
        .concatMap(bronzeStore::append)
        .count()
        .doOnNext(count -> log.debug("Appended {} raw points", count))
        .map(count -> new AppendResponse().setAppended(count));
  }
}
