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

package com.rackspace.helios.app.config;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class WorkerPoolConfig {

  private final PipelineProperties pipelineProperties;

  @Autowired
  public WorkerPoolConfig(PipelineProperties pipelineProperties) {
    this.pipelineProperties = pipelineProperties;
  }

  @Bean(destroyMethod = "shutdown")
  public ExecutorService pipelineWorkers() {
    return Executors.newFixedThreadPool(pipelineProperties.getWorkerThreads());
  }

  /**
   * Source of <code>generated_at</code> provenance timestamps.
   */
  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
