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

import java.time.Duration;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties("helios.pipeline")
@Component
@Data
@Validated
public class PipelineProperties {

  /**
   * The number of threads that process series in parallel and host forecast fits.
   * The default uses number of available processors reported by the JVM.
   */
  @Min(1)
  int workerThreads = Runtime.getRuntime().availableProcessors();

  /**
   * How long a stage run waits for a forecast fit before abandoning it.
   */
  @NotNull
  Duration fitTimeout = Duration.ofMinutes(5);
}
