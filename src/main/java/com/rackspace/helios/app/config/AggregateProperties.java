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

import com.rackspace.helios.app.model.AggregateKind;
import java.time.Duration;
import java.util.List;
import javax.validation.constraints.DecimalMax;
import javax.validation.constraints.DecimalMin;
import javax.validation.constraints.NotEmpty;
import javax.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationFormat;
import org.springframework.boot.convert.DurationStyle;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties("helios.aggregate")
@Component
@Data
@Validated
public class AggregateProperties {
  /**
   * Width of the fixed, non-overlapping aggregation windows.
   * For example: 1d
   */
  @NotNull
  @DurationFormat(DurationStyle.SIMPLE)
  Duration window = Duration.ofDays(1);

  @NotEmpty
  List<AggregateKind> kinds = List.of(
      AggregateKind.SUM, AggregateKind.MEAN, AggregateKind.MIN, AggregateKind.MAX);

  /**
   * Summaries with a lower completeness ratio are not written. Zero keeps every summary.
   */
  @DecimalMin("0.0")
  @DecimalMax("1.0")
  double completenessThreshold = 0.0;
}
