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

package com.rackspace.helios.app.aggregate;

import com.rackspace.helios.app.model.AggregateKind;
import java.time.Instant;
import lombok.Data;

/**
 * Running aggregate of one window. Only points with a value contribute to the statistics;
 * <code>total</code> counts every point seen, missing ones included.
 */
@Data
public class AggregatedWindow {
  Instant windowStart;
  Instant windowEnd;
  double min = Double.POSITIVE_INFINITY;
  double max = Double.NEGATIVE_INFINITY;
  double sum;
  int count;
  int total;
  double average = Double.NaN;

  public double valueOf(AggregateKind kind) {
    switch (kind) {
      case SUM:
        return sum;
      case MEAN:
        return average;
      case MIN:
        return min;
      case MAX:
        return max;
      case COUNT:
        return count;
      default:
        throw new IllegalArgumentException("Unsupported aggregate kind: " + kind);
    }
  }
}
