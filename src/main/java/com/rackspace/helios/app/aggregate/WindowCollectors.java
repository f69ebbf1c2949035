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

import com.rackspace.helios.app.model.TimeSeriesPoint;
import java.time.Instant;
import java.util.stream.Collector;

public class WindowCollectors {

  private WindowCollectors() {
  }

  public static Collector<TimeSeriesPoint, AggregatedWindow, AggregatedWindow> windowCollector(
      TemporalNormalizer normalizer) {
    return Collector.of(
        AggregatedWindow::new,
        (agg, in) -> {
          agg.setWindowStart(minTimestamp(agg.getWindowStart(), in.getTimestamp()));
          agg.setTotal(agg.getTotal() + 1);
          if (in.hasValue()) {
            final double value = in.getValue();
            agg.setMin(Double.min(agg.getMin(), value));
            agg.setMax(Double.max(agg.getMax(), value));
            agg.setSum(agg.getSum() + value);
            agg.setCount(agg.getCount() + 1);
          }
        },
        WindowCollectors::combine,
        agg -> {
          agg.setWindowStart(agg.getWindowStart().with(normalizer));
          agg.setWindowEnd(normalizer.next(agg.getWindowStart()));
          agg.setAverage(agg.getCount() > 0 ? agg.getSum() / agg.getCount() : Double.NaN);
          return agg;
        }
    );
  }

  private static AggregatedWindow combine(AggregatedWindow agg, AggregatedWindow in) {
    agg.setWindowStart(minTimestamp(agg.getWindowStart(), in.getWindowStart()));
    agg.setMin(Double.min(agg.getMin(), in.getMin()));
    agg.setMax(Double.max(agg.getMax(), in.getMax()));
    agg.setSum(Double.sum(agg.getSum(), in.getSum()));
    agg.setCount(Integer.sum(agg.getCount(), in.getCount()));
    agg.setTotal(Integer.sum(agg.getTotal(), in.getTotal()));
    return agg;
  }

  private static Instant minTimestamp(Instant lhs, Instant rhs) {
    if (lhs == null) {
      return rhs;
    } else if (rhs == null) {
      return lhs;
    } else {
      return lhs.compareTo(rhs) < 0 ? lhs : rhs;
    }
  }
}
