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

package com.rackspace.helios.app.analytics;

import java.util.Arrays;

public class RobustStatistics {

  /**
   * Scales the median absolute deviation to a consistent estimator of the standard deviation
   * of normally distributed data.
   */
  public static final double MAD_SCALE = 1.4826;

  private RobustStatistics() {
  }

  public static double median(double[] values) {
    if (values.length == 0) {
      throw new IllegalArgumentException("Median of no values");
    }
    final double[] sorted = values.clone();
    Arrays.sort(sorted);
    final int mid = sorted.length / 2;
    return sorted.length % 2 == 1 ? sorted[mid] : (sorted[mid - 1] + sorted[mid]) / 2;
  }

  public static double medianAbsoluteDeviation(double[] values, double median) {
    final double[] deviations = new double[values.length];
    for (int i = 0; i < values.length; i++) {
      deviations[i] = Math.abs(values[i] - median);
    }
    return median(deviations);
  }

  public static double mean(double[] values) {
    double sum = 0;
    for (double value : values) {
      sum += value;
    }
    return values.length == 0 ? Double.NaN : sum / values.length;
  }

  /**
   * Population standard deviation.
   */
  public static double standardDeviation(double[] values, double mean) {
    double sumSquares = 0;
    for (double value : values) {
      sumSquares += (value - mean) * (value - mean);
    }
    return values.length == 0 ? Double.NaN : Math.sqrt(sumSquares / values.length);
  }
}
