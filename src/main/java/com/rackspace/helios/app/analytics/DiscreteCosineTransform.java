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

/**
 * Orthonormal DCT-II and its inverse, matching <code>norm="ortho"</code> conventions so that
 * the transform preserves energy.
 */
public class DiscreteCosineTransform {

  private DiscreteCosineTransform() {
  }

  public static double[] forward(double[] x) {
    final int n = x.length;
    final double[] coefficients = new double[n];
    for (int k = 0; k < n; k++) {
      double sum = 0;
      for (int i = 0; i < n; i++) {
        sum += x[i] * Math.cos(Math.PI * k * (2 * i + 1) / (2.0 * n));
      }
      coefficients[k] = sum * scale(k, n);
    }
    return coefficients;
  }

  public static double[] inverse(double[] coefficients) {
    final int n = coefficients.length;
    final double[] x = new double[n];
    for (int i = 0; i < n; i++) {
      double sum = 0;
      for (int k = 0; k < n; k++) {
        if (coefficients[k] != 0) {
          sum += scale(k, n) * coefficients[k] * Math.cos(Math.PI * k * (2 * i + 1) / (2.0 * n));
        }
      }
      x[i] = sum;
    }
    return x;
  }

  /**
   * Keeps the lowest <code>keep</code> coefficients and reconstructs the signal.
   */
  public static double[] lowPass(double[] x, int keep) {
    final double[] coefficients = forward(x);
    for (int k = Math.max(keep, 0); k < coefficients.length; k++) {
      coefficients[k] = 0;
    }
    return inverse(coefficients);
  }

  private static double scale(int k, int n) {
    return k == 0 ? Math.sqrt(1.0 / n) : Math.sqrt(2.0 / n);
  }
}
