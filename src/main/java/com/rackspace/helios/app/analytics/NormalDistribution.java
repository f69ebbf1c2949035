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
 * Inverse of the standard normal cumulative distribution using Acklam's rational approximation,
 * relative error below 1.15e-9.
 */
public class NormalDistribution {

  private static final double[] A = {
      -3.969683028665376e+01, 2.209460984245205e+02, -2.759285104469687e+02,
      1.383577518672690e+02, -3.066479806614716e+01, 2.506628277459239e+00
  };
  private static final double[] B = {
      -5.447609879822406e+01, 1.615858368580409e+02, -1.556989798598866e+02,
      6.680131188771972e+01, -1.328068155288572e+01
  };
  private static final double[] C = {
      -7.784894002430293e-03, -3.223964580411365e-01, -2.400758277161838e+00,
      -2.549732539343734e+00, 4.374664141464968e+00, 2.938163982698783e+00
  };
  private static final double[] D = {
      7.784695709041462e-03, 3.224671290700398e-01, 2.445134137142996e+00,
      3.754408661907416e+00
  };
  private static final double P_LOW = 0.02425;
  private static final double P_HIGH = 1 - P_LOW;

  private NormalDistribution() {
  }

  public static double quantile(double p) {
    if (!(p > 0 && p < 1)) {
      throw new IllegalArgumentException("Probability must be in (0, 1): " + p);
    }
    if (p < P_LOW) {
      final double q = Math.sqrt(-2 * Math.log(p));
      return (((((C[0] * q + C[1]) * q + C[2]) * q + C[3]) * q + C[4]) * q + C[5])
          / ((((D[0] * q + D[1]) * q + D[2]) * q + D[3]) * q + 1);
    }
    if (p > P_HIGH) {
      final double q = Math.sqrt(-2 * Math.log(1 - p));
      return -(((((C[0] * q + C[1]) * q + C[2]) * q + C[3]) * q + C[4]) * q + C[5])
          / ((((D[0] * q + D[1]) * q + D[2]) * q + D[3]) * q + 1);
    }
    final double q = p - 0.5;
    final double r = q * q;
    return (((((A[0] * r + A[1]) * r + A[2]) * r + A[3]) * r + A[4]) * r + A[5]) * q
        / (((((B[0] * r + B[1]) * r + B[2]) * r + B[3]) * r + B[4]) * r + 1);
  }

  /**
   * @return the two-sided critical value for a central interval at <code>confidenceLevel</code>
   */
  public static double criticalValue(double confidenceLevel) {
    return quantile((1 + confidenceLevel) / 2);
  }

  /**
   * Wilson-Hilferty approximation of the chi-squared quantile.
   */
  public static double chiSquaredQuantile(double p, int degreesOfFreedom) {
    if (degreesOfFreedom < 1) {
      throw new IllegalArgumentException("Degrees of freedom must be positive, got " + degreesOfFreedom);
    }
    final double spread = 2.0 / (9 * degreesOfFreedom);
    final double cube = 1 - spread + quantile(p) * Math.sqrt(spread);
    return degreesOfFreedom * cube * cube * cube;
  }
}
