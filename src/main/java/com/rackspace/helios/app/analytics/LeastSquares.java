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
 * Ordinary least squares through the normal equations, solved by Gaussian elimination with
 * partial pivoting.
 */
public class LeastSquares {

  private static final double SINGULAR_EPSILON = 1e-12;

  private LeastSquares() {
  }

  /**
   * Solves <code>min |Xb - y|&sup2; + &lambda;|b|&sup2;</code> where &lambda; is
   * <code>ridge</code> times the mean diagonal of <code>X'X</code>.
   *
   * @param design one row per observation
   * @throws ArithmeticException if the normal equations are singular
   */
  public static double[] solve(double[][] design, double[] target, double ridge) {
    if (design.length != target.length) {
      throw new IllegalArgumentException("Design has " + design.length + " rows but target has "
          + target.length);
    }
    if (design.length == 0) {
      throw new ArithmeticException("No observations to fit");
    }
    final int cols = design[0].length;
    final double[][] normal = new double[cols][cols];
    final double[] rhs = new double[cols];
    for (int r = 0; r < design.length; r++) {
      final double[] row = design[r];
      for (int i = 0; i < cols; i++) {
        if (row[i] == 0) {
          continue;
        }
        rhs[i] += row[i] * target[r];
        for (int j = 0; j < cols; j++) {
          normal[i][j] += row[i] * row[j];
        }
      }
    }

    double trace = 0;
    for (int i = 0; i < cols; i++) {
      trace += normal[i][i];
    }
    final double penalty = ridge * trace / cols;
    for (int i = 0; i < cols; i++) {
      normal[i][i] += penalty;
    }
    return gaussianElimination(normal, rhs, SINGULAR_EPSILON * Math.max(trace / cols, 1.0));
  }

  static double[] gaussianElimination(double[][] a, double[] b, double epsilon) {
    final int n = b.length;
    for (int col = 0; col < n; col++) {
      int pivot = col;
      for (int row = col + 1; row < n; row++) {
        if (Math.abs(a[row][col]) > Math.abs(a[pivot][col])) {
          pivot = row;
        }
      }
      if (!(Math.abs(a[pivot][col]) > epsilon)) {
        throw new ArithmeticException("Singular system at column " + col);
      }
      final double[] rowSwap = a[col];
      a[col] = a[pivot];
      a[pivot] = rowSwap;
      final double bSwap = b[col];
      b[col] = b[pivot];
      b[pivot] = bSwap;

      for (int row = col + 1; row < n; row++) {
        final double factor = a[row][col] / a[col][col];
        if (factor == 0) {
          continue;
        }
        for (int k = col; k < n; k++) {
          a[row][k] -= factor * a[col][k];
        }
        b[row] -= factor * b[col];
      }
    }

    final double[] x = new double[n];
    for (int row = n - 1; row >= 0; row--) {
      double sum = b[row];
      for (int k = row + 1; k < n; k++) {
        sum -= a[row][k] * x[k];
      }
      x[row] = sum / a[row][row];
    }
    return x;
  }
}
