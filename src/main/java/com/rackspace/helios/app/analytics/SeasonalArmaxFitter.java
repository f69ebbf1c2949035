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

import com.rackspace.helios.app.exceptions.FitConvergenceException;
import com.rackspace.helios.app.model.ForecastConfig;
import java.util.Arrays;
import lombok.extern.slf4j.Slf4j;

/**
 * Fits {@link SeasonalArmaxModel} in two stages. Seasonal profile and exogenous coefficients
 * come from least squares over seasonal dummies and regressors. The regression residuals are
 * then fitted as ARMA(p, q): Hannan-Rissanen initial estimates refined by iterated conditional
 * least squares until either the largest parameter change or the relative change of the
 * conditional sum of squares is below the tolerance.
 * <p>
 * When the initial estimates do not fit the residuals significantly better than white noise,
 * the AR and MA terms nearly cancel and the objective is flat along that ridge. Those estimates
 * are kept as they are instead of being iterated.
 * </p>
 */
@Slf4j
public class SeasonalArmaxFitter {

  private static final int MIN_LONG_AR_ORDER = 10;

  /**
   * Level of the likelihood-ratio test of the initial ARMA estimates against white noise.
   */
  private static final double SIGNIFICANCE_LEVEL = 0.99;

  private SeasonalArmaxFitter() {
  }

  /**
   * @param y training values, none missing
   * @param phases seasonal phase of each training step
   * @param exogenous <code>exogenous[j][t]</code> is regressor <code>j</code> at step <code>t</code>
   * @throws FitConvergenceException if estimation does not converge, a system is singular or an
   * estimate is not finite
   */
  public static SeasonalArmaxModel fit(double[] y, int[] phases, double[][] exogenous,
                                       ForecastConfig config) {
    try {
      return doFit(y, phases, exogenous, config);
    } catch (ArithmeticException e) {
      throw new FitConvergenceException("Singular system: " + e.getMessage(), config, e);
    }
  }

  private static SeasonalArmaxModel doFit(double[] y, int[] phases, double[][] exogenous,
                                          ForecastConfig config) {
    final int n = y.length;
    final int m = config.getSeasonalPeriod();
    final int k = exogenous.length;
    final int p = config.getArOrder();
    final int q = config.getMaOrder();

    final double[][] design = new double[n][m + k];
    for (int t = 0; t < n; t++) {
      design[t][phases[t]] = 1;
      for (int j = 0; j < k; j++) {
        design[t][m + j] = exogenous[j][t];
      }
    }
    final double[] regression = LeastSquares.solve(design, y, config.getRidge());
    requireFinite(regression, "regression coefficients", config);

    final double[] e = new double[n];
    for (int t = 0; t < n; t++) {
      double fitted = 0;
      for (int c = 0; c < m + k; c++) {
        fitted += design[t][c] * regression[c];
      }
      e[t] = y[t] - fitted;
    }

    double[] params;
    int iterations;
    if (p == 0 && q == 0) {
      params = new double[0];
      iterations = 0;
    } else if (q == 0) {
      params = regressOnLags(e, null, p, 0, p, config.getRidge());
      iterations = 1;
    } else {
      params = hannanRissanen(e, p, q, config);
      iterations = 0;
      double css = sumOfSquares(innovations(e, params, p, q), p);
      boolean converged = !isSignificant(e, css, p, q);
      if (converged) {
        log.debug("{} terms are not significant against white noise, keeping initial estimates {}",
            config, Arrays.toString(params));
      }
      while (!converged && iterations < config.getMaxIterations()) {
        iterations++;
        final double[] eps = innovations(e, params, p, q);
        requireFinite(eps, "innovations", config);
        final double[] next = regressOnLags(e, eps, p, q, p + q, config.getRidge());
        requireFinite(next, "ARMA coefficients", config);
        double delta = 0;
        for (int i = 0; i < next.length; i++) {
          delta = Math.max(delta, Math.abs(next[i] - params[i]));
        }
        final double nextCss = sumOfSquares(innovations(e, next, p, q), p);
        final double cssChange = Math.abs(css - nextCss) / Math.max(css, Double.MIN_NORMAL);
        params = next;
        css = nextCss;
        log.trace("Iteration {} of {} changed ARMA coefficients by {} and CSS by {}",
            iterations, config, delta, cssChange);
        converged = delta < config.getTolerance() || cssChange < config.getTolerance();
      }
      if (!converged) {
        throw new FitConvergenceException(
            "ARMA estimation did not converge within " + iterations + " iterations", config);
      }
    }

    final double[] eps = innovations(e, params, p, q);
    requireFinite(eps, "innovations", config);
    return new SeasonalArmaxModel(config,
        Arrays.copyOfRange(regression, 0, m),
        Arrays.copyOfRange(regression, m, m + k),
        Arrays.copyOfRange(params, 0, p),
        Arrays.copyOfRange(params, p, p + q),
        e, eps, p, iterations);
  }

  /**
   * Likelihood-ratio test of the conditional sum of squares against the plain sum of squares of
   * the same residuals.
   */
  private static boolean isSignificant(double[] e, double css, int p, int q) {
    final int count = e.length - p;
    final double whiteNoise = sumOfSquares(e, p);
    if (!(css > 0) || !(whiteNoise > 0)) {
      return true;
    }
    final double statistic = count * Math.log(whiteNoise / css);
    return statistic > NormalDistribution.chiSquaredQuantile(SIGNIFICANCE_LEVEL, p + q);
  }

  private static double sumOfSquares(double[] values, int from) {
    double sum = 0;
    for (int t = from; t < values.length; t++) {
      sum += values[t] * values[t];
    }
    return sum;
  }

  private static double[] hannanRissanen(double[] e, int p, int q, ForecastConfig config) {
    final int n = e.length;
    final int longOrder = Math.min(Math.max(2 * (p + q), MIN_LONG_AR_ORDER), n / 4);
    if (longOrder < 1) {
      throw new ArithmeticException("Too few residuals for a long autoregression");
    }
    final double[] longAr = regressOnLags(e, null, longOrder, 0, longOrder, config.getRidge());
    final double[] approximate = new double[n];
    for (int t = longOrder; t < n; t++) {
      double predicted = 0;
      for (int i = 1; i <= longOrder; i++) {
        predicted += longAr[i - 1] * e[t - i];
      }
      approximate[t] = e[t] - predicted;
    }
    final double[] initial = regressOnLags(e, approximate, p, q,
        Math.max(p, longOrder + q), config.getRidge());
    requireFinite(initial, "initial ARMA estimates", config);
    return initial;
  }

  /**
   * Regresses <code>e(t)</code> on <code>e(t-1..t-p)</code> and <code>eps(t-1..t-q)</code>
   * for <code>t &ge; start</code>.
   */
  private static double[] regressOnLags(double[] e, double[] eps, int p, int q, int start,
                                        double ridge) {
    final int rows = e.length - start;
    if (rows <= p + q) {
      throw new ArithmeticException("Too few observations for " + (p + q) + " ARMA terms");
    }
    final double[][] design = new double[rows][p + q];
    final double[] target = new double[rows];
    for (int r = 0; r < rows; r++) {
      final int t = start + r;
      for (int i = 1; i <= p; i++) {
        design[r][i - 1] = e[t - i];
      }
      for (int j = 1; j <= q; j++) {
        design[r][p + j - 1] = eps[t - j];
      }
      target[r] = e[t];
    }
    return LeastSquares.solve(design, target, ridge);
  }

  /**
   * Conditional innovations, zero before the first <code>p</code> steps.
   */
  static double[] innovations(double[] e, double[] params, int p, int q) {
    final double[] eps = new double[e.length];
    for (int t = p; t < e.length; t++) {
      double predicted = 0;
      for (int i = 1; i <= p; i++) {
        predicted += params[i - 1] * e[t - i];
      }
      for (int j = 1; j <= q && t - j >= 0; j++) {
        predicted += params[p + j - 1] * eps[t - j];
      }
      eps[t] = e[t] - predicted;
    }
    return eps;
  }

  private static void requireFinite(double[] values, String what, ForecastConfig config) {
    for (double value : values) {
      if (!Double.isFinite(value)) {
        throw new FitConvergenceException("Non-finite " + what, config);
      }
    }
  }
}
