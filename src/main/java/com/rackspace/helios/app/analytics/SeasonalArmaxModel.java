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

import com.rackspace.helios.app.model.ForecastConfig;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Value;

/**
 * A fitted model <code>y(t) = s(phase(t)) + &Sigma; &beta;j xj(t) + e(t)</code> where
 * <code>e</code> follows an ARMA(p, q) process. Instances are immutable and created by
 * {@link SeasonalArmaxFitter}.
 */
@Getter
public class SeasonalArmaxModel {

  @Value
  public static class Projection {
    double point;
    double lower;
    double upper;
  }

  private final ForecastConfig config;
  private final double[] seasonalProfile;
  private final double[] exogenousCoefficients;
  private final double[] arCoefficients;
  private final double[] maCoefficients;
  private final double sigma;
  private final double residualMean;
  private final double residualStdDev;
  private final int residualCount;
  private final int iterations;

  @Getter(lombok.AccessLevel.NONE)
  private final double[] regressionResiduals;
  @Getter(lombok.AccessLevel.NONE)
  private final double[] innovations;

  SeasonalArmaxModel(ForecastConfig config, double[] seasonalProfile,
                     double[] exogenousCoefficients, double[] arCoefficients,
                     double[] maCoefficients, double[] regressionResiduals, double[] innovations,
                     int innovationsStart, int iterations) {
    this.config = config;
    this.seasonalProfile = seasonalProfile;
    this.exogenousCoefficients = exogenousCoefficients;
    this.arCoefficients = arCoefficients;
    this.maCoefficients = maCoefficients;
    this.regressionResiduals = regressionResiduals;
    this.innovations = innovations;
    this.iterations = iterations;

    final int count = innovations.length - innovationsStart;
    double sum = 0;
    double sumSquares = 0;
    for (int t = innovationsStart; t < innovations.length; t++) {
      sum += innovations[t];
      sumSquares += innovations[t] * innovations[t];
    }
    this.residualCount = count;
    this.residualMean = count == 0 ? 0 : sum / count;
    this.residualStdDev = count == 0 ? 0 :
        Math.sqrt(Math.max(sumSquares / count - residualMean * residualMean, 0));
    final int degreesOfFreedom = Math.max(count - arCoefficients.length - maCoefficients.length, 1);
    this.sigma = Math.sqrt(sumSquares / degreesOfFreedom);
  }

  /**
   * Projects the model over the horizon steps that follow the training data.
   *
   * @param phases seasonal phase of each horizon step
   * @param exogenous <code>exogenous[j][h]</code> is regressor <code>j</code> at step <code>h</code>
   * @return one projection per step with bounds at the configured confidence level
   */
  public List<Projection> project(int[] phases, double[][] exogenous) {
    final int horizon = phases.length;
    final int n = regressionResiduals.length;
    final int p = arCoefficients.length;
    final int q = maCoefficients.length;

    final double[] e = new double[n + horizon];
    System.arraycopy(regressionResiduals, 0, e, 0, n);
    final double[] eps = new double[n + horizon];
    System.arraycopy(innovations, 0, eps, 0, n);

    final double[] psiSquaresCumulative = psiSquaresCumulative(horizon);
    final double z = NormalDistribution.criticalValue(config.getConfidenceLevel());

    final List<Projection> projections = new ArrayList<>(horizon);
    for (int h = 0; h < horizon; h++) {
      final int t = n + h;
      double arma = 0;
      for (int i = 1; i <= p; i++) {
        arma += arCoefficients[i - 1] * e[t - i];
      }
      for (int j = 1; j <= q; j++) {
        arma += maCoefficients[j - 1] * eps[t - j];
      }
      e[t] = arma;

      double point = seasonalProfile[phases[h]] + arma;
      for (int j = 0; j < exogenousCoefficients.length; j++) {
        point += exogenousCoefficients[j] * exogenous[j][h];
      }
      final double halfWidth = z * sigma * Math.sqrt(psiSquaresCumulative[h]);
      projections.add(new Projection(point, point - halfWidth, point + halfWidth));
    }
    return projections;
  }

  /**
   * @return at index h the sum of squared psi-weights 0..h of the MA(&infin;) representation
   */
  double[] psiSquaresCumulative(int horizon) {
    final int p = arCoefficients.length;
    final int q = maCoefficients.length;
    final double[] psi = new double[horizon];
    final double[] cumulative = new double[horizon];
    for (int j = 0; j < horizon; j++) {
      if (j == 0) {
        psi[j] = 1;
      } else {
        double value = j <= q ? maCoefficients[j - 1] : 0;
        for (int i = 1; i <= Math.min(j, p); i++) {
          value += arCoefficients[i - 1] * psi[j - i];
        }
        psi[j] = value;
      }
      cumulative[j] = (j == 0 ? 0 : cumulative[j - 1]) + psi[j] * psi[j];
    }
    return cumulative;
  }
}
