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

import com.rackspace.helios.app.model.AnomalyMethod;
import com.rackspace.helios.app.model.ForecastConfig;
import java.time.Duration;
import javax.validation.Valid;
import javax.validation.constraints.DecimalMax;
import javax.validation.constraints.DecimalMin;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties("helios.analytics")
@Component
@Data
@Validated
public class AnalyticsProperties {

  @Valid
  @NotNull
  Anomaly anomaly = new Anomaly();

  @Valid
  @NotNull
  Correlation correlation = new Correlation();

  @Valid
  @NotNull
  Forecast forecast = new Forecast();

  @Data
  public static class Anomaly {
    @NotNull
    AnomalyMethod method = AnomalyMethod.ROLLING_MAD;

    /**
     * Number of preceding points that form the local reference of each point. The first
     * <code>windowSize</code> points of a series are never flagged.
     */
    @Min(3)
    int windowSize = 24;

    /**
     * Deviation, in units of the local scale, beyond which a point is flagged.
     */
    @DecimalMin("0.0")
    double threshold = 3.5;

    /**
     * Lower bound for the local scale so flat windows do not divide by zero.
     */
    double minScale = 1e-9;

    /**
     * Fraction of DCT coefficients kept by the low-pass filter of {@link AnomalyMethod#DCT_SPC}.
     */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    double dctCutoff = 0.05;

    /**
     * Expected proportion of outliers for {@link AnomalyMethod#LOF}.
     */
    @DecimalMin(value = "0.0", inclusive = false)
    @DecimalMax("0.5")
    double contamination = 0.01;
  }

  @Data
  public static class Correlation {
    /**
     * Number of intervals in each sliding window.
     */
    @Min(2)
    int windowSize = 48;

    /**
     * Intervals between consecutive window positions. Defaults to the window size.
     */
    Integer step;

    /**
     * Inclusive range of lags, for example <code>-24..24</code>.
     */
    @NotNull
    LagRange lagRange = LagRange.of(-24, 24);

    /**
     * Fewer valid pairs than this omits the (window, lag) result.
     */
    @Min(3)
    int minPoints = 3;

    public int effectiveStep() {
      return step == null ? windowSize : step;
    }
  }

  @Data
  public static class Forecast {
    @NotNull
    Duration trainingWindow = Duration.ofDays(28);

    @NotNull
    Duration horizon = Duration.ofHours(168);

    @Valid
    @NotNull
    ForecastConfig model = new ForecastConfig();
  }
}
