package com.rackspace.helios.app.services;

import static com.rackspace.helios.app.SeriesFixtures.hourly;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.rackspace.helios.app.analytics.DctSpcDetection;
import com.rackspace.helios.app.analytics.LocalOutlierFactorDetection;
import com.rackspace.helios.app.analytics.RollingMadDetection;
import com.rackspace.helios.app.config.AnalyticsProperties;
import com.rackspace.helios.app.model.AnomalyFlag;
import com.rackspace.helios.app.model.AnomalyMethod;
import com.rackspace.helios.app.model.SilverSeries;
import java.util.List;
import org.junit.jupiter.api.Test;

class AnomalyDetectorTest {

  final AnalyticsProperties analyticsProperties = new AnalyticsProperties();

  private static SilverSeries withSpike() {
    final double[] values = new double[96];
    for (int i = 0; i < values.length; i++) {
      values[i] = 100 + i % 5;
    }
    values[60] = 900;
    return hourly("NO1", "production", values);
  }

  @Test
  void usesConfiguredMethod() {
    final AnomalyDetector detector = new AnomalyDetector(analyticsProperties,
        List.of(new RollingMadDetection(), new DctSpcDetection()));

    final List<AnomalyFlag> flags = detector.detect(withSpike());

    assertThat(flags).extracting(AnomalyFlag::getMethod).containsOnly("rolling-mad");
    assertThat(flags).extracting(AnomalyFlag::getValue).containsExactly(900.0);
  }

  @Test
  void methodPerRequest() {
    final AnomalyDetector detector = new AnomalyDetector(analyticsProperties,
        List.of(new RollingMadDetection(), new DctSpcDetection()));

    final List<AnomalyFlag> flags = detector.detect(withSpike(),
        new AnalyticsProperties.Anomaly().setMethod(AnomalyMethod.DCT_SPC).setThreshold(3));

    assertThat(flags).extracting(AnomalyFlag::getMethod).containsOnly("dct-spc");
    assertThat(flags).extracting(AnomalyFlag::getValue).contains(900.0);
  }

  @Test
  void localOutlierFactorPerRequest() {
    final AnomalyDetector detector = new AnomalyDetector(analyticsProperties,
        List.of(new RollingMadDetection(), new DctSpcDetection(), new LocalOutlierFactorDetection()));

    final List<AnomalyFlag> flags = detector.detect(withSpike(),
        new AnalyticsProperties.Anomaly().setMethod(AnomalyMethod.LOF));

    assertThat(flags).extracting(AnomalyFlag::getMethod).containsOnly("lof");
    assertThat(flags).extracting(AnomalyFlag::getValue).containsExactly(900.0);
  }

  @Test
  void unavailableMethod() {
    final AnomalyDetector detector = new AnomalyDetector(analyticsProperties,
        List.of(new RollingMadDetection()));

    assertThatThrownBy(() -> detector.detect(withSpike(),
        new AnalyticsProperties.Anomaly().setMethod(AnomalyMethod.DCT_SPC)))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
