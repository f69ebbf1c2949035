package com.rackspace.helios.app.analytics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

class NormalDistributionTest {

  @Test
  void quantiles() {
    assertThat(NormalDistribution.quantile(0.5)).isCloseTo(0, within(1e-12));
    assertThat(NormalDistribution.quantile(0.975)).isCloseTo(1.959964, within(1e-6));
    assertThat(NormalDistribution.quantile(0.01)).isCloseTo(-2.326348, within(1e-6));
    assertThat(NormalDistribution.quantile(0.999)).isCloseTo(3.090232, within(1e-6));
  }

  @Test
  void symmetric() {
    assertThat(NormalDistribution.quantile(0.2))
        .isCloseTo(-NormalDistribution.quantile(0.8), within(1e-9));
  }

  @Test
  void criticalValue() {
    assertThat(NormalDistribution.criticalValue(0.95)).isCloseTo(1.959964, within(1e-6));
    assertThat(NormalDistribution.criticalValue(0.8)).isCloseTo(1.281552, within(1e-6));
  }

  @Test
  void outsideUnitInterval() {
    assertThatThrownBy(() -> NormalDistribution.quantile(0))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> NormalDistribution.quantile(1))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
