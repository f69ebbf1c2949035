package com.rackspace.helios.app.analytics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

class DiscreteCosineTransformTest {

  @Test
  void inverseRestoresSignal() {
    final double[] x = {3, -1, 4, 1, -5, 9, 2, 6};

    final double[] restored = DiscreteCosineTransform.inverse(DiscreteCosineTransform.forward(x));

    for (int i = 0; i < x.length; i++) {
      assertThat(restored[i]).isCloseTo(x[i], within(1e-9));
    }
  }

  @Test
  void preservesEnergy() {
    final double[] x = {3, -1, 4, 1, -5, 9, 2, 6};

    double signal = 0;
    double spectrum = 0;
    for (double coefficient : DiscreteCosineTransform.forward(x)) {
      spectrum += coefficient * coefficient;
    }
    for (double value : x) {
      signal += value * value;
    }
    assertThat(spectrum).isCloseTo(signal, within(1e-9));
  }

  @Test
  void constantSignalHasOnlyDcComponent() {
    final double[] coefficients = DiscreteCosineTransform.forward(new double[]{2, 2, 2, 2});

    assertThat(coefficients[0]).isCloseTo(4, within(1e-12));
    for (int k = 1; k < coefficients.length; k++) {
      assertThat(coefficients[k]).isCloseTo(0, within(1e-12));
    }
  }

  @Test
  void lowPassKeepingOnlyDcGivesMean() {
    final double[] smoothed = DiscreteCosineTransform.lowPass(new double[]{1, 2, 3, 6}, 1);

    assertThat(smoothed).containsExactly(new double[]{3, 3, 3, 3}, within(1e-12));
  }
}
