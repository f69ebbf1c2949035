package com.rackspace.helios.app.analytics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

class LeastSquaresTest {

  @Test
  void exactLine() {
    final double[][] design = {{1, 0}, {1, 1}, {1, 2}, {1, 3}};
    final double[] target = {2, 5, 8, 11};

    assertThat(LeastSquares.solve(design, target, 0))
        .containsExactly(new double[]{2, 3}, within(1e-9));
  }

  @Test
  void overdeterminedMinimizesResiduals() {
    final double[][] design = {{1}, {1}, {1}};
    final double[] target = {1, 2, 6};

    assertThat(LeastSquares.solve(design, target, 0)[0]).isCloseTo(3, within(1e-12));
  }

  @Test
  void ridgeShrinksTowardsZero() {
    final double[][] design = {{1}, {1}};
    final double[] target = {4, 4};

    // penalty is ridge times the mean diagonal of the normal matrix
    assertThat(LeastSquares.solve(design, target, 1)[0]).isCloseTo(8.0 / 4, within(1e-12));
  }

  @Test
  void collinearColumnsAreSingular() {
    final double[][] design = {{1, 2}, {2, 4}, {3, 6}};
    final double[] target = {1, 2, 3};

    assertThatThrownBy(() -> LeastSquares.solve(design, target, 0))
        .isInstanceOf(ArithmeticException.class);
  }

  @Test
  void mismatchedRows() {
    assertThatThrownBy(() -> LeastSquares.solve(new double[][]{{1}}, new double[]{1, 2}, 0))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
