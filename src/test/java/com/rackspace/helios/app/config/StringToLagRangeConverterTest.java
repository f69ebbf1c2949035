package com.rackspace.helios.app.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class StringToLagRangeConverterTest {

  final StringToLagRangeConverter converter = new StringToLagRangeConverter();

  @Test
  void range() {
    final LagRange result = converter.convert("-24..24");

    assertThat(result).isEqualTo(LagRange.of(-24, 24));
    assertThat(result.size()).isEqualTo(49);
    assertThat(result.stream().limit(2)).containsExactly(-24, -23);
  }

  @Test
  void singleLag() {
    assertThat(converter.convert("3")).isEqualTo(LagRange.of(3, 3));
  }

  @Test
  void toleratesSpaces() {
    assertThat(converter.convert(" -240 .. 240 ")).isEqualTo(LagRange.of(-240, 240));
  }

  @Test
  void invalid() {
    assertThatThrownBy(() -> converter.convert("a..b"))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> converter.convert("5..-5"))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> converter.convert(""))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
