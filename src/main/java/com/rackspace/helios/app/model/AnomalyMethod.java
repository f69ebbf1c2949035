package com.rackspace.helios.app.model;

import lombok.Getter;

public enum AnomalyMethod {
  ROLLING_MAD("rolling-mad"),
  DCT_SPC("dct-spc"),
  LOF("lof");

  @Getter
  private final String label;

  AnomalyMethod(String label) {
    this.label = label;
  }
}
