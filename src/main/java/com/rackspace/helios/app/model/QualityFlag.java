package com.rackspace.helios.app.model;

public enum QualityFlag {
  RAW,
  INTERPOLATED,
  OUTLIER,
  MISSING
}
