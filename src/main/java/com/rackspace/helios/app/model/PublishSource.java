package com.rackspace.helios.app.model;

/**
 * Stored records that can be copied to the serving store.
 */
public enum PublishSource {
  SILVER,
  GOLD,
  ANOMALIES,
  CORRELATIONS,
  FORECASTS
}
