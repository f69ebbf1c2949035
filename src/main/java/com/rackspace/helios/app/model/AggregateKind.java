package com.rackspace.helios.app.model;

public enum AggregateKind {
  SUM,
  MEAN,
  MIN,
  MAX,
  COUNT
}
