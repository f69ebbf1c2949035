package com.rackspace.helios.app.model;

public enum Layer {
  BRONZE,
  SILVER,
  GOLD
}
