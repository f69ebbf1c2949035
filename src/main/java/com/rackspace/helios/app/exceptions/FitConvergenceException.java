package com.rackspace.helios.app.exceptions;

import com.rackspace.helios.app.model.ForecastConfig;
import lombok.Getter;

public class FitConvergenceException extends RuntimeException {

  @Getter
  private final ForecastConfig config;

  public FitConvergenceException(String message, ForecastConfig config) {
    super(message + " [" + config + "]");
    this.config = config;
  }

  public FitConvergenceException(String message, ForecastConfig config, Throwable cause) {
    super(message + " [" + config + "]", cause);
    this.config = config;
  }
}
