package com.rackspace.helios.app.web;

import com.rackspace.helios.app.exceptions.CoverageException;
import com.rackspace.helios.app.exceptions.FitConvergenceException;
import com.rackspace.helios.app.exceptions.InsufficientDataException;
import com.rackspace.helios.app.exceptions.MissingPointException;
import com.rackspace.helios.app.exceptions.StoreUnavailableException;
import com.rackspace.helios.app.exceptions.ValidationException;
import com.rackspace.helios.app.model.ApiErrorResponse;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.support.WebExchangeBindException;

@ControllerAdvice
@Slf4j
public class RestExceptionHandler {

  @ExceptionHandler({IllegalArgumentException.class, ValidationException.class})
  public ResponseEntity<ApiErrorResponse> handleBadRequest(RuntimeException e) {
    return respond(HttpStatus.BAD_REQUEST, e.getMessage(), null);
  }

  @ExceptionHandler(WebExchangeBindException.class)
  public ResponseEntity<ApiErrorResponse> handleBindException(WebExchangeBindException e) {
    final String message = e.getFieldErrors().stream()
        .map(fieldError -> fieldError.getField() + " " + fieldError.getDefaultMessage())
        .reduce((first, second) -> first + ", " + second)
        .orElse(e.getReason());
    return respond(HttpStatus.BAD_REQUEST, message, null);
  }

  @ExceptionHandler({CoverageException.class, InsufficientDataException.class,
      MissingPointException.class})
  public ResponseEntity<ApiErrorResponse> handlePreconditionFailure(RuntimeException e) {
    return respond(HttpStatus.UNPROCESSABLE_ENTITY, e.getMessage(), null);
  }

  @ExceptionHandler(FitConvergenceException.class)
  public ResponseEntity<ApiErrorResponse> handleFitConvergence(FitConvergenceException e) {
    log.warn("Forecast fit failed: {}", e.getMessage());
    return respond(HttpStatus.UNPROCESSABLE_ENTITY, e.getMessage(), String.valueOf(e.getConfig()));
  }

  @ExceptionHandler(StoreUnavailableException.class)
  public ResponseEntity<ApiErrorResponse> handleStoreUnavailable(StoreUnavailableException e) {
    log.error("Store unavailable", e);
    return respond(HttpStatus.SERVICE_UNAVAILABLE, e.getMessage(), null);
  }

  @ExceptionHandler(TimeoutException.class)
  public ResponseEntity<ApiErrorResponse> handleTimeout(TimeoutException e) {
    log.warn("Abandoned a stage run: {}", e.getMessage());
    return respond(HttpStatus.SERVICE_UNAVAILABLE, "Stage run did not finish in time", e.getMessage());
  }

  private static ResponseEntity<ApiErrorResponse> respond(HttpStatus status, String message,
                                                          String detail) {
    return ResponseEntity.status(status)
        .body(new ApiErrorResponse()
            .setStatus(status.value())
            .setError(status.getReasonPhrase())
            .setMessage(message)
            .setDetail(detail));
  }
}
