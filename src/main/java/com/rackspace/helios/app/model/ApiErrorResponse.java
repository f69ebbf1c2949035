package com.rackspace.helios.app.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import lombok.Data;

@Data
@JsonInclude(Include.NON_NULL)
public class ApiErrorResponse {
  int status;
  String error;
  String message;
  String detail;
}
