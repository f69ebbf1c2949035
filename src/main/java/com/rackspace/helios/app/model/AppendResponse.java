package com.rackspace.helios.app.model;

import lombok.Data;

@Data
public class AppendResponse {
  long appended;
}
