package com.rackspace.helios.app.model;

import lombok.Data;

@Data
public class PublishResponse {
  String table;
  long published;
}
