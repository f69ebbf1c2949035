package com.rackspace.helios.app.model;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TransformResult {
  SilverSeries series;
  List<RejectedPoint> rejected;
}
