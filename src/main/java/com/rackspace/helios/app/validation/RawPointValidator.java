/*
 * Copyright 2022 Rackspace US, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.rackspace.helios.app.validation;

import com.rackspace.helios.app.exceptions.ValidationException;
import com.rackspace.helios.app.model.RawPoint;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

/**
 * Checks the type and range constraints a raw point must meet before it enters the silver
 * layer.
 */
@Component
public class RawPointValidator {

  /**
   * @throws ValidationException describing the first violated constraint
   */
  public void validate(RawPoint point, String entityId, String metric) {
    if (StringUtils.isBlank(point.getEntityId()) || StringUtils.isBlank(point.getMetric())) {
      throw new ValidationException("Entity id and metric are required");
    }
    if (!point.getEntityId().equals(entityId) || !point.getMetric().equals(metric)) {
      throw new ValidationException(String.format("Point of %s/%s does not belong to series %s/%s",
          point.getEntityId(), point.getMetric(), entityId, metric));
    }
    if (point.getTimestamp() == null) {
      throw new ValidationException("Timestamp with explicit offset is required");
    }
    if (point.getValue() == null) {
      throw new ValidationException("Value is required");
    }
    final double value = point.getValue().doubleValue();
    if (Double.isNaN(value) || Double.isInfinite(value)) {
      throw new ValidationException("Value must be finite but was " + value);
    }
  }
}
