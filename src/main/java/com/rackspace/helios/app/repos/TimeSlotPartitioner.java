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

package com.rackspace.helios.app.repos;

import com.rackspace.helios.app.aggregate.TemporalNormalizer;
import com.rackspace.helios.app.config.AppProperties;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Maps timestamps to the time slot partitions of the series tables.
 */
@Component
public class TimeSlotPartitioner {

  private final TemporalNormalizer normalizer;
  private final AppProperties appProperties;

  @Autowired
  public TimeSlotPartitioner(AppProperties appProperties) {
    this.appProperties = appProperties;
    // partitions are aligned in UTC so a zone change never moves stored rows
    this.normalizer = new TemporalNormalizer(appProperties.getPartitionWidth());
  }

  public Instant timeSlot(Instant ts) {
    return ts.with(normalizer);
  }

  /**
   * @param start start of range, inclusive
   * @param end end of range, exclusive
   * @return the partition time slots
   */
  public List<Instant> partitionsOverRange(Instant start, Instant end) {
    final List<Instant> partitions = new ArrayList<>();

    Instant current = start.with(normalizer);
    partitions.add(current);

    for (Instant next = current.plus(appProperties.getPartitionWidth());
        // use isBefore since 'end' is exclusive
        next.isBefore(end);
        next = next.plus(appProperties.getPartitionWidth())
    ) {
      partitions.add(next);
    }

    return partitions;
  }
}
