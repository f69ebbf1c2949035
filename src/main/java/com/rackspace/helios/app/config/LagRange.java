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

package com.rackspace.helios.app.config;

import java.util.Iterator;
import java.util.stream.IntStream;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * An inclusive range of lags that can be bound to properties with
 * {@link StringToLagRangeConverter}. Iterates from the lowest to the highest lag.
 */
@Getter
@EqualsAndHashCode
public class LagRange implements Iterable<Integer> {

  final int from;
  final int to;

  LagRange(int from, int to) {
    if (from > to) {
      throw new IllegalArgumentException("Lag range start " + from + " is after its end " + to);
    }
    this.from = from;
    this.to = to;
  }

  public static LagRange of(int from, int to) {
    return new LagRange(from, to);
  }

  public int size() {
    return to - from + 1;
  }

  @Override
  public Iterator<Integer> iterator() {
    return stream().iterator();
  }

  public IntStream stream() {
    return IntStream.rangeClosed(from, to);
  }

  @Override
  public String toString() {
    return from + ".." + to;
  }
}
