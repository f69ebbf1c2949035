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

import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.boot.context.properties.ConfigurationPropertiesBinding;
import org.springframework.core.convert.converter.Converter;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Converts <code>-24..24</code> style expressions, or a single lag such as <code>3</code>,
 * into a {@link LagRange}.
 */
@Component
@ConfigurationPropertiesBinding
public class StringToLagRangeConverter implements Converter<String, LagRange> {

  private static final Pattern PATTERN =
      Pattern.compile("(?<range>(?<start>[-+]?\\d+)\\.\\.(?<end>[-+]?\\d+))|(?<single>[-+]?\\d+)");

  @Override
  public LagRange convert(String input) {
    if (!StringUtils.hasText(input)) {
      throw new IllegalArgumentException("Lag range expression is empty");
    }

    final Matcher m = PATTERN.matcher(input.replace(" ", ""));
    if (!m.matches()) {
      throw new IllegalArgumentException("Invalid lag range expression: " + input);
    }
    if (m.group("single") != null) {
      final int lag = Integer.parseInt(m.group("single"));
      return LagRange.of(lag, lag);
    }
    return LagRange.of(Integer.parseInt(m.group("start")), Integer.parseInt(m.group("end")));
  }
}
