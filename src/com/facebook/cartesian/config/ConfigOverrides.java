/*
 * Copyright (c) Facebook, Inc. and its affiliates.
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

package com.facebook.cartesian.config;

import com.facebook.cartesian.util.HumanReadableException;

/** Parses {@code section.key=value} strings given with {@code --config}. */
public class ConfigOverrides {

  private ConfigOverrides() {}

  public static RawConfig parse(Iterable<String> overrides) {
    RawConfig.Builder builder = RawConfig.builder();
    for (String override : overrides) {
      int equals = override.indexOf('=');
      int dot = override.indexOf('.');
      if (equals < 0 || dot <= 0 || dot > equals) {
        throw new HumanReadableException(
            "Invalid config override \"%s\", expected section.key=value", override);
      }
      String section = override.substring(0, dot).trim();
      String key = override.substring(dot + 1, equals).trim();
      if (key.isEmpty()) {
        throw new HumanReadableException("Config override \"%s\" has an empty key", override);
      }
      builder.put(section, key, override.substring(equals + 1).trim());
    }
    return builder.build();
  }
}
