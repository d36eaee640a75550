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

import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** Hierarchical configuration of section/key/value triples. */
public class RawConfig {
  private final ImmutableMap<String, ImmutableMap<String, String>> values;

  private RawConfig(ImmutableMap<String, ImmutableMap<String, String>> values) {
    this.values = values;
  }

  public static RawConfig of() {
    return new RawConfig(ImmutableMap.of());
  }

  public static RawConfig of(Map<String, ? extends Map<String, String>> values) {
    return builder().putAll(values).build();
  }

  public ImmutableMap<String, ImmutableMap<String, String>> getValues() {
    return values;
  }

  /** @return the entries of a section, or an empty map if the section is not defined. */
  public ImmutableMap<String, String> getSection(String section) {
    ImmutableMap<String, String> entries = values.get(section);
    return entries == null ? ImmutableMap.of() : entries;
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof RawConfig)) {
      return false;
    }
    return values.equals(((RawConfig) other).values);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(values);
  }

  @Override
  public String toString() {
    return String.format("RawConfig{%s}", values);
  }

  /** Accumulates sections; later puts override earlier ones key by key. */
  public static class Builder {
    private final Map<String, Map<String, String>> values = new LinkedHashMap<>();

    public Builder putAll(Map<String, ? extends Map<String, String>> config) {
      for (Map.Entry<String, ? extends Map<String, String>> entry : config.entrySet()) {
        requireSection(entry.getKey()).putAll(entry.getValue());
      }
      return this;
    }

    public Builder putAll(RawConfig config) {
      return putAll(config.getValues());
    }

    public Builder put(String section, String key, String value) {
      requireSection(section).put(key, value);
      return this;
    }

    private Map<String, String> requireSection(String section) {
      return values.computeIfAbsent(section, k -> new LinkedHashMap<>());
    }

    public RawConfig build() {
      ImmutableMap.Builder<String, ImmutableMap<String, String>> builder = ImmutableMap.builder();
      for (Map.Entry<String, Map<String, String>> entry : values.entrySet()) {
        builder.put(entry.getKey(), ImmutableMap.copyOf(entry.getValue()));
      }
      return new RawConfig(builder.build());
    }
  }
}
