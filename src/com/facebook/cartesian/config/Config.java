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
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

/**
 * Structured representation of data read from a stack of {@code .ini} files, where each file can
 * override values defined by the previous ones.
 */
public class Config {

  private final RawConfig rawConfig;

  /** Convenience constructor to create an empty config. */
  public Config() {
    this(RawConfig.of());
  }

  public Config(RawConfig rawConfig) {
    this.rawConfig = rawConfig;
  }

  /**
   * Reads every existing file in {@code files}, in order, then applies {@code overrides} on top.
   * Missing files are skipped.
   */
  public static Config createFromFiles(ImmutableList<Path> files, RawConfig overrides)
      throws IOException {
    RawConfig.Builder builder = RawConfig.builder();
    for (Path file : files) {
      if (Files.isRegularFile(file)) {
        builder.putAll(Inis.read(file));
      }
    }
    builder.putAll(overrides);
    return new Config(builder.build());
  }

  public ImmutableMap<String, String> get(String sectionName) {
    return rawConfig.getSection(sectionName);
  }

  public Optional<String> getValue(String sectionName, String propertyName) {
    String value = get(sectionName).get(propertyName);
    if (value == null) {
      return Optional.empty();
    }
    value = value.trim();
    return value.isEmpty() ? Optional.empty() : Optional.of(value);
  }

  public Optional<Long> getLong(String sectionName, String propertyName) {
    Optional<String> value = getValue(sectionName, propertyName);
    if (!value.isPresent()) {
      return Optional.empty();
    }
    try {
      return Optional.of(Long.valueOf(value.get()));
    } catch (NumberFormatException e) {
      throw new HumanReadableException(
          e,
          "Malformed value for %s in [%s]: %s; expecting an integer.",
          propertyName,
          sectionName,
          value.get());
    }
  }

  public boolean getBooleanValue(String sectionName, String propertyName, boolean defaultValue) {
    Optional<String> answer = getValue(sectionName, propertyName);
    if (!answer.isPresent()) {
      return defaultValue;
    }

    switch (answer.get().toLowerCase(Locale.ROOT)) {
      case "yes":
      case "true":
        return true;

      case "no":
      case "false":
        return false;

      default:
        throw new HumanReadableException(
            "Unknown value for %s in [%s]: %s; should be yes/no true/false!",
            propertyName,
            sectionName,
            answer.get());
    }
  }

  public <T extends Enum<T>> Optional<T> getEnum(String section, String field, Class<T> clazz) {
    Optional<String> value = getValue(section, field);
    if (!value.isPresent()) {
      return Optional.empty();
    }
    try {
      return Optional.of(Enum.valueOf(clazz, value.get().toUpperCase(Locale.ROOT)));
    } catch (IllegalArgumentException e) {
      throw new HumanReadableException(
          "%s:%s must be one of %s (case insensitive) (was \"%s\")",
          section,
          field,
          Joiner.on(", ").join(clazz.getEnumConstants()),
          value.get());
    }
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    } else if (!(obj instanceof Config)) {
      return false;
    }
    return rawConfig.equals(((Config) obj).rawConfig);
  }

  @Override
  public int hashCode() {
    return rawConfig.hashCode();
  }

  @Override
  public String toString() {
    return String.format("Config{%s}", rawConfig);
  }
}
