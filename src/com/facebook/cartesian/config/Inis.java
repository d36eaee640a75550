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
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import org.ini4j.Ini;
import org.ini4j.Profile;

/** Reads {@code .ini} formatted files into section/key/value maps. */
public class Inis {

  private Inis() {}

  public static ImmutableMap<String, ImmutableMap<String, String>> read(Path path)
      throws IOException {
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return read(reader);
    }
  }

  public static ImmutableMap<String, ImmutableMap<String, String>> read(Reader reader)
      throws IOException {
    Ini ini = new Ini();
    org.ini4j.Config config = ini.getConfig();
    config.setEscape(false);
    config.setEmptySection(true);
    ini.load(reader);

    Map<String, ImmutableMap<String, String>> sections = new LinkedHashMap<>();
    for (Map.Entry<String, Profile.Section> section : ini.entrySet()) {
      ImmutableMap.Builder<String, String> entries = ImmutableMap.builder();
      for (Map.Entry<String, String> entry : section.getValue().entrySet()) {
        entries.put(entry.getKey(), entry.getValue() == null ? "" : entry.getValue());
      }
      sections.put(section.getKey(), entries.build());
    }
    return ImmutableMap.copyOf(sections);
  }
}
