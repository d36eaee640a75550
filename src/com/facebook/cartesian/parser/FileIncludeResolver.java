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

package com.facebook.cartesian.parser;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/** Resolves include paths relative to the directory of the including file. */
public class FileIncludeResolver implements IncludeResolver {

  @Override
  public SourceText resolve(String includingSource, String path) throws IOException {
    Path parent = Paths.get(includingSource).getParent();
    Path target = (parent == null ? Paths.get(path) : parent.resolve(path)).normalize();
    return read(target);
  }

  public static SourceText read(Path path) throws IOException {
    return SourceText.of(
        path.toString(), new String(Files.readAllBytes(path), StandardCharsets.UTF_8));
  }
}
