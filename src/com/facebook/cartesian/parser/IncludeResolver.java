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

/** Loads the text named by an {@code include} line. */
@FunctionalInterface
public interface IncludeResolver {

  /**
   * @param includingSource name of the source containing the {@code include} line
   * @param path the path as written after {@code include}
   */
  SourceText resolve(String includingSource, String path) throws IOException;

  /** Resolver for text that has no file behind it; every include fails. */
  static IncludeResolver unsupported() {
    return (includingSource, path) -> {
      throw new IOException(
          String.format("%s is not a file, includes can only be used from files", includingSource));
    };
  }
}
