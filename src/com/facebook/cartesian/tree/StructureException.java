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

package com.facebook.cartesian.tree;

import com.facebook.cartesian.util.CartesianException;

/** Raised for a parsed tree that is not a valid set of axes, such as duplicate case names. */
public class StructureException extends CartesianException {

  public StructureException(String humanReadableFormatString, Object... args) {
    super(humanReadableFormatString, args);
  }
}
