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

import com.facebook.cartesian.util.immutables.CartesianStyleTuple;
import org.immutables.value.Value;

/** Full contents of one configuration source, named for error messages and include lookups. */
@Value.Immutable
@CartesianStyleTuple
abstract class AbstractSourceText {

  public abstract String getName();

  public abstract String getText();
}
