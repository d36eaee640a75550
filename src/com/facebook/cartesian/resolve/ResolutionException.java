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

package com.facebook.cartesian.resolve;

import com.facebook.cartesian.util.CartesianException;

/** Raised when a value refers, through {@code ${name}}, to a parameter not yet assigned. */
public class ResolutionException extends CartesianException {

  private final String key;
  private final String reference;

  public ResolutionException(String key, String reference) {
    super("cannot resolve ${%s} in the value of '%s': '%s' is not set", reference, key, reference);
    this.key = key;
    this.reference = reference;
  }

  /** The parameter whose value contains the reference. */
  public String getKey() {
    return key;
  }

  /** The name inside {@code ${...}}. */
  public String getReference() {
    return reference;
  }
}
