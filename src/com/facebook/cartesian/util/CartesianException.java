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

package com.facebook.cartesian.util;

/**
 * Base class of the checked errors raised while reading, validating and expanding a Cartesian
 * configuration. Every subclass is deterministic: the same input always raises the same error.
 */
public abstract class CartesianException extends Exception
    implements ExceptionWithHumanReadableMessage {

  protected CartesianException(String message) {
    super(message);
  }

  protected CartesianException(String humanReadableFormatString, Object... args) {
    this(String.format(humanReadableFormatString, args));
  }

  @Override
  public String getHumanReadableErrorMessage() {
    return getLocalizedMessage();
  }
}
