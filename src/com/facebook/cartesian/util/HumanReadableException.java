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

import javax.annotation.Nullable;

/**
 * Exception with an error message that can sensibly be displayed to the user without a stack
 * trace. Used for problems in user supplied configuration and command line input.
 */
public class HumanReadableException extends RuntimeException
    implements ExceptionWithHumanReadableMessage {

  public HumanReadableException(String humanReadableErrorMessage) {
    super(humanReadableErrorMessage);
  }

  public HumanReadableException(String humanReadableFormatString, Object... args) {
    super(String.format(humanReadableFormatString, args));
  }

  public HumanReadableException(
      @Nullable Throwable cause, String humanReadableFormatString, Object... args) {
    super(String.format(humanReadableFormatString, args), cause);
  }

  @Override
  public String getHumanReadableErrorMessage() {
    return getMessage();
  }
}
