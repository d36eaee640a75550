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
 * ExitCode defines the protocol between the {@code cartesian} binary and the shell that runs it.
 *
 * <p>Exit codes 1-9 are reserved for non-fatal errors, like malformed input.
 *
 * <p>Exit codes 10-19 are reserved for fatal errors, like unexpected runtime exceptions.
 *
 * <p>Exit codes for interrupts follow the POSIX convention, i.e. 128 + SIGNAL_CODE.
 */
public enum ExitCode {
  // Success 0

  /** Expansion completed and emitted at least one configuration */
  SUCCESS(0),

  // Non-fatal generic errors 1-9

  /** Input could not be parsed, validated, or one of its filters is malformed */
  PARSE_ERROR(1),
  /** Expansion completed but some branches could not be resolved */
  PARTIAL_RESULT(2),
  /** User supplied incorrect command line options */
  COMMANDLINE_ERROR(3),
  /** Every candidate was filtered out */
  NOTHING_TO_DO(4),

  // Fatal errors 10-19

  /** Generic non-recoverable error */
  FATAL_GENERIC(10),

  // Signal processors 128+

  /** Expansion was interrupted (Ctrl + C) */
  SIGNAL_INTERRUPT(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /** @return integer value of the exit code */
  public int getCode() {
    return code;
  }
}
