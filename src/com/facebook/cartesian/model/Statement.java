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

package com.facebook.cartesian.model;

/**
 * One line-level construct of a scope: an {@link Assignment}, a {@link VariantsBlock} or a {@link
 * FilterStatement}. The set is closed; the constructor is package private so that code walking a
 * scope can handle every kind through a {@link Visitor}.
 */
public abstract class Statement {

  Statement() {}

  public abstract <R, E extends Exception> R accept(Visitor<R, E> visitor) throws E;

  /**
   * Handles each kind of statement.
   *
   * @param <R> result of a visit
   * @param <E> checked exception a visit may throw
   */
  public interface Visitor<R, E extends Exception> {
    R visitAssignment(Assignment assignment) throws E;

    R visitVariantsBlock(VariantsBlock block) throws E;

    R visitFilter(FilterStatement filter) throws E;
  }
}
