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

package com.facebook.cartesian.expand;

import com.facebook.cartesian.filter.CompiledFilter;
import com.facebook.cartesian.model.Assignment;
import com.facebook.cartesian.model.Scope;
import com.facebook.cartesian.model.Statement;
import com.facebook.cartesian.model.VariantCase;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * Everything one candidate path has accumulated: the statements still to visit, the cases selected
 * so far and the assignments and filters to replay at the leaf. Instances are immutable; each
 * transition returns a new state sharing structure with the old one, so sibling branches cannot
 * observe each other.
 */
final class ExpansionState {

  /** Position within one statement list. */
  private static final class Frame {
    final ImmutableList<Statement> statements;
    final int index;

    Frame(ImmutableList<Statement> statements, int index) {
      this.statements = statements;
      this.index = index;
    }
  }

  private final Chain<Frame> pending;
  private final Chain<VariantCase> selected;
  private final Chain<Assignment> assignments;
  private final Chain<CompiledFilter> filters;

  private ExpansionState(
      Chain<Frame> pending,
      Chain<VariantCase> selected,
      Chain<Assignment> assignments,
      Chain<CompiledFilter> filters) {
    this.pending = pending;
    this.selected = selected;
    this.assignments = assignments;
    this.filters = filters;
  }

  static ExpansionState start(Scope root) {
    return new ExpansionState(Chain.empty(), Chain.empty(), Chain.empty(), Chain.empty())
        .push(root);
  }

  boolean hasPending() {
    return !pending.isEmpty();
  }

  Statement peek() {
    Frame frame = pending.head();
    return frame.statements.get(frame.index);
  }

  /** @return the state after consuming the statement returned by {@link #peek()}. */
  ExpansionState advance() {
    Frame frame = pending.head();
    Chain<Frame> rest = pending.tail();
    if (frame.index + 1 < frame.statements.size()) {
      rest = rest.prepend(new Frame(frame.statements, frame.index + 1));
    }
    return new ExpansionState(rest, selected, assignments, filters);
  }

  /** Selects {@code variantCase}; its body is visited before anything else still pending. */
  ExpansionState select(VariantCase variantCase) {
    return new ExpansionState(pending, selected.prepend(variantCase), assignments, filters)
        .push(variantCase.getBody());
  }

  ExpansionState withAssignment(Assignment assignment) {
    return new ExpansionState(pending, selected, assignments.prepend(assignment), filters);
  }

  ExpansionState withFilter(CompiledFilter filter) {
    return new ExpansionState(pending, selected, assignments, filters.prepend(filter));
  }

  private ExpansionState push(Scope scope) {
    if (scope.getStatements().isEmpty()) {
      return this;
    }
    return new ExpansionState(
        pending.prepend(new Frame(scope.getStatements(), 0)), selected, assignments, filters);
  }

  /** Every selected shortname, silent ones included, in selection order. */
  ImmutableList<String> getPath() {
    ImmutableList.Builder<String> path = ImmutableList.builderWithExpectedSize(selected.size());
    for (VariantCase variantCase : selected.toInsertionOrder()) {
      path.add(variantCase.getShortname());
    }
    return path.build();
  }

  /** The configuration name: selected shortnames without silent ones, joined by dots. */
  String getName() {
    StringBuilder name = new StringBuilder();
    List<VariantCase> cases = selected.toInsertionOrder();
    for (VariantCase variantCase : cases) {
      if (!variantCase.isSilent()) {
        if (name.length() > 0) {
          name.append('.');
        }
        name.append(variantCase.getShortname());
      }
    }
    return name.toString();
  }

  ImmutableList<Assignment> getAssignments() {
    return assignments.toInsertionOrder();
  }

  ImmutableList<CompiledFilter> getFilters() {
    return filters.toInsertionOrder();
  }

  @Override
  public String toString() {
    return Joiner.on('.').join(getPath());
  }
}
