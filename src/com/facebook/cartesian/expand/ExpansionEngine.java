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

import com.facebook.cartesian.config.ExpansionConfig.UnresolvedReferencePolicy;
import com.facebook.cartesian.filter.CompiledFilter;
import com.facebook.cartesian.log.Logger;
import com.facebook.cartesian.model.Assignment;
import com.facebook.cartesian.model.Configuration;
import com.facebook.cartesian.model.FilterStatement;
import com.facebook.cartesian.model.Statement;
import com.facebook.cartesian.model.VariantCase;
import com.facebook.cartesian.model.VariantsBlock;
import com.facebook.cartesian.resolve.ParameterResolver;
import com.facebook.cartesian.resolve.ResolutionException;
import com.facebook.cartesian.tree.VariantTree;
import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.function.Consumer;
import javax.annotation.Nullable;

/**
 * Expands a {@link VariantTree} into the {@link Configuration}s of every path that survives its
 * filters.
 *
 * <p>The traversal is depth first. Statements are visited in source order; reaching a {@code
 * variants:} block forks one branch per case, in declaration order, and each branch visits the
 * case body before the statements following the block. Sibling axes therefore multiply in odometer
 * order with the first-declared axis varying slowest, and a configuration's name lists its
 * shortnames in axis declaration order. At the end of a branch every filter collected along it is
 * checked, and only then are its assignments replayed.
 *
 * <p>Each branch carries its own {@link ExpansionState}, so no state is shared between branches.
 */
public class ExpansionEngine {
  private static final Logger LOG = Logger.get(ExpansionEngine.class);

  private final VariantTree tree;
  private final ParameterResolver resolver;
  private final UnresolvedReferencePolicy unresolvedReferencePolicy;

  public ExpansionEngine(VariantTree tree) {
    this(tree, new ParameterResolver(), UnresolvedReferencePolicy.SKIP);
  }

  public ExpansionEngine(
      VariantTree tree,
      ParameterResolver resolver,
      UnresolvedReferencePolicy unresolvedReferencePolicy) {
    this.tree = tree;
    this.resolver = resolver;
    this.unresolvedReferencePolicy = unresolvedReferencePolicy;
  }

  /** Expands the whole tree on the calling thread. */
  public ExpansionResult expand() throws InterruptedException, ResolutionException {
    List<Configuration> configurations = new ArrayList<>();
    Run run = new Run(configurations::add);
    start(run, null);
    return finish(ImmutableList.of(run), ImmutableList.copyOf(configurations));
  }

  /**
   * Expands the whole tree on the calling thread, handing each configuration to {@code consumer}
   * as soon as it is resolved. With {@link UnresolvedReferencePolicy#FAIL} the consumer may
   * already have seen some configurations when the {@link ResolutionException} is thrown.
   *
   * @return the paths that could not be resolved
   */
  public ImmutableList<ResolutionFailure> expand(Consumer<Configuration> consumer)
      throws InterruptedException, ResolutionException {
    Run run = new Run(consumer);
    start(run, null);
    return finish(ImmutableList.of(run), ImmutableList.of()).getFailures();
  }

  /**
   * Expands the tree, running the branches of its first axis as separate tasks on {@code
   * executor}. The result is identical to {@link #expand()}.
   */
  public ExpansionResult expand(ListeningExecutorService executor)
      throws InterruptedException, ResolutionException {
    List<Configuration> rootConfigurations = new ArrayList<>();
    Run rootRun = new Run(rootConfigurations::add);
    List<ExpansionState> branches = new ArrayList<>();
    start(rootRun, branches);
    if (branches.isEmpty()) {
      // Nothing to partition: the walk above already produced the only leaf, if any.
      return finish(ImmutableList.of(rootRun), ImmutableList.copyOf(rootConfigurations));
    }
    LOG.debug("Expanding %d branches of the first axis in parallel", branches.size());

    List<ListenableFuture<BranchResult>> futures = new ArrayList<>(branches.size());
    for (ExpansionState branch : branches) {
      futures.add(
          executor.submit(
              () -> {
                List<Configuration> configurations = new ArrayList<>();
                Run run = new Run(configurations::add);
                walk(branch, run, null);
                return new BranchResult(run, configurations);
              }));
    }

    ListenableFuture<List<BranchResult>> all = Futures.allAsList(futures);
    List<BranchResult> results;
    try {
      results = all.get();
    } catch (InterruptedException e) {
      all.cancel(true);
      throw e;
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      Throwables.throwIfInstanceOf(cause, InterruptedException.class);
      Throwables.throwIfUnchecked(cause);
      throw new IllegalStateException("Expansion branch failed", cause);
    }

    ImmutableList.Builder<Run> runs = ImmutableList.builder();
    ImmutableList.Builder<Configuration> configurations = ImmutableList.builder();
    runs.add(rootRun);
    for (BranchResult result : results) {
      runs.add(result.run);
      configurations.addAll(result.configurations);
    }
    return finish(runs.build(), configurations.build());
  }

  private void start(Run run, @Nullable List<ExpansionState> branchSink)
      throws InterruptedException {
    ExpansionState initial = ExpansionState.start(tree.getRoot());
    if (isPruned(initial)) {
      LOG.verbose("Global filters reject every path");
      run.pruned++;
      return;
    }
    walk(initial, run, branchSink);
  }

  private ExpansionResult finish(
      ImmutableList<Run> runs, ImmutableList<Configuration> configurations)
      throws ResolutionException {
    ExpansionResult.Builder builder = ExpansionResult.builder().setConfigurations(configurations);
    long pruned = 0;
    long emitted = 0;
    for (Run run : runs) {
      builder.addAllFailures(run.failures);
      pruned += run.pruned;
      emitted += run.emitted;
    }
    ExpansionResult result = builder.setPrunedCount(pruned).build();
    LOG.debug(
        "Expansion emitted %d configurations, pruned %d candidates, failed to resolve %d",
        emitted,
        pruned,
        result.getFailures().size());
    if (unresolvedReferencePolicy == UnresolvedReferencePolicy.FAIL && result.hasFailures()) {
      throw result.getFailures().get(0).getCause();
    }
    return result;
  }

  /**
   * Visits the pending statements of {@code start} until the path forks, is pruned or is
   * complete, in which case it is emitted.
   *
   * @param branchSink when not null, the branches of the first {@code variants:} block reached are
   *     added to it instead of being walked
   */
  private void walk(ExpansionState start, Run run, @Nullable List<ExpansionState> branchSink)
      throws InterruptedException {
    ExpansionState state = start;
    while (state.hasPending()) {
      if (run.aborted) {
        return;
      }
      Statement statement = state.peek();
      state = state.advance();
      Step step = new Step(state);
      statement.accept(step);
      if (step.fork != null) {
        fork(state, step.fork, run, branchSink);
        return;
      }
      state = step.state;
      if (step.filter != null
          && step.filter.rejectsAllExtensionsOf(state.getPath(), tree.getAllShortnames())) {
        LOG.verbose("%s: pruned by '%s'", state, step.filter);
        run.pruned++;
        return;
      }
    }
    emit(state, run);
  }

  private void fork(
      ExpansionState state,
      VariantsBlock block,
      Run run,
      @Nullable List<ExpansionState> branchSink)
      throws InterruptedException {
    for (VariantCase variantCase : block.getCases()) {
      if (run.aborted) {
        return;
      }
      ExpansionState branch = state.select(variantCase);
      if (isPruned(branch)) {
        LOG.verbose("%s: pruned", branch);
        run.pruned++;
        continue;
      }
      if (branchSink != null) {
        branchSink.add(branch);
      } else {
        walk(branch, run, null);
      }
    }
  }

  /** Whether a filter collected so far already rejects every completion of the path. */
  private boolean isPruned(ExpansionState state) {
    ImmutableList<String> path = state.getPath();
    for (CompiledFilter filter : state.getFilters()) {
      if (filter.rejectsAllExtensionsOf(path, tree.getAllShortnames())) {
        return true;
      }
    }
    for (CompiledFilter filter : tree.getGlobalFilters()) {
      if (filter.rejectsAllExtensionsOf(path, tree.getAllShortnames())) {
        return true;
      }
    }
    return false;
  }

  private void emit(ExpansionState state, Run run) throws InterruptedException {
    if (Thread.interrupted()) {
      throw new InterruptedException("Expansion cancelled at " + state);
    }
    ImmutableList<String> path = state.getPath();
    for (CompiledFilter filter : state.getFilters()) {
      if (!filter.passes(path)) {
        run.pruned++;
        return;
      }
    }
    for (CompiledFilter filter : tree.getGlobalFilters()) {
      if (!filter.passes(path)) {
        run.pruned++;
        return;
      }
    }

    String name = state.getName();
    ImmutableMap<String, String> params;
    try {
      params = resolver.resolve(state.getAssignments());
    } catch (ResolutionException e) {
      LOG.warn("%s: %s", name, e.getHumanReadableErrorMessage());
      run.failures.add(ResolutionFailure.of(name, e));
      if (unresolvedReferencePolicy == UnresolvedReferencePolicy.FAIL) {
        run.aborted = true;
      }
      return;
    }
    run.emitted++;
    run.consumer.accept(Configuration.of(name, params));
  }

  /** Applies one statement to a state. */
  private class Step implements Statement.Visitor<Void, RuntimeException> {
    private ExpansionState state;
    @Nullable private CompiledFilter filter;
    @Nullable private VariantsBlock fork;

    Step(ExpansionState state) {
      this.state = state;
    }

    @Override
    public Void visitAssignment(Assignment assignment) {
      state = state.withAssignment(assignment);
      return null;
    }

    @Override
    public Void visitVariantsBlock(VariantsBlock block) {
      fork = block;
      return null;
    }

    @Override
    public Void visitFilter(FilterStatement statement) {
      filter = tree.getCompiledFilter(statement);
      state = state.withFilter(filter);
      return null;
    }
  }

  /** Mutable bookkeeping of one sequential walk. Confined to a single thread. */
  private static class Run {
    private final Consumer<Configuration> consumer;
    private final List<ResolutionFailure> failures = new ArrayList<>();
    private long pruned;
    private long emitted;
    private boolean aborted;

    Run(Consumer<Configuration> consumer) {
      this.consumer = consumer;
    }
  }

  private static class BranchResult {
    private final Run run;
    private final List<Configuration> configurations;

    BranchResult(Run run, List<Configuration> configurations) {
      this.run = run;
      this.configurations = configurations;
    }
  }
}
