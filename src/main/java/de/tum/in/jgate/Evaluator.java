/*
 * This file is part of JGate.
 * Copyright (c) 2026 The JGate Authors.
 *
 * JGate is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, version 3.
 *
 * JGate is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU
 * General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with JGate. If not, see <http://www.gnu.org/licenses/>.
 */
package de.tum.in.jgate;

import static com.google.common.util.concurrent.MoreExecutors.directExecutor;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.Sets;
import com.google.common.util.concurrent.FutureCallback;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Decides a compiled policy by resolving its terminals through {@link Requirement requirements}.
 *
 * <p>Each call to {@link #evaluate(Object)} issues exactly one check per distinct terminal, no
 * matter how often the terminal occurs in the policy source, and runs all checks concurrently. Once
 * every check succeeded, the policy diagram is evaluated under the obtained assignment. If any check
 * fails, the evaluation fails with a {@link RequirementFailedException} for that terminal and, by
 * default, stops waiting for the checks still pending.</p>
 *
 * <p>An evaluation never cancels the futures returned by {@link Requirement#check(Object)}: a
 * requirement may hand the same future to several evaluations, and the failure or cancellation of
 * one evaluation must not affect the others.</p>
 *
 * <p>The diagram and requirements are fixed at construction; evaluations only share them for
 * reading, so an evaluator may run any number of evaluations concurrently.</p>
 *
 * @param <Q> The type of the querier passed to the requirements.
 */
public final class Evaluator<Q> {
    private static final Logger logger = Logger.getLogger(Evaluator.class.getName());

    private final DecisionDiagram diagram;
    private final int root;
    private final ImmutableSortedMap<Integer, Requirement<? super Q>> requirements;
    private final EvaluatorConfiguration configuration;

    private Evaluator(
            DecisionDiagram diagram,
            int root,
            ImmutableSortedMap<Integer, Requirement<? super Q>> requirements,
            EvaluatorConfiguration configuration) {
        this.diagram = diagram;
        this.root = root;
        this.requirements = requirements;
        this.configuration = configuration;
    }

    public static <Q> Evaluator<Q> create(
            CompiledPolicy policy, Map<Integer, ? extends Requirement<? super Q>> requirements)
            throws TerminalMismatchException {
        return create(policy, requirements, ImmutableEvaluatorConfiguration.builder().build());
    }

    public static <Q> Evaluator<Q> create(
            CompiledPolicy policy,
            Map<Integer, ? extends Requirement<? super Q>> requirements,
            EvaluatorConfiguration configuration)
            throws TerminalMismatchException {
        return create(policy.diagram(), policy.root(), requirements, configuration);
    }

    /**
     * Creates an evaluator for the function represented by {@code root} in {@code diagram}.
     *
     * @throws TerminalMismatchException if the keys of {@code requirements} differ from the variables
     *     of the diagram.
     */
    public static <Q> Evaluator<Q> create(
            DecisionDiagram diagram,
            int root,
            Map<Integer, ? extends Requirement<? super Q>> requirements,
            EvaluatorConfiguration configuration)
            throws TerminalMismatchException {
        Preconditions.checkArgument(diagram.isNodeValidOrLeaf(root), "Invalid root node %s", root);
        Set<Integer> variables = diagram.variables();
        if (!variables.equals(requirements.keySet())) {
            throw new TerminalMismatchException(
                    Sets.difference(variables, requirements.keySet()),
                    Sets.difference(requirements.keySet(), variables));
        }
        ImmutableSortedMap<Integer, Requirement<? super Q>> sortedRequirements = ImmutableSortedMap.copyOf(requirements);
        return new Evaluator<>(diagram, root, sortedRequirements, configuration);
    }

    /**
     * Creates an evaluator binding the {@code i}-th requirement to terminal {@code i}. The policy
     * terminals thus need to be numbered densely from {@literal 0}.
     */
    public static <Q> Evaluator<Q> createPositional(
            CompiledPolicy policy, List<? extends Requirement<? super Q>> requirements)
            throws TerminalMismatchException {
        Map<Integer, Requirement<? super Q>> requirementMap = new HashMap<>();
        for (int i = 0; i < requirements.size(); i++) {
            requirementMap.put(i, requirements.get(i));
        }
        return create(policy, requirementMap);
    }

    public Set<Integer> terminals() {
        return requirements.keySet();
    }

    /**
     * Resolves all terminals against the given {@code querier} and decides the policy.
     *
     * <p>The returned future completes with the decision, or fails with a
     * {@link RequirementFailedException} if a check failed, timed out, or completed with
     * {@code null}. Cancelling the returned future releases the pending checks of this evaluation,
     * including their timeouts.</p>
     */
    public ListenableFuture<Boolean> evaluate(Q querier) {
        logger.log(Level.FINER, "Evaluating {0} requirements", requirements.size());

        List<Integer> terminalIds = new ArrayList<>(requirements.size());
        List<ListenableFuture<Boolean>> checks = new ArrayList<>(requirements.size());
        requirements.forEach((terminalId, requirement) -> {
            terminalIds.add(terminalId);
            checks.add(resolve(terminalId, requirement, querier));
        });

        ListenableFuture<List<Boolean>> outcomes = Futures.allAsList(checks);
        if (configuration.cancelPendingOnFailure()) {
            Futures.addCallback(outcomes, new CancelOnFailure(checks), directExecutor());
        }
        return Futures.transform(outcomes, values -> decide(terminalIds, values), directExecutor());
    }

    private boolean decide(List<Integer> terminalIds, List<Boolean> values) {
        assert terminalIds.size() == values.size();
        ImmutableMap.Builder<Integer, Boolean> assignment = ImmutableMap.builderWithExpectedSize(values.size());
        for (int i = 0; i < values.size(); i++) {
            assignment.put(terminalIds.get(i), values.get(i));
        }
        boolean decision = diagram.evaluate(root, assignment.build());
        logger.log(Level.FINER, "Policy decided {0}", decision);
        return decision;
    }

    private ListenableFuture<Boolean> resolve(int terminalId, Requirement<? super Q> requirement, Q querier) {
        ListenableFuture<Boolean> check;
        try {
            check = requirement.check(querier);
        } catch (RuntimeException e) {
            check = Futures.immediateFailedFuture(e);
        }
        if (check == null) {
            check = Futures.immediateFailedFuture(new NullPointerException("Requirement returned no future"));
        }
        // Cancelling the evaluation-local chain below must not reach the requirement's future
        check = Futures.nonCancellationPropagating(check);

        if (configuration.timeout().isPresent()) {
            Duration timeout = configuration.timeout().get();
            check = Futures.withTimeout(
                    check,
                    timeout.toNanos(),
                    TimeUnit.NANOSECONDS,
                    configuration.scheduler().orElseThrow());
        }

        ListenableFuture<Boolean> nonNull = Futures.transform(
                check,
                value -> {
                    if (value == null) {
                        throw new NullPointerException("Requirement completed without a value");
                    }
                    return value;
                },
                directExecutor());
        return Futures.catchingAsync(
                nonNull,
                Throwable.class,
                cause -> {
                    logger.log(Level.FINE, "Requirement of terminal {0} failed: {1}", new Object[] {terminalId, cause});
                    return Futures.immediateFailedFuture(new RequirementFailedException(terminalId, cause));
                },
                directExecutor());
    }

    @Override
    public String toString() {
        return String.format("Evaluator(%s, root %d, terminals %s)", diagram, root, requirements.keySet());
    }

    private static final class CancelOnFailure implements FutureCallback<List<Boolean>> {
        private final List<ListenableFuture<Boolean>> checks;

        CancelOnFailure(List<ListenableFuture<Boolean>> checks) {
            this.checks = checks;
        }

        @Override
        public void onSuccess(List<Boolean> result) {
            // All checks are done
        }

        @Override
        public void onFailure(Throwable failure) {
            for (ListenableFuture<Boolean> check : checks) {
                check.cancel(true);
            }
        }
    }
}
