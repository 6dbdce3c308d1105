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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableMap;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.SettableFuture;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class EvaluatorTest {
    private ScheduledExecutorService scheduler;
    private ListeningExecutorService executor;

    @BeforeEach
    public void setUp() {
        scheduler = Executors.newSingleThreadScheduledExecutor();
        executor = MoreExecutors.listeningDecorator(Executors.newFixedThreadPool(8));
    }

    @AfterEach
    public void tearDown() {
        scheduler.shutdownNow();
        executor.shutdownNow();
    }

    private static Throwable failureOf(ListenableFuture<Boolean> evaluation) {
        ExecutionException exception = assertThrows(ExecutionException.class, () -> evaluation.get(5, TimeUnit.SECONDS));
        return exception.getCause();
    }

    /* Grants terminal i iff the querier contains i. */
    private static Map<Integer, Requirement<Set<Integer>>> membership(Set<Integer> terminals) {
        Map<Integer, Requirement<Set<Integer>>> requirements = new HashMap<>();
        for (int terminal : terminals) {
            requirements.put(terminal, Requirements.of(granted -> granted.contains(terminal)));
        }
        return requirements;
    }

    @Test
    public void testConstantRequirements() throws Exception {
        CompiledPolicy policy = DiagramCompiler.compile("(0 AND 1) OR (0 AND 2)");
        Evaluator<Object> evaluator = Evaluator.create(policy, ImmutableMap.<Integer, Requirement<Object>>of(
                0, Requirements.constant(true),
                1, Requirements.constant(false),
                2, Requirements.constant(true)));
        assertThat(evaluator.evaluate(new Object()).get(), is(true));
        assertThat(evaluator.terminals(), contains(0, 1, 2));
    }

    @Test
    public void testNandTruthTable() throws Exception {
        CompiledPolicy policy = DiagramCompiler.compile("0 NAND 1");
        Evaluator<Set<Integer>> evaluator = Evaluator.create(policy, membership(Set.of(0, 1)));
        assertThat(evaluator.evaluate(Set.of()).get(), is(true));
        assertThat(evaluator.evaluate(Set.of(0)).get(), is(true));
        assertThat(evaluator.evaluate(Set.of(1)).get(), is(true));
        assertThat(evaluator.evaluate(Set.of(0, 1)).get(), is(false));
    }

    @Test
    public void testSharedNandTerminal() throws Exception {
        Expression expression = Parser.parse("(0 NAND 1) OR (0 NAND 2)");
        CompiledPolicy policy = DiagramCompiler.compile(expression);
        Evaluator<Set<Integer>> evaluator = Evaluator.create(policy, membership(Set.of(0, 1, 2)));
        for (int mask = 0; mask < 8; mask++) {
            int valuation = mask;
            Set<Integer> granted = new HashSet<>();
            for (int terminal = 0; terminal < 3; terminal++) {
                if ((valuation & (1 << terminal)) != 0) {
                    granted.add(terminal);
                }
            }
            assertThat(evaluator.evaluate(granted).get(), is(expression.evaluate(granted::contains)));
        }
        assertThat(evaluator.evaluate(Set.of(0, 1, 2)).get(), is(false));
    }

    @Test
    public void testSharedNandTerminalWithFalseResolver() throws Exception {
        Expression expression = Parser.parse("(0 NAND 1) OR (0 NAND 2)");
        CompiledPolicy policy = DiagramCompiler.compile(expression);
        for (boolean first : new boolean[] {false, true}) {
            for (boolean second : new boolean[] {false, true}) {
                Evaluator<Object> evaluator = Evaluator.create(policy, ImmutableMap.<Integer, Requirement<Object>>of(
                        0, Requirements.constant(false),
                        1, Requirements.constant(first),
                        2, Requirements.constant(second)));
                boolean expected = expression.evaluate(id -> id == 1 ? first : id == 2 && second);
                assertThat(expected, is(true));
                assertThat(evaluator.evaluate(this).get(), is(expected));
            }
        }
    }

    @Test
    public void testEachTerminalResolvedOnce() throws Exception {
        CompiledPolicy policy = DiagramCompiler.compile("0 AND (0 OR 1) AND NOT (0 XOR 1)");
        AtomicInteger zeroCount = new AtomicInteger();
        AtomicInteger oneCount = new AtomicInteger();
        Evaluator<Object> evaluator = Evaluator.create(policy, ImmutableMap.<Integer, Requirement<Object>>of(
                0, querier -> {
                    zeroCount.incrementAndGet();
                    return Futures.immediateFuture(true);
                },
                1, querier -> {
                    oneCount.incrementAndGet();
                    return Futures.immediateFuture(true);
                }));

        assertThat(evaluator.evaluate("first").get(), is(true));
        assertThat(zeroCount.get(), is(1));
        assertThat(oneCount.get(), is(1));

        assertThat(evaluator.evaluate("second").get(), is(true));
        assertThat(zeroCount.get(), is(2));
        assertThat(oneCount.get(), is(2));
    }

    @Test
    public void testIrrelevantTerminalIsStillResolved() throws Exception {
        CompiledPolicy policy = DiagramCompiler.compile("0 OR NOT 0 OR 1");
        assertThat(policy.root(), is(policy.diagram().trueNode()));
        AtomicInteger count = new AtomicInteger();
        Evaluator<Object> evaluator = Evaluator.create(policy, ImmutableMap.<Integer, Requirement<Object>>of(
                0, Requirements.constant(false),
                1, querier -> {
                    count.incrementAndGet();
                    return Futures.immediateFuture(false);
                }));
        assertThat(evaluator.evaluate(this).get(), is(true));
        assertThat(count.get(), is(1));
    }

    @Test
    public void testFailingRequirement() throws Exception {
        CompiledPolicy policy = DiagramCompiler.compile("0 OR 1");
        IllegalStateException backendFailure = new IllegalStateException("backend unavailable");
        Evaluator<Object> evaluator = Evaluator.create(policy, ImmutableMap.<Integer, Requirement<Object>>of(
                0, Requirements.constant(true),
                1, Requirements.of(querier -> {
                    throw backendFailure;
                })));

        Throwable failure = failureOf(evaluator.evaluate(this));
        assertThat(failure, instanceOf(RequirementFailedException.class));
        assertThat(((RequirementFailedException) failure).terminalId(), is(1));
        assertThat(failure.getCause(), is(backendFailure));
    }

    @Test
    public void testThrowingRequirement() throws Exception {
        CompiledPolicy policy = DiagramCompiler.compile("3 AND 4");
        Evaluator<Object> evaluator = Evaluator.create(policy, ImmutableMap.<Integer, Requirement<Object>>of(
                3, querier -> {
                    throw new UnsupportedOperationException();
                },
                4, Requirements.constant(true)));

        Throwable failure = failureOf(evaluator.evaluate(this));
        assertThat(((RequirementFailedException) failure).terminalId(), is(3));
        assertThat(failure.getCause(), instanceOf(UnsupportedOperationException.class));
    }

    @Test
    public void testNullOutcome() throws Exception {
        CompiledPolicy policy = DiagramCompiler.compile("0 AND 1");
        Evaluator<Object> evaluator = Evaluator.create(policy, ImmutableMap.<Integer, Requirement<Object>>of(
                0, querier -> Futures.immediateFuture(null),
                1, querier -> null));

        Throwable failure = failureOf(evaluator.evaluate(this));
        assertThat(failure, instanceOf(RequirementFailedException.class));
        assertThat(failure.getCause(), instanceOf(NullPointerException.class));
    }

    @Test
    public void testFirstFailureWins() throws Exception {
        CompiledPolicy policy = DiagramCompiler.compile("0 AND 1");
        SettableFuture<Boolean> pending = SettableFuture.create();
        Evaluator<Object> evaluator = Evaluator.create(policy, ImmutableMap.<Integer, Requirement<Object>>of(
                0, querier -> pending,
                1, querier -> Futures.immediateFailedFuture(new IllegalStateException("denied"))));

        ListenableFuture<Boolean> evaluation = evaluator.evaluate(this);
        Throwable failure = failureOf(evaluation);
        assertThat(((RequirementFailedException) failure).terminalId(), is(1));
        // The requirement's own future is left alone
        assertThat(pending.isCancelled(), is(false));
        assertThat(pending.setException(new IllegalStateException("late")), is(true));
        assertThat(((RequirementFailedException) failureOf(evaluation)).terminalId(), is(1));
    }

    @Test
    public void testFailureDoesNotAffectOtherEvaluations() throws Exception {
        CompiledPolicy policy = DiagramCompiler.compile("0 AND 1");
        SettableFuture<Boolean> shared = SettableFuture.create();
        Evaluator<String> evaluator = Evaluator.create(policy, ImmutableMap.<Integer, Requirement<String>>of(
                0, querier -> shared,
                1, Requirements.of(querier -> {
                    if ("bad".equals(querier)) {
                        throw new IllegalStateException("rejected querier");
                    }
                    return true;
                })));

        ListenableFuture<Boolean> good = evaluator.evaluate("good");
        ListenableFuture<Boolean> bad = evaluator.evaluate("bad");
        assertThat(((RequirementFailedException) failureOf(bad)).terminalId(), is(1));
        assertThat(shared.isCancelled(), is(false));
        assertThat(good.isDone(), is(false));

        shared.set(true);
        assertThat(good.get(5, TimeUnit.SECONDS), is(true));
    }

    @Test
    public void testPendingChecksKeptWithoutCancellation() throws Exception {
        CompiledPolicy policy = DiagramCompiler.compile("0 AND 1");
        SettableFuture<Boolean> pending = SettableFuture.create();
        EvaluatorConfiguration configuration = ImmutableEvaluatorConfiguration.builder()
                .cancelPendingOnFailure(false)
                .build();
        Evaluator<Object> evaluator = Evaluator.create(policy, ImmutableMap.<Integer, Requirement<Object>>of(
                0, querier -> pending,
                1, querier -> Futures.immediateFailedFuture(new IllegalStateException("denied"))), configuration);

        Throwable failure = failureOf(evaluator.evaluate(this));
        assertThat(((RequirementFailedException) failure).terminalId(), is(1));
        assertThat(pending.isDone(), is(false));
        pending.set(true);
    }

    @Test
    public void testCancellingEvaluationKeepsRequirementFutures() throws Exception {
        CompiledPolicy policy = DiagramCompiler.compile("0 OR 1");
        SettableFuture<Boolean> first = SettableFuture.create();
        SettableFuture<Boolean> second = SettableFuture.create();
        Evaluator<Object> evaluator = Evaluator.create(policy, ImmutableMap.<Integer, Requirement<Object>>of(
                0, querier -> first,
                1, querier -> second));

        ListenableFuture<Boolean> cancelled = evaluator.evaluate(this);
        ListenableFuture<Boolean> other = evaluator.evaluate(this);
        assertThat(cancelled.isDone(), is(false));
        assertThat(cancelled.cancel(true), is(true));
        assertThat(first.isCancelled(), is(false));
        assertThat(second.isCancelled(), is(false));

        first.set(false);
        second.set(true);
        assertThat(other.get(5, TimeUnit.SECONDS), is(true));
        assertThat(cancelled.isCancelled(), is(true));
    }

    @Test
    public void testInvalidRoot() {
        CompiledPolicy policy = DiagramCompiler.compile(Expression.terminal(0));
        EvaluatorConfiguration configuration = ImmutableEvaluatorConfiguration.builder().build();
        assertThrows(IllegalArgumentException.class, () -> Evaluator.create(
                policy.diagram(), 12_345, membership(Set.of(0)), configuration));
        assertThrows(IllegalArgumentException.class, () -> Evaluator.create(
                policy.diagram(), 0, membership(Set.of(0)), configuration));
    }

    @Test
    public void testTimeout() throws Exception {
        CompiledPolicy policy = DiagramCompiler.compile("0 OR 1");
        SettableFuture<Boolean> never = SettableFuture.create();
        EvaluatorConfiguration configuration = ImmutableEvaluatorConfiguration.builder()
                .timeout(Duration.ofMillis(50))
                .scheduler(scheduler)
                .build();
        Evaluator<Object> evaluator = Evaluator.create(policy, ImmutableMap.<Integer, Requirement<Object>>of(
                0, Requirements.constant(false),
                1, querier -> never), configuration);

        Throwable failure = failureOf(evaluator.evaluate(this));
        assertThat(((RequirementFailedException) failure).terminalId(), is(1));
        assertThat(failure.getCause(), instanceOf(TimeoutException.class));
        assertThat(never.isCancelled(), is(false));
    }

    @Test
    public void testTimeoutNotReachedWithinDeadline() throws Exception {
        CompiledPolicy policy = DiagramCompiler.compile("0 AND 1");
        EvaluatorConfiguration configuration = ImmutableEvaluatorConfiguration.builder()
                .timeout(Duration.ofSeconds(10))
                .scheduler(scheduler)
                .build();
        Evaluator<Set<Integer>> evaluator = Evaluator.create(
                policy.diagram(), policy.root(), membership(Set.of(0, 1)), configuration);
        assertThat(evaluator.evaluate(Set.of(0, 1)).get(5, TimeUnit.SECONDS), is(true));
    }

    @Test
    public void testInvalidConfiguration() {
        assertThrows(IllegalStateException.class, () -> ImmutableEvaluatorConfiguration.builder()
                .timeout(Duration.ofSeconds(1))
                .build());
        assertThrows(IllegalStateException.class, () -> ImmutableEvaluatorConfiguration.builder()
                .timeout(Duration.ZERO)
                .scheduler(scheduler)
                .build());
    }

    @Test
    public void testTerminalMismatch() throws Exception {
        CompiledPolicy policy = DiagramCompiler.compile("0 AND 2");
        TerminalMismatchException missing = assertThrows(TerminalMismatchException.class,
                () -> Evaluator.create(policy, ImmutableMap.<Integer, Requirement<Object>>of(0, Requirements.constant(true))));
        assertThat(missing.missing(), contains(2));
        assertThat(missing.unexpected(), empty());

        TerminalMismatchException unexpected = assertThrows(TerminalMismatchException.class,
                () -> Evaluator.create(policy, ImmutableMap.<Integer, Requirement<Object>>of(
                        0, Requirements.constant(true),
                        1, Requirements.constant(true),
                        2, Requirements.constant(true))));
        assertThat(unexpected.missing(), empty());
        assertThat(unexpected.unexpected(), contains(1));

        // Positional binding covers 0 and 1, but the policy has no terminal 1
        TerminalMismatchException positional = assertThrows(TerminalMismatchException.class,
                () -> Evaluator.createPositional(policy, List.<Requirement<Object>>of(
                        Requirements.constant(true), Requirements.constant(true))));
        assertThat(positional.missing(), contains(2));
        assertThat(positional.unexpected(), contains(1));
    }

    @Test
    public void testPositionalBinding() throws Exception {
        CompiledPolicy policy = DiagramCompiler.compile("0 AND NOT 1 AND 2");
        Evaluator<Object> evaluator = Evaluator.createPositional(policy, List.<Requirement<Object>>of(
                Requirements.constant(true), Requirements.constant(false), Requirements.constant(true)));
        assertThat(evaluator.evaluate(this).get(), is(true));
    }

    @Test
    public void testConcurrentEvaluations() throws Exception {
        Expression expression = Parser.parse("(0 AND 1) OR (2 XOR NOT 3)");
        CompiledPolicy policy = DiagramCompiler.compile(expression);
        Map<Integer, Requirement<Integer>> requirements = new HashMap<>();
        for (int terminal = 0; terminal < 4; terminal++) {
            int bit = 1 << terminal;
            requirements.put(terminal, Requirements.async(mask -> (mask & bit) != 0, executor));
        }
        Evaluator<Integer> evaluator = Evaluator.create(policy, requirements);

        List<ListenableFuture<Boolean>> evaluations = new ArrayList<>();
        for (int i = 0; i < 400; i++) {
            evaluations.add(evaluator.evaluate(i % 16));
        }
        List<Boolean> decisions = Futures.allAsList(evaluations).get(10, TimeUnit.SECONDS);
        for (int i = 0; i < decisions.size(); i++) {
            int mask = i % 16;
            assertThat(decisions.get(i), is(expression.evaluate(id -> (mask & (1 << id)) != 0)));
        }
    }
}
