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

import java.math.BigInteger;
import java.util.Map;
import java.util.Set;
import java.util.function.IntPredicate;

/**
 * A reduced, ordered binary decision diagram over terminal ids.
 *
 * <p>Functions are represented by {@code int} node handles which are only meaningful for the diagram
 * that produced them. Nodes are never removed: every handle stays valid for the lifetime of the
 * diagram, and structurally identical nodes are never created twice, so two handles are equal iff
 * they represent the same function.</p>
 *
 * <p>Variables are ordered by the time they were first requested through {@link #variable(int)}.
 * Construction methods are not thread-safe; once construction is finished, the read-only methods
 * ({@link #evaluate(int, IntPredicate)}, {@link #low(int)}, ...) may be used concurrently.</p>
 */
public interface DecisionDiagram {
    /**
     * Returns the node representing {@code true}.
     */
    int trueNode();

    /**
     * Returns the node representing {@code false}.
     */
    int falseNode();

    /**
     * Determines whether the given {@code node} represents a constant.
     */
    boolean isLeaf(int node);

    /**
     * Determines whether {@code node} is a leaf or a node created by this diagram.
     */
    boolean isNodeValidOrLeaf(int node);

    int low(int node);

    int high(int node);

    /**
     * Returns the terminal id the given {@code node} branches on, or {@literal -1} for a leaf.
     */
    int labelOf(int node);

    /**
     * Returns the node representing the terminal with the given id, registering it as a new variable
     * if it is not yet known to this diagram. Repeated calls with the same id return the same node.
     *
     * @param terminalId The non-negative terminal id.
     * @return The node representing the terminal.
     */
    int variable(int terminalId);

    boolean hasVariable(int terminalId);

    /**
     * Determines whether the given {@code node} represents a single variable.
     */
    default boolean isVariable(int node) {
        return !isLeaf(node) && low(node) == falseNode() && high(node) == trueNode();
    }

    int numberOfVariables();

    /**
     * Returns the terminal ids of all variables registered in this diagram, in ascending order.
     */
    Set<Integer> variables();

    /**
     * Returns the terminal ids which have an influence on the function represented by {@code node},
     * in ascending order.
     */
    Set<Integer> support(int node);

    /**
     * Constructs the node representing {@code node1 AND node2}.
     */
    int and(int node1, int node2);

    /**
     * Constructs the node representing {@code node1 OR node2}.
     */
    int or(int node1, int node2);

    /**
     * Constructs the node representing {@code node1 XOR node2}.
     */
    int xor(int node1, int node2);

    /**
     * Constructs the node representing {@code NOT node}.
     */
    int not(int node);

    /**
     * Evaluates the function represented by {@code node} by walking from {@code node} to a leaf. The
     * {@code assignment} is only queried for the terminals on the taken path.
     *
     * @param node The node to evaluate.
     * @param assignment The value of each terminal, keyed by terminal id.
     * @return The truth value of the node under the given assignment.
     */
    boolean evaluate(int node, IntPredicate assignment);

    /**
     * Evaluates the function represented by {@code node} under the given {@code assignment}.
     *
     * @throws IllegalArgumentException if a terminal on the taken path has no assigned value.
     */
    default boolean evaluate(int node, Map<Integer, Boolean> assignment) {
        return evaluate(node, terminalId -> {
            Boolean value = assignment.get(terminalId);
            if (value == null) {
                throw new IllegalArgumentException("No value assigned to terminal " + terminalId);
            }
            return value;
        });
    }

    /**
     * Returns any satisfying assignment, containing exactly the terminals along one path from
     * {@code node} to {@code true}.
     *
     * @throws java.util.NoSuchElementException if {@code node} is {@literal false}.
     */
    Map<Integer, Boolean> getSatisfyingAssignment(int node);

    /**
     * Counts the satisfying assignments of the function represented by {@code node} over all
     * variables of this diagram.
     */
    BigInteger countSatisfyingAssignments(int node);

    /**
     * Returns the number of inner (non-leaf) nodes of this diagram.
     */
    int nodeCount();

    /**
     * Returns a string containing some statistics about the diagram. The content and formatting of
     * this string may change and is only intended as human-readable output.
     */
    String statistics();
}
