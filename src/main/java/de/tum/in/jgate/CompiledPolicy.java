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

import com.google.common.base.Preconditions;
import java.util.Map;
import java.util.Set;
import java.util.function.IntPredicate;

/**
 * A policy expression compiled into a decision diagram, identified by the diagram and the node
 * representing the policy within it.
 */
public final class CompiledPolicy {
    private final DecisionDiagram diagram;
    private final int root;

    CompiledPolicy(DecisionDiagram diagram, int root) {
        this.diagram = diagram;
        this.root = root;
    }

    /**
     * Returns the diagram holding the policy. It must not be extended once an {@link Evaluator} has
     * been created for this policy, since new variables would lack a requirement.
     */
    public DecisionDiagram diagram() {
        return diagram;
    }

    public int root() {
        return root;
    }

    /**
     * Returns the ids of all terminals referenced by the policy source, in ascending order.
     */
    public Set<Integer> terminals() {
        return diagram.variables();
    }

    public boolean evaluate(IntPredicate assignment) {
        return diagram.evaluate(root, assignment);
    }

    /**
     * Evaluates the policy under the given {@code assignment}.
     *
     * @throws IllegalArgumentException if a terminal needed for the decision has no assigned value.
     */
    public boolean evaluate(Map<Integer, Boolean> assignment) {
        Preconditions.checkNotNull(assignment);
        return diagram.evaluate(root, assignment);
    }

    @Override
    public String toString() {
        return String.format("Policy(%s, root %d, %d nodes)", diagram, root, diagram.nodeCount());
    }
}
