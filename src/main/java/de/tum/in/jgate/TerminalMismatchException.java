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

import com.google.common.collect.ImmutableSortedSet;
import java.util.Set;

/**
 * Thrown when the requirements given to an {@link Evaluator} do not cover exactly the terminals of
 * the policy.
 */
public class TerminalMismatchException extends Exception {
    private static final long serialVersionUID = 1L;

    private final ImmutableSortedSet<Integer> missing;
    private final ImmutableSortedSet<Integer> unexpected;

    public TerminalMismatchException(Set<Integer> missing, Set<Integer> unexpected) {
        super(String.format("Requirements do not match the policy terminals: missing %s, unexpected %s",
                missing, unexpected));
        this.missing = ImmutableSortedSet.copyOf(missing);
        this.unexpected = ImmutableSortedSet.copyOf(unexpected);
    }

    /**
     * Returns the terminals of the policy without a requirement.
     */
    public Set<Integer> missing() {
        return missing;
    }

    /**
     * Returns the terminals with a requirement which do not occur in the policy.
     */
    public Set<Integer> unexpected() {
        return unexpected;
    }
}
