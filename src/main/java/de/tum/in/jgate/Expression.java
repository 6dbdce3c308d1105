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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.function.IntPredicate;

/**
 * Immutable syntax tree of a policy expression. Leaves are {@link Terminal terminals}, inner nodes
 * are {@link Operation gate applications} with exactly as many operands as the gate's arity.
 *
 * <p>{@link #toString()} prints the tree with every operation parenthesized, so parsing the printed
 * form yields an equal tree.</p>
 */
public abstract class Expression {
    Expression() {}

    public static Expression terminal(int terminalId) {
        return new Terminal(terminalId);
    }

    public static Expression not(Expression operand) {
        return new Operation(Gate.NOT, ImmutableList.of(operand));
    }

    public static Expression of(Gate gate, Expression left, Expression right) {
        if (gate.isUnary()) {
            throw new IllegalArgumentException(gate + " is a unary gate");
        }
        return new Operation(gate, ImmutableList.of(left, right));
    }

    /**
     * Evaluates this expression directly, looking up the value of each terminal in the
     * {@code assignment}.
     */
    public abstract boolean evaluate(IntPredicate assignment);

    /**
     * Returns all terminal ids occurring in this expression, in ascending order.
     */
    public Set<Integer> terminals() {
        SortedSet<Integer> terminals = new TreeSet<>();
        Deque<Expression> pending = new ArrayDeque<>();
        pending.push(this);
        while (!pending.isEmpty()) {
            Expression current = pending.pop();
            if (current instanceof Terminal) {
                terminals.add(((Terminal) current).terminalId);
            } else {
                ((Operation) current).operands.forEach(pending::push);
            }
        }
        return ImmutableSortedSet.copyOfSorted(terminals);
    }

    public abstract int depth();

    public static final class Terminal extends Expression {
        private final int terminalId;

        Terminal(int terminalId) {
            if (terminalId < 0) {
                throw new IllegalArgumentException("Negative terminal id " + terminalId);
            }
            this.terminalId = terminalId;
        }

        public int terminalId() {
            return terminalId;
        }

        @Override
        public boolean evaluate(IntPredicate assignment) {
            return assignment.test(terminalId);
        }

        @Override
        public int depth() {
            return 0;
        }

        @Override
        public boolean equals(Object object) {
            if (this == object) {
                return true;
            }
            if (!(object instanceof Terminal)) {
                return false;
            }
            return terminalId == ((Terminal) object).terminalId;
        }

        @Override
        public int hashCode() {
            return Integer.hashCode(terminalId);
        }

        @Override
        public String toString() {
            return Integer.toString(terminalId);
        }
    }

    public static final class Operation extends Expression {
        private final Gate gate;
        private final ImmutableList<Expression> operands;
        private final int depth;

        Operation(Gate gate, ImmutableList<Expression> operands) {
            if (operands.size() != gate.arity()) {
                throw new IllegalArgumentException(
                        String.format("%s expects %d operands, got %d", gate, gate.arity(), operands.size()));
            }
            this.gate = gate;
            this.operands = operands;
            this.depth = operands.stream().mapToInt(Expression::depth).max().orElse(0) + 1;
        }

        public Gate gate() {
            return gate;
        }

        public List<Expression> operands() {
            return operands;
        }

        public Expression left() {
            return operands.get(0);
        }

        /**
         * Returns the second operand of a binary operation.
         *
         * @throws IllegalStateException if the gate is unary.
         */
        public Expression right() {
            if (gate.isUnary()) {
                throw new IllegalStateException(gate + " has a single operand");
            }
            return operands.get(1);
        }

        @Override
        public boolean evaluate(IntPredicate assignment) {
            if (gate.isUnary()) {
                return gate.apply(left().evaluate(assignment));
            }
            return gate.apply(left().evaluate(assignment), right().evaluate(assignment));
        }

        @Override
        public int depth() {
            return depth;
        }

        @Override
        public boolean equals(Object object) {
            if (this == object) {
                return true;
            }
            if (!(object instanceof Operation)) {
                return false;
            }
            Operation that = (Operation) object;
            return gate == that.gate && operands.equals(that.operands);
        }

        @Override
        public int hashCode() {
            return Objects.hash(gate, operands);
        }

        @Override
        public String toString() {
            if (gate.isUnary()) {
                return "(" + gate + " " + left() + ")";
            }
            return "(" + left() + " " + gate + " " + right() + ")";
        }
    }
}
