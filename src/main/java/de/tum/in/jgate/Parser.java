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

import java.util.Iterator;
import java.util.List;
import javax.annotation.Nullable;

/**
 * Recursive-descent parser for policy expressions.
 *
 * <p>Binary gates connect the operand before and after them. Chains without parentheses are grouped
 * from left to right, there is no precedence: {@code 0 AND 1 OR 2} is parsed as
 * {@code (0 AND 1) OR 2}. {@link Gate#NOT} prefixes exactly one operand and may appear wherever an
 * operand is expected. Empty groups such as {@code ()} contribute nothing and are dropped, but a
 * source without any operand is rejected.</p>
 */
public final class Parser {
    private Parser() {}

    public static Expression parse(String source) throws ParseException {
        List<Token> tokens;
        try {
            tokens = Lexer.tokenize(source);
        } catch (LexException e) {
            throw new ParseException(e);
        }
        return parse(tokens);
    }

    public static Expression parse(List<Token> tokens) throws ParseException {
        Iterator<Token> iterator = tokens.iterator();
        Expression expression = parseGroup(iterator, true);
        if (expression == null) {
            throw new ParseException(ParseException.Kind.INVALID_EXPRESSION, "Expression contains no terminal");
        }
        return expression;
    }

    /* Parses tokens until the closing parenthesis of the current group (or the end of input for the
     * top level) and returns the group's expression, or null if the group is empty. */
    @Nullable
    private static Expression parseGroup(Iterator<Token> tokens, boolean topLevel) throws ParseException {
        Group group = new Group();
        while (tokens.hasNext()) {
            Token token = tokens.next();
            switch (token.type()) {
                case OPEN_PAREN:
                    Expression inner = parseGroup(tokens, false);
                    if (inner != null) {
                        group.finalizeOperand(inner);
                    }
                    break;
                case CLOSE_PAREN:
                    if (topLevel) {
                        throw new ParseException(
                                ParseException.Kind.INVALID_EXPRESSION, "Unmatched closing parenthesis");
                    }
                    group.checkComplete();
                    return group.current;
                case TERMINAL:
                    group.finalizeOperand(Expression.terminal(token.terminalId()));
                    break;
                case GATE:
                    group.gate(token.gate());
                    break;
                default:
                    throw new AssertionError(token);
            }
        }
        if (!topLevel) {
            throw new ParseException(ParseException.Kind.INVALID_EXPRESSION, "Unclosed parenthesis");
        }
        group.checkComplete();
        return group.current;
    }

    private static final class Group {
        @Nullable
        Expression current = null;

        @Nullable
        Gate pendingGate = null;

        int pendingNegations = 0;

        boolean expectsOperand() {
            return current == null || pendingGate != null;
        }

        void gate(Gate gate) throws ParseException {
            if (gate.isUnary()) {
                if (!expectsOperand()) {
                    throw invalidGate(gate + " must not follow an operand");
                }
                pendingNegations += 1;
                return;
            }
            if (current == null || pendingGate != null || pendingNegations > 0) {
                throw invalidGate(gate + " must come between two operands");
            }
            pendingGate = gate;
        }

        void finalizeOperand(Expression operand) throws ParseException {
            Expression value = operand;
            for (; pendingNegations > 0; pendingNegations--) {
                value = Expression.not(value);
            }

            if (current == null) {
                if (pendingGate != null) {
                    throw invalidGate(pendingGate + " has no left operand");
                }
                current = value;
            } else {
                if (pendingGate == null) {
                    throw new ParseException(
                            ParseException.Kind.INVALID_TERMINAL_PLACEMENT,
                            String.format("Operands %s and %s are not connected by a gate", current, value));
                }
                current = Expression.of(pendingGate, current, value);
                pendingGate = null;
            }
        }

        void checkComplete() throws ParseException {
            if (pendingGate != null) {
                throw invalidGate(pendingGate + " has no right operand");
            }
            if (pendingNegations > 0) {
                throw invalidGate("NOT has no operand");
            }
        }

        private static ParseException invalidGate(String message) {
            return new ParseException(ParseException.Kind.INVALID_GATE_PLACEMENT, message);
        }
    }
}
