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

import com.google.common.collect.ImmutableMap;
import java.util.Arrays;
import java.util.Locale;
import java.util.function.Function;
import javax.annotation.Nullable;

/**
 * The logic gates available in policy expressions. All gates except {@link #NOT} are binary.
 */
public enum Gate {
    AND("AND", 2),
    OR("OR", 2),
    NAND("NAND", 2),
    NOR("NOR", 2),
    XOR("XOR", 2),
    NOT("NOT", 1);

    private static final ImmutableMap<String, Gate> KEYWORDS =
            Arrays.stream(values()).collect(ImmutableMap.toImmutableMap(Gate::keyword, Function.identity()));

    private final String keyword;
    private final int arity;

    Gate(String keyword, int arity) {
        this.keyword = keyword;
        this.arity = arity;
    }

    /**
     * Looks up the gate with the given keyword, ignoring case.
     *
     * @return The gate or {@code null} if there is no such keyword.
     */
    @Nullable
    public static Gate fromKeyword(String keyword) {
        return KEYWORDS.get(keyword.toUpperCase(Locale.ROOT));
    }

    public String keyword() {
        return keyword;
    }

    public int arity() {
        return arity;
    }

    public boolean isUnary() {
        return arity == 1;
    }

    /**
     * Applies this gate to the given operand values. Unary gates expect exactly one value, binary
     * gates exactly two.
     */
    public boolean apply(boolean... operands) {
        if (operands.length != arity) {
            throw new IllegalArgumentException(
                    String.format("%s expects %d operands, got %d", keyword, arity, operands.length));
        }
        switch (this) {
            case AND:
                return operands[0] && operands[1];
            case OR:
                return operands[0] || operands[1];
            case NAND:
                return !(operands[0] && operands[1]);
            case NOR:
                return !(operands[0] || operands[1]);
            case XOR:
                return operands[0] ^ operands[1];
            case NOT:
                return !operands[0];
            default:
                throw new AssertionError(this);
        }
    }

    @Override
    public String toString() {
        return keyword;
    }
}
