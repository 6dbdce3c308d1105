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

import java.util.Objects;
import javax.annotation.Nullable;

/**
 * A lexical unit of a policy expression. Whitespace never produces a token.
 */
public final class Token {
    public enum Type {
        OPEN_PAREN,
        CLOSE_PAREN,
        TERMINAL,
        GATE
    }

    private static final Token OPEN_PAREN = new Token(Type.OPEN_PAREN, -1, null);
    private static final Token CLOSE_PAREN = new Token(Type.CLOSE_PAREN, -1, null);

    private final Type type;
    private final int terminalId;

    @Nullable
    private final Gate gate;

    private Token(Type type, int terminalId, @Nullable Gate gate) {
        this.type = type;
        this.terminalId = terminalId;
        this.gate = gate;
    }

    public static Token openParen() {
        return OPEN_PAREN;
    }

    public static Token closeParen() {
        return CLOSE_PAREN;
    }

    public static Token terminal(int terminalId) {
        if (terminalId < 0) {
            throw new IllegalArgumentException("Negative terminal id " + terminalId);
        }
        return new Token(Type.TERMINAL, terminalId, null);
    }

    public static Token gate(Gate gate) {
        return new Token(Type.GATE, -1, Objects.requireNonNull(gate));
    }

    public Type type() {
        return type;
    }

    /**
     * Returns the terminal id of a {@link Type#TERMINAL} token.
     *
     * @throws IllegalStateException if this is not a terminal token.
     */
    public int terminalId() {
        if (type != Type.TERMINAL) {
            throw new IllegalStateException(this + " is not a terminal");
        }
        return terminalId;
    }

    /**
     * Returns the gate of a {@link Type#GATE} token.
     *
     * @throws IllegalStateException if this is not a gate token.
     */
    public Gate gate() {
        if (gate == null) {
            throw new IllegalStateException(this + " is not a gate");
        }
        return gate;
    }

    @Override
    public boolean equals(Object object) {
        if (this == object) {
            return true;
        }
        if (!(object instanceof Token)) {
            return false;
        }
        Token that = (Token) object;
        return type == that.type && terminalId == that.terminalId && gate == that.gate;
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, terminalId, gate);
    }

    @Override
    public String toString() {
        switch (type) {
            case OPEN_PAREN:
                return "(";
            case CLOSE_PAREN:
                return ")";
            case TERMINAL:
                return Integer.toString(terminalId);
            case GATE:
                return String.valueOf(gate);
            default:
                throw new AssertionError(type);
        }
    }
}
