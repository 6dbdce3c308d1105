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

public class ParseException extends Exception {
    private static final long serialVersionUID = 1L;

    public enum Kind {
        /** The source contains no operand at all. */
        INVALID_EXPRESSION,
        /** Two operands follow each other without a connecting gate. */
        INVALID_TERMINAL_PLACEMENT,
        /** A gate lacks an operand or follows another gate. */
        INVALID_GATE_PLACEMENT,
        /** The source could not be tokenized, the cause is a {@link LexException}. */
        LEXING
    }

    private final Kind kind;

    public ParseException(Kind kind, String message) {
        super(message);
        if (kind == Kind.LEXING) {
            throw new IllegalArgumentException("Lexing errors need a cause");
        }
        this.kind = kind;
    }

    public ParseException(LexException cause) {
        super(cause.getMessage(), cause);
        this.kind = Kind.LEXING;
    }

    public Kind kind() {
        return kind;
    }
}
