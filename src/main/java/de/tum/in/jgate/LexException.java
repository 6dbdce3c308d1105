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

import javax.annotation.Nullable;

public class LexException extends Exception {
    private static final long serialVersionUID = 1L;

    public enum Kind {
        INVALID_CHARACTER,
        UNKNOWN_GATE,
        UNBALANCED_PARENS,
        MALFORMED_TERMINAL_ID
    }

    private final Kind kind;
    private final int position;

    @Nullable
    private final String text;

    LexException(Kind kind, String message, int position, @Nullable String text) {
        super(message);
        this.kind = kind;
        this.position = position;
        this.text = text;
    }

    static LexException invalidCharacter(char character, int position) {
        return new LexException(
                Kind.INVALID_CHARACTER,
                String.format("Invalid character '%s' at position %d", character, position),
                position,
                String.valueOf(character));
    }

    static LexException unknownGate(String text, int position) {
        return new LexException(
                Kind.UNKNOWN_GATE, String.format("%s is not a valid logic gate", text), position, text);
    }

    static LexException malformedTerminalId(String text, int position) {
        return new LexException(
                Kind.MALFORMED_TERMINAL_ID,
                String.format("Terminal id %s at position %d exceeds %d", text, position, Lexer.MAX_TERMINAL_ID),
                position,
                text);
    }

    static LexException unclosedParens(int balance) {
        return new LexException(
                Kind.UNBALANCED_PARENS,
                String.format("Mismatching parentheses count, %d unclosed", balance),
                -1,
                null);
    }

    static LexException unmatchedClosingParen(int position) {
        return new LexException(
                Kind.UNBALANCED_PARENS,
                String.format("Unexpected closing parenthesis at position %d", position),
                position,
                ")");
    }

    public Kind kind() {
        return kind;
    }

    /**
     * Returns the offset in the source where the offending input starts, or {@literal -1} if the
     * error concerns the input as a whole.
     */
    public int position() {
        return position;
    }

    @Nullable
    public String text() {
        return text;
    }
}
