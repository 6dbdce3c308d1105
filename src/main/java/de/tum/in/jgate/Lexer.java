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
import java.util.List;

/**
 * Splits policy source text into {@link Token tokens}.
 *
 * <p>Terminal ids are maximal runs of ASCII digits, gates are maximal runs of ASCII letters matched
 * case-insensitively against the {@link Gate} keywords. Whitespace separates tokens but is otherwise
 * ignored, so {@code "999   OR1000"} is a valid input.</p>
 */
public final class Lexer {
    /** Terminal ids are 16 bit unsigned values. */
    public static final int MAX_TERMINAL_ID = 0xFFFF;

    private Lexer() {}

    public static List<Token> tokenize(String source) throws LexException {
        ImmutableList.Builder<Token> tokens = ImmutableList.builder();
        int balance = 0;
        int length = source.length();
        int position = 0;

        while (position < length) {
            char character = source.charAt(position);
            if (Character.isWhitespace(character)) {
                position += 1;
            } else if (character == '(') {
                balance += 1;
                tokens.add(Token.openParen());
                position += 1;
            } else if (character == ')') {
                balance -= 1;
                // A closing parenthesis can never be matched later on
                if (balance < 0) {
                    throw LexException.unmatchedClosingParen(position);
                }
                tokens.add(Token.closeParen());
                position += 1;
            } else if (isDigit(character)) {
                int end = position;
                int value = 0;
                boolean overflow = false;
                while (end < length && isDigit(source.charAt(end))) {
                    if (!overflow) {
                        value = value * 10 + (source.charAt(end) - '0');
                        overflow = value > MAX_TERMINAL_ID;
                    }
                    end += 1;
                }
                if (overflow) {
                    throw LexException.malformedTerminalId(source.substring(position, end), position);
                }
                tokens.add(Token.terminal(value));
                position = end;
            } else if (isLetter(character)) {
                int end = position;
                while (end < length && isLetter(source.charAt(end))) {
                    end += 1;
                }
                String word = source.substring(position, end);
                Gate gate = Gate.fromKeyword(word);
                if (gate == null) {
                    throw LexException.unknownGate(word, position);
                }
                tokens.add(Token.gate(gate));
                position = end;
            } else {
                throw LexException.invalidCharacter(character, position);
            }
        }

        if (balance != 0) {
            throw LexException.unclosedParens(balance);
        }
        return tokens.build();
    }

    private static boolean isDigit(char character) {
        return '0' <= character && character <= '9';
    }

    private static boolean isLetter(char character) {
        return ('a' <= character && character <= 'z') || ('A' <= character && character <= 'Z');
    }
}
