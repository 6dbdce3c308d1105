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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

public class LexerTest {
    @Test
    public void testSimpleExpression() throws LexException {
        List<Token> tokens = Lexer.tokenize("(0 AND 1) OR 2");
        assertThat(tokens, contains(
                Token.openParen(),
                Token.terminal(0),
                Token.gate(Gate.AND),
                Token.terminal(1),
                Token.closeParen(),
                Token.gate(Gate.OR),
                Token.terminal(2)));
    }

    @Test
    public void testWhitespaceIsOptional() throws LexException {
        assertThat(Lexer.tokenize("999   OR1000"), contains(
                Token.terminal(999), Token.gate(Gate.OR), Token.terminal(1000)));
        assertThat(Lexer.tokenize("\t(1)\nxor\r\n(2)"), contains(
                Token.openParen(),
                Token.terminal(1),
                Token.closeParen(),
                Token.gate(Gate.XOR),
                Token.openParen(),
                Token.terminal(2),
                Token.closeParen()));
    }

    @Test
    public void testKeywordsIgnoreCase() throws LexException {
        assertThat(Lexer.tokenize("not 1 nAnD 2 Nor 3"), contains(
                Token.gate(Gate.NOT),
                Token.terminal(1),
                Token.gate(Gate.NAND),
                Token.terminal(2),
                Token.gate(Gate.NOR),
                Token.terminal(3)));
    }

    @Test
    public void testEmptyInput() throws LexException {
        assertThat(Lexer.tokenize(""), empty());
        assertThat(Lexer.tokenize("  \t "), empty());
    }

    @Test
    public void testTerminalRange() throws LexException {
        assertThat(Lexer.tokenize("65535"), contains(Token.terminal(Lexer.MAX_TERMINAL_ID)));
        assertThat(Lexer.tokenize("007"), contains(Token.terminal(7)));

        LexException exception = assertThrows(LexException.class, () -> Lexer.tokenize("1 AND 65536"));
        assertThat(exception.kind(), is(LexException.Kind.MALFORMED_TERMINAL_ID));
        assertThat(exception.position(), is(6));
        assertThat(exception.text(), is("65536"));

        exception = assertThrows(LexException.class, () -> Lexer.tokenize("123456789012345678901234567890"));
        assertThat(exception.kind(), is(LexException.Kind.MALFORMED_TERMINAL_ID));
    }

    @Test
    public void testInvalidCharacter() {
        LexException exception = assertThrows(LexException.class, () -> Lexer.tokenize("0 & 1"));
        assertThat(exception.kind(), is(LexException.Kind.INVALID_CHARACTER));
        assertThat(exception.position(), is(2));
        assertThat(exception.text(), is("&"));

        exception = assertThrows(LexException.class, () -> Lexer.tokenize("-1"));
        assertThat(exception.kind(), is(LexException.Kind.INVALID_CHARACTER));
    }

    @Test
    public void testUnknownGate() {
        LexException exception = assertThrows(LexException.class, () -> Lexer.tokenize("0 AND FOO"));
        assertThat(exception.kind(), is(LexException.Kind.UNKNOWN_GATE));
        assertThat(exception.position(), is(6));
        assertThat(exception.text(), is("FOO"));

        // Letters are matched as a whole word
        exception = assertThrows(LexException.class, () -> Lexer.tokenize("0 ANDOR 1"));
        assertThat(exception.text(), is("ANDOR"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"(0", "((1)", "(0 AND (1)"})
    public void testUnclosedParentheses(String source) {
        LexException exception = assertThrows(LexException.class, () -> Lexer.tokenize(source));
        assertThat(exception.kind(), is(LexException.Kind.UNBALANCED_PARENS));
        assertThat(exception.position(), is(-1));
    }

    private static Stream<Arguments> unmatchedClosingParentheses() {
        return Stream.of(
                Arguments.of(")(", 0),
                Arguments.of(")", 0),
                Arguments.of("(0 AND 1))", 9),
                Arguments.of("0 ) OR (1", 2));
    }

    @ParameterizedTest
    @MethodSource("unmatchedClosingParentheses")
    public void testUnmatchedClosingParenthesis(String source, int position) {
        LexException exception = assertThrows(LexException.class, () -> Lexer.tokenize(source));
        assertThat(exception.kind(), is(LexException.Kind.UNBALANCED_PARENS));
        assertThat(exception.position(), is(position));
        assertThat(exception.text(), is(")"));
    }

    @Test
    public void testTokenAccessors() {
        assertThat(Token.terminal(5).terminalId(), is(5));
        assertThat(Token.gate(Gate.OR).gate(), is(Gate.OR));
        assertThrows(IllegalStateException.class, () -> Token.openParen().terminalId());
        assertThrows(IllegalStateException.class, () -> Token.terminal(1).gate());
    }
}
