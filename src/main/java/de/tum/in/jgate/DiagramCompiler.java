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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Translates {@link Expression expressions} into decision diagrams. Every distinct terminal id
 * becomes exactly one diagram variable, and equivalent sub-functions share a single node.
 */
public final class DiagramCompiler {
    private static final Logger logger = Logger.getLogger(DiagramCompiler.class.getName());

    private DiagramCompiler() {}

    public static CompiledPolicy compile(String source) throws ParseException {
        return compile(Parser.parse(source));
    }

    public static CompiledPolicy compile(Expression expression) {
        return compile(expression, DiagramFactory.buildDiagram());
    }

    public static CompiledPolicy compile(Expression expression, DiagramConfiguration configuration) {
        return compile(expression, DiagramFactory.buildDiagram(configuration));
    }

    private static CompiledPolicy compile(Expression expression, DecisionDiagram diagram) {
        int root = compileInto(diagram, expression);
        logger.log(Level.FINE, "Compiled expression of depth {0} into {1} nodes over {2} variables", new Object[] {
            expression.depth(), diagram.nodeCount(), diagram.numberOfVariables()
        });
        return new CompiledPolicy(diagram, root);
    }

    /**
     * Builds the given {@code expression} in an existing {@code diagram}. Expressions compiled into
     * the same diagram are represented by the same node iff they are logically equivalent.
     *
     * <p>Terminals unknown to the diagram are registered in reverse order of their first occurrence.
     * The last operand of a left-to-right chain then is tested first, so every step of the chain adds
     * a constant number of nodes. The expression is traversed without recursion, chains may be
     * arbitrarily long.</p>
     *
     * <p>Callers must not compile into a diagram which already backs an {@link Evaluator}, since new
     * terminals would not be covered by its requirements.</p>
     *
     * @return The node representing the expression.
     */
    static int compileInto(DecisionDiagram diagram, Expression expression) {
        List<Integer> terminals = new ArrayList<>(terminalsInOrder(expression));
        for (int i = terminals.size() - 1; i >= 0; i--) {
            diagram.variable(terminals.get(i));
        }

        Deque<Frame> frames = new ArrayDeque<>();
        Deque<Integer> nodes = new ArrayDeque<>();
        frames.push(new Frame(expression));
        while (!frames.isEmpty()) {
            Frame frame = frames.peek();
            if (frame.expression instanceof Expression.Terminal) {
                frames.pop();
                nodes.push(diagram.variable(((Expression.Terminal) frame.expression).terminalId()));
                continue;
            }

            Expression.Operation operation = (Expression.Operation) frame.expression;
            if (!frame.expanded) {
                frame.expanded = true;
                List<Expression> operands = operation.operands();
                for (int i = operands.size() - 1; i >= 0; i--) {
                    frames.push(new Frame(operands.get(i)));
                }
                continue;
            }

            frames.pop();
            if (operation.gate() == Gate.NOT) {
                nodes.push(diagram.not(nodes.pop()));
            } else {
                int right = nodes.pop();
                int left = nodes.pop();
                nodes.push(apply(diagram, operation.gate(), left, right));
            }
        }
        assert nodes.size() == 1;
        return nodes.pop();
    }

    private static int apply(DecisionDiagram diagram, Gate gate, int left, int right) {
        switch (gate) {
            case AND:
                return diagram.and(left, right);
            case OR:
                return diagram.or(left, right);
            case XOR:
                return diagram.xor(left, right);
            case NAND:
                return diagram.not(diagram.and(left, right));
            case NOR:
                return diagram.not(diagram.or(left, right));
            default:
                throw new AssertionError(gate);
        }
    }

    /* Terminals in order of their first occurrence in the source, left to right. */
    private static Set<Integer> terminalsInOrder(Expression expression) {
        Set<Integer> terminals = new LinkedHashSet<>();
        Deque<Expression> pending = new ArrayDeque<>();
        pending.push(expression);
        while (!pending.isEmpty()) {
            Expression current = pending.pop();
            if (current instanceof Expression.Terminal) {
                terminals.add(((Expression.Terminal) current).terminalId());
            } else {
                List<Expression> operands = ((Expression.Operation) current).operands();
                for (int i = operands.size() - 1; i >= 0; i--) {
                    pending.push(operands.get(i));
                }
            }
        }
        return terminals;
    }

    private static final class Frame {
        final Expression expression;
        boolean expanded = false;

        Frame(Expression expression) {
            this.expression = expression;
        }
    }
}
