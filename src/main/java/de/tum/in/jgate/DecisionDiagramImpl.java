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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedSet;
import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.function.IntPredicate;

/* Implementation notes:
 * - and, or and xor are practically copies of each other except for the terminal cases, as the
 *   structure of the apply algorithm is the same for all of them.
 * - Levels increase while descending the diagram; a new variable always gets the largest level.
 * - Nothing is ever freed, so the operations do not need to protect intermediate results.
 */
@SuppressWarnings({"PMD.AvoidReassigningParameters", "AssignmentToMethodParameter"})
final class DecisionDiagramImpl extends NodeTable {
    private static final int TRUE_NODE = -1;
    private static final int FALSE_NODE = -2;

    private final OperationCache cache;
    private final Map<Integer, Integer> variableNodeByLabel = new HashMap<>();
    private int[] labels = new int[16];
    private int numberOfVariables = 0;

    /* Low and high successors of each node */
    private int[] tree;

    private int hashLookupLow = NOT_A_NODE;
    private int hashLookupHigh = NOT_A_NODE;

    DecisionDiagramImpl(DiagramConfiguration configuration) {
        super(configuration.initialSize(), configuration.growthFactor());
        tree = new int[2 * tableSize()];
        cache = new OperationCache(this, configuration);
    }

    // Nodes

    @Override
    protected boolean checkLookupChildrenMatch(int lookup) {
        int[] tree = this.tree;
        return tree[2 * lookup] == hashLookupLow && tree[2 * lookup + 1] == hashLookupHigh;
    }

    private int makeNode(int level, int low, int high) {
        assert 0 <= level && level < numberOfVariables;
        assert isLeaf(low) || level < levelOf(low);
        assert isLeaf(high) || level < levelOf(high);

        if (low == high) {
            return low;
        }

        hashLookupLow = low;
        hashLookupHigh = high;
        int node = findOrCreateNode(level, hashCode(level, low, high));
        tree[2 * node] = low;
        tree[2 * node + 1] = high;
        return node;
    }

    @Override
    public int low(int node) {
        Preconditions.checkArgument(isNodeValid(node), "Invalid node %s", node);
        return tree[2 * node];
    }

    @Override
    public int high(int node) {
        Preconditions.checkArgument(isNodeValid(node), "Invalid node %s", node);
        return tree[2 * node + 1];
    }

    @Override
    protected int lowUnchecked(int node) {
        return tree[2 * node];
    }

    @Override
    protected int highUnchecked(int node) {
        return tree[2 * node + 1];
    }

    @Override
    public boolean isLeaf(int node) {
        return node == TRUE_NODE || node == FALSE_NODE;
    }

    @Override
    public int labelOf(int node) {
        Preconditions.checkArgument(isNodeValidOrLeaf(node), "Invalid node %s", node);
        return isLeaf(node) ? -1 : labels[levelOf(node)];
    }

    // Variables and base nodes

    @Override
    public int trueNode() {
        return TRUE_NODE;
    }

    @Override
    public int falseNode() {
        return FALSE_NODE;
    }

    @Override
    public int variable(int terminalId) {
        Preconditions.checkArgument(terminalId >= 0, "Negative terminal id %s", terminalId);
        Integer existing = variableNodeByLabel.get(terminalId);
        if (existing != null) {
            return existing;
        }

        int level = numberOfVariables;
        if (level == labels.length) {
            labels = Arrays.copyOf(labels, labels.length * 2);
        }
        labels[level] = terminalId;
        numberOfVariables++;

        int variableNode = makeNode(level, FALSE_NODE, TRUE_NODE);
        variableNodeByLabel.put(terminalId, variableNode);
        return variableNode;
    }

    @Override
    public boolean hasVariable(int terminalId) {
        return variableNodeByLabel.containsKey(terminalId);
    }

    @Override
    public int numberOfVariables() {
        return numberOfVariables;
    }

    @Override
    public Set<Integer> variables() {
        return ImmutableSortedSet.copyOf(variableNodeByLabel.keySet());
    }

    // Reading

    @Override
    public boolean evaluate(int node, IntPredicate assignment) {
        Preconditions.checkArgument(isNodeValidOrLeaf(node), "Invalid node %s", node);
        int[] tree = this.tree;
        int current = node;
        while (current >= FIRST_NODE) {
            current = assignment.test(labels[levelOf(current)]) ? tree[2 * current + 1] : tree[2 * current];
        }
        assert isLeaf(current);
        return current == TRUE_NODE;
    }

    @Override
    public Set<Integer> support(int node) {
        Preconditions.checkArgument(isNodeValidOrLeaf(node), "Invalid node %s", node);
        BitSet visited = new BitSet(nodeCount() + FIRST_NODE);
        ImmutableSortedSet.Builder<Integer> support = ImmutableSortedSet.naturalOrder();
        Deque<Integer> stack = new ArrayDeque<>();
        stack.push(node);
        while (!stack.isEmpty()) {
            int current = stack.pop();
            if (isLeaf(current) || visited.get(current)) {
                continue;
            }
            visited.set(current);
            support.add(labels[levelOf(current)]);
            stack.push(tree[2 * current]);
            stack.push(tree[2 * current + 1]);
        }
        return support.build();
    }

    @Override
    public Map<Integer, Boolean> getSatisfyingAssignment(int node) {
        Preconditions.checkArgument(isNodeValidOrLeaf(node), "Invalid node %s", node);
        if (node == FALSE_NODE) {
            throw new NoSuchElementException("False has no satisfying assignment");
        }
        // In a reduced diagram, every node other than false has a path to true
        ImmutableMap.Builder<Integer, Boolean> assignment = ImmutableMap.builder();
        int current = node;
        while (!isLeaf(current)) {
            int label = labels[levelOf(current)];
            int low = tree[2 * current];
            if (low == FALSE_NODE) {
                assignment.put(label, true);
                current = tree[2 * current + 1];
            } else {
                assignment.put(label, false);
                current = low;
            }
        }
        assert current == TRUE_NODE;
        return assignment.build();
    }

    @Override
    public BigInteger countSatisfyingAssignments(int node) {
        Preconditions.checkArgument(isNodeValidOrLeaf(node), "Invalid node %s", node);
        BigInteger count = countSatisfyingAssignmentsRecursive(node, new HashMap<>());
        return count.shiftLeft(levelOrEnd(node));
    }

    /* Counts the assignments of the variables on levels levelOf(node) and below. */
    private BigInteger countSatisfyingAssignmentsRecursive(int node, Map<Integer, BigInteger> memo) {
        if (node == FALSE_NODE) {
            return BigInteger.ZERO;
        }
        if (node == TRUE_NODE) {
            return BigInteger.ONE;
        }
        BigInteger cached = memo.get(node);
        if (cached != null) {
            return cached;
        }
        int level = levelOf(node);
        int low = tree[2 * node];
        int high = tree[2 * node + 1];
        BigInteger lowCount = countSatisfyingAssignmentsRecursive(low, memo).shiftLeft(levelOrEnd(low) - level - 1);
        BigInteger highCount =
                countSatisfyingAssignmentsRecursive(high, memo).shiftLeft(levelOrEnd(high) - level - 1);
        BigInteger result = lowCount.add(highCount);
        memo.put(node, result);
        return result;
    }

    private int levelOrEnd(int node) {
        return isLeaf(node) ? numberOfVariables : levelOf(node);
    }

    // Operations

    @Override
    public int and(int node1, int node2) {
        Preconditions.checkArgument(isNodeValidOrLeaf(node1) && isNodeValidOrLeaf(node2));
        return andRecursive(node1, node2);
    }

    private int andRecursive(int node1, int node2) {
        if (node1 == node2 || node2 == TRUE_NODE) {
            return node1;
        }
        if (node1 == FALSE_NODE || node2 == FALSE_NODE) {
            return FALSE_NODE;
        }
        if (node1 == TRUE_NODE) {
            return node2;
        }

        int node1level = levelOf(node1);
        int node2level = levelOf(node2);

        if (node2level < node1level || (node2level == node1level && node2 < node1)) {
            int nodeSwap = node1;
            node1 = node2;
            node2 = nodeSwap;

            int levelSwap = node1level;
            node1level = node2level;
            node2level = levelSwap;
        }

        if (cache.lookupBinary(OperationCache.OPERATION_AND, node1, node2)) {
            return cache.lookupResult();
        }
        int hash = cache.lookupHash();
        int lowNode;
        int highNode;
        if (node1level == node2level) {
            lowNode = andRecursive(low(node1), low(node2));
            highNode = andRecursive(high(node1), high(node2));
        } else { // node1level < node2level
            lowNode = andRecursive(low(node1), node2);
            highNode = andRecursive(high(node1), node2);
        }
        int resultNode = makeNode(node1level, lowNode, highNode);
        cache.putBinary(OperationCache.OPERATION_AND, hash, node1, node2, resultNode);
        return resultNode;
    }

    @Override
    public int or(int node1, int node2) {
        Preconditions.checkArgument(isNodeValidOrLeaf(node1) && isNodeValidOrLeaf(node2));
        return orRecursive(node1, node2);
    }

    private int orRecursive(int node1, int node2) {
        if (node1 == node2 || node2 == FALSE_NODE) {
            return node1;
        }
        if (node1 == TRUE_NODE || node2 == TRUE_NODE) {
            return TRUE_NODE;
        }
        if (node1 == FALSE_NODE) {
            return node2;
        }

        int node1level = levelOf(node1);
        int node2level = levelOf(node2);

        if (node2level < node1level || (node2level == node1level && node2 < node1)) {
            int nodeSwap = node1;
            node1 = node2;
            node2 = nodeSwap;

            int levelSwap = node1level;
            node1level = node2level;
            node2level = levelSwap;
        }

        if (cache.lookupBinary(OperationCache.OPERATION_OR, node1, node2)) {
            return cache.lookupResult();
        }
        int hash = cache.lookupHash();
        int lowNode;
        int highNode;
        if (node1level == node2level) {
            lowNode = orRecursive(low(node1), low(node2));
            highNode = orRecursive(high(node1), high(node2));
        } else { // node1level < node2level
            lowNode = orRecursive(low(node1), node2);
            highNode = orRecursive(high(node1), node2);
        }
        int resultNode = makeNode(node1level, lowNode, highNode);
        cache.putBinary(OperationCache.OPERATION_OR, hash, node1, node2, resultNode);
        return resultNode;
    }

    @Override
    public int xor(int node1, int node2) {
        Preconditions.checkArgument(isNodeValidOrLeaf(node1) && isNodeValidOrLeaf(node2));
        return xorRecursive(node1, node2);
    }

    private int xorRecursive(int node1, int node2) {
        if (node1 == node2) {
            return FALSE_NODE;
        }
        if (node1 == FALSE_NODE) {
            return node2;
        }
        if (node2 == FALSE_NODE) {
            return node1;
        }
        if (node1 == TRUE_NODE) {
            return notRecursive(node2);
        }
        if (node2 == TRUE_NODE) {
            return notRecursive(node1);
        }

        int node1level = levelOf(node1);
        int node2level = levelOf(node2);

        if (node2level < node1level || (node2level == node1level && node2 < node1)) {
            int nodeSwap = node1;
            node1 = node2;
            node2 = nodeSwap;

            int levelSwap = node1level;
            node1level = node2level;
            node2level = levelSwap;
        }

        if (cache.lookupBinary(OperationCache.OPERATION_XOR, node1, node2)) {
            return cache.lookupResult();
        }
        int hash = cache.lookupHash();
        int lowNode;
        int highNode;
        if (node1level == node2level) {
            lowNode = xorRecursive(low(node1), low(node2));
            highNode = xorRecursive(high(node1), high(node2));
        } else { // node1level < node2level
            lowNode = xorRecursive(low(node1), node2);
            highNode = xorRecursive(high(node1), node2);
        }
        int resultNode = makeNode(node1level, lowNode, highNode);
        cache.putBinary(OperationCache.OPERATION_XOR, hash, node1, node2, resultNode);
        return resultNode;
    }

    @Override
    public int not(int node) {
        Preconditions.checkArgument(isNodeValidOrLeaf(node), "Invalid node %s", node);
        return notRecursive(node);
    }

    private int notRecursive(int node) {
        if (node == FALSE_NODE) {
            return TRUE_NODE;
        }
        if (node == TRUE_NODE) {
            return FALSE_NODE;
        }

        if (cache.lookupNot(node)) {
            return cache.lookupResult();
        }
        int hash = cache.lookupHash();

        int lowNode = notRecursive(low(node));
        int highNode = notRecursive(high(node));
        int resultNode = makeNode(levelOf(node), lowNode, highNode);
        cache.putNot(hash, node, resultNode);
        return resultNode;
    }

    // Table management

    @Override
    protected void onTableResize(int newSize) {
        tree = Arrays.copyOf(tree, 2 * newSize);
        cache.reallocate(newSize);
    }

    @Override
    protected int hashCode(int node, int level) {
        return hashCode(level, tree[2 * node], tree[2 * node + 1]);
    }

    private static int hashCode(int level, int low, int high) {
        return HashUtil.hash(level, low, high);
    }

    // Statistics and Formatting

    @Override
    public String toString() {
        return String.format("Diagram@%d(%d)", tableSize(), System.identityHashCode(this));
    }

    @Override
    public String statistics() {
        return String.format(
                "Variables: %d%n%s%n%s", numberOfVariables, getStatistics(), cache.getStatistics());
    }
}
