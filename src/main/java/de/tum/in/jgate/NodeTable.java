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

import java.util.Arrays;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Append-only unique table for decision diagram nodes. Each node carries a level (the position of
 * its variable in the variable order); subclasses store the successors and decide when two nodes are
 * identical. Nodes are never freed, hence a node index stays valid for the life of the table.
 */
abstract class NodeTable implements DecisionDiagram {
    private static final Logger logger = Logger.getLogger(NodeTable.class.getName());

    // Use 0 as "not a node" so that freshly allocated chain arrays are empty
    protected static final int NOT_A_NODE = 0;
    protected static final int FIRST_NODE = 1;
    private static final int INVALID_LEVEL = -1;

    private static final int MINIMUM_NODE_TABLE_SIZE = MathUtil.nextPrime(128);
    private static final int MAXIMAL_NODE_COUNT = Integer.MAX_VALUE / 2 - 8;

    private final double growthFactor;

    /* Level of each node, INVALID_LEVEL for unused slots. */
    private int[] levels;

    /* Hash buckets pointing to the first node of their chain, and for each node the next node in its
     * chain. Chains end with NOT_A_NODE. */
    private int[] hashToChainStart;
    private int[] hashChain;

    /* Nodes are allocated sequentially, every index below this one is a valid node. */
    private int nextFreeNode = FIRST_NODE;

    // Statistics
    private long nodeRequests = 0;
    private long hashChainLookups = 0;
    private long hashChainLookupLength = 0;
    private long hashChainLookupHit = 0;
    private long growCount = 0;

    NodeTable(int initialSize, double growthFactor) {
        this.growthFactor = growthFactor;
        int tableSize = Math.max(MathUtil.nextPrime(initialSize), MINIMUM_NODE_TABLE_SIZE);

        levels = new int[tableSize];
        hashToChainStart = new int[tableSize];
        hashChain = new int[tableSize];
        Arrays.fill(levels, INVALID_LEVEL);
    }

    final int tableSize() {
        return levels.length;
    }

    final int levelOf(int node) {
        assert isNodeValidOrLeaf(node);
        return isLeaf(node) ? INVALID_LEVEL : levels[node];
    }

    boolean isNodeValid(int node) {
        return FIRST_NODE <= node && node < nextFreeNode;
    }

    /**
     * Determines if the given {@code node} is either a leaf or valid. Most operations require that
     * this is the case.
     */
    @Override
    public boolean isNodeValidOrLeaf(int node) {
        return isLeaf(node) || isNodeValid(node);
    }

    @Override
    public int nodeCount() {
        return nextFreeNode - FIRST_NODE;
    }

    protected abstract boolean checkLookupChildrenMatch(int lookup);

    protected abstract int hashCode(int node, int level);

    protected abstract void onTableResize(int newSize);

    protected abstract int lowUnchecked(int node);

    protected abstract int highUnchecked(int node);

    /**
     * Returns the node with the given {@code level} whose children match the ones currently
     * prepared by the subclass (see {@link #checkLookupChildrenMatch(int)}), creating it if
     * necessary. The caller writes the children of a newly created node.
     */
    protected int findOrCreateNode(int level, int hashCode) {
        nodeRequests += 1;

        int currentLookupNode = hashToChainStart[MathUtil.mod(hashCode, tableSize())];
        int chainLookups = 1;
        hashChainLookups += 1;
        while (currentLookupNode != NOT_A_NODE) {
            if (levels[currentLookupNode] == level && checkLookupChildrenMatch(currentLookupNode)) {
                hashChainLookupLength += chainLookups;
                hashChainLookupHit += 1;
                return currentLookupNode;
            }
            currentLookupNode = hashChain[currentLookupNode];
            chainLookups += 1;
        }
        hashChainLookupLength += chainLookups;

        if (nextFreeNode == tableSize()) {
            grow();
        }

        int freeNode = nextFreeNode;
        nextFreeNode += 1;
        levels[freeNode] = level;
        connectHashList(freeNode, hashCode);
        return freeNode;
    }

    private void connectHashList(int node, int hashCode) {
        int bucket = MathUtil.mod(hashCode, tableSize());
        hashChain[node] = hashToChainStart[bucket];
        hashToChainStart[bucket] = node;
    }

    private void grow() {
        int oldSize = tableSize();
        if (oldSize >= MAXIMAL_NODE_COUNT) {
            throw new IllegalStateException("Node table exhausted at " + oldSize + " nodes");
        }
        growCount += 1;
        @SuppressWarnings("NumericCastThatLosesPrecision")
        int newSize = Math.min(MAXIMAL_NODE_COUNT, MathUtil.nextPrime((int) Math.ceil(oldSize * growthFactor)));
        assert oldSize < newSize : "Got new size " + newSize + " with old size " + oldSize;
        logger.log(Level.FINE, "Growing the table of {0} from {1} to {2}", new Object[] {this, oldSize, newSize});

        onTableResize(newSize);
        levels = Arrays.copyOf(levels, newSize);
        Arrays.fill(levels, oldSize, newSize, INVALID_LEVEL);
        hashChain = new int[newSize];
        hashToChainStart = new int[newSize];

        // Bucket positions depend on the table size, re-insert every node
        for (int node = FIRST_NODE; node < nextFreeNode; node++) {
            connectHashList(node, hashCode(node, levels[node]));
        }
        assert check();
    }

    /**
     * Checks the table invariants: every node is reachable through its hash chain, children are leaves
     * or valid nodes on a strictly larger level, and no two nodes are identical.
     *
     * @return {@code true}, so that the call can be wrapped in an {@code assert}.
     * @throws IllegalStateException if an invariant is violated.
     */
    boolean check() {
        for (int node = FIRST_NODE; node < nextFreeNode; node++) {
            int level = levels[node];
            int low = lowUnchecked(node);
            int high = highUnchecked(node);
            checkState(level >= 0, "Node %d has invalid level %d", node, level);
            checkState(low != high, "Node %d has identical children %d", node, low);
            checkState(isNodeValidOrLeaf(low) && isNodeValidOrLeaf(high), "Node %d has invalid children", node);
            checkState(isLeaf(low) || levels[low] > level, "Node %d is not ordered w.r.t. %d", node, low);
            checkState(isLeaf(high) || levels[high] > level, "Node %d is not ordered w.r.t. %d", node, high);

            boolean found = false;
            int chainNode = hashToChainStart[MathUtil.mod(hashCode(node, level), tableSize())];
            while (chainNode != NOT_A_NODE) {
                if (chainNode == node) {
                    found = true;
                } else if (levels[chainNode] == level
                        && lowUnchecked(chainNode) == low
                        && highUnchecked(chainNode) == high) {
                    throw new IllegalStateException(String.format("Nodes %d and %d are identical", node, chainNode));
                }
                chainNode = hashChain[chainNode];
            }
            checkState(found, "Node %d is not in its hash chain", node);
        }
        return true;
    }

    private static void checkState(boolean state, String formatString, Object... format) {
        if (!state) {
            throw new IllegalStateException(String.format(formatString, format));
        }
    }

    String getStatistics() {
        float averageLookupLength = (float) hashChainLookupLength / (float) Math.max(hashChainLookups, 1L);
        return String.format(
                "Node table: size=%d, nodes=%d, requests=%d, grown %d times%n"
                        + "Hash lookups: %d, hits: %d, average chain length: %3.3f",
                tableSize(),
                nodeCount(),
                nodeRequests,
                growCount,
                hashChainLookups,
                hashChainLookupHit,
                averageLookupLength);
    }
}
