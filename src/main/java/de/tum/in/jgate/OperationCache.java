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

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Direct-mapped computed table for the diagram operations. An entry is overwritten by any later
 * result hashing to the same position. Since nodes are never freed, cached results never become
 * stale; entries are only dropped when the cache is resized together with the node table.
 */
final class OperationCache {
    private static final Logger logger = Logger.getLogger(OperationCache.class.getName());

    private static final byte NOT_AN_OPERATION = 0;
    static final byte OPERATION_AND = 1;
    static final byte OPERATION_OR = 2;
    static final byte OPERATION_XOR = 3;

    private static final int MINIMUM_KEY_COUNT = 31;

    private final NodeTable associatedDiagram;
    private final DiagramConfiguration configuration;
    private final CacheStatistics binaryStatistics = new CacheStatistics();
    private final CacheStatistics negationStatistics = new CacheStatistics();

    private int negationKeyCount;
    private int[] negationCache;

    private int binaryKeyCount;
    private byte[] binaryOperation;
    private int[] binaryCache;

    private int lookupHash = -1;
    private int lookupResult = NodeTable.NOT_A_NODE;

    OperationCache(NodeTable associatedDiagram, DiagramConfiguration configuration) {
        this.associatedDiagram = associatedDiagram;
        this.configuration = configuration;
        reallocate(associatedDiagram.tableSize());
    }

    void reallocate(int tableSize) {
        negationKeyCount = MathUtil.nextPrime(Math.max(MINIMUM_KEY_COUNT, tableSize / configuration.cacheNegationDivider()));
        negationCache = new int[2 * negationKeyCount];

        binaryKeyCount = MathUtil.nextPrime(Math.max(MINIMUM_KEY_COUNT, tableSize / configuration.cacheBinaryDivider()));
        binaryOperation = new byte[binaryKeyCount];
        binaryCache = new int[3 * binaryKeyCount];

        negationStatistics.invalidation();
        binaryStatistics.invalidation();
        logger.log(Level.FINER, "Allocated {0} negation and {1} binary cache entries", new Object[] {
            negationKeyCount, binaryKeyCount
        });
    }

    int lookupHash() {
        return lookupHash;
    }

    int lookupResult() {
        assert associatedDiagram.isNodeValidOrLeaf(lookupResult);
        return lookupResult;
    }

    boolean lookupNot(int inputNode) {
        assert associatedDiagram.isNodeValid(inputNode);

        int hash = HashUtil.hash(inputNode);
        lookupHash = hash;
        int binStart = 2 * MathUtil.mod(hash, negationKeyCount);
        if (negationCache[binStart] == inputNode) {
            lookupResult = negationCache[binStart + 1];
            negationStatistics.cacheHit();
            return true;
        }
        return false;
    }

    void putNot(int hash, int inputNode, int resultNode) {
        assert hash == HashUtil.hash(inputNode);
        assert associatedDiagram.isNodeValidOrLeaf(resultNode);

        int binStart = 2 * MathUtil.mod(hash, negationKeyCount);
        negationCache[binStart] = inputNode;
        negationCache[binStart + 1] = resultNode;
        negationStatistics.put();
    }

    /**
     * Looks up the result of the binary {@code operation}. The operations are symmetric, so callers
     * pass the inputs ordered to increase the hit rate.
     */
    boolean lookupBinary(byte operation, int inputNode1, int inputNode2) {
        assert operation != NOT_AN_OPERATION;
        assert associatedDiagram.isNodeValid(inputNode1) && associatedDiagram.isNodeValid(inputNode2);

        int hash = HashUtil.hash(operation, inputNode1, inputNode2);
        lookupHash = hash;
        int cachePosition = MathUtil.mod(hash, binaryKeyCount);
        int binStart = 3 * cachePosition;
        if (binaryCache[binStart] == inputNode1
                && binaryCache[binStart + 1] == inputNode2
                && binaryOperation[cachePosition] == operation) {
            lookupResult = binaryCache[binStart + 2];
            binaryStatistics.cacheHit();
            return true;
        }
        return false;
    }

    void putBinary(byte operation, int hash, int inputNode1, int inputNode2, int resultNode) {
        assert hash == HashUtil.hash(operation, inputNode1, inputNode2);
        assert associatedDiagram.isNodeValidOrLeaf(resultNode);

        int cachePosition = MathUtil.mod(hash, binaryKeyCount);
        int binStart = 3 * cachePosition;
        binaryOperation[cachePosition] = operation;
        binaryCache[binStart] = inputNode1;
        binaryCache[binStart + 1] = inputNode2;
        binaryCache[binStart + 2] = resultNode;
        binaryStatistics.put();
    }

    String getStatistics() {
        return String.format(
                "Negation (%d entries): %s%nBinary (%d entries): %s",
                negationKeyCount, negationStatistics, binaryKeyCount, binaryStatistics);
    }

    private static final class CacheStatistics {
        private int hitCount = 0;
        private int putCount = 0;
        private int invalidationCount = 0;

        void cacheHit() {
            hitCount++;
        }

        void put() {
            putCount++;
        }

        void invalidation() {
            invalidationCount++;
        }

        @Override
        public String toString() {
            float hitToPutRatio = (float) hitCount / (float) Math.max(putCount, 1);
            return String.format(
                    "put=%d, hit=%d, hit-to-put=%3.3f, reallocated %d times",
                    putCount, hitCount, hitToPutRatio, invalidationCount);
        }
    }
}
