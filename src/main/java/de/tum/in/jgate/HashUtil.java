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

final class HashUtil {
    // Cheap mixing; the node and cache tables reduce the result modulo a prime anyway
    static final int PRIME = 0x1000193;

    private HashUtil() {}

    static int hash(int key) {
        return key * PRIME;
    }

    static int hash(int firstKey, int secondKey, int thirdKey) {
        return ((firstKey * PRIME) ^ secondKey) * PRIME + thirdKey;
    }

    static int hash(byte operation, int firstKey, int secondKey) {
        return hash((int) operation, firstKey, secondKey);
    }
}
