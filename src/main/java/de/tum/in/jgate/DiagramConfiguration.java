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
import org.immutables.value.Value;

@SuppressWarnings("MethodReturnAlwaysConstant")
@Value.Immutable
public abstract class DiagramConfiguration {
    public static final int DEFAULT_INITIAL_SIZE = 1024;
    public static final int DEFAULT_CACHE_BINARY_DIVIDER = 8;
    public static final int DEFAULT_CACHE_NEGATION_DIVIDER = 16;
    public static final double DEFAULT_NODE_TABLE_GROWTH_FACTOR = 1.5d;

    @Value.Default
    public int initialSize() {
        return DEFAULT_INITIAL_SIZE;
    }

    @Value.Default
    public double growthFactor() {
        return DEFAULT_NODE_TABLE_GROWTH_FACTOR;
    }

    @Value.Default
    public int cacheBinaryDivider() {
        return DEFAULT_CACHE_BINARY_DIVIDER;
    }

    @Value.Default
    public int cacheNegationDivider() {
        return DEFAULT_CACHE_NEGATION_DIVIDER;
    }

    @Value.Check
    protected void check() {
        Preconditions.checkState(initialSize() > 0, "Initial size must be positive");
        Preconditions.checkState(growthFactor() > 1.0d, "Growth factor must be larger than 1");
        Preconditions.checkState(
                cacheBinaryDivider() > 0 && cacheNegationDivider() > 0, "Cache dividers must be positive");
    }
}
