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

import com.google.common.math.LongMath;

final class MathUtil {
    private MathUtil() {}

    static int nextPrime(int value) {
        int candidate = Math.max(3, value | 1);
        while (!LongMath.isPrime(candidate)) {
            candidate += 2;
        }
        return candidate;
    }

    static int mod(int value, int modulus) {
        int remainder = value % modulus;
        return remainder < 0 ? remainder + modulus : remainder;
    }
}
