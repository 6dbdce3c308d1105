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

import com.google.common.util.concurrent.ListenableFuture;

/**
 * Resolves the value of one terminal, for example by verifying a signature or querying a balance.
 *
 * <p>Checks may be slow; implementations should return immediately and complete the future once the
 * outcome is known, failing it if the outcome cannot be determined. The querier is an opaque,
 * requirement-defined context (e.g. a shared network client) which the {@link Evaluator} passes
 * through unchanged. Retrying failed lookups is up to the implementation.</p>
 *
 * <p>The returned future may be shared between calls, for example to deduplicate lookups. The
 * evaluator never cancels it.</p>
 *
 * @param <Q> The type of the querier.
 * @see Requirements
 */
@FunctionalInterface
public interface Requirement<Q> {
    ListenableFuture<Boolean> check(Q querier);
}
