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

import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import java.util.concurrent.Executor;
import java.util.function.Predicate;

/**
 * Factories for simple {@link Requirement requirements}.
 */
public final class Requirements {
    private static final ListenableFuture<Boolean> TRUE = Futures.immediateFuture(Boolean.TRUE);
    private static final ListenableFuture<Boolean> FALSE = Futures.immediateFuture(Boolean.FALSE);

    private Requirements() {}

    /**
     * Returns a requirement which is always satisfied or never satisfied, regardless of the querier.
     */
    public static <Q> Requirement<Q> constant(boolean value) {
        ListenableFuture<Boolean> result = value ? TRUE : FALSE;
        return querier -> result;
    }

    /**
     * Returns a requirement which evaluates the {@code predicate} on the calling thread. Exceptions
     * thrown by the predicate fail the check.
     */
    public static <Q> Requirement<Q> of(Predicate<? super Q> predicate) {
        return querier -> {
            try {
                return Futures.immediateFuture(predicate.test(querier));
            } catch (RuntimeException e) {
                return Futures.immediateFailedFuture(e);
            }
        };
    }

    /**
     * Returns a requirement which evaluates the {@code predicate} on the given {@code executor}.
     */
    public static <Q> Requirement<Q> async(Predicate<? super Q> predicate, Executor executor) {
        return querier -> Futures.submit(() -> predicate.test(querier), executor);
    }
}
