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
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;
import org.immutables.value.Value;

@Value.Immutable
public abstract class EvaluatorConfiguration {
    /**
     * Time each requirement check may take. A check which does not complete in time fails the
     * evaluation with a {@link java.util.concurrent.TimeoutException} as cause. Requires a
     * {@link #scheduler()}.
     */
    public abstract Optional<Duration> timeout();

    /**
     * Executor used to enforce the {@link #timeout()}.
     */
    public abstract Optional<ScheduledExecutorService> scheduler();

    /**
     * Whether the evaluation releases the checks which are still pending as soon as one check fails,
     * cancelling their timeouts. Otherwise, their outcome is awaited and ignored. The futures returned
     * by the requirements are not cancelled in either case.
     */
    @Value.Default
    public boolean cancelPendingOnFailure() {
        return true;
    }

    @Value.Check
    protected void check() {
        timeout().ifPresent(timeout -> {
            Preconditions.checkState(!timeout.isNegative() && !timeout.isZero(), "Timeout must be positive");
            Preconditions.checkState(scheduler().isPresent(), "A timeout requires a scheduler");
        });
    }
}
