/*
 * This file is part of JQBF.
 * Copyright (c) 2023 Tobias Meggendorfer.
 *
 * JQBF is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, version 3.
 *
 * JQBF is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU
 * General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with JQBF. If not, see <http://www.gnu.org/licenses/>.
 */
package de.tum.in.jqbf;

import org.immutables.value.Value;

@SuppressWarnings("MethodReturnAlwaysConstant")
@Value.Immutable
public abstract class SolverConfiguration {
    public static final int DEFAULT_SEQUENTIAL_CUTOFF = 8;

    @Value.Default
    public boolean unitPropagation() {
        return true;
    }

    @Value.Default
    public boolean universalReduction() {
        return true;
    }

    /**
     * If the branching variable does not occur in the matrix, both of its restrictions are equal and
     * only one of them needs to be decided.
     */
    @Value.Default
    public boolean skipVacuousBranches() {
        return true;
    }

    @Value.Default
    public boolean parallel() {
        return false;
    }

    @Value.Default
    public int parallelism() {
        return Runtime.getRuntime().availableProcessors();
    }

    /**
     * Formulas with at most this many quantified variables are decided sequentially in parallel mode.
     */
    @Value.Default
    public int sequentialCutoff() {
        return DEFAULT_SEQUENTIAL_CUTOFF;
    }

    @Value.Default
    public boolean logStatistics() {
        return false;
    }

    @Value.Check
    protected void check() {
        if (parallelism() < 1) {
            throw new IllegalArgumentException("Parallelism must be positive, got " + parallelism());
        }
        if (sequentialCutoff() < 0) {
            throw new IllegalArgumentException("Sequential cutoff must not be negative, got " + sequentialCutoff());
        }
    }
}
