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

import java.util.concurrent.atomic.LongAdder;

/**
 * Counters collected while deciding formulas. Safe to update from several threads.
 */
public final class SolverStatistics {
    private final LongAdder decisions = new LongAdder();
    private final LongAdder unitPropagations = new LongAdder();
    private final LongAdder universalReductions = new LongAdder();
    private final LongAdder tautologies = new LongAdder();
    private final LongAdder conflicts = new LongAdder();
    private final LongAdder skippedBranches = new LongAdder();
    private final LongAdder cancelledBranches = new LongAdder();

    void onDecision() {
        decisions.increment();
    }

    void onUnitPropagation() {
        unitPropagations.increment();
    }

    void onUniversalReduction(int literals) {
        universalReductions.add(literals);
    }

    void onTautology() {
        tautologies.increment();
    }

    void onConflict() {
        conflicts.increment();
    }

    void onSkippedBranch() {
        skippedBranches.increment();
    }

    void onCancelledBranch() {
        cancelledBranches.increment();
    }

    public long decisions() {
        return decisions.sum();
    }

    public long unitPropagations() {
        return unitPropagations.sum();
    }

    public long universalReductions() {
        return universalReductions.sum();
    }

    public long tautologies() {
        return tautologies.sum();
    }

    public long conflicts() {
        return conflicts.sum();
    }

    public long skippedBranches() {
        return skippedBranches.sum();
    }

    public long cancelledBranches() {
        return cancelledBranches.sum();
    }

    @Override
    public String toString() {
        return String.format("Decisions: %d, conflicts: %d, unit propagations: %d, "
                        + "universally reduced literals: %d, tautologies: %d, "
                        + "skipped branches: %d, cancelled branches: %d",
                decisions(), conflicts(), unitPropagations(), universalReductions(), tautologies(),
                skippedBranches(), cancelledBranches());
    }
}
