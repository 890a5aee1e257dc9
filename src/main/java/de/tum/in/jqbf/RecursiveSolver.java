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

/**
 * Evaluates the restrictions of every split one after the other on the calling thread. Results,
 * including witnesses, are fully deterministic.
 */
final class RecursiveSolver extends AbstractSolver {
    RecursiveSolver(SolverConfiguration configuration) {
        super(configuration);
    }

    @Override
    protected Decision decideTopLevel(Formula formula) {
        Decision decision = decide(formula, CancellationToken.never());
        assert decision != null;
        return decision;
    }

    @Override
    public void close() {
        // Nothing to release
    }

    @Override
    public String toString() {
        return "RecursiveSolver";
    }
}
