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

public final class SolverFactory {
    private SolverFactory() {}

    public static QbfSolver buildSolver() {
        return buildSolver(ImmutableSolverConfiguration.builder().build());
    }

    public static QbfSolver buildSolver(SolverConfiguration configuration) {
        return configuration.parallel() ? buildParallelSolver(configuration) : buildRecursiveSolver(configuration);
    }

    public static QbfSolver buildRecursiveSolver(SolverConfiguration configuration) {
        return new RecursiveSolver(configuration);
    }

    public static QbfSolver buildParallelSolver(SolverConfiguration configuration) {
        return new ParallelSolver(configuration);
    }
}
