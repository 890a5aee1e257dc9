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
 * Decides the truth of quantified boolean formulas.
 *
 * <p>Implementations are obtained through {@link SolverFactory}. Deciding is a pure function of the
 * given formula; a solver only keeps statistics between calls. Solvers may own threads and should be
 * closed after use.</p>
 */
public interface QbfSolver extends AutoCloseable {
    /**
     * Decides whether {@code formula} is true. The returned assignment contains values for
     * existential variables which were fixed before any universal variable was branched on.
     *
     * @param formula
     *     The formula to decide.
     *
     * @return The verdict together with the existential choices leading to it.
     */
    Decision decide(Formula formula);

    /**
     * Decides {@code formula} and restricts the witness to the outermost existential variables, see
     * {@link Result#assemble(Formula, Decision)}.
     */
    default Result solve(Formula formula) {
        return Result.assemble(formula, decide(formula));
    }

    SolverConfiguration configuration();

    SolverStatistics statistics();

    @Override
    void close();
}
