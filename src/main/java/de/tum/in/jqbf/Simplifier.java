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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Truth-preserving reductions of a formula, applied until none of them changes it any more:
 * <ul>
 *   <li>removal of tautological clauses,</li>
 *   <li>universal reduction, i.e. removal of universal literals nested deeper than every existential
 *     literal of the same clause,</li>
 *   <li>unit propagation of existential literals.</li>
 * </ul>
 * A clause whose only remaining literals are universal thus becomes empty, which the
 * {@link QbfSolver} treats as a conflict.
 */
public final class Simplifier {
    private static final Logger logger = Logger.getLogger(Simplifier.class.getName());

    private final SolverConfiguration configuration;
    private final SolverStatistics statistics;

    public Simplifier(SolverConfiguration configuration) {
        this(configuration, new SolverStatistics());
    }

    Simplifier(SolverConfiguration configuration, SolverStatistics statistics) {
        this.configuration = configuration;
        this.statistics = statistics;
    }

    public Simplification simplify(Formula formula) {
        Map<Integer, Boolean> forced = new LinkedHashMap<>();
        Formula current = formula;
        int round = 0;
        while (true) {
            round += 1;
            current = reduceClauses(current);
            if (current.hasEmptyClause()) {
                break;
            }
            int unit = configuration.unitPropagation() ? findExistentialUnit(current) : 0;
            if (unit == 0) {
                break;
            }
            int variable = Math.abs(unit);
            forced.put(variable, unit > 0);
            statistics.onUnitPropagation();
            current = current.restrict(variable, unit > 0);
        }
        if (round > 1 && logger.isLoggable(Level.FINER)) {
            logger.log(Level.FINER, "Simplification reached fixpoint after {0} rounds, forced {1}",
                    new Object[] {round, forced});
        }
        return new Simplification(current, forced);
    }

    /**
     * Drops tautologies and applies universal reduction to every clause. Returns {@code formula}
     * itself if no clause changed.
     */
    private Formula reduceClauses(Formula formula) {
        QuantifierPrefix prefix = formula.prefix();
        List<Clause> reduced = new ArrayList<>(formula.numberOfClauses());
        boolean changed = false;
        for (Clause clause : formula.clauses()) {
            if (clause.isTautology()) {
                statistics.onTautology();
                changed = true;
                continue;
            }
            Clause result = configuration.universalReduction() ? universalReduction(prefix, clause) : clause;
            if (result != clause) {
                statistics.onUniversalReduction(clause.size() - result.size());
                changed = true;
            }
            reduced.add(result);
        }
        return changed ? formula.withClauses(reduced) : formula;
    }

    static Clause universalReduction(QuantifierPrefix prefix, Clause clause) {
        int maximalExistentialRank = -1;
        for (int i = 0; i < clause.size(); i++) {
            int variable = Math.abs(clause.literal(i));
            if (prefix.isExistential(variable)) {
                maximalExistentialRank = Math.max(maximalExistentialRank, prefix.rank(variable));
            }
        }
        int bound = maximalExistentialRank;
        return clause.retain(literal -> {
            int variable = Math.abs(literal);
            return prefix.isExistential(variable) || prefix.rank(variable) < bound;
        });
    }

    /**
     * Returns the literal of the first unit clause over an existential variable, or 0 if there is none.
     */
    private static int findExistentialUnit(Formula formula) {
        for (Clause clause : formula.clauses()) {
            if (clause.isUnit() && formula.prefix().isExistential(Math.abs(clause.literal(0)))) {
                return clause.literal(0);
            }
        }
        return 0;
    }
}
