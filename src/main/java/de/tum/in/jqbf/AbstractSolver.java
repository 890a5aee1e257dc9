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

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * The recursive quantifier elimination procedure. A formula is simplified and then split on the
 * smallest variable of its outermost quantifier block. An existential variable needs one true
 * restriction, a universal one needs both restrictions to be true. How the two restrictions of a
 * split are evaluated is left to subclasses.
 */
abstract class AbstractSolver implements QbfSolver {
    private static final Logger logger = Logger.getLogger(AbstractSolver.class.getName());

    protected final SolverConfiguration configuration;
    protected final SolverStatistics statistics;
    private final Simplifier simplifier;

    AbstractSolver(SolverConfiguration configuration) {
        this.configuration = configuration;
        this.statistics = new SolverStatistics();
        this.simplifier = new Simplifier(configuration, statistics);
    }

    @Override
    public final Decision decide(Formula formula) {
        long start = System.nanoTime();
        Decision decision = decideTopLevel(formula);
        if (logger.isLoggable(Level.FINE)) {
            logger.log(Level.FINE, "Decided formula with {0} variables and {1} clauses as {2} in {3} ms",
                    new Object[] {
                        formula.prefix().numberOfVariables(),
                        formula.numberOfClauses(),
                        decision.verdict(),
                        TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start)
                    });
        }
        if (configuration.logStatistics()) {
            logger.log(Level.INFO, statistics.toString());
        }
        return decision;
    }

    protected abstract Decision decideTopLevel(Formula formula);

    @Override
    public SolverConfiguration configuration() {
        return configuration;
    }

    @Override
    public SolverStatistics statistics() {
        return statistics;
    }

    /**
     * Decides {@code formula}.
     *
     * @return The decision, or {@code null} if {@code token} was cancelled before it was reached.
     */
    @Nullable
    protected final Decision decide(Formula formula, CancellationToken token) {
        if (token.isCancelled()) {
            statistics.onCancelledBranch();
            return null;
        }

        Simplification simplification = simplifier.simplify(formula);
        Formula simplified = simplification.formula();
        if (simplified.hasEmptyClause()) {
            statistics.onConflict();
            return Decision.unsatisfiable();
        }
        if (simplified.isEmpty()) {
            return Decision.satisfiable(existentialCompletion(simplified.prefix()))
                    .with(simplification.assignment());
        }

        // The matrix is not empty and all its variables are bound, hence there is a block.
        QuantifierBlock block = simplified.prefix().outermostBlock();
        assert block != null;
        int variable = block.firstVariable();
        statistics.onDecision();

        Formula positive = simplified.restrict(variable, true);
        @Nullable Formula negative;
        if (configuration.skipVacuousBranches() && !simplified.occurs(variable)) {
            statistics.onSkippedBranch();
            negative = null;
        } else {
            negative = simplified.restrict(variable, false);
        }
        if (logger.isLoggable(Level.FINEST)) {
            logger.log(Level.FINEST, "Branching on {0} variable {1}", new Object[] {block.quantifier(), variable});
        }

        Branch branch = decideBranches(block.quantifier(), positive, negative, token);
        if (branch == null) {
            return null;
        }
        Decision decision = branch.decision;
        if (!decision.isSatisfiable()) {
            return decision;
        }
        if (block.isExistential()) {
            return decision.with(variable, branch.value).with(simplification.assignment());
        }
        // Existential choices below a universal split depend on the universal value.
        return Decision.satisfiable(simplification.assignment());
    }

    /**
     * Decides the restrictions of a split, the {@code positive} one first. Evaluation stops as soon
     * as one restriction determines the result of the split: a true restriction for {@code EXISTS},
     * a false one for {@code FORALL}.
     *
     * @param negative
     *     The restriction to {@code false}, or {@code null} if it equals {@code positive}.
     *
     * @return The deciding branch, or {@code null} if the evaluation was cancelled.
     */
    @Nullable
    protected Branch decideBranches(Quantifier quantifier, Formula positive, @Nullable Formula negative,
            CancellationToken token) {
        Decision first = decide(positive, token);
        if (first == null) {
            return null;
        }
        if (negative == null || first.verdict() == decisiveVerdict(quantifier)) {
            return new Branch(true, first);
        }
        Decision second = decide(negative, token);
        return second == null ? null : new Branch(false, second);
    }

    /**
     * Returns the verdict of a restriction which alone determines the verdict of a split on a
     * variable bound by {@code quantifier}.
     */
    protected static Verdict decisiveVerdict(Quantifier quantifier) {
        return quantifier == Quantifier.EXISTS ? Verdict.SAT : Verdict.UNSAT;
    }

    private static Map<Integer, Boolean> existentialCompletion(QuantifierPrefix prefix) {
        Map<Integer, Boolean> completion = new HashMap<>();
        for (QuantifierBlock block : prefix.blocks()) {
            if (block.isUniversal()) {
                // Later existential variables depend on this universal one.
                break;
            }
            for (int variable : block.variables()) {
                completion.put(variable, Boolean.FALSE);
            }
        }
        return completion;
    }

    /**
     * The restriction which determined the result of a split, identified by the value assigned to the
     * split variable.
     */
    protected static final class Branch {
        final boolean value;
        final Decision decision;

        Branch(boolean value, Decision decision) {
            this.value = value;
            this.decision = decision;
        }
    }
}
