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

import java.util.concurrent.CancellationException;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.RecursiveTask;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * Evaluates both restrictions of a split concurrently on a fork/join pool. The first restriction
 * which determines the result of the split cancels its sibling. Cancellation is cooperative: every
 * recursion step checks the token of its branch.
 *
 * <p>Verdicts are the same as those of the {@link RecursiveSolver}. The witness of a satisfiable
 * formula may differ between runs, since either restriction of an existential split may win.</p>
 */
final class ParallelSolver extends AbstractSolver {
    private static final Logger logger = Logger.getLogger(ParallelSolver.class.getName());

    private final ForkJoinPool pool;

    ParallelSolver(SolverConfiguration configuration) {
        super(configuration);
        this.pool = new ForkJoinPool(configuration.parallelism());
    }

    @Override
    protected Decision decideTopLevel(Formula formula) {
        CancellationToken root = CancellationToken.root();
        Decision decision = pool.invoke(new BranchTask(formula, root, null, Verdict.SAT));
        if (decision == null) {
            throw new CancellationException("Decision was cancelled");
        }
        return decision;
    }

    @Nullable
    @Override
    protected Branch decideBranches(Quantifier quantifier, Formula positive, @Nullable Formula negative,
            CancellationToken token) {
        if (negative == null || positive.prefix().numberOfVariables() <= configuration.sequentialCutoff()) {
            return super.decideBranches(quantifier, positive, negative, token);
        }

        Verdict decisive = decisiveVerdict(quantifier);
        CancellationToken positiveToken = token.child();
        CancellationToken negativeToken = token.child();
        BranchTask positiveTask = new BranchTask(positive, positiveToken, negativeToken, decisive);
        BranchTask negativeTask = new BranchTask(negative, negativeToken, positiveToken, decisive);
        if (logger.isLoggable(Level.FINER)) {
            logger.log(Level.FINER, "Forking {0} split with {1} remaining variables",
                    new Object[] {quantifier, positive.prefix().numberOfVariables()});
        }

        negativeTask.fork();
        Decision first = positiveTask.invoke();
        if (first != null && first.verdict() == decisive) {
            // The sibling has been cancelled, if it did not start yet it never will.
            negativeTask.tryUnfork();
            return new Branch(true, first);
        }
        Decision second = negativeTask.join();
        if (second == null) {
            return null;
        }
        if (second.verdict() == decisive) {
            return new Branch(false, second);
        }
        // Neither restriction was decisive, so the positive one was not cancelled by its sibling.
        return first == null ? null : new Branch(false, second);
    }

    @Override
    public void close() {
        pool.shutdownNow();
    }

    @Override
    public String toString() {
        return String.format("ParallelSolver{parallelism=%d}", pool.getParallelism());
    }

    private final class BranchTask extends RecursiveTask<Decision> {
        private static final long serialVersionUID = 1L;

        private final transient Formula formula;
        private final transient CancellationToken token;
        @Nullable
        private final transient CancellationToken sibling;
        private final Verdict decisive;

        BranchTask(Formula formula, CancellationToken token, @Nullable CancellationToken sibling,
                Verdict decisive) {
            this.formula = formula;
            this.token = token;
            this.sibling = sibling;
            this.decisive = decisive;
        }

        @Nullable
        @Override
        protected Decision compute() {
            Decision decision = decide(formula, token);
            if (decision != null && sibling != null && decision.verdict() == decisive) {
                sibling.cancel();
            }
            return decision;
        }
    }
}
