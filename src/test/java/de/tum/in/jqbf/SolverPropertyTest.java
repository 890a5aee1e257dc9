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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

/**
 * Checks the solvers against the quantified semantics on random small formulas.
 */
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class SolverPropertyTest {
    private static final int formulaCount = 400;
    private static final int maximalVariables = 6;
    private static final int maximalClauses = 10;
    private static final int maximalClauseSize = 3;

    private final List<QbfSolver> solvers = Solvers.all();
    private final List<Formula> formulas =
            FormulaGenerator.generate(0L, formulaCount, maximalVariables, maximalClauses, maximalClauseSize);
    private final List<Boolean> expected = new ArrayList<>();

    {
        for (Formula formula : formulas) {
            expected.add(BruteForce.isTrue(formula));
        }
    }

    @AfterAll
    public void closeSolvers() {
        solvers.forEach(QbfSolver::close);
    }

    Stream<Arguments> solvers() {
        return solvers.stream().map(Arguments::of);
    }

    @ParameterizedTest(autoCloseArguments = false)
    @MethodSource("solvers")
    public void testAgreesWithBruteForce(QbfSolver solver) {
        for (int i = 0; i < formulas.size(); i++) {
            Formula formula = formulas.get(i);
            assertThat(formula.toString(), solver.decide(formula).isSatisfiable(), is(expected.get(i)));
        }
    }

    @ParameterizedTest(autoCloseArguments = false)
    @MethodSource("solvers")
    public void testWitnessValidity(QbfSolver solver) {
        for (Formula formula : formulas) {
            Result result = solver.solve(formula);
            if (!result.isSatisfiable()) {
                continue;
            }
            assertThat(result.witness().keySet(),
                    is(formula.prefix().leadingExistentialVariables().stream().boxed()
                            .collect(Collectors.toSet())));
            Formula residual = formula.restrict(result.witness());
            assertThat(formula + " with " + result.witness(), BruteForce.isTrue(residual), is(true));
            assertThat(solver.decide(residual).isSatisfiable(), is(true));
        }
    }

    @ParameterizedTest(autoCloseArguments = false)
    @MethodSource("solvers")
    public void testMonotonicity(QbfSolver solver) {
        Random random = new Random(1L);
        for (int i = 0; i < formulas.size(); i++) {
            Formula formula = formulas.get(i);
            int variables = formula.prefix().maxVariable();
            if (expected.get(i)) {
                if (formula.isEmpty()) {
                    continue;
                }
                List<Clause> fewer = new ArrayList<>(formula.clauses());
                fewer.remove(random.nextInt(fewer.size()));
                assertThat(solver.decide(Formula.of(formula.prefix(), fewer)).isSatisfiable(), is(true));
            } else {
                List<Clause> more = new ArrayList<>(formula.clauses());
                more.add(FormulaGenerator.randomClause(random, variables, maximalClauseSize));
                assertThat(solver.decide(Formula.of(formula.prefix(), more)).isSatisfiable(), is(false));
            }
        }
    }

    @Test
    public void testDeterminism() {
        try (QbfSolver first = SolverFactory.buildSolver();
                QbfSolver second = SolverFactory.buildSolver()) {
            for (Formula formula : formulas) {
                Decision decision = first.decide(formula);
                assertThat(first.decide(formula), is(decision));
                assertThat(second.decide(formula), is(decision));
            }
        }
    }

    @Test
    public void testParallelVerdictsAreStable() {
        QbfSolver parallel = solvers.get(solvers.size() - 1);
        for (int i = 0; i < formulas.size(); i++) {
            for (int run = 0; run < 3; run++) {
                assertThat(parallel.decide(formulas.get(i)).verdict(), is(Verdict.of(expected.get(i))));
            }
        }
    }

    @Test
    public void testLargerFormulasAgree() {
        List<Formula> larger = FormulaGenerator.generate(7L, 40, 12, 30, 4);
        try (QbfSolver sequential = SolverFactory.buildSolver();
                QbfSolver parallel = SolverFactory.buildSolver(ImmutableSolverConfiguration.builder()
                        .parallel(true)
                        .sequentialCutoff(4)
                        .build())) {
            for (Formula formula : larger) {
                assertThat(formula.toString(), parallel.decide(formula).verdict(),
                        is(sequential.decide(formula).verdict()));
            }
        }
    }
}
