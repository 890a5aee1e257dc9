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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.IntStream;

/**
 * Produces small random formulas with mixed prefixes. Generation only depends on the seed, so tests
 * are reproducible.
 */
public final class FormulaGenerator {
    private static final Logger logger = Logger.getLogger(FormulaGenerator.class.getName());

    private FormulaGenerator() {
        // empty
    }

    public static List<Formula> generate(long seed, int count, int maximalVariables, int maximalClauses,
            int maximalClauseSize) {
        logger.log(Level.FINE, "Generating {0} formulas with up to {1} variables and {2} clauses",
                new Object[] {count, maximalVariables, maximalClauses});
        Random random = new Random(seed);
        ImmutableList.Builder<Formula> formulas = ImmutableList.builder();
        for (int i = 0; i < count; i++) {
            formulas.add(generate(random, maximalVariables, maximalClauses, maximalClauseSize));
        }
        return formulas.build();
    }

    public static Formula generate(Random random, int maximalVariables, int maximalClauses,
            int maximalClauseSize) {
        int variables = 1 + random.nextInt(maximalVariables);
        QuantifierPrefix prefix = randomPrefix(random, variables);
        int clauseCount = random.nextInt(maximalClauses + 1);
        List<Clause> clauses = new ArrayList<>(clauseCount);
        for (int i = 0; i < clauseCount; i++) {
            clauses.add(randomClause(random, variables, maximalClauseSize));
        }
        return Formula.of(prefix, clauses);
    }

    public static QuantifierPrefix randomPrefix(Random random, int variables) {
        List<Integer> order = new ArrayList<>();
        IntStream.rangeClosed(1, variables).forEach(order::add);
        Collections.shuffle(order, random);

        QuantifierPrefix.Builder builder = QuantifierPrefix.builder();
        int position = 0;
        while (position < order.size()) {
            int size = 1 + random.nextInt(Math.min(3, order.size() - position));
            int[] block = order.subList(position, position + size).stream().mapToInt(Integer::intValue).toArray();
            builder.block(random.nextBoolean() ? Quantifier.EXISTS : Quantifier.FORALL, block);
            position += size;
        }
        return builder.build();
    }

    public static Clause randomClause(Random random, int variables, int maximalClauseSize) {
        int size = 1 + random.nextInt(maximalClauseSize);
        int[] literals = new int[size];
        for (int i = 0; i < size; i++) {
            int variable = 1 + random.nextInt(variables);
            literals[i] = random.nextBoolean() ? variable : -variable;
        }
        return Clause.of(literals);
    }
}
