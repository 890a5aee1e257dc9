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

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * A maximal group of variables bound by the same quantifier at the same nesting depth. The
 * {@link #rank()} is the index of the block within its prefix, with 0 being the outermost block.
 */
public final class QuantifierBlock {
    private final Quantifier quantifier;
    private final int rank;
    private final int[] variables;

    private QuantifierBlock(Quantifier quantifier, int rank, int[] variables) {
        this.quantifier = quantifier;
        this.rank = rank;
        this.variables = variables;
    }

    /**
     * Creates a block binding the given variables.
     *
     * @throws InvalidPrefixException if the block is empty, has a negative rank or lists a variable twice.
     * @throws MalformedFormulaException if a variable is not positive.
     */
    public static QuantifierBlock of(Quantifier quantifier, int rank, int... variables) {
        if (rank < 0) {
            throw new InvalidPrefixException("Negative rank " + rank);
        }
        if (variables.length == 0) {
            throw new InvalidPrefixException("Empty quantifier block at rank " + rank);
        }
        int[] sorted = variables.clone();
        Arrays.sort(sorted);
        if (sorted[0] <= 0) {
            throw new MalformedFormulaException("Invalid variable " + sorted[0]);
        }
        for (int i = 1; i < sorted.length; i++) {
            if (sorted[i - 1] == sorted[i]) {
                throw new InvalidPrefixException(
                        String.format("Variable %d bound twice in block %d", sorted[i], rank));
            }
        }
        return new QuantifierBlock(quantifier, rank, sorted);
    }

    public Quantifier quantifier() {
        return quantifier;
    }

    public boolean isExistential() {
        return quantifier == Quantifier.EXISTS;
    }

    public boolean isUniversal() {
        return quantifier == Quantifier.FORALL;
    }

    public int rank() {
        return rank;
    }

    public int size() {
        return variables.length;
    }

    /**
     * Returns the bound variables in ascending order.
     */
    public int[] variables() {
        return variables.clone();
    }

    /**
     * Returns the smallest variable of this block, which is the one branched on first.
     */
    public int firstVariable() {
        return variables[0];
    }

    public boolean contains(int variable) {
        return Arrays.binarySearch(variables, variable) >= 0;
    }

    QuantifierBlock withRank(int newRank) {
        return newRank == rank ? this : new QuantifierBlock(quantifier, newRank, variables);
    }

    /**
     * Returns the variables of this block except {@code variable}, possibly none.
     */
    int[] variablesWithout(int variable) {
        int index = Arrays.binarySearch(variables, variable);
        assert index >= 0;
        int[] remaining = new int[variables.length - 1];
        System.arraycopy(variables, 0, remaining, 0, index);
        System.arraycopy(variables, index + 1, remaining, index, variables.length - index - 1);
        return remaining;
    }

    static QuantifierBlock ofTrusted(Quantifier quantifier, int rank, int[] sortedVariables) {
        assert sortedVariables.length > 0;
        return new QuantifierBlock(quantifier, rank, sortedVariables);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof QuantifierBlock)) {
            return false;
        }
        QuantifierBlock other = (QuantifierBlock) o;
        return rank == other.rank && quantifier == other.quantifier && Arrays.equals(variables, other.variables);
    }

    @Override
    public int hashCode() {
        return (31 * quantifier.hashCode() + rank) * 31 + Arrays.hashCode(variables);
    }

    @Override
    public String toString() {
        return Arrays.stream(variables)
                .mapToObj(Integer::toString)
                .collect(Collectors.joining(" ", quantifier.symbol() + " ", " 0"));
    }
}
