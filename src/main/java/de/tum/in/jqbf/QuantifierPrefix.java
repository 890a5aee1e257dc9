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
import java.util.Arrays;
import java.util.BitSet;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import javax.annotation.Nullable;

/**
 * The ordered sequence of quantifier blocks of a formula. Consecutive blocks of the same kind are
 * kept apart so that the branching order stays the one given by the input.
 *
 * <p>The rank of every variable is stored in a dense array indexed by variable id, so lookups
 * during search are constant time.</p>
 */
public final class QuantifierPrefix {
    /**
     * The largest variable id a prefix can bind. Ranks are stored densely up to the largest bound
     * variable, so this bounds the size of that array.
     */
    public static final int MAX_VARIABLE = 1 << 26;

    private static final int UNBOUND = -1;
    private static final QuantifierPrefix EMPTY = new QuantifierPrefix(List.of(), new int[1], 0);

    private final List<QuantifierBlock> blocks;
    private final int[] rankByVariable;
    private final int numberOfVariables;

    private QuantifierPrefix(List<QuantifierBlock> blocks, int[] rankByVariable, int numberOfVariables) {
        this.blocks = blocks;
        this.rankByVariable = rankByVariable;
        this.numberOfVariables = numberOfVariables;
    }

    public static QuantifierPrefix empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a prefix from the given blocks, which have to be ordered by rank.
     *
     * @throws InvalidPrefixException if ranks are not exactly {@code 0, 1, 2, ...}, a variable is
     *     bound by more than one block or a variable exceeds {@link #MAX_VARIABLE}.
     */
    public static QuantifierPrefix of(List<QuantifierBlock> blocks) {
        if (blocks.isEmpty()) {
            return EMPTY;
        }
        int maxVariable = 0;
        for (int rank = 0; rank < blocks.size(); rank++) {
            QuantifierBlock block = blocks.get(rank);
            if (block.rank() != rank) {
                throw new InvalidPrefixException(
                        String.format("Block %s has rank %d, expected %d", block, block.rank(), rank));
            }
            int[] variables = block.variables();
            maxVariable = Math.max(maxVariable, variables[variables.length - 1]);
        }
        if (maxVariable > MAX_VARIABLE) {
            throw new InvalidPrefixException(
                    String.format("Variable %d exceeds the maximum variable %d", maxVariable, MAX_VARIABLE));
        }
        int[] ranks = new int[maxVariable + 1];
        Arrays.fill(ranks, UNBOUND);
        int count = 0;
        for (QuantifierBlock block : blocks) {
            for (int variable : block.variables()) {
                if (ranks[variable] != UNBOUND) {
                    throw new InvalidPrefixException(String.format(
                            "Variable %d bound in blocks %d and %d", variable, ranks[variable], block.rank()));
                }
                ranks[variable] = block.rank();
                count += 1;
            }
        }
        return new QuantifierPrefix(List.copyOf(blocks), ranks, count);
    }

    public List<QuantifierBlock> blocks() {
        return blocks;
    }

    public int numberOfBlocks() {
        return blocks.size();
    }

    public boolean isEmpty() {
        return blocks.isEmpty();
    }

    public int numberOfVariables() {
        return numberOfVariables;
    }

    /**
     * Returns the largest bound variable, or 0 if the prefix is empty.
     */
    public int maxVariable() {
        for (int variable = rankByVariable.length - 1; variable > 0; variable--) {
            if (rankByVariable[variable] != UNBOUND) {
                return variable;
            }
        }
        return 0;
    }

    public boolean isBound(int variable) {
        return variable > 0 && variable < rankByVariable.length && rankByVariable[variable] != UNBOUND;
    }

    /**
     * Returns the rank of the block binding {@code variable}.
     *
     * @throws IllegalArgumentException if the variable is not bound.
     */
    public int rank(int variable) {
        if (!isBound(variable)) {
            throw new IllegalArgumentException("Variable " + variable + " is not bound");
        }
        return rankByVariable[variable];
    }

    public Quantifier quantifier(int variable) {
        return blocks.get(rank(variable)).quantifier();
    }

    public boolean isExistential(int variable) {
        return quantifier(variable) == Quantifier.EXISTS;
    }

    public boolean isUniversal(int variable) {
        return quantifier(variable) == Quantifier.FORALL;
    }

    public BitSet variables() {
        BitSet variables = new BitSet(rankByVariable.length);
        for (int variable = 1; variable < rankByVariable.length; variable++) {
            if (rankByVariable[variable] != UNBOUND) {
                variables.set(variable);
            }
        }
        return variables;
    }

    @Nullable
    public QuantifierBlock outermostBlock() {
        return blocks.isEmpty() ? null : blocks.get(0);
    }

    /**
     * Returns the variables of all existential blocks preceding the first universal block. An
     * assignment to these variables is a strategy which does not depend on any universal choice.
     */
    public BitSet leadingExistentialVariables() {
        BitSet variables = new BitSet();
        for (QuantifierBlock block : blocks) {
            if (block.isUniversal()) {
                break;
            }
            for (int variable : block.variables()) {
                variables.set(variable);
            }
        }
        return variables;
    }

    /**
     * Returns the prefix with {@code variable} unbound. A block which becomes empty is removed and
     * the ranks of all following blocks are shifted down by one.
     */
    public QuantifierPrefix without(int variable) {
        int rank = rank(variable);
        QuantifierBlock block = blocks.get(rank);
        int[] remaining = block.variablesWithout(variable);

        List<QuantifierBlock> newBlocks = new ArrayList<>(blocks.size());
        newBlocks.addAll(blocks.subList(0, rank));
        if (remaining.length > 0) {
            newBlocks.add(QuantifierBlock.ofTrusted(block.quantifier(), rank, remaining));
        }
        for (int i = rank + 1; i < blocks.size(); i++) {
            newBlocks.add(blocks.get(i).withRank(newBlocks.size()));
        }

        int[] ranks = rankByVariable.clone();
        ranks[variable] = UNBOUND;
        if (remaining.length == 0) {
            for (int v = 1; v < ranks.length; v++) {
                if (ranks[v] > rank) {
                    ranks[v] -= 1;
                }
            }
        }
        return new QuantifierPrefix(Collections.unmodifiableList(newBlocks), ranks, numberOfVariables - 1);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof QuantifierPrefix && blocks.equals(((QuantifierPrefix) o).blocks));
    }

    @Override
    public int hashCode() {
        return blocks.hashCode();
    }

    @Override
    public String toString() {
        return blocks.stream().map(QuantifierBlock::toString).collect(Collectors.joining("\n"));
    }

    /**
     * Assembles a prefix block by block, assigning ranks in the order of the calls.
     */
    public static final class Builder {
        private final List<QuantifierBlock> blocks = new ArrayList<>();

        private Builder() {}

        public Builder exists(int... variables) {
            return block(Quantifier.EXISTS, variables);
        }

        public Builder forall(int... variables) {
            return block(Quantifier.FORALL, variables);
        }

        public Builder block(Quantifier quantifier, int... variables) {
            blocks.add(QuantifierBlock.of(quantifier, blocks.size(), variables));
            return this;
        }

        public QuantifierPrefix build() {
            return QuantifierPrefix.of(blocks);
        }
    }
}
