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

import java.util.BitSet;
import java.util.Collections;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * The answer for a formula: its verdict and, for true formulas, a witness. The witness assigns the
 * variables of the existential blocks preceding the first universal block, since only these choices
 * are independent of the universal variables. For a formula without universal blocks the witness
 * is a complete satisfying assignment.
 */
public final class Result {
    private final Verdict verdict;
    private final SortedMap<Integer, Boolean> witness;

    private Result(Verdict verdict, SortedMap<Integer, Boolean> witness) {
        this.verdict = verdict;
        this.witness = witness;
    }

    /**
     * Builds the result of deciding {@code formula}. Outermost existential variables which the
     * decision left open are set to {@code false}.
     */
    public static Result assemble(Formula formula, Decision decision) {
        if (!decision.isSatisfiable()) {
            return new Result(Verdict.UNSAT, Collections.emptySortedMap());
        }
        BitSet leading = formula.prefix().leadingExistentialVariables();
        SortedMap<Integer, Boolean> witness = new TreeMap<>();
        for (int variable = leading.nextSetBit(0); variable >= 0; variable = leading.nextSetBit(variable + 1)) {
            witness.put(variable, decision.assignment().getOrDefault(variable, Boolean.FALSE));
        }
        return new Result(Verdict.SAT, Collections.unmodifiableSortedMap(witness));
    }

    public Verdict verdict() {
        return verdict;
    }

    public boolean isSatisfiable() {
        return verdict == Verdict.SAT;
    }

    /**
     * Returns the witness, empty for false formulas.
     */
    public SortedMap<Integer, Boolean> witness() {
        return witness;
    }

    /**
     * Returns the witness as DIMACS literals in ascending variable order.
     */
    public int[] witnessLiterals() {
        return witness.entrySet().stream()
                .mapToInt(entry -> entry.getValue() ? entry.getKey() : -entry.getKey())
                .toArray();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Result)) {
            return false;
        }
        Result other = (Result) o;
        return verdict == other.verdict && witness.equals(other.witness);
    }

    @Override
    public int hashCode() {
        return Objects.hash(verdict, witness);
    }

    @Override
    public String toString() {
        return verdict.toString();
    }
}
