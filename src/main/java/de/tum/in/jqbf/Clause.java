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
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.function.IntPredicate;
import java.util.stream.Collectors;
import javax.annotation.Nullable;

/**
 * An immutable disjunction of literals. Literals are stored in their DIMACS encoding, sorted by
 * variable and free of duplicates. A clause may contain complementary literals, in which case it is
 * a tautology; the {@link Simplifier} drops such clauses.
 */
public final class Clause {
    private static final int[] NO_LITERALS = new int[0];
    private static final Clause EMPTY = new Clause(NO_LITERALS);

    private final int[] literals;
    private final int hashCode;

    private Clause(int[] literals) {
        this.literals = literals;
        this.hashCode = Arrays.hashCode(literals);
    }

    public static Clause empty() {
        return EMPTY;
    }

    /**
     * Creates a clause from DIMACS encoded literals. Repeated literals are merged.
     *
     * @throws MalformedFormulaException if any of the literals is zero.
     */
    public static Clause of(int... literals) {
        if (literals.length == 0) {
            return EMPTY;
        }
        Literal[] parsed = new Literal[literals.length];
        for (int i = 0; i < literals.length; i++) {
            parsed[i] = Literal.of(literals[i]);
        }
        return of(Arrays.asList(parsed));
    }

    public static Clause of(Collection<Literal> literals) {
        if (literals.isEmpty()) {
            return EMPTY;
        }
        int[] encoded = literals.stream()
                .sorted()
                .distinct()
                .mapToInt(Literal::toDimacs)
                .toArray();
        return new Clause(encoded);
    }

    public int size() {
        return literals.length;
    }

    public boolean isEmpty() {
        return literals.length == 0;
    }

    public boolean isUnit() {
        return literals.length == 1;
    }

    /**
     * Returns the {@code index}-th literal in DIMACS encoding.
     */
    public int literal(int index) {
        return literals[index];
    }

    public List<Literal> literals() {
        List<Literal> list = new ArrayList<>(literals.length);
        for (int literal : literals) {
            list.add(Literal.of(literal));
        }
        return Collections.unmodifiableList(list);
    }

    public int[] toDimacs() {
        return literals.clone();
    }

    public boolean contains(Literal literal) {
        return indexOf(literal.toDimacs()) >= 0;
    }

    public boolean containsVariable(int variable) {
        return indexOf(variable) >= 0 || indexOf(-variable) >= 0;
    }

    private int indexOf(int encoding) {
        for (int i = 0; i < literals.length; i++) {
            if (literals[i] == encoding) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Determines whether this clause contains a literal together with its complement.
     */
    public boolean isTautology() {
        // Complementary literals are adjacent since literals are sorted by variable.
        for (int i = 1; i < literals.length; i++) {
            if (literals[i - 1] == -literals[i]) {
                return true;
            }
        }
        return false;
    }

    /**
     * Resolves the clause under the assignment {@code variable = value}.
     *
     * @return {@code null} if the clause is satisfied by the assignment, otherwise the clause
     *     without the falsified literal (possibly {@code this}, possibly empty).
     */
    @Nullable
    public Clause assign(int variable, boolean value) {
        int satisfied = value ? variable : -variable;
        if (indexOf(satisfied) >= 0) {
            return null;
        }
        int falsified = indexOf(-satisfied);
        if (falsified < 0) {
            return this;
        }
        if (literals.length == 1) {
            return EMPTY;
        }
        int[] remaining = new int[literals.length - 1];
        System.arraycopy(literals, 0, remaining, 0, falsified);
        System.arraycopy(literals, falsified + 1, remaining, falsified, literals.length - falsified - 1);
        return new Clause(remaining);
    }

    /**
     * Returns the clause consisting of those literals accepted by {@code keep}.
     */
    public Clause retain(IntPredicate keep) {
        int[] kept = Arrays.stream(literals).filter(keep).toArray();
        if (kept.length == literals.length) {
            return this;
        }
        return kept.length == 0 ? EMPTY : new Clause(kept);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Clause)) {
            return false;
        }
        Clause other = (Clause) o;
        return hashCode == other.hashCode && Arrays.equals(literals, other.literals);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return Arrays.stream(literals).mapToObj(Integer::toString).collect(Collectors.joining(" ", "", " 0"))
                .stripLeading();
    }
}
