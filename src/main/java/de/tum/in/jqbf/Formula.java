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
import java.util.BitSet;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import javax.annotation.Nullable;

/**
 * A quantified boolean formula in prenex conjunctive normal form: a {@link QuantifierPrefix} and a
 * set of {@link Clause clauses}, the matrix.
 *
 * <p>Formulas are immutable. All operations which change the formula, in particular
 * {@link #restrict(int, boolean)}, return a new instance, so sub-formulas handed to different
 * branches of a search never interfere.</p>
 */
public final class Formula {
    private final QuantifierPrefix prefix;
    private final List<Clause> clauses;
    private final boolean hasEmptyClause;

    @Nullable
    private volatile BitSet occurringVariables;

    private Formula(QuantifierPrefix prefix, List<Clause> clauses) {
        this.prefix = prefix;
        this.clauses = clauses;
        this.hasEmptyClause = clauses.stream().anyMatch(Clause::isEmpty);
    }

    /**
     * Creates a formula. Duplicate clauses are merged, the order of the remaining clauses is kept.
     *
     * @throws MalformedFormulaException if a clause mentions a variable not bound by {@code prefix}.
     */
    public static Formula of(QuantifierPrefix prefix, Collection<Clause> clauses) {
        Set<Clause> distinct = new LinkedHashSet<>(clauses);
        for (Clause clause : distinct) {
            for (int i = 0; i < clause.size(); i++) {
                int variable = Math.abs(clause.literal(i));
                if (!prefix.isBound(variable)) {
                    throw new MalformedFormulaException(
                            String.format("Clause %s references unbound variable %d", clause, variable));
                }
            }
        }
        return new Formula(prefix, List.copyOf(distinct));
    }

    public static Formula of(QuantifierPrefix prefix, Clause... clauses) {
        return of(prefix, List.of(clauses));
    }

    public QuantifierPrefix prefix() {
        return prefix;
    }

    public List<Clause> clauses() {
        return clauses;
    }

    public int numberOfClauses() {
        return clauses.size();
    }

    /**
     * Returns whether the matrix has no clauses, in which case the formula is trivially true.
     */
    public boolean isEmpty() {
        return clauses.isEmpty();
    }

    /**
     * Returns whether the matrix contains the empty clause, in which case the formula is false.
     */
    public boolean hasEmptyClause() {
        return hasEmptyClause;
    }

    /**
     * Returns whether {@code variable} occurs in some clause.
     */
    public boolean occurs(int variable) {
        BitSet occurring = occurringVariables;
        if (occurring == null) {
            occurring = new BitSet();
            for (Clause clause : clauses) {
                for (int i = 0; i < clause.size(); i++) {
                    occurring.set(Math.abs(clause.literal(i)));
                }
            }
            occurringVariables = occurring;
        }
        return occurring.get(variable);
    }

    /**
     * Returns the formula obtained by fixing {@code variable} to {@code value}. Satisfied clauses are
     * removed, the falsified literal is removed from all other clauses and the variable is removed
     * from the prefix.
     *
     * @throws IllegalArgumentException if {@code variable} is not bound.
     */
    public Formula restrict(int variable, boolean value) {
        QuantifierPrefix restrictedPrefix = prefix.without(variable);
        Set<Clause> restricted = new LinkedHashSet<>(clauses.size());
        for (Clause clause : clauses) {
            Clause assigned = clause.assign(variable, value);
            if (assigned != null) {
                restricted.add(assigned);
            }
        }
        return new Formula(restrictedPrefix, Collections.unmodifiableList(new ArrayList<>(restricted)));
    }

    /**
     * Applies all assignments of the given partial assignment, see {@link #restrict(int, boolean)}.
     */
    public Formula restrict(Map<Integer, Boolean> assignment) {
        Formula formula = this;
        for (Map.Entry<Integer, Boolean> entry : assignment.entrySet()) {
            formula = formula.restrict(entry.getKey(), entry.getValue());
        }
        return formula;
    }

    /**
     * Returns a formula with the same prefix and the given clauses. The clauses are assumed to only
     * mention bound variables.
     */
    Formula withClauses(Collection<Clause> newClauses) {
        assert newClauses.stream().allMatch(clause -> {
            for (int i = 0; i < clause.size(); i++) {
                if (!prefix.isBound(Math.abs(clause.literal(i)))) {
                    return false;
                }
            }
            return true;
        });
        return new Formula(prefix, List.copyOf(new LinkedHashSet<>(newClauses)));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Formula)) {
            return false;
        }
        Formula other = (Formula) o;
        // The matrix is a set, the order of clauses is irrelevant.
        return prefix.equals(other.prefix)
                && clauses.size() == other.clauses.size()
                && new HashSet<>(clauses).containsAll(other.clauses);
    }

    @Override
    public int hashCode() {
        int clauseHash = 0;
        for (Clause clause : clauses) {
            clauseHash += clause.hashCode();
        }
        return 31 * prefix.hashCode() + clauseHash;
    }

    @Override
    public String toString() {
        return QdimacsWriter.write(this);
    }
}
