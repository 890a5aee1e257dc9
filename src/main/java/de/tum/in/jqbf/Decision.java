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

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * The raw outcome of deciding a formula: its verdict and, if it is true, the values chosen for the
 * existential variables which were assigned before the first universal branch.
 */
public final class Decision {
    private static final Decision UNSATISFIABLE = new Decision(Verdict.UNSAT, Collections.emptySortedMap());

    private final Verdict verdict;
    private final SortedMap<Integer, Boolean> assignment;

    private Decision(Verdict verdict, SortedMap<Integer, Boolean> assignment) {
        this.verdict = verdict;
        this.assignment = assignment;
    }

    public static Decision unsatisfiable() {
        return UNSATISFIABLE;
    }

    public static Decision satisfiable(Map<Integer, Boolean> assignment) {
        return new Decision(Verdict.SAT, Collections.unmodifiableSortedMap(new TreeMap<>(assignment)));
    }

    public Verdict verdict() {
        return verdict;
    }

    public boolean isSatisfiable() {
        return verdict == Verdict.SAT;
    }

    public SortedMap<Integer, Boolean> assignment() {
        return assignment;
    }

    /**
     * Extends the assignment of a satisfiable decision. Unsatisfiable decisions are returned as is.
     */
    Decision with(Map<Integer, Boolean> values) {
        if (!isSatisfiable() || values.isEmpty()) {
            return this;
        }
        SortedMap<Integer, Boolean> extended = new TreeMap<>(assignment);
        extended.putAll(values);
        return new Decision(verdict, Collections.unmodifiableSortedMap(extended));
    }

    Decision with(int variable, boolean value) {
        return with(Map.of(variable, value));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Decision)) {
            return false;
        }
        Decision other = (Decision) o;
        return verdict == other.verdict && assignment.equals(other.assignment);
    }

    @Override
    public int hashCode() {
        return Objects.hash(verdict, assignment);
    }

    @Override
    public String toString() {
        return isSatisfiable() ? verdict + " " + assignment : verdict.toString();
    }
}
