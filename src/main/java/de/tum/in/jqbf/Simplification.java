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
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * The outcome of {@link Simplifier#simplify(Formula)}: the simplified formula together with the
 * existential assignments forced along the way.
 */
public final class Simplification {
    private final Formula formula;
    private final SortedMap<Integer, Boolean> assignment;

    Simplification(Formula formula, Map<Integer, Boolean> assignment) {
        this.formula = formula;
        this.assignment = Collections.unmodifiableSortedMap(new TreeMap<>(assignment));
    }

    public Formula formula() {
        return formula;
    }

    /**
     * Returns the values unit propagation assigned to existential variables.
     */
    public SortedMap<Integer, Boolean> assignment() {
        return assignment;
    }
}
