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

/**
 * A signed reference to a variable. Literals are represented by their DIMACS encoding, i.e. the
 * variable id negated if the literal is negative.
 */
public final class Literal implements Comparable<Literal> {
    private final int encoding;

    private Literal(int encoding) {
        this.encoding = encoding;
    }

    /**
     * Creates the literal with the given DIMACS encoding.
     *
     * @throws MalformedFormulaException if {@code dimacs} is zero.
     */
    public static Literal of(int dimacs) {
        if (dimacs == 0 || dimacs == Integer.MIN_VALUE) {
            throw new MalformedFormulaException("Invalid literal " + dimacs);
        }
        return new Literal(dimacs);
    }

    public static Literal of(int variable, boolean positive) {
        if (variable <= 0) {
            throw new MalformedFormulaException("Invalid variable " + variable);
        }
        return new Literal(positive ? variable : -variable);
    }

    public int variable() {
        return Math.abs(encoding);
    }

    public boolean isPositive() {
        return encoding > 0;
    }

    public Literal complement() {
        return new Literal(-encoding);
    }

    public boolean isComplementOf(Literal other) {
        return encoding == -other.encoding;
    }

    /**
     * Returns whether this literal is satisfied if its variable is assigned {@code value}.
     */
    public boolean isSatisfiedBy(boolean value) {
        return isPositive() == value;
    }

    public int toDimacs() {
        return encoding;
    }

    /**
     * Orders by variable first, the negative literal before the positive one.
     */
    @Override
    public int compareTo(Literal o) {
        int variableComparison = Integer.compare(variable(), o.variable());
        return variableComparison == 0 ? Integer.compare(encoding, o.encoding) : variableComparison;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Literal && encoding == ((Literal) o).encoding);
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(encoding);
    }

    @Override
    public String toString() {
        return Integer.toString(encoding);
    }
}
