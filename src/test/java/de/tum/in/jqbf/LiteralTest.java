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
import static org.hamcrest.Matchers.lessThan;
import static org.hamcrest.Matchers.not;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

public class LiteralTest {
    @Test
    public void testEncoding() {
        Literal positive = Literal.of(3);
        Literal negative = Literal.of(3, false);

        assertThat(positive.variable(), is(3));
        assertThat(negative.variable(), is(3));
        assertThat(positive.isPositive(), is(true));
        assertThat(negative.isPositive(), is(false));
        assertThat(positive.toDimacs(), is(3));
        assertThat(negative.toDimacs(), is(-3));
    }

    @Test
    public void testComplement() {
        Literal literal = Literal.of(3);

        assertThat(literal.complement(), is(Literal.of(-3)));
        assertThat(literal.complement().complement(), is(literal));
        assertThat(literal.isComplementOf(Literal.of(-3)), is(true));
        assertThat(literal.isComplementOf(Literal.of(3)), is(false));
        assertThat(literal.isComplementOf(Literal.of(-4)), is(false));
        assertThat(literal, is(not(literal.complement())));
        assertThat(literal.hashCode(), is(Literal.of(3).hashCode()));
    }

    @Test
    public void testSatisfaction() {
        assertThat(Literal.of(2).isSatisfiedBy(true), is(true));
        assertThat(Literal.of(2).isSatisfiedBy(false), is(false));
        assertThat(Literal.of(-2).isSatisfiedBy(false), is(true));
    }

    @Test
    public void testOrder() {
        assertThat(Literal.of(-1).compareTo(Literal.of(1)), lessThan(0));
        assertThat(Literal.of(1).compareTo(Literal.of(-2)), lessThan(0));
        assertThat(Literal.of(2).compareTo(Literal.of(2)), is(0));
    }

    @Test
    public void testInvalid() {
        assertThrows(MalformedFormulaException.class, () -> Literal.of(0));
        assertThrows(MalformedFormulaException.class, () -> Literal.of(0, true));
        assertThrows(MalformedFormulaException.class, () -> Literal.of(-1, false));
    }
}
