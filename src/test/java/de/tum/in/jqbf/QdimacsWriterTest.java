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

import org.junit.jupiter.api.Test;

public class QdimacsWriterTest {
    @Test
    public void testWrite() {
        Formula formula = Formula.of(QuantifierPrefix.builder().exists(3, 1).forall(2).build(),
                Clause.of(2, -1), Clause.of(3));

        assertThat(QdimacsWriter.write(formula), is("p cnf 3 2\ne 1 3 0\na 2 0\n-1 2 0\n3 0\n"));
        assertThat(formula.toString(), is(QdimacsWriter.write(formula)));
    }

    @Test
    public void testReadBack() throws Exception {
        for (String name : new String[] {"large_formula.qdimacs", "complex_alternating.qdimacs",
            "classical_sat_complex.dimacs"}) {
            Formula formula = Fixtures.read(name);
            assertThat(name, QdimacsReader.read(QdimacsWriter.write(formula)), is(formula));
        }
    }

    @Test
    public void testImplicitBlockBecomesExplicit() throws Exception {
        Formula formula = QdimacsReader.read("p cnf 2 1\na 2 0\n1 2 0\n");

        assertThat(QdimacsWriter.write(formula), is("p cnf 2 1\ne 1 0\na 2 0\n1 2 0\n"));
    }
}
