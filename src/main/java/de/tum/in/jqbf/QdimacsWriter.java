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

import java.util.StringJoiner;

public final class QdimacsWriter {
    private QdimacsWriter() {}

    /**
     * Renders {@code formula} in QDIMACS. Every quantifier block is written explicitly, so reading the
     * output back yields an equal formula, unless the matrix contains the empty clause, which
     * {@link QdimacsReader} rejects.
     */
    public static String write(Formula formula) {
        QuantifierPrefix prefix = formula.prefix();
        StringJoiner joiner = new StringJoiner("\n", "", "\n");
        joiner.add(String.format("p cnf %d %d", prefix.maxVariable(), formula.numberOfClauses()));
        for (QuantifierBlock block : prefix.blocks()) {
            joiner.add(block.toString());
        }
        for (Clause clause : formula.clauses()) {
            joiner.add(clause.toString());
        }
        return joiner.toString();
    }
}
