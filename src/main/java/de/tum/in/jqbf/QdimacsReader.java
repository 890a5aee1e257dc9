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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import javax.annotation.Nullable;

/**
 * Reads formulas in QDIMACS format. Plain DIMACS is accepted as well, in which case all variables
 * are existentially quantified.
 *
 * <p>Variables which are not bound by any quantifier line form an additional existential block in
 * front of all declared blocks.</p>
 */
public final class QdimacsReader {
    private static final Logger logger = Logger.getLogger(QdimacsReader.class.getName());
    private static final Pattern WHITESPACE = Pattern.compile("[ \t]+");

    private QdimacsReader() {}

    @Nullable
    private static String nextLine(BufferedReader reader) throws IOException {
        while (true) {
            String line = reader.readLine();
            if (line == null) {
                return null;
            }
            if (line.isBlank()) {
                continue;
            }
            if (line.charAt(0) != 'c') {
                return line.strip();
            }
        }
    }

    public static Formula read(String content) throws InvalidFormatException {
        try {
            return read(new BufferedReader(new StringReader(content)));
        } catch (IOException e) {
            throw new UncheckedIOException("Reading from a string failed", e);
        }
    }

    public static Formula read(BufferedReader reader) throws IOException, InvalidFormatException {
        String header = nextLine(reader);
        if (header == null) {
            throw new InvalidFormatException("Stream is empty");
        }
        String[] array = WHITESPACE.split(header);
        if (array.length != 4 || !"p".equals(array[0]) || !"cnf".equals(array[1])) {
            throw new InvalidFormatException("Invalid header " + header);
        }
        int variables;
        int declaredClauses;
        try {
            variables = Integer.parseInt(array[2]);
            declaredClauses = Integer.parseInt(array[3]);
        } catch (NumberFormatException e) {
            throw new InvalidFormatException("Invalid header " + header, e);
        }
        if (variables <= 0 || variables > QuantifierPrefix.MAX_VARIABLE) {
            throw new InvalidFormatException("Invalid number of variables in header " + header);
        }
        if (declaredClauses < 0) {
            throw new InvalidFormatException("Invalid number of clauses in header " + header);
        }

        List<Quantifier> quantifiers = new ArrayList<>();
        List<int[]> blockVariables = new ArrayList<>();
        List<Clause> clauses = new ArrayList<>();
        Set<List<Integer>> clauseLines = new HashSet<>();
        while (true) {
            String line = nextLine(reader);
            if (line == null) {
                break;
            }
            char symbol = line.charAt(0);
            if (symbol == 'a' || symbol == 'e') {
                if (!clauses.isEmpty()) {
                    throw new InvalidFormatException("Quantifier line after clauses: " + line);
                }
                // The symbol need not be followed by whitespace, e.g. "a1 2 0".
                String bound = line.substring(1).strip();
                String[] tokens = bound.isEmpty() ? new String[0] : WHITESPACE.split(bound);
                quantifiers.add(Quantifier.fromSymbol(symbol));
                blockVariables.add(parseBlock(line, tokens, variables));
                continue;
            }

            String[] tokens = WHITESPACE.split(line);
            int[] literals = parseClause(line, tokens, variables);
            List<Integer> key = Arrays.stream(literals).boxed().collect(Collectors.toList());
            if (!clauseLines.add(key)) {
                throw new InvalidFormatException("Duplicate clause " + line);
            }
            clauses.add(Clause.of(literals));
        }
        if (clauses.size() != declaredClauses) {
            logger.log(Level.WARNING, "Header declares {0} clauses, found {1}",
                    new Object[] {declaredClauses, clauses.size()});
        }

        try {
            return Formula.of(buildPrefix(variables, quantifiers, blockVariables), clauses);
        } catch (FormulaException e) {
            throw new InvalidFormatException(e.getMessage(), e);
        }
    }

    private static int[] parseBlock(String line, String[] tokens, int variables) throws InvalidFormatException {
        if (tokens.length == 0 || !"0".equals(tokens[tokens.length - 1])) {
            throw new InvalidFormatException("Quantifier line must end with 0: " + line);
        }
        if (tokens.length == 1) {
            throw new InvalidFormatException("Empty quantifier block: " + line);
        }
        int[] bound = new int[tokens.length - 1];
        for (int i = 0; i < tokens.length - 1; i++) {
            int variable;
            try {
                variable = Integer.parseInt(tokens[i]);
            } catch (NumberFormatException e) {
                throw new InvalidFormatException("Invalid quantifier line " + line, e);
            }
            if (variable <= 0 || variable > variables) {
                throw new InvalidFormatException("Invalid variable " + tokens[i] + " in quantifier line " + line);
            }
            bound[i] = variable;
        }
        return bound;
    }

    private static int[] parseClause(String line, String[] tokens, int variables) throws InvalidFormatException {
        if (!"0".equals(tokens[tokens.length - 1])) {
            throw new InvalidFormatException("Clause must end with 0: " + line);
        }
        int length = tokens.length - 1;
        if (length == 0) {
            throw new InvalidFormatException("Empty clause");
        }
        int[] literals = new int[length];
        for (int j = 0; j < length; j++) {
            int literal;
            try {
                literal = Integer.parseInt(tokens[j]);
            } catch (NumberFormatException e) {
                throw new InvalidFormatException("Invalid clause " + line, e);
            }
            if (literal == 0 || literal < -variables || literal > variables) {
                throw new InvalidFormatException("Invalid clause " + line);
            }
            literals[j] = literal;
        }
        return literals;
    }

    private static QuantifierPrefix buildPrefix(int variables, List<Quantifier> quantifiers,
            List<int[]> blockVariables) {
        BitSet free = new BitSet(variables + 1);
        free.set(1, variables + 1);
        for (int[] bound : blockVariables) {
            for (int variable : bound) {
                free.clear(variable);
            }
        }

        QuantifierPrefix.Builder builder = QuantifierPrefix.builder();
        if (!free.isEmpty()) {
            builder.exists(free.stream().toArray());
        }
        for (int i = 0; i < quantifiers.size(); i++) {
            builder.block(quantifiers.get(i), blockVariables.get(i));
        }
        return builder.build();
    }

    public static class InvalidFormatException extends Exception {
        private static final long serialVersionUID = 1L;

        public InvalidFormatException(String message) {
            super(message);
        }

        public InvalidFormatException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
