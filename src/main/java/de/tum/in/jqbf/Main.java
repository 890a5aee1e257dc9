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
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.StringJoiner;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

/**
 * Command line front end: decides the QDIMACS file given as argument and prints {@code SAT} or
 * {@code UNSAT}.
 */
public final class Main {
    private static final String USAGE = "jqbf [options] FILE";

    private static final Option witness = Option.builder("w")
            .longOpt("witness")
            .desc("Print an assignment of the outermost existential variables for true formulas")
            .build();

    private static final Option parallel = Option.builder("p")
            .longOpt("parallel")
            .desc("Evaluate branches concurrently")
            .build();

    private static final Option statistics = Option.builder("s")
            .longOpt("statistics")
            .desc("Print solver statistics as comment line")
            .build();

    private static final Option help = Option.builder("h")
            .longOpt("help")
            .desc("Print this help message")
            .build();

    private static final Options options = new Options()
            .addOption(witness)
            .addOption(parallel)
            .addOption(statistics)
            .addOption(help);

    private Main() {}

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        CommandLine commandLine;
        try {
            commandLine = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            err.println(e.getMessage());
            printHelp(err);
            return 1;
        }
        if (commandLine.hasOption(help.getOpt())) {
            printHelp(out);
            return 0;
        }
        List<String> files = commandLine.getArgList();
        if (files.size() != 1) {
            err.println("Expected exactly one input file");
            printHelp(err);
            return 1;
        }

        Path path = Paths.get(files.get(0));
        Formula formula;
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            formula = QdimacsReader.read(reader);
        } catch (NoSuchFileException e) {
            err.printf("File %s not found.%n", path);
            return 1;
        } catch (IOException e) {
            err.printf("Failed to read %s: %s%n", path, e.getMessage());
            return 1;
        } catch (QdimacsReader.InvalidFormatException e) {
            err.printf("Invalid puzzle: %s%n", e.getMessage());
            return 1;
        }

        SolverConfiguration configuration = ImmutableSolverConfiguration.builder()
                .parallel(commandLine.hasOption(parallel.getOpt()))
                .build();
        try (QbfSolver solver = SolverFactory.buildSolver(configuration)) {
            Result result = solver.solve(formula);
            out.println(result.verdict());
            if (result.isSatisfiable() && commandLine.hasOption(witness.getOpt())) {
                StringJoiner line = new StringJoiner(" ");
                line.add("v");
                for (int literal : result.witnessLiterals()) {
                    line.add(Integer.toString(literal));
                }
                line.add("0");
                out.println(line);
            }
            if (commandLine.hasOption(statistics.getOpt())) {
                out.println("c " + solver.statistics());
            }
        }
        return 0;
    }

    private static void printHelp(PrintStream stream) {
        PrintWriter writer = new PrintWriter(stream);
        new HelpFormatter().printHelp(writer, HelpFormatter.DEFAULT_WIDTH, USAGE, null, options,
                HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD, null);
        writer.flush();
    }
}
