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
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.startsWith;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class MainTest {
    @TempDir
    Path directory;

    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;

    @BeforeEach
    public void setUp() {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
    }

    private int run(String... args) {
        return Main.run(args, new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String write(String content) throws IOException {
        Path file = directory.resolve("input.qdimacs");
        Files.writeString(file, content);
        return file.toString();
    }

    private String output() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String errors() {
        return err.toString(StandardCharsets.UTF_8);
    }

    @Test
    public void testSatisfiable() throws IOException {
        assertThat(run(write("p cnf 1 1\n1 0\n")), is(0));
        assertThat(output().strip(), is("SAT"));
    }

    @Test
    public void testUnsatisfiable() throws IOException {
        assertThat(run(write("p cnf 2 4\na 1 0\ne 2 0\n1 2 0\n-1 -2 0\n1 -2 0\n-1 2 0\n")), is(0));
        assertThat(output().strip(), is("UNSAT"));
    }

    @Test
    public void testWitness() throws IOException {
        assertThat(run("--witness", write("p cnf 3 2\ne 1 2 0\na 3 0\n1 3 0\n-2 0\n")), is(0));
        assertThat(output().strip(), is("SAT\nv 1 -2 0"));
    }

    @Test
    public void testEmptyWitness() throws IOException {
        assertThat(run("-w", write("p cnf 2 2\na 1 0\ne 2 0\n1 2 0\n-1 2 0\n")), is(0));
        assertThat(output().strip(), is("SAT\nv 0"));
    }

    @Test
    public void testParallelWithStatistics() throws IOException {
        assertThat(run("-p", "-s", write("p cnf 2 2\n1 2 0\n-1 2 0\n")), is(0));
        assertThat(output(), startsWith("SAT"));
        assertThat(output(), containsString("c Decisions:"));
    }

    @Test
    public void testMissingFile() {
        String missing = directory.resolve("missing.qdimacs").toString();
        assertThat(run(missing), is(1));
        assertThat(errors(), containsString("File " + missing + " not found."));
    }

    @Test
    public void testInvalidInput() throws IOException {
        assertThat(run(write("p cnf 1 1\n2 0\n")), is(1));
        assertThat(errors(), startsWith("Invalid puzzle: "));
    }

    @Test
    public void testTooManyVariables() throws IOException {
        assertThat(run(write("p cnf 2147483647 0\n")), is(1));
        assertThat(errors(), startsWith("Invalid puzzle: "));
    }

    @Test
    public void testUsage() {
        assertThat(run(), is(1));
        assertThat(errors(), containsString("usage: jqbf"));
        assertThat(run("--unknown", "file"), is(1));
    }

    @Test
    public void testHelp() {
        assertThat(run("-h"), is(0));
        assertThat(output(), containsString("--witness"));
    }
}
