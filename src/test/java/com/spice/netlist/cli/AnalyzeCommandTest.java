package com.spice.netlist.cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Exit-code tests for AnalyzeCommand.
 */
class AnalyzeCommandTest {

    private static final String NETLIST = """
            * two-stage buffer
            .MODEL nch nmos level=1
            .SUBCKT inv in out
            M1 out in 0 0 nch
            .ENDS
            .SUBCKT buf a y
            X1 a mid inv
            X2 mid y inv
            .ENDS
            """;

    @TempDir
    Path tempDir;

    @Test
    void testAllReportsSucceed() throws IOException {
        Path file = write("buf.sp", NETLIST);

        int exitCode = execute(file.toString(), "--stats", "--flatten", "--count-transistors",
                "--model-usage", "--find-model", "nch", "--tree", "--list-top-cells");

        assertThat(exitCode).isEqualTo(0);
    }

    @Test
    void testDefaultReport() throws IOException {
        Path file = write("buf.sp", NETLIST);

        assertThat(execute(file.toString())).isEqualTo(0);
    }

    @Test
    void testExplicitTopCell() throws IOException {
        Path file = write("buf.sp", NETLIST);

        assertThat(execute(file.toString(), "--top-cell", "inv", "--flatten")).isEqualTo(0);
        assertThat(execute(file.toString(), "--top-cell", "nope", "--flatten")).isEqualTo(1);
    }

    @Test
    void testResolveIncludes() throws IOException {
        write("cells.sp", NETLIST);
        Path main = write("main.sp", ".INCLUDE cells.sp\nXtop in out buf\n");

        assertThat(execute(main.toString(), "--resolve-includes", "--count-transistors")).isEqualTo(0);
    }

    @Test
    void testMissingFileFailsValidation() {
        assertThat(execute(tempDir.resolve("missing.sp").toString(), "--stats")).isEqualTo(1);
    }

    @Test
    void testInvalidMaxDepthFailsValidation() throws IOException {
        Path file = write("buf.sp", NETLIST);

        assertThat(execute(file.toString(), "--max-depth", "0")).isEqualTo(1);
    }

    @Test
    void testRecursiveHierarchyFails() throws IOException {
        Path file = write("loop.sp", """
                .SUBCKT loop a
                R1 a 0 1
                X1 a loop
                .ENDS
                Xtop n loop
                """);

        assertThat(execute(file.toString(), "--flatten")).isEqualTo(1);
    }

    @Test
    void testUnknownOptionIsUsageError() throws IOException {
        Path file = write("buf.sp", NETLIST);

        assertThat(execute(file.toString(), "--no-such-option")).isEqualTo(CommandLine.ExitCode.USAGE);
    }

    private static int execute(String... args) {
        return new CommandLine(new AnalyzeCommand()).execute(args);
    }

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content);
        return file;
    }
}
