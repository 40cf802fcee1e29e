package com.mainframe.anonymizer.cli;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import picocli.CommandLine;

import static org.assertj.core.api.Assertions.*;

/**
 * Exit codes of the anonymize command.
 */
class AnonymizeCommandTest {

    @TempDir
    Path tempDir;

    @Test
    void testSuccessfulRun() throws IOException {
        Path in = writeProgram();
        Path out = tempDir.resolve("out");

        int exitCode = execute("-i", in.toString(), "-o", out.toString(), "-s", "numeric");

        assertThat(exitCode).isEqualTo(AnonymizeCommand.EXIT_OK);
        assertThat(out.resolve("PG001.cbl")).exists();
    }

    @Test
    void testMissingRequiredOptionIsUsageError() {
        assertThat(execute("-o", tempDir.toString())).isEqualTo(AnonymizeCommand.EXIT_USAGE);
    }

    @Test
    void testInvalidOptionsAreUsageError() {
        assertThat(execute("-i", tempDir.resolve("missing").toString(), "--dry-run"))
                .isEqualTo(AnonymizeCommand.EXIT_USAGE);
    }

    @Test
    void testFailedRunExitsWithOne() throws IOException {
        Path in = Files.createDirectories(tempDir.resolve("in"));
        Files.writeString(in.resolve("A.cpy"), "       COPY B.\n");
        Files.writeString(in.resolve("B.cpy"), "       COPY A.\n");

        assertThat(execute("-i", in.toString(), "--dry-run")).isEqualTo(AnonymizeCommand.EXIT_FAILURE);
    }

    @Test
    void testValidateOnlyNeedsNoOutput() throws IOException {
        Path in = writeProgram();

        assertThat(execute("-i", in.toString(), "--validate-only")).isEqualTo(AnonymizeCommand.EXIT_OK);
        assertThat(tempDir.resolve("out")).doesNotExist();
    }

    @Test
    void testValidateOnlyFailsOnTooLongLine() throws IOException {
        Path in = writeProgram();
        Files.writeString(in.resolve("WIDE.cpy"), String.format("%-72s%s\n", "       01  WIDE-REC PIC X.",
                "SEQ00001EXTRA"));

        assertThat(execute("-i", in.toString(), "--validate-only")).isEqualTo(AnonymizeCommand.EXIT_FAILURE);
    }

    @Test
    void testAnonymizeLiterals() throws IOException {
        Path in = writeProgram();
        Files.writeString(in.resolve("HELLO.cbl"), Files.readString(in.resolve("HELLO.cbl"))
                .replace("DISPLAY WS-GREETING.", "DISPLAY 'WELCOME BACK'."));
        Path out = tempDir.resolve("out");

        int exitCode = execute("-i", in.toString(), "-o", out.toString(), "-s", "numeric", "--anonymize-literals");

        assertThat(exitCode).isEqualTo(AnonymizeCommand.EXIT_OK);
        assertThat(Files.readString(out.resolve("PG001.cbl")))
                .doesNotContain("WELCOME BACK")
                .containsPattern("DISPLAY '[A-Z -]{12}'\\.")
                // names the program, so it stays
                .contains("VALUE 'HELLO'.");
    }

    private Path writeProgram() throws IOException {
        Path in = Files.createDirectories(tempDir.resolve("in"));
        Files.writeString(in.resolve("HELLO.cbl"), """
                       IDENTIFICATION DIVISION.
                       PROGRAM-ID. HELLO.
                       DATA DIVISION.
                       WORKING-STORAGE SECTION.
                       01 WS-GREETING PIC X(5) VALUE 'HELLO'.
                       PROCEDURE DIVISION.
                           DISPLAY WS-GREETING.
                           STOP RUN.
                """);
        return in;
    }

    private static int execute(String... args) {
        return new CommandLine(new AnonymizeCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
    }
}
