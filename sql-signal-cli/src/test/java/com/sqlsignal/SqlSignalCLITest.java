package com.sqlsignal;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class SqlSignalCLITest {

    private final PrintStream originalOut = System.out;
    private ByteArrayOutputStream outputStream;

    @BeforeEach
    void setUp() {
        outputStream = new ByteArrayOutputStream();
        System.setOut(new PrintStream(outputStream, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void tearDown() {
        System.setOut(originalOut);
    }

    @Test
    void execute_noArguments_printsUsageHint() {
        int exitCode = SqlSignalCLI.commandLine().execute();

        assertThat(exitCode).isZero();
        assertThat(outputStream.toString(StandardCharsets.UTF_8)).contains("sqlsignal --help");
    }

    @Test
    void execute_quiet_printsNothing() {
        int exitCode = SqlSignalCLI.commandLine().execute("--quiet");

        assertThat(exitCode).isZero();
        assertThat(outputStream.toString(StandardCharsets.UTF_8)).isEmpty();
    }

    @Test
    void execute_unknownCommand_usageError() {
        int exitCode = SqlSignalCLI.commandLine().execute("explode");

        assertThat(exitCode).isEqualTo(2);
    }
}
