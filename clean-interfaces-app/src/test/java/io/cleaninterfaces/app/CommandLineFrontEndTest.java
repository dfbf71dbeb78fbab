package io.cleaninterfaces.app;

import io.cleaninterfaces.observability.DispatchMode;
import io.cleaninterfaces.observability.ExportConfig;
import io.cleaninterfaces.observability.Level;
import io.cleaninterfaces.observability.LogRecord;
import io.cleaninterfaces.observability.Pipeline;
import io.cleaninterfaces.observability.format.JsonRecordFormatter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CommandLineFrontEndTest {

    @TempDir
    Path tempDir;

    private Path logFile;
    private Pipeline pipeline;
    private ByteArrayOutputStream output;
    private FrontEnd cli;

    @BeforeEach
    void setUp() {
        logFile = tempDir.resolve("cli.log");
        pipeline = Pipeline.create(ExportConfig.builder()
                .filePath(logFile)
                .dispatch(DispatchMode.SYNC)
                .build());
        output = new ByteArrayOutputStream();
        cli = new FrontEndFactory(pipeline, new PrintStream(output, true, StandardCharsets.UTF_8)).create("cli");
    }

    @AfterEach
    void tearDown() {
        pipeline.close();
    }

    private String output() {
        return output.toString(StandardCharsets.UTF_8);
    }

    private List<LogRecord> records() throws Exception {
        return Files.readAllLines(logFile).stream().map(JsonRecordFormatter::parse).toList();
    }

    @Test
    void noCommand_printsWelcome() throws Exception {
        int exit = cli.run(List.of());

        assertEquals(0, exit);
        assertTrue(output().contains("Welcome to Clean Interfaces!"));
        assertTrue(output().contains("Type --help for more information"));

        LogRecord performance = records().get(0);
        assertEquals("performance", performance.message());
        assertEquals("cli.welcome", performance.fields().get("operation"));
        assertEquals("success", performance.fields().get("outcome"));
        assertEquals("cli", performance.component());
    }

    @Test
    void help_listsCommands() {
        int exit = cli.run(List.of("help"));

        assertEquals(0, exit);
        String text = output();
        assertTrue(text.contains("Available Commands:"));
        assertTrue(text.contains("welcome - Display welcome message"));
        assertTrue(text.contains("help - Show available commands and their usage"));
    }

    @Test
    void helpForCommand_showsDescription() {
        assertEquals(0, cli.run(List.of("help", "welcome")));
        assertTrue(output().contains("Command: welcome"));
    }

    @Test
    void helpForUnknownCommand_isUsageError() {
        assertEquals(2, cli.run(List.of("help", "dance")));
    }

    @Test
    void unknownCommand_isUsageErrorAndLogged() throws Exception {
        int exit = cli.run(List.of("dance"));

        assertEquals(2, exit);
        assertTrue(output().contains("Unknown command: dance"));
        LogRecord warning = records().get(0);
        assertEquals(Level.WARNING, warning.level());
        assertEquals("unknown_command", warning.message());
        assertEquals("dance", warning.fields().get("command"));
    }

    @Test
    void name_isCli() {
        assertEquals("CLI", cli.name());
    }
}
