package io.cleaninterfaces.app;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import io.cleaninterfaces.observability.ConfigurationException;
import io.cleaninterfaces.observability.Observability;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ApplicationTest {

    @TempDir
    Path tempDir;

    @AfterEach
    void tearDown() {
        Observability.shutdown();
    }

    private Config config(Path logFile, String interfaceType) {
        return ConfigFactory.parseString("""
                        clean_interfaces {
                          interface_type = "%s"
                          observability {
                            log_file_path = "%s"
                            dispatch = sync
                          }
                        }
                        """.formatted(interfaceType, logFile.toString().replace("\\", "/")))
                .withFallback(ConfigFactory.load())
                .resolve();
    }

    @Test
    void run_welcomeWritesOutputAndLogs() throws Exception {
        Path logFile = tempDir.resolve("logs").resolve("app.log");
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        int exit = new Application(config(logFile, "cli"), new PrintStream(out, true, StandardCharsets.UTF_8))
                .run(List.of());

        assertEquals(0, exit);
        assertTrue(out.toString(StandardCharsets.UTF_8).contains("Welcome to Clean Interfaces!"));
        String log = Files.readString(logFile);
        assertTrue(log.contains("\"message\":\"application_initialized\""));
        assertTrue(log.contains("\"message\":\"performance\""));
        assertTrue(log.contains("\"message\":\"application_shutting_down\""));
        assertTrue(Observability.current().isEmpty());
    }

    @Test
    void run_unknownInterfaceTypeFailsAndShutsDown() {
        Path logFile = tempDir.resolve("bad.log");
        Application app = new Application(config(logFile, "grpc"), new PrintStream(new ByteArrayOutputStream()));

        assertThrows(ConfigurationException.class, () -> app.run(List.of()));
        assertTrue(Observability.current().isEmpty());
    }

    @Test
    void constructor_rejectsInvalidObservabilitySettings() {
        Config config = ConfigFactory.parseString("clean_interfaces.observability.export_mode = carrier_pigeon")
                .withFallback(ConfigFactory.load())
                .resolve();

        assertThrows(ConfigurationException.class, () -> new Application(config, System.out));
    }
}
