package io.cleaninterfaces.observability;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ExportConfigTest {

    @Test
    void builder_appliesDefaults() {
        ExportConfig config = ExportConfig.builder()
                .filePath(Path.of("/tmp/app.log"))
                .build();

        assertEquals(ExportMode.FILE, config.mode());
        assertEquals(Level.INFO, config.level());
        assertEquals(DispatchMode.ASYNC, config.dispatch());
        assertEquals(Duration.ofSeconds(5), config.timeout());
        assertEquals(64, config.batchSize());
        assertEquals(2048, config.maxQueueSize());
        assertEquals(3, config.maxRetries());
        assertEquals("clean-interfaces", config.serviceName());
        assertTrue(config.profilerEnabled());
        assertFalse(config.profilerCollectMemory());
    }

    @Test
    void fileMode_requiresPath() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> ExportConfig.builder().mode(ExportMode.FILE).build());
        assertTrue(e.getMessage().contains("file"));

        assertThrows(ConfigurationException.class,
                () -> ExportConfig.builder().mode(ExportMode.BOTH).build());
    }

    @Test
    void otlpMode_doesNotNeedPathButNeedsEndpoint() {
        ExportConfig config = ExportConfig.builder().mode(ExportMode.OTLP).build();
        assertNull(config.filePath());

        assertThrows(ConfigurationException.class,
                () -> ExportConfig.builder().mode(ExportMode.OTLP).endpoint(" ").build());
    }

    @Test
    void timeout_mustBePositive() {
        assertThrows(ConfigurationException.class,
                () -> ExportConfig.builder().mode(ExportMode.OTLP).timeout(Duration.ZERO).build());
        assertThrows(ConfigurationException.class,
                () -> ExportConfig.builder().mode(ExportMode.OTLP).timeout(Duration.ofMillis(-1)).build());
    }

    @Test
    void batchLimits_areValidated() {
        assertThrows(ConfigurationException.class,
                () -> ExportConfig.builder().mode(ExportMode.OTLP).batchSize(0).build());
        assertThrows(ConfigurationException.class,
                () -> ExportConfig.builder().mode(ExportMode.OTLP).batchSize(10).maxQueueSize(5).build());
        assertThrows(ConfigurationException.class,
                () -> ExportConfig.builder().mode(ExportMode.OTLP).maxRetries(-1).build());
        assertThrows(ConfigurationException.class,
                () -> ExportConfig.builder().mode(ExportMode.OTLP).laneCapacity(0).build());
    }

    @Test
    void modes_parseFromStrings() {
        assertEquals(ExportMode.BOTH, ExportMode.from("Both"));
        assertEquals(DispatchMode.SYNC, DispatchMode.from("sync"));
        assertEquals(DispatchMode.ASYNC, DispatchMode.from(""));
        assertThrows(ConfigurationException.class, () -> ExportMode.from("kafka"));
        assertThrows(ConfigurationException.class, () -> DispatchMode.from("later"));
    }
}
