package io.cleaninterfaces.observability.otlp;

import io.cleaninterfaces.observability.ConfigurationException;
import io.cleaninterfaces.observability.Level;
import io.cleaninterfaces.observability.LogRecord;
import io.cleaninterfaces.observability.testutil.MockCollector;
import io.opentelemetry.proto.collector.logs.v1.ExportLogsServiceRequest;
import io.opentelemetry.proto.common.v1.KeyValue;
import io.opentelemetry.proto.logs.v1.ResourceLogs;
import io.opentelemetry.proto.logs.v1.SeverityNumber;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class OtlpHttpExporterTest {

    private MockCollector collector;
    private OtlpHttpExporter exporter;

    @BeforeEach
    void setUp() throws Exception {
        collector = MockCollector.start();
        exporter = new OtlpHttpExporter(collector.endpoint(), "exporter-test",
                Map.of("deployment.environment", "test", "service.name", "impostor"), Duration.ofSeconds(2));
    }

    @AfterEach
    void tearDown() {
        exporter.close();
        collector.close();
    }

    private static LogRecord record(String message) {
        return new LogRecord(Instant.now(), Level.INFO, message, Map.of("n", 1), "test");
    }

    private static String attribute(List<KeyValue> attributes, String key) {
        return attributes.stream()
                .filter(kv -> kv.getKey().equals(key))
                .map(kv -> kv.getValue().getStringValue())
                .findFirst()
                .orElse(null);
    }

    @Test
    void export_postsBatchToLogsPath() throws Exception {
        exporter.export(List.of(record("a"), record("b")));

        assertEquals(1, collector.requestCount());
        List<io.opentelemetry.proto.logs.v1.LogRecord> records = collector.logRecords();
        assertEquals(2, records.size());
        assertEquals("a", records.get(0).getBody().getStringValue());
        assertEquals(SeverityNumber.SEVERITY_NUMBER_INFO, records.get(0).getSeverityNumber());
        assertEquals("test", attribute(records.get(0).getAttributesList(), "component"));
    }

    @Test
    void export_sendsResourceAndScope() throws Exception {
        exporter.export(List.of(record("a")));

        ExportLogsServiceRequest request = collector.payloads().get(0);
        ResourceLogs resourceLogs = request.getResourceLogs(0);
        List<KeyValue> resource = resourceLogs.getResource().getAttributesList();
        assertEquals("exporter-test", attribute(resource, "service.name"));
        assertEquals("test", attribute(resource, "deployment.environment"));
        assertEquals(OtlpLogRecordMapper.SCOPE_NAME, resourceLogs.getScopeLogs(0).getScope().getName());
    }

    @Test
    void export_emptyBatchSendsNothing() throws Exception {
        exporter.export(List.of());

        assertEquals(0, collector.requestCount());
    }

    @Test
    void export_non2xxIsExportException() {
        collector.respondWith(500);

        assertThrows(ExportException.class, () -> exporter.export(List.of(record("a"))));
        // retries belong to the sink, the exporter sends once
        assertEquals(1, collector.requestCount());
    }

    @Test
    void export_timeoutIsExportException() throws Exception {
        collector.hang();
        Duration timeout = Duration.ofMillis(50);
        try (OtlpHttpExporter fast = new OtlpHttpExporter(collector.endpoint(), "t", Map.of(), timeout)) {
            long start = System.nanoTime();
            assertThrows(ExportException.class, () -> fast.export(List.of(record("a"))));
            long elapsedMs = (System.nanoTime() - start) / 1_000_000;
            assertTrue(elapsedMs < timeout.toMillis() * 4 + 250, "export took " + elapsedMs + " ms");
        }
    }

    @Test
    void export_unreachableCollectorIsExportException() throws Exception {
        int port = collector.port();
        collector.close();
        try (OtlpHttpExporter orphan = new OtlpHttpExporter("http://localhost:" + port, "t", Map.of(), Duration.ofMillis(500))) {
            assertThrows(ExportException.class, () -> orphan.export(List.of(record("a"))));
        }
    }

    @Test
    void logsUri_appendsPathOnce() {
        assertEquals("http://collector:4318/v1/logs", OtlpHttpExporter.logsUri("http://collector:4318").toString());
        assertEquals("http://collector:4318/v1/logs", OtlpHttpExporter.logsUri("http://collector:4318/").toString());
        assertEquals("http://collector:4318/v1/logs", OtlpHttpExporter.logsUri("http://collector:4318/v1/logs").toString());
        assertThrows(ConfigurationException.class, () -> OtlpHttpExporter.logsUri("collector"));
        assertThrows(ConfigurationException.class, () -> OtlpHttpExporter.logsUri(""));
    }
}
