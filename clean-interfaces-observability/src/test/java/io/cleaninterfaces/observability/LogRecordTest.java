package io.cleaninterfaces.observability;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LogRecordTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:15:30.123Z");

    @Test
    void reservedKeyCollision_keepsCanonicalValueAndRecordsDroppedKey() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("timestamp", "yesterday");
        fields.put("user", "alice");

        LogRecord record = new LogRecord(NOW, Level.INFO, "login", fields, "auth");

        assertEquals(NOW, record.timestamp());
        assertFalse(record.fields().containsKey("timestamp"));
        assertEquals("alice", record.fields().get("user"));
        assertEquals(List.of("timestamp"), record.fields().get(LogRecord.RESERVED_KEY_COLLISION));
    }

    @Test
    void reservedKeyCollision_listsAllDroppedKeysSorted() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("message", "x");
        fields.put("level", "y");
        fields.put("component", "z");

        LogRecord record = new LogRecord(NOW, Level.INFO, "event", fields, "c");

        assertEquals(List.of("component", "level", "message"), record.fields().get(LogRecord.RESERVED_KEY_COLLISION));
        assertEquals(1, record.fields().size());
    }

    @Test
    void fields_areCopiedAndUnmodifiable() {
        Map<String, Object> fields = new HashMap<>();
        fields.put("a", 1);
        LogRecord record = new LogRecord(NOW, Level.INFO, "event", fields, "c");

        fields.put("b", 2);

        assertEquals(Map.of("a", 1), record.fields());
        assertThrows(UnsupportedOperationException.class, () -> record.fields().put("c", 3));
    }

    @Test
    void nullFieldValues_areKept() {
        Map<String, Object> fields = new HashMap<>();
        fields.put("optional", null);

        LogRecord record = new LogRecord(NOW, Level.INFO, "event", fields, "c");

        assertTrue(record.fields().containsKey("optional"));
        assertNull(record.fields().get("optional"));
    }

    @Test
    void requiredValues_mustNotBeNull() {
        assertThrows(NullPointerException.class, () -> new LogRecord(null, Level.INFO, "m", Map.of(), "c"));
        assertThrows(NullPointerException.class, () -> new LogRecord(NOW, null, "m", Map.of(), "c"));
        assertThrows(NullPointerException.class, () -> new LogRecord(NOW, Level.INFO, null, Map.of(), "c"));
        assertThrows(NullPointerException.class, () -> new LogRecord(NOW, Level.INFO, "m", Map.of(), null));
    }

    @Test
    void traceIds_areOptional() {
        LogRecord plain = new LogRecord(NOW, Level.INFO, "m", null, "c");
        LogRecord traced = new LogRecord(NOW, Level.INFO, "m", Map.of(), "c", "4bf92f3577b34da6a3ce929d0e0e4736", "00f067aa0ba902b7");

        assertFalse(plain.hasTrace());
        assertTrue(plain.fields().isEmpty());
        assertTrue(traced.hasTrace());
    }
}
