package io.cleaninterfaces.observability.format;

import io.cleaninterfaces.observability.Level;
import io.cleaninterfaces.observability.LogRecord;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PlainRecordFormatterTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:15:30.123Z");

    @Test
    void format_writesKeyValuePairs() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("port", 8080);
        fields.put("path", "/health");
        LogRecord record = new LogRecord(NOW, Level.INFO, "started", fields, "api");

        assertEquals("timestamp=2024-05-01T10:15:30.123Z level=INFO message=started component=api port=8080 path=/health",
                new PlainRecordFormatter().format(record));
    }

    @Test
    void renderValue_quotesWhenNeeded() {
        assertEquals("simple", PlainRecordFormatter.renderValue("simple"));
        assertEquals("\"two words\"", PlainRecordFormatter.renderValue("two words"));
        assertEquals("\"a=b\"", PlainRecordFormatter.renderValue("a=b"));
        assertEquals("\"say \\\"hi\\\"\"", PlainRecordFormatter.renderValue("say \"hi\""));
        assertEquals("\"line\\nbreak\"", PlainRecordFormatter.renderValue("line\nbreak"));
        assertEquals("\"\"", PlainRecordFormatter.renderValue(""));
        assertEquals("null", PlainRecordFormatter.renderValue(null));
    }

    @Test
    void format_isSingleLine() {
        LogRecord record = new LogRecord(NOW, Level.ERROR, "failed", Map.of("error", "boom\nstack"), "worker");

        assertFalse(new PlainRecordFormatter().format(record).contains("\n"));
    }
}
