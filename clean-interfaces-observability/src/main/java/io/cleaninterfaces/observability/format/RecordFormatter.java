package io.cleaninterfaces.observability.format;

import io.cleaninterfaces.observability.LogRecord;

/**
 * Renders a record as a single line of text, without the trailing newline.
 * Implementations are stateless and depend only on the record.
 */
@FunctionalInterface
public interface RecordFormatter {

    String format(LogRecord record);
}
