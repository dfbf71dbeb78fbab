package io.cleaninterfaces.observability.otlp;

import io.cleaninterfaces.observability.LogRecord;

import java.io.Closeable;
import java.util.List;

/**
 * Sends a batch of records to a remote collector in one request.
 */
public interface LogRecordExporter extends Closeable {

    void export(List<LogRecord> batch) throws ExportException;

    @Override
    void close();
}
