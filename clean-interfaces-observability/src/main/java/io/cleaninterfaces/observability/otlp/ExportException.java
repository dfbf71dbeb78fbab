package io.cleaninterfaces.observability.otlp;

/**
 * A batch could not be exported. The caller decides whether to retry.
 */
public class ExportException extends Exception {

    public ExportException(String message) {
        super(message);
    }

    public ExportException(String message, Throwable cause) {
        super(message, cause);
    }
}
