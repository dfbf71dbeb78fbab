package io.cleaninterfaces.logback;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.IThrowableProxy;
import ch.qos.logback.core.AppenderBase;
import io.cleaninterfaces.observability.Level;
import io.cleaninterfaces.observability.LogRecord;
import io.cleaninterfaces.observability.LoggerHandle;
import io.cleaninterfaces.observability.Pipeline;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Logback appender that turns SLF4J events into {@link LogRecord}s and hands them to an
 * installed {@link Pipeline}, so third-party libraries logging through SLF4J end up in the
 * same file and OTLP sinks as application records.
 *
 * <p>Usage in logback.xml:</p>
 * <pre>{@code
 * <appender name="PIPELINE" class="io.cleaninterfaces.logback.PipelineAppender"/>
 *
 * <root level="INFO">
 *     <appender-ref ref="PIPELINE"/>
 * </root>
 * }</pre>
 *
 * The pipeline itself is installed from code with {@link #install(Pipeline)} once it is built.
 */
public class PipelineAppender extends AppenderBase<ILoggingEvent> {

    public static final String APPENDER_NAME = "PIPELINE";

    public static final String LOGGER_FIELD = "logger";
    public static final String THREAD_FIELD = "thread";

    // Our own diagnostics must never travel through the pipeline they describe
    private static final String[] EXCLUDED_PACKAGES = {
            "io.cleaninterfaces.observability",
            "io.cleaninterfaces.logback"
    };

    private static final AtomicLong droppedCounter = new AtomicLong(0);

    private static volatile Pipeline pipeline;

    public static void install(Pipeline target) {
        pipeline = target;
    }

    public static void uninstall() {
        pipeline = null;
    }

    public static Pipeline installed() {
        return pipeline;
    }

    /**
     * Install the pipeline and attach a started appender to the root logger of the current
     * logback context.
     */
    public static PipelineAppender attachToRoot(Pipeline target) {
        install(target);
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        ch.qos.logback.classic.Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        if (root.getAppender(APPENDER_NAME) instanceof PipelineAppender existing) {
            return existing;
        }
        PipelineAppender appender = new PipelineAppender();
        appender.setContext(context);
        appender.setName(APPENDER_NAME);
        appender.start();
        root.addAppender(appender);
        return appender;
    }

    @Override
    protected void append(ILoggingEvent event) {
        String loggerName = event.getLoggerName();
        if (loggerName != null && shouldExclude(loggerName)) {
            return;
        }

        Pipeline target = pipeline;
        if (target == null || target.isClosed()) {
            // Only warn once every 1000 events to avoid spamming the status manager
            long dropped = droppedCounter.incrementAndGet();
            if (dropped == 1 || dropped % 1000 == 0) {
                addWarn("No observability pipeline installed, dropped " + dropped + " events so far");
            }
            return;
        }

        Level level = toLevel(event.getLevel());
        if (!target.isEnabled(level)) {
            return;
        }
        try {
            target.submit(toRecord(event, level));
        } catch (RuntimeException e) {
            addError("Failed to forward logging event", e);
        }
    }

    static LogRecord toRecord(ILoggingEvent event, Level level) {
        Map<String, Object> fields = new LinkedHashMap<>();
        Map<String, String> mdc = event.getMDCPropertyMap();
        if (mdc != null) {
            fields.putAll(mdc);
        }
        fields.put(LOGGER_FIELD, event.getLoggerName());
        fields.put(THREAD_FIELD, event.getThreadName());
        IThrowableProxy throwable = event.getThrowableProxy();
        if (throwable != null) {
            fields.put(LoggerHandle.ERROR_TYPE, throwable.getClassName());
            fields.put(LoggerHandle.ERROR_MESSAGE, String.valueOf(throwable.getMessage()));
        }
        String component = event.getLoggerName() == null ? "" : event.getLoggerName();
        return new LogRecord(event.getInstant(), level, event.getFormattedMessage(), fields, component);
    }

    static Level toLevel(ch.qos.logback.classic.Level level) {
        return switch (level.toInt()) {
            case ch.qos.logback.classic.Level.ERROR_INT -> Level.ERROR;
            case ch.qos.logback.classic.Level.WARN_INT -> Level.WARNING;
            case ch.qos.logback.classic.Level.INFO_INT -> Level.INFO;
            default -> Level.DEBUG;
        };
    }

    private static boolean shouldExclude(String loggerName) {
        for (String excluded : EXCLUDED_PACKAGES) {
            if (loggerName.startsWith(excluded)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Reset the appender state. Primarily for testing.
     */
    static void reset() {
        pipeline = null;
        droppedCounter.set(0);
    }
}
