package io.cleaninterfaces.logback;

import io.cleaninterfaces.observability.DispatchMode;
import io.cleaninterfaces.observability.ExportConfig;
import io.cleaninterfaces.observability.LogRecord;
import io.cleaninterfaces.observability.Pipeline;
import io.cleaninterfaces.observability.format.JsonRecordFormatter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Logs through plain SLF4J and checks the records land in the pipeline's file sink.
 */
class PipelineAppenderIntegrationTest {

    private static final Logger logger = LoggerFactory.getLogger("com.example.checkout.CheckoutService");

    @TempDir
    Path tempDir;

    private Pipeline pipeline;

    @AfterEach
    void tearDown() {
        ch.qos.logback.classic.LoggerContext context = (ch.qos.logback.classic.LoggerContext) LoggerFactory.getILoggerFactory();
        context.getLogger(Logger.ROOT_LOGGER_NAME).detachAppender(PipelineAppender.APPENDER_NAME);
        PipelineAppender.reset();
        if (pipeline != null) {
            pipeline.close();
        }
    }

    @Test
    void slf4jEvents_reachTheFileSink() throws Exception {
        Path file = tempDir.resolve("bridge.log");
        pipeline = Pipeline.create(ExportConfig.builder()
                .filePath(file)
                .dispatch(DispatchMode.SYNC)
                .build());
        PipelineAppender first = PipelineAppender.attachToRoot(pipeline);
        PipelineAppender second = PipelineAppender.attachToRoot(pipeline);
        assertSame(first, second);

        MDC.put("order_id", "o-7");
        try {
            logger.info("Checkout completed in {} ms", 12);
        } finally {
            MDC.remove("order_id");
        }
        LoggerFactory.getLogger("io.cleaninterfaces.observability.Internal").warn("must not loop");
        pipeline.flush();

        List<String> lines = Files.readAllLines(file);
        assertEquals(1, lines.size());
        LogRecord record = JsonRecordFormatter.parse(lines.get(0));
        assertEquals("Checkout completed in 12 ms", record.message());
        assertEquals("com.example.checkout.CheckoutService", record.component());
        assertEquals("o-7", record.fields().get("order_id"));
    }
}
