package io.cleaninterfaces.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Process-wide access point for front-ends that do not pass a {@link Pipeline} around.
 * {@link #init(ExportConfig)} creates the pipeline once and registers a shutdown hook that
 * closes it; later calls return the existing instance.
 */
public final class Observability {

    private static final Logger logger = LoggerFactory.getLogger(Observability.class);

    private static Pipeline pipeline;
    private static Thread shutdownHook;

    private Observability() {
    }

    public static synchronized Pipeline init(ExportConfig config) {
        if (pipeline != null) {
            if (!pipeline.config().equals(config)) {
                logger.warn("Observability already initialized, ignoring new configuration");
            }
            return pipeline;
        }
        Pipeline created = Pipeline.create(config);
        Thread hook = new Thread(created::close, "observability-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);
        pipeline = created;
        shutdownHook = hook;
        return created;
    }

    /**
     * Initialize from {@link ExportConfigFactory#load()}.
     */
    public static Pipeline init() {
        return init(ExportConfigFactory.load());
    }

    public static synchronized Optional<Pipeline> current() {
        return Optional.ofNullable(pipeline);
    }

    /**
     * @throws IllegalStateException if {@link #init} has not been called
     */
    public static LoggerHandle getLogger(String component) {
        return current()
                .orElseThrow(() -> new IllegalStateException("Observability has not been initialized"))
                .getLogger(component);
    }

    public static synchronized void shutdown() {
        if (pipeline == null) {
            return;
        }
        try {
            pipeline.close();
        } finally {
            try {
                Runtime.getRuntime().removeShutdownHook(shutdownHook);
            } catch (IllegalStateException e) {
                logger.debug("JVM is already shutting down, hook not removed");
            }
            pipeline = null;
            shutdownHook = null;
        }
    }
}
