package io.cleaninterfaces.observability;

public final class ConfigConstants {

    public static final String CONFIG_PATH = "clean_interfaces.observability";

    // Routing
    public static final String LOG_LEVEL_KEY = "log_level";
    public static final String EXPORT_MODE_KEY = "export_mode";
    public static final String DISPATCH_KEY = "dispatch";
    public static final String LANE_CAPACITY_KEY = "lane_capacity";

    // File sink
    public static final String LOG_FORMAT_KEY = "log_format";
    public static final String LOG_FILE_PATH_KEY = "log_file_path";

    // OTLP sink
    public static final String ENDPOINT_KEY = "endpoint";
    public static final String SERVICE_NAME_KEY = "service_name";
    public static final String RESOURCE_ATTRIBUTES_KEY = "resource_attributes";
    public static final String EXPORT_TIMEOUT_MS_KEY = "export_timeout_ms";
    public static final String BATCH_SIZE_KEY = "batch_size";
    public static final String MAX_QUEUE_SIZE_KEY = "max_queue_size";
    public static final String MAX_RETRIES_KEY = "max_retries";
    public static final String FLUSH_INTERVAL_MS_KEY = "flush_interval_ms";

    // Profiler
    public static final String PROFILER_ENABLED_KEY = "profiler.enabled";
    public static final String PROFILER_COLLECT_MEMORY_KEY = "profiler.collect_memory";

    private ConfigConstants() {
    }
}
