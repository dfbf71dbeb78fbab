package io.cleaninterfaces.observability;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import io.cleaninterfaces.observability.format.LogFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds {@link ExportConfig} instances from Typesafe Config. Defaults and environment
 * overrides live in the module's {@code reference.conf}:
 *
 * <pre>{@code
 * clean_interfaces.observability {
 *   log_level = "INFO"
 *   log_level = ${?LOG_LEVEL}
 *   log_format = "json"
 *   log_format = ${?LOG_FORMAT}
 *   log_file_path = ""
 *   log_file_path = ${?LOG_FILE_PATH}
 *   export_mode = "file"
 *   export_mode = ${?OTEL_LOGS_EXPORT_MODE}
 *   endpoint = "http://localhost:4318"
 *   endpoint = ${?OTEL_ENDPOINT}
 *   service_name = "clean-interfaces"
 *   service_name = ${?OTEL_SERVICE_NAME}
 *   export_timeout_ms = 5000
 *   export_timeout_ms = ${?OTEL_EXPORT_TIMEOUT}
 *   ...
 * }
 * }</pre>
 */
public final class ExportConfigFactory {

    private static final Logger logger = LoggerFactory.getLogger(ExportConfigFactory.class);

    private ExportConfigFactory() {
    }

    /**
     * Load the {@value ConfigConstants#CONFIG_PATH} block from the default configuration
     * (application.conf, system properties, environment overrides, reference.conf).
     */
    public static ExportConfig load() {
        return fromConfig(ConfigFactory.load().getConfig(ConfigConstants.CONFIG_PATH));
    }

    /**
     * Map an already resolved observability block to an {@link ExportConfig}.
     *
     * @throws ConfigurationException if a key is missing, has the wrong type or the
     *                                resulting combination is invalid
     */
    public static ExportConfig fromConfig(Config config) {
        try {
            String rawPath = config.getString(ConfigConstants.LOG_FILE_PATH_KEY);
            return ExportConfig.builder()
                    .level(Level.parse(config.getString(ConfigConstants.LOG_LEVEL_KEY)))
                    .mode(ExportMode.from(config.getString(ConfigConstants.EXPORT_MODE_KEY)))
                    .dispatch(DispatchMode.from(config.getString(ConfigConstants.DISPATCH_KEY)))
                    .laneCapacity(config.getInt(ConfigConstants.LANE_CAPACITY_KEY))
                    .format(LogFormat.from(config.getString(ConfigConstants.LOG_FORMAT_KEY)))
                    .filePath(toPath(rawPath))
                    .endpoint(config.getString(ConfigConstants.ENDPOINT_KEY))
                    .serviceName(config.getString(ConfigConstants.SERVICE_NAME_KEY))
                    .resourceAttributes(parseResourceAttributes(config.getString(ConfigConstants.RESOURCE_ATTRIBUTES_KEY)))
                    .timeout(Duration.ofMillis(config.getLong(ConfigConstants.EXPORT_TIMEOUT_MS_KEY)))
                    .batchSize(config.getInt(ConfigConstants.BATCH_SIZE_KEY))
                    .maxQueueSize(config.getInt(ConfigConstants.MAX_QUEUE_SIZE_KEY))
                    .maxRetries(config.getInt(ConfigConstants.MAX_RETRIES_KEY))
                    .flushInterval(Duration.ofMillis(config.getLong(ConfigConstants.FLUSH_INTERVAL_MS_KEY)))
                    .profilerEnabled(config.getBoolean(ConfigConstants.PROFILER_ENABLED_KEY))
                    .profilerCollectMemory(config.getBoolean(ConfigConstants.PROFILER_COLLECT_MEMORY_KEY))
                    .build();
        } catch (ConfigException e) {
            throw new ConfigurationException("Invalid observability configuration: " + e.getMessage(), e);
        }
    }

    private static Path toPath(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Path.of(raw.trim());
        } catch (InvalidPathException e) {
            throw new ConfigurationException("Invalid log file path: " + raw, e);
        }
    }

    /**
     * Parse {@code key=value} pairs separated by commas, the format of
     * {@code OTEL_RESOURCE_ATTRIBUTES}. Malformed entries are skipped with a warning.
     */
    static Map<String, String> parseResourceAttributes(String raw) {
        if (raw == null || raw.isBlank()) {
            return Map.of();
        }
        Map<String, String> attributes = new LinkedHashMap<>();
        for (String token : raw.split(",")) {
            String trimmed = token.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            int idx = trimmed.indexOf('=');
            if (idx <= 0 || idx == trimmed.length() - 1) {
                logger.warn("Ignoring malformed resource attribute entry: {}", trimmed);
                continue;
            }
            String key = trimmed.substring(0, idx).trim();
            String value = trimmed.substring(idx + 1).trim();
            if (key.isEmpty() || value.isEmpty()) {
                logger.warn("Ignoring resource attribute entry with blank key/value: {}", trimmed);
                continue;
            }
            attributes.put(key, value);
        }
        return attributes;
    }
}
