package io.cleaninterfaces.app;

import com.typesafe.config.Config;
import io.cleaninterfaces.logback.PipelineAppender;
import io.cleaninterfaces.observability.ConfigConstants;
import io.cleaninterfaces.observability.ConfigurationException;
import io.cleaninterfaces.observability.ExportConfig;
import io.cleaninterfaces.observability.ExportConfigFactory;
import io.cleaninterfaces.observability.LoggerHandle;
import io.cleaninterfaces.observability.Observability;
import io.cleaninterfaces.observability.Pipeline;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Wires configuration, the observability pipeline and the selected front-end together.
 */
public final class Application {

    public static final String INTERFACE_TYPE_KEY = "clean_interfaces.interface_type";

    private final ExportConfig exportConfig;
    private final String interfaceType;
    private final PrintStream out;

    public Application(Config config, PrintStream out) {
        this.exportConfig = ExportConfigFactory.fromConfig(config.getConfig(ConfigConstants.CONFIG_PATH));
        this.interfaceType = config.getString(INTERFACE_TYPE_KEY);
        this.out = out;
    }

    public ExportConfig exportConfig() {
        return exportConfig;
    }

    public int run(List<String> commands) {
        createLogDirectory(exportConfig.filePath());
        Pipeline pipeline = Observability.init(exportConfig);
        PipelineAppender.attachToRoot(pipeline);
        LoggerHandle log = pipeline.getLogger("app");
        try {
            FrontEnd frontEnd = new FrontEndFactory(pipeline, out).create(interfaceType);
            log.info("application_initialized", Map.of("interface", frontEnd.name(),
                    "export_mode", exportConfig.mode().name().toLowerCase(Locale.ROOT)));
            return frontEnd.run(commands);
        } catch (RuntimeException e) {
            log.exception("application_error", e);
            throw e;
        } finally {
            log.info("application_shutting_down");
            PipelineAppender.uninstall();
            Observability.shutdown();
        }
    }

    private static void createLogDirectory(Path file) {
        if (file == null || file.toAbsolutePath().getParent() == null) {
            return;
        }
        Path dir = file.toAbsolutePath().getParent();
        if (!Files.exists(dir)) {
            try {
                Files.createDirectories(dir);
            } catch (IOException e) {
                throw new ConfigurationException("Cannot create log directory " + dir, e);
            }
        }
    }
}
