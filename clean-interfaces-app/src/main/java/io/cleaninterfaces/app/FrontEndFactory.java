package io.cleaninterfaces.app;

import io.cleaninterfaces.observability.ConfigurationException;
import io.cleaninterfaces.observability.Pipeline;

import java.io.PrintStream;
import java.util.Locale;

public final class FrontEndFactory {

    public static final String CLI = "cli";

    private final Pipeline pipeline;
    private final PrintStream out;

    public FrontEndFactory(Pipeline pipeline, PrintStream out) {
        this.pipeline = pipeline;
        this.out = out;
    }

    /**
     * @throws ConfigurationException if the interface type is not supported
     */
    public FrontEnd create(String interfaceType) {
        String type = interfaceType == null ? "" : interfaceType.trim().toLowerCase(Locale.ROOT);
        if (CLI.equals(type)) {
            var log = pipeline.getLogger(CommandLineFrontEnd.COMPONENT);
            return new CommandLineFrontEnd(out, log, pipeline.profiler(log));
        }
        throw new ConfigurationException("Unknown interface type: " + interfaceType);
    }
}
