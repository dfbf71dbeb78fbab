package io.cleaninterfaces.app;

import java.util.List;

/**
 * A user facing entry point of the application.
 */
public interface FrontEnd {

    String name();

    /**
     * @param commands command words left after option parsing
     * @return process exit code
     */
    int run(List<String> commands);
}
